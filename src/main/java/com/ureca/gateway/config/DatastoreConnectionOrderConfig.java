package com.ureca.gateway.config;

import com.ureca.gateway.bootstrap.DatastoreConnectionWaiter;
import org.springframework.boot.autoconfigure.AbstractDependsOnBeanFactoryPostProcessor;
import org.springframework.boot.autoconfigure.orm.jpa.EntityManagerFactoryDependsOnPostProcessor;
import org.springframework.boot.jdbc.init.DataSourceScriptDatabaseInitializer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 저장소 연결 대기 순서 설정
 * <p>
 * schema.sql 실행(DataSourceScriptDatabaseInitializer)과 EntityManagerFactory 생성이
 * DatastoreConnectionWaiter 이후에 일어나도록 depends-on 추가
 * BeanFactoryPostProcessor 라 static 빈으로 등록
 */
@Configuration(proxyBeanMethods = false)
public class DatastoreConnectionOrderConfig {

    @Bean
    public static EntityManagerFactoryDependsOnPostProcessor entityManagerFactoryAwaitsDatastore() {
        return new EntityManagerFactoryDependsOnPostProcessor(DatastoreConnectionWaiter.BEAN_NAME);
    }

    @Bean
    public static ScriptInitializerAwaitsDatastore scriptInitializerAwaitsDatastore() {
        return new ScriptInitializerAwaitsDatastore();
    }

    static class ScriptInitializerAwaitsDatastore extends AbstractDependsOnBeanFactoryPostProcessor {

        ScriptInitializerAwaitsDatastore() {
            super(DataSourceScriptDatabaseInitializer.class, DatastoreConnectionWaiter.BEAN_NAME);
        }
    }
}
