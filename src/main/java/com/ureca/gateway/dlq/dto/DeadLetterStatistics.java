package com.ureca.gateway.dlq.dto;

public record DeadLetterStatistics(
        long total,
        long pending,
        long failed,
        long retrying,
        long resolved
) {
}
