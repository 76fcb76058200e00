package com.ureca.gateway.dlq.dto;

import jakarta.validation.constraints.Size;

public record ResolveRequest(
        @Size(max = 500)
        String reason
) {
}
