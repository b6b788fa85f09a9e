package com.shinobi.error.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Body of every non-validation error: {@code {detail, request_id}}.
 */
public record ErrorResponse(
        String detail,
        @JsonInclude(JsonInclude.Include.ALWAYS) String requestId
) {
}
