package com.shinobi.error.dto;

import java.util.List;

public record ValidationErrorResponse(
        boolean success,
        String message,
        List<FieldErrorDetail> errors,
        String path
) {

    public static ValidationErrorResponse of(String message, List<FieldErrorDetail> errors, String path) {
        return new ValidationErrorResponse(false, message, errors, path);
    }

    public record FieldErrorDetail(String field, String message, String type) {
    }
}
