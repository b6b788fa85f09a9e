package com.shinobi.error;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.shinobi.config.RequestIdFilter;
import com.shinobi.error.dto.ErrorResponse;
import com.shinobi.error.dto.ValidationErrorResponse;
import com.shinobi.error.dto.ValidationErrorResponse.FieldErrorDetail;
import com.shinobi.error.exception.BaseException;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Path;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.MessageSourceResolvable;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns every failure into a JSON body. Schema violations become 422 with a per-field list,
 * domain failures keep their own status, anything else is a 500 without internal details.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final PropertyNamingStrategies.SnakeCaseStrategy SNAKE_CASE =
            new PropertyNamingStrategies.SnakeCaseStrategy();

    @ExceptionHandler(BaseException.class)
    public ResponseEntity<ErrorResponse> handleBaseException(BaseException e, HttpServletRequest request) {
        HttpStatus status = e.getErrorCode().getStatus();
        if (status.is5xxServerError()) {
            log.error("{} {} failed: {}", request.getMethod(), request.getRequestURI(), e.getMessage(), e);
        } else {
            log.warn("{} {} rejected: {}", request.getMethod(), request.getRequestURI(), e.getMessage());
        }
        return ResponseEntity.status(status).body(new ErrorResponse(e.getMessage(), requestId(request)));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ValidationErrorResponse> handleBodyValidation(MethodArgumentNotValidException e,
                                                                        HttpServletRequest request) {
        List<FieldErrorDetail> errors = new ArrayList<>();
        for (FieldError fieldError : e.getBindingResult().getFieldErrors()) {
            errors.add(new FieldErrorDetail(
                    SNAKE_CASE.translate(fieldError.getField()),
                    fieldError.getDefaultMessage(),
                    SNAKE_CASE.translate(fieldError.getCode())));
        }
        e.getBindingResult().getGlobalErrors().forEach(error -> errors.add(new FieldErrorDetail(
                error.getObjectName(), error.getDefaultMessage(), SNAKE_CASE.translate(error.getCode()))));
        return validationError(errors, request);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ValidationErrorResponse> handleConstraintViolation(ConstraintViolationException e,
                                                                             HttpServletRequest request) {
        List<FieldErrorDetail> errors = e.getConstraintViolations().stream()
                .map(violation -> new FieldErrorDetail(
                        leafName(violation),
                        violation.getMessage(),
                        SNAKE_CASE.translate(violation.getConstraintDescriptor()
                                .getAnnotation().annotationType().getSimpleName())))
                .toList();
        return validationError(errors, request);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ValidationErrorResponse> handleMethodValidation(HandlerMethodValidationException e,
                                                                          HttpServletRequest request) {
        List<FieldErrorDetail> errors = new ArrayList<>();
        e.getParameterValidationResults().forEach(result -> {
            RequestParam requestParam = result.getMethodParameter().getParameterAnnotation(RequestParam.class);
            String field = requestParam != null && !requestParam.value().isEmpty()
                    ? requestParam.value()
                    : result.getMethodParameter().getParameterName();
            for (MessageSourceResolvable error : result.getResolvableErrors()) {
                errors.add(new FieldErrorDetail(field, error.getDefaultMessage(), constraintType(error)));
            }
        });
        return validationError(errors, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ValidationErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e,
                                                                        HttpServletRequest request) {
        FieldErrorDetail error;
        if (e.getCause() instanceof JsonParseException) {
            error = new FieldErrorDetail("body", "JSON decode error", "json_invalid");
        } else if (e.getCause() instanceof JsonMappingException mappingException
                && !mappingException.getPath().isEmpty()) {
            String field = mappingException.getPath().stream()
                    .map(reference -> reference.getFieldName() != null
                            ? reference.getFieldName()
                            : String.valueOf(reference.getIndex()))
                    .collect(Collectors.joining("."));
            String message = mappingException.getCause() instanceof IllegalArgumentException cause
                    ? cause.getMessage()
                    : "Invalid value";
            error = new FieldErrorDetail(field, message, "value_error");
        } else {
            error = new FieldErrorDetail("body", "Field required", "missing");
        }
        return validationError(List.of(error), request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ValidationErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e,
                                                                      HttpServletRequest request) {
        String expected = e.getRequiredType() == null ? "value" : e.getRequiredType().getSimpleName().toLowerCase();
        return validationError(List.of(new FieldErrorDetail(
                e.getName(), "Input should be a valid " + expected, "type_error")), request);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ValidationErrorResponse> handleMissingParameter(MissingServletRequestParameterException e,
                                                                          HttpServletRequest request) {
        return validationError(List.of(new FieldErrorDetail(
                e.getParameterName(), "Field required", "missing")), request);
    }

    /**
     * Framework-level rejections (unknown route, wrong verb, unsupported media type) keep their status.
     */
    @ExceptionHandler(ServletException.class)
    public ResponseEntity<ErrorResponse> handleServletException(ServletException e, HttpServletRequest request) {
        if (!(e instanceof org.springframework.web.ErrorResponse errorResponse)) {
            return handleException(e, request);
        }
        HttpStatusCode status = errorResponse.getStatusCode();
        HttpStatus resolved = HttpStatus.resolve(status.value());
        String detail = resolved == null ? "Request failed" : resolved.getReasonPhrase();
        log.warn("{} {} rejected with {}", request.getMethod(), request.getRequestURI(), status.value());
        return ResponseEntity.status(status).body(new ErrorResponse(detail, requestId(request)));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleException(Exception e, HttpServletRequest request) {
        log.error("Unexpected failure on {} {}", request.getMethod(), request.getRequestURI(), e);
        return ResponseEntity.status(ErrorCode.INTERNAL_SERVER_ERROR.getStatus())
                .body(new ErrorResponse(ErrorCode.INTERNAL_SERVER_ERROR.getMessage(), requestId(request)));
    }

    private ResponseEntity<ValidationErrorResponse> validationError(List<FieldErrorDetail> errors,
                                                                    HttpServletRequest request) {
        log.warn("Validation failed on {} {}: {}", request.getMethod(), request.getRequestURI(), errors);
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(ValidationErrorResponse.of("Validation error", errors, request.getRequestURI()));
    }

    private String requestId(HttpServletRequest request) {
        return request.getHeader(RequestIdFilter.REQUEST_ID_HEADER);
    }

    private String leafName(ConstraintViolation<?> violation) {
        String name = null;
        for (Path.Node node : violation.getPropertyPath()) {
            name = node.getName();
        }
        return name == null ? "" : SNAKE_CASE.translate(name);
    }

    private String constraintType(MessageSourceResolvable error) {
        String[] codes = error.getCodes();
        if (codes == null || codes.length == 0) {
            return "value_error";
        }
        return SNAKE_CASE.translate(codes[codes.length - 1]);
    }
}
