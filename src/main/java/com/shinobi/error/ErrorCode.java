package com.shinobi.error;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
@AllArgsConstructor
public enum ErrorCode {
    // 4xx
    RESOURCE_NOT_FOUND("%s not found", HttpStatus.NOT_FOUND),
    RELATED_RESOURCE_NOT_FOUND("%s not found", HttpStatus.BAD_REQUEST),
    CREATE_FAILED("Could not create %s", HttpStatus.BAD_REQUEST),
    UPDATE_FAILED("Could not update %s", HttpStatus.BAD_REQUEST),
    JUTSU_ASSIGN_FAILED("Could not add jutsu to character", HttpStatus.BAD_REQUEST),

    // 5xx
    RETRIEVE_FAILED("Error retrieving %s", HttpStatus.INTERNAL_SERVER_ERROR),
    DELETE_FAILED("Could not delete %s", HttpStatus.INTERNAL_SERVER_ERROR),
    INTERNAL_SERVER_ERROR("An unexpected error occurred.", HttpStatus.INTERNAL_SERVER_ERROR);

    private final String message;
    private final HttpStatus status;

    public String format(Object... args) {
        return args.length == 0 ? message : String.format(message, args);
    }
}
