package com.shinobi.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.HashSet;
import java.util.Set;

/**
 * Base for PATCH bodies. Jackson only calls a setter for keys that appear in the JSON document,
 * so setters record which fields were sent, including the ones sent as an explicit {@code null}.
 */
public abstract class PatchRequest {

    /**
     * Required text fields may be omitted, but when sent they need a non-whitespace character.
     */
    protected static final String NOT_BLANK = "(?s).*\\S.*";

    @JsonIgnore
    private final Set<String> presentFields = new HashSet<>();

    protected void markPresent(String field) {
        presentFields.add(field);
    }

    public boolean isPresent(String field) {
        return presentFields.contains(field);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return presentFields.isEmpty();
    }
}
