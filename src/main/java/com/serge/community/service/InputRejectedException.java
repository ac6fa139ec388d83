package com.serge.community.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Client input failed validation. Carries one message per offending field.
 */
public class InputRejectedException extends RuntimeException {
    private final Map<String, String> fieldErrors;

    public InputRejectedException(Map<String, String> fieldErrors) {
        super("Input rejected: " + fieldErrors.keySet());
        this.fieldErrors = Collections.unmodifiableMap(new LinkedHashMap<>(fieldErrors));
    }

    public Map<String, String> getFieldErrors() {
        return fieldErrors;
    }
}
