package com.repolink.dispatch.api;

import com.repolink.core.error.RepolinkException;

/**
 * Boundary checks shared by the controllers.
 */
final class RequestValidation {

    private RequestValidation() {}

    static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw RepolinkException.validation(field + " is required");
        }
        return value;
    }

    static <T> T requireBody(T body) {
        if (body == null) {
            throw RepolinkException.validation("Request body is required");
        }
        return body;
    }

    static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
