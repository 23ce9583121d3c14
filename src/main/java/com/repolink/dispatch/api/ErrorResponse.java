package com.repolink.dispatch.api;

/**
 * JSON error body. {@code error} is the {@link com.repolink.core.error.ErrorKind}
 * name, {@code code} the specific failure.
 */
public record ErrorResponse(String error, String code, String detail) {}
