package com.repolink.core.error;

/**
 * Failure raised by the context store, the commit builder and the object store clients.
 *
 * <p>Every instance carries an {@link ErrorKind}, a short snake_case {@code code}
 * (for example {@code context_not_found} or {@code ref_update_ambiguous}) and a
 * human-readable detail message.
 */
public class RepolinkException extends RuntimeException {

    private final ErrorKind kind;
    private final String code;

    public RepolinkException(ErrorKind kind, String code, String detail) {
        super(detail);
        this.kind = kind;
        this.code = code;
    }

    public RepolinkException(ErrorKind kind, String code, String detail, Throwable cause) {
        super(detail, cause);
        this.kind = kind;
        this.code = code;
    }

    public ErrorKind kind() {
        return kind;
    }

    public String code() {
        return code;
    }

    public static RepolinkException notFound(String code, String detail) {
        return new RepolinkException(ErrorKind.NOT_FOUND, code, detail);
    }

    public static RepolinkException validation(String detail) {
        return new RepolinkException(ErrorKind.VALIDATION, "invalid_request", detail);
    }

    public static RepolinkException validation(String code, String detail) {
        return new RepolinkException(ErrorKind.VALIDATION, code, detail);
    }

    public static RepolinkException conflict(String code, String detail) {
        return new RepolinkException(ErrorKind.CONFLICT, code, detail);
    }

    public static RepolinkException upstream(String detail, Throwable cause) {
        return new RepolinkException(ErrorKind.UPSTREAM, "upstream_error", detail, cause);
    }

    public static RepolinkException upstream(String detail) {
        return new RepolinkException(ErrorKind.UPSTREAM, "upstream_error", detail);
    }

    public static RepolinkException contextNotFound(String contextId) {
        return notFound("context_not_found", "Context not found: " + contextId);
    }
}
