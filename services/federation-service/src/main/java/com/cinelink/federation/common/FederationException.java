package com.cinelink.federation.common;

public class FederationException extends RuntimeException {
    private final ErrorKind kind;

    public FederationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public FederationException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static FederationException validation(String message) {
        return new FederationException(ErrorKind.VALIDATION, message);
    }

    public static FederationException notFound(String message) {
        return new FederationException(ErrorKind.NOT_FOUND, message);
    }

    public static FederationException backend(Throwable cause) {
        String message = cause.getMessage();
        return new FederationException(
            ErrorKind.BACKEND,
            message == null ? cause.getClass().getSimpleName() : message,
            cause
        );
    }

    public ErrorKind getKind() {
        return kind;
    }
}
