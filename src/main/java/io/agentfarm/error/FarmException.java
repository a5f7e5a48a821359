package io.agentfarm.error;

public class FarmException extends RuntimeException {
    private final ErrorKind kind;

    public FarmException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public FarmException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public static FarmException capacity(String message) {
        return new FarmException(ErrorKind.CAPACITY, message);
    }

    public static FarmException conflict(String message) {
        return new FarmException(ErrorKind.CONFLICT, message);
    }

    public static FarmException notFound(String message) {
        return new FarmException(ErrorKind.NOT_FOUND, message);
    }

    public static FarmException invalid(String message) {
        return new FarmException(ErrorKind.INVALID_ARGUMENT, message);
    }
}
