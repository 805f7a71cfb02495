package dev.resumescreener.error;

import lombok.Getter;

/**
 * Failure carrying an {@link ErrorKind} and a human-readable message.
 */
@Getter
public class ScreeningException extends RuntimeException {

    private final ErrorKind kind;

    public ScreeningException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ScreeningException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
