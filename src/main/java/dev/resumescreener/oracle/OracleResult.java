package dev.resumescreener.oracle;

import dev.resumescreener.error.ErrorKind;
import dev.resumescreener.error.ScreeningException;

/**
 * Success value or classified failure returned by the scoring oracle.
 */
public record OracleResult<T>(T value, ErrorKind errorKind, String message) {

    public static <T> OracleResult<T> success(T value) {
        return new OracleResult<>(value, null, null);
    }

    public static <T> OracleResult<T> failure(ErrorKind kind, String message) {
        return new OracleResult<>(null, kind, message);
    }

    public boolean isSuccess() {
        return errorKind == null;
    }

    public ScreeningException toException() {
        return new ScreeningException(errorKind, message);
    }
}
