package com.evpn.auditor.transport;

import java.util.Objects;
import java.util.function.Function;

/**
 * Результат удалённой операции над устройством: значение либо причина отказа.
 * Транспорт не пробрасывает свои исключения наружу, а заворачивает их в {@link Failure}.
 */
public sealed interface OperationResult<T> permits OperationResult.Success, OperationResult.Failure {

    static <T> OperationResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> OperationResult<T> failure(String reason) {
        return new Failure<>(reason, null);
    }

    static <T> OperationResult<T> failure(String reason, Throwable cause) {
        return new Failure<>(reason, cause);
    }

    boolean isSuccess();

    default <R> OperationResult<R> map(Function<T, R> mapper) {
        if (this instanceof Success<T> success) {
            return new Success<>(mapper.apply(success.value()));
        }
        Failure<T> failure = (Failure<T>) this;
        return new Failure<>(failure.reason(), failure.cause());
    }

    record Success<T>(T value) implements OperationResult<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    record Failure<T>(String reason, Throwable cause) implements OperationResult<T> {
        public Failure {
            Objects.requireNonNull(reason, "reason");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        public String describe() {
            if (cause == null || cause.getMessage() == null) {
                return reason;
            }
            return reason + ": " + cause.getMessage();
        }
    }
}
