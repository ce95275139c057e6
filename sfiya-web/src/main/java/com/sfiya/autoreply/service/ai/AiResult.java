package com.sfiya.autoreply.service.ai;

import java.util.function.Function;

/**
 * Outcome of a call to the generative backend: either a value or the reason there is none.
 * Adapters map a failed result to their safe default instead of throwing.
 */
public record AiResult<T>(T value, String error) {

    public static <T> AiResult<T> ok(T value) {
        return new AiResult<>(value, null);
    }

    public static <T> AiResult<T> failure(String error) {
        return new AiResult<>(null, error != null ? error : "Unknown error");
    }

    public boolean isOk() {
        return error == null;
    }

    public <R> AiResult<R> map(Function<? super T, ? extends R> mapper) {
        return isOk() ? ok(mapper.apply(value)) : failure(error);
    }

    public <R> AiResult<R> flatMap(Function<? super T, AiResult<R>> mapper) {
        return isOk() ? mapper.apply(value) : failure(error);
    }

    public T orElse(T fallback) {
        return isOk() ? value : fallback;
    }
}
