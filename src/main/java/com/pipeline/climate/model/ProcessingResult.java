package com.pipeline.climate.model;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * 处理结果：成功时携带值，失败时携带原因和说明。
 * 管道和组合算子检查结果，遇到失败立即停止并向上传递。
 */
public final class ProcessingResult<T> {

    private final T value;
    private final FailureReason reason;
    private final String message;

    private ProcessingResult(T value, FailureReason reason, String message) {
        this.value = value;
        this.reason = reason;
        this.message = message;
    }

    public static <T> ProcessingResult<T> success(T value) {
        return new ProcessingResult<>(Objects.requireNonNull(value, "value"), null, null);
    }

    public static <T> ProcessingResult<T> failure(FailureReason reason, String message) {
        return new ProcessingResult<>(null, Objects.requireNonNull(reason, "reason"), message);
    }

    /** 空值视为失败 */
    public static <T> ProcessingResult<T> ofOptional(Optional<T> value, FailureReason reason, String message) {
        return value.map(ProcessingResult::success).orElseGet(() -> failure(reason, message));
    }

    public boolean isSuccess() {
        return reason == null;
    }

    public boolean isFailure() {
        return reason != null;
    }

    public T get() {
        if (reason != null) {
            throw new NoSuchElementException("Processing failed (" + reason + "): " + message);
        }
        return value;
    }

    public FailureReason getReason() { return reason; }
    public String getMessage() { return message; }

    public Optional<T> toOptional() {
        return Optional.ofNullable(value);
    }

    public <R> ProcessingResult<R> map(Function<? super T, ? extends R> mapper) {
        if (isFailure()) {
            return failure(reason, message);
        }
        return success(mapper.apply(value));
    }

    public <R> ProcessingResult<R> flatMap(Function<? super T, ProcessingResult<R>> mapper) {
        if (isFailure()) {
            return failure(reason, message);
        }
        return mapper.apply(value);
    }

    @Override
    public String toString() {
        return isSuccess() ? "Success{" + value + "}" : "Failure{" + reason + ": " + message + "}";
    }
}
