package com.ryuqq.result.core;

import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * 성공 결과.
 *
 * <p>연산이 성공적으로 완료되어 값을 보유하고 있음을 나타냅니다.</p>
 *
 * @param value 성공 값 (non-null)
 * @param <S> 성공 값 타입
 * @param <F> 실패 사유 타입 (사용되지 않음)
 *
 * @author Result Team
 * @since 1.0.0
 */
public record Success<S, F>(S value) implements Result<S, F> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException value가 null인 경우
     */
    public Success {
        Preconditions.checkNotNull(value, "value");
    }

    @Override
    public boolean succeeded() {
        return true;
    }

    @Override
    public <SP> Result<SP, F> map(Function<? super S, ? extends SP> mapper) {
        Preconditions.checkNotNull(mapper, "mapper");
        return new Success<>(mapper.apply(value));
    }

    @Override
    public <SP> Result<SP, F> flatMap(Function<? super S, ? extends Result<SP, F>> next) {
        Preconditions.checkNotNull(next, "next");
        return next.apply(value);
    }

    @Override
    public Result<S, F> conditionalMap(Predicate<? super S> predicate, Function<? super S, ? extends S> mapper) {
        Preconditions.checkNotNull(predicate, "predicate");
        Preconditions.checkNotNull(mapper, "mapper");
        return predicate.test(value) ? new Success<>(mapper.apply(value)) : new Success<>(value);
    }

    @Override
    public Result<S, F> conditionalFlatMap(Predicate<? super S> predicate,
                                           Function<? super S, ? extends Result<S, F>> next) {
        Preconditions.checkNotNull(predicate, "predicate");
        Preconditions.checkNotNull(next, "next");
        return predicate.test(value) ? next.apply(value) : new Success<>(value);
    }

    @Override
    public Result<S, F> filter(Predicate<? super S> predicate, Supplier<? extends F> failureProvider) {
        Preconditions.checkNotNull(predicate, "predicate");
        Preconditions.checkNotNull(failureProvider, "failureProvider");
        return predicate.test(value) ? new Success<>(value) : new Failure<>(failureProvider.get());
    }

    @Override
    public <FP> Result<S, FP> mapFailure(Function<? super F, ? extends FP> mapper) {
        Preconditions.checkNotNull(mapper, "mapper");
        return new Success<>(value);
    }

    @Override
    public <SP> Result<SP, F> asFailureOf(F fallback) {
        return new Failure<>(fallback);
    }

    @Override
    public Result<S, F> onSuccess(Consumer<? super S> handler, Function<? super HandlerFault, ? extends F> faultMapper) {
        Preconditions.checkNotNull(handler, "handler");
        return HandlerInvoker.invoke("onSuccess", () -> handler.accept(value), faultMapper, this);
    }

    @Override
    public Result<S, F> onFailure(Consumer<? super F> handler, Function<? super HandlerFault, ? extends F> faultMapper) {
        Preconditions.checkNotNull(handler, "handler");
        Preconditions.checkNotNull(faultMapper, "faultMapper");
        return this;
    }

    @Override
    public S getOrNull() {
        return value;
    }

    @Override
    public S getOrDefault(S defaultValue) {
        return value;
    }

    @Override
    public S getOr(Supplier<? extends S> supplier) {
        return value;
    }

    @Override
    public S getOrThrow() {
        return value;
    }

    @Override
    public <X extends Throwable> S getOrThrow(Function<? super F, ? extends X> exceptionFactory) {
        return value;
    }

    @Override
    public F failureOrNull() {
        return null;
    }
}
