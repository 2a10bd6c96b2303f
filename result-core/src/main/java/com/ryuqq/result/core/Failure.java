package com.ryuqq.result.core;

import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * 실패 결과.
 *
 * <p>연산이 값을 만들지 못했음을 나타내며, 그 사유를 보유합니다.
 * 성공 값을 다루는 조합 연산은 모두 단락(short-circuit)되어 사유를 그대로 전파합니다.</p>
 *
 * @param failure 실패 사유 (non-null)
 * @param <S> 성공 값 타입 (사용되지 않음)
 * @param <F> 실패 사유 타입
 *
 * @author Result Team
 * @since 1.0.0
 */
public record Failure<S, F>(F failure) implements Result<S, F> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException failure가 null인 경우
     */
    public Failure {
        Preconditions.checkNotNull(failure, "failure");
    }

    @Override
    public boolean succeeded() {
        return false;
    }

    @Override
    public <SP> Result<SP, F> map(Function<? super S, ? extends SP> mapper) {
        Preconditions.checkNotNull(mapper, "mapper");
        return new Failure<>(failure);
    }

    @Override
    public <SP> Result<SP, F> flatMap(Function<? super S, ? extends Result<SP, F>> next) {
        Preconditions.checkNotNull(next, "next");
        return new Failure<>(failure);
    }

    @Override
    public Result<S, F> conditionalMap(Predicate<? super S> predicate, Function<? super S, ? extends S> mapper) {
        Preconditions.checkNotNull(predicate, "predicate");
        Preconditions.checkNotNull(mapper, "mapper");
        return new Failure<>(failure);
    }

    @Override
    public Result<S, F> conditionalFlatMap(Predicate<? super S> predicate,
                                           Function<? super S, ? extends Result<S, F>> next) {
        Preconditions.checkNotNull(predicate, "predicate");
        Preconditions.checkNotNull(next, "next");
        return new Failure<>(failure);
    }

    @Override
    public Result<S, F> filter(Predicate<? super S> predicate, Supplier<? extends F> failureProvider) {
        Preconditions.checkNotNull(predicate, "predicate");
        Preconditions.checkNotNull(failureProvider, "failureProvider");
        return new Failure<>(failure);
    }

    @Override
    public <FP> Result<S, FP> mapFailure(Function<? super F, ? extends FP> mapper) {
        Preconditions.checkNotNull(mapper, "mapper");
        return new Failure<>(mapper.apply(failure));
    }

    @Override
    public <SP> Result<SP, F> asFailureOf(F fallback) {
        return new Failure<>(failure);
    }

    @Override
    public Result<S, F> onSuccess(Consumer<? super S> handler, Function<? super HandlerFault, ? extends F> faultMapper) {
        Preconditions.checkNotNull(handler, "handler");
        Preconditions.checkNotNull(faultMapper, "faultMapper");
        return this;
    }

    @Override
    public Result<S, F> onFailure(Consumer<? super F> handler, Function<? super HandlerFault, ? extends F> faultMapper) {
        Preconditions.checkNotNull(handler, "handler");
        return HandlerInvoker.invoke("onFailure", () -> handler.accept(failure), faultMapper, this);
    }

    @Override
    public S getOrNull() {
        return null;
    }

    @Override
    public S getOrDefault(S defaultValue) {
        return defaultValue;
    }

    @Override
    public S getOr(Supplier<? extends S> supplier) {
        Preconditions.checkNotNull(supplier, "supplier");
        return supplier.get();
    }

    @Override
    public S getOrThrow() {
        throw new ResultFailureException(Displayable.render(failure), failure);
    }

    @Override
    public <X extends Throwable> S getOrThrow(Function<? super F, ? extends X> exceptionFactory) throws X {
        Preconditions.checkNotNull(exceptionFactory, "exceptionFactory");
        throw exceptionFactory.apply(failure);
    }

    @Override
    public F failureOrNull() {
        return failure;
    }
}
