package com.ryuqq.result.core;

import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * 성공 또는 실패를 표현하는 불변 결과 타입.
 *
 * <p>Result는 두 가지 상태 중 정확히 하나를 가집니다:</p>
 * <ul>
 *   <li>{@link Success}: 성공 값(S)을 보유</li>
 *   <li>{@link Failure}: 실패 사유(F)를 보유</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 두 상태 외의 구현은 허용되지 않습니다.
 * 모든 조합 연산(map, flatMap, filter 등)은 원본을 변경하지 않고 새 Result를 반환합니다.</p>
 *
 * <p><strong>예외 정책:</strong></p>
 * <ul>
 *   <li>실패는 데이터입니다. 조합 연산은 실패 분기에서 예외를 던지지 않습니다.</li>
 *   <li>onSuccess, onFailure, always 핸들러가 던진 예외(Error 제외)는 {@link HandlerFault}로
 *       변환되어 새 실패 Result가 됩니다.</li>
 *   <li>예외가 던져지는 유일한 지점은 {@link #getOrThrow()} 계열 종단 연산입니다.</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Result&lt;Integer, String&gt; parsed = parse(input);
 * int doubled = parsed
 *     .filter(value -&gt; value &gt; 0, () -&gt; "must be positive")
 *     .map(value -&gt; value * 2)
 *     .onFailure(log::warn, HandlerFault::describe)
 *     .getOrDefault(0);
 * </pre>
 *
 * @param <S> 성공 값 타입
 * @param <F> 실패 사유 타입
 *
 * @author Result Team
 * @since 1.0.0
 */
public sealed interface Result<S, F> permits Success, Failure {

    /**
     * 성공 Result 생성.
     *
     * @param value 성공 값
     * @param <S> 성공 값 타입
     * @param <F> 실패 사유 타입
     * @return 성공 Result
     * @throws IllegalArgumentException value가 null인 경우
     */
    static <S, F> Result<S, F> success(S value) {
        return new Success<>(value);
    }

    /**
     * 실패 Result 생성.
     *
     * @param failure 실패 사유
     * @param <S> 성공 값 타입
     * @param <F> 실패 사유 타입
     * @return 실패 Result
     * @throws IllegalArgumentException failure가 null인 경우
     */
    static <S, F> Result<S, F> failure(F failure) {
        return new Failure<>(failure);
    }

    /**
     * 성공 여부 확인.
     *
     * @return 성공이면 true
     */
    boolean succeeded();

    /**
     * 실패 여부 확인. 항상 {@link #succeeded()}의 보수입니다.
     *
     * @return 실패이면 true
     */
    default boolean failed() {
        return !succeeded();
    }

    /**
     * {@link #equals(Object)}의 부정.
     *
     * @param other 비교 대상
     * @return 두 Result가 같지 않으면 true
     */
    default boolean nonEqual(Result<S, F> other) {
        return !equals(other);
    }

    /**
     * 성공 값을 변환합니다. 실패이면 mapper를 호출하지 않고 같은 실패 사유를 전달합니다.
     *
     * @param mapper 성공 값 변환 함수
     * @param <SP> 변환된 성공 값 타입
     * @return 변환된 Result
     */
    <SP> Result<SP, F> map(Function<? super S, ? extends SP> mapper);

    /**
     * 성공 값으로 다음 Result를 생성합니다. 중첩 없이 next의 반환값을 그대로 돌려줍니다.
     *
     * @param next 다음 단계
     * @param <SP> 다음 단계의 성공 값 타입
     * @return next의 결과, 또는 전파된 실패
     */
    <SP> Result<SP, F> flatMap(Function<? super S, ? extends Result<SP, F>> next);

    /**
     * @deprecated {@link #flatMap(Function)}을 사용하세요.
     */
    @Deprecated
    default <SP> Result<SP, F> andThen(Function<? super S, ? extends Result<SP, F>> next) {
        return flatMap(next);
    }

    /**
     * 조건부 map. predicate가 참일 때만 mapper를 적용하고, 거짓이면 원래 값을 새 성공으로 반환합니다.
     *
     * @param predicate 적용 조건
     * @param mapper 값 변환 함수 (타입 유지)
     * @return 변환되었거나 그대로인 Result
     */
    Result<S, F> conditionalMap(Predicate<? super S> predicate, Function<? super S, ? extends S> mapper);

    /**
     * 조건부 flatMap. predicate가 참일 때만 next를 적용합니다.
     *
     * @param predicate 적용 조건
     * @param next 다음 단계 (타입 유지)
     * @return next의 결과, 원래 값의 새 성공, 또는 전파된 실패
     */
    Result<S, F> conditionalFlatMap(Predicate<? super S> predicate,
                                    Function<? super S, ? extends Result<S, F>> next);

    /**
     * 성공 값이 predicate를 만족하지 않으면 failureProvider가 만든 실패로 바꿉니다.
     *
     * <p>String 실패 타입에서 기본 실패 메시지가 필요하면
     * {@link com.ryuqq.result.core.aggregate.Results#filter(Result, Predicate)}를 사용합니다.</p>
     *
     * @param predicate 유지 조건
     * @param failureProvider 조건 불충족 시 실패 사유 공급자
     * @return 필터링된 Result
     */
    Result<S, F> filter(Predicate<? super S> predicate, Supplier<? extends F> failureProvider);

    /**
     * 실패 사유를 변환합니다. 성공이면 값을 그대로 전달합니다.
     *
     * @param mapper 실패 사유 변환 함수
     * @param <FP> 변환된 실패 사유 타입
     * @return 변환된 Result
     */
    <FP> Result<S, FP> mapFailure(Function<? super F, ? extends FP> mapper);

    /**
     * 다른 성공 타입의 실패로 변환합니다. 실패 사유가 없으면(성공인 경우) fallback을 사용합니다.
     *
     * @param fallback 대체 실패 사유
     * @param <SP> 새 성공 값 타입
     * @return 항상 실패 Result
     */
    <SP> Result<SP, F> asFailureOf(F fallback);

    /**
     * 성공일 때만 부수효과 핸들러를 실행합니다.
     *
     * @param handler 성공 값 핸들러
     * @param faultMapper 핸들러가 예외를 던졌을 때 실패 사유를 만드는 함수 (null을 반환해서는 안 됨)
     * @return 정상이면 this, 핸들러 예외 시 새 실패 Result
     * @throws IllegalArgumentException faultMapper가 null이거나 null을 반환한 경우
     */
    Result<S, F> onSuccess(Consumer<? super S> handler, Function<? super HandlerFault, ? extends F> faultMapper);

    /**
     * 실패일 때만 부수효과 핸들러를 실행합니다.
     *
     * @param handler 실패 사유 핸들러
     * @param faultMapper 핸들러가 예외를 던졌을 때 실패 사유를 만드는 함수 (null을 반환해서는 안 됨)
     * @return 정상이면 this, 핸들러 예외 시 새 실패 Result
     * @throws IllegalArgumentException faultMapper가 null이거나 null을 반환한 경우
     */
    Result<S, F> onFailure(Consumer<? super F> handler, Function<? super HandlerFault, ? extends F> faultMapper);

    /**
     * 상태와 무관하게 핸들러를 실행합니다.
     *
     * @param handler 핸들러
     * @param faultMapper 핸들러가 예외를 던졌을 때 실패 사유를 만드는 함수 (null을 반환해서는 안 됨)
     * @return 정상이면 this, 핸들러 예외 시 새 실패 Result
     * @throws IllegalArgumentException faultMapper가 null이거나 null을 반환한 경우
     */
    default Result<S, F> always(Runnable handler, Function<? super HandlerFault, ? extends F> faultMapper) {
        Preconditions.checkNotNull(handler, "handler");
        return HandlerInvoker.invoke("onAlways", handler, faultMapper, this);
    }

    /**
     * @return 성공 값, 실패이면 null
     */
    S getOrNull();

    /**
     * @param defaultValue 실패 시 반환할 값
     * @return 성공 값 또는 defaultValue
     */
    S getOrDefault(S defaultValue);

    /**
     * @param supplier 실패 시 호출되는 값 공급자
     * @return 성공 값 또는 supplier의 결과
     */
    S getOr(Supplier<? extends S> supplier);

    /**
     * 성공 값을 반환하고, 실패이면 {@link ResultFailureException}을 던집니다.
     *
     * @return 성공 값
     * @throws ResultFailureException 실패인 경우 (메시지는 실패 사유의 표시 문자열)
     */
    S getOrThrow();

    /**
     * 성공 값을 반환하고, 실패이면 exceptionFactory가 만든 예외를 던집니다.
     *
     * @param exceptionFactory 실패 사유로 예외를 만드는 함수
     * @param <X> 예외 타입
     * @return 성공 값
     * @throws X 실패인 경우
     */
    <X extends Throwable> S getOrThrow(Function<? super F, ? extends X> exceptionFactory) throws X;

    /**
     * @return 실패 사유, 성공이면 null
     */
    F failureOrNull();
}
