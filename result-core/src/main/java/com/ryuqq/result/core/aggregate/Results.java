package com.ryuqq.result.core.aggregate;

import com.ryuqq.result.core.Result;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;

import static com.ryuqq.result.core.Preconditions.checkElementsNotNull;
import static com.ryuqq.result.core.Preconditions.checkNotNull;

/**
 * Result 목록 집계 유틸리티.
 *
 * <p>여러 Result를 하나의 Result로 줄이는 두 가지 정책을 제공합니다:</p>
 * <ul>
 *   <li><strong>All-or-nothing:</strong> {@link #fromAll}, {@link #forEachResult},
 *       {@link #forEachElement} - 모두 성공해야 성공</li>
 *   <li><strong>Best-effort:</strong> {@link #fromAny} - 실패는 버리고 성공만 수집</li>
 * </ul>
 *
 * <p>{@link #reduceToResult}는 Result를 반환하는 reducer로 왼쪽 접기를 수행하며,
 * 실패한 단계가 있어도 접기를 계속하여 모든 실패를 수집합니다.</p>
 *
 * <p>모든 결과 목록은 입력 순서를 유지하며 수정 불가능합니다.</p>
 *
 * @author Result Team
 * @since 1.0.0
 */
public final class Results {

    /**
     * {@link #filter(Result, Predicate)}의 기본 실패 메시지.
     */
    public static final String PREDICATE_NOT_SATISFIED = "Predicate not satisfied";

    private Results() {
    }

    /**
     * 모든 Result가 성공일 때만 성공 값 목록으로 성공합니다.
     *
     * <p>하나라도 실패하면 실패 개수를 담은 메시지로 실패합니다. 개별 실패 사유는 버려집니다.
     * 사유가 필요하면 {@link #forEachResult}를 사용하세요.</p>
     *
     * @param results Result 목록
     * @param <T> 성공 값 타입
     * @param <F> 실패 사유 타입
     * @return 성공 값 목록 또는 실패 메시지
     * @throws IllegalArgumentException results가 null이거나 null 원소를 포함하는 경우
     */
    public static <T, F> Result<List<T>, String> fromAll(List<? extends Result<T, F>> results) {
        checkElementsNotNull(results, "results");

        List<T> successes = new ArrayList<>(results.size());
        int failed = 0;
        for (Result<T, F> result : results) {
            if (result.succeeded()) {
                successes.add(result.getOrThrow());
            } else {
                failed++;
            }
        }
        if (failed > 0) {
            return Result.failure("All results were not successful; number_failed: " + failed);
        }
        return Result.success(List.copyOf(successes));
    }

    /**
     * 성공한 Result의 값만 모아 항상 성공합니다. 모두 실패하면 빈 목록으로 성공합니다.
     *
     * @param results Result 목록
     * @param <T> 성공 값 타입
     * @param <F> 실패 사유 타입
     * @return 성공 값 목록 (항상 성공)
     * @throws IllegalArgumentException results가 null이거나 null 원소를 포함하는 경우
     */
    public static <T, F> Result<List<T>, String> fromAny(List<? extends Result<T, F>> results) {
        checkElementsNotNull(results, "results");

        List<T> successes = new ArrayList<>(results.size());
        for (Result<T, F> result : results) {
            if (result.succeeded()) {
                successes.add(result.getOrThrow());
            }
        }
        return Result.success(List.copyOf(successes));
    }

    /**
     * 각 Result에 handler를 적용한 뒤, 모두 성공이면 변환된 값 목록으로 성공하고
     * 그렇지 않으면 모든 실패 사유 목록으로 실패합니다.
     *
     * @param resultList Result 목록
     * @param handler Result 변환 함수
     * @param <SI> 입력 성공 값 타입
     * @param <FI> 입력 실패 사유 타입
     * @param <SO> 출력 성공 값 타입
     * @param <FO> 출력 실패 사유 타입
     * @return 성공 값 목록 또는 실패 사유 목록
     * @throws IllegalArgumentException resultList나 handler가 null이거나 handler가 null을 반환한 경우
     */
    public static <SI, FI, SO, FO> Result<List<SO>, List<FO>> forEachResult(
        List<? extends Result<SI, FI>> resultList,
        Function<? super Result<SI, FI>, ? extends Result<SO, FO>> handler
    ) {
        checkElementsNotNull(resultList, "resultList");
        checkNotNull(handler, "handler");

        List<Result<SO, FO>> results = new ArrayList<>(resultList.size());
        for (Result<SI, FI> result : resultList) {
            results.add(checkNotNull(handler.apply(result), "handler result"));
        }
        return collect(results);
    }

    /**
     * 각 원소에 Result를 만드는 handler를 적용하고 {@link #forEachResult}와 같은 규칙으로 집계합니다.
     *
     * @param elements 원소 목록
     * @param handler 원소별 Result 생성 함수
     * @param <V> 원소 타입
     * @param <S> 성공 값 타입
     * @param <F> 실패 사유 타입
     * @return 성공 값 목록 또는 실패 사유 목록
     * @throws IllegalArgumentException elements나 handler가 null이거나 handler가 null을 반환한 경우
     */
    public static <V, S, F> Result<List<S>, List<F>> forEachElement(
        List<? extends V> elements,
        Function<? super V, ? extends Result<S, F>> handler
    ) {
        checkNotNull(elements, "elements");
        checkNotNull(handler, "handler");

        List<Result<S, F>> results = new ArrayList<>(elements.size());
        for (V element : elements) {
            results.add(checkNotNull(handler.apply(element), "handler result"));
        }
        return collect(results);
    }

    /**
     * Result를 반환하는 reducer로 왼쪽 접기를 수행합니다.
     *
     * <p>reducer가 실패를 반환한 단계는 실패 사유를 기록하고 누산기를 바꾸지 않은 채 다음 원소로 진행합니다.
     * 한 단계라도 실패했다면 전체는 모든 실패 사유 목록으로 실패하고,
     * 그렇지 않으면 최종 누산기로 성공합니다. 빈 입력은 initialValue로 성공합니다.</p>
     *
     * @param values 입력 값 목록
     * @param reducer (누산기, 값) → 새 누산기 Result
     * @param initialValue 초기 누산기
     * @param <V> 입력 값 타입
     * @param <S> 누산기 타입
     * @param <F> 실패 사유 타입
     * @return 최종 누산기 또는 실패 사유 목록
     * @throws IllegalArgumentException 인자가 null이거나 reducer가 null을 반환한 경우
     */
    public static <V, S, F> Result<S, List<F>> reduceToResult(
        List<? extends V> values,
        BiFunction<? super S, ? super V, ? extends Result<S, F>> reducer,
        S initialValue
    ) {
        checkNotNull(values, "values");
        checkNotNull(reducer, "reducer");
        checkNotNull(initialValue, "initialValue");

        List<F> failures = new ArrayList<>();
        S reduced = initialValue;
        for (V value : values) {
            Result<S, F> step = checkNotNull(reducer.apply(reduced, value), "reducer result");
            if (step.failed()) {
                failures.add(step.failureOrNull());
            } else {
                reduced = step.getOrThrow();
            }
        }
        if (!failures.isEmpty()) {
            return Result.failure(List.copyOf(failures));
        }
        return Result.success(reduced);
    }

    /**
     * String 실패 타입 전용 filter. 조건을 만족하지 않으면 {@link #PREDICATE_NOT_SATISFIED}로 실패합니다.
     *
     * @param result 대상 Result
     * @param predicate 유지 조건
     * @param <S> 성공 값 타입
     * @return 필터링된 Result
     */
    public static <S> Result<S, String> filter(Result<S, String> result, Predicate<? super S> predicate) {
        checkNotNull(result, "result");
        return result.filter(predicate, () -> PREDICATE_NOT_SATISFIED);
    }

    private static <S, F> Result<List<S>, List<F>> collect(List<Result<S, F>> results) {
        List<S> succeeded = new ArrayList<>(results.size());
        List<F> failed = new ArrayList<>();
        for (Result<S, F> result : results) {
            if (result.succeeded()) {
                succeeded.add(result.getOrThrow());
            } else {
                failed.add(result.failureOrNull());
            }
        }
        if (!failed.isEmpty()) {
            return Result.failure(List.copyOf(failed));
        }
        return Result.success(List.copyOf(succeeded));
    }
}
