package com.ryuqq.result.async;

import com.ryuqq.result.core.Result;
import com.ryuqq.result.core.aggregate.Results;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

import static com.ryuqq.result.core.Preconditions.checkNotNull;

/**
 * Result와 {@link CompletionStage} 사이의 비동기 브리지.
 *
 * <p><strong>제공 연산:</strong></p>
 * <ul>
 *   <li>{@link #liftFuture}: {@code Result<CompletionStage<S>, F>} → {@code CompletableFuture<Result<S, F>>}</li>
 *   <li>{@link #liftNestedFuture}: {@code Result<CompletionStage<Result<S, F>>, F>} → {@code CompletableFuture<Result<S, F>>}
 *       (한 단계 평탄화)</li>
 *   <li>{@link #lift}: 대기 중인 계산이 없는 Result를 즉시 완료된 future로 감쌉니다.</li>
 *   <li>{@link #forEachFuture}: 원소별 비동기 Result를 모두 정착(settle)될 때까지 기다린 뒤 하나의 Result로 집계합니다.</li>
 * </ul>
 *
 * <p><strong>거부(rejection) 처리:</strong></p>
 * <p>future가 예외로 완료되면 그 원인({@link CompletionException}, {@link ExecutionException}을 벗긴 예외)을
 * rejectionMapper로 실패 사유로 변환합니다. 예외는 체인 밖으로 던져지지 않습니다.</p>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>스레드를 생성하거나 블로킹하지 않습니다. 실행은 호출자가 넘긴 future에 맡깁니다.</li>
 *   <li>forEachFuture는 동시 실행 개수를 제한하지 않으며, 취소나 타임아웃을 제공하지 않습니다.</li>
 * </ul>
 *
 * @author Result Team
 * @since 1.0.0
 */
public final class ResultFutures {

    private static final Logger log = LoggerFactory.getLogger(ResultFutures.class);

    private ResultFutures() {
    }

    /**
     * 대기 중인 계산이 없는 Result를 즉시 완료된 future로 감쌉니다.
     *
     * @param result Result
     * @param <S> 성공 값 타입
     * @param <F> 실패 사유 타입
     * @return result로 완료된 future
     * @throws IllegalArgumentException result가 null인 경우
     */
    public static <S, F> CompletableFuture<Result<S, F>> lift(Result<S, F> result) {
        checkNotNull(result, "result");
        return CompletableFuture.completedFuture(result);
    }

    /**
     * 성공 값이 대기 중인 계산인 Result를, Result를 내는 future로 바꿉니다.
     *
     * <ul>
     *   <li>실패: 같은 실패 사유로 즉시 완료</li>
     *   <li>계산 정상 완료: 그 값의 성공</li>
     *   <li>계산 거부: rejectionMapper가 만든 실패</li>
     * </ul>
     *
     * @param result 성공 값이 CompletionStage인 Result
     * @param rejectionMapper 거부 원인 → 실패 사유
     * @param <S> 계산 결과 타입
     * @param <F> 실패 사유 타입
     * @return Result를 내는 future
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static <S, F> CompletableFuture<Result<S, F>> liftFuture(
        Result<? extends CompletionStage<? extends S>, F> result,
        Function<? super Throwable, ? extends F> rejectionMapper
    ) {
        checkNotNull(result, "result");
        checkNotNull(rejectionMapper, "rejectionMapper");

        if (result.failed()) {
            return CompletableFuture.completedFuture(Result.<S, F>failure(result.failureOrNull()));
        }
        return ResultFutures.<S, S, F>settle(result.getOrThrow(), Result::success, rejectionMapper);
    }

    /**
     * 성공 값이 Result를 내는 계산인 Result를 한 단계 평탄화합니다.
     *
     * <p>계산이 낸 Result는 그대로 반환됩니다. 나머지 규칙은 {@link #liftFuture}와 같습니다.</p>
     *
     * @param result 성공 값이 {@code CompletionStage<Result<S, F>>}인 Result
     * @param rejectionMapper 거부 원인 → 실패 사유
     * @param <S> 성공 값 타입
     * @param <F> 실패 사유 타입
     * @return 평탄화된 Result를 내는 future
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static <S, F> CompletableFuture<Result<S, F>> liftNestedFuture(
        Result<? extends CompletionStage<Result<S, F>>, F> result,
        Function<? super Throwable, ? extends F> rejectionMapper
    ) {
        checkNotNull(result, "result");
        checkNotNull(rejectionMapper, "rejectionMapper");

        if (result.failed()) {
            return CompletableFuture.completedFuture(Result.<S, F>failure(result.failureOrNull()));
        }
        return ResultFutures.<Result<S, F>, S, F>settle(result.getOrThrow(), nested -> nested, rejectionMapper);
    }

    /**
     * 각 원소에 대해 비동기 Result를 시작하고, 모두 정착될 때까지 기다려 하나의 Result로 집계합니다.
     *
     * <p><strong>집계 규칙:</strong></p>
     * <ol>
     *   <li>모든 future를 동시에 시작합니다. handler가 동기적으로 예외를 던지면 해당 원소의 거부로 취급합니다.</li>
     *   <li>첫 거부에서 멈추지 않고 모든 future가 정착될 때까지 기다립니다.</li>
     *   <li>거부된 future가 하나라도 있으면 모든 거부 원인을 실패 사유 목록으로 실패합니다.</li>
     *   <li>그렇지 않으면 정착된 Result들을 {@link Results#forEachResult}로 집계합니다.</li>
     *   <li>집계 자체가 실패하면 그 원인 하나를 담은 실패 목록으로 실패합니다.</li>
     * </ol>
     *
     * <p>성공 값과 실패 사유 목록은 정착 순서가 아닌 입력 순서를 따릅니다.</p>
     *
     * @param elements 원소 목록
     * @param handler 원소 → Result를 내는 CompletionStage
     * @param rejectionMapper 거부 원인 → 실패 사유
     * @param <V> 원소 타입
     * @param <S> 성공 값 타입
     * @param <F> 실패 사유 타입
     * @return 성공 값 목록 또는 실패 사유 목록을 내는 future
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static <V, S, F> CompletableFuture<Result<List<S>, List<F>>> forEachFuture(
        List<? extends V> elements,
        Function<? super V, ? extends CompletionStage<Result<S, F>>> handler,
        Function<? super Throwable, ? extends F> rejectionMapper
    ) {
        checkNotNull(elements, "elements");
        checkNotNull(handler, "handler");
        checkNotNull(rejectionMapper, "rejectionMapper");

        List<CompletableFuture<Result<S, F>>> futures = new ArrayList<>(elements.size());
        for (V element : elements) {
            futures.add(launch(handler, element));
        }
        log.debug("forEachFuture launched {} futures", futures.size());

        return CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
            .handle((ignored, error) -> partition(futures, rejectionMapper))
            .exceptionally(reason -> {
                Throwable cause = unwrap(reason);
                log.error("forEachFuture failed to settle all results", cause);
                return Result.<List<S>, List<F>>failure(List.of(rejectionMapper.apply(cause)));
            });
    }

    /**
     * 예외 래퍼를 벗겨 실제 원인을 찾습니다.
     *
     * @param error future가 완료된 예외
     * @return {@link CompletionException}, {@link ExecutionException}을 벗긴 원인
     */
    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static <T, S, F> CompletableFuture<Result<S, F>> settle(
        CompletionStage<? extends T> pending,
        Function<? super T, Result<S, F>> onValue,
        Function<? super Throwable, ? extends F> rejectionMapper
    ) {
        return pending.<Result<S, F>>handle((value, error) -> {
            if (error != null) {
                return Result.failure(rejectionMapper.apply(unwrap(error)));
            }
            if (value == null) {
                return Result.failure(rejectionMapper.apply(
                    new IllegalStateException("pending computation completed with null")));
            }
            return onValue.apply(value);
        }).toCompletableFuture();
    }

    private static <V, S, F> CompletableFuture<Result<S, F>> launch(
        Function<? super V, ? extends CompletionStage<Result<S, F>>> handler,
        V element
    ) {
        try {
            CompletionStage<Result<S, F>> stage = handler.apply(element);
            if (stage == null) {
                return CompletableFuture.failedFuture(
                    new IllegalStateException("handler returned null for element: " + element));
            }
            return stage.toCompletableFuture();
        } catch (RuntimeException e) {
            log.debug("forEachFuture handler threw for element {}", element, e);
            return CompletableFuture.failedFuture(e);
        }
    }

    private static <S, F> Result<List<S>, List<F>> partition(
        List<CompletableFuture<Result<S, F>>> futures,
        Function<? super Throwable, ? extends F> rejectionMapper
    ) {
        List<F> rejected = new ArrayList<>();
        List<Result<S, F>> resolved = new ArrayList<>(futures.size());
        for (CompletableFuture<Result<S, F>> future : futures) {
            try {
                Result<S, F> result = future.join();
                if (result == null) {
                    rejected.add(rejectionMapper.apply(
                        new IllegalStateException("pending computation completed with null")));
                } else {
                    resolved.add(result);
                }
            } catch (CompletionException | CancellationException e) {
                rejected.add(rejectionMapper.apply(unwrap(e)));
            }
        }

        if (!rejected.isEmpty()) {
            log.warn("forEachFuture: {} of {} futures were rejected", rejected.size(), futures.size());
            return Result.failure(List.copyOf(rejected));
        }
        return Results.forEachResult(resolved, result -> result);
    }
}
