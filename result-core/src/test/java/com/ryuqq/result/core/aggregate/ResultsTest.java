package com.ryuqq.result.core.aggregate;

import com.ryuqq.result.core.Result;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Results 집계 유틸리티 테스트.
 *
 * @author Result Team
 * @since 1.0.0
 */
class ResultsTest {

    // ============================================================
    // 1. fromAll
    // ============================================================

    @Test
    void fromAll_AllSucceeded_ReturnsValuesInOrder() {
        // Given
        List<Result<Integer, String>> results = List.of(
            Result.success(1), Result.success(2), Result.success(3)
        );

        // When
        Result<List<Integer>, String> combined = Results.fromAll(results);

        // Then
        assertEquals(Result.success(List.of(1, 2, 3)), combined);
    }

    @Test
    void fromAll_SomeFailed_ReportsFailureCount() {
        // Given
        List<Result<Integer, String>> results = List.of(
            Result.success(1), Result.failure("x"), Result.success(3), Result.failure("y")
        );

        // When
        Result<List<Integer>, String> combined = Results.fromAll(results);

        // Then
        assertTrue(combined.failed());
        assertEquals("All results were not successful; number_failed: 2", combined.failureOrNull());
    }

    @Test
    void fromAll_Empty_ReturnsEmptySuccess() {
        assertEquals(Result.success(List.of()), Results.fromAll(List.<Result<Integer, String>>of()));
    }

    @Test
    void fromAll_NullElement_ThrowsException() {
        // Given
        List<Result<Integer, String>> results = Arrays.asList(Result.success(1), null);

        // When & Then
        assertThatThrownBy(() -> Results.fromAll(results))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("results cannot contain null");
    }

    // ============================================================
    // 2. fromAny
    // ============================================================

    @Test
    void fromAny_MixedResults_DropsFailuresPreservingOrder() {
        // Given
        List<Result<Integer, String>> results = List.of(
            Result.success(1), Result.failure("x"), Result.success(3)
        );

        // When
        Result<List<Integer>, String> combined = Results.fromAny(results);

        // Then
        assertEquals(Result.success(List.of(1, 3)), combined);
    }

    @Test
    void fromAny_AllFailed_ReturnsEmptySuccess() {
        // Given
        List<Result<Integer, String>> results = List.of(Result.failure("a"), Result.failure("b"));

        // When
        Result<List<Integer>, String> combined = Results.fromAny(results);

        // Then
        assertTrue(combined.succeeded());
        assertThat(combined.getOrThrow()).isEmpty();
    }

    // ============================================================
    // 3. forEachResult / forEachElement
    // ============================================================

    @Test
    void forEachResult_AllSucceeded_ReturnsTransformedValues() {
        // Given
        List<Result<String, String>> results = List.of(
            Result.success("an apple"),
            Result.success("busy bumble bees"),
            Result.success("changing clothing causes confusion"),
            Result.success("doorknobs doorbells dinner ding dong")
        );

        // When
        Result<List<Integer>, List<String>> combined = Results.forEachResult(
            results,
            result -> result.map(value -> value.split(" ").length)
        );

        // Then
        assertTrue(combined.succeeded());
        assertEquals(List.of(2, 3, 4, 5), combined.getOrThrow());
    }

    @Test
    void forEachResult_SomeFailed_ReturnsAllFailuresInOrder() {
        // Given
        List<Result<String, String>> results = List.of(
            Result.success("an apple"),
            Result.success("busy bumble bees"),
            Result.failure("doorknobs doorbells dinner ding dong"),
            Result.success("changing clothing causes confusion"),
            Result.failure("oops only one operation ordinarily opens")
        );

        // When
        Result<List<Integer>, List<String>> combined = Results.forEachResult(
            results,
            result -> result.map(value -> value.split(" ").length)
        );

        // Then
        assertTrue(combined.failed());
        assertNull(combined.getOrNull());
        assertEquals(List.of(
            "doorknobs doorbells dinner ding dong",
            "oops only one operation ordinarily opens"
        ), combined.failureOrNull());
    }

    @Test
    void forEachResult_HandlerChangesFailureType_CollectsMappedFailures() {
        // Given
        List<Result<Integer, String>> results = List.of(Result.success(1), Result.failure("abc"));

        // When
        Result<List<Integer>, List<Integer>> combined = Results.forEachResult(
            results,
            result -> result.mapFailure(String::length)
        );

        // Then
        assertEquals(Result.failure(List.of(3)), combined);
    }

    @Test
    void forEachElement_AllSucceeded_ReturnsValues() {
        // When
        Result<List<Integer>, List<String>> result = Results.forEachElement(
            List.of(1, 2, 3, 4, 5),
            element -> Result.success(2 * element)
        );

        // Then
        assertEquals(List.of(2, 4, 6, 8, 10), result.getOrDefault(List.of()));
    }

    @Test
    void forEachElement_OneFailed_ReturnsFailureList() {
        // When
        Result<List<Integer>, List<String>> result = Results.forEachElement(
            List.of(1, 2, 3, 4, 5),
            element -> element == 3
                ? Result.<Integer, String>failure("three sucks")
                : Result.<Integer, String>success(2 * element)
        );

        // Then
        assertTrue(result.failed());
        assertEquals(List.of("three sucks"), result.failureOrNull());
    }

    @Test
    void forEachElement_HandlerReturnsNull_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> Results.forEachElement(List.of(1), element -> null));
    }

    // ============================================================
    // 4. reduceToResult
    // ============================================================

    @Test
    void reduceToResult_AllStepsSucceed_ReturnsFinalAccumulator() {
        // When
        Result<List<String>, List<String>> reduced = Results.reduceToResult(
            List.of("a", "b"),
            (accumulator, value) -> {
                List<String> next = new ArrayList<>(accumulator);
                next.add(value);
                return Result.success(next);
            },
            List.<String>of()
        );

        // Then
        assertEquals(Result.success(List.of("a", "b")), reduced);
    }

    @Test
    void reduceToResult_StepFails_ContinuesWithUnchangedAccumulator() {
        // Given
        List<String> inputs = List.of(
            "an apple",
            "busy bumble bees",
            "doorknobs doorbells dinner ding dong",
            "changing clothing causes confusion"
        );
        List<Integer> seen = new ArrayList<>();

        // When
        Result<Integer, List<String>> reduced = Results.reduceToResult(
            inputs,
            (total, value) -> {
                seen.add(total);
                if (value.startsWith("d")) {
                    return Result.failure("oops only one operation ordinarily opens");
                }
                return Result.success(total + value.split(" ").length);
            },
            0
        );

        // Then
        assertTrue(reduced.failed());
        assertEquals(List.of("oops only one operation ordinarily opens"), reduced.failureOrNull());
        assertEquals(List.of(0, 2, 5, 5), seen);
    }

    @Test
    void reduceToResult_AlwaysFails_ReturnsOneFailurePerInput() {
        // When
        Result<Integer, List<String>> reduced = Results.reduceToResult(
            List.of("a", "b", "c"),
            (total, value) -> Result.failure("rejected " + value),
            0
        );

        // Then
        assertEquals(Result.failure(List.of("rejected a", "rejected b", "rejected c")), reduced);
    }

    @Test
    void reduceToResult_SteadyStateEqualsInitial_StillSucceeds() {
        // When
        Result<Integer, List<String>> reduced = Results.reduceToResult(
            List.of(1, -1, 0),
            (total, value) -> Result.success(total + value),
            0
        );

        // Then
        assertEquals(Result.success(0), reduced);
    }

    @Test
    void reduceToResult_EmptyInput_ReturnsInitialValue() {
        assertEquals(Result.success(10),
            Results.<Integer, Integer, String>reduceToResult(List.of(), (total, value) -> Result.success(total), 10));
    }

    // ============================================================
    // 5. filter (String 실패 기본값)
    // ============================================================

    @Test
    void filter_PredicateNotMet_UsesDefaultMessage() {
        // When
        Result<Integer, String> result = Results.filter(Result.success(3), value -> value > 5);

        // Then
        assertEquals(Result.failure(Results.PREDICATE_NOT_SATISFIED), result);
        assertEquals("Predicate not satisfied", result.failureOrNull());
    }

    @Test
    void filter_PredicateMet_KeepsValue() {
        assertEquals(Result.success(10), Results.filter(Result.success(10), value -> value > 5));
    }
}
