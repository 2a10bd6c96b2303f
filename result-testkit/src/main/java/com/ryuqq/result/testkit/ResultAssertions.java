package com.ryuqq.result.testkit;

import com.ryuqq.result.core.Result;
import com.ryuqq.result.core.optional.Optional;

/**
 * Result SDK assertion 진입점.
 *
 * <p>AssertJ의 {@code Assertions.assertThat}과 함께 static import하여 사용합니다.</p>
 *
 * @author Result Team
 * @since 1.0.0
 */
public final class ResultAssertions {

    private ResultAssertions() {
    }

    public static <S, F> ResultAssert<S, F> assertThat(Result<S, F> actual) {
        return new ResultAssert<>(actual);
    }

    public static <T> OptionalAssert<T> assertThat(Optional<T> actual) {
        return new OptionalAssert<>(actual);
    }
}
