package com.ryuqq.result.testkit;

import com.ryuqq.result.core.optional.Optional;
import org.assertj.core.api.AbstractAssert;

/**
 * {@link Optional} 전용 AssertJ assertion.
 *
 * @param <T> 값 타입
 *
 * @author Result Team
 * @since 1.0.0
 */
public class OptionalAssert<T> extends AbstractAssert<OptionalAssert<T>, Optional<T>> {

    public OptionalAssert(Optional<T> actual) {
        super(actual, OptionalAssert.class);
    }

    public OptionalAssert<T> isPresent() {
        isNotNull();
        if (actual.isEmpty()) {
            failWithMessage("Expected Optional to contain a value but it was empty");
        }
        return this;
    }

    public OptionalAssert<T> isEmpty() {
        isNotNull();
        if (actual.isNotEmpty()) {
            failWithMessage("Expected Optional to be empty but was <%s>", actual);
        }
        return this;
    }

    /**
     * 값을 보유하며 그 값이 expected와 같은지 검증.
     *
     * @param expected 기대 값
     * @return this
     */
    public OptionalAssert<T> contains(T expected) {
        isPresent();
        if (!actual.equals(Optional.ofNullable(expected))) {
            failWithMessage("Expected Optional to contain <%s> but was <%s>", expected, actual);
        }
        return this;
    }
}
