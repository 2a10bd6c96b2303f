package com.ryuqq.result.testkit;

import com.ryuqq.result.core.Result;
import org.assertj.core.api.AbstractAssert;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Result 전용 AssertJ assertion.
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * assertThat(result).isSuccess().hasValue(42);
 * assertThat(result).isFailure().hasFailure("not found");
 * </pre>
 *
 * @param <S> 성공 값 타입
 * @param <F> 실패 사유 타입
 *
 * @author Result Team
 * @since 1.0.0
 */
public class ResultAssert<S, F> extends AbstractAssert<ResultAssert<S, F>, Result<S, F>> {

    public ResultAssert(Result<S, F> actual) {
        super(actual, ResultAssert.class);
    }

    /**
     * 성공인지 검증.
     *
     * @return this
     */
    public ResultAssert<S, F> isSuccess() {
        isNotNull();
        if (!actual.succeeded()) {
            failWithMessage("Expected Result to be a success but was a failure with <%s>", actual.failureOrNull());
        }
        return this;
    }

    /**
     * 실패인지 검증.
     *
     * @return this
     */
    public ResultAssert<S, F> isFailure() {
        isNotNull();
        if (!actual.failed()) {
            failWithMessage("Expected Result to be a failure but was a success with <%s>", actual.getOrNull());
        }
        return this;
    }

    /**
     * 성공이며 값이 expected와 같은지 검증.
     *
     * @param expected 기대 값
     * @return this
     */
    public ResultAssert<S, F> hasValue(S expected) {
        isSuccess();
        if (!Objects.equals(actual.getOrNull(), expected)) {
            failWithMessage("Expected success value <%s> but was <%s>", expected, actual.getOrNull());
        }
        return this;
    }

    /**
     * 실패이며 사유가 expected와 같은지 검증.
     *
     * @param expected 기대 실패 사유
     * @return this
     */
    public ResultAssert<S, F> hasFailure(F expected) {
        isFailure();
        if (!Objects.equals(actual.failureOrNull(), expected)) {
            failWithMessage("Expected failure <%s> but was <%s>", expected, actual.failureOrNull());
        }
        return this;
    }

    public ResultAssert<S, F> hasValueSatisfying(Consumer<? super S> requirements) {
        isSuccess();
        requirements.accept(actual.getOrNull());
        return this;
    }

    public ResultAssert<S, F> hasFailureSatisfying(Consumer<? super F> requirements) {
        isFailure();
        requirements.accept(actual.failureOrNull());
        return this;
    }
}
