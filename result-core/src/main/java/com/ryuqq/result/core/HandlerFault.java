package com.ryuqq.result.core;

/**
 * 부수효과 핸들러가 던진 예외에 대한 기술.
 *
 * <p>{@link Result#onSuccess}, {@link Result#onFailure}, {@link Result#always}의 핸들러가
 * 예외를 던지면, 예외는 체인 밖으로 전파되지 않고 이 기술로 감싸져 faultMapper에 전달됩니다.
 * faultMapper가 반환한 값이 새 실패 Result의 실패 사유가 됩니다.</p>
 *
 * <p><strong>String 실패 타입 예시:</strong></p>
 * <pre>
 * Result&lt;Order, String&gt; result = placeOrder(request)
 *     .onSuccess(order -&gt; audit.record(order), HandlerFault::describe);
 * </pre>
 *
 * @param operation 핸들러를 실행한 연산 이름 (onSuccess, onFailure, onAlways)
 * @param cause 핸들러가 던진 예외
 *
 * @author Result Team
 * @since 1.0.0
 */
public record HandlerFault(
    String operation,
    Exception cause
) implements Displayable {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException operation이 null/blank이거나 cause가 null인 경우
     */
    public HandlerFault {
        if (operation == null || operation.isBlank()) {
            throw new IllegalArgumentException("operation cannot be null or blank");
        }
        Preconditions.checkNotNull(cause, "cause");
    }

    /**
     * 사람이 읽을 수 있는 기술 문자열.
     *
     * @return 예: {@code Result.onSuccess handler threw an error; error: boom}
     */
    public String describe() {
        return "Result." + operation + " handler threw an error; error: " + cause.getMessage();
    }

    @Override
    public String display() {
        return describe();
    }
}
