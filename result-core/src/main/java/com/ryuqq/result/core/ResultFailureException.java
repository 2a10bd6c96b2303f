package com.ryuqq.result.core;

/**
 * 실패 Result에서 {@link Result#getOrThrow()}를 호출했을 때 던져지는 예외.
 *
 * <p>메시지는 실패 사유의 표시 문자열이며, 원래 실패 사유는 {@link #getFailure()}로 조회할 수 있습니다.</p>
 *
 * @author Result Team
 * @since 1.0.0
 */
public class ResultFailureException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient Object failure;

    /**
     * 생성자.
     *
     * @param message 예외 메시지
     * @param failure 실패 사유
     */
    public ResultFailureException(String message, Object failure) {
        super(message);
        this.failure = failure;
    }

    /**
     * 실패 사유 조회.
     *
     * @return 실패 사유 (역직렬화된 경우 null)
     */
    public Object getFailure() {
        return failure;
    }
}
