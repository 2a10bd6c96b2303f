package com.ryuqq.result.core;

/**
 * 사람이 읽을 수 있는 문자열로 변환 가능한 실패 사유.
 *
 * <p>실패 사유를 문자열로 바꿔야 하는 지점({@link Result#getOrThrow()})에서 사용됩니다.
 * 이 인터페이스를 구현하지 않은 실패 사유는 {@link String#valueOf(Object)}로 표시됩니다.</p>
 *
 * @author Result Team
 * @since 1.0.0
 */
public interface Displayable {

    /**
     * @return 표시 문자열
     */
    String display();

    /**
     * 실패 사유의 표시 문자열.
     *
     * @param failure 실패 사유
     * @return Displayable이면 {@link #display()}, 아니면 {@link String#valueOf(Object)}
     */
    static String render(Object failure) {
        if (failure instanceof Displayable displayable) {
            return displayable.display();
        }
        return String.valueOf(failure);
    }
}
