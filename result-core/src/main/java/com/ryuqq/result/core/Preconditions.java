package com.ryuqq.result.core;

/**
 * 인자 검증 헬퍼.
 *
 * <p>모든 모듈이 같은 메시지 형식({@code "<name> cannot be null"})으로
 * {@link IllegalArgumentException}을 던지도록 검증 로직을 한곳에 둡니다.</p>
 *
 * @author Result Team
 * @since 1.0.0
 */
public final class Preconditions {

    private Preconditions() {
    }

    /**
     * @param value 검증 대상
     * @param name 파라미터 이름 (예외 메시지에 사용)
     * @param <T> 값 타입
     * @return value
     * @throws IllegalArgumentException value가 null인 경우
     */
    public static <T> T checkNotNull(T value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
        return value;
    }

    /**
     * 컬렉션 자체와 각 원소가 null이 아님을 검증합니다.
     *
     * @param values 검증 대상
     * @param name 파라미터 이름 (예외 메시지에 사용)
     * @param <T> 컬렉션 타입
     * @return values
     * @throws IllegalArgumentException values가 null이거나 null 원소를 포함하는 경우
     */
    public static <T extends Iterable<?>> T checkElementsNotNull(T values, String name) {
        checkNotNull(values, name);
        for (Object value : values) {
            if (value == null) {
                throw new IllegalArgumentException(name + " cannot contain null");
            }
        }
        return values;
    }
}
