package com.ryuqq.result.core.optional;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

import static com.ryuqq.result.core.Preconditions.checkNotNull;

/**
 * 값의 존재/부재를 표현하는 불변 래퍼.
 *
 * <p>Result에서 실패 사유를 뺀 단순화된 형태입니다. 부재 여부는 보유한 참조가 null인지로만 결정됩니다.</p>
 *
 * <p><strong>생성 방법:</strong></p>
 * <ul>
 *   <li>{@link #of(Object)}: 반드시 존재하는 값</li>
 *   <li>{@link #ofNullable(Object)}: null일 수 있는 값</li>
 *   <li>{@link #empty()}: 빈 Optional</li>
 * </ul>
 *
 * <p>{@link #ifPresent(Consumer)}는 Result의 onSuccess와 달리 핸들러 예외를 잡지 않습니다.</p>
 *
 * @param <T> 값 타입
 *
 * @author Result Team
 * @since 1.0.0
 */
public final class Optional<T> {

    private final T value;

    private Optional(T value) {
        this.value = value;
    }

    /**
     * 존재하는 값으로 생성.
     *
     * @param value 값
     * @param <T> 값 타입
     * @return 값을 보유한 Optional
     * @throws IllegalArgumentException value가 null인 경우
     */
    public static <T> Optional<T> of(T value) {
        checkNotNull(value, "value");
        return new Optional<>(value);
    }

    /**
     * null일 수 있는 값으로 생성.
     *
     * @param value 값 (null 허용)
     * @param <T> 값 타입
     * @return value가 null이면 빈 Optional
     */
    public static <T> Optional<T> ofNullable(T value) {
        return value == null ? empty() : new Optional<>(value);
    }

    /**
     * @param <T> 값 타입
     * @return 빈 Optional
     */
    public static <T> Optional<T> empty() {
        return new Optional<>(null);
    }

    public boolean isEmpty() {
        return value == null;
    }

    public boolean isNotEmpty() {
        return value != null;
    }

    /**
     * @param defaultValue 비어 있을 때 반환할 값
     * @return 보유한 값 또는 defaultValue
     */
    public T getOrElse(T defaultValue) {
        return isNotEmpty() ? value : defaultValue;
    }

    /**
     * 보유한 값을 반환하고, 비어 있으면 supplier가 만든 예외를 던집니다.
     *
     * @param supplier 예외 공급자
     * @param <X> 예외 타입
     * @return 보유한 값
     * @throws X 비어 있는 경우
     */
    public <X extends Throwable> T getOrThrow(Supplier<? extends X> supplier) throws X {
        checkNotNull(supplier, "supplier");
        if (isNotEmpty()) {
            return value;
        }
        throw supplier.get();
    }

    /**
     * 값을 변환합니다. mapper가 null을 반환하면 빈 Optional이 됩니다.
     *
     * @param mapper 변환 함수
     * @param <U> 변환된 값 타입
     * @return 변환된 Optional
     */
    public <U> Optional<U> map(Function<? super T, ? extends U> mapper) {
        checkNotNull(mapper, "mapper");
        if (isNotEmpty()) {
            return ofNullable(mapper.apply(value));
        }
        return empty();
    }

    /**
     * predicate를 만족할 때만 값을 유지합니다.
     *
     * @param predicate 유지 조건
     * @return 필터링된 Optional
     */
    public Optional<T> filter(Predicate<? super T> predicate) {
        checkNotNull(predicate, "predicate");
        if (isNotEmpty() && predicate.test(value)) {
            return new Optional<>(value);
        }
        return empty();
    }

    /**
     * 값이 있을 때만 consumer를 호출합니다.
     *
     * @param consumer 값 consumer
     * @return this
     */
    public Optional<T> ifPresent(Consumer<? super T> consumer) {
        checkNotNull(consumer, "consumer");
        if (isNotEmpty()) {
            consumer.accept(value);
        }
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Optional<?> other)) {
            return false;
        }
        return Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return isNotEmpty() ? "Optional{value=" + value + "}" : "Optional{empty}";
    }
}
