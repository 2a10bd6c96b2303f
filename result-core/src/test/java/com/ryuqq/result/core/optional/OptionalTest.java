package com.ryuqq.result.core.optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Optional 테스트.
 *
 * @author Result Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class OptionalTest {

    @Mock
    private Consumer<String> consumer;

    @Test
    void of_ValidValue_IsNotEmpty() {
        // When
        Optional<String> optional = Optional.of("value");

        // Then
        assertTrue(optional.isNotEmpty());
        assertFalse(optional.isEmpty());
        assertEquals("value", optional.getOrElse("other"));
    }

    @Test
    void of_NullValue_ThrowsException() {
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class, () -> Optional.of(null));
        assertTrue(exception.getMessage().contains("value cannot be null"));
    }

    @Test
    void ofNullable_Null_IsEmpty() {
        // When
        Optional<String> optional = Optional.ofNullable(null);

        // Then
        assertTrue(optional.isEmpty());
        assertFalse(optional.isNotEmpty());
        assertEquals(Optional.empty(), optional);
    }

    @Test
    void empty_DifferentTypes_AreEqualAndEmpty() {
        // Given
        Optional<String> text = Optional.empty();
        Optional<Integer> number = Optional.empty();

        // When & Then
        assertTrue(text.isEmpty());
        assertEquals(text, number);
        assertEquals(text.hashCode(), number.hashCode());
    }

    @Test
    void empty_GetOrElse_ReturnsDefault() {
        assertEquals("default", Optional.<String>empty().getOrElse("default"));
    }

    @Test
    void getOrThrow_Present_ReturnsValue() {
        assertEquals(3, Optional.of(3).getOrThrow(IllegalStateException::new));
    }

    @Test
    void getOrThrow_Empty_ThrowsSuppliedException() {
        // Given
        Optional<Integer> optional = Optional.empty();

        // When & Then
        NoSuchElementException exception = assertThrows(
            NoSuchElementException.class,
            () -> optional.getOrThrow(() -> new NoSuchElementException("no value"))
        );
        assertEquals("no value", exception.getMessage());
    }

    @Test
    void map_Present_WrapsMappedValue() {
        assertEquals(Optional.of(5), Optional.of("hello").map(String::length));
    }

    @Test
    void map_MapperReturnsNull_BecomesEmpty() {
        // When
        Optional<String> mapped = Optional.of("hello").map(value -> null);

        // Then
        assertTrue(mapped.isEmpty());
    }

    @Test
    void map_Empty_StaysEmpty() {
        // Given
        List<String> calls = new ArrayList<>();

        // When
        Optional<Integer> mapped = Optional.<String>empty().map(value -> {
            calls.add(value);
            return value.length();
        });

        // Then
        assertTrue(mapped.isEmpty());
        assertTrue(calls.isEmpty());
    }

    @Test
    void filter_PredicateMet_KeepsValue() {
        assertEquals(Optional.of(10), Optional.of(10).filter(value -> value > 5));
    }

    @Test
    void filter_PredicateNotMet_BecomesEmpty() {
        assertTrue(Optional.of(3).filter(value -> value > 5).isEmpty());
    }

    @Test
    void filter_Empty_StaysEmpty() {
        assertTrue(Optional.<Integer>empty().filter(value -> true).isEmpty());
    }

    @Test
    void ifPresent_Present_InvokesConsumerAndReturnsThis() {
        // Given
        Optional<String> optional = Optional.of("value");

        // When
        Optional<String> result = optional.ifPresent(consumer);

        // Then
        assertSame(optional, result);
        verify(consumer).accept("value");
    }

    @Test
    void ifPresent_Empty_DoesNotInvokeConsumer() {
        // When
        Optional.<String>empty().ifPresent(consumer);

        // Then
        verifyNoInteractions(consumer);
    }

    @Test
    void ifPresent_ConsumerThrows_PropagatesException() {
        // Given
        Optional<String> optional = Optional.of("value");

        // When & Then
        assertThrows(IllegalStateException.class, () -> optional.ifPresent(value -> {
            throw new IllegalStateException("not caught");
        }));
    }

    @Test
    void equals_SameValues_ReturnsTrue() {
        assertEquals(Optional.of("a"), Optional.ofNullable("a"));
        assertNotEquals(Optional.of("a"), Optional.of("b"));
        assertNotEquals(Optional.of("a"), Optional.empty());
        assertEquals(Optional.of("a").hashCode(), Optional.of("a").hashCode());
    }

    @Test
    void toString_ShowsState() {
        assertEquals("Optional{value=a}", Optional.of("a").toString());
        assertEquals("Optional{empty}", Optional.empty().toString());
    }
}
