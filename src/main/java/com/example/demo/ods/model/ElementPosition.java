package com.example.demo.ods.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.OptionalInt;

/**
 * Logical position of a row, cell or column among its same-kind siblings.
 * Either part is absent when it was not requested.
 */
@EqualsAndHashCode
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ElementPosition {
    private final Integer ordinal;
    private final Integer count;

    public static ElementPosition of(Integer ordinal, Integer count) {
        return new ElementPosition(ordinal, count);
    }

    public OptionalInt ordinal() {
        return ordinal == null ? OptionalInt.empty() : OptionalInt.of(ordinal);
    }

    public OptionalInt count() {
        return count == null ? OptionalInt.empty() : OptionalInt.of(count);
    }
}
