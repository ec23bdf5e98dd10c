/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.datacleaner;

import java.util.Locale;
import java.util.Objects;

/** A collection of common utility functions. */
public class CommonUtils {

    private CommonUtils() {
    }

    /**
     * Throws an {@link IllegalArgumentException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalArgumentException} if {@code condition} is
     *                  false.
     * @throws IllegalArgumentException if {@code condition} is false.
     */
    public static void checkArgument(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Throws an {@link IllegalStateException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalStateException} if {@code condition} is
     *                  false.
     * @throws IllegalStateException if {@code condition} is false.
     */
    public static void checkState(boolean condition, String message) {
        if (!condition) {
            throw new IllegalStateException(message);
        }
    }

    /**
     * Throws a {@link NullPointerException} with the specified message if the
     * specified input is null.
     *
     * @param <T>     An arbitrary type.
     * @param object  An object reference to test for nullity.
     * @param message The error message to include in the
     *                {@code NullPointerException} if {@code object} is null.
     * @return {@code object} if not null.
     * @throws NullPointerException if the supplied object is null.
     */
    public static <T> T checkNotNull(T object, String message) {
        Objects.requireNonNull(object, message);
        return object;
    }

    /**
     * A cell is missing when it is null or a floating point NaN.
     *
     * @param value a cell value
     * @return true if the value is a missing marker
     */
    public static boolean isMissing(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Double) {
            return ((Double) value).isNaN();
        }
        if (value instanceof Float) {
            return ((Float) value).isNaN();
        }
        return false;
    }

    /**
     * @param value a cell value
     * @return true for numbers, booleans excluded
     */
    public static boolean isNumber(Object value) {
        return value instanceof Number;
    }

    /**
     * Key under which cell values are compared: numbers are equal when their
     * double values are, so that 5 and 5.0 fall together.
     *
     * @param value a cell value
     * @return the comparison key
     */
    public static Object valueKey(Object value) {
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            return d == 0 ? 0.0 : d;
        }
        return value;
    }

    /**
     * Parses an option name into an enum constant. The comparison ignores case,
     * underscores and dashes so that "box-cox", "boxcox" and "BOX_COX" all name
     * the same constant.
     *
     * @param type the enum class
     * @param name the name given by the caller
     * @param <E>  the enum type
     * @return the matching constant
     * @throws IllegalArgumentException if no constant matches
     */
    public static <E extends Enum<E>> E parseEnum(Class<E> type, String name) {
        checkNotNull(name, type.getSimpleName() + " name must not be null");
        String normalized = normalizeName(name);
        for (E constant : type.getEnumConstants()) {
            if (normalizeName(constant.name()).equals(normalized)) {
                return constant;
            }
        }
        StringBuilder options = new StringBuilder();
        for (E constant : type.getEnumConstants()) {
            if (options.length() > 0) {
                options.append(", ");
            }
            options.append(constant.name().toLowerCase(Locale.ROOT));
        }
        throw new IllegalArgumentException(
                String.format("%s must be one of %s, found '%s'", type.getSimpleName(), options, name));
    }

    private static String normalizeName(String name) {
        return name.replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
    }
}
