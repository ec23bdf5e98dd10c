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

package com.amazon.datacleaner.detection.types;

import static com.amazon.datacleaner.CommonUtils.checkArgument;
import static com.amazon.datacleaner.CommonUtils.checkNotNull;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

import lombok.extern.slf4j.Slf4j;

import com.amazon.datacleaner.config.CastTarget;
import com.amazon.datacleaner.config.DetectorKind;
import com.amazon.datacleaner.detection.AbstractColumnDetector;
import com.amazon.datacleaner.detection.IncompatibleDataException;
import com.amazon.datacleaner.frame.Column;
import com.amazon.datacleaner.frame.DataType;

/**
 * Flags the text values that can not be read as the target type. Numbers may
 * carry custom thousands and decimal separators. Booleans are matched against
 * an explicit table of spellings and dates against a list of patterns.
 */
@Slf4j
public class CastableDetector extends AbstractColumnDetector {

    public static final List<String> DEFAULT_DATE_FORMATS = Collections.unmodifiableList(Arrays.asList(
            "uuuu-MM-dd", "uuuu-MM-dd HH:mm:ss", "uuuu-MM-dd'T'HH:mm:ss", "uuuu-MM-dd'T'HH:mm:ss.SSS",
            "uuuu/MM/dd", "dd/MM/uuuu", "MM/dd/uuuu", "dd-MM-uuuu", "dd.MM.uuuu", "d MMM uuuu", "MMM d, uuuu"));

    public static final Map<String, Boolean> DEFAULT_BOOL_VALUES;

    static {
        Map<String, Boolean> values = new LinkedHashMap<>();
        values.put("True", true);
        values.put("False", false);
        DEFAULT_BOOL_VALUES = Collections.unmodifiableMap(values);
    }

    private static final Pattern NUMBER = Pattern
            .compile("[+-]?(((\\d+(\\.\\d*)?)|(\\.\\d+))([eE][+-]?\\d+)?|inf|infinity)", Pattern.CASE_INSENSITIVE);

    private final CastTarget target;

    private final String thousands;

    private final String decimal;

    private final Map<String, Boolean> boolValues;

    private final List<String> dateFormats;

    private final List<DateTimeFormatter> formatters;

    private CastableDetector(Column data, CastTarget target, String thousands, String decimal,
            Map<String, Boolean> boolValues, List<String> dateFormats) {
        super(data);
        if (data.getDtype() != DataType.OBJECT && data.count() > 0) {
            throw new IncompatibleDataException("This detector is only for object columns");
        }
        this.target = checkNotNull(target, "Target parameter must be defined");
        checkArgument(target != CastTarget.DATE || (thousands == null && decimal == null),
                "Thousands/decimal separator parameter is not necessary to check if value is castable to date");
        this.thousands = thousands;
        this.decimal = decimal;
        this.boolValues = boolValues == null ? DEFAULT_BOOL_VALUES : boolValues;
        this.dateFormats = dateFormats == null ? DEFAULT_DATE_FORMATS : dateFormats;
        this.formatters = new ArrayList<>();
        for (String format : this.dateFormats) {
            formatters.add(DateTimeFormatter.ofPattern(format, Locale.ENGLISH).withResolverStyle(ResolverStyle.STRICT));
        }
    }

    public static CastableDetector fromData(CastableConfig config, Column data) {
        return new CastableDetector(data, config.getTarget(), config.getThousands(), config.getDecimal(),
                config.getBoolValues(), config.getDateFormats());
    }

    public static CastableDetector fromDetector(CastableDetector source, Column data) {
        return new CastableDetector(data, source.target, source.thousands, source.decimal, source.boolValues,
                source.dateFormats);
    }

    @Override
    protected boolean isErrorValue(Object value) {
        String text = value.toString();
        switch (target) {
        case INT:
            return !isInteger(text);
        case FLOAT:
            return parseNumber(text) == null;
        case DATE:
            return !isDate(text);
        default:
            return !boolValues.containsKey(text);
        }
    }

    private Double parseNumber(String text) {
        String normalized = text.trim();
        if (thousands != null) {
            normalized = normalized.replace(thousands, "");
        }
        if (decimal != null) {
            normalized = normalized.replace(decimal, ".");
        }
        if (!NUMBER.matcher(normalized).matches()) {
            return null;
        }
        String lower = normalized.toLowerCase(Locale.ROOT);
        if (lower.endsWith("inf") || lower.endsWith("infinity")) {
            return lower.startsWith("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        return Double.parseDouble(normalized);
    }

    private boolean isInteger(String text) {
        Double number = parseNumber(text);
        return number != null && !Double.isInfinite(number) && number == Math.rint(number);
    }

    private boolean isDate(String text) {
        String trimmed = text.trim();
        for (DateTimeFormatter formatter : formatters) {
            try {
                formatter.parseBest(trimmed, LocalDateTime::from, LocalDate::from);
                return true;
            } catch (DateTimeParseException e) {
                log.trace("'{}' does not match {}", trimmed, formatter);
            }
        }
        return false;
    }

    public CastTarget getTarget() {
        return target;
    }

    public String getThousands() {
        return thousands;
    }

    public String getDecimal() {
        return decimal;
    }

    public Map<String, Boolean> getBoolValues() {
        return boolValues;
    }

    public List<String> getDateFormats() {
        return dateFormats;
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.CASTABLE;
    }
}
