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

package com.amazon.datacleaner.runner;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import lombok.extern.slf4j.Slf4j;

import com.amazon.datacleaner.config.DetectorKind;
import com.amazon.datacleaner.detection.DetectorConfig;
import com.amazon.datacleaner.detection.Detectors;
import com.amazon.datacleaner.detection.IDetector;
import com.amazon.datacleaner.detection.bound.BoundedConfig;
import com.amazon.datacleaner.detection.bound.QuantilesConfig;
import com.amazon.datacleaner.detection.gaussian.GaussianConfig;
import com.amazon.datacleaner.frame.Column;
import com.amazon.datacleaner.frame.DataType;
import com.amazon.datacleaner.frame.Table;
import com.amazon.datacleaner.returntypes.ErrorMask;

/**
 * Reads delimited text with a header row, runs one detection method on the
 * selected columns and writes every input line back with an extra
 * {@code is_error} column.
 */
@Slf4j
public class DetectionRunner {

    public static final String RESULT_COLUMN = "is_error";

    protected final ArgumentParser argumentParser;

    public DetectionRunner() {
        this(new ArgumentParser(DetectionRunner.class.getName(),
                "Flag the erroneous rows of a delimited file with a detection method."));
    }

    public DetectionRunner(ArgumentParser argumentParser) {
        this.argumentParser = argumentParser;
    }

    public static void main(String[] args) throws IOException {
        DetectionRunner runner = new DetectionRunner();
        runner.parse(args);
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        PrintWriter out = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
        runner.run(in, out);
    }

    public void parse(String... arguments) {
        argumentParser.parse(arguments);
    }

    public void run(BufferedReader in, PrintWriter out) throws IOException {
        String delimiter = argumentParser.getDelimiter();
        String header = in.readLine();
        if (header == null) {
            out.flush();
            return;
        }
        String[] names = split(header, delimiter);
        List<String> lines = new ArrayList<>();
        List<String[]> rows = new ArrayList<>();
        String line;
        while ((line = in.readLine()) != null) {
            String[] values = split(line, delimiter);
            if (values.length != names.length) {
                throw new IllegalArgumentException(
                        String.format("Wrong number of values on line %d. Expected %d but found %d.", lines.size() + 2,
                                names.length, values.length));
            }
            lines.add(line);
            rows.add(values);
        }

        ErrorMask mask = detect(readTable(names, rows));
        out.println(header + delimiter + RESULT_COLUMN);
        for (int i = 0; i < lines.size(); i++) {
            out.println(lines.get(i) + delimiter + mask.get(i));
        }
        out.flush();
    }

    protected ErrorMask detect(Table table) {
        DetectorKind kind = argumentParser.getMethod();
        DetectorConfig config = buildConfig(kind);
        List<String> selected = argumentParser.getColumns();
        if (kind == DetectorKind.OUTLIERS) {
            Table data = selected.isEmpty() ? new Table(table.getColumns(DataType.NUMERIC)) : table.select(selected);
            return Detectors.fromData(kind, config, data).isError();
        }
        if (selected.size() > 1) {
            return Detectors.fromData(kind, config, table.select(selected)).isError();
        }
        Column column = selected.isEmpty() ? table.getColumns().get(0) : table.getColumn(selected.get(0));
        IDetector<Column> detector = Detectors.fromData(kind, config, column);
        log.info("{} flagged {} of {} rows", kind, detector.getNErrors(), column.size());
        return detector.isError();
    }

    protected DetectorConfig buildConfig(DetectorKind kind) {
        double lower = argumentParser.getLower();
        double upper = argumentParser.getUpper();
        switch (kind) {
        case BOUNDED:
            return BoundedConfig.builder().lower(Double.isNaN(lower) ? Double.NEGATIVE_INFINITY : lower)
                    .upper(Double.isNaN(upper) ? Double.POSITIVE_INFINITY : upper)
                    .inclusive(argumentParser.getInclusive()).build();
        case QUANTILES:
            return QuantilesConfig.builder().lowerq(Double.isNaN(lower) ? 0 : lower)
                    .upperq(Double.isNaN(upper) ? 1 : upper).inclusive(argumentParser.getInclusive()).build();
        case IQR:
        case ZSCORE:
        case MODZSCORE:
            GaussianConfig.Builder<?> builder = GaussianConfig.builder().inclusive(argumentParser.getInclusive())
                    .sided(argumentParser.getSided()).transform(argumentParser.getTransform());
            if (!Double.isNaN(argumentParser.getThreshold())) {
                builder.threshold(argumentParser.getThreshold());
            }
            return builder.build();
        default:
            return null;
        }
    }

    /**
     * Builds the table from the text cells. A column is numeric when every
     * non-empty cell parses as a number. Empty cells are missing.
     */
    static Table readTable(String[] names, List<String[]> rows) {
        List<Column> columns = new ArrayList<>();
        for (int j = 0; j < names.length; j++) {
            List<Object> numbers = new ArrayList<>(rows.size());
            List<Object> texts = new ArrayList<>(rows.size());
            boolean numeric = true;
            for (String[] row : rows) {
                String cell = row[j].trim();
                if (cell.isEmpty()) {
                    numbers.add(null);
                    texts.add(null);
                    continue;
                }
                texts.add(row[j]);
                if (numeric) {
                    try {
                        numbers.add(Double.parseDouble(cell));
                    } catch (NumberFormatException e) {
                        numeric = false;
                    }
                }
            }
            columns.add(numeric ? new Column(names[j], numbers, Column.defaultIndex(rows.size()), DataType.NUMERIC)
                    : new Column(names[j], texts, Column.defaultIndex(rows.size()), DataType.OBJECT));
        }
        return new Table(columns);
    }

    private static String[] split(String line, String delimiter) {
        return line.split(Pattern.quote(delimiter), -1);
    }
}
