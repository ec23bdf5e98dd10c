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

import static com.amazon.datacleaner.CommonUtils.checkArgument;
import static com.amazon.datacleaner.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;

import com.amazon.datacleaner.config.DetectorKind;
import com.amazon.datacleaner.config.Inclusive;
import com.amazon.datacleaner.config.Sided;
import com.amazon.datacleaner.config.TransformMethod;

/**
 * A utility class for parsing command-line arguments.
 */
public class ArgumentParser {

    public static final String ARCHIVE_NAME = "target/datacleaner-core-1.0.jar";

    /**
     * detection methods the command line can drive
     */
    public static final Set<DetectorKind> SUPPORTED_METHODS = Collections.unmodifiableSet(
            EnumSet.of(DetectorKind.BOUNDED, DetectorKind.QUANTILES, DetectorKind.IQR, DetectorKind.ZSCORE,
                    DetectorKind.MODZSCORE, DetectorKind.COUNTS, DetectorKind.KEY_COLLISION, DetectorKind.EMAIL,
                    DetectorKind.URL, DetectorKind.SPACES, DetectorKind.OUTLIERS));

    private final String runnerClass;
    private final String runnerDescription;
    private final Map<String, Argument<?>> shortFlags;
    private final Map<String, Argument<?>> longFlags;
    private final Argument<DetectorKind> method;
    private final StringArgument columns;
    private final DoubleArgument threshold;
    private final DoubleArgument lower;
    private final DoubleArgument upper;
    private final Argument<Inclusive> inclusive;
    private final Argument<Sided> sided;
    private final Argument<TransformMethod> transform;
    private final StringArgument delimiter;

    /**
     * Create a new ArgumentParser. The runner class and runner description
     * will be used in help text.
     *
     * @param runnerClass       The name of the runner class where this argument
     *                          parser is being invoked.
     * @param runnerDescription A description of the runner class where this
     *                          argument parser is being invoked.
     */
    public ArgumentParser(String runnerClass, String runnerDescription) {
        this.runnerClass = runnerClass;
        this.runnerDescription = runnerDescription;
        shortFlags = new HashMap<>();
        longFlags = new HashMap<>();

        method = new Argument<>("-m", "--method", "Detection method: " + SUPPORTED_METHODS + ".", DetectorKind.ZSCORE,
                DetectorKind::fromName,
                kind -> checkArgument(SUPPORTED_METHODS.contains(kind),
                        kind + " is not available from the command line"));
        addArgument(method);

        columns = new StringArgument("-c", "--columns",
                "Comma separated names of the columns to inspect, "
                        + "empty for the first column (all numerical columns with outliers).",
                "");
        addArgument(columns);

        threshold = new DoubleArgument("-t", "--threshold",
                "Threshold of iqr, zscore and modzscore, NaN for the method default.", Double.NaN,
                t -> checkArgument(Double.isNaN(t) || t >= 0, "threshold should be >= 0"));
        addArgument(threshold);

        lower = new DoubleArgument(null, "--lower",
                "Lower bound of bounded, or lower quantile of quantiles. NaN when not restricted.", Double.NaN);
        addArgument(lower);

        upper = new DoubleArgument(null, "--upper",
                "Upper bound of bounded, or upper quantile of quantiles. NaN when not restricted.", Double.NaN);
        addArgument(upper);

        inclusive = new Argument<>(null, "--inclusive",
                "Bounds included in the valid range: both, neither, left, right.", Inclusive.BOTH,
                Inclusive::fromName);
        addArgument(inclusive);

        sided = new Argument<>(null, "--sided", "Sides checked by iqr, zscore and modzscore: both, left, right.",
                Sided.BOTH, Sided::fromName);
        addArgument(sided);

        transform = new Argument<>(null, "--transform",
                "Power transform applied before iqr, zscore and modzscore: none, box_cox, yeo_johnson.",
                TransformMethod.NONE, TransformMethod::fromName);
        addArgument(transform);

        delimiter = new StringArgument("-d", "--delimiter", "The character or string used as a field delimiter.", ",",
                d -> checkArgument(!d.isEmpty(), "delimiter should not be empty"));
        addArgument(delimiter);
    }

    /**
     * Add a new argument to this argument parser.
     *
     * @param argument An Argument instance for a command-line argument that
     *                 should be parsed.
     */
    protected void addArgument(Argument<?> argument) {
        checkNotNull(argument, "argument should not be null");

        checkArgument(argument.getShortFlag() == null || !shortFlags.containsKey(argument.getShortFlag()),
                String.format("An argument mapping already exists for %s", argument.getShortFlag()));

        checkArgument(!longFlags.containsKey(argument.getLongFlag()),
                String.format("An argument mapping already exists for %s", argument.getLongFlag()));

        if (argument.getShortFlag() != null) {
            shortFlags.put(argument.getShortFlag(), argument);
        }

        longFlags.put(argument.getLongFlag(), argument);
    }

    /**
     * Parse the given array of command-line arguments.
     *
     * @param arguments An array of command-line arguments.
     */
    public void parse(String... arguments) {
        int i = 0;
        while (i < arguments.length) {
            String flag = arguments[i];

            try {
                if (shortFlags.containsKey(flag)) {
                    shortFlags.get(flag).parse(arguments[++i]);
                } else if (longFlags.containsKey(flag)) {
                    longFlags.get(flag).parse(arguments[++i]);
                } else if ("-h".equals(flag) || "--help".equals(flag)) {
                    printUsage();
                    Runtime.getRuntime().exit(0);
                } else {
                    throw new IllegalArgumentException("Unknown argument: " + flag);
                }
            } catch (Exception e) {
                printUsageAndExit("%s: %s", e.getClass().getName(), e.getMessage());
            }

            i++;
        }
    }

    /**
     * Print a usage message to STDOUT.
     */
    public void printUsage() {
        System.out.println(String.format("Usage: java -cp %s %s [options] < input_file > output_file", ARCHIVE_NAME,
                runnerClass));
        System.out.println();
        System.out.println(runnerDescription);
        System.out.println();
        System.out.println("Options:");

        longFlags.values().stream().map(Argument::getHelpMessage).sorted()
                .forEach(msg -> System.out.println("\t" + msg));

        System.out.println();
        System.out.println("\t--help, -h: Print this help message and exit.");
    }

    /**
     * Print an error message, the usage message, and exit the application.
     *
     * @param errorMessage  An error message to show the user.
     * @param formatObjects An array of format objects that will be interpolated
     *                      into the error message using {@link String#format}.
     */
    public void printUsageAndExit(String errorMessage, Object... formatObjects) {
        System.err.println("Error: " + String.format(errorMessage, formatObjects));
        printUsage();
        System.exit(1);
    }

    /**
     * @return the user-specified detection method
     */
    public DetectorKind getMethod() {
        return method.getValue();
    }

    /**
     * @return the user-specified column names, empty when none was given
     */
    public List<String> getColumns() {
        List<String> names = new ArrayList<>();
        for (String name : Arrays.asList(columns.getValue().split(","))) {
            if (!name.trim().isEmpty()) {
                names.add(name.trim());
            }
        }
        return names;
    }

    /**
     * @return the user-specified threshold, NaN when not given
     */
    public double getThreshold() {
        return threshold.getValue();
    }

    public double getLower() {
        return lower.getValue();
    }

    public double getUpper() {
        return upper.getValue();
    }

    public Inclusive getInclusive() {
        return inclusive.getValue();
    }

    public Sided getSided() {
        return sided.getValue();
    }

    public TransformMethod getTransform() {
        return transform.getValue();
    }

    /**
     * @return the user-specified value of the delimiter parameter
     */
    public String getDelimiter() {
        return delimiter.getValue();
    }

    public static class Argument<T> {

        private final String shortFlag;
        private final String longFlag;
        private final String description;
        private final T defaultValue;
        private final Function<String, T> parseFunction;
        private final Consumer<T> validateFunction;
        private T value;

        public Argument(String shortFlag, String longFlag, String description, T defaultValue,
                Function<String, T> parseFunction, Consumer<T> validateFunction) {
            this.shortFlag = shortFlag;
            this.longFlag = longFlag;
            this.description = description;
            this.defaultValue = defaultValue;
            this.parseFunction = parseFunction;
            this.validateFunction = validateFunction;
            value = defaultValue;
        }

        public Argument(String shortFlag, String longFlag, String description, T defaultValue,
                Function<String, T> parseFunction) {
            this(shortFlag, longFlag, description, defaultValue, parseFunction, t -> {
            });
        }

        public String getShortFlag() {
            return shortFlag;
        }

        public String getLongFlag() {
            return longFlag;
        }

        public String getDescription() {
            return description;
        }

        public T getDefaultValue() {
            return defaultValue;
        }

        public String getHelpMessage() {
            if (shortFlag != null) {
                return String.format("%s, %s: %s (default: %s)", longFlag, shortFlag, description, defaultValue);
            } else {
                return String.format("%s: %s (default: %s)", longFlag, description, defaultValue);
            }
        }

        public void parse(String string) {
            value = parseFunction.apply(string);
            validateFunction.accept(value);
        }

        public T getValue() {
            return value;
        }
    }

    public static class StringArgument extends Argument<String> {
        public StringArgument(String shortFlag, String longFlag, String description, String defaultValue,
                Consumer<String> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, x -> x, validateFunction);
        }

        public StringArgument(String shortFlag, String longFlag, String description, String defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, x -> x);
        }
    }

    public static class DoubleArgument extends Argument<Double> {
        public DoubleArgument(String shortFlag, String longFlag, String description, double defaultValue,
                Consumer<Double> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, Double::parseDouble, validateFunction);
        }

        public DoubleArgument(String shortFlag, String longFlag, String description, double defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, Double::parseDouble);
        }
    }
}
