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

package com.amazon.topologicaloutlier.runner;

import static com.amazon.topologicaloutlier.CommonUtils.checkArgument;
import static com.amazon.topologicaloutlier.CommonUtils.checkNotNull;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;

import com.amazon.topologicaloutlier.config.DistanceVariant;
import com.amazon.topologicaloutlier.config.FailurePolicy;
import com.amazon.topologicaloutlier.config.ScoringStrategy;

/**
 * A utility class for parsing command-line arguments.
 */
public class ArgumentParser {

    public static final String ARCHIVE_NAME = "target/topological-outlier-core-1.0.0.jar";

    /**
     * Metrics that can compare raw series from the command line.
     */
    public enum SeriesMetric {
        INTERPOLATED, WEIGHTED_INTERPOLATED, DTW
    }

    private final String runnerClass;
    private final String runnerDescription;
    private final Map<String, Argument<?>> shortFlags;
    private final Map<String, Argument<?>> longFlags;
    private final Argument<DistanceVariant> distanceVariant;
    private final Argument<ScoringStrategy> scoringStrategy;
    private final Argument<FailurePolicy> failurePolicy;
    private final Argument<SeriesMetric> seriesMetric;
    private final DoubleArgument dtwBandFraction;
    private final IntegerArgument queryTimestampCount;
    private final DoubleArgument queryStart;
    private final DoubleArgument queryEnd;
    private final IntegerArgument maxDimension;
    private final DoubleArgument maxDiameter;
    private final IntegerArgument nearestNeighbors;
    private final IntegerArgument embeddingDimension;
    private final IntegerArgument embeddingDelay;
    private final BooleanArgument parallelExecutionEnabled;
    private final IntegerArgument threadPoolSize;
    private final IntegerArgument topK;
    private final StringArgument delimiter;
    private final BooleanArgument headerRow;

    /**
     * Create a new ArgumentParser. The runner class and runner description will
     * be used in help text.
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

        distanceVariant = new Argument<>("-v", "--distance-variant",
                "What is compared between series: RAW_SERIES, WASSERSTEIN_GP or DIAGRAM_DISTANCE.",
                DistanceVariant.RAW_SERIES, s -> DistanceVariant.valueOf(s.toUpperCase(Locale.ROOT)));

        addArgument(distanceVariant);

        scoringStrategy = new Argument<>("-s", "--scoring-strategy",
                "How series are scored: MIN_INCIDENT_EDGE, MAX_INCIDENT_EDGE, TREE_ECCENTRICITY, DIAGRAM_BULK"
                        + " or MEDOID_DISTANCE.",
                ScoringStrategy.MIN_INCIDENT_EDGE, s -> ScoringStrategy.valueOf(s.toUpperCase(Locale.ROOT)));

        addArgument(scoringStrategy);

        failurePolicy = new Argument<>("-f", "--failure-policy",
                "What to do with a series whose fit diverges: ABORT or EXCLUDE.", FailurePolicy.ABORT,
                s -> FailurePolicy.valueOf(s.toUpperCase(Locale.ROOT)));

        addArgument(failurePolicy);

        seriesMetric = new Argument<>("-m", "--series-metric",
                "Metric for RAW_SERIES: INTERPOLATED, WEIGHTED_INTERPOLATED or DTW.", SeriesMetric.INTERPOLATED,
                s -> SeriesMetric.valueOf(s.toUpperCase(Locale.ROOT)));

        addArgument(seriesMetric);

        dtwBandFraction = new DoubleArgument(null, "--dtw-band",
                "Half width of the Sakoe-Chiba band as a fraction of the longer series.", 1.0,
                x -> checkArgument(x > 0 && x <= 1, "dtw band should be in (0, 1]"));

        addArgument(dtwBandFraction);

        queryTimestampCount = new IntegerArgument("-q", "--query-timestamp-count",
                "Number of query timestamps at which fitted posteriors are compared.", 32,
                n -> checkArgument(n > 0, "query timestamp count should be greater than 0"));

        addArgument(queryTimestampCount);

        queryStart = new DoubleArgument(null, "--query-start",
                "First query timestamp, or NaN to start with the earliest sample.", Double.NaN);

        addArgument(queryStart);

        queryEnd = new DoubleArgument(null, "--query-end",
                "Last query timestamp, or NaN to end with the latest sample.", Double.NaN);

        addArgument(queryEnd);

        maxDimension = new IntegerArgument("-D", "--max-dimension",
                "Largest homological dimension of the persistence diagrams.", 1,
                n -> checkArgument(n >= 0, "max dimension should be non-negative"));

        addArgument(maxDimension);

        maxDiameter = new DoubleArgument(null, "--max-diameter", "Largest diameter of a simplex in a filtration.",
                Double.POSITIVE_INFINITY, x -> checkArgument(x >= 0, "max diameter should be non-negative"));

        addArgument(maxDiameter);

        nearestNeighbors = new IntegerArgument("-k", "--nearest-neighbors",
                "Only connect each series to its k nearest neighbors in the spanning tree, or 0 for all pairs.", 0,
                n -> checkArgument(n >= 0, "nearest neighbors should be non-negative"));

        addArgument(nearestNeighbors);

        embeddingDimension = new IntegerArgument("-e", "--embedding-dimension",
                "Delay embedding dimension for DIAGRAM_DISTANCE.", 2,
                n -> checkArgument(n > 0, "embedding dimension should be greater than 0"));

        addArgument(embeddingDimension);

        embeddingDelay = new IntegerArgument(null, "--embedding-delay", "Delay embedding lag for DIAGRAM_DISTANCE.",
                1, n -> checkArgument(n > 0, "embedding delay should be greater than 0"));

        addArgument(embeddingDelay);

        parallelExecutionEnabled = new BooleanArgument("-p", "--parallel-execution-enabled",
                "Set to 'true' to fit and compare series on a thread pool.", false);

        addArgument(parallelExecutionEnabled);

        threadPoolSize = new IntegerArgument("-t", "--thread-pool-size",
                "Number of threads when parallel execution is enabled, or 0 for the number of processors.", 0,
                n -> checkArgument(n >= 0, "thread pool size should be non-negative"));

        addArgument(threadPoolSize);

        topK = new IntegerArgument(null, "--top-k", "Number of ranked series to print, or 0 for all of them.", 0,
                n -> checkArgument(n >= 0, "top k should be non-negative"));

        addArgument(topK);

        delimiter = new StringArgument("-d", "--delimiter", "The character or string used as a field delimiter.",
                ",");

        addArgument(delimiter);

        headerRow = new BooleanArgument(null, "--header-row", "Set to 'true' if the data contains a header row.",
                false);

        addArgument(headerRow);
    }

    /**
     * Add a new argument to this argument parser.
     *
     * @param argument An Argument instance for a command-line argument that should
     *                 be parsed.
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
        System.out.println(
                String.format("Usage: java -cp %s %s [options] < input_file > output_file", ARCHIVE_NAME, runnerClass));
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

    public DistanceVariant getDistanceVariant() {
        return distanceVariant.getValue();
    }

    public ScoringStrategy getScoringStrategy() {
        return scoringStrategy.getValue();
    }

    public FailurePolicy getFailurePolicy() {
        return failurePolicy.getValue();
    }

    public SeriesMetric getSeriesMetric() {
        return seriesMetric.getValue();
    }

    public double getDtwBandFraction() {
        return dtwBandFraction.getValue();
    }

    public int getQueryTimestampCount() {
        return queryTimestampCount.getValue();
    }

    /**
     * @return the user-specified first query timestamp, NaN if unset
     */
    public double getQueryStart() {
        return queryStart.getValue();
    }

    /**
     * @return the user-specified last query timestamp, NaN if unset
     */
    public double getQueryEnd() {
        return queryEnd.getValue();
    }

    public int getMaxDimension() {
        return maxDimension.getValue();
    }

    public double getMaxDiameter() {
        return maxDiameter.getValue();
    }

    public int getNearestNeighbors() {
        return nearestNeighbors.getValue();
    }

    public int getEmbeddingDimension() {
        return embeddingDimension.getValue();
    }

    public int getEmbeddingDelay() {
        return embeddingDelay.getValue();
    }

    public boolean getParallelExecutionEnabled() {
        return parallelExecutionEnabled.getValue();
    }

    /**
     * @return the user-specified thread pool size, 0 for the default
     */
    public int getThreadPoolSize() {
        return threadPoolSize.getValue();
    }

    /**
     * @return the number of ranked series to print, 0 for all
     */
    public int getTopK() {
        return topK.getValue();
    }

    /**
     * @return the user-specified value of the delimiter parameter
     */
    public String getDelimiter() {
        return delimiter.getValue();
    }

    /**
     * @return the user-specified value of the header-row parameter
     */
    public boolean getHeaderRow() {
        return headerRow.getValue();
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

    public static class BooleanArgument extends Argument<Boolean> {
        public BooleanArgument(String shortFlag, String longFlag, String description, boolean defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, Boolean::parseBoolean);
        }
    }

    public static class IntegerArgument extends Argument<Integer> {
        public IntegerArgument(String shortFlag, String longFlag, String description, int defaultValue,
                Consumer<Integer> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, Integer::parseInt, validateFunction);
        }

        public IntegerArgument(String shortFlag, String longFlag, String description, int defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, Integer::parseInt);
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
