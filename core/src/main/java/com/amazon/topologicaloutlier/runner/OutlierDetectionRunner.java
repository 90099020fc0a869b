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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.regex.Pattern;

import com.amazon.topologicaloutlier.TopologicalOutlierDetector;
import com.amazon.topologicaloutlier.distance.DynamicTimeWarpingDistance;
import com.amazon.topologicaloutlier.distance.IDistanceMetric;
import com.amazon.topologicaloutlier.distance.InterpolatedSeriesDistance;
import com.amazon.topologicaloutlier.inputtypes.TimeSeries;
import com.amazon.topologicaloutlier.returntypes.OutlierRanking;
import com.amazon.topologicaloutlier.returntypes.OutlierReport;

/**
 * Reads samples as {@code id,timestamp,value[,uncertainty]} rows, ranks the
 * series they form and writes {@code rank,id,score} rows. Rows of one series
 * may appear in any order and interleaved with rows of other series; series are
 * kept in the order in which they first appear.
 */
public class OutlierDetectionRunner {

    public static final List<String> RESULT_COLUMN_NAMES = List.of("rank", "id", "score");

    /**
     * Log4j 2 configuration used by the command line unless
     * {@code log4j2.configurationFile} is already set. The library jar ships no
     * {@code log4j2.xml}, so applications embedding it keep their own setup.
     */
    public static final String LOG_CONFIGURATION = "topologicaloutlier-runner-log4j2.xml";

    static final String LOG_CONFIGURATION_PROPERTY = "log4j2.configurationFile";

    protected final ArgumentParser argumentParser;
    protected final Map<String, List<double[]>> samples;
    protected int lineNumber;

    public OutlierDetectionRunner() {
        this(new ArgumentParser(OutlierDetectionRunner.class.getName(),
                "Rank time series by how anomalous each one is with respect to the others."));
    }

    public OutlierDetectionRunner(ArgumentParser argumentParser) {
        this.argumentParser = argumentParser;
        this.samples = new LinkedHashMap<>();
    }

    public static void main(String... args) throws IOException {
        useRunnerLogConfiguration();
        OutlierDetectionRunner runner = new OutlierDetectionRunner();
        runner.parse(args);
        System.err.println("Reading from stdin... (Ctrl-c to exit)");
        runner.run(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)));
        System.err.println("Done.");
    }

    static void useRunnerLogConfiguration() {
        if (System.getProperty(LOG_CONFIGURATION_PROPERTY) == null) {
            System.setProperty(LOG_CONFIGURATION_PROPERTY, LOG_CONFIGURATION);
        }
    }

    public void parse(String... arguments) {
        argumentParser.parse(arguments);
    }

    public void run(BufferedReader in, PrintWriter out) throws IOException {
        String line;
        while ((line = in.readLine()) != null) {
            lineNumber++;
            if (lineNumber == 1 && argumentParser.getHeaderRow()) {
                continue;
            }
            if (line.trim().isEmpty()) {
                continue;
            }
            processLine(line.split(Pattern.quote(argumentParser.getDelimiter())));
        }

        finish(out);
        out.flush();
    }

    protected void processLine(String[] values) {
        if (values.length != 3 && values.length != 4) {
            throw new IllegalArgumentException(
                    String.format("Wrong number of values on line %d. Expected 3 or 4 but found %d.", lineNumber,
                            values.length));
        }
        double[] sample = new double[3];
        sample[0] = Double.parseDouble(values[1].trim());
        sample[1] = Double.parseDouble(values[2].trim());
        sample[2] = values.length == 4 ? Double.parseDouble(values[3].trim()) : 0.0;
        samples.computeIfAbsent(values[0].trim(), k -> new ArrayList<>()).add(sample);
    }

    protected void finish(PrintWriter out) {
        OutlierReport report = createDetector().detect(buildSeries());
        OutlierRanking ranking = report.getRanking();
        int topK = argumentParser.getTopK() > 0 ? argumentParser.getTopK() : ranking.size();

        out.println(String.join(argumentParser.getDelimiter(), RESULT_COLUMN_NAMES));
        for (OutlierRanking.RankedItem item : ranking.topK(topK)) {
            StringJoiner joiner = new StringJoiner(argumentParser.getDelimiter());
            joiner.add(Integer.toString(item.getRank()));
            joiner.add(item.getId());
            joiner.add(Double.toString(item.getScore()));
            out.println(joiner.toString());
        }
    }

    protected List<TimeSeries> buildSeries() {
        List<TimeSeries> series = new ArrayList<>(samples.size());
        for (Map.Entry<String, List<double[]>> entry : samples.entrySet()) {
            List<double[]> rows = new ArrayList<>(entry.getValue());
            rows.sort(Comparator.comparingDouble(row -> row[0]));
            double[] timestamps = new double[rows.size()];
            double[] values = new double[rows.size()];
            double[] uncertainties = new double[rows.size()];
            for (int i = 0; i < rows.size(); i++) {
                timestamps[i] = rows.get(i)[0];
                values[i] = rows.get(i)[1];
                uncertainties[i] = rows.get(i)[2];
            }
            series.add(new TimeSeries(entry.getKey(), timestamps, values, uncertainties));
        }
        return series;
    }

    protected TopologicalOutlierDetector createDetector() {
        TopologicalOutlierDetector.Builder<?> builder = TopologicalOutlierDetector.builder()
                .distanceVariant(argumentParser.getDistanceVariant())
                .scoringStrategy(argumentParser.getScoringStrategy())
                .failurePolicy(argumentParser.getFailurePolicy())
                .queryTimestampCount(argumentParser.getQueryTimestampCount())
                .maxDimension(argumentParser.getMaxDimension()).maxDiameter(argumentParser.getMaxDiameter())
                .nearestNeighbors(argumentParser.getNearestNeighbors())
                .embeddingDimension(argumentParser.getEmbeddingDimension())
                .embeddingDelay(argumentParser.getEmbeddingDelay())
                .parallelExecutionEnabled(argumentParser.getParallelExecutionEnabled())
                .seriesMetric(seriesMetric());
        if (!Double.isNaN(argumentParser.getQueryStart())) {
            builder.queryStart(argumentParser.getQueryStart());
        }
        if (!Double.isNaN(argumentParser.getQueryEnd())) {
            builder.queryEnd(argumentParser.getQueryEnd());
        }
        if (argumentParser.getParallelExecutionEnabled() && argumentParser.getThreadPoolSize() > 0) {
            builder.threadPoolSize(argumentParser.getThreadPoolSize());
        }
        return builder.build();
    }

    protected IDistanceMetric<TimeSeries> seriesMetric() {
        switch (argumentParser.getSeriesMetric()) {
        case WEIGHTED_INTERPOLATED:
            return new InterpolatedSeriesDistance(true);
        case DTW:
            return new DynamicTimeWarpingDistance(argumentParser.getDtwBandFraction());
        default:
            return new InterpolatedSeriesDistance();
        }
    }
}
