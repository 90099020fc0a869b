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


package com.amazon.topologicaloutlier;

import static com.amazon.topologicaloutlier.TestUtils.toTimeSeries;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import com.amazon.topologicaloutlier.config.DistanceVariant;
import com.amazon.topologicaloutlier.config.FailurePolicy;
import com.amazon.topologicaloutlier.config.ScoringStrategy;
import com.amazon.topologicaloutlier.distance.GaussianWassersteinDistance;
import com.amazon.topologicaloutlier.errors.FitDivergenceException;
import com.amazon.topologicaloutlier.errors.InsufficientDataException;
import com.amazon.topologicaloutlier.fitting.GaussianProcessFitter;
import com.amazon.topologicaloutlier.fitting.IProcessFitter;
import com.amazon.topologicaloutlier.inputtypes.TimeSeries;
import com.amazon.topologicaloutlier.matrix.DistanceMatrix;
import com.amazon.topologicaloutlier.returntypes.OutlierRanking;
import com.amazon.topologicaloutlier.returntypes.OutlierReport;
import com.amazon.topologicaloutlier.testutils.PointCloudTestData;
import com.amazon.topologicaloutlier.testutils.TimeSeriesTestData;

public class TopologicalOutlierDetectorTest {

    private static final int LENGTH = 30;

    private List<TimeSeries> series;

    @BeforeEach
    public void setUp() {
        TimeSeriesTestData data = new TimeSeriesTestData();
        series = new ArrayList<>(toTimeSeries(data.generate(8, LENGTH, 42)));
        series.add(toTimeSeries(data.anomalous("odd", LENGTH, 5.0, 43)));
    }

    private static List<String> rankedIds(OutlierReport report) {
        return report.getRanking().getItems().stream().map(OutlierRanking.RankedItem::getId)
                .collect(Collectors.toList());
    }

    @Test
    public void testDefaults() {
        TopologicalOutlierDetector detector = TopologicalOutlierDetector.builder().build();
        assertEquals(DistanceVariant.RAW_SERIES, detector.getDistanceVariant());
        assertEquals(ScoringStrategy.MIN_INCIDENT_EDGE, detector.getScoringStrategy());
        assertEquals(FailurePolicy.ABORT, detector.getFailurePolicy());
        assertEquals(32, detector.getQueryTimestampCount());
        assertEquals(1, detector.getMaxDimension());
        assertEquals(Double.POSITIVE_INFINITY, detector.getMaxDiameter());
        assertFalse(detector.isParallelExecutionEnabled());
        assertEquals(0, detector.getThreadPoolSize());
    }

    @Test
    public void testInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class,
                () -> TopologicalOutlierDetector.builder().queryTimestampCount(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> TopologicalOutlierDetector.builder().maxDimension(-1).build());
        assertThrows(IllegalArgumentException.class,
                () -> TopologicalOutlierDetector.builder().threadPoolSize(2).build());
        assertThrows(IllegalArgumentException.class,
                () -> TopologicalOutlierDetector.builder().queryStart(5).queryEnd(1).build());
        assertThrows(NullPointerException.class,
                () -> TopologicalOutlierDetector.builder().scoringStrategy(null).build());
    }

    @ParameterizedTest
    @EnumSource(value = ScoringStrategy.class, names = { "MIN_INCIDENT_EDGE", "TREE_ECCENTRICITY", "DIAGRAM_BULK",
            "MEDOID_DISTANCE" })
    public void testScoreRanksInjectedPointFirst(ScoringStrategy strategy) {
        TopologicalOutlierDetector detector = TopologicalOutlierDetector.builder().scoringStrategy(strategy).build();
        OutlierReport report = detector.score(DistanceMatrix.of(PointCloudTestData.twoPairsAndOutlier()));
        assertEquals("4", report.getRanking().getItems().get(0).getId());
        assertEquals(5, report.getRanking().size());
        assertEquals(strategy.getStructure() == ScoringStrategy.Structure.SPANNING_TREE,
                report.getSpanningTree().isPresent());
        assertEquals(strategy.getStructure() == ScoringStrategy.Structure.FILTRATION,
                report.getPersistence().isPresent());
    }

    @ParameterizedTest
    @EnumSource(value = ScoringStrategy.class, names = { "TREE_ECCENTRICITY", "MEDOID_DISTANCE" })
    public void testRankingDoesNotDependOnItemOrder(ScoringStrategy strategy) {
        // the two middle points tie as centroid and as medoid
        DistanceMatrix line = DistanceMatrix
                .of(PointCloudTestData.euclideanDistances(new double[][] { { 0 }, { 1 }, { 2 }, { 3 } }));
        TopologicalOutlierDetector detector = TopologicalOutlierDetector.builder().scoringStrategy(strategy).build();

        OutlierRanking ranking = detector.score(line).getRanking();
        assertEquals("3", ranking.getItems().get(0).getId());
        assertEquals(0.0, ranking.getScore("1"));
        assertEquals(1.0, ranking.getScore("2"));
        for (int[] order : new int[][] { { 2, 3, 0, 1 }, { 3, 2, 1, 0 }, { 1, 0, 3, 2 } }) {
            OutlierRanking permuted = detector.score(line.permute(order)).getRanking();
            assertEquals(ranking.getItems().toString(), permuted.getItems().toString());
        }
    }

    @Test
    public void testRawSeries() {
        OutlierReport report = TopologicalOutlierDetector.builder().build().detect(series);
        assertEquals("odd", rankedIds(report).get(0));
        assertEquals(9, report.getDistanceMatrix().size());
        assertEquals(8, report.getSpanningTree().get().getEdges().size());
        assertTrue(report.getExcludedIds().isEmpty());
    }

    @Test
    public void testWassersteinWithMeans() {
        TopologicalOutlierDetector detector = TopologicalOutlierDetector.builder()
                .distanceVariant(DistanceVariant.WASSERSTEIN_GP).queryTimestampCount(16).queryStart(2.0)
                .queryEnd(20.0).posteriorMetric(new GaussianWassersteinDistance(true, false,
                        GaussianWassersteinDistance.DEFAULT_IMAGINARY_TOLERANCE,
                        GaussianWassersteinDistance.DEFAULT_ZERO_TOLERANCE))
                .scoringStrategy(ScoringStrategy.TREE_ECCENTRICITY).build();
        OutlierReport report = detector.detect(series);
        assertEquals("odd", rankedIds(report).get(0));
    }

    @Test
    public void testWassersteinOfCovariances() {
        List<TimeSeries> mixed = new ArrayList<>(series.subList(0, 8));
        // same shape, ten times the measurement uncertainty
        mixed.add(toTimeSeries(new TimeSeriesTestData(1.0, 20.0, 0.05, 1.0).anomalous("noisy", LENGTH, 1.0, 44)));
        OutlierReport report = TopologicalOutlierDetector.builder().distanceVariant(DistanceVariant.WASSERSTEIN_GP)
                .queryTimestampCount(16).queryStart(2.0).queryEnd(20.0).build().detect(mixed);
        assertEquals("noisy", rankedIds(report).get(0));
        DistanceMatrix matrix = report.getDistanceMatrix();
        for (int i = 0; i < matrix.size(); i++) {
            assertEquals(0.0, matrix.get(i, i));
        }
    }

    @Test
    public void testDiagramDistance() {
        OutlierReport report = TopologicalOutlierDetector.builder().distanceVariant(DistanceVariant.DIAGRAM_DISTANCE)
                .build().detect(series);
        assertEquals("odd", rankedIds(report).get(0));
    }

    @Test
    public void testParallelMatchesSequential() {
        OutlierReport sequential = TopologicalOutlierDetector.builder().build().detect(series);
        OutlierReport parallel = TopologicalOutlierDetector.builder().parallelExecutionEnabled(true)
                .threadPoolSize(3).build().detect(series);
        assertEquals(rankedIds(sequential), rankedIds(parallel));
        for (OutlierRanking.RankedItem item : sequential.getRanking().getItems()) {
            assertEquals(item.getScore(), parallel.getRanking().getScore(item.getId()));
        }
    }

    @Test
    public void testExcludedSeriesLeaveTheRanking() {
        GaussianProcessFitter real = GaussianProcessFitter.builder().build();
        IProcessFitter fitter = mock(IProcessFitter.class);
        when(fitter.fit(any(), any())).thenAnswer(invocation -> {
            TimeSeries s = invocation.getArgument(0);
            if (s.getId().equals("s3")) {
                throw new FitDivergenceException(s.getId(), "did not converge");
            }
            return real.fit(s, invocation.getArgument(1));
        });

        TopologicalOutlierDetector.Builder<?> builder = TopologicalOutlierDetector.builder()
                .distanceVariant(DistanceVariant.WASSERSTEIN_GP).queryTimestampCount(12).queryStart(1.0)
                .queryEnd(25.0).processFitter(fitter);

        OutlierReport excluded = builder.failurePolicy(FailurePolicy.EXCLUDE).build().detect(series);
        assertEquals(Collections.singletonList("s3"), excluded.getExcludedIds());
        assertEquals(series.size() - 1, excluded.getRanking().size());
        assertFalse(excluded.getRanking().find("s3").isPresent());

        List<TimeSeries> remaining = series.stream().filter(s -> !s.getId().equals("s3"))
                .collect(Collectors.toList());
        OutlierReport reference = TopologicalOutlierDetector.builder().distanceVariant(DistanceVariant.WASSERSTEIN_GP)
                .queryTimestampCount(12).queryStart(1.0).queryEnd(25.0).build().detect(remaining);
        assertEquals(rankedIds(reference), rankedIds(excluded));

        assertThrows(FitDivergenceException.class,
                () -> builder.failurePolicy(FailurePolicy.ABORT).build().detect(series));
    }

    @Test
    public void testInsufficientData() {
        TopologicalOutlierDetector detector = TopologicalOutlierDetector.builder().build();
        assertThrows(InsufficientDataException.class, () -> detector.detect(series.subList(0, 1)));
        assertThrows(InsufficientDataException.class,
                () -> detector.score(DistanceMatrix.of(new double[][] { { 0 } })));
    }

    @Test
    public void testIdenticalSeries() {
        List<TimeSeries> copies = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            copies.add(TestUtils.line("c" + i, 1.0, 0.0, 10));
        }
        OutlierReport report = TopologicalOutlierDetector.builder().build().detect(copies);
        assertEquals(List.of("c0", "c1", "c2", "c3"), rankedIds(report));
        for (OutlierRanking.RankedItem item : report.getRanking().getItems()) {
            assertEquals(0.0, item.getScore());
        }
    }

    @Test
    public void testQueryTimes() {
        TopologicalOutlierDetector spanning = TopologicalOutlierDetector.builder().queryTimestampCount(3).build();
        List<TimeSeries> lines = List.of(TestUtils.line("a", 1, 0, 5), TestUtils.line("b", 1, 0, 9));
        assertArrayEquals(new double[] { 0, 4, 8 }, spanning.queryTimes(lines));

        TopologicalOutlierDetector fixedStart = TopologicalOutlierDetector.builder().queryTimestampCount(3)
                .queryStart(2).build();
        assertArrayEquals(new double[] { 2, 5, 8 }, fixedStart.queryTimes(lines));
    }
}
