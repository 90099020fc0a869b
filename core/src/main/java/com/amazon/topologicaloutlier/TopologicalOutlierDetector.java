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

import static com.amazon.topologicaloutlier.CommonUtils.checkArgument;
import static com.amazon.topologicaloutlier.CommonUtils.checkNotNull;
import static com.amazon.topologicaloutlier.errors.InsufficientDataException.checkSufficient;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import lombok.Getter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.topologicaloutlier.config.DistanceVariant;
import com.amazon.topologicaloutlier.config.FailurePolicy;
import com.amazon.topologicaloutlier.config.ScoringStrategy;
import com.amazon.topologicaloutlier.distance.DiagramFamilyDistance;
import com.amazon.topologicaloutlier.distance.GaussianWassersteinDistance;
import com.amazon.topologicaloutlier.distance.IDistanceMetric;
import com.amazon.topologicaloutlier.distance.InterpolatedSeriesDistance;
import com.amazon.topologicaloutlier.distance.PersistenceDiagramDistance;
import com.amazon.topologicaloutlier.fitting.GaussianProcessFitter;
import com.amazon.topologicaloutlier.fitting.IProcessFitter;
import com.amazon.topologicaloutlier.fitting.QueryTimes;
import com.amazon.topologicaloutlier.homology.FiltrationEngine;
import com.amazon.topologicaloutlier.homology.PerSeriesDiagramBuilder;
import com.amazon.topologicaloutlier.homology.PersistenceDiagrams;
import com.amazon.topologicaloutlier.homology.PersistenceResult;
import com.amazon.topologicaloutlier.inputtypes.PosteriorSnapshot;
import com.amazon.topologicaloutlier.inputtypes.TimeSeries;
import com.amazon.topologicaloutlier.matrix.DistanceMatrix;
import com.amazon.topologicaloutlier.matrix.DistanceMatrixBuilder;
import com.amazon.topologicaloutlier.returntypes.OutlierRanking;
import com.amazon.topologicaloutlier.returntypes.OutlierReport;
import com.amazon.topologicaloutlier.scoring.DiagramBulkScorer;
import com.amazon.topologicaloutlier.scoring.MaxIncidentEdgeScorer;
import com.amazon.topologicaloutlier.scoring.MedoidDistanceScorer;
import com.amazon.topologicaloutlier.scoring.MinIncidentEdgeScorer;
import com.amazon.topologicaloutlier.scoring.TreeEccentricityScorer;
import com.amazon.topologicaloutlier.store.RepresentationStore;
import com.amazon.topologicaloutlier.tree.SpanningTree;
import com.amazon.topologicaloutlier.tree.SpanningTreeEngine;

/**
 * Ranks a collection of time series by how anomalous each one is with respect
 * to the others.
 *
 * A run computes a pairwise distance matrix between the series, derives a
 * topological structure from it (a minimum spanning tree or a Vietoris-Rips
 * filtration with its persistent homology) and scores every series by how
 * poorly it fits that structure. The {@link DistanceVariant} selects what is
 * compared when the matrix is built, the {@link ScoringStrategy} selects the
 * structure and the score.
 *
 * <pre>
 * TopologicalOutlierDetector detector = TopologicalOutlierDetector.builder()
 *         .distanceVariant(DistanceVariant.WASSERSTEIN_GP).queryTimestampCount(24)
 *         .scoringStrategy(ScoringStrategy.TREE_ECCENTRICITY).build();
 * OutlierReport report = detector.detect(series);
 * </pre>
 */
@Getter
public class TopologicalOutlierDetector {

    private static final Logger logger = LogManager.getLogger(TopologicalOutlierDetector.class);

    /**
     * Default distance variant.
     */
    public static final DistanceVariant DEFAULT_DISTANCE_VARIANT = DistanceVariant.RAW_SERIES;

    /**
     * Default scoring strategy, the nearest neighbor persistence.
     */
    public static final ScoringStrategy DEFAULT_SCORING_STRATEGY = ScoringStrategy.MIN_INCIDENT_EDGE;

    /**
     * Default number of query timestamps at which fitted posteriors are compared.
     */
    public static final int DEFAULT_QUERY_TIMESTAMP_COUNT = 32;

    /**
     * Default largest homological dimension of the persistence diagrams.
     */
    public static final int DEFAULT_MAX_DIMENSION = FiltrationEngine.DEFAULT_MAX_DIMENSION;

    /**
     * Default largest diameter of a simplex in a filtration.
     */
    public static final double DEFAULT_MAX_DIAMETER = FiltrationEngine.DEFAULT_MAX_DIAMETER;

    private final DistanceVariant distanceVariant;
    private final ScoringStrategy scoringStrategy;
    private final FailurePolicy failurePolicy;
    private final int queryTimestampCount;
    private final Optional<Double> queryStart;
    private final Optional<Double> queryEnd;
    private final int maxDimension;
    private final double maxDiameter;
    private final boolean parallelExecutionEnabled;
    private final int threadPoolSize;
    private final int nearestNeighbors;
    private final int embeddingDimension;
    private final int embeddingDelay;
    private final IProcessFitter processFitter;
    private final IDistanceMetric<TimeSeries> seriesMetric;
    private final IDistanceMetric<PersistenceDiagrams> diagramMetric;
    private final IDistanceMetric<PosteriorSnapshot> posteriorMetric;

    private final DistanceMatrixBuilder matrixBuilder;
    private final FiltrationEngine filtrationEngine;
    private final SpanningTreeEngine spanningTreeEngine;

    protected TopologicalOutlierDetector(Builder<?> builder) {
        checkNotNull(builder.distanceVariant, "distanceVariant must not be null");
        checkNotNull(builder.scoringStrategy, "scoringStrategy must not be null");
        checkNotNull(builder.failurePolicy, "failurePolicy must not be null");
        checkArgument(builder.queryTimestampCount > 0, "queryTimestampCount must be greater than 0");
        checkArgument(builder.maxDimension >= 0, "maxDimension must be non-negative");
        checkArgument(builder.nearestNeighbors >= 0, "nearestNeighbors must be non-negative");
        if (builder.queryStart.isPresent() && builder.queryEnd.isPresent()) {
            checkArgument(builder.queryStart.get() <= builder.queryEnd.get(), "queryStart must not be after queryEnd");
        }
        builder.threadPoolSize.ifPresent(n -> checkArgument(n > 0, "threadPoolSize must be greater than 0"));
        if (builder.threadPoolSize.isPresent()) {
            checkArgument(builder.parallelExecutionEnabled,
                    "threadPoolSize can only be set when parallel execution is enabled");
        }

        distanceVariant = builder.distanceVariant;
        scoringStrategy = builder.scoringStrategy;
        failurePolicy = builder.failurePolicy;
        queryTimestampCount = builder.queryTimestampCount;
        queryStart = builder.queryStart;
        queryEnd = builder.queryEnd;
        maxDimension = builder.maxDimension;
        maxDiameter = builder.maxDiameter;
        parallelExecutionEnabled = builder.parallelExecutionEnabled;
        threadPoolSize = builder.threadPoolSize.orElse(parallelExecutionEnabled ? Runtime.getRuntime()
                .availableProcessors() : 0);
        nearestNeighbors = builder.nearestNeighbors;
        embeddingDimension = builder.embeddingDimension;
        embeddingDelay = builder.embeddingDelay;
        processFitter = builder.processFitter.orElseGet(() -> GaussianProcessFitter.builder().build());
        seriesMetric = builder.seriesMetric.orElseGet(InterpolatedSeriesDistance::new);
        diagramMetric = builder.diagramMetric.orElseGet(() -> new DiagramFamilyDistance(new PersistenceDiagramDistance(
                PersistenceDiagramDistance.DEFAULT_ORDER, Double.isFinite(maxDiameter) ? maxDiameter : 0)));
        posteriorMetric = builder.posteriorMetric.orElseGet(GaussianWassersteinDistance::new);

        DistanceMatrixBuilder.Builder<?> matrixBuilderBuilder = DistanceMatrixBuilder.builder()
                .failurePolicy(failurePolicy).parallelExecutionEnabled(parallelExecutionEnabled);
        if (parallelExecutionEnabled) {
            matrixBuilderBuilder.threadPoolSize(threadPoolSize);
        }
        matrixBuilder = matrixBuilderBuilder.build();
        filtrationEngine = new FiltrationEngine(maxDimension, maxDiameter);
        spanningTreeEngine = new SpanningTreeEngine(nearestNeighbors);
    }

    /**
     * @return a new builder.
     */
    public static Builder<?> builder() {
        return new Builder<>();
    }

    /**
     * Runs the whole pipeline on a collection of series.
     *
     * @param series the series to rank; identifiers must be unique
     * @return the ranking, its intermediate structures and the excluded series
     */
    public OutlierReport detect(List<TimeSeries> series) {
        checkNotNull(series, "series must not be null");
        checkSufficient(series.size() >= 2, "at least two series are required, found " + series.size());
        logger.info("Ranking {} series with {} distances and {} scoring", series.size(), distanceVariant,
                scoringStrategy);

        DistanceMatrix matrix;
        List<String> excluded;
        switch (distanceVariant) {
        case RAW_SERIES:
            RepresentationStore<TimeSeries> raw = matrixBuilder.populate(series, Function.identity());
            matrix = matrixBuilder.computePairwise(raw, seriesMetric);
            excluded = raw.getMissingKeys();
            break;
        case WASSERSTEIN_GP:
            double[] queryTimes = queryTimes(series);
            RepresentationStore<PosteriorSnapshot> posteriors = matrixBuilder.populate(series,
                    s -> processFitter.fit(s, queryTimes));
            matrix = matrixBuilder.computePairwise(posteriors, posteriorMetric);
            excluded = posteriors.getMissingKeys();
            break;
        case DIAGRAM_DISTANCE:
            PerSeriesDiagramBuilder diagramBuilder = new PerSeriesDiagramBuilder(embeddingDimension,
                    embeddingDelay, filtrationEngine);
            RepresentationStore<PersistenceDiagrams> diagrams = matrixBuilder.populate(series, diagramBuilder);
            matrix = matrixBuilder.computePairwise(diagrams, diagramMetric);
            excluded = diagrams.getMissingKeys();
            break;
        default:
            throw new IllegalStateException("unknown distance variant " + distanceVariant);
        }
        return score(matrix, excluded);
    }

    /**
     * Scores an existing distance matrix.
     *
     * @param matrix pairwise distances between at least two items
     * @return the ranking and its intermediate structures
     */
    public OutlierReport score(DistanceMatrix matrix) {
        return score(matrix, Collections.emptyList());
    }

    OutlierReport score(DistanceMatrix matrix, List<String> excluded) {
        checkNotNull(matrix, "matrix must not be null");
        checkSufficient(matrix.size() >= 2, "at least two items are required, found " + matrix.size());

        double[] scores;
        Optional<SpanningTree> tree = Optional.empty();
        Optional<PersistenceResult> persistence = Optional.empty();
        switch (scoringStrategy) {
        case MIN_INCIDENT_EDGE:
            tree = Optional.of(spanningTreeEngine.build(matrix));
            scores = new MinIncidentEdgeScorer().score(tree.get());
            break;
        case MAX_INCIDENT_EDGE:
            tree = Optional.of(spanningTreeEngine.build(matrix));
            scores = new MaxIncidentEdgeScorer().score(tree.get());
            break;
        case TREE_ECCENTRICITY:
            tree = Optional.of(spanningTreeEngine.build(matrix));
            scores = new TreeEccentricityScorer(matrix.getLabels()).score(tree.get());
            break;
        case DIAGRAM_BULK:
            persistence = Optional.of(filtrationEngine.compute(matrix));
            scores = new DiagramBulkScorer().score(persistence.get());
            break;
        case MEDOID_DISTANCE:
            scores = new MedoidDistanceScorer().score(matrix);
            break;
        default:
            throw new IllegalStateException("unknown scoring strategy " + scoringStrategy);
        }

        OutlierRanking ranking = new OutlierRanking(matrix.getLabels(), scores);
        if (!excluded.isEmpty()) {
            logger.info("Excluded {} series: {}", excluded.size(), excluded);
        }
        logger.info("Most anomalous: {}", ranking.topK(1));
        return new OutlierReport(ranking, matrix, tree, persistence, excluded);
    }

    double[] queryTimes(List<TimeSeries> series) {
        if (queryStart.isPresent() && queryEnd.isPresent()) {
            return QueryTimes.uniform(queryStart.get(), queryEnd.get(), queryTimestampCount);
        }
        double[] spanning = QueryTimes.spanning(series, 2);
        return QueryTimes.uniform(queryStart.orElse(spanning[0]), queryEnd.orElse(spanning[1]),
                queryTimestampCount);
    }

    public static class Builder<T extends Builder<T>> {

        // default values for builder fields
        private DistanceVariant distanceVariant = DEFAULT_DISTANCE_VARIANT;
        private ScoringStrategy scoringStrategy = DEFAULT_SCORING_STRATEGY;
        private FailurePolicy failurePolicy = DistanceMatrixBuilder.DEFAULT_FAILURE_POLICY;
        private int queryTimestampCount = DEFAULT_QUERY_TIMESTAMP_COUNT;
        private int maxDimension = DEFAULT_MAX_DIMENSION;
        private double maxDiameter = DEFAULT_MAX_DIAMETER;
        private boolean parallelExecutionEnabled = DistanceMatrixBuilder.DEFAULT_PARALLEL_EXECUTION_ENABLED;
        private int nearestNeighbors = SpanningTreeEngine.DEFAULT_NEAREST_NEIGHBORS;
        private int embeddingDimension = PerSeriesDiagramBuilder.DEFAULT_EMBEDDING_DIMENSION;
        private int embeddingDelay = PerSeriesDiagramBuilder.DEFAULT_EMBEDDING_DELAY;

        // Optional fields
        private Optional<Double> queryStart = Optional.empty();
        private Optional<Double> queryEnd = Optional.empty();
        private Optional<Integer> threadPoolSize = Optional.empty();
        private Optional<IProcessFitter> processFitter = Optional.empty();
        private Optional<IDistanceMetric<TimeSeries>> seriesMetric = Optional.empty();
        private Optional<IDistanceMetric<PersistenceDiagrams>> diagramMetric = Optional.empty();
        private Optional<IDistanceMetric<PosteriorSnapshot>> posteriorMetric = Optional.empty();

        public T distanceVariant(DistanceVariant distanceVariant) {
            this.distanceVariant = distanceVariant;
            return (T) this;
        }

        public T scoringStrategy(ScoringStrategy scoringStrategy) {
            this.scoringStrategy = scoringStrategy;
            return (T) this;
        }

        public T failurePolicy(FailurePolicy failurePolicy) {
            this.failurePolicy = failurePolicy;
            return (T) this;
        }

        public T queryTimestampCount(int queryTimestampCount) {
            this.queryTimestampCount = queryTimestampCount;
            return (T) this;
        }

        public T queryStart(double queryStart) {
            this.queryStart = Optional.of(queryStart);
            return (T) this;
        }

        public T queryEnd(double queryEnd) {
            this.queryEnd = Optional.of(queryEnd);
            return (T) this;
        }

        public T maxDimension(int maxDimension) {
            this.maxDimension = maxDimension;
            return (T) this;
        }

        public T maxDiameter(double maxDiameter) {
            this.maxDiameter = maxDiameter;
            return (T) this;
        }

        public T parallelExecutionEnabled(boolean parallelExecutionEnabled) {
            this.parallelExecutionEnabled = parallelExecutionEnabled;
            return (T) this;
        }

        public T threadPoolSize(int threadPoolSize) {
            this.threadPoolSize = Optional.of(threadPoolSize);
            return (T) this;
        }

        public T nearestNeighbors(int nearestNeighbors) {
            this.nearestNeighbors = nearestNeighbors;
            return (T) this;
        }

        public T embeddingDimension(int embeddingDimension) {
            this.embeddingDimension = embeddingDimension;
            return (T) this;
        }

        public T embeddingDelay(int embeddingDelay) {
            this.embeddingDelay = embeddingDelay;
            return (T) this;
        }

        public T processFitter(IProcessFitter processFitter) {
            this.processFitter = Optional.of(processFitter);
            return (T) this;
        }

        public T seriesMetric(IDistanceMetric<TimeSeries> seriesMetric) {
            this.seriesMetric = Optional.of(seriesMetric);
            return (T) this;
        }

        public T diagramMetric(IDistanceMetric<PersistenceDiagrams> diagramMetric) {
            this.diagramMetric = Optional.of(diagramMetric);
            return (T) this;
        }

        public T posteriorMetric(IDistanceMetric<PosteriorSnapshot> posteriorMetric) {
            this.posteriorMetric = Optional.of(posteriorMetric);
            return (T) this;
        }

        public TopologicalOutlierDetector build() {
            return new TopologicalOutlierDetector(this);
        }
    }
}
