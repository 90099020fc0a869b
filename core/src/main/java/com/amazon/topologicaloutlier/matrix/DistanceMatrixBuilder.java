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

package com.amazon.topologicaloutlier.matrix;

import static com.amazon.topologicaloutlier.CommonUtils.checkNotNull;
import static com.amazon.topologicaloutlier.CommonUtils.checkState;
import static com.amazon.topologicaloutlier.errors.InsufficientDataException.checkSufficient;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import lombok.Getter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.topologicaloutlier.config.FailurePolicy;
import com.amazon.topologicaloutlier.distance.IDistanceMetric;
import com.amazon.topologicaloutlier.errors.FitDivergenceException;
import com.amazon.topologicaloutlier.executor.ITaskExecutor;
import com.amazon.topologicaloutlier.executor.ParallelTaskExecutor;
import com.amazon.topologicaloutlier.executor.SequentialTaskExecutor;
import com.amazon.topologicaloutlier.inputtypes.TimeSeries;
import com.amazon.topologicaloutlier.store.RepresentationStore;

/**
 * Builds the distance matrix of a collection of series in two phases. In the
 * population phase the (possibly expensive) representation of every series is
 * computed exactly once and published to a {@link RepresentationStore}. In the
 * pairwise phase every unordered pair is compared once and the result is
 * written to both symmetric cells; each row is owned by a single task.
 *
 * Both phases run on the configured {@link ITaskExecutor}.
 */
@Getter
public class DistanceMatrixBuilder {

    private static final Logger logger = LogManager.getLogger(DistanceMatrixBuilder.class);

    public static final FailurePolicy DEFAULT_FAILURE_POLICY = FailurePolicy.ABORT;

    public static final boolean DEFAULT_PARALLEL_EXECUTION_ENABLED = false;

    private final FailurePolicy failurePolicy;
    private final ITaskExecutor executor;

    protected DistanceMatrixBuilder(Builder<?> builder) {
        this.failurePolicy = checkNotNull(builder.failurePolicy, "failurePolicy must not be null");
        if (builder.executor.isPresent()) {
            this.executor = builder.executor.get();
        } else if (builder.parallelExecutionEnabled) {
            this.executor = new ParallelTaskExecutor(
                    builder.threadPoolSize.orElse(Runtime.getRuntime().availableProcessors()));
        } else {
            this.executor = new SequentialTaskExecutor();
        }
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    /**
     * Runs both phases.
     *
     * @param series         the items, in output order
     * @param representation computes the representation of one series; may throw
     *                       {@link FitDivergenceException}
     * @param metric         compares two representations
     * @param <R>            type of the representation
     * @return the distance matrix of the items that could be represented
     */
    public <R> DistanceMatrix build(List<TimeSeries> series, Function<TimeSeries, R> representation,
            IDistanceMetric<R> metric) {
        return computePairwise(populate(series, representation), metric);
    }

    /**
     * The population phase. Items whose representation fails with a
     * {@link FitDivergenceException} are left out of the store under
     * {@link FailurePolicy#EXCLUDE}; under {@link FailurePolicy#ABORT} the first
     * such failure (in item order) is rethrown.
     *
     * @param series         the items
     * @param representation computes the representation of one series
     * @param <R>            type of the representation
     * @return a sealed store
     */
    public <R> RepresentationStore<R> populate(List<TimeSeries> series, Function<TimeSeries, R> representation) {
        checkNotNull(series, "series must not be null");
        checkNotNull(representation, "representation must not be null");
        checkSufficient(series.size() >= 2, "at least two series are required, found " + series.size());

        RepresentationStore<R> store = new RepresentationStore<>(
                series.stream().map(TimeSeries::getId).collect(Collectors.toList()));
        List<Optional<FitDivergenceException>> failures = executor.map(series.size(), i -> {
            try {
                store.put(i, checkNotNull(representation.apply(series.get(i)),
                        "representation of " + series.get(i).getId() + " is null"));
                return Optional.empty();
            } catch (FitDivergenceException e) {
                return Optional.of(e);
            }
        });
        store.seal();

        for (Optional<FitDivergenceException> failure : failures) {
            if (failure.isPresent()) {
                FitDivergenceException e = failure.get();
                if (failurePolicy == FailurePolicy.ABORT) {
                    throw e;
                }
                logger.warn("Excluding series {} from the run: {}", e.getSeriesId(), e.getMessage());
            }
        }
        checkSufficient(store.size() >= 2,
                "at least two series are required after exclusions, found " + store.size());
        logger.debug("Computed {} representations, excluded {}", store.size(), store.getMissingKeys().size());
        return store;
    }

    /**
     * The pairwise phase.
     *
     * @param store  a sealed store
     * @param metric compares two representations
     * @param <R>    type of the representation
     * @return the distance matrix, labelled by the keys of the store
     */
    public <R> DistanceMatrix computePairwise(RepresentationStore<R> store, IDistanceMetric<R> metric) {
        checkNotNull(store, "store must not be null");
        checkNotNull(metric, "metric must not be null");
        checkState(store.isSealed(), "representations must be computed before pairwise comparison");
        int n = store.size();
        checkSufficient(n >= 2, "at least two items are required, found " + n);

        String[] labels = new String[n];
        for (int i = 0; i < n; i++) {
            labels[i] = store.getStoredKey(i);
        }
        double[][] distances = new double[n][n];
        executor.forEach(n, i -> {
            R first = store.get(i);
            for (int j = i + 1; j < n; j++) {
                double d = metric.distance(first, store.get(j));
                checkState(!Double.isNaN(d) && d >= 0,
                        "distance between " + labels[i] + " and " + labels[j] + " is invalid: " + d);
                distances[i][j] = d;
                distances[j][i] = d;
            }
        });
        logger.debug("Computed {} pairwise distances", n * (n - 1) / 2);
        return new DistanceMatrix(labels, distances, false);
    }

    public static class Builder<T extends Builder<T>> {

        private FailurePolicy failurePolicy = DEFAULT_FAILURE_POLICY;
        private boolean parallelExecutionEnabled = DEFAULT_PARALLEL_EXECUTION_ENABLED;
        private Optional<Integer> threadPoolSize = Optional.empty();
        private Optional<ITaskExecutor> executor = Optional.empty();

        public T failurePolicy(FailurePolicy failurePolicy) {
            this.failurePolicy = failurePolicy;
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

        public T executor(ITaskExecutor executor) {
            this.executor = Optional.of(executor);
            return (T) this;
        }

        public DistanceMatrixBuilder build() {
            return new DistanceMatrixBuilder(this);
        }
    }
}
