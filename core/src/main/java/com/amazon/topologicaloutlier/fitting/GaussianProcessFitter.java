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

package com.amazon.topologicaloutlier.fitting;

import static com.amazon.topologicaloutlier.CommonUtils.checkArgument;
import static com.amazon.topologicaloutlier.CommonUtils.checkNotNull;
import static com.amazon.topologicaloutlier.errors.InsufficientDataException.checkSufficient;

import java.util.Optional;

import lombok.Getter;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.NonPositiveDefiniteMatrixException;
import org.apache.commons.math3.linear.NonSymmetricMatrixException;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.topologicaloutlier.errors.FitDivergenceException;
import com.amazon.topologicaloutlier.inputtypes.PosteriorSnapshot;
import com.amazon.topologicaloutlier.inputtypes.TimeSeries;

/**
 * Exact Gaussian process regression with a squared exponential kernel
 *
 * <pre>
 * k(s, t) = amplitude^2 * exp(-(s - t)^2 / (2 * lengthScale^2))
 * </pre>
 *
 * and a constant prior mean equal to the sample mean. Each observation carries
 * its own noise variance, the square of its uncertainty, plus
 * {@code jitter * amplitude^2} for numerical stability.
 *
 * Hyper-parameters are fixed, not optimized. When they are not configured the
 * amplitude is the sample standard deviation of the values and the length
 * scale is {@code DEFAULT_LENGTH_SCALE_INTERVALS} times the mean sampling
 * interval of the series.
 */
@Getter
public class GaussianProcessFitter implements IProcessFitter {

    private static final Logger logger = LogManager.getLogger(GaussianProcessFitter.class);

    public static final double DEFAULT_JITTER = 1e-8;

    public static final double DEFAULT_LENGTH_SCALE_INTERVALS = 3.0;

    /**
     * smallest pivot of the Cholesky factorization, relative to amplitude^2
     */
    static final double POSITIVITY_THRESHOLD = 1e-12;

    private final Optional<Double> lengthScale;
    private final Optional<Double> amplitude;
    private final double jitter;

    protected GaussianProcessFitter(Builder<?> builder) {
        builder.lengthScale.ifPresent(l -> checkArgument(l > 0 && Double.isFinite(l), "lengthScale must be positive"));
        builder.amplitude.ifPresent(a -> checkArgument(a > 0 && Double.isFinite(a), "amplitude must be positive"));
        checkArgument(builder.jitter >= 0, "jitter must be non-negative");
        this.lengthScale = builder.lengthScale;
        this.amplitude = builder.amplitude;
        this.jitter = builder.jitter;
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    @Override
    public PosteriorSnapshot fit(TimeSeries series, double[] queryTimes) {
        checkNotNull(series, "series must not be null");
        checkNotNull(queryTimes, "queryTimes must not be null");
        checkSufficient(series.size() >= 2, "series " + series.getId() + " has fewer than two samples");

        double[] t = series.getTimestamps();
        double[] y = series.getValues();
        double[] sigma = series.getUncertainties();
        int n = t.length;
        int q = queryTimes.length;

        double priorMean = 0;
        for (double v : y) {
            priorMean += v;
        }
        priorMean /= n;
        double a = amplitude.orElseGet(() -> defaultAmplitude(y));
        double l = lengthScale.orElseGet(() -> DEFAULT_LENGTH_SCALE_INTERVALS * (t[n - 1] - t[0]) / (n - 1));
        double variance = a * a;

        RealMatrix train = new Array2DRowRealMatrix(n, n);
        for (int i = 0; i < n; i++) {
            for (int j = i; j < n; j++) {
                double k = kernel(t[i], t[j], variance, l);
                train.setEntry(i, j, k);
                train.setEntry(j, i, k);
            }
            train.addToEntry(i, i, sigma[i] * sigma[i] + jitter * variance);
        }
        RealMatrix cross = new Array2DRowRealMatrix(n, q);
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < q; j++) {
                cross.setEntry(i, j, kernel(t[i], queryTimes[j], variance, l));
            }
        }
        RealMatrix prior = new Array2DRowRealMatrix(q, q);
        for (int i = 0; i < q; i++) {
            for (int j = i; j < q; j++) {
                double k = kernel(queryTimes[i], queryTimes[j], variance, l);
                prior.setEntry(i, j, k);
                prior.setEntry(j, i, k);
            }
        }

        DecompositionSolver solver;
        try {
            solver = new CholeskyDecomposition(train, CholeskyDecomposition.DEFAULT_RELATIVE_SYMMETRY_THRESHOLD,
                    POSITIVITY_THRESHOLD * variance).getSolver();
        } catch (NonPositiveDefiniteMatrixException | NonSymmetricMatrixException e) {
            throw new FitDivergenceException(series.getId(),
                    "kernel matrix of " + series.getId() + " is not positive definite", e);
        }

        RealVector centered = new ArrayRealVector(y).mapSubtract(priorMean);
        RealVector mean = cross.transpose().operate(solver.solve(centered)).mapAdd(priorMean);
        RealMatrix covariance = prior.subtract(cross.transpose().multiply(solver.solve(cross)));

        double[][] answer = covariance.getData();
        for (int i = 0; i < q; i++) {
            if (!Double.isFinite(mean.getEntry(i))) {
                throw new FitDivergenceException(series.getId(), "posterior mean of " + series.getId()
                        + " is not finite");
            }
            for (int j = i; j < q; j++) {
                if (!Double.isFinite(answer[i][j]) || !Double.isFinite(answer[j][i])) {
                    throw new FitDivergenceException(series.getId(), "posterior covariance of " + series.getId()
                            + " is not finite");
                }
                double average = 0.5 * (answer[i][j] + answer[j][i]);
                answer[i][j] = average;
                answer[j][i] = average;
            }
        }
        logger.debug("fitted {} with amplitude {} and length scale {}", series.getId(), a, l);
        return new PosteriorSnapshot(series.getId(), queryTimes, mean.toArray(), answer);
    }

    static double kernel(double s, double t, double variance, double lengthScale) {
        double d = (s - t) / lengthScale;
        return variance * Math.exp(-0.5 * d * d);
    }

    static double defaultAmplitude(double[] values) {
        double mean = 0;
        for (double v : values) {
            mean += v;
        }
        mean /= values.length;
        double sum = 0;
        for (double v : values) {
            sum += (v - mean) * (v - mean);
        }
        double deviation = Math.sqrt(sum / values.length);
        return deviation > 0 ? deviation : 1.0;
    }

    public static class Builder<T extends Builder<T>> {

        private Optional<Double> lengthScale = Optional.empty();
        private Optional<Double> amplitude = Optional.empty();
        private double jitter = DEFAULT_JITTER;

        public T lengthScale(double lengthScale) {
            this.lengthScale = Optional.of(lengthScale);
            return (T) this;
        }

        public T amplitude(double amplitude) {
            this.amplitude = Optional.of(amplitude);
            return (T) this;
        }

        public T jitter(double jitter) {
            this.jitter = jitter;
            return (T) this;
        }

        public GaussianProcessFitter build() {
            return new GaussianProcessFitter(this);
        }
    }
}
