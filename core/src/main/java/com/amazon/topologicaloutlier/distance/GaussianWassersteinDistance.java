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

package com.amazon.topologicaloutlier.distance;

import static com.amazon.topologicaloutlier.CommonUtils.checkArgument;
import static java.lang.Math.max;

import lombok.Getter;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.topologicaloutlier.errors.DimensionMismatchException;
import com.amazon.topologicaloutlier.inputtypes.PosteriorSnapshot;
import com.amazon.topologicaloutlier.util.SymmetricMatrixRoot;

/**
 * The 2-Wasserstein distance between two Gaussian posteriors evaluated at the
 * same query timestamps,
 *
 * <pre>
 * W^2 = |m1 - m2|^2 + tr(K1 + K2 - 2 (K1^(1/2) K2 K1^(1/2))^(1/2))
 * </pre>
 *
 * where the mean term is only included when requested (posteriors are compared
 * as zero centered distributions by default). Matrix square roots keep the real
 * part only; if the dropped imaginary part is larger than
 * {@code imaginaryTolerance} relative to the root, a warning is logged.
 *
 * Values of W^2 below {@code zeroTolerance * tr(K1 + K2)} are rounding noise of
 * the two eigen decompositions and are reported as 0.
 */
@Getter
public class GaussianWassersteinDistance implements IDistanceMetric<PosteriorSnapshot> {

    private static final Logger logger = LogManager.getLogger(GaussianWassersteinDistance.class);

    public static final double DEFAULT_IMAGINARY_TOLERANCE = 1e-6;

    public static final double DEFAULT_ZERO_TOLERANCE = 1e-10;

    private final boolean meanIncluded;
    private final boolean squared;
    private final double imaginaryTolerance;
    private final double zeroTolerance;

    public GaussianWassersteinDistance() {
        this(false, false, DEFAULT_IMAGINARY_TOLERANCE, DEFAULT_ZERO_TOLERANCE);
    }

    /**
     * @param meanIncluded       add the squared distance between the means
     * @param squared            return W^2 instead of W
     * @param imaginaryTolerance relative size of a discarded imaginary part above
     *                           which a warning is logged
     * @param zeroTolerance      relative size below which W^2 is reported as 0
     */
    public GaussianWassersteinDistance(boolean meanIncluded, boolean squared, double imaginaryTolerance,
            double zeroTolerance) {
        checkArgument(imaginaryTolerance >= 0, "imaginaryTolerance must be non-negative");
        checkArgument(zeroTolerance >= 0, "zeroTolerance must be non-negative");
        this.meanIncluded = meanIncluded;
        this.squared = squared;
        this.imaginaryTolerance = imaginaryTolerance;
        this.zeroTolerance = zeroTolerance;
    }

    @Override
    public double distance(PosteriorSnapshot a, PosteriorSnapshot b) {
        if (a.getDimension() != b.getDimension()) {
            throw new DimensionMismatchException("cannot compare posteriors of " + a.getSeriesId() + " and "
                    + b.getSeriesId() + ": " + a.getDimension() + " versus " + b.getDimension() + " query times");
        }
        if (!a.sharesQueryTimes(b)) {
            throw new DimensionMismatchException("posteriors of " + a.getSeriesId() + " and " + b.getSeriesId()
                    + " were evaluated at different query times");
        }
        double value = squaredCovarianceTerm(a.getCovariance(), b.getCovariance(),
                a.getSeriesId() + "/" + b.getSeriesId());
        if (meanIncluded) {
            double[] m1 = a.getMean();
            double[] m2 = b.getMean();
            for (int i = 0; i < m1.length; i++) {
                value += (m1[i] - m2[i]) * (m1[i] - m2[i]);
            }
        }
        return squared ? value : Math.sqrt(value);
    }

    /**
     * The covariance part of the squared distance.
     *
     * @param k1    first covariance
     * @param k2    second covariance, same shape as the first
     * @param label used in diagnostics
     * @return tr(K1 + K2 - 2 (K1^(1/2) K2 K1^(1/2))^(1/2)), never negative
     */
    public double squaredCovarianceTerm(double[][] k1, double[][] k2, String label) {
        if (k1.length != k2.length || (k1.length > 0 && k1[0].length != k2[0].length)) {
            throw new DimensionMismatchException("covariance shapes differ for " + label);
        }
        if (k1.length == 0) {
            return 0;
        }
        RealMatrix first = MatrixUtils.createRealMatrix(k1);
        RealMatrix second = MatrixUtils.createRealMatrix(k2);

        SymmetricMatrixRoot firstRoot = SymmetricMatrixRoot.of(first);
        checkImaginaryPart(firstRoot, label);
        RealMatrix product = firstRoot.getRoot().multiply(second).multiply(firstRoot.getRoot());
        SymmetricMatrixRoot cross = SymmetricMatrixRoot.of(product);
        checkImaginaryPart(cross, label);

        double traceSum = first.getTrace() + second.getTrace();
        double value = traceSum - 2 * cross.getTrace();
        if (value <= zeroTolerance * max(Math.abs(traceSum), Double.MIN_NORMAL)) {
            return 0;
        }
        return value;
    }

    private void checkImaginaryPart(SymmetricMatrixRoot root, String label) {
        double discarded = root.getDiscardedImaginaryNorm();
        if (discarded > imaginaryTolerance * max(1.0, root.getRootNorm())) {
            logger.warn("Matrix square root for {} is not real; discarded an imaginary part of norm {}", label,
                    discarded);
        }
    }
}
