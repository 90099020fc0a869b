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

package com.amazon.topologicaloutlier.util;

import static com.amazon.topologicaloutlier.CommonUtils.checkArgument;

import lombok.Getter;

import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * The principal square root of a symmetric matrix, computed from its eigen
 * decomposition {@code A = V diag(l) V^T} as {@code V diag(sqrt(l)) V^T}.
 *
 * A covariance estimate is only approximately positive semi-definite; its
 * negative eigenvalues have purely imaginary square roots. Only the real part
 * {@code V diag(sqrt(max(l, 0))) V^T} is kept. The Frobenius norm of the
 * discarded imaginary part, {@code sqrt(sum(max(-l, 0)))}, is reported so that
 * callers can tell rounding noise from a genuinely indefinite input.
 */
@Getter
public class SymmetricMatrixRoot {

    /**
     * the real part of the principal square root
     */
    private final RealMatrix root;

    /**
     * eigenvalues of the input, after symmetrization
     */
    private final double[] eigenvalues;

    /**
     * Frobenius norm of the imaginary part that was dropped
     */
    private final double discardedImaginaryNorm;

    /**
     * trace of {@link #root}, i.e. sum of sqrt(max(l, 0))
     */
    private final double trace;

    private SymmetricMatrixRoot(RealMatrix root, double[] eigenvalues, double discardedImaginaryNorm, double trace) {
        this.root = root;
        this.eigenvalues = eigenvalues;
        this.discardedImaginaryNorm = discardedImaginaryNorm;
        this.trace = trace;
    }

    /**
     * @param matrix a square matrix that is symmetric up to rounding; it is
     *               symmetrized before the decomposition
     * @return the root
     */
    public static SymmetricMatrixRoot of(RealMatrix matrix) {
        checkArgument(matrix.isSquare(), "matrix must be square");
        RealMatrix symmetric = symmetrize(matrix);
        int n = symmetric.getRowDimension();

        EigenDecomposition decomposition = new EigenDecomposition(symmetric);
        double[] eigenvalues = decomposition.getRealEigenvalues();
        RealMatrix v = decomposition.getV();

        double[] roots = new double[n];
        double imaginarySquared = 0;
        double trace = 0;
        for (int i = 0; i < n; i++) {
            if (eigenvalues[i] > 0) {
                roots[i] = Math.sqrt(eigenvalues[i]);
                trace += roots[i];
            } else {
                imaginarySquared -= eigenvalues[i];
            }
        }
        RealMatrix root = v.multiply(MatrixUtils.createRealDiagonalMatrix(roots)).multiply(v.transpose());
        return new SymmetricMatrixRoot(symmetrize(root), eigenvalues, Math.sqrt(imaginarySquared), trace);
    }

    /**
     * @param matrix a square matrix
     * @return (M + M^T) / 2
     */
    public static RealMatrix symmetrize(RealMatrix matrix) {
        return matrix.add(matrix.transpose()).scalarMultiply(0.5);
    }

    /**
     * @return Frobenius norm of the real part of the root
     */
    public double getRootNorm() {
        return root.getFrobeniusNorm();
    }
}
