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

import static com.amazon.topologicaloutlier.CommonUtils.checkArgument;
import static com.amazon.topologicaloutlier.CommonUtils.checkNotNull;
import static com.amazon.topologicaloutlier.CommonUtils.copyOf;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.function.BiFunction;

/**
 * An immutable, labelled N x N matrix of pairwise distances. Symmetric, zero on
 * the diagonal and non-negative; entries may be {@code +Infinity} but never
 * NaN.
 */
public class DistanceMatrix {

    private final String[] labels;
    private final double[][] distances;

    /**
     * Creates a matrix, validating the invariants. The arrays are copied.
     *
     * @param labels    one unique label per row
     * @param distances the square matrix
     */
    public DistanceMatrix(String[] labels, double[][] distances) {
        this(checkNotNull(labels, "labels must not be null").clone(), copyOf(checkNotNull(distances,
                "distances must not be null")), true);
    }

    // used by the builder, which hands over arrays that nobody else references
    DistanceMatrix(String[] labels, double[][] distances, boolean validate) {
        if (validate) {
            validate(labels, distances);
        }
        this.labels = labels;
        this.distances = distances;
    }

    private static void validate(String[] labels, double[][] distances) {
        int n = distances.length;
        checkArgument(labels.length == n, "one label is required per row");
        checkArgument(new HashSet<>(Arrays.asList(labels)).size() == n, "labels must be unique");
        for (int i = 0; i < n; i++) {
            checkNotNull(labels[i], "labels must not be null");
            checkArgument(distances[i].length == n, "distance matrix must be square");
            checkArgument(distances[i][i] == 0, "diagonal entries must be 0");
            for (int j = 0; j < n; j++) {
                checkArgument(!Double.isNaN(distances[i][j]) && distances[i][j] >= 0,
                        "distances must be non-negative, found " + distances[i][j] + " at (" + i + "," + j + ")");
                checkArgument(distances[i][j] == distances[j][i], "distance matrix must be symmetric");
            }
        }
    }

    /**
     * A matrix of the distances between labelled points.
     *
     * @param labels   labels of the points
     * @param points   the points
     * @param distance a symmetric distance function
     * @param <T>      type of the points
     * @return the matrix
     */
    public static <T> DistanceMatrix of(List<String> labels, List<T> points, BiFunction<T, T, Double> distance) {
        checkArgument(labels.size() == points.size(), "one label is required per point");
        int n = points.size();
        double[][] distances = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                double d = distance.apply(points.get(i), points.get(j));
                distances[i][j] = d;
                distances[j][i] = d;
            }
        }
        return new DistanceMatrix(labels.toArray(new String[0]), distances, true);
    }

    /**
     * A matrix labelled by row index.
     *
     * @param distances the square matrix
     * @return the matrix
     */
    public static DistanceMatrix of(double[][] distances) {
        String[] labels = new String[distances.length];
        for (int i = 0; i < labels.length; i++) {
            labels[i] = Integer.toString(i);
        }
        return new DistanceMatrix(labels, copyOf(distances), true);
    }

    public int size() {
        return labels.length;
    }

    public double get(int i, int j) {
        return distances[i][j];
    }

    public String getLabel(int i) {
        return labels[i];
    }

    public String[] getLabels() {
        return labels.clone();
    }

    public double[] getRow(int i) {
        return distances[i].clone();
    }

    public double[][] toArray() {
        return copyOf(distances);
    }

    /**
     * @param label a label
     * @return the row of the label, or -1 if absent
     */
    public int indexOf(String label) {
        for (int i = 0; i < labels.length; i++) {
            if (labels[i].equals(label)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * The matrix with one point removed, every other entry unchanged.
     *
     * @param index row (and column) to drop
     * @return a smaller matrix
     */
    public DistanceMatrix without(int index) {
        checkArgument(index >= 0 && index < labels.length, "index out of range");
        int n = labels.length - 1;
        String[] newLabels = new String[n];
        double[][] newDistances = new double[n][n];
        for (int i = 0, a = 0; i <= n; i++) {
            if (i == index) {
                continue;
            }
            newLabels[a] = labels[i];
            for (int j = 0, b = 0; j <= n; j++) {
                if (j != index) {
                    newDistances[a][b++] = distances[i][j];
                }
            }
            a++;
        }
        return new DistanceMatrix(newLabels, newDistances, false);
    }

    /**
     * The same point set in a different order: row {@code k} of the answer is
     * row {@code order[k]} of this matrix.
     *
     * @param order a permutation of 0..N-1
     * @return the permuted matrix
     */
    public DistanceMatrix permute(int[] order) {
        int n = labels.length;
        checkArgument(order.length == n, "incorrect permutation length");
        boolean[] seen = new boolean[n];
        String[] newLabels = new String[n];
        double[][] newDistances = new double[n][n];
        for (int k = 0; k < n; k++) {
            checkArgument(order[k] >= 0 && order[k] < n && !seen[order[k]], "not a permutation");
            seen[order[k]] = true;
            newLabels[k] = labels[order[k]];
            for (int l = 0; l < n; l++) {
                newDistances[k][l] = distances[order[k]][order[l]];
            }
        }
        return new DistanceMatrix(newLabels, newDistances, false);
    }

    /**
     * @return the largest finite off-diagonal entry, 0 if there is none
     */
    public double getMaxFiniteDistance() {
        double max = 0;
        for (double[] row : distances) {
            for (double v : row) {
                if (Double.isFinite(v)) {
                    max = Math.max(max, v);
                }
            }
        }
        return max;
    }
}
