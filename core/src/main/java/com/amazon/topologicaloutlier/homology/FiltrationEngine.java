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

package com.amazon.topologicaloutlier.homology;

import static com.amazon.topologicaloutlier.CommonUtils.checkArgument;
import static com.amazon.topologicaloutlier.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import lombok.Getter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.topologicaloutlier.matrix.DistanceMatrix;

/**
 * Builds the Vietoris-Rips filtration of a distance matrix and computes its
 * persistent homology over Z/2.
 *
 * Simplices are admitted up to dimension {@code maxDimension + 1} so that every
 * class of dimension {@code maxDimension} can be killed. A simplex enters at
 * the largest pairwise distance between its vertices and is admitted only when
 * that distance does not exceed {@code maxDiameter}.
 */
@Getter
public class FiltrationEngine {

    private static final Logger logger = LogManager.getLogger(FiltrationEngine.class);

    public static final int DEFAULT_MAX_DIMENSION = 1;

    public static final double DEFAULT_MAX_DIAMETER = Double.POSITIVE_INFINITY;

    private final int maxDimension;
    private final double maxDiameter;

    public FiltrationEngine() {
        this(DEFAULT_MAX_DIMENSION, DEFAULT_MAX_DIAMETER);
    }

    public FiltrationEngine(int maxDimension, double maxDiameter) {
        checkArgument(maxDimension >= 0, "maxDimension must be non-negative");
        checkArgument(!Double.isNaN(maxDiameter) && maxDiameter >= 0, "maxDiameter must be non-negative");
        this.maxDimension = maxDimension;
        this.maxDiameter = maxDiameter;
    }

    public PersistenceResult compute(DistanceMatrix matrix) {
        Filtration filtration = buildFiltration(matrix);
        return new PersistenceResult(filtration, computePersistence(filtration));
    }

    public Filtration buildFiltration(DistanceMatrix matrix) {
        checkNotNull(matrix, "matrix must not be null");
        int n = matrix.size();
        int maxSimplexDimension = maxDimension + 1;
        List<Simplex> simplices = new ArrayList<>();
        int[] current = new int[maxSimplexDimension + 1];
        for (int v = 0; v < n; v++) {
            current[0] = v;
            expand(matrix, current, 1, 0.0, simplices);
        }
        simplices.sort(Simplex.FILTRATION_ORDER);
        logger.debug("filtration of {} vertices has {} simplices", n, simplices.size());
        return new Filtration(n, maxSimplexDimension, maxDiameter, simplices);
    }

    /**
     * records the simplex {@code current[0..length)} and all its cofaces with
     * larger vertices
     */
    private void expand(DistanceMatrix matrix, int[] current, int length, double diameter, List<Simplex> output) {
        output.add(new Simplex(Arrays.copyOf(current, length), diameter));
        if (length == current.length) {
            return;
        }
        for (int v = current[length - 1] + 1; v < matrix.size(); v++) {
            double extended = diameter;
            for (int i = 0; i < length && extended <= maxDiameter; i++) {
                extended = Math.max(extended, matrix.get(current[i], v));
            }
            if (extended <= maxDiameter) {
                current[length] = v;
                expand(matrix, current, length + 1, extended, output);
            }
        }
    }

    /**
     * Standard column reduction of the boundary matrix. A column whose lowest
     * entry is already owned by an earlier column is added to it until the
     * lowest entry is new or the column is empty.
     *
     * @param filtration an ordered filtration
     * @return diagrams for dimensions 0 to maxDimension
     */
    public PersistenceDiagrams computePersistence(Filtration filtration) {
        checkNotNull(filtration, "filtration must not be null");
        int size = filtration.size();
        int[][] columns = new int[size][];
        int[] owner = new int[size];
        Arrays.fill(owner, -1);
        boolean[] killed = new boolean[size];

        List<List<PersistencePoint>> points = new ArrayList<>();
        for (int d = 0; d <= maxDimension; d++) {
            points.add(new ArrayList<>());
        }

        for (int j = 0; j < size; j++) {
            int[] column = filtration.boundary(j);
            while (column.length > 0 && owner[low(column)] >= 0) {
                column = add(column, columns[owner[low(column)]]);
            }
            columns[j] = column;
            if (column.length > 0) {
                int birthIndex = low(column);
                owner[birthIndex] = j;
                killed[birthIndex] = true;
                Simplex creator = filtration.get(birthIndex);
                double birth = creator.getDiameter();
                double death = filtration.get(j).getDiameter();
                if (creator.getDimension() <= maxDimension && death > birth) {
                    points.get(creator.getDimension()).add(new PersistencePoint(birth, death));
                }
            }
        }

        for (int i = 0; i < size; i++) {
            Simplex simplex = filtration.get(i);
            if (columns[i].length == 0 && !killed[i] && simplex.getDimension() <= maxDimension) {
                points.get(simplex.getDimension()).add(PersistencePoint.essential(simplex.getDiameter()));
            }
        }

        List<PersistenceDiagram> diagrams = new ArrayList<>();
        for (int d = 0; d <= maxDimension; d++) {
            diagrams.add(new PersistenceDiagram(d, points.get(d)));
            logger.debug("dimension {} has {} persistence points", d, points.get(d).size());
        }
        return new PersistenceDiagrams(diagrams);
    }

    private static int low(int[] column) {
        return column[column.length - 1];
    }

    /**
     * sum over Z/2 of two sorted columns, i.e. their symmetric difference
     */
    static int[] add(int[] a, int[] b) {
        int[] answer = new int[a.length + b.length];
        int i = 0;
        int j = 0;
        int k = 0;
        while (i < a.length && j < b.length) {
            if (a[i] < b[j]) {
                answer[k++] = a[i++];
            } else if (a[i] > b[j]) {
                answer[k++] = b[j++];
            } else {
                i++;
                j++;
            }
        }
        while (i < a.length) {
            answer[k++] = a[i++];
        }
        while (j < b.length) {
            answer[k++] = b[j++];
        }
        return Arrays.copyOf(answer, k);
    }
}
