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
import static com.amazon.topologicaloutlier.CommonUtils.checkState;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;

/**
 * A totally ordered sequence of simplices, sorted by
 * {@link Simplex#FILTRATION_ORDER}. Every face of a simplex precedes it.
 *
 * Simplices are located by their combinatorial number
 * {@code sum_i C(v_i, i + 1)} which is unique among the simplices of one
 * dimension.
 */
public class Filtration {

    @Getter
    private final int numberOfVertices;
    @Getter
    private final int maxSimplexDimension;
    @Getter
    private final double maxDiameter;
    private final List<Simplex> simplices;
    private final List<Map<Long, Integer>> positions;
    private final long[][] binomials;

    Filtration(int numberOfVertices, int maxSimplexDimension, double maxDiameter, List<Simplex> sorted) {
        this.numberOfVertices = numberOfVertices;
        this.maxSimplexDimension = maxSimplexDimension;
        this.maxDiameter = maxDiameter;
        this.simplices = Collections.unmodifiableList(new ArrayList<>(sorted));
        this.binomials = binomialTable(numberOfVertices, maxSimplexDimension + 1);
        this.positions = new ArrayList<>();
        for (int d = 0; d <= maxSimplexDimension; d++) {
            positions.add(new HashMap<>());
        }
        for (int i = 0; i < simplices.size(); i++) {
            Simplex simplex = simplices.get(i);
            Integer previous = positions.get(simplex.getDimension()).put(key(simplex.getVertices()), i);
            checkState(previous == null, "duplicate simplex " + simplex);
        }
    }

    public int size() {
        return simplices.size();
    }

    public Simplex get(int index) {
        return simplices.get(index);
    }

    public List<Simplex> getSimplices() {
        return simplices;
    }

    /**
     * @param vertices sorted vertex indices
     * @return position of the simplex in the filtration, or -1 if it was not
     *         admitted
     */
    public int indexOf(int[] vertices) {
        int dimension = vertices.length - 1;
        checkArgument(dimension >= 0, "a simplex has at least one vertex");
        if (dimension > maxSimplexDimension) {
            return -1;
        }
        Integer position = positions.get(dimension).get(key(vertices));
        return position == null ? -1 : position;
    }

    /**
     * Positions of the codimension one faces of a simplex, in increasing order.
     *
     * @param index position of a simplex
     * @return positions of its facets; empty for a vertex
     */
    public int[] boundary(int index) {
        Simplex simplex = simplices.get(index);
        int dimension = simplex.getDimension();
        if (dimension == 0) {
            return new int[0];
        }
        int[] vertices = simplex.getVertices();
        int[] answer = new int[dimension + 1];
        int[] face = new int[dimension];
        for (int skip = 0; skip <= dimension; skip++) {
            for (int i = 0, k = 0; i <= dimension; i++) {
                if (i != skip) {
                    face[k++] = vertices[i];
                }
            }
            int position = indexOf(face);
            checkState(position >= 0 && position < index, "face of " + simplex + " is missing");
            answer[skip] = position;
        }
        Arrays.sort(answer);
        return answer;
    }

    private long key(int[] vertices) {
        long key = 0;
        for (int i = 0; i < vertices.length; i++) {
            key += binomials[vertices[i]][i + 1];
        }
        return key;
    }

    private static long[][] binomialTable(int n, int k) {
        long[][] table = new long[Math.max(n, 1)][k + 1];
        for (int i = 0; i < table.length; i++) {
            table[i][0] = 1;
            for (int j = 1; j <= k; j++) {
                table[i][j] = (i == 0) ? 0 : table[i - 1][j - 1] + table[i - 1][j];
            }
        }
        return table;
    }
}
