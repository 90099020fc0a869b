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

import java.util.Arrays;

import lombok.Getter;

/**
 * A filtration together with the persistence diagrams computed from it.
 */
@Getter
public class PersistenceResult {

    private final Filtration filtration;
    private final PersistenceDiagrams diagrams;

    public PersistenceResult(Filtration filtration, PersistenceDiagrams diagrams) {
        this.filtration = filtration;
        this.diagrams = diagrams;
    }

    /**
     * For every vertex, the diameter of the first edge containing it, i.e. the
     * death of the dimension 0 generator born at the vertex if the vertex is
     * always taken to be the younger one of a merge. {@code +Infinity} for a
     * vertex that stays isolated within the filtration.
     *
     * @return one value per vertex
     */
    public double[] getVertexDeaths() {
        double[] deaths = new double[filtration.getNumberOfVertices()];
        Arrays.fill(deaths, Double.POSITIVE_INFINITY);
        for (Simplex simplex : filtration.getSimplices()) {
            if (simplex.getDimension() == 1) {
                for (int v : simplex.getVertices()) {
                    if (deaths[v] == Double.POSITIVE_INFINITY) {
                        deaths[v] = simplex.getDiameter();
                    }
                }
            }
        }
        return deaths;
    }
}
