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
import java.util.Comparator;

import lombok.Getter;

/**
 * A simplex of a Vietoris-Rips complex: a sorted set of vertex indices and the
 * diameter at which it enters the filtration.
 */
@Getter
public class Simplex {

    /**
     * the order of a filtration: diameter, then dimension, then the vertex sets
     * compared lexicographically
     */
    public static final Comparator<Simplex> FILTRATION_ORDER = Comparator.comparingDouble(Simplex::getDiameter)
            .thenComparingInt(Simplex::getDimension).thenComparing(Simplex::compareVertices);

    private final int[] vertices;
    private final double diameter;

    public Simplex(int[] vertices, double diameter) {
        this.vertices = vertices;
        this.diameter = diameter;
    }

    public int getDimension() {
        return vertices.length - 1;
    }

    public int getVertex(int i) {
        return vertices[i];
    }

    public int[] getVertices() {
        return vertices.clone();
    }

    private static int compareVertices(Simplex a, Simplex b) {
        return Arrays.compare(a.vertices, b.vertices);
    }

    @Override
    public String toString() {
        return Arrays.toString(vertices) + "@" + diameter;
    }
}
