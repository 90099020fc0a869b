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

package com.amazon.topologicaloutlier.scoring;

import static com.amazon.topologicaloutlier.CommonUtils.checkArgument;

import java.util.Arrays;

import com.amazon.topologicaloutlier.tree.SpanningTree;

/**
 * Path length along tree edges from a point to the centroid of its component.
 * The centroid is the vertex with the smallest total path length to the other
 * vertices of the component. Totals equal up to rounding are tied; the tie
 * goes to the smaller label when labels are given and to the lower index
 * otherwise.
 */
public class TreeEccentricityScorer implements IOutlierScorer<SpanningTree> {

    private final String[] labels;

    public TreeEccentricityScorer() {
        this(null);
    }

    /**
     * @param labels item identifiers indexed like the tree vertices, or null
     */
    public TreeEccentricityScorer(String[] labels) {
        this.labels = labels;
    }

    @Override
    public double[] score(SpanningTree tree) {
        int n = tree.getNumberOfVertices();
        checkArgument(labels == null || labels.length == n, "one label per vertex is required");
        double[][] paths = new double[n][];
        double[] totals = new double[n];
        for (int v = 0; v < n; v++) {
            paths[v] = tree.pathDistancesFrom(v);
            for (int w = 0; w < n; w++) {
                if (tree.sameComponent(v, w)) {
                    totals[v] += paths[v][w];
                }
            }
        }

        int[] centroid = new int[n];
        Arrays.fill(centroid, -1);
        for (int v = 0; v < n; v++) {
            if (centroid[v] >= 0) {
                continue;
            }
            int best = v;
            for (int w = v + 1; w < n; w++) {
                if (tree.sameComponent(v, w) && precedes(w, best, totals)) {
                    best = w;
                }
            }
            for (int w = v; w < n; w++) {
                if (tree.sameComponent(v, w)) {
                    centroid[w] = best;
                }
            }
        }

        double[] scores = new double[n];
        for (int v = 0; v < n; v++) {
            scores[v] = paths[centroid[v]][v];
        }
        return scores;
    }

    private boolean precedes(int w, int best, double[] totals) {
        if (labels != null) {
            return MedoidDistanceScorer.precedes(totals[w], labels[w], totals[best], labels[best]);
        }
        // w > best, so a tie keeps best
        return MedoidDistanceScorer.precedes(totals[w], "1", totals[best], "0");
    }
}
