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

import com.amazon.topologicaloutlier.tree.Edge;
import com.amazon.topologicaloutlier.tree.SpanningTree;

/**
 * The nearest neighbor persistence of a point: the weight of its lightest
 * spanning tree edge, i.e. the scale at which it stops being an isolated
 * component, rescaled to [0, 1] by the smallest and largest edge weight of the
 * tree. A vertex without edges never stops being isolated within the forest
 * and scores 1, the top of the range. Vertices of a tree whose edges all have
 * the same weight score 0.
 */
public class MinIncidentEdgeScorer implements IOutlierScorer<SpanningTree> {

    @Override
    public double[] score(SpanningTree tree) {
        int n = tree.getNumberOfVertices();
        double[] range = tree.getWeightRange();
        double width = range[1] - range[0];
        double[] scores = new double[n];
        for (int v = 0; v < n; v++) {
            if (tree.degree(v) == 0) {
                scores[v] = 1.0;
                continue;
            }
            if (!(width > 0)) {
                continue;
            }
            double lightest = Double.POSITIVE_INFINITY;
            for (Edge edge : tree.getIncidentEdges(v)) {
                lightest = Math.min(lightest, edge.getWeight());
            }
            scores[v] = (lightest - range[0]) / width;
        }
        return scores;
    }
}
