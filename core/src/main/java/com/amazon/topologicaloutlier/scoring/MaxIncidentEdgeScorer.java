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
 * Weight of the heaviest spanning tree edge at a point; 0 for a vertex without
 * edges.
 */
public class MaxIncidentEdgeScorer implements IOutlierScorer<SpanningTree> {

    @Override
    public double[] score(SpanningTree tree) {
        double[] scores = new double[tree.getNumberOfVertices()];
        for (Edge edge : tree.getEdges()) {
            scores[edge.getSource()] = Math.max(scores[edge.getSource()], edge.getWeight());
            scores[edge.getTarget()] = Math.max(scores[edge.getTarget()], edge.getWeight());
        }
        return scores;
    }
}
