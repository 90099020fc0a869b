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

package com.amazon.topologicaloutlier.tree;

import static com.amazon.topologicaloutlier.CommonUtils.checkArgument;
import static com.amazon.topologicaloutlier.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;

import lombok.Getter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.topologicaloutlier.matrix.DistanceMatrix;
import com.amazon.topologicaloutlier.util.UnionFind;

/**
 * Kruskal's algorithm over a distance matrix. Candidate edges are sorted by
 * (weight, i, j) so the tree is unique even when weights tie.
 *
 * With {@code nearestNeighbors = k > 0} only the edges from each vertex to its
 * k nearest neighbours are candidates (an edge is kept if either end selects
 * it) and the answer may be a spanning forest. Infinite distances are never
 * candidates.
 */
@Getter
public class SpanningTreeEngine {

    private static final Logger logger = LogManager.getLogger(SpanningTreeEngine.class);

    /**
     * 0 means every pair is a candidate edge
     */
    public static final int DEFAULT_NEAREST_NEIGHBORS = 0;

    private final int nearestNeighbors;

    public SpanningTreeEngine() {
        this(DEFAULT_NEAREST_NEIGHBORS);
    }

    public SpanningTreeEngine(int nearestNeighbors) {
        checkArgument(nearestNeighbors >= 0, "nearestNeighbors must be non-negative");
        this.nearestNeighbors = nearestNeighbors;
    }

    public SpanningTree build(DistanceMatrix matrix) {
        checkNotNull(matrix, "matrix must not be null");
        int n = matrix.size();
        List<Edge> candidates = candidateEdges(matrix);
        Collections.sort(candidates);

        UnionFind unionFind = new UnionFind(n);
        List<Edge> chosen = new ArrayList<>(Math.max(n - 1, 0));
        for (Edge edge : candidates) {
            if (unionFind.union(edge.getSource(), edge.getTarget())) {
                chosen.add(edge);
                if (chosen.size() == n - 1) {
                    break;
                }
            }
        }

        SpanningTree tree = new SpanningTree(n, chosen);
        if (!tree.isConnected()) {
            logger.warn("candidate edges leave {} components among {} vertices", tree.getComponentCount(), n);
        }
        logger.debug("spanning tree over {} vertices has total weight {}", n, tree.getTotalWeight());
        return tree;
    }

    List<Edge> candidateEdges(DistanceMatrix matrix) {
        int n = matrix.size();
        boolean[][] selected = new boolean[n][n];
        if (nearestNeighbors == 0 || nearestNeighbors >= n - 1) {
            for (boolean[] row : selected) {
                Arrays.fill(row, true);
            }
        } else {
            for (int i = 0; i < n; i++) {
                int vertex = i;
                int[] neighbors = IntStream.range(0, n).filter(j -> j != vertex).boxed()
                        .sorted(Comparator.comparingDouble((Integer j) -> matrix.get(vertex, j))
                                .thenComparingInt(j -> j))
                        .limit(nearestNeighbors).mapToInt(Integer::intValue).toArray();
                for (int j : neighbors) {
                    selected[i][j] = true;
                    selected[j][i] = true;
                }
            }
        }

        List<Edge> edges = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                if (selected[i][j] && Double.isFinite(matrix.get(i, j))) {
                    edges.add(new Edge(i, j, matrix.get(i, j)));
                }
            }
        }
        return edges;
    }
}
