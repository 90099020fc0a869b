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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

import lombok.Getter;

import com.amazon.topologicaloutlier.util.UnionFind;

/**
 * A minimum spanning tree, or forest when the candidate edges did not connect
 * every vertex. Immutable.
 */
public class SpanningTree {

    @Getter
    private final int numberOfVertices;
    private final List<Edge> edges;
    private final List<List<Edge>> incident;
    @Getter
    private final double totalWeight;
    private final int[] component;
    @Getter
    private final int componentCount;

    public SpanningTree(int numberOfVertices, List<Edge> edges) {
        checkArgument(numberOfVertices >= 0, "numberOfVertices must be non-negative");
        checkNotNull(edges, "edges must not be null");
        this.numberOfVertices = numberOfVertices;
        this.edges = Collections.unmodifiableList(new ArrayList<>(edges));
        this.incident = new ArrayList<>(numberOfVertices);
        for (int i = 0; i < numberOfVertices; i++) {
            incident.add(new ArrayList<>());
        }
        UnionFind unionFind = new UnionFind(numberOfVertices);
        double total = 0;
        for (Edge edge : edges) {
            checkArgument(edge.getTarget() < numberOfVertices, "edge " + edge + " leaves the vertex set");
            checkArgument(unionFind.union(edge.getSource(), edge.getTarget()), "edge " + edge + " closes a cycle");
            incident.get(edge.getSource()).add(edge);
            incident.get(edge.getTarget()).add(edge);
            total += edge.getWeight();
        }
        this.totalWeight = total;
        this.componentCount = unionFind.getComponentCount();
        this.component = new int[numberOfVertices];
        for (int i = 0; i < numberOfVertices; i++) {
            component[i] = unionFind.find(i);
        }
    }

    public List<Edge> getEdges() {
        return edges;
    }

    public List<Edge> getIncidentEdges(int vertex) {
        return Collections.unmodifiableList(incident.get(vertex));
    }

    public int degree(int vertex) {
        return incident.get(vertex).size();
    }

    public boolean isConnected() {
        return componentCount <= 1;
    }

    public boolean sameComponent(int a, int b) {
        return component[a] == component[b];
    }

    /**
     * Path lengths along tree edges from one vertex.
     *
     * @param source the start vertex
     * @return distances to every vertex, {@code +Infinity} outside the
     *         component of the source
     */
    public double[] pathDistancesFrom(int source) {
        double[] distances = new double[numberOfVertices];
        Arrays.fill(distances, Double.POSITIVE_INFINITY);
        distances[source] = 0;
        boolean[] visited = new boolean[numberOfVertices];
        visited[source] = true;
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(source);
        while (!stack.isEmpty()) {
            int vertex = stack.pop();
            for (Edge edge : incident.get(vertex)) {
                int next = edge.opposite(vertex);
                if (!visited[next]) {
                    visited[next] = true;
                    distances[next] = distances[vertex] + edge.getWeight();
                    stack.push(next);
                }
            }
        }
        return distances;
    }

    /**
     * @return smallest and largest edge weight, {0, 0} for a tree without edges
     */
    public double[] getWeightRange() {
        if (edges.isEmpty()) {
            return new double[] { 0, 0 };
        }
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (Edge edge : edges) {
            min = Math.min(min, edge.getWeight());
            max = Math.max(max, edge.getWeight());
        }
        return new double[] { min, max };
    }
}
