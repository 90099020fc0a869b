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

import lombok.Getter;

/**
 * A weighted undirected edge with {@code source < target}. Edges compare by
 * weight, then by source, then by target.
 */
@Getter
public class Edge implements Comparable<Edge> {

    private final int source;
    private final int target;
    private final double weight;

    public Edge(int source, int target, double weight) {
        checkArgument(source != target, "self loops are not edges");
        checkArgument(!Double.isNaN(weight) && weight >= 0, "weight must be non-negative");
        this.source = Math.min(source, target);
        this.target = Math.max(source, target);
        this.weight = weight;
    }

    public boolean isIncidentTo(int vertex) {
        return source == vertex || target == vertex;
    }

    /**
     * @param vertex one end of the edge
     * @return the other end
     */
    public int opposite(int vertex) {
        checkArgument(isIncidentTo(vertex), "vertex is not on this edge");
        return vertex == source ? target : source;
    }

    @Override
    public int compareTo(Edge other) {
        int answer = Double.compare(weight, other.weight);
        if (answer == 0) {
            answer = Integer.compare(source, other.source);
        }
        if (answer == 0) {
            answer = Integer.compare(target, other.target);
        }
        return answer;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Edge)) {
            return false;
        }
        Edge other = (Edge) o;
        return source == other.source && target == other.target && Double.compare(weight, other.weight) == 0;
    }

    @Override
    public int hashCode() {
        return (31 * source + target) * 31 + Double.hashCode(weight);
    }

    @Override
    public String toString() {
        return "(" + source + "-" + target + ", " + weight + ")";
    }
}
