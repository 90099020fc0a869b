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

package com.amazon.topologicaloutlier.config;

/**
 * Options for turning the topological structure of a distance matrix into
 * outlier scores. Each option names the structure it consumes.
 */
public enum ScoringStrategy {

    /**
     * weight of the lightest spanning tree edge at a point, min-max normalized
     * over the tree; the nearest neighbor persistence of the point
     */
    MIN_INCIDENT_EDGE(Structure.SPANNING_TREE),
    /**
     * weight of the heaviest spanning tree edge at a point
     */
    MAX_INCIDENT_EDGE(Structure.SPANNING_TREE),
    /**
     * distance along tree edges to the centroid of the spanning tree
     */
    TREE_ECCENTRICITY(Structure.SPANNING_TREE),
    /**
     * distance of the dimension 0 generator of a point to the bulk of the
     * population persistence diagram
     */
    DIAGRAM_BULK(Structure.FILTRATION),
    /**
     * distance to the medoid of the distance matrix
     */
    MEDOID_DISTANCE(Structure.DISTANCE_MATRIX);

    /**
     * the structure a strategy is computed from
     */
    public enum Structure {
        SPANNING_TREE, FILTRATION, DISTANCE_MATRIX
    }

    private final Structure structure;

    ScoringStrategy(Structure structure) {
        this.structure = structure;
    }

    public Structure getStructure() {
        return structure;
    }
}
