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


package com.amazon.topologicaloutlier.state;

import static com.amazon.topologicaloutlier.state.Version.V1_0;

import java.io.Serializable;
import java.util.List;

import lombok.Data;

/**
 * The data of an {@link com.amazon.topologicaloutlier.returntypes.OutlierReport}
 * in a form that can be serialized and deserialized. The filtration is not
 * stored; it is rebuilt from the distance matrix with the saved maximum
 * dimension and diameter.
 */
@Data
public class OutlierReportState implements Serializable {

    private static final long serialVersionUID = 1L;

    private String version = V1_0;

    /**
     * ranked identifiers, most anomalous first
     */
    private String[] rankedIds;

    private double[] rankedScores;

    private String[] labels;

    private double[][] distances;

    private boolean spanningTreePresent;

    private int[] treeSources;

    private int[] treeTargets;

    private double[] treeWeights;

    private boolean persistencePresent;

    private int maxDimension;

    private double maxDiameter;

    private List<PersistenceDiagramState> diagrams;

    private String[] excludedIds;
}
