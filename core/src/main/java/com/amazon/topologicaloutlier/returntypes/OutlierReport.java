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

package com.amazon.topologicaloutlier.returntypes;

import static com.amazon.topologicaloutlier.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import lombok.Getter;

import com.amazon.topologicaloutlier.homology.PersistenceResult;
import com.amazon.topologicaloutlier.matrix.DistanceMatrix;
import com.amazon.topologicaloutlier.tree.SpanningTree;

/**
 * The outcome of one detection run: the ranking together with the
 * intermediate structures it was derived from, and the identifiers of the
 * series that were excluded because their fit diverged.
 */
@Getter
public class OutlierReport {

    private final OutlierRanking ranking;
    private final DistanceMatrix distanceMatrix;
    private final Optional<SpanningTree> spanningTree;
    private final Optional<PersistenceResult> persistence;
    private final List<String> excludedIds;

    public OutlierReport(OutlierRanking ranking, DistanceMatrix distanceMatrix, Optional<SpanningTree> spanningTree,
            Optional<PersistenceResult> persistence, List<String> excludedIds) {
        this.ranking = checkNotNull(ranking, "ranking must not be null");
        this.distanceMatrix = checkNotNull(distanceMatrix, "distanceMatrix must not be null");
        this.spanningTree = checkNotNull(spanningTree, "spanningTree must not be null");
        this.persistence = checkNotNull(persistence, "persistence must not be null");
        this.excludedIds = Collections.unmodifiableList(new ArrayList<>(excludedIds));
    }
}
