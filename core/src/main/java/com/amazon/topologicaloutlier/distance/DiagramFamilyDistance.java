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

package com.amazon.topologicaloutlier.distance;

import static com.amazon.topologicaloutlier.CommonUtils.checkNotNull;

import lombok.Getter;

import com.amazon.topologicaloutlier.homology.PersistenceDiagrams;

/**
 * Combines the per dimension distances of two diagram families as
 * {@code (sum_d W_p(d)^p)^(1/p)}. A dimension present in only one family is
 * compared against an empty diagram.
 */
@Getter
public class DiagramFamilyDistance implements IDistanceMetric<PersistenceDiagrams> {

    private final PersistenceDiagramDistance diagramDistance;

    public DiagramFamilyDistance() {
        this(new PersistenceDiagramDistance());
    }

    public DiagramFamilyDistance(PersistenceDiagramDistance diagramDistance) {
        this.diagramDistance = checkNotNull(diagramDistance, "diagramDistance must not be null");
    }

    @Override
    public double distance(PersistenceDiagrams a, PersistenceDiagrams b) {
        int maxDimension = Math.max(a.getMaxDimension(), b.getMaxDimension());
        double total = 0;
        for (int d = 0; d <= maxDimension; d++) {
            total += diagramDistance.powerCost(a.get(d), b.get(d));
        }
        return Math.pow(total, 1.0 / diagramDistance.getOrder());
    }
}
