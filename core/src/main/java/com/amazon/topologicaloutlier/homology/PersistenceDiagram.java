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

package com.amazon.topologicaloutlier.homology;

import static com.amazon.topologicaloutlier.CommonUtils.checkArgument;
import static com.amazon.topologicaloutlier.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import lombok.Getter;

/**
 * The persistence diagram of one homological dimension: a multiset of
 * (birth, death) pairs. Points are kept sorted by {@link PersistencePoint#ORDER}
 * so that two diagrams are equal exactly when they are equal as multisets.
 */
public class PersistenceDiagram {

    @Getter
    private final int dimension;
    private final List<PersistencePoint> points;

    public PersistenceDiagram(int dimension, List<PersistencePoint> points) {
        checkArgument(dimension >= 0, "dimension must be non-negative");
        checkNotNull(points, "points must not be null");
        List<PersistencePoint> sorted = new ArrayList<>(points);
        sorted.sort(PersistencePoint.ORDER);
        this.dimension = dimension;
        this.points = Collections.unmodifiableList(sorted);
    }

    public static PersistenceDiagram empty(int dimension) {
        return new PersistenceDiagram(dimension, Collections.emptyList());
    }

    public List<PersistencePoint> getPoints() {
        return points;
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public List<PersistencePoint> getFinitePoints() {
        return points.stream().filter(p -> !p.isEssential()).collect(Collectors.toList());
    }

    public List<PersistencePoint> getEssentialPoints() {
        return points.stream().filter(PersistencePoint::isEssential).collect(Collectors.toList());
    }

    /**
     * @return the largest finite birth or death value, 0 for a diagram without
     *         finite values
     */
    public double getMaxFiniteValue() {
        double max = 0;
        for (PersistencePoint p : points) {
            max = Math.max(max, p.getBirth());
            if (!p.isEssential()) {
                max = Math.max(max, p.getDeath());
            }
        }
        return max;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PersistenceDiagram)) {
            return false;
        }
        PersistenceDiagram other = (PersistenceDiagram) o;
        return dimension == other.dimension && points.equals(other.points);
    }

    @Override
    public int hashCode() {
        return 31 * dimension + points.hashCode();
    }

    @Override
    public String toString() {
        return "H" + dimension + points;
    }
}
