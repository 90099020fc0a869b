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

import java.util.Comparator;

import lombok.Getter;

/**
 * A (birth, death) pair of a persistence diagram. A death of
 * {@code +Infinity} marks an essential class, one that never dies within the
 * filtration.
 */
@Getter
public class PersistencePoint {

    public static final Comparator<PersistencePoint> ORDER = Comparator.comparingDouble(PersistencePoint::getBirth)
            .thenComparingDouble(PersistencePoint::getDeath);

    private final double birth;
    private final double death;

    public PersistencePoint(double birth, double death) {
        checkArgument(Double.isFinite(birth), "birth must be finite");
        checkArgument(!Double.isNaN(death) && birth <= death, "birth must not exceed death");
        this.birth = birth;
        this.death = death;
    }

    public static PersistencePoint essential(double birth) {
        return new PersistencePoint(birth, Double.POSITIVE_INFINITY);
    }

    public boolean isEssential() {
        return death == Double.POSITIVE_INFINITY;
    }

    public double getPersistence() {
        return death - birth;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PersistencePoint)) {
            return false;
        }
        PersistencePoint other = (PersistencePoint) o;
        return Double.compare(birth, other.birth) == 0 && Double.compare(death, other.death) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(birth) + Double.hashCode(death);
    }

    @Override
    public String toString() {
        return "(" + birth + ", " + death + ")";
    }
}
