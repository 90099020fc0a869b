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

/**
 * A family of persistence diagrams indexed by homological dimension 0..D.
 */
public class PersistenceDiagrams {

    private final List<PersistenceDiagram> diagrams;

    public PersistenceDiagrams(List<PersistenceDiagram> diagrams) {
        checkNotNull(diagrams, "diagrams must not be null");
        for (int d = 0; d < diagrams.size(); d++) {
            checkArgument(diagrams.get(d).getDimension() == d, "diagram " + d + " has the wrong dimension");
        }
        this.diagrams = Collections.unmodifiableList(new ArrayList<>(diagrams));
    }

    /**
     * @return D, the largest dimension with a diagram; -1 for an empty family
     */
    public int getMaxDimension() {
        return diagrams.size() - 1;
    }

    /**
     * @param dimension a homological dimension
     * @return its diagram, an empty diagram for a dimension beyond D
     */
    public PersistenceDiagram get(int dimension) {
        checkArgument(dimension >= 0, "dimension must be non-negative");
        return dimension < diagrams.size() ? diagrams.get(dimension) : PersistenceDiagram.empty(dimension);
    }

    public List<PersistenceDiagram> getDiagrams() {
        return diagrams;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PersistenceDiagrams)) {
            return false;
        }
        return diagrams.equals(((PersistenceDiagrams) o).diagrams);
    }

    @Override
    public int hashCode() {
        return diagrams.hashCode();
    }

    @Override
    public String toString() {
        return diagrams.toString();
    }
}
