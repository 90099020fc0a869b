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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.topologicaloutlier.homology.PersistenceDiagram;
import com.amazon.topologicaloutlier.homology.PersistenceDiagrams;
import com.amazon.topologicaloutlier.homology.PersistencePoint;

public class PersistenceDiagramDistanceTest {

    private PersistenceDiagramDistance distance;

    @BeforeEach
    public void setUp() {
        distance = new PersistenceDiagramDistance();
    }

    private static PersistenceDiagram diagram(int dimension, PersistencePoint... points) {
        return new PersistenceDiagram(dimension, Arrays.asList(points));
    }

    @Test
    public void testEmptyDiagrams() {
        assertEquals(0.0, distance.distance(PersistenceDiagram.empty(0), PersistenceDiagram.empty(0)));
        // (0, 2) is matched to the diagonal at (2 / 2)^2
        assertEquals(1.0, distance.distance(PersistenceDiagram.empty(0), diagram(0, new PersistencePoint(0, 2))),
                1e-12);
    }

    @Test
    public void testFinitePoints() {
        assertEquals(0.5, distance.distance(diagram(1, new PersistencePoint(0, 2)),
                diagram(1, new PersistencePoint(0, 2.5))), 1e-12);

        // matching (1, 1.2) to (5, 5.2) costs 4, sending both to the diagonal costs 2 * 0.1
        PersistenceDiagram a = diagram(1, new PersistencePoint(1, 1.2));
        PersistenceDiagram b = diagram(1, new PersistencePoint(5, 5.2));
        assertEquals(Math.sqrt(0.02), distance.distance(a, b), 1e-12);
        assertEquals(distance.distance(a, b), distance.distance(b, a), 1e-12);
    }

    @Test
    public void testOptimalMatching() {
        PersistenceDiagram a = diagram(0, new PersistencePoint(0, 1), new PersistencePoint(0, 3));
        PersistenceDiagram b = diagram(0, new PersistencePoint(0, 3.5), new PersistencePoint(0, 1.5));
        assertEquals(Math.sqrt(0.5), distance.distance(a, b), 1e-12);
        assertEquals(0.0, distance.distance(a, a));
    }

    @Test
    public void testEssentialPoints() {
        assertEquals(1.0, distance.distance(diagram(0, PersistencePoint.essential(0)),
                diagram(0, PersistencePoint.essential(1))), 1e-12);
        PersistenceDiagram extra = diagram(0, PersistencePoint.essential(0), new PersistencePoint(0, 2));
        PersistenceDiagram single = diagram(0, new PersistencePoint(0, 2));
        assertEquals(2.0, distance.distance(extra, single), 1e-12);
        assertEquals(2.0, distance.distance(single, extra), 1e-12);
    }

    @Test
    public void testSurplusEssentialPointIsNeverFree() {
        PersistenceDiagram two = diagram(0, PersistencePoint.essential(0), PersistencePoint.essential(0));
        PersistenceDiagram one = diagram(0, PersistencePoint.essential(0));
        // no finite point sets a scale, so the unmatched component costs 1
        assertEquals(1.0, distance.distance(two, one), 1e-12);
        assertEquals(1.0, distance.distance(one, two), 1e-12);

        PersistenceDiagramDistance bounded = new PersistenceDiagramDistance(2.0, 3.0);
        assertEquals(3.0, bounded.distance(two, one), 1e-12);
        assertEquals(0.0, bounded.distance(two, two));
        // a finite death beyond the horizon takes over
        PersistenceDiagram wide = diagram(0, PersistencePoint.essential(0), new PersistencePoint(0, 4));
        PersistenceDiagram narrow = diagram(0, new PersistencePoint(0, 4));
        assertEquals(4.0, bounded.distance(wide, narrow), 1e-12);
        assertThrows(IllegalArgumentException.class, () -> new PersistenceDiagramDistance(2.0, -1.0));
        assertThrows(IllegalArgumentException.class,
                () -> new PersistenceDiagramDistance(2.0, Double.POSITIVE_INFINITY));
    }

    @Test
    public void testOrder() {
        PersistenceDiagramDistance first = new PersistenceDiagramDistance(1);
        PersistenceDiagram a = diagram(0, new PersistencePoint(0, 1), new PersistencePoint(0, 3));
        assertEquals(2.0, first.distance(a, PersistenceDiagram.empty(0)), 1e-12);
        assertEquals(2.0, first.powerCost(a, diagram(0)), 1e-12);
        assertThrows(IllegalArgumentException.class, () -> new PersistenceDiagramDistance(0.5));
        assertThrows(IllegalArgumentException.class,
                () -> new PersistenceDiagramDistance(Double.POSITIVE_INFINITY));
    }

    @Test
    public void testDimensionsMustAgree() {
        assertThrows(IllegalArgumentException.class,
                () -> distance.distance(PersistenceDiagram.empty(0), PersistenceDiagram.empty(1)));
    }

    @Test
    public void testFamilyDistance() {
        PersistenceDiagrams a = new PersistenceDiagrams(
                Arrays.asList(diagram(0, new PersistencePoint(0, 2)), diagram(1, new PersistencePoint(1, 3))));
        PersistenceDiagrams b = new PersistenceDiagrams(Collections.singletonList(PersistenceDiagram.empty(0)));
        DiagramFamilyDistance family = new DiagramFamilyDistance();
        // 1 from dimension 0 and 1 from dimension 1
        assertEquals(Math.sqrt(2.0), family.distance(a, b), 1e-12);
        assertEquals(family.distance(a, b), family.distance(b, a), 1e-12);
        assertEquals(0.0, family.distance(a, a));
    }
}
