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


package com.amazon.topologicaloutlier.serialize;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.topologicaloutlier.TopologicalOutlierDetector;
import com.amazon.topologicaloutlier.config.ScoringStrategy;
import com.amazon.topologicaloutlier.matrix.DistanceMatrix;
import com.amazon.topologicaloutlier.returntypes.OutlierReport;
import com.amazon.topologicaloutlier.testutils.PointCloudTestData;

public class OutlierReportSerDeTest {

    private OutlierReportSerDe serDe;
    private DistanceMatrix matrix;

    @BeforeEach
    public void setUp() {
        serDe = new OutlierReportSerDe();
        matrix = DistanceMatrix.of(PointCloudTestData.twoPairsAndOutlier());
    }

    private OutlierReport report(ScoringStrategy strategy) {
        return TopologicalOutlierDetector.builder().scoringStrategy(strategy).maxDiameter(20.0).build()
                .score(matrix);
    }

    @Test
    public void testRoundTripWithInfiniteValues() {
        OutlierReport report = report(ScoringStrategy.DIAGRAM_BULK);
        String json = serDe.toJson(report);
        assertTrue(json.contains("Infinity"));

        OutlierReport restored = serDe.fromJson(json);
        assertEquals(report.getRanking().getItems().toString(), restored.getRanking().getItems().toString());
        assertEquals(Double.POSITIVE_INFINITY, restored.getRanking().getScore("4"));
        assertEquals(report.getPersistence().get().getDiagrams(), restored.getPersistence().get().getDiagrams());
        assertArrayEquals(matrix.getLabels(), restored.getDistanceMatrix().getLabels());
        for (int i = 0; i < matrix.size(); i++) {
            for (int j = 0; j < matrix.size(); j++) {
                assertEquals(matrix.get(i, j), restored.getDistanceMatrix().get(i, j));
            }
        }
    }

    @Test
    public void testRoundTripSpanningTree() {
        OutlierReport report = report(ScoringStrategy.MIN_INCIDENT_EDGE);
        OutlierReport restored = serDe.fromJson(serDe.toJson(report));
        assertEquals(report.getSpanningTree().get().getEdges(), restored.getSpanningTree().get().getEdges());
        assertFalse(restored.getPersistence().isPresent());
        assertEquals("4", restored.getRanking().getItems().get(0).getId());
    }
}
