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

package com.amazon.topologicaloutlier.scoring;

import java.util.Arrays;

import org.apache.commons.math3.stat.descriptive.rank.Median;

import com.amazon.topologicaloutlier.homology.PersistenceResult;

/**
 * Scores a point by how far its dimension 0 generator lies from the bulk of the
 * population diagram. Every point is born at 0 and embedded by the death of
 * its generator, the diameter of the first filtration edge that touches it.
 * The score is the distance of that death to the median death over all points.
 * A point that no edge reaches within the maximum diameter never dies and
 * scores {@code +Infinity}.
 */
public class DiagramBulkScorer implements IOutlierScorer<PersistenceResult> {

    @Override
    public double[] score(PersistenceResult result) {
        double[] deaths = result.getVertexDeaths();
        double[] finite = Arrays.stream(deaths).filter(Double::isFinite).toArray();
        double[] scores = new double[deaths.length];
        if (finite.length == 0) {
            Arrays.fill(scores, Double.POSITIVE_INFINITY);
            return scores;
        }
        double median = new Median().evaluate(finite);
        for (int i = 0; i < deaths.length; i++) {
            scores[i] = Double.isFinite(deaths[i]) ? Math.abs(deaths[i] - median) : Double.POSITIVE_INFINITY;
        }
        return scores;
    }
}
