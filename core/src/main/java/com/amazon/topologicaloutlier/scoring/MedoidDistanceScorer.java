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

import com.amazon.topologicaloutlier.matrix.DistanceMatrix;

/**
 * Distance to the medoid, the item with the smallest sum of distances to all
 * others. Sums equal up to rounding are tied and the tie goes to the smaller
 * label, so the scores do not depend on the order of the rows.
 */
public class MedoidDistanceScorer implements IOutlierScorer<DistanceMatrix> {

    static final double TIE_TOLERANCE = 1e-12;

    @Override
    public double[] score(DistanceMatrix matrix) {
        int medoid = medoid(matrix);
        double[] scores = new double[matrix.size()];
        for (int i = 0; i < scores.length; i++) {
            scores[i] = matrix.get(i, medoid);
        }
        return scores;
    }

    public static int medoid(DistanceMatrix matrix) {
        int best = -1;
        double bestTotal = Double.POSITIVE_INFINITY;
        for (int i = 0; i < matrix.size(); i++) {
            double total = 0;
            for (int j = 0; j < matrix.size(); j++) {
                total += matrix.get(i, j);
            }
            if (best < 0 || precedes(total, matrix.getLabel(i), bestTotal, matrix.getLabel(best))) {
                best = i;
                bestTotal = total;
            }
        }
        return best;
    }

    static boolean precedes(double total, String label, double bestTotal, String bestLabel) {
        if (Math.abs(total - bestTotal) <= TIE_TOLERANCE * Math.max(1.0, Math.abs(bestTotal))) {
            return label.compareTo(bestLabel) < 0;
        }
        return total < bestTotal;
    }
}
