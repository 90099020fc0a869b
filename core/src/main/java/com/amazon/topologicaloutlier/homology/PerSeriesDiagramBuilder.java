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
import static com.amazon.topologicaloutlier.CommonUtils.l2Distance;
import static com.amazon.topologicaloutlier.errors.InsufficientDataException.checkSufficient;

import java.util.function.Function;

import lombok.Getter;

import com.amazon.topologicaloutlier.inputtypes.TimeSeries;
import com.amazon.topologicaloutlier.matrix.DistanceMatrix;

/**
 * The persistence diagrams of a single series. The values are delay embedded,
 * point {@code k} being
 * {@code (v[k], v[k + delay], ..., v[k + (embeddingDimension - 1) * delay])},
 * and the Vietoris-Rips persistence of the resulting point cloud is computed
 * with the Euclidean distance.
 */
@Getter
public class PerSeriesDiagramBuilder implements Function<TimeSeries, PersistenceDiagrams> {

    public static final int DEFAULT_EMBEDDING_DIMENSION = 2;

    public static final int DEFAULT_EMBEDDING_DELAY = 1;

    private final int embeddingDimension;
    private final int embeddingDelay;
    private final FiltrationEngine engine;

    public PerSeriesDiagramBuilder(FiltrationEngine engine) {
        this(DEFAULT_EMBEDDING_DIMENSION, DEFAULT_EMBEDDING_DELAY, engine);
    }

    public PerSeriesDiagramBuilder(int embeddingDimension, int embeddingDelay, FiltrationEngine engine) {
        checkArgument(embeddingDimension >= 1, "embeddingDimension must be positive");
        checkArgument(embeddingDelay >= 1, "embeddingDelay must be positive");
        this.embeddingDimension = embeddingDimension;
        this.embeddingDelay = embeddingDelay;
        this.engine = checkNotNull(engine, "engine must not be null");
    }

    @Override
    public PersistenceDiagrams apply(TimeSeries series) {
        return engine.compute(embeddedDistances(series)).getDiagrams();
    }

    public double[][] embed(TimeSeries series) {
        checkNotNull(series, "series must not be null");
        double[] values = series.getValues();
        int span = (embeddingDimension - 1) * embeddingDelay;
        int count = values.length - span;
        checkSufficient(values.length >= 2 && count >= 2, "series " + series.getId()
                + " is too short to embed in dimension " + embeddingDimension + " with delay " + embeddingDelay);
        double[][] points = new double[count][embeddingDimension];
        for (int k = 0; k < count; k++) {
            for (int d = 0; d < embeddingDimension; d++) {
                points[k][d] = values[k + d * embeddingDelay];
            }
        }
        return points;
    }

    DistanceMatrix embeddedDistances(TimeSeries series) {
        double[][] points = embed(series);
        int n = points.length;
        double[][] distances = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                double d = l2Distance(points[i], points[j]);
                distances[i][j] = d;
                distances[j][i] = d;
            }
        }
        return DistanceMatrix.of(distances);
    }
}
