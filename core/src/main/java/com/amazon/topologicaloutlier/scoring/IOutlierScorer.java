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

/**
 * Turns a structure derived from a distance matrix into one outlier score per
 * item, higher meaning more anomalous. Scores are indexed like the rows of the
 * matrix and are never NaN.
 *
 * @param <S> the structure the scores are computed from
 */
@FunctionalInterface
public interface IOutlierScorer<S> {

    double[] score(S structure);
}
