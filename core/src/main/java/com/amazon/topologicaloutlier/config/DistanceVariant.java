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

package com.amazon.topologicaloutlier.config;

/**
 * The representation of a series that is compared when the distance matrix is
 * built.
 */
public enum DistanceVariant {

    /**
     * the samples themselves, compared by a series metric that tolerates
     * irregular sampling
     */
    RAW_SERIES,
    /**
     * posterior covariances of a process fitted to each series on a shared grid
     * of query timestamps, compared by the 2-Wasserstein distance between
     * Gaussians
     */
    WASSERSTEIN_GP,
    /**
     * one persistence diagram family per series, computed from the delay
     * embedding of that series alone, compared by a diagram matching distance
     */
    DIAGRAM_DISTANCE;
}
