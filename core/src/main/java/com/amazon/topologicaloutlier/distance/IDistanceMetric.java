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

/**
 * A pairwise distance between two representations of the same kind. The
 * answer is non-negative, symmetric, and 0 (within floating point tolerance)
 * for identical inputs. Implementations are stateless or thread safe since the
 * matrix builder may call them from several threads.
 *
 * @param <T> the representation being compared
 */
@FunctionalInterface
public interface IDistanceMetric<T> {

    /**
     * @param a first representation
     * @param b second representation
     * @return the distance between a and b
     */
    double distance(T a, T b);
}
