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

package com.amazon.topologicaloutlier.executor;

import java.util.List;
import java.util.function.IntConsumer;
import java.util.function.IntFunction;

/**
 * Runs independent tasks indexed 0..n-1. Tasks must not share mutable state
 * except through disjoint slots of a result array.
 */
public interface ITaskExecutor {

    /**
     * Applies the function to every index and collects the results in index
     * order.
     *
     * @param n        number of tasks
     * @param function the task
     * @param <R>      result type
     * @return the results, element i being the result of task i
     */
    <R> List<R> map(int n, IntFunction<R> function);

    /**
     * Runs the consumer once for every index.
     *
     * @param n        number of tasks
     * @param consumer the task
     */
    void forEach(int n, IntConsumer consumer);
}
