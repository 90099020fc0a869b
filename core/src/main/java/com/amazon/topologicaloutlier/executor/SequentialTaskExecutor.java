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
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Runs the tasks one after another on the calling thread.
 */
public class SequentialTaskExecutor implements ITaskExecutor {

    @Override
    public <R> List<R> map(int n, IntFunction<R> function) {
        return IntStream.range(0, n).mapToObj(function).collect(Collectors.toList());
    }

    @Override
    public void forEach(int n, IntConsumer consumer) {
        IntStream.range(0, n).forEach(consumer);
    }
}
