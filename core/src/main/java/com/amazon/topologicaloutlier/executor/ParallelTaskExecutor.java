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

import static com.amazon.topologicaloutlier.CommonUtils.checkArgument;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ForkJoinPool;
import java.util.function.IntConsumer;
import java.util.function.IntFunction;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import lombok.Getter;

/**
 * Runs the tasks on a private thread pool, so that the number of threads used
 * by a run is bounded by the configured pool size and not by the common pool.
 * Exceptions thrown by a task are rethrown on the calling thread.
 */
public class ParallelTaskExecutor implements ITaskExecutor {

    private ForkJoinPool forkJoinPool;
    @Getter
    private final int threadPoolSize;

    public ParallelTaskExecutor(int threadPoolSize) {
        checkArgument(threadPoolSize > 0, "threadPoolSize must be greater than 0");
        this.threadPoolSize = threadPoolSize;
        forkJoinPool = new ForkJoinPool(threadPoolSize);
    }

    @Override
    public <R> List<R> map(int n, IntFunction<R> function) {
        return submitAndJoin(() -> IntStream.range(0, n).parallel().mapToObj(function).collect(Collectors.toList()));
    }

    @Override
    public void forEach(int n, IntConsumer consumer) {
        submitAndJoin(() -> {
            IntStream.range(0, n).parallel().forEach(consumer);
            return null;
        });
    }

    private <T> T submitAndJoin(Callable<T> callable) {
        if (forkJoinPool == null) {
            forkJoinPool = new ForkJoinPool(threadPoolSize);
        }
        return forkJoinPool.submit(callable).join();
    }
}
