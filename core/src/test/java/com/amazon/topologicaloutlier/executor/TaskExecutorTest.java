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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.concurrent.atomic.AtomicIntegerArray;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

public class TaskExecutorTest {

    static Stream<Arguments> executors() {
        return Stream.of(Arguments.of(new SequentialTaskExecutor()), Arguments.of(new ParallelTaskExecutor(3)));
    }

    @ParameterizedTest
    @MethodSource("executors")
    public void testMapKeepsOrder(ITaskExecutor executor) {
        List<Integer> squares = executor.map(100, i -> i * i);
        assertEquals(IntStream.range(0, 100).map(i -> i * i).boxed().collect(Collectors.toList()), squares);
    }

    @ParameterizedTest
    @MethodSource("executors")
    public void testForEachVisitsEveryIndexOnce(ITaskExecutor executor) {
        AtomicIntegerArray visits = new AtomicIntegerArray(50);
        executor.forEach(50, visits::incrementAndGet);
        for (int i = 0; i < 50; i++) {
            assertEquals(1, visits.get(i));
        }
    }

    @ParameterizedTest
    @MethodSource("executors")
    public void testTaskExceptionReachesCaller(ITaskExecutor executor) {
        assertThrows(IllegalStateException.class, () -> executor.forEach(10, i -> {
            if (i == 7) {
                throw new IllegalStateException("task " + i);
            }
        }));
    }

    @ParameterizedTest
    @MethodSource("executors")
    public void testEmpty(ITaskExecutor executor) {
        assertEquals(0, executor.map(0, i -> i).size());
    }

    @Test
    public void testInvalidPoolSize() {
        assertThrows(IllegalArgumentException.class, () -> new ParallelTaskExecutor(0));
        assertEquals(4, new ParallelTaskExecutor(4).getThreadPoolSize());
    }
}
