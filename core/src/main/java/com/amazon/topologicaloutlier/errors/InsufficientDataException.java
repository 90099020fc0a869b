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

package com.amazon.topologicaloutlier.errors;

/**
 * Thrown when a run has fewer than two items to compare, or when a single
 * series has fewer than two samples. Aborts the run.
 */
public class InsufficientDataException extends TopologicalOutlierException {

    private static final long serialVersionUID = 1L;

    public InsufficientDataException(String message) {
        super(message);
    }

    /**
     * Throws if the condition does not hold.
     *
     * @param condition the condition to test
     * @param message   message of the exception
     */
    public static void checkSufficient(boolean condition, String message) {
        if (!condition) {
            throw new InsufficientDataException(message);
        }
    }
}
