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
 * Base class of the failures that are specific to outlier detection, as opposed
 * to plain argument validation which uses the standard
 * {@link IllegalArgumentException} and {@link IllegalStateException}.
 */
public class TopologicalOutlierException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public TopologicalOutlierException(String message) {
        super(message);
    }

    public TopologicalOutlierException(String message, Throwable cause) {
        super(message, cause);
    }
}
