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

import lombok.Getter;

/**
 * Thrown by a process fitter when the model of a single series cannot be
 * fitted. This is an item level failure; the
 * {@link com.amazon.topologicaloutlier.config.FailurePolicy} decides whether
 * the item is dropped or the whole run fails.
 */
@Getter
public class FitDivergenceException extends TopologicalOutlierException {

    private static final long serialVersionUID = 1L;

    private final String seriesId;

    public FitDivergenceException(String seriesId, String message) {
        super(message);
        this.seriesId = seriesId;
    }

    public FitDivergenceException(String seriesId, String message, Throwable cause) {
        super(message, cause);
        this.seriesId = seriesId;
    }
}
