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

package com.amazon.topologicaloutlier.fitting;

import com.amazon.topologicaloutlier.errors.FitDivergenceException;
import com.amazon.topologicaloutlier.inputtypes.PosteriorSnapshot;
import com.amazon.topologicaloutlier.inputtypes.TimeSeries;

/**
 * Fits a stochastic process to one series and evaluates its posterior at a
 * shared set of query timestamps. Implementations must be safe to call from
 * several threads at once.
 */
@FunctionalInterface
public interface IProcessFitter {

    /**
     * @param series     the observations
     * @param queryTimes timestamps at which the posterior is evaluated
     * @return mean and covariance of the posterior at {@code queryTimes}
     * @throws FitDivergenceException if the fit does not converge for this series
     */
    PosteriorSnapshot fit(TimeSeries series, double[] queryTimes);
}
