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


package com.amazon.topologicaloutlier.testutils;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Irregularly sampled noisy sine waves sharing one period, and anomalous series
 * that do not follow the common pattern.
 */
public class TimeSeriesTestData {

    private final double amplitude;
    private final double period;
    private final double noiseSigma;
    private final double uncertainty;

    public TimeSeriesTestData(double amplitude, double period, double noiseSigma, double uncertainty) {
        this.amplitude = amplitude;
        this.period = period;
        this.noiseSigma = noiseSigma;
        this.uncertainty = uncertainty;
    }

    public TimeSeriesTestData() {
        this(1.0, 20.0, 0.05, 0.1);
    }

    /**
     * Raw arrays of one series.
     */
    public static class SeriesData {

        public final String id;
        public final double[] timestamps;
        public final double[] values;
        public final double[] uncertainties;

        public SeriesData(String id, double[] timestamps, double[] values, double[] uncertainties) {
            this.id = id;
            this.timestamps = timestamps;
            this.values = values;
            this.uncertainties = uncertainties;
        }
    }

    /**
     * @param numberOfSeries number of series, named "s0", "s1", ...
     * @param length         samples per series
     * @param seed           random seed
     * @return series following the common pattern
     */
    public List<SeriesData> generate(int numberOfSeries, int length, long seed) {
        Random random = new Random(seed);
        List<SeriesData> answer = new ArrayList<>(numberOfSeries);
        for (int i = 0; i < numberOfSeries; i++) {
            answer.add(generate("s" + i, length, 1.0, random));
        }
        return answer;
    }

    /**
     * @param id     identifier of the series
     * @param length number of samples
     * @param factor the amplitude relative to the common pattern
     * @param seed   random seed
     * @return a series whose amplitude differs from the common pattern
     */
    public SeriesData anomalous(String id, int length, double factor, long seed) {
        return generate(id, length, factor, new Random(seed));
    }

    private SeriesData generate(String id, int length, double factor, Random random) {
        double[] timestamps = new double[length];
        double[] values = new double[length];
        double[] uncertainties = new double[length];
        double t = random.nextDouble();
        for (int j = 0; j < length; j++) {
            timestamps[j] = t;
            values[j] = factor * amplitude * Math.sin(2 * Math.PI * t / period) + noiseSigma * random.nextGaussian();
            uncertainties[j] = uncertainty;
            t += 0.5 + random.nextDouble();
        }
        return new SeriesData(id, timestamps, values, uncertainties);
    }
}
