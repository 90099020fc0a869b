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

package com.amazon.topologicaloutlier.inputtypes;

import static com.amazon.topologicaloutlier.CommonUtils.checkArgument;
import static com.amazon.topologicaloutlier.CommonUtils.checkNotNull;

import java.util.Arrays;

import lombok.Getter;

/**
 * An immutable, irregularly sampled series of (timestamp, value, uncertainty)
 * triples. Timestamps are strictly increasing; uncertainties are one standard
 * deviation of the measurement and are non-negative.
 *
 * The arrays are copied on the way in and on the way out, so the caller can
 * reuse its buffers.
 */
public class TimeSeries {

    @Getter
    private final String id;
    private final double[] timestamps;
    private final double[] values;
    private final double[] uncertainties;

    public TimeSeries(String id, double[] timestamps, double[] values, double[] uncertainties) {
        checkNotNull(id, "id must not be null");
        checkNotNull(timestamps, "timestamps must not be null");
        checkNotNull(values, "values must not be null");
        checkNotNull(uncertainties, "uncertainties must not be null");
        checkArgument(timestamps.length == values.length, "timestamps and values must have the same length");
        checkArgument(timestamps.length == uncertainties.length,
                "timestamps and uncertainties must have the same length");
        for (int i = 0; i < timestamps.length; i++) {
            checkArgument(Double.isFinite(timestamps[i]) && Double.isFinite(values[i]),
                    "series " + id + " has a non-finite entry at position " + i);
            checkArgument(Double.isFinite(uncertainties[i]) && uncertainties[i] >= 0,
                    "series " + id + " has an invalid uncertainty at position " + i);
            checkArgument(i == 0 || timestamps[i] > timestamps[i - 1],
                    "timestamps of series " + id + " must be strictly increasing");
        }
        this.id = id;
        this.timestamps = Arrays.copyOf(timestamps, timestamps.length);
        this.values = Arrays.copyOf(values, values.length);
        this.uncertainties = Arrays.copyOf(uncertainties, uncertainties.length);
    }

    /**
     * a series whose samples carry no uncertainty
     *
     * @param id         identifier
     * @param timestamps strictly increasing timestamps
     * @param values     the measurements
     * @return a new series
     */
    public static TimeSeries of(String id, double[] timestamps, double[] values) {
        return new TimeSeries(id, timestamps, values, new double[values.length]);
    }

    public int size() {
        return timestamps.length;
    }

    public double getTimestamp(int index) {
        return timestamps[index];
    }

    public double getValue(int index) {
        return values[index];
    }

    public double getUncertainty(int index) {
        return uncertainties[index];
    }

    public double[] getTimestamps() {
        return Arrays.copyOf(timestamps, timestamps.length);
    }

    public double[] getValues() {
        return Arrays.copyOf(values, values.length);
    }

    public double[] getUncertainties() {
        return Arrays.copyOf(uncertainties, uncertainties.length);
    }

    public double getStartTime() {
        checkArgument(timestamps.length > 0, "empty series has no start");
        return timestamps[0];
    }

    public double getEndTime() {
        checkArgument(timestamps.length > 0, "empty series has no end");
        return timestamps[timestamps.length - 1];
    }

    /**
     * linear interpolation of the values at time t; the series is held constant
     * before its first and after its last sample
     *
     * @param t a time
     * @return the interpolated value
     */
    public double valueAt(double t) {
        return interpolate(values, t);
    }

    /**
     * the interpolated uncertainty at time t, with the same conventions as
     * {@link #valueAt(double)}
     *
     * @param t a time
     * @return the interpolated uncertainty
     */
    public double uncertaintyAt(double t) {
        return interpolate(uncertainties, t);
    }

    private double interpolate(double[] y, double t) {
        checkArgument(timestamps.length > 0, "cannot interpolate an empty series");
        if (t <= timestamps[0]) {
            return y[0];
        }
        int last = timestamps.length - 1;
        if (t >= timestamps[last]) {
            return y[last];
        }
        int position = Arrays.binarySearch(timestamps, t);
        if (position >= 0) {
            return y[position];
        }
        int right = -position - 1;
        int left = right - 1;
        double fraction = (t - timestamps[left]) / (timestamps[right] - timestamps[left]);
        return y[left] + fraction * (y[right] - y[left]);
    }

    @Override
    public String toString() {
        return "TimeSeries{" + id + ", " + timestamps.length + " samples}";
    }
}
