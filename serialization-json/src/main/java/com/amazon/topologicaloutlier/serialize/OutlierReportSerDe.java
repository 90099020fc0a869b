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


package com.amazon.topologicaloutlier.serialize;

import lombok.Getter;

import com.amazon.topologicaloutlier.returntypes.OutlierReport;
import com.amazon.topologicaloutlier.state.OutlierReportMapper;
import com.amazon.topologicaloutlier.state.OutlierReportState;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * {@link OutlierReport} serialization. Internally we use the
 * {@link OutlierReportMapper} class to convert a report into a corresponding
 * state object, and we use <a href="https://github.com/google/gson">Gson</a>
 * to write the state object as a JSON string. The Gson instance is exposed so
 * users can customize the output (e.g., by enabling pretty printing); it must
 * write special floating point values, since essential persistence points die
 * at {@code Infinity}.
 */
@Getter
public class OutlierReportSerDe {

    private final OutlierReportMapper mapper;
    private final Gson gson;

    /**
     * Constructor instantiating objects for default serialization.
     */
    public OutlierReportSerDe() {
        this(new OutlierReportMapper(), new GsonBuilder().serializeSpecialFloatingPointValues().create());
    }

    /**
     * Create a SerDe instance using the provided mapper and Gson objects.
     *
     * @param mapper An OutlierReportMapper instance, used to convert a report to a
     *               corresponding state object.
     * @param gson   A Gson instance that will be used to generate JSON for a given
     *               {@link OutlierReportState} object.
     */
    public OutlierReportSerDe(OutlierReportMapper mapper, Gson gson) {
        this.mapper = mapper;
        this.gson = gson;
    }

    /**
     * Serializes a report to a json string.
     *
     * @param report an outlier report
     * @return a json string serialized from the report
     */
    public String toJson(OutlierReport report) {
        return gson.toJson(mapper.toState(report));
    }

    /**
     * Deserializes a serialized report.
     *
     * @param json a json string serialized from a report
     * @return the report
     */
    public OutlierReport fromJson(String json) {
        OutlierReportState state = gson.fromJson(json, OutlierReportState.class);
        return mapper.toModel(state);
    }
}
