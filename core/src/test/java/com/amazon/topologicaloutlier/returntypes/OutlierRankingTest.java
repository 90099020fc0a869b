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


package com.amazon.topologicaloutlier.returntypes;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class OutlierRankingTest {

    private OutlierRanking ranking;

    @BeforeEach
    public void setUp() {
        ranking = new OutlierRanking(new String[] { "c", "a", "d", "b" }, new double[] { 0.5, 2.0, 0.5,
                Double.POSITIVE_INFINITY });
    }

    private static List<String> ids(List<OutlierRanking.RankedItem> items) {
        return items.stream().map(OutlierRanking.RankedItem::getId).collect(Collectors.toList());
    }

    @Test
    public void testOrder() {
        assertEquals(List.of("b", "a", "c", "d"), ids(ranking.getItems()));
        assertEquals(1, ranking.getItems().get(0).getRank());
        assertEquals(4, ranking.getItems().get(3).getRank());
        assertEquals(4, ranking.size());
    }

    @Test
    public void testOrderDoesNotDependOnInputOrder() {
        OutlierRanking shuffled = new OutlierRanking(new String[] { "b", "d", "a", "c" },
                new double[] { Double.POSITIVE_INFINITY, 0.5, 2.0, 0.5 });
        assertEquals(ids(ranking.getItems()), ids(shuffled.getItems()));
    }

    @Test
    public void testTopK() {
        assertEquals(List.of("b", "a"), ids(ranking.topK(2)));
        assertEquals(4, ranking.topK(10).size());
        assertEquals(0, ranking.topK(0).size());
        assertThrows(IllegalArgumentException.class, () -> ranking.topK(-1));
    }

    @Test
    public void testFind() {
        assertEquals(2.0, ranking.getScore("a"));
        assertEquals(3, ranking.find("c").get().getRank());
        assertFalse(ranking.find("z").isPresent());
        assertThrows(IllegalArgumentException.class, () -> ranking.getScore("z"));
    }

    @Test
    public void testInvalidRankings() {
        assertThrows(IllegalArgumentException.class,
                () -> new OutlierRanking(new String[] { "a", "a" }, new double[] { 1, 2 }));
        assertThrows(IllegalArgumentException.class,
                () -> new OutlierRanking(new String[] { "a" }, new double[] { Double.NaN }));
        assertThrows(IllegalArgumentException.class,
                () -> new OutlierRanking(new String[] { "a" }, new double[] { 1, 2 }));
    }
}
