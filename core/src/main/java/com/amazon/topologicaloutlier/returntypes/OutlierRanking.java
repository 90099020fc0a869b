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

import static com.amazon.topologicaloutlier.CommonUtils.checkArgument;
import static com.amazon.topologicaloutlier.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import lombok.Getter;

/**
 * Items ordered from most to least anomalous: by score descending, ties broken
 * by identifier ascending. The order is total and does not depend on the order
 * in which the items were supplied.
 */
public class OutlierRanking {

    public static final Comparator<RankedItem> ORDER = Comparator.comparingDouble(RankedItem::getScore).reversed()
            .thenComparing(RankedItem::getId);

    private final List<RankedItem> items;

    /**
     * @param ids    item identifiers, unique
     * @param scores one score per identifier, not NaN
     */
    public OutlierRanking(String[] ids, double[] scores) {
        checkNotNull(ids, "ids must not be null");
        checkNotNull(scores, "scores must not be null");
        checkArgument(ids.length == scores.length, "one score is required per item");
        List<RankedItem> unranked = new ArrayList<>(ids.length);
        for (int i = 0; i < ids.length; i++) {
            checkArgument(!Double.isNaN(scores[i]), "score of " + ids[i] + " is NaN");
            unranked.add(new RankedItem(ids[i], scores[i], 0));
        }
        unranked.sort(ORDER);
        List<RankedItem> ranked = new ArrayList<>(ids.length);
        for (int i = 0; i < unranked.size(); i++) {
            RankedItem item = unranked.get(i);
            checkArgument(i == 0 || !unranked.get(i - 1).getId().equals(item.getId()),
                    "duplicate identifier " + item.getId());
            ranked.add(new RankedItem(item.getId(), item.getScore(), i + 1));
        }
        this.items = Collections.unmodifiableList(ranked);
    }

    public List<RankedItem> getItems() {
        return items;
    }

    public int size() {
        return items.size();
    }

    /**
     * @param k number of items
     * @return the k most anomalous items, or all of them if there are fewer
     */
    public List<RankedItem> topK(int k) {
        checkArgument(k >= 0, "k must be non-negative");
        return items.subList(0, Math.min(k, items.size()));
    }

    public Optional<RankedItem> find(String id) {
        return items.stream().filter(item -> item.getId().equals(id)).findFirst();
    }

    public double getScore(String id) {
        return find(id).orElseThrow(() -> new IllegalArgumentException("unknown item " + id)).getScore();
    }

    @Getter
    public static class RankedItem {

        private final String id;
        private final double score;
        /**
         * 1 for the most anomalous item
         */
        private final int rank;

        public RankedItem(String id, double score, int rank) {
            this.id = checkNotNull(id, "id must not be null");
            this.score = score;
            this.rank = rank;
        }

        @Override
        public String toString() {
            return rank + ":" + id + "=" + score;
        }
    }
}
