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

package com.amazon.topologicaloutlier.util;

import static com.amazon.topologicaloutlier.CommonUtils.checkArgument;

/**
 * A disjoint-set forest with union by rank and path halving.
 */
public class UnionFind {

    private final int[] parent;
    private final byte[] rank;
    private int componentCount;

    public UnionFind(int size) {
        checkArgument(size >= 0, "size must be non-negative");
        parent = new int[size];
        rank = new byte[size];
        for (int i = 0; i < size; i++) {
            parent[i] = i;
        }
        componentCount = size;
    }

    public int find(int x) {
        while (parent[x] != x) {
            parent[x] = parent[parent[x]];
            x = parent[x];
        }
        return x;
    }

    /**
     * @return true if the two elements were in different sets before the call
     */
    public boolean union(int x, int y) {
        int a = find(x);
        int b = find(y);
        if (a == b) {
            return false;
        }
        if (rank[a] < rank[b]) {
            parent[a] = b;
        } else if (rank[a] > rank[b]) {
            parent[b] = a;
        } else {
            parent[b] = a;
            rank[a]++;
        }
        componentCount--;
        return true;
    }

    public boolean connected(int x, int y) {
        return find(x) == find(y);
    }

    public int getComponentCount() {
        return componentCount;
    }

    public int size() {
        return parent.length;
    }
}
