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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class UnionFindTest {

    @Test
    public void testUnion() {
        UnionFind unionFind = new UnionFind(6);
        assertEquals(6, unionFind.size());
        assertEquals(6, unionFind.getComponentCount());
        assertTrue(unionFind.union(0, 1));
        assertTrue(unionFind.union(2, 3));
        assertTrue(unionFind.union(1, 3));
        assertFalse(unionFind.union(0, 2));
        assertEquals(3, unionFind.getComponentCount());
        assertTrue(unionFind.connected(0, 3));
        assertFalse(unionFind.connected(0, 4));
        assertEquals(unionFind.find(2), unionFind.find(1));
    }
}
