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

package com.amazon.topologicaloutlier.distance;

import static com.amazon.topologicaloutlier.CommonUtils.checkArgument;
import static java.lang.Math.abs;
import static java.lang.Math.max;
import static java.lang.Math.pow;

import java.util.List;

import lombok.Getter;

import com.amazon.topologicaloutlier.homology.PersistenceDiagram;
import com.amazon.topologicaloutlier.homology.PersistencePoint;
import com.amazon.topologicaloutlier.util.HungarianAssignment;

/**
 * The order p Wasserstein distance between two persistence diagrams of the
 * same dimension, with the L-infinity ground metric. A point may be matched to
 * its projection on the diagonal at cost {@code ((death - birth) / 2)^p}, so
 * diagrams of different sizes are comparable.
 *
 * Finite points are matched optimally with the Hungarian algorithm. Essential
 * points can only be matched with essential points; they are paired in order
 * of birth and a surplus essential point born at {@code b} costs
 * {@code (T - b)^p}. {@code T} is the larger of the configured horizon, usually
 * the diameter threshold of the filtrations, and the largest finite value in
 * either diagram. A surplus point born at or after {@code T} costs 1.
 */
@Getter
public class PersistenceDiagramDistance implements IDistanceMetric<PersistenceDiagram> {

    public static final double DEFAULT_ORDER = 2.0;

    private final double order;

    /**
     * the scale up to which a surplus essential point is charged, 0 if only the
     * finite points of the diagrams set it
     */
    private final double horizon;

    public PersistenceDiagramDistance() {
        this(DEFAULT_ORDER);
    }

    /**
     * @param order the exponent p, at least 1
     */
    public PersistenceDiagramDistance(double order) {
        this(order, 0);
    }

    /**
     * @param order   the exponent p, at least 1
     * @param horizon finite non-negative scale for unmatched essential points
     */
    public PersistenceDiagramDistance(double order, double horizon) {
        checkArgument(order >= 1 && Double.isFinite(order), "order must be a finite number of at least 1");
        checkArgument(horizon >= 0 && Double.isFinite(horizon), "horizon must be finite and non-negative");
        this.order = order;
        this.horizon = horizon;
    }

    @Override
    public double distance(PersistenceDiagram a, PersistenceDiagram b) {
        return pow(powerCost(a, b), 1.0 / order);
    }

    /**
     * @return W_p^p, the cost of an optimal matching before taking the root
     */
    public double powerCost(PersistenceDiagram a, PersistenceDiagram b) {
        checkArgument(a.getDimension() == b.getDimension(), "diagrams of different dimensions");
        return finiteCost(a.getFinitePoints(), b.getFinitePoints()) + essentialCost(a, b);
    }

    double finiteCost(List<PersistencePoint> first, List<PersistencePoint> second) {
        int n = first.size();
        int m = second.size();
        if (n + m == 0) {
            return 0;
        }
        // rows: points of the first diagram, then diagonal slots for the second
        // columns: points of the second diagram, then diagonal slots for the first
        double[][] cost = new double[n + m][n + m];
        for (int i = 0; i < n; i++) {
            PersistencePoint p = first.get(i);
            for (int j = 0; j < m; j++) {
                PersistencePoint q = second.get(j);
                cost[i][j] = pow(max(abs(p.getBirth() - q.getBirth()), abs(p.getDeath() - q.getDeath())), order);
            }
            double diagonal = diagonalCost(p);
            for (int j = m; j < n + m; j++) {
                cost[i][j] = diagonal;
            }
        }
        for (int j = 0; j < m; j++) {
            double diagonal = diagonalCost(second.get(j));
            for (int i = n; i < n + m; i++) {
                cost[i][j] = diagonal;
            }
        }
        return HungarianAssignment.minimumCost(cost);
    }

    double essentialCost(PersistenceDiagram a, PersistenceDiagram b) {
        List<PersistencePoint> first = a.getEssentialPoints();
        List<PersistencePoint> second = b.getEssentialPoints();
        // both lists are sorted by birth
        int common = Math.min(first.size(), second.size());
        double total = 0;
        for (int i = 0; i < common; i++) {
            total += pow(abs(first.get(i).getBirth() - second.get(i).getBirth()), order);
        }
        double scale = max(horizon, max(a.getMaxFiniteValue(), b.getMaxFiniteValue()));
        List<PersistencePoint> surplus = first.size() > common ? first : second;
        for (int i = common; i < surplus.size(); i++) {
            double birth = surplus.get(i).getBirth();
            total += scale > birth ? pow(scale - birth, order) : 1.0;
        }
        return total;
    }

    private double diagonalCost(PersistencePoint point) {
        return pow(point.getPersistence() / 2, order);
    }
}
