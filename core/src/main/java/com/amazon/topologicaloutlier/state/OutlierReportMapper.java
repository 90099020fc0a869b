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


package com.amazon.topologicaloutlier.state;

import static com.amazon.topologicaloutlier.CommonUtils.checkArgument;
import static com.amazon.topologicaloutlier.CommonUtils.checkNotNull;
import static com.amazon.topologicaloutlier.CommonUtils.checkState;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import lombok.Getter;
import lombok.Setter;

import com.amazon.topologicaloutlier.homology.Filtration;
import com.amazon.topologicaloutlier.homology.FiltrationEngine;
import com.amazon.topologicaloutlier.homology.PersistenceDiagram;
import com.amazon.topologicaloutlier.homology.PersistenceDiagrams;
import com.amazon.topologicaloutlier.homology.PersistencePoint;
import com.amazon.topologicaloutlier.homology.PersistenceResult;
import com.amazon.topologicaloutlier.matrix.DistanceMatrix;
import com.amazon.topologicaloutlier.returntypes.OutlierRanking;
import com.amazon.topologicaloutlier.returntypes.OutlierReport;
import com.amazon.topologicaloutlier.tree.Edge;
import com.amazon.topologicaloutlier.tree.SpanningTree;

@Getter
@Setter
public class OutlierReportMapper implements IStateMapper<OutlierReport, OutlierReportState> {

    /**
     * If true, the persistence diagrams rebuilt from the distance matrix are
     * compared with the saved ones when a report is restored.
     */
    private boolean diagramCheckEnabled = true;

    @Override
    public OutlierReportState toState(OutlierReport model) {
        checkNotNull(model, "model must not be null");
        OutlierReportState state = new OutlierReportState();

        List<OutlierRanking.RankedItem> items = model.getRanking().getItems();
        String[] ids = new String[items.size()];
        double[] scores = new double[items.size()];
        for (int i = 0; i < items.size(); i++) {
            ids[i] = items.get(i).getId();
            scores[i] = items.get(i).getScore();
        }
        state.setRankedIds(ids);
        state.setRankedScores(scores);

        state.setLabels(model.getDistanceMatrix().getLabels());
        state.setDistances(model.getDistanceMatrix().toArray());

        if (model.getSpanningTree().isPresent()) {
            List<Edge> edges = model.getSpanningTree().get().getEdges();
            int[] sources = new int[edges.size()];
            int[] targets = new int[edges.size()];
            double[] weights = new double[edges.size()];
            for (int i = 0; i < edges.size(); i++) {
                sources[i] = edges.get(i).getSource();
                targets[i] = edges.get(i).getTarget();
                weights[i] = edges.get(i).getWeight();
            }
            state.setSpanningTreePresent(true);
            state.setTreeSources(sources);
            state.setTreeTargets(targets);
            state.setTreeWeights(weights);
        }

        if (model.getPersistence().isPresent()) {
            PersistenceResult persistence = model.getPersistence().get();
            Filtration filtration = persistence.getFiltration();
            state.setPersistencePresent(true);
            state.setMaxDimension(filtration.getMaxSimplexDimension() - 1);
            state.setMaxDiameter(filtration.getMaxDiameter());
            List<PersistenceDiagramState> diagrams = new ArrayList<>();
            for (PersistenceDiagram diagram : persistence.getDiagrams().getDiagrams()) {
                diagrams.add(toState(diagram));
            }
            state.setDiagrams(diagrams);
        }

        state.setExcludedIds(model.getExcludedIds().toArray(new String[0]));
        return state;
    }

    @Override
    public OutlierReport toModel(OutlierReportState state) {
        checkNotNull(state, "state must not be null");
        checkArgument(Version.V1_0.equals(state.getVersion()), "unsupported version " + state.getVersion());

        OutlierRanking ranking = new OutlierRanking(state.getRankedIds(), state.getRankedScores());
        DistanceMatrix matrix = new DistanceMatrix(state.getLabels(), state.getDistances());

        Optional<SpanningTree> tree = Optional.empty();
        if (state.isSpanningTreePresent()) {
            int[] sources = state.getTreeSources();
            List<Edge> edges = new ArrayList<>(sources.length);
            for (int i = 0; i < sources.length; i++) {
                edges.add(new Edge(sources[i], state.getTreeTargets()[i], state.getTreeWeights()[i]));
            }
            tree = Optional.of(new SpanningTree(matrix.size(), edges));
        }

        Optional<PersistenceResult> persistence = Optional.empty();
        if (state.isPersistencePresent()) {
            PersistenceResult result = new FiltrationEngine(state.getMaxDimension(), state.getMaxDiameter())
                    .compute(matrix);
            if (diagramCheckEnabled && state.getDiagrams() != null) {
                List<PersistenceDiagram> saved = new ArrayList<>();
                for (PersistenceDiagramState diagramState : state.getDiagrams()) {
                    saved.add(toModel(diagramState));
                }
                checkState(result.getDiagrams().equals(new PersistenceDiagrams(saved)),
                        "saved persistence diagrams do not match the distance matrix");
            }
            persistence = Optional.of(result);
        }

        List<String> excluded = state.getExcludedIds() == null ? List.of() : List.of(state.getExcludedIds());
        return new OutlierReport(ranking, matrix, tree, persistence, excluded);
    }

    public PersistenceDiagramState toState(PersistenceDiagram diagram) {
        List<PersistencePoint> points = diagram.getPoints();
        double[] births = new double[points.size()];
        double[] deaths = new double[points.size()];
        for (int i = 0; i < points.size(); i++) {
            births[i] = points.get(i).getBirth();
            deaths[i] = points.get(i).getDeath();
        }
        PersistenceDiagramState state = new PersistenceDiagramState();
        state.setDimension(diagram.getDimension());
        state.setBirths(births);
        state.setDeaths(deaths);
        return state;
    }

    public PersistenceDiagram toModel(PersistenceDiagramState state) {
        checkArgument(state.getBirths().length == state.getDeaths().length, "births and deaths must align");
        List<PersistencePoint> points = new ArrayList<>(state.getBirths().length);
        for (int i = 0; i < state.getBirths().length; i++) {
            points.add(new PersistencePoint(state.getBirths()[i], state.getDeaths()[i]));
        }
        return new PersistenceDiagram(state.getDimension(), points);
    }
}
