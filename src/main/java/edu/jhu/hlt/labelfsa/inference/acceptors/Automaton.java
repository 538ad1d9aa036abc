// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.labelfsa.inference.acceptors;

import java.util.List;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;

/**
 * An immutable label graph: a state count plus an ordered list of edges.
 * <p>
 * State 0 is the start state and state {@code numStates - 1} the single
 * final state. States carry nothing but their index. Symbol
 * {@code numLabels} is reserved for blank.
 * <p>
 * Edge endpoints are not range checked here, since some constructions
 * emit edges past the last state; use {@link AutomatonValidator} to
 * find out whether a graph is usable.
 */
public final class Automaton {

    private final int numStates;
    private final int numLabels;
    private final ImmutableList<Edge> edges;

    // lazily built adjacency, in edge emission order
    private volatile ImmutableListMultimap<Integer, Edge> outgoing;
    private volatile ImmutableListMultimap<Integer, Edge> incoming;

    public Automaton(int numStates, int numLabels, List<Edge> edges) {
        Preconditions.checkArgument(numStates >= 1, "an automaton needs at least one state, got %s", numStates);
        Preconditions.checkArgument(numLabels >= 0, "negative number of labels: %s", numLabels);
        this.numStates = numStates;
        this.numLabels = numLabels;
        this.edges = ImmutableList.copyOf(edges);
    }

    public int getNumStates() { return numStates; }
    public int getNumLabels() { return numLabels; }
    public ImmutableList<Edge> getEdges() { return edges; }
    public int getNumEdges() { return edges.size(); }

    public int getStartState() { return 0; }
    public int getFinalState() { return numStates - 1; }

    public int getBlankSymbol() { return numLabels; }
    public boolean isBlank(int symbol) { return symbol == numLabels; }

    public boolean hasState(int state) {
        return state >= 0 && state < numStates;
    }

    /** Edges leaving {@code state}, self-loops included. */
    public ImmutableList<Edge> outgoing(int state) {
        index();
        return outgoing.get(state);
    }

    /** Edges entering {@code state}, self-loops included. */
    public ImmutableList<Edge> incoming(int state) {
        index();
        return incoming.get(state);
    }

    private void index() {
        if (outgoing != null) return;
        synchronized (this) {
            if (outgoing != null) return;
            buildIndex();
        }
    }

    private void buildIndex() {
        ImmutableListMultimap.Builder<Integer, Edge> out = ImmutableListMultimap.builder();
        ImmutableListMultimap.Builder<Integer, Edge> in = ImmutableListMultimap.builder();
        for (Edge e : edges) {
            out.put(e.getFrom(), e);
            in.put(e.getTo(), e);
        }
        incoming = in.build();
        outgoing = out.build();
    }

    /** Whether some edge goes from {@code from} to {@code to} with {@code symbol}. */
    public boolean hasEdge(int from, int to, int symbol) {
        for (Edge e : outgoing(from)) {
            if (e.getTo() == to && e.getSymbol() == symbol)
                return true;
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Automaton)) return false;
        Automaton a = (Automaton) o;
        return numStates == a.numStates && numLabels == a.numLabels && edges.equals(a.edges);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(numStates, numLabels, edges);
    }

    @Override
    public String toString() {
        return "Automaton(numStates=" + numStates + ", numLabels=" + numLabels + ", edges=" + edges + ")";
    }
}
