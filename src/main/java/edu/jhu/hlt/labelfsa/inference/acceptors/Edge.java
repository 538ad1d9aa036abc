// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.labelfsa.inference.acceptors;

import com.google.common.base.Objects;

/**
 * A weighted transition (from, to, symbol, weight). The symbol is a label
 * index, or the number of labels for blank. Weights are in -log space.
 */
public final class Edge {

    // Placeholder cost; real costs come from the scorer.
    public static final double DEFAULT_WEIGHT = 1.0;

    private final int from;
    private final int to;
    private final int symbol;
    private final double weight;

    public Edge(int from, int to, int symbol, double weight) {
        this.from = from;
        this.to = to;
        this.symbol = symbol;
        this.weight = weight;
    }

    public Edge(int from, int to, int symbol) {
        this(from, to, symbol, DEFAULT_WEIGHT);
    }

    public int getFrom() { return from; }
    public int getTo() { return to; }
    public int getSymbol() { return symbol; }
    public double getWeight() { return weight; }

    public boolean isSelfLoop() { return from == to; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Edge)) return false;
        Edge e = (Edge) o;
        return from == e.from && to == e.to && symbol == e.symbol
            && Double.compare(weight, e.weight) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(from, to, symbol, weight);
    }

    @Override
    public String toString() {
        return "(" + from + ", " + to + ", " + symbol + ", " + weight + ")";
    }
}
