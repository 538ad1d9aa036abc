// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.labelfsa.inference.acceptors;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;

/**
 * Inspection of the alignments an acceptor admits. Mostly useful for testing
 * and debugging small graphs; {@link #labelSequences} enumerates paths and is
 * exponential in the sequence length.
 */
public final class AlignmentPaths {

    private AlignmentPaths() {}

    /**
     * CTC collapse of a frame-level symbol sequence: runs of equal symbols are
     * merged, then blanks are dropped.
     */
    public static ImmutableList<Integer> collapse(List<Integer> symbols, int blank) {
        ImmutableList.Builder<Integer> out = ImmutableList.builder();
        Integer prev = null;
        for (Integer s : symbols) {
            if (!s.equals(prev) && s != blank)
                out.add(s);
            prev = s;
        }
        return out.build();
    }

    public static ImmutableList<Integer> collapse(int [] symbols, int blank) {
        return collapse(Ints.asList(symbols), blank);
    }

    /**
     * The distinct collapsed label sequences spelled by start-to-final paths.
     * Self-loops are not taken; in the CTC and ASG graphs a self-loop repeats
     * the symbol of the edge that entered its state, or is a blank, so it
     * cannot change the collapsed output. Other edges are used at most once
     * per path.
     */
    public static Set<List<Integer>> labelSequences(Automaton a) {
        Set<List<Integer>> out = new LinkedHashSet<List<Integer>>();
        List<Integer> symbols = new ArrayList<Integer>();
        BitSet onPath = new BitSet(a.getNumStates());
        onPath.set(a.getStartState());
        walk(a, a.getStartState(), symbols, onPath, out);
        return out;
    }

    private static void walk(Automaton a, int state, List<Integer> symbols, BitSet onPath,
                             Set<List<Integer>> out) {
        if (state == a.getFinalState())
            out.add(collapse(symbols, a.getBlankSymbol()));
        for (Edge e : a.outgoing(state)) {
            int next = e.getTo();
            if (e.isSelfLoop() || !a.hasState(next) || onPath.get(next))
                continue;
            onPath.set(next);
            symbols.add(e.getSymbol());
            walk(a, next, symbols, onPath, out);
            symbols.remove(symbols.size() - 1);
            onPath.clear(next);
        }
    }

    /**
     * Whether the frame-level symbol sequence is an alignment: some path from
     * the start state takes exactly one edge per frame and ends in the final
     * state.
     */
    public static boolean accepts(Automaton a, int [] frameSymbols) {
        BitSet current = new BitSet(a.getNumStates());
        current.set(a.getStartState());
        for (int symbol : frameSymbols) {
            BitSet next = new BitSet(a.getNumStates());
            for (int s = current.nextSetBit(0); s >= 0; s = current.nextSetBit(s + 1)) {
                for (Edge e : a.outgoing(s)) {
                    if (e.getSymbol() == symbol && a.hasState(e.getTo()))
                        next.set(e.getTo());
                }
            }
            if (next.isEmpty())
                return false;
            current = next;
        }
        return current.get(a.getFinalState());
    }
}
