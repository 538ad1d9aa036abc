// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.labelfsa.inference.acceptors;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.List;

import edu.jhu.hlt.labelfsa.inference.acceptors.ValidationResult.Kind;
import edu.jhu.hlt.labelfsa.inference.acceptors.ValidationResult.Violation;

/**
 * Read-only structural check of an {@link Automaton}.
 * <p>
 * Checks that:
 * <ul>
 * <li>every edge endpoint lies in {@code [0, numStates)}, every symbol in
 *     {@code [0, numLabels]} and every weight is a non-negative number;</li>
 * <li>no edge enters the start state and none leaves the final state
 *     (self-loops are allowed on both, the CTC final state idles on blank);</li>
 * <li>every state is reachable from the start state and reaches the final
 *     state.</li>
 * </ul>
 * Builders never call this themselves.
 */
public final class AutomatonValidator {

    private AutomatonValidator() {}

    public static ValidationResult validate(Automaton a) {
        List<Violation> violations = new ArrayList<Violation>();
        checkEdges(a, violations);
        checkEndpoints(a, violations);
        checkReachability(a, violations);
        return new ValidationResult(violations);
    }

    private static void checkEdges(Automaton a, List<Violation> violations) {
        for (Edge e : a.getEdges()) {
            if (!a.hasState(e.getFrom()) || !a.hasState(e.getTo())) {
                violations.add(new Violation(Kind.EDGE_OUT_OF_RANGE, -1,
                    "edge " + e + " leaves [0, " + a.getNumStates() + ")"));
            }
            if (e.getSymbol() < 0 || e.getSymbol() > a.getBlankSymbol()) {
                violations.add(new Violation(Kind.SYMBOL_OUT_OF_RANGE, -1,
                    "edge " + e + " has symbol outside [0, " + a.getBlankSymbol() + "]"));
            }
            if (!(e.getWeight() >= 0.0)) {
                violations.add(new Violation(Kind.NEGATIVE_WEIGHT, -1,
                    "edge " + e + " has weight " + e.getWeight()));
            }
        }
    }

    private static void checkEndpoints(Automaton a, List<Violation> violations) {
        int start = a.getStartState();
        int fin = a.getFinalState();
        for (Edge e : a.incoming(start)) {
            if (!e.isSelfLoop()) {
                violations.add(new Violation(Kind.START_HAS_INCOMING, start,
                    "start state " + start + " is entered by " + e));
            }
        }
        for (Edge e : a.outgoing(fin)) {
            if (!e.isSelfLoop()) {
                violations.add(new Violation(Kind.FINAL_HAS_OUTGOING, fin,
                    "final state " + fin + " is left by " + e));
            }
        }
    }

    private static void checkReachability(Automaton a, List<Violation> violations) {
        BitSet forward = reach(a, a.getStartState(), true);
        BitSet backward = reach(a, a.getFinalState(), false);
        for (int s = 0; s < a.getNumStates(); s++) {
            if (!forward.get(s)) {
                violations.add(new Violation(Kind.UNREACHABLE_FROM_START, s,
                    "state " + s + " is not reachable from the start state"));
            }
        }
        for (int s = 0; s < a.getNumStates(); s++) {
            if (!backward.get(s)) {
                violations.add(new Violation(Kind.CANNOT_REACH_FINAL, s,
                    "final state " + a.getFinalState() + " is not reachable from state " + s));
            }
        }
    }

    // states reachable from origin along edges (or against them), ignoring out-of-range edges
    static BitSet reach(Automaton a, int origin, boolean alongEdges) {
        BitSet seen = new BitSet(a.getNumStates());
        Deque<Integer> queue = new ArrayDeque<Integer>();
        seen.set(origin);
        queue.add(origin);
        while (!queue.isEmpty()) {
            int s = queue.poll();
            List<Edge> next = alongEdges ? a.outgoing(s) : a.incoming(s);
            for (Edge e : next) {
                if (!a.hasState(e.getFrom()) || !a.hasState(e.getTo()))
                    continue;
                int t = alongEdges ? e.getTo() : e.getFrom();
                if (!seen.get(t)) {
                    seen.set(t);
                    queue.add(t);
                }
            }
        }
        return seen;
    }
}
