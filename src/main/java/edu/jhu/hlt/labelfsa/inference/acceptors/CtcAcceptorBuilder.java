// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.labelfsa.inference.acceptors;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Builds the CTC alignment acceptor for a label sequence.
 * <p>
 * Position m of the sequence owns states 2m+1 (blank) and 2m+2 (label),
 * entered from state 2m:
 * <pre>
 *   2m   --blank--&gt; 2m+1   2m+1 --blank--&gt; 2m+1
 *   2m+1 --y[m]---&gt; 2m+2   2m+2 --y[m]---&gt; 2m+2
 *   2m   --y[m]---&gt; 2m+2   (skip, only when y[m] != y[m-1])
 * </pre>
 * A final state n = 2|y|+1 is then appended, reached by a blank from state n-1
 * (looping on blank) or by the last label straight from states n-2 and n-3.
 * The result has 2|y|+2 states.
 * <p>
 * For m = 0 the predecessor y[m-1] wraps around to the last label, so a
 * sequence that starts and ends with the same label has no skip edge out of
 * the start state. A one-label sequence never has one.
 */
public class CtcAcceptorBuilder implements AcceptorBuilder {

    private static final Logger logger = Logger.getLogger(CtcAcceptorBuilder.class.getName());

    public static final CtcAcceptorBuilder INSTANCE = new CtcAcceptorBuilder();

    @Override
    public Automaton build(int numLabels, int [] labelSeq) {
        LabelSequences.check(numLabels, labelSeq);

        final int blank = numLabels;
        List<Edge> edges = new ArrayList<Edge>(5 * labelSeq.length + 4);
        int numStates = 0;
        for (int m = 0; m < labelSeq.length; m++) {
            numStates = addLabelBlock(labelSeq, m, blank, edges);
            logger.fine("label: " + labelSeq[m] + " = " + m);
        }
        numStates = addFinalState(labelSeq[labelSeq.length - 1], numStates, blank, edges);
        logger.fine("label: blank = " + labelSeq.length);

        return new Automaton(numStates, numLabels, edges);
    }

    /**
     * Appends the edges owned by position m and returns the state count so far.
     */
    private static int addLabelBlock(int [] labelSeq, int m, int blank, List<Edge> edges) {
        final int i = 2 * m;
        final int label = labelSeq[m];
        edges.add(new Edge(i, i + 1, blank));
        edges.add(new Edge(i + 1, i + 1, blank));
        edges.add(new Edge(i + 1, i + 2, label));
        edges.add(new Edge(i + 2, i + 2, label));
        if (label != labelSeq[previous(m, labelSeq.length)])
            edges.add(new Edge(i, i + 2, label));
        return 2 * (m + 2) - 1;
    }

    // index of the predecessor of m, wrapping to the end at m = 0
    static int previous(int m, int length) {
        return (m - 1 + length) % length;
    }

    private static int addFinalState(int lastLabel, int numStates, int blank, List<Edge> edges) {
        final int f = numStates;
        edges.add(new Edge(f - 1, f, blank));
        edges.add(new Edge(f, f, blank));
        edges.add(new Edge(f - 2, f, lastLabel));
        edges.add(new Edge(f - 3, f, lastLabel));
        return numStates + 1;
    }
}
