// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.labelfsa.inference.acceptors;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Builds the ASG (auto segmentation criterion) acceptor for a label sequence.
 * <p>
 * There is no blank. Each position m emits {@code y[m] -> y[m]+1} and a
 * self-loop on {@code y[m]+1}, both labelled {@code y[m]}: states are keyed by
 * label value, not by position, so repeated labels land on the same pair of
 * edges. The state count is always {@code numLabels}.
 * <p>
 * NOTE: with a label of {@code numLabels - 1} the emitted edges point at state
 * {@code numLabels}, which does not exist, and labels that are not used leave
 * states unreachable. {@link AutomatonValidator} reports both.
 */
public class AsgAcceptorBuilder implements AcceptorBuilder {

    private static final Logger logger = Logger.getLogger(AsgAcceptorBuilder.class.getName());

    public static final AsgAcceptorBuilder INSTANCE = new AsgAcceptorBuilder();

    @Override
    public Automaton build(int numLabels, int [] labelSeq) {
        LabelSequences.check(numLabels, labelSeq);

        List<Edge> edges = new ArrayList<Edge>(2 * labelSeq.length);
        int numStates = 0;
        for (int m = 0; m < labelSeq.length; m++) {
            numStates = addLabelPair(labelSeq[m], numLabels, edges);
            logger.fine("label: " + labelSeq[m] + " = " + m);
        }
        return new Automaton(numStates, numLabels, edges);
    }

    private static int addLabelPair(int label, int numLabels, List<Edge> edges) {
        final int i = label;
        edges.add(new Edge(i, i + 1, label));
        edges.add(new Edge(i + 1, i + 1, label));
        return numLabels;
    }
}
