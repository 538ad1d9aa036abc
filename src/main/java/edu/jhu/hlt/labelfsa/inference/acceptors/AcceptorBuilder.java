// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.labelfsa.inference.acceptors;

/**
 * Turns a target label sequence into the acceptor of all its frame-level
 * alignments under one training criterion.
 * <p>
 * Implementations keep no state between calls and may be shared by threads.
 */
public interface AcceptorBuilder {

    /**
     * @param numLabels size of the label inventory; symbol {@code numLabels} is blank
     * @param labelSeq target labels, each in {@code [0, numLabels)}
     * @throws InvalidLabelSequenceException if the sequence is empty or holds
     *         a label out of range
     */
    public Automaton build(int numLabels, int [] labelSeq);
}
