// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.labelfsa.inference.acceptors;

/**
 * Thrown by the acceptor builders when a label sequence cannot be turned into
 * a label graph: it is empty, or holds a label outside {@code [0, numLabels)}.
 */
public class InvalidLabelSequenceException extends IllegalArgumentException {

    private static final long serialVersionUID = 3418821649019311742L;

    private final int position;
    private final int label;

    public InvalidLabelSequenceException(String message) {
        this(message, -1, -1);
    }

    public InvalidLabelSequenceException(String message, int position, int label) {
        super(message);
        this.position = position;
        this.label = label;
    }

    /** Offending index into the sequence, or -1. */
    public int getPosition() { return position; }

    /** Offending label value, or -1. */
    public int getLabel() { return label; }
}
