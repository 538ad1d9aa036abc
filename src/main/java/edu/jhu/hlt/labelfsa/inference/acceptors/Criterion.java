// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.labelfsa.inference.acceptors;

import java.util.Locale;

/**
 * The training criteria an acceptor can be built for.
 */
public enum Criterion {
    CTC,
    ASG,
    // word/lexicon HMM acceptors; construction is not implemented
    HMM;

    public AcceptorBuilder builder() {
        switch (this) {
        case CTC:
            return CtcAcceptorBuilder.INSTANCE;
        case ASG:
            return AsgAcceptorBuilder.INSTANCE;
        case HMM:
            return UNIMPLEMENTED;
        default:
            throw new AssertionError(this);
        }
    }

    public boolean isImplemented() {
        return this != HMM;
    }

    /** Case-insensitive lookup, e.g. {@code "ctc"}. */
    public static Criterion fromName(String name) {
        if (name != null) {
            for (Criterion c : values()) {
                if (c.name().equals(name.trim().toUpperCase(Locale.ROOT)))
                    return c;
            }
        }
        throw new IllegalArgumentException("Unknown criterion: " + name + " (expected one of ctc, asg, hmm)");
    }

    private static final AcceptorBuilder UNIMPLEMENTED = new AcceptorBuilder() {
        @Override
        public Automaton build(int numLabels, int [] labelSeq) {
            throw new UnsupportedOperationException("HMM acceptor construction is not implemented");
        }
    };
}
