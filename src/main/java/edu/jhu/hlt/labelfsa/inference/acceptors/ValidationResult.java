// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.labelfsa.inference.acceptors;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * What {@link AutomatonValidator} found wrong with an automaton, in the order
 * it was found. Empty means structurally sound.
 */
public final class ValidationResult {

    public static enum Kind {
        EDGE_OUT_OF_RANGE,
        SYMBOL_OUT_OF_RANGE,
        NEGATIVE_WEIGHT,
        START_HAS_INCOMING,
        FINAL_HAS_OUTGOING,
        UNREACHABLE_FROM_START,
        CANNOT_REACH_FINAL
    }

    public static final class Violation {
        private final Kind kind;
        private final int state;
        private final String message;

        public Violation(Kind kind, int state, String message) {
            this.kind = kind;
            this.state = state;
            this.message = message;
        }

        public Kind getKind() { return kind; }
        // state concerned, -1 for edge-level problems
        public int getState() { return state; }
        public String getMessage() { return message; }

        @Override
        public String toString() {
            return kind + ": " + message;
        }
    }

    private final ImmutableList<Violation> violations;

    public ValidationResult(List<Violation> violations) {
        this.violations = ImmutableList.copyOf(violations);
    }

    public boolean isValid() {
        return violations.isEmpty();
    }

    public ImmutableList<Violation> getViolations() {
        return violations;
    }

    public ImmutableList<Violation> getViolations(Kind kind) {
        ImmutableList.Builder<Violation> b = ImmutableList.builder();
        for (Violation v : violations) {
            if (v.getKind() == kind)
                b.add(v);
        }
        return b.build();
    }

    public boolean has(Kind kind) {
        return !getViolations(kind).isEmpty();
    }

    public void throwIfInvalid() {
        if (!isValid())
            throw new StructuralInvariantViolationException(violations);
    }

    @Override
    public String toString() {
        return isValid() ? "valid" : violations.toString();
    }
}
