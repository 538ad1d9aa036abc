// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.labelfsa.inference.acceptors;

import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

public class StructuralInvariantViolationException extends IllegalStateException {

    private static final long serialVersionUID = -2297460190154083321L;

    private final ImmutableList<ValidationResult.Violation> violations;

    public StructuralInvariantViolationException(List<ValidationResult.Violation> violations) {
        super(violations.size() + " structural violation(s): " + Joiner.on("; ").join(violations));
        this.violations = ImmutableList.copyOf(violations);
    }

    public ImmutableList<ValidationResult.Violation> getViolations() {
        return violations;
    }
}
