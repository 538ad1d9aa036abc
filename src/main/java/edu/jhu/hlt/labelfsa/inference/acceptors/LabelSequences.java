// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.labelfsa.inference.acceptors;

import java.util.List;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.primitives.Ints;

/**
 * Checking and parsing of label sequences.
 */
public final class LabelSequences {

    private static final Splitter SPLITTER =
        Splitter.on(CharMatcher.anyOf(", \t")).omitEmptyStrings().trimResults();

    private LabelSequences() {}

    /**
     * Rejects an empty sequence, a non-positive label count, or any label
     * outside {@code [0, numLabels)}.
     */
    public static void check(int numLabels, int [] labelSeq) {
        Preconditions.checkNotNull(labelSeq, "labelSeq");
        if (numLabels < 1)
            throw new InvalidLabelSequenceException("number of labels must be positive, got " + numLabels);
        if (labelSeq.length == 0)
            throw new InvalidLabelSequenceException("label sequence is empty");
        for (int m = 0; m < labelSeq.length; m++) {
            int label = labelSeq[m];
            if (label < 0 || label >= numLabels) {
                throw new InvalidLabelSequenceException(
                    "label " + label + " at position " + m + " is outside [0, " + numLabels + ")", m, label);
            }
        }
    }

    /**
     * Parses {@code "0,1,0"}, {@code "0 1 0"} or {@code "[0, 1, 0]"}.
     * Does not check the labels against a label count.
     */
    public static int [] parse(String text) {
        Preconditions.checkNotNull(text, "text");
        String body = text.trim();
        if (body.startsWith("[") && body.endsWith("]"))
            body = body.substring(1, body.length() - 1);
        List<String> tokens = SPLITTER.splitToList(body);
        if (tokens.isEmpty())
            throw new InvalidLabelSequenceException("label sequence is empty: \"" + text + "\"");
        int [] labels = new int[tokens.size()];
        for (int m = 0; m < labels.length; m++) {
            Integer label = Ints.tryParse(tokens.get(m));
            if (label == null)
                throw new InvalidLabelSequenceException(
                    "malformed label \"" + tokens.get(m) + "\" at position " + m + " in \"" + text + "\"", m, -1);
            labels[m] = label;
        }
        return labels;
    }

    public static String toString(int [] labelSeq) {
        return "[" + Ints.join(", ", labelSeq) + "]";
    }
}
