// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.labelfsa.inference.acceptors;

import java.io.File;
import java.io.IOException;
import java.util.logging.Logger;

import com.google.common.base.Charsets;
import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;

import edu.jhu.hlt.labelfsa.util.LabelFsaConfig;

/**
 * Writes an automaton as Graphviz DOT source. Nodes are named by state
 * index; edges are labelled with the symbol index, or the blank text for the
 * blank symbol. Rendering the DOT file is left to Graphviz.
 */
public class DotExporter {

    private static final Logger logger = Logger.getLogger(DotExporter.class.getName());

    public static final String DEFAULT_BLANK_TEXT = "<b>";

    private final String blankText;

    public DotExporter(String blankText) {
        this.blankText = blankText;
    }

    /** Uses the blank text from {@link LabelFsaConfig#DOT_BLANK}. */
    public DotExporter() {
        this(LabelFsaConfig.getString(LabelFsaConfig.DOT_BLANK, DEFAULT_BLANK_TEXT));
    }

    public ImmutableList<String> nodeIds(Automaton a) {
        ImmutableList.Builder<String> nodes = ImmutableList.builder();
        for (int i = 0; i < a.getNumStates(); i++)
            nodes.add(String.valueOf(i));
        return nodes.build();
    }

    public String edgeLabel(Automaton a, int symbol) {
        return a.isBlank(symbol) ? blankText : String.valueOf(symbol);
    }

    public String toDot(Automaton a, String graphName) {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph ").append(quote(graphName)).append(" {\n");
        sb.append("  rankdir=LR;\n");
        ImmutableList<String> nodes = nodeIds(a);
        for (int i = 0; i < nodes.size(); i++) {
            sb.append("  ").append(quote(nodes.get(i)));
            if (i == a.getFinalState())
                sb.append(" [shape=doublecircle]");
            sb.append(";\n");
        }
        for (Edge e : a.getEdges()) {
            sb.append("  ").append(quote(String.valueOf(e.getFrom())))
              .append(" -> ").append(quote(String.valueOf(e.getTo())))
              .append(" [label=").append(quote(edgeLabel(a, e.getSymbol()))).append("];\n");
        }
        sb.append("}\n");
        return sb.toString();
    }

    public void write(Automaton a, String graphName, File file) throws IOException {
        Files.createParentDirs(file);
        Files.asCharSink(file, Charsets.UTF_8).write(toDot(a, graphName));
        logger.info("File saved in: " + file.getPath());
    }

    static String quote(String s) {
        return "\"" + s.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
