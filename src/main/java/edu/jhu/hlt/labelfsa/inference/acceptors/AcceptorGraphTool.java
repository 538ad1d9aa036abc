// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.labelfsa.inference.acceptors;

import java.io.File;
import java.io.IOException;
import java.util.logging.Logger;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.cli.PosixParser;
import org.apache.commons.io.FilenameUtils;

import edu.jhu.hlt.labelfsa.util.LabelFsaConfig;

/**
 * Builds the acceptor for one label sequence and writes it as a DOT file, e.g.
 * <pre>
 * java edu.jhu.hlt.labelfsa.inference.acceptors.AcceptorGraphTool \
 *     --fsa ctc --num_labels 3 --label_seq 0,1,0 --file ctc_010
 * </pre>
 * writes {@code tmp/ctc_010.dot}. Input problems are reported before anything
 * is built.
 */
public class AcceptorGraphTool {

    private static final Logger logger = Logger.getLogger(AcceptorGraphTool.class.getName());

    public static final String DOT_EXTENSION = "dot";

    private File resolveOutput(CommandLine cmd) {
        File dir;
        if (cmd.hasOption("outdir")) {
            dir = new File(cmd.getOptionValue("outdir"));
        } else {
            dir = LabelFsaConfig.getDirectory(LabelFsaConfig.OUTPUT_DIR, new File("tmp"));
        }
        String name = cmd.getOptionValue("file");
        if (FilenameUtils.getExtension(name).isEmpty())
            name = name + "." + DOT_EXTENSION;
        return new File(dir, name);
    }

    public boolean execute(CommandLine cmd) {

        for (String required : new String [] { "fsa", "num_labels", "label_seq", "file" }) {
            if (!cmd.hasOption(required)) {
                System.err.println("Must specify --" + required + ".");
                return false;
            }
        }

        // ===== Check the input =====

        Criterion criterion;
        int numLabels;
        int [] labelSeq;
        try {
            criterion = Criterion.fromName(cmd.getOptionValue("fsa"));
            numLabels = Integer.parseInt(cmd.getOptionValue("num_labels").trim());
            labelSeq = LabelSequences.parse(cmd.getOptionValue("label_seq"));
            LabelSequences.check(numLabels, labelSeq);
        } catch (NumberFormatException e) {
            System.err.println("Number of labels is not an integer: " + cmd.getOptionValue("num_labels"));
            return false;
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            return false;
        }

        if (!criterion.isImplemented()) {
            System.err.println(criterion + " acceptor construction is not implemented.");
            return false;
        }

        // ===== Build =====

        Automaton automaton = criterion.builder().build(numLabels, labelSeq);
        logger.info("Built " + criterion + " acceptor for " + LabelSequences.toString(labelSeq)
                    + ": " + automaton.getNumStates() + " states, " + automaton.getNumEdges() + " edges");

        if (cmd.hasOption("validate")) {
            ValidationResult result = AutomatonValidator.validate(automaton);
            if (result.isValid()) {
                logger.info("Automaton is structurally valid");
            } else {
                for (ValidationResult.Violation v : result.getViolations())
                    logger.warning(v.toString());
            }
        }

        // ===== Export =====

        File output = resolveOutput(cmd);
        try {
            new DotExporter().write(automaton, FilenameUtils.getBaseName(output.getName()), output);
        } catch (IOException e) {
            System.err.println("Cannot write " + output + ": " + e.getMessage());
            return false;
        }
        return true;
    }

    private static Options createOptions() {
        Options options = new Options();

        options.addOption("c", "fsa", true, "Criterion: ctc, asg or hmm.");
        options.addOption("n", "num_labels", true, "Number of labels; label indices are 0..num_labels-1.");
        options.addOption("l", "label_seq", true, "Label sequence, e.g. 0,1,0");
        options.addOption("f", "file", true, "Name of the DOT file to write.");
        options.addOption("o", "outdir", true, "Output directory (default: " + LabelFsaConfig.OUTPUT_DIR + " or tmp).");
        options.addOption("v", "validate", false, "Check the automaton and log any structural violations.");

        return options;
    }

    /**
     * @return the process exit status
     */
    public static int run(String [] args) {

        final String usage = "java " + AcceptorGraphTool.class.getName() + " [OPTIONS]";
        final CommandLineParser parser = new PosixParser();
        final Options options = createOptions();
        final HelpFormatter formatter = new HelpFormatter();
        CommandLine cmd;
        try {
            cmd = parser.parse(options, args);
        } catch (ParseException e) {
            System.err.println(e.getMessage());
            formatter.printHelp(usage, options, true);
            return -1;
        }

        final AcceptorGraphTool tool = new AcceptorGraphTool();
        if (!tool.execute(cmd)) {
            formatter.printHelp(usage, options, true);
            return -1;
        }
        return 0;
    }

    public static void main(String [] args) {
        System.exit(run(args));
    }
}
