// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.labelfsa.inference.acceptors;

import static org.junit.Assert.*;

import java.io.File;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.google.common.base.Charsets;
import com.google.common.io.Files;

public class TestAcceptorGraphTool {

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  private File outdir;

  @Before
  public void setUp() throws Exception {
    outdir = tmp.newFolder("graphs");
  }

  private int run(String fsa, String numLabels, String labelSeq) {
    return AcceptorGraphTool.run(new String[] {
        "--fsa", fsa, "--num_labels", numLabels, "--label_seq", labelSeq,
        "--file", "graph", "--outdir", outdir.getPath() });
  }

  @Test
  public void testWritesCtcGraph() throws Exception {
    assertEquals(0, run("ctc", "3", "0,1,0"));
    File dot = new File(outdir, "graph.dot");
    assertTrue(dot.isFile());
    String text = Files.asCharSource(dot, Charsets.UTF_8).read();
    Automaton expected = CtcAcceptorBuilder.INSTANCE.build(3, new int[] {0, 1, 0});
    assertEquals(new DotExporter().toDot(expected, "graph"), text);
  }

  @Test
  public void testWritesAsgGraphWithShortOptions() throws Exception {
    int status = AcceptorGraphTool.run(new String[] {
        "-c", "ASG", "-n", "4", "-l", "[3, 1, 2]", "-f", "asg.gv", "-o", outdir.getPath(), "-v" });
    assertEquals(0, status);
    assertTrue(new File(outdir, "asg.gv").isFile());
  }

  @Test
  public void testUnknownCriterion() {
    assertEquals(-1, run("rnnt", "3", "0,1"));
    assertEquals(0, outdir.list().length);
  }

  @Test
  public void testMalformedLabelSequence() {
    assertEquals(-1, run("ctc", "3", "0,one"));
    assertEquals(0, outdir.list().length);
  }

  @Test
  public void testLabelOutOfRange() {
    assertEquals(-1, run("ctc", "3", "0,3"));
    assertEquals(0, outdir.list().length);
  }

  @Test
  public void testBadLabelCount() {
    assertEquals(-1, run("asg", "three", "0"));
    assertEquals(0, outdir.list().length);
  }

  @Test
  public void testHmmIsRejected() {
    assertEquals(-1, run("hmm", "3", "0,1"));
    assertEquals(0, outdir.list().length);
  }

  @Test
  public void testMissingOption() {
    int status = AcceptorGraphTool.run(new String[] { "--fsa", "ctc", "--num_labels", "3" });
    assertEquals(-1, status);
  }

  @Test
  public void testUnknownOption() {
    assertEquals(-1, AcceptorGraphTool.run(new String[] { "--bogus" }));
  }
}
