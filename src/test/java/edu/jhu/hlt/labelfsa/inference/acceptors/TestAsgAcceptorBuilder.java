// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.labelfsa.inference.acceptors;

import static org.junit.Assert.*;

import java.util.List;

import org.junit.Test;

import com.google.common.collect.ImmutableList;

import edu.jhu.hlt.labelfsa.inference.acceptors.ValidationResult.Kind;

public class TestAsgAcceptorBuilder {

  private static final AsgAcceptorBuilder ASG = AsgAcceptorBuilder.INSTANCE;

  @Test
  public void testEdgesForTwoLabels() {
    Automaton a = ASG.build(3, new int[] {0, 1});
    List<Edge> expected = ImmutableList.of(
        new Edge(0, 1, 0), new Edge(1, 1, 0),
        new Edge(1, 2, 1), new Edge(2, 2, 1));
    assertEquals(3, a.getNumStates());
    assertEquals(expected, a.getEdges());
    assertTrue(AutomatonValidator.validate(a).isValid());
  }

  @Test
  public void testStateCountIsNumberOfLabels() {
    int [][] seqs = { {0}, {0, 1}, {1, 0, 1, 0, 1, 0}, {4}, {3, 3, 3} };
    for (int numLabels = 5; numLabels <= 9; numLabels++) {
      for (int [] s : seqs)
        assertEquals(numLabels, ASG.build(numLabels, s).getNumStates());
    }
  }

  @Test
  public void testNoBlankEdges() {
    Automaton a = ASG.build(4, new int[] {2, 0, 1, 3});
    for (Edge e : a.getEdges())
      assertFalse(a.isBlank(e.getSymbol()));
    assertEquals(8, a.getNumEdges());
  }

  @Test
  public void testRepeatedLabelValuesCollide() {
    // states are keyed by label value, so both 0s emit the same two edges
    Automaton a = ASG.build(3, new int[] {0, 1, 0});
    assertEquals(ImmutableList.of(
        new Edge(0, 1, 0), new Edge(1, 1, 0),
        new Edge(1, 2, 1), new Edge(2, 2, 1),
        new Edge(0, 1, 0), new Edge(1, 1, 0)), a.getEdges());
    assertTrue(AutomatonValidator.validate(a).isValid());
  }

  @Test
  public void testLastLabelPointsPastFinalState() {
    Automaton a = ASG.build(3, new int[] {2});
    assertEquals(ImmutableList.of(new Edge(2, 3, 2), new Edge(3, 3, 2)), a.getEdges());
    ValidationResult result = AutomatonValidator.validate(a);
    assertFalse(result.isValid());
    assertEquals(2, result.getViolations(Kind.EDGE_OUT_OF_RANGE).size());
    assertTrue(result.has(Kind.UNREACHABLE_FROM_START));
    assertTrue(result.has(Kind.CANNOT_REACH_FINAL));
  }

  @Test
  public void testUnusedLabelsLeaveFinalUnreachable() {
    Automaton a = ASG.build(4, new int[] {0, 1});
    ValidationResult result = AutomatonValidator.validate(a);
    assertEquals(1, result.getViolations(Kind.UNREACHABLE_FROM_START).size());
    assertEquals(3, result.getViolations(Kind.UNREACHABLE_FROM_START).get(0).getState());
    assertEquals(3, result.getViolations(Kind.CANNOT_REACH_FINAL).size());
    assertFalse(result.has(Kind.EDGE_OUT_OF_RANGE));
  }

  @Test
  public void testDeterministic() {
    int [] s = {1, 2, 1, 0};
    assertEquals(ASG.build(4, s), ASG.build(4, s));
  }

  @Test
  public void testLabelOutOfRange() {
    try {
      ASG.build(2, new int[] {0, 1, 2});
      fail();
    } catch (InvalidLabelSequenceException e) {
      assertEquals(2, e.getPosition());
      assertEquals(2, e.getLabel());
    }
  }

  @Test(expected=InvalidLabelSequenceException.class)
  public void testEmptySequence() {
    ASG.build(2, new int[0]);
  }
}
