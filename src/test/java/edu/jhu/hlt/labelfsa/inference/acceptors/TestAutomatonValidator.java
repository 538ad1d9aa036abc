// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.labelfsa.inference.acceptors;

import static org.junit.Assert.*;

import java.util.Collections;

import org.junit.Test;

import com.google.common.collect.ImmutableList;

import edu.jhu.hlt.labelfsa.inference.acceptors.ValidationResult.Kind;

public class TestAutomatonValidator {

  @Test
  public void testSingleStateIsValid() {
    Automaton a = new Automaton(1, 2, Collections.<Edge>emptyList());
    assertTrue(AutomatonValidator.validate(a).isValid());
  }

  @Test
  public void testChainIsValid() {
    Automaton a = new Automaton(3, 1, ImmutableList.of(
        new Edge(0, 1, 0), new Edge(1, 2, 1), new Edge(2, 2, 1)));
    ValidationResult result = AutomatonValidator.validate(a);
    assertTrue(result.isValid());
    assertEquals("valid", result.toString());
    result.throwIfInvalid();
  }

  @Test
  public void testStartWithIncomingEdge() {
    Automaton a = new Automaton(3, 1, ImmutableList.of(
        new Edge(0, 1, 0), new Edge(1, 0, 0), new Edge(1, 2, 0)));
    ValidationResult result = AutomatonValidator.validate(a);
    assertEquals(1, result.getViolations().size());
    assertEquals(Kind.START_HAS_INCOMING, result.getViolations().get(0).getKind());
    assertEquals(0, result.getViolations().get(0).getState());
  }

  @Test
  public void testFinalWithOutgoingEdge() {
    Automaton a = new Automaton(3, 1, ImmutableList.of(
        new Edge(0, 1, 0), new Edge(1, 2, 0), new Edge(2, 1, 0)));
    ValidationResult result = AutomatonValidator.validate(a);
    assertEquals(ImmutableList.of(Kind.FINAL_HAS_OUTGOING), kinds(result));
  }

  @Test
  public void testSelfLoopsOnStartAndFinalAllowed() {
    Automaton a = new Automaton(2, 1, ImmutableList.of(
        new Edge(0, 0, 1), new Edge(0, 1, 0), new Edge(1, 1, 1)));
    assertTrue(AutomatonValidator.validate(a).isValid());
  }

  @Test
  public void testBadSymbolAndWeight() {
    Automaton a = new Automaton(2, 1, ImmutableList.of(
        new Edge(0, 1, 2), new Edge(0, 1, -1), new Edge(0, 1, 0, -0.5), new Edge(0, 1, 1, Double.NaN)));
    ValidationResult result = AutomatonValidator.validate(a);
    assertEquals(2, result.getViolations(Kind.SYMBOL_OUT_OF_RANGE).size());
    assertEquals(2, result.getViolations(Kind.NEGATIVE_WEIGHT).size());
    assertEquals(4, result.getViolations().size());
  }

  @Test
  public void testUnreachableStates() {
    // 0 -> 2, state 1 hangs off nothing, state 3 is a dead end
    Automaton a = new Automaton(4, 1, ImmutableList.of(
        new Edge(0, 2, 0), new Edge(2, 3, 0), new Edge(0, 4, 0)));
    ValidationResult result = AutomatonValidator.validate(a);
    assertEquals(1, result.getViolations(Kind.EDGE_OUT_OF_RANGE).size());
    assertEquals(1, result.getViolations(Kind.UNREACHABLE_FROM_START).size());
    assertEquals(1, result.getViolations(Kind.UNREACHABLE_FROM_START).get(0).getState());
    assertEquals(1, result.getViolations(Kind.CANNOT_REACH_FINAL).size());
    assertEquals(1, result.getViolations(Kind.CANNOT_REACH_FINAL).get(0).getState());
  }

  @Test
  public void testThrowIfInvalid() {
    Automaton a = new Automaton(2, 1, Collections.<Edge>emptyList());
    try {
      AutomatonValidator.validate(a).throwIfInvalid();
      fail();
    } catch (StructuralInvariantViolationException e) {
      assertEquals(2, e.getViolations().size());
      assertTrue(e.getMessage(), e.getMessage().startsWith("2 structural violation(s)"));
    }
  }

  @Test(expected=IllegalArgumentException.class)
  public void testAutomatonNeedsAState() {
    new Automaton(0, 1, Collections.<Edge>emptyList());
  }

  private static ImmutableList<Kind> kinds(ValidationResult result) {
    ImmutableList.Builder<Kind> b = ImmutableList.builder();
    for (ValidationResult.Violation v : result.getViolations())
      b.add(v.getKind());
    return b.build();
  }
}
