package com.github.scxmljani;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Collections;

import org.junit.Test;

import com.github.scxmljani.CompilerException.Code;

/**
 * Tests for building statecharts out of SCXML documents.
 */
public class StatechartParserTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  static final String header =
      "<scxml xmlns='http://www.w3.org/2005/07/scxml' version='1.0' datamodel='ecmascript'";

  private static Statechart parse(final String id, final String xml) throws CompilerException {
    return StatechartParser.parse(StatechartDocument.fromString(id, xml));
  }

  @Test
  public void testHierarchy() throws CompilerException {
    final Statechart statechart = parse("robot.scxml", header + " initial='S'>"
        + "<datamodel><data id='count' expr='0'/><data id='speed' type='float64' expr='1.5'/>"
        + "</datamodel>"
        + "<state id='S' initial='A'>"
        + "  <transition event='x' target='T'/>"
        + "  <state id='A'><transition event='x' target='B'/></state>"
        + "  <state id='B'/>"
        + "</state>"
        + "<parallel id='T'><state id='R1'/><state id='R2'/></parallel>"
        + "<final id='done'/>"
        + "</scxml>");
    assertEquals("robot", statechart.getName());
    assertEquals("robot.scxml", statechart.getDocumentId());
    assertEquals(StateKind.COMPOUND, statechart.getState("S").getKind());
    assertEquals(StateKind.ATOMIC, statechart.getState("A").getKind());
    assertEquals(StateKind.PARALLEL, statechart.getState("T").getKind());
    assertEquals(StateKind.FINAL, statechart.getState("done").getKind());
    assertEquals(statechart.getState("S"), statechart.getState("A").getParent());
    assertTrue(statechart.getState("B").isDescendantOf(statechart.getState("S")));
    assertFalse(statechart.isFlat());

    // document order: the transition of S precedes the one of its child A
    assertEquals(2, statechart.getTransitions().size());
    assertEquals("S", statechart.getTransitions().get(0).getSource().getId());
    assertEquals(0, statechart.getTransitions().get(0).getDocumentIndex());
    assertEquals("A", statechart.getTransitions().get(1).getSource().getId());

    assertEquals("A",
        statechart.getState("S").getInitialTransition().getTargets().get(0).getId());
    assertEquals("R1",
        statechart.getState("T").getChildren().get(0).getId());

    assertEquals(ExpressionType.INT, statechart.getLocalTypes().get("count"));
    assertEquals(ExpressionType.REAL, statechart.getLocalTypes().get("speed"));
  }

  @Test
  public void testNameAndInstanceParameters() throws CompilerException {
    final String xml = header + " name='Counter' initial='idle'>"
        + "<datamodel><data id='limit' type='int32' expr='3'/></datamodel>"
        + "<state id='idle'/></scxml>";
    assertEquals("Counter", parse("counter.scxml", xml).getName());

    final Statechart instance = StatechartParser.parse(
        StatechartDocument.fromString("counter.scxml", xml), "counter_2",
        Collections.singletonMap("limit", "7"));
    assertEquals("counter_2", instance.getName());
    assertEquals(Long.valueOf(7L),
        ((Expression.Literal) instance.getDataVariables().get("limit").getInitialValue())
            .getValue());

    try {
      StatechartParser.parse(StatechartDocument.fromString("counter.scxml", xml), "c",
          Collections.singletonMap("unknown", "1"));
      fail("Expected a parameter without data variable to be rejected");
    } catch (CompilerException expected) {
      assertEquals(Code.STRUCTURAL_VALIDITY, expected.getCode());
    }
  }

  @Test
  public void testExecutableContent() throws CompilerException {
    final Statechart statechart = parse("content.scxml", header + ">"
        + "<datamodel><data id='x' expr='0'/><data id='buf' type='int32[4]'/></datamodel>"
        + "<state id='s'>"
        + "  <onentry><assign location='x' expr='x + 1'/><log expr='x'/></onentry>"
        + "  <transition event='go' cond='x &gt; 2' target='s'>"
        + "    <assign location='buf[1]' expr='x'/>"
        + "    <send event='ack'><param name='value' expr='x'/></send>"
        + "    <send event='self' target='#_internal'/>"
        + "    <if cond='x == 3'><raise event='three'/>"
        + "    <elseif cond='x == 4'/><else/><assign location='x' expr='0'/></if>"
        + "  </transition>"
        + "</state></scxml>");
    final StateNode state = statechart.getState("s");
    // <log> is dropped
    assertEquals(1, state.getOnEntry().size());
    assertEquals(ExecutableContent.Kind.ASSIGN, state.getOnEntry().get(0).getKind());

    final TransitionNode transition = state.getTransitions().get(0);
    assertEquals("(x > 2)", transition.getGuard().toString());
    assertEquals(4, transition.getContent().size());

    final ExecutableContent.Assign element =
        (ExecutableContent.Assign) transition.getContent().get(0);
    assertEquals("buf", element.getTarget());
    assertEquals("1", element.getIndex().toString());

    final ExecutableContent.Send send = (ExecutableContent.Send) transition.getContent().get(1);
    assertEquals("ack", send.getEvent());
    assertEquals("x", send.getParameters().get("value").toString());

    final ExecutableContent.Raise internal =
        (ExecutableContent.Raise) transition.getContent().get(2);
    assertEquals("self", internal.getEvent());

    final ExecutableContent.If conditional = (ExecutableContent.If) transition.getContent().get(3);
    assertEquals(3, conditional.getBranches().size());
    assertTrue(conditional.hasElse());
    assertTrue(conditional.getBranches().get(1).getContent().isEmpty());
    assertNull(conditional.getBranches().get(2).getCondition());
    assertEquals(1, conditional.getBranches().get(2).getContent().size());

    // no initial attribute: the first child state
    assertEquals("s",
        statechart.getRoot().getInitialTransition().getTargets().get(0).getId());
  }

  @Test
  public void testEventDescriptors() {
    assertTrue(TransitionNode.descriptorMatches("error", "error.execution"));
    assertTrue(TransitionNode.descriptorMatches("error.*", "error.execution"));
    assertTrue(TransitionNode.descriptorMatches("*", "anything"));
    assertFalse(TransitionNode.descriptorMatches("error", "errors"));
    assertFalse(TransitionNode.descriptorMatches("error.execution", "error"));
  }

  @Test
  public void testStructuralErrors() {
    assertFailure(header + "><state id='a'/><state id='a'/></scxml>", Code.STRUCTURAL_VALIDITY);
    assertFailure(header + "><state id='a'><transition target='nowhere'/></state></scxml>",
        Code.STRUCTURAL_VALIDITY);
    assertFailure(header + " initial='b'><state id='a'/></scxml>", Code.STRUCTURAL_VALIDITY);
    assertFailure(header + "><state id='a' initial='c'><state id='b'/></state><state id='c'/>"
        + "</scxml>", Code.STRUCTURAL_VALIDITY);
    assertFailure(header + "></scxml>", Code.STRUCTURAL_VALIDITY);
    assertFailure("<state id='a'/>", Code.STRUCTURAL_VALIDITY);
    assertFailure(header + "><state id='a'><transition cond='x +' target='a'/></state></scxml>",
        Code.STRUCTURAL_VALIDITY);
    assertFailure("<scxml><state", Code.STRUCTURAL_VALIDITY);
  }

  @Test
  public void testUnsupportedConstructs() {
    assertFailure(header + "><state id='a'><history id='h'/></state></scxml>",
        Code.UNSUPPORTED_CONSTRUCT);
    assertFailure(header + "><state id='a'><invoke src='b.scxml'/></state></scxml>",
        Code.UNSUPPORTED_CONSTRUCT);
    assertFailure(header + "><state id='a'><onentry><send event='e' delay='1s'/></onentry>"
        + "</state></scxml>", Code.UNSUPPORTED_CONSTRUCT);
    assertFailure(header + "><state id='a'><onentry><send event='e' target='B'/></onentry>"
        + "</state></scxml>", Code.UNSUPPORTED_CONSTRUCT);
    assertFailure("<scxml xmlns='http://www.w3.org/2005/07/scxml' datamodel='xpath'>"
        + "<state id='a'/></scxml>", Code.UNSUPPORTED_CONSTRUCT);
  }

  @Test
  public void testErrorsAreLocated() {
    try {
      parse("located.scxml", header + "><state id='a'><transition event='e' target='gone'/>"
          + "</state></scxml>");
      fail("Expected a dangling target to be rejected");
    } catch (CompilerException expected) {
      assertEquals("located.scxml", expected.getDocumentId());
      assertEquals("/scxml/state[0]#a/transition[0]", expected.getLocation());
    }
  }

  private static void assertFailure(final String xml, final Code code) {
    try {
      parse("broken.scxml", xml);
      fail("Expected " + code + " for " + xml);
    } catch (CompilerException expected) {
      assertEquals(xml, code, expected.getCode());
    }
  }
}
