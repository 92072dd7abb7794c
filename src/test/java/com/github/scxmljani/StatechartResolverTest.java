package com.github.scxmljani;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import com.github.scxmljani.CompilerConfiguration.CompilerConfigurationBuilder;
import com.github.scxmljani.CompilerException.Code;

/**
 * Tests for flattening of hierarchical and parallel statecharts into locations and microsteps.
 */
public class StatechartResolverTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  private static final String header = StatechartParserTest.header;

  private static ResolvedAutomaton resolve(final String xml) throws CompilerException {
    return resolve(xml, CompilerConfiguration.defaults());
  }

  private static ResolvedAutomaton resolve(final String xml, final CompilerConfiguration config)
      throws CompilerException {
    final Statechart statechart =
        StatechartParser.parse(StatechartDocument.fromString("chart.scxml", xml));
    final EventRegistry events = EventRegistry.build(Collections.singletonList(statechart),
        Collections.<String, ExpressionType>emptyMap());
    return StatechartResolver.resolve(statechart,
        Collections.<String, ExpressionType>emptyMap(), events, config);
  }

  private static List<Microstep> steps(final ResolvedAutomaton automaton, final String location,
      final String event) {
    final Location source = automaton.findLocation(location);
    assertNotNull("No location " + location, source);
    final List<Microstep> found = new ArrayList<>();
    for (Microstep microstep : automaton.getMicrostepsFrom(source.getIndex())) {
      if (event == null ? microstep.getEvent() == null : event.equals(microstep.getEvent())) {
        found.add(microstep);
      }
    }
    return found;
  }

  private static String targetOf(final ResolvedAutomaton automaton, final Microstep microstep) {
    return automaton.getLocation(microstep.getTarget()).getName();
  }

  private static List<String> locationNames(final ResolvedAutomaton automaton) {
    final List<String> names = new ArrayList<>();
    for (Location location : automaton.getLocations()) {
      names.add(location.getName());
    }
    return names;
  }

  @Test
  public void testFlatChartIsUnchanged() throws CompilerException {
    final String xml = header + " initial='a'>"
        + "<state id='a'><transition event='e' target='b'/></state>"
        + "<state id='b'><transition event='f' target='a'/></state></scxml>";
    final ResolvedAutomaton automaton = resolve(xml);
    assertEquals(Arrays.asList("a", "b"), locationNames(automaton));
    assertEquals("a", automaton.getInitialLocation().getName());
    assertEquals(Arrays.asList("e", "f"), new ArrayList<>(automaton.getReceivableEvents()));
    assertEquals(4, automaton.getMicrosteps().size());

    final List<Microstep> ae = steps(automaton, "a", "e");
    assertEquals(1, ae.size());
    assertEquals(Microstep.Kind.RECEIVE, ae.get(0).getKind());
    assertEquals("b", targetOf(automaton, ae.get(0)));
    assertEquals(Arrays.asList(0), ae.get(0).getTransitions());

    final List<Microstep> af = steps(automaton, "a", "f");
    assertEquals(Microstep.Kind.DISCARD, af.get(0).getKind());
    assertEquals("a", targetOf(automaton, af.get(0)));

    // resolving again gives the same locations
    assertEquals(locationNames(automaton), locationNames(resolve(xml)));
  }

  @Test
  public void testInnermostTransitionPreempts() throws CompilerException {
    final ResolvedAutomaton automaton = resolve(header + " initial='S'>"
        + "<state id='S' initial='A'>"
        + "  <transition event='x' target='T'/>"
        + "  <state id='A'><transition event='x' target='B'/></state>"
        + "  <state id='B'/>"
        + "</state>"
        + "<state id='T'/></scxml>");
    assertEquals("A", automaton.getInitialLocation().getName());
    final List<Microstep> fromA = steps(automaton, "A", "x");
    assertEquals(1, fromA.size());
    assertEquals("B", targetOf(automaton, fromA.get(0)));

    final List<Microstep> fromB = steps(automaton, "B", "x");
    assertEquals(1, fromB.size());
    assertEquals("T", targetOf(automaton, fromB.get(0)));

    final List<Microstep> fromT = steps(automaton, "T", "x");
    assertEquals(Microstep.Kind.DISCARD, fromT.get(0).getKind());
  }

  @Test
  public void testParallelConflictPicksDocumentOrder() throws CompilerException {
    final String xml = header + " initial='P'>"
        + "<parallel id='P'>"
        + "  <state id='R1'><state id='a1'><transition event='x' target='out1'/></state></state>"
        + "  <state id='R2'><state id='b1'><transition event='x' target='out2'/></state></state>"
        + "</parallel>"
        + "<state id='out1'/><state id='out2'/></scxml>";
    final ResolvedAutomaton automaton = resolve(xml);
    assertEquals("a1+b1", automaton.getInitialLocation().getName());
    final List<Microstep> taken = steps(automaton, "a1+b1", "x");
    assertEquals(1, taken.size());
    assertEquals("out1", targetOf(automaton, taken.get(0)));
    assertEquals(Arrays.asList(0), taken.get(0).getTransitions());
    assertNull(automaton.findLocation("out2"));

    final ResolvedAutomaton again = resolve(xml);
    assertEquals(locationNames(automaton), locationNames(again));
    assertEquals("out1", targetOf(again, steps(again, "a1+b1", "x").get(0)));
  }

  @Test
  public void testParallelRegionsMoveTogether() throws CompilerException {
    final ResolvedAutomaton automaton = resolve(header + ">"
        + "<parallel id='P'>"
        + "  <state id='R1'><state id='a1'><transition event='x' target='a2'/></state>"
        + "    <state id='a2'/></state>"
        + "  <state id='R2'><state id='b1'><transition event='x' target='b2'/></state>"
        + "    <state id='b2'/></state>"
        + "</parallel></scxml>");
    final List<Microstep> taken = steps(automaton, "a1+b1", "x");
    assertEquals(1, taken.size());
    assertEquals("a2+b2", targetOf(automaton, taken.get(0)));
    assertEquals(Arrays.asList(0, 1), taken.get(0).getTransitions());
  }

  @Test
  public void testGuardsCoverEveryValuation() throws CompilerException {
    final ResolvedAutomaton automaton = resolve(header + ">"
        + "<datamodel><data id='x' expr='0'/></datamodel>"
        + "<state id='a'><transition event='e' cond='x &gt; 0' target='b'/>"
        + "  <transition event='e' target='a'><assign location='x' expr='x + 1'/></transition>"
        + "</state>"
        + "<state id='b'/></scxml>");
    final List<Microstep> fromA = steps(automaton, "a", "e");
    assertEquals(2, fromA.size());
    assertEquals("b", targetOf(automaton, fromA.get(0)));
    assertEquals("(x > 0)", fromA.get(0).getGuard().toString());
    assertEquals("a", targetOf(automaton, fromA.get(1)));
    assertEquals(Expressions.not(fromA.get(0).getGuard()), fromA.get(1).getGuard());
    assertEquals(1, fromA.get(1).getActions().size());

    // nothing is enabled in b, every event is discarded
    final List<Microstep> fromB = steps(automaton, "b", "e");
    assertEquals(1, fromB.size());
    assertEquals(Microstep.Kind.DISCARD, fromB.get(0).getKind());
    assertTrue(Expressions.isTrue(fromB.get(0).getGuard()));
  }

  @Test
  public void testInitialContentGetsItsOwnLocation() throws CompilerException {
    final ResolvedAutomaton automaton = resolve(header + ">"
        + "<datamodel><data id='x' expr='0'/></datamodel>"
        + "<state id='a'><onentry><assign location='x' expr='5'/></onentry></state></scxml>");
    final Location initial = automaton.getInitialLocation();
    assertEquals(StatechartResolver.initializingLocation, initial.getName());
    assertTrue(initial.isInitializing());
    final List<Microstep> entry = steps(automaton, StatechartResolver.initializingLocation, null);
    assertEquals(1, entry.size());
    assertEquals(Microstep.Kind.INTERNAL, entry.get(0).getKind());
    assertEquals("a", targetOf(automaton, entry.get(0)));
    assertEquals(1, entry.get(0).getActions().size());
  }

  @Test
  public void testDoneEventsAndTermination() throws CompilerException {
    final ResolvedAutomaton automaton = resolve(header + " initial='S'>"
        + "<state id='S' initial='s1'>"
        + "  <state id='s1'><transition event='go' target='sf'/></state>"
        + "  <final id='sf'/>"
        + "  <transition event='done.state.S' target='end'/>"
        + "</state>"
        + "<final id='end'/></scxml>");
    assertEquals(Collections.singleton("go"), automaton.getReceivableEvents());
    final List<Microstep> go = steps(automaton, "s1", "go");
    assertEquals("sf|done.state.S", targetOf(automaton, go.get(0)));

    final List<Microstep> done = steps(automaton, "sf|done.state.S", "done.state.S");
    assertEquals(1, done.size());
    assertEquals(Microstep.Kind.INTERNAL, done.get(0).getKind());
    assertEquals("end", targetOf(automaton, done.get(0)));

    final Location end = automaton.findLocation("end");
    assertTrue(end.isTerminated());
    final List<Microstep> afterEnd = steps(automaton, "end", "go");
    assertEquals(1, afterEnd.size());
    assertEquals(Microstep.Kind.DISCARD, afterEnd.get(0).getKind());
    assertFalse(automaton.findLocation("s1").isTerminated());
  }

  @Test
  public void testInPredicateFollowsTheConfiguration() throws CompilerException {
    final ResolvedAutomaton automaton = resolve(header + ">"
        + "<parallel id='P'>"
        + "  <state id='R1'><state id='a1'><transition event='x' target='a2'/></state>"
        + "    <state id='a2'/></state>"
        + "  <state id='R2'><state id='b1'>"
        + "    <transition event='y' cond=\"In('a2')\" target='b2'/></state>"
        + "    <state id='b2'/></state>"
        + "</parallel></scxml>");
    final List<Microstep> early = steps(automaton, "a1+b1", "y");
    assertEquals(1, early.size());
    assertEquals(Microstep.Kind.DISCARD, early.get(0).getKind());
    final List<Microstep> late = steps(automaton, "a2+b1", "y");
    assertEquals(1, late.size());
    assertEquals("a2+b2", targetOf(automaton, late.get(0)));
    assertTrue(Expressions.isTrue(late.get(0).getGuard()));
  }

  @Test
  public void testInternalSendIsRaised() throws CompilerException {
    final ResolvedAutomaton automaton = resolve(header + " initial='a'>"
        + "<state id='a'><transition event='go' target='b'>"
        + "  <send event='next' target='#_internal'/></transition></state>"
        + "<state id='b'><transition event='next' target='c'/></state>"
        + "<state id='c'/></scxml>");
    assertEquals(Collections.singleton("go"), automaton.getReceivableEvents());
    assertEquals("b|next", targetOf(automaton, steps(automaton, "a", "go").get(0)));
    final List<Microstep> consumed = steps(automaton, "b|next", "next");
    assertEquals(Microstep.Kind.INTERNAL, consumed.get(0).getKind());
    assertEquals("c", targetOf(automaton, consumed.get(0)));
  }

  @Test
  public void testGuardedEventlessLoopSettles() throws CompilerException {
    final ResolvedAutomaton automaton = resolve(header + ">"
        + "<datamodel><data id='x' expr='0'/></datamodel>"
        + "<state id='a'><transition cond='x &lt; 3' target='a'>"
        + "  <assign location='x' expr='x + 1'/></transition>"
        + "  <transition event='e' target='a'/></state></scxml>");
    final List<Microstep> eventless = steps(automaton, "a", null);
    assertEquals(1, eventless.size());
    assertEquals(Microstep.Kind.INTERNAL, eventless.get(0).getKind());
    // the event is only received once the eventless transition is disabled
    final List<Microstep> received = steps(automaton, "a", "e");
    assertEquals(2, received.size());
    assertEquals(Microstep.Kind.DISCARD, received.get(0).getKind());
    assertEquals("(x < 3)", received.get(0).getGuard().toString());
    assertEquals("a", targetOf(automaton, received.get(0)));
    assertEquals(Microstep.Kind.RECEIVE, received.get(1).getKind());
    assertEquals("!((x < 3))", received.get(1).getGuard().toString());
  }

  @Test
  public void testEventsPassByPendingSteps() throws CompilerException {
    final ResolvedAutomaton automaton = resolve(header + " initial='a'>"
        + "<state id='a'><onentry><raise event='ping'/></onentry>"
        + "  <transition event='ping' target='b'/>"
        + "  <transition event='e' target='b'/></state>"
        + "<state id='b'><transition event='e' target='a'/></state></scxml>");
    assertEquals("a|ping", automaton.getInitialLocation().getName());
    final List<Microstep> pending = steps(automaton, "a|ping", "e");
    assertEquals(1, pending.size());
    assertEquals(Microstep.Kind.DISCARD, pending.get(0).getKind());
    assertEquals("a|ping", targetOf(automaton, pending.get(0)));
    assertTrue(Expressions.isTrue(pending.get(0).getGuard()));
    assertEquals(Microstep.Kind.RECEIVE, steps(automaton, "b", "e").get(0).getKind());
  }

  @Test
  public void testUserStateNamedLikeTheEntryLocation() throws CompilerException {
    final ResolvedAutomaton automaton = resolve(header + " initial='s'>"
        + "<datamodel><data id='x' expr='0'/></datamodel>"
        + "<state id='s'><onentry><assign location='x' expr='1'/></onentry>"
        + "  <transition event='e' target='__init'/></state>"
        + "<state id='__init'><transition event='f' target='s'/></state></scxml>");
    assertEquals(3, automaton.getLocations().size());
    final Location entry = automaton.getInitialLocation();
    assertTrue(entry.isInitializing());
    assertFalse(StatechartResolver.initializingLocation.equals(entry.getName()));

    final Location user = automaton.findLocation("__init");
    assertFalse(user.isInitializing());
    assertEquals("__init", targetOf(automaton, steps(automaton, "s", "e").get(0)));
    final List<Microstep> back = steps(automaton, "__init", "f");
    assertEquals(1, back.size());
    assertEquals(Microstep.Kind.RECEIVE, back.get(0).getKind());
    assertEquals("s", targetOf(automaton, back.get(0)));
    assertEquals(1, back.get(0).getActions().size());
  }

  @Test
  public void testLocationsWithTheSameNameStayApart() throws CompilerException {
    final ResolvedAutomaton automaton = resolve(header + " initial='P'>"
        + "<parallel id='P'>"
        + "  <state id='R1'><state id='a'><transition event='x' target='a+b'/></state></state>"
        + "  <state id='R2'><state id='b'/></state>"
        + "</parallel>"
        + "<state id='a+b'><transition event='x' target='P'/></state></scxml>");
    assertEquals(Arrays.asList("a+b", "a+b_1"), locationNames(automaton));
    assertEquals("a+b_1", targetOf(automaton, steps(automaton, "a+b", "x").get(0)));
    assertEquals("a+b", targetOf(automaton, steps(automaton, "a+b_1", "x").get(0)));
  }

  @Test
  public void testEventlessCycleIsRejected() {
    try {
      resolve(header + " initial='a'>"
          + "<state id='a'><transition target='b'/></state>"
          + "<state id='b'><transition target='a'/></state></scxml>");
      fail("Expected an unconditional eventless cycle to be rejected");
    } catch (CompilerException expected) {
      assertEquals(Code.SEMANTIC_NONTERMINATION, expected.getCode());
      assertEquals("chart.scxml", expected.getDocumentId());
    }
  }

  @Test
  public void testInternalQueueIsBounded() throws CompilerException {
    final CompilerConfiguration config =
        CompilerConfigurationBuilder.newBuilder().internalQueueBound(2).build();
    try {
      resolve(header + ">"
          + "<state id='a'><onentry><raise event='e'/><raise event='e'/></onentry>"
          + "  <transition event='e' target='a'/></state></scxml>", config);
      fail("Expected an ever growing internal queue to be rejected");
    } catch (CompilerException expected) {
      assertEquals(Code.SEMANTIC_NONTERMINATION, expected.getCode());
      assertTrue(expected.getMessage().contains("exceeds the bound of 2"));
    }
  }

  @Test
  public void testTypeErrorsInGuardsAreLocated() {
    try {
      resolve(header + "><datamodel><data id='flag' expr='true'/></datamodel>"
          + "<state id='a'><transition event='e' cond='flag + 1 &gt; 0' target='a'/></state>"
          + "</scxml>");
      fail("Expected a boolean in arithmetic to be rejected");
    } catch (CompilerException expected) {
      assertEquals(Code.UNSUPPORTED_CONSTRUCT, expected.getCode());
      assertEquals("chart.scxml", expected.getDocumentId());
    }
  }
}
