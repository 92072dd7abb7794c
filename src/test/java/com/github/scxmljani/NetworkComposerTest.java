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
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.Test;

import com.github.scxmljani.CompilerException.Code;

/**
 * Tests for merging resolved automata into one network with synchronized send and receive.
 */
public class NetworkComposerTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  private static final String header = StatechartParserTest.header;

  static final String producer = header + " name='P' initial='idle'>"
      + "<datamodel><data id='count' expr='0'/></datamodel>"
      + "<state id='idle'><transition event='start' target='running'>"
      + "  <assign location='count' expr='count + 1'/>"
      + "  <send event='go'><param name='speed' expr='count * 2'/></send>"
      + "</transition></state>"
      + "<state id='running'/></scxml>";

  static final String consumer = header + " name='C' initial='waiting'>"
      + "<datamodel><data id='speed' expr='0'/></datamodel>"
      + "<state id='waiting'><transition event='go' target='acked'>"
      + "  <assign location='speed' expr='_event.data.speed'/>"
      + "</transition></state>"
      + "<state id='acked'/></scxml>";

  private static AutomataNetwork compose(final List<DataVariable> globals,
      final List<PropertyDeclaration> properties, final String... documents)
      throws CompilerException {
    final List<Statechart> statecharts = new ArrayList<>();
    for (int i = 0; i < documents.length; i++) {
      statecharts.add(StatechartParser.parse(
          StatechartDocument.fromString("chart" + i + ".scxml", documents[i])));
    }
    final Map<String, ExpressionType> globalTypes = new LinkedHashMap<>();
    for (DataVariable global : globals) {
      globalTypes.put(global.getId(), global.getType());
    }
    final EventRegistry events = EventRegistry.build(statecharts, globalTypes);
    final CompilerConfiguration config = CompilerConfiguration.defaults();
    final List<ResolvedAutomaton> resolved = new ArrayList<>();
    for (Statechart statechart : statecharts) {
      resolved.add(StatechartResolver.resolve(statechart, globalTypes, events, config));
    }
    return NetworkComposer.compose("net", resolved, globals, events, properties, config);
  }

  private static AutomataNetwork compose(final String... documents) throws CompilerException {
    return compose(Collections.<DataVariable>emptyList(),
        Collections.<PropertyDeclaration>emptyList(), documents);
  }

  private static NetworkEdge onlyEdgeFrom(final NetworkAutomaton automaton,
      final String location) {
    final List<NetworkEdge> edges = automaton.getEdgesFrom(location);
    assertEquals("Edges from " + location + ": " + edges, 1, edges.size());
    return edges.get(0);
  }

  // the edge with the given action, null for the silent one
  private static NetworkEdge onlyEdgeFrom(final NetworkAutomaton automaton,
      final String location, final String action) {
    final List<NetworkEdge> found = new ArrayList<>();
    for (NetworkEdge edge : automaton.getEdgesFrom(location)) {
      if (action == null ? edge.isSilent() : action.equals(edge.getAction())) {
        found.add(edge);
      }
    }
    assertEquals("Edges " + action + " from " + location + ": " + found, 1, found.size());
    return found.get(0);
  }

  private static boolean isPassingBy(final NetworkEdge edge) {
    final NetworkDestination destination = onlyDestination(edge);
    return Expressions.isTrue(edge.getGuard())
        && destination.getLocation().equals(edge.getLocation())
        && destination.getAssignments().isEmpty();
  }

  // every participant has an unguarded edge with its action in its initial location
  private static boolean isEnabledInitially(final AutomataNetwork network,
      final SyncVector vector) {
    for (int i = 0; i < vector.getParticipants().size(); i++) {
      final String action = vector.getParticipants().get(i);
      if (action == null) {
        continue;
      }
      final NetworkAutomaton automaton = network.getAutomata().get(i);
      boolean enabled = false;
      for (NetworkEdge edge : automaton.getEdgesFrom(automaton.getInitialLocation())) {
        enabled |= action.equals(edge.getAction()) && Expressions.isTrue(edge.getGuard());
      }
      if (!enabled) {
        return false;
      }
    }
    return true;
  }

  private static NetworkDestination onlyDestination(final NetworkEdge edge) {
    assertEquals(1, edge.getDestinations().size());
    return edge.getDestinations().get(0);
  }

  @Test
  public void testSendSynchronizesWithReceiver() throws CompilerException {
    final AutomataNetwork network = compose(producer, consumer);
    assertEquals(2, network.getSyncVectors().size());
    final SyncVector go = network.getSyncVectors().get(0);
    assertEquals(Arrays.asList("go_on_send", "go_on_receive"), go.getParticipants());
    assertEquals("go", go.getResult());
    final SyncVector start = network.getSyncVectors().get(1);
    assertEquals(Arrays.asList("start_on_receive", null), start.getParticipants());
    assertEquals("start", start.getResult());
    assertTrue(network.getActions().containsAll(
        Arrays.asList("go", "go_on_send", "go_on_receive", "start", "start_on_receive")));

    final NetworkAutomaton p = network.findAutomaton("P");
    final NetworkAutomaton c = network.findAutomaton("C");
    assertEquals("idle", p.getInitialLocation());
    assertEquals("waiting", c.getInitialLocation());

    // idle --start--> idle__0_0 --silent, writes parameters--> idle__0_1 --go--> running
    final NetworkEdge received = onlyEdgeFrom(p, "idle");
    assertEquals("start_on_receive", received.getAction());
    final NetworkDestination afterStart = onlyDestination(received);
    assertEquals("idle__0_0", afterStart.getLocation());
    assertEquals("P.count", afterStart.getAssignments().get(0).getTarget());
    assertEquals("(P.count + 1)", afterStart.getAssignments().get(0).getValue().toString());

    final NetworkEdge parameters = onlyEdgeFrom(p, "idle__0_0", null);
    assertTrue(parameters.isSilent());
    assertEquals("!(go.valid)", parameters.getGuard().toString());
    final NetworkDestination written = onlyDestination(parameters);
    assertEquals("idle__0_1", written.getLocation());
    assertEquals("go.speed", written.getAssignments().get(0).getTarget());
    assertEquals("(P.count * 2)", written.getAssignments().get(0).getValue().toString());
    assertEquals("go.valid", written.getAssignments().get(1).getTarget());

    final NetworkEdge sent = onlyEdgeFrom(p, "idle__0_1", "go_on_send");
    assertEquals("go_on_send", sent.getAction());
    assertEquals("running", onlyDestination(sent).getLocation());
    assertEquals(Expressions.FALSE, onlyDestination(sent).getAssignments().get(0).getValue());

    final NetworkEdge delivered = onlyEdgeFrom(c, "waiting");
    assertEquals("go_on_receive", delivered.getAction());
    final NetworkDestination acked = onlyDestination(delivered);
    assertEquals("acked", acked.getLocation());
    assertEquals("C.speed", acked.getAssignments().get(0).getTarget());
    assertEquals("go.speed", acked.getAssignments().get(0).getValue().toString());

    // a listener with nothing to do lets the event pass, unchanged
    assertTrue(isPassingBy(onlyEdgeFrom(c, "acked", "go_on_receive")));
    assertTrue(isPassingBy(onlyEdgeFrom(p, "running", "start_on_receive")));
    // so does a sender in the middle of its chain
    assertTrue(isPassingBy(onlyEdgeFrom(p, "idle__0_0", "start_on_receive")));
    assertTrue(isPassingBy(onlyEdgeFrom(p, "idle__0_1", "start_on_receive")));
  }

  @Test
  public void testBroadcastReachesEveryListener() throws CompilerException {
    final String p = header + " name='P' initial='idle'>"
        + "<state id='idle'><transition event='go' target='running'/></state>"
        + "<state id='running'/></scxml>";
    final String c = header + " name='C' initial='waiting'>"
        + "<state id='waiting'><transition event='go' target='acked'/></state>"
        + "<state id='acked'/></scxml>";
    final AutomataNetwork network = compose(p, c);
    assertEquals(1, network.getSyncVectors().size());
    final SyncVector go = network.getSyncVectors().get(0);
    assertEquals(Arrays.asList("go_on_receive", "go_on_receive"), go.getParticipants());
    assertEquals("go", go.getResult());

    final NetworkAutomaton first = network.findAutomaton("P");
    final NetworkAutomaton second = network.findAutomaton("C");
    assertEquals("idle", first.getInitialLocation());
    assertEquals("waiting", second.getInitialLocation());
    assertTrue(isEnabledInitially(network, go));
    assertEquals("running",
        onlyDestination(onlyEdgeFrom(first, "idle", "go_on_receive")).getLocation());
    assertEquals("acked",
        onlyDestination(onlyEdgeFrom(second, "waiting", "go_on_receive")).getLocation());
  }

  @Test
  public void testMutualSendsDoNotBlock() throws CompilerException {
    final String a = header + " name='A' initial='s'>"
        + "<state id='s'><onentry><send event='e1'/></onentry>"
        + "  <transition event='f1' target='done'/></state>"
        + "<state id='done'/></scxml>";
    final String b = header + " name='B' initial='s'>"
        + "<state id='s'><onentry><send event='f1'/></onentry>"
        + "  <transition event='e1' target='done'/></state>"
        + "<state id='done'/></scxml>";
    final AutomataNetwork network = compose(a, b);
    final NetworkAutomaton first = network.findAutomaton("A");
    final NetworkAutomaton second = network.findAutomaton("B");
    assertEquals(StatechartResolver.initializingLocation, first.getInitialLocation());
    assertEquals(StatechartResolver.initializingLocation, second.getInitialLocation());
    assertEquals("s", onlyDestination(onlyEdgeFrom(first, first.getInitialLocation(),
        "e1_on_send")).getLocation());
    // each side lets the other's event pass while it has not entered s yet
    assertTrue(isPassingBy(onlyEdgeFrom(second, second.getInitialLocation(), "e1_on_receive")));
    assertTrue(isPassingBy(onlyEdgeFrom(first, first.getInitialLocation(), "f1_on_receive")));
    assertEquals(2, network.getSyncVectors().size());
    for (SyncVector vector : network.getSyncVectors()) {
      assertTrue(vector.toString(), isEnabledInitially(network, vector));
    }
  }

  @Test
  public void testIntermediateNamesAvoidStates() throws CompilerException {
    final String looping = producer.replace("<state id='running'/>",
        "<state id='running'><transition event='stop' target='idle__0_0'/></state>"
            + "<state id='idle__0_0'/>");
    final AutomataNetwork network = compose(looping, consumer);
    final NetworkAutomaton p = network.findAutomaton("P");
    assertTrue(p.getLocations().contains("idle__0_0"));
    final String afterStart =
        onlyDestination(onlyEdgeFrom(p, "idle", "start_on_receive")).getLocation();
    assertFalse("idle__0_0".equals(afterStart));
    assertTrue(onlyEdgeFrom(p, afterStart, null).isSilent());
    assertEquals(p.getLocations().size(), new HashSet<>(p.getLocations()).size());
    JaniSchemaValidator.validate(JaniModelEmitter.emit(network));
  }

  @Test
  public void testRandomDrawsAreBounded() {
    try {
      compose(header + " name='D'>"
          + "<datamodel><data id='r' expr='0.0'/></datamodel>"
          + "<state id='a'><transition event='roll' target='a'>"
          + "  <assign location='r' expr='Math.random() + Math.random() + Math.random()'/>"
          + "</transition></state></scxml>");
      fail("Expected a million equally likely destinations to be rejected");
    } catch (CompilerException expected) {
      assertEquals(Code.UNSUPPORTED_CONSTRUCT, expected.getCode());
      assertTrue(expected.getMessage().contains("3 Math.random() draws"));
    }
  }

  @Test
  public void testVariablesAreQualified() throws CompilerException {
    final AutomataNetwork network = compose(Arrays.asList(
        new DataVariable("limit", ExpressionType.INT, Expression.literal(3L))),
        Collections.<PropertyDeclaration>emptyList(), producer, consumer);
    assertNotNull(network.findVariable("limit"));
    assertNotNull(network.findVariable("P.count"));
    assertNotNull(network.findVariable("C.speed"));
    assertNotNull(network.findVariable("go.speed"));
    final NetworkVariable valid = network.findVariable("go.valid");
    assertEquals(ExpressionType.BOOL, valid.getType());
    assertEquals(Expressions.FALSE, valid.getInitialValue());
    assertNull(network.findVariable("count"));
  }

  @Test
  public void testSendWithoutListenerIsDropped() throws CompilerException {
    final AutomataNetwork network = compose(producer);
    assertEquals(1, network.getSyncVectors().size());
    assertEquals("start", network.getSyncVectors().get(0).getResult());
    final NetworkEdge received = onlyEdgeFrom(network.findAutomaton("P"), "idle");
    assertEquals("running", onlyDestination(received).getLocation());
    assertFalse(network.getActions().contains("go_on_send"));
  }

  @Test
  public void testPropertiesAreQualified() throws CompilerException {
    final AutomataNetwork network = compose(Collections.<DataVariable>emptyList(),
        Arrays.asList(new PropertyDeclaration("acked", "C.speed > 0",
            PropertyDeclaration.Kind.PMAX)), producer, consumer);
    assertEquals(1, network.getProperties().size());
    assertEquals("(C.speed > 0)", network.getProperties().get(0).getGoal().toString());

    try {
      compose(Collections.<DataVariable>emptyList(),
          Arrays.asList(new PropertyDeclaration("broken", "nothing > 0",
              PropertyDeclaration.Kind.PMAX)), producer, consumer);
      fail("Expected an unknown variable in a property to be rejected");
    } catch (CompilerException expected) {
      assertEquals(Code.UNRESOLVED_REFERENCE, expected.getCode());
    }
  }

  @Test
  public void testCollidingNamesAreRejected() {
    try {
      compose(Arrays.asList(new DataVariable("go.valid", ExpressionType.BOOL, null)),
          Collections.<PropertyDeclaration>emptyList(), producer, consumer);
      fail("Expected a global to collide with the event flag");
    } catch (CompilerException expected) {
      assertEquals(Code.COMPOSITION_INCONSISTENCY, expected.getCode());
    }
    try {
      compose(producer, producer);
      fail("Expected two automata with the same name to be rejected");
    } catch (CompilerException expected) {
      assertEquals(Code.COMPOSITION_INCONSISTENCY, expected.getCode());
    }
  }

  @Test
  public void testInconsistentParametersAreRejected() {
    final String other = header + " name='Q'>"
        + "<state id='q'><transition event='tick' target='q'>"
        + "  <send event='go'><param name='distance' expr='1'/></send>"
        + "</transition></state></scxml>";
    try {
      compose(producer, other, consumer);
      fail("Expected the same event with different parameters to be rejected");
    } catch (CompilerException expected) {
      assertEquals(Code.COMPOSITION_INCONSISTENCY, expected.getCode());
    }
  }
}
