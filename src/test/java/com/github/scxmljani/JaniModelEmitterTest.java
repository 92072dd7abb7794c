package com.github.scxmljani;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.scxmljani.CompilerConfiguration.CompilerConfigurationBuilder;
import com.github.scxmljani.NetworkDescription.NetworkDescriptionBuilder;
import com.github.scxmljani.StatechartCompiler.StatechartCompilerBuilder;

/**
 * Tests for the JANI document emitted from a composed network.
 */
public class JaniModelEmitterTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  private static final String header = StatechartParserTest.header;

  private static ObjectNode emit(final CompilerConfiguration config,
      final NetworkDescription description) throws CompilerException {
    final StatechartCompiler compiler =
        StatechartCompilerBuilder.newBuilder().config(config).build();
    final ObjectNode model = JaniModelEmitter.emit(compiler.compile(description));
    JaniSchemaValidator.validate(model);
    return model;
  }

  private static List<String> texts(final JsonNode array, final String member) {
    final List<String> values = new ArrayList<>();
    for (JsonNode element : array) {
      values.add(member == null ? element.asText() : element.path(member).asText());
    }
    return values;
  }

  private static JsonNode edgeFrom(final JsonNode automaton, final String location) {
    for (JsonNode edge : automaton.path("edges")) {
      if (location.equals(edge.path("location").asText())) {
        return edge;
      }
    }
    throw new AssertionError("No edge from " + location);
  }

  private static ObjectNode producerConsumer() throws CompilerException {
    return emit(CompilerConfiguration.defaults(), NetworkDescriptionBuilder.newBuilder()
        .name("relay")
        .automaton(StatechartDocument.fromString("p.scxml", NetworkComposerTest.producer))
        .automaton(StatechartDocument.fromString("c.scxml", NetworkComposerTest.consumer))
        .property(new PropertyDeclaration("acked", "C.speed > 0", PropertyDeclaration.Kind.PMAX))
        .build());
  }

  @Test
  public void testModelHeaderAndDeclarations() throws CompilerException {
    final ObjectNode model = producerConsumer();
    assertEquals(1, model.path("jani-version").asInt());
    assertEquals("relay", model.path("name").asText());
    assertEquals("mdp", model.path("type").asText());
    assertTrue(texts(model.path("features"), null).contains("derived-operators"));

    final JsonNode variables = model.path("variables");
    assertEquals(Arrays.asList("P.count", "C.speed", "go.speed", "go.valid"),
        texts(variables, "name"));
    assertEquals("int", variables.get(0).path("type").asText());
    assertEquals("bool", variables.get(3).path("type").asText());
    assertFalse(variables.get(3).path("initial-value").asBoolean());

    assertEquals(Arrays.asList("P", "C"), texts(model.path("system").path("elements"), "automaton"));
    final JsonNode syncs = model.path("system").path("syncs");
    assertEquals(2, syncs.size());
    assertEquals(Arrays.asList("go_on_send", "go_on_receive"),
        texts(syncs.get(0).path("synchronise"), null));
    assertEquals("go", syncs.get(0).path("result").asText());
    assertTrue(syncs.get(1).path("synchronise").get(1).isNull());
  }

  @Test
  public void testEdgesAndExpressions() throws CompilerException {
    final JsonNode producer = producerConsumer().path("automata").get(0);
    assertEquals("P", producer.path("name").asText());
    assertEquals("idle", producer.path("initial-locations").get(0).asText());

    final JsonNode silent = edgeFrom(producer, "idle__0_0");
    assertFalse(silent.has("action"));
    final JsonNode guard = silent.path("guard").path("exp");
    assertEquals("¬", guard.path("op").asText());
    assertEquals("go.valid", guard.path("exp").asText());

    final JsonNode assignment =
        silent.path("destinations").get(0).path("assignments").get(0);
    assertEquals("go.speed", assignment.path("ref").asText());
    assertEquals("*", assignment.path("value").path("op").asText());
    assertEquals("P.count", assignment.path("value").path("left").asText());
    assertEquals(2, assignment.path("value").path("right").asInt());

    final JsonNode unguarded = edgeFrom(producer, "idle");
    assertEquals("start_on_receive", unguarded.path("action").asText());
    assertFalse(unguarded.has("guard"));
  }

  @Test
  public void testPropertyIsReachability() throws CompilerException {
    final JsonNode property = producerConsumer().path("properties").get(0);
    assertEquals("acked", property.path("name").asText());
    final JsonNode filter = property.path("expression");
    assertEquals("filter", filter.path("op").asText());
    assertEquals("max", filter.path("fun").asText());
    assertEquals("initial", filter.path("states").path("op").asText());
    final JsonNode probability = filter.path("values");
    assertEquals("Pmax", probability.path("op").asText());
    final JsonNode until = probability.path("exp");
    assertEquals("U", until.path("op").asText());
    assertTrue(until.path("left").asBoolean());
    assertEquals(">", until.path("right").path("op").asText());
    assertEquals("C.speed", until.path("right").path("left").asText());
  }

  @Test
  public void testRandomDrawsBecomeProbabilisticDestinations() throws CompilerException {
    final CompilerConfiguration config =
        CompilerConfigurationBuilder.newBuilder().randomOptions(2).build();
    final ObjectNode model = emit(config, NetworkDescriptionBuilder.newBuilder().name("dice")
        .automaton(StatechartDocument.fromString("dice.scxml", header + " name='D'>"
            + "<datamodel><data id='r' expr='0.0'/></datamodel>"
            + "<state id='a'><transition event='roll' target='a'>"
            + "  <assign location='r' expr='Math.random()'/></transition></state></scxml>"))
        .build());
    final JsonNode destinations =
        edgeFrom(model.path("automata").get(0), "a").path("destinations");
    assertEquals(2, destinations.size());
    for (int i = 0; i < 2; i++) {
      final JsonNode probability = destinations.get(i).path("probability").path("exp");
      assertEquals("/", probability.path("op").asText());
      assertEquals(1, probability.path("left").asInt());
      assertEquals(2, probability.path("right").asInt());
      assertEquals(i * 0.5, destinations.get(i).path("assignments").get(0).path("value")
          .asDouble(), 1e-9);
    }
  }

  @Test
  public void testArraysDeclareTheirLength() throws CompilerException {
    final CompilerConfiguration config =
        CompilerConfigurationBuilder.newBuilder().maxArraySize(4).build();
    final ObjectNode model = emit(config, NetworkDescriptionBuilder.newBuilder().name("arrays")
        .automaton(StatechartDocument.fromString("list.scxml", header + " name='L'>"
            + "<datamodel><data id='arr' expr='[1, 2]'/></datamodel>"
            + "<state id='a'><transition event='push' cond='arr.length &lt; 4' target='a'>"
            + "  <assign location='arr[arr.length]' expr='7'/></transition></state></scxml>"))
        .build());
    assertTrue(texts(model.path("features"), null).contains("arrays"));
    final JsonNode variables = model.path("variables");
    assertEquals(Arrays.asList("L.arr", "L.arr.length"), texts(variables, "name"));
    assertEquals("array", variables.get(0).path("type").path("kind").asText());
    assertEquals(4, variables.get(0).path("initial-value").path("elements").size());
    assertEquals("bounded", variables.get(1).path("type").path("kind").asText());
    assertEquals(2, variables.get(1).path("initial-value").asInt());

    final JsonNode assignment = edgeFrom(model.path("automata").get(0), "a")
        .path("destinations").get(0).path("assignments").get(0);
    assertEquals("aa", assignment.path("ref").path("op").asText());
    assertEquals("L.arr", assignment.path("ref").path("exp").asText());
  }

  @Test
  public void testRenderedDocumentIsJson() throws CompilerException {
    final String text = JaniModelEmitter.render(producerConsumer());
    assertTrue(text.startsWith("{"));
    assertTrue(text.contains("\"jani-version\" : 1"));
  }
}
