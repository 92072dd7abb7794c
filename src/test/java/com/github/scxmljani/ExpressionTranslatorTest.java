package com.github.scxmljani;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.scxmljani.CompilerException.Code;

/**
 * Tests for renaming and lowering of expressions into the JANI expression algebra.
 */
public class ExpressionTranslatorTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  private static Scope scope() {
    final Map<String, ExpressionType> locals = new LinkedHashMap<>();
    locals.put("x", ExpressionType.INT);
    locals.put("flag", ExpressionType.BOOL);
    locals.put("arr", ExpressionType.arrayOf(ExpressionType.INT, 3));
    locals.put("other", ExpressionType.arrayOf(ExpressionType.INT, 2));
    final Map<String, ExpressionType> globals = new LinkedHashMap<>();
    globals.put("shared", ExpressionType.REAL);
    return new Scope("A", locals, globals);
  }

  private static JsonNode lower(final String text, final Scope scope) throws CompilerException {
    return ExpressionTranslator.toJani(
        ExpressionTranslator.qualify(ExpressionParser.parse(text), scope, 10));
  }

  @Test
  public void testOperatorMapping() throws CompilerException {
    final Scope scope = scope();
    final JsonNode condition = ExpressionTranslator.toJani(ExpressionTranslator.qualify(
        ExpressionTranslator.translateCondition("x > 1 && flag", scope), scope, 10));
    assertEquals("∧", condition.get("op").asText());
    assertEquals(">", condition.get("left").get("op").asText());
    assertEquals("A.x", condition.get("left").get("left").asText());
    assertEquals(1, condition.get("left").get("right").asInt());
    assertEquals("A.flag", condition.get("right").asText());

    assertEquals("¬", lower("!flag", scope).get("op").asText());
    assertEquals("≠", lower("x != shared", scope).get("op").asText());
    assertEquals("shared", lower("x != shared", scope).get("right").asText());
    assertEquals("≤", lower("x <= 2", scope).get("op").asText());
    assertEquals("∨", lower("flag || x == 0", scope).get("op").asText());
  }

  @Test
  public void testNegationConditionalAndCalls() throws CompilerException {
    final Scope scope = scope();
    final JsonNode negation = lower("-x", scope);
    assertEquals("-", negation.get("op").asText());
    assertEquals(0, negation.get("left").asInt());
    assertEquals("A.x", negation.get("right").asText());

    final JsonNode ite = lower("flag ? x : 2", scope);
    assertEquals("ite", ite.get("op").asText());
    assertEquals("A.flag", ite.get("if").asText());

    final JsonNode sqrt = lower("Math.sqrt(shared)", scope);
    assertEquals("pow", sqrt.get("op").asText());
    assertEquals(0.5d, sqrt.get("right").asDouble(), 0.0d);

    final JsonNode max = lower("Math.max(x, 3)", scope);
    assertEquals("max", max.get("op").asText());
    assertEquals("A.x", max.get("left").asText());

    final JsonNode abs = lower("Math.abs(x)", scope);
    assertEquals("abs", abs.get("op").asText());
    assertEquals("A.x", abs.get("exp").asText());
  }

  @Test
  public void testArrayAccessAndComparison() throws CompilerException {
    final Scope scope = scope();
    final JsonNode element = lower("arr[1]", scope);
    assertEquals("aa", element.get("op").asText());
    assertEquals("A.arr", element.get("exp").asText());
    assertEquals(1, element.get("index").asInt());

    // arr.length == 2 && arr[0] == 4 && arr[1] == 5
    final JsonNode literal = lower("arr == [4, 5]", scope);
    assertEquals("∧", literal.get("op").asText());
    final JsonNode lengthCheck = literal.get("left").get("left");
    assertEquals("=", lengthCheck.get("op").asText());
    assertEquals("A.arr.length", lengthCheck.get("left").asText());
    assertEquals(2, lengthCheck.get("right").asInt());
    final JsonNode lastElement = literal.get("right");
    assertEquals("aa", lastElement.get("left").get("op").asText());
    assertEquals(5, lastElement.get("right").asInt());

    final JsonNode different = lower("arr != other", scope);
    assertEquals("¬", different.get("op").asText());

    final Expression expanded = ExpressionTranslator.expandArrayComparisons(
        ExpressionParser.parse("arr == other"), scope, 10);
    // one element check per position of the smaller capacity
    assertTrue(expanded.toString().contains("(1 >= arr.length)"));
    assertFalse(expanded.toString().contains("(2 >= arr.length)"));
  }

  @Test
  public void testEventDataIsRenamed() throws CompilerException {
    final Scope scope = scope().withEvent("go",
        Collections.singletonMap("speed", ExpressionType.REAL));
    assertEquals("go.speed", lower("_event.data.speed", scope).asText());
  }

  @Test
  public void testUnloweredCallsAreRejected() {
    try {
      ExpressionTranslator.toJani(ExpressionParser.parse("In('idle')"));
      fail("Expected In() to require folding before lowering");
    } catch (CompilerException expected) {
      assertEquals(Code.INTERNAL_CONSISTENCY, expected.getCode());
    }
    try {
      ExpressionTranslator.toJani(ExpressionParser.parse("Math.random()"));
      fail("Expected Math.random() to require expansion before lowering");
    } catch (CompilerException expected) {
      assertEquals(Code.INTERNAL_CONSISTENCY, expected.getCode());
    }
  }
}
