package com.github.scxmljani;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.scxmljani.CompilerException.Code;

/**
 * Tests for the structural check of JANI documents.
 */
public class JaniSchemaValidatorTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  private static final ObjectMapper objectMapper = new ObjectMapper();

  private static final String valid = "{'jani-version': 1, 'name': 'm', 'type': 'mdp',"
      + " 'variables': [{'name': 'x', 'type': {'kind': 'bounded', 'base': 'int',"
      + "   'lower-bound': 0, 'upper-bound': 3}, 'initial-value': 0}],"
      + " 'actions': [{'name': 'a'}],"
      + " 'automata': [{'name': 'A', 'locations': [{'name': 'l0'}, {'name': 'l1'}],"
      + "   'initial-locations': ['l0'],"
      + "   'edges': [{'location': 'l0', 'action': 'a',"
      + "     'guard': {'exp': {'op': '<', 'left': 'x', 'right': 3}},"
      + "     'destinations': [{'location': 'l1',"
      + "       'assignments': [{'ref': 'x', 'value': {'op': '+', 'left': 'x', 'right': 1}}]}]}]}],"
      + " 'system': {'elements': [{'automaton': 'A'}],"
      + "   'syncs': [{'synchronise': ['a'], 'result': 'a'}]},"
      + " 'properties': [{'name': 'p', 'expression': {'op': 'filter', 'fun': 'max',"
      + "   'values': {'op': 'Pmax', 'exp': {'op': 'U', 'left': true,"
      + "     'right': {'op': '=', 'left': 'x', 'right': 3}}},"
      + "   'states': {'op': 'initial'}}}]}";

  private static JsonNode json(final String text) throws Exception {
    return objectMapper.readTree(text.replace('\'', '"'));
  }

  private static void assertInvalid(final String model, final String reason) throws Exception {
    try {
      JaniSchemaValidator.validate(json(model));
      fail("Expected model to be rejected: " + reason);
    } catch (CompilerException expected) {
      assertEquals(Code.INTERNAL_CONSISTENCY, expected.getCode());
      assertTrue(expected.getMessage(), expected.getMessage().contains(reason));
    }
  }

  @Test
  public void testValidModel() throws Exception {
    JaniSchemaValidator.validate(json(valid));
  }

  @Test
  public void testBrokenModels() throws Exception {
    assertInvalid(valid.replace("'type': 'mdp'", "'type': 'game'"), "unknown model type");
    assertInvalid(valid.replace("'initial-locations': ['l0']", "'initial-locations': ['l9']"),
        "undeclared initial location 'l9'");
    assertInvalid(valid.replace("{'location': 'l1',", "{'location': 'l2',"),
        "undeclared target location 'l2'");
    assertInvalid(valid.replace("'assignments': [{'ref': 'x'", "'assignments': [{'ref': 'y'"),
        "assignment to undeclared variable 'y'");
    assertInvalid(valid.replace("'op': '<'", "'op': 'lt'"), "unknown operator 'lt'");
    assertInvalid(valid.replace("'right': 3}}", "'right': 'z'}}"),
        "reference to undeclared identifier 'z'");
    assertInvalid(valid.replace("'synchronise': ['a']", "'synchronise': ['a', null]"),
        "has 2 entries for 1 elements");
    assertInvalid(valid.replace("'synchronise': ['a']", "'synchronise': [null]"),
        "no participant");
    assertInvalid(valid.replace("'result': 'a'", "'result': 'b'"), "undeclared result action");
    assertInvalid(valid.replace("'actions': [{'name': 'a'}]",
        "'actions': [{'name': 'a'}, {'name': 'a'}]"), "declared twice");
    assertInvalid(valid.replace("'kind': 'bounded', 'base': 'int',", "'kind': 'bounded',"
        + " 'base': 'bool',"), "bounded type with base 'bool'");
  }
}
