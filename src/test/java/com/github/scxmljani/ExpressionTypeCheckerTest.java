package com.github.scxmljani;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.Test;

import com.github.scxmljani.CompilerException.Code;

/**
 * Tests for typing of expressions against automaton scopes.
 */
public class ExpressionTypeCheckerTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  private static Scope scope() {
    final Map<String, ExpressionType> locals = new LinkedHashMap<>();
    locals.put("x", ExpressionType.INT);
    locals.put("flag", ExpressionType.BOOL);
    locals.put("speed", ExpressionType.REAL);
    locals.put("arr", ExpressionType.arrayOf(ExpressionType.INT, 3));
    final Map<String, ExpressionType> globals = new LinkedHashMap<>();
    globals.put("x", ExpressionType.REAL);
    globals.put("counter", ExpressionType.boundedInt(0L, 10L));
    return new Scope("A", locals, globals);
  }

  private static ExpressionType typeOf(final String text, final Scope scope)
      throws CompilerException {
    return ExpressionTypeChecker.check(ExpressionParser.parse(text), scope);
  }

  @Test
  public void testArithmeticAndLogic() throws CompilerException {
    final Scope scope = scope();
    assertEquals(ExpressionType.INT, typeOf("x + 1", scope));
    assertEquals(ExpressionType.REAL, typeOf("x / 2", scope));
    assertEquals(ExpressionType.INT, typeOf("x % -(2 - 1)", scope));
    assertEquals(ExpressionType.REAL, typeOf("speed * x", scope));
    assertEquals(ExpressionType.INT, typeOf("counter - 1", scope));
    assertEquals(ExpressionType.BOOL, typeOf("x > 1 && !flag", scope));
    assertEquals(ExpressionType.BOOL, typeOf("flag == false", scope));
    assertEquals(ExpressionType.INT, typeOf("Math.floor(speed)", scope));
    assertEquals(ExpressionType.REAL, typeOf("Math.sqrt(x)", scope));
    assertEquals(ExpressionType.REAL, typeOf("flag ? x : speed", scope));
  }

  @Test
  public void testLocalsShadowGlobals() throws CompilerException {
    final Scope scope = scope();
    assertEquals(ExpressionType.INT, typeOf("x", scope));
    assertEquals("A.x", scope.resolve("x").getQualifiedName());
    assertEquals("counter", scope.resolve("counter").getQualifiedName());
  }

  @Test
  public void testArrays() throws CompilerException {
    final Scope scope = scope();
    assertEquals(ExpressionType.INT, typeOf("arr[1]", scope));
    assertEquals(ExpressionType.Kind.INT, typeOf("arr.length", scope).getKind());
    assertEquals("A.arr.length", scope.resolve("arr.length").getQualifiedName());
    assertEquals(ExpressionType.BOOL, typeOf("arr == [1, 2]", scope));
    assertFailure("arr[flag]", scope, Code.UNSUPPORTED_CONSTRUCT);
    assertFailure("x[0]", scope, Code.UNSUPPORTED_CONSTRUCT);
  }

  @Test
  public void testEventData() throws CompilerException {
    final Scope scope = scope().withEvent("go",
        Collections.singletonMap("speed", ExpressionType.REAL));
    assertEquals(ExpressionType.REAL, typeOf("_event.data.speed * 2", scope));
    assertEquals("go.speed", scope.resolve("_event.data.speed").getQualifiedName());
    assertFailure("_event.data.other", scope, Code.UNRESOLVED_REFERENCE);
    assertFailure("_event.data.speed", scope(), Code.UNRESOLVED_REFERENCE);
  }

  @Test
  public void testMismatches() {
    final Scope scope = scope();
    assertFailure("flag + 1", scope, Code.UNSUPPORTED_CONSTRUCT);
    assertFailure("x && flag", scope, Code.UNSUPPORTED_CONSTRUCT);
    assertFailure("x == flag", scope, Code.UNSUPPORTED_CONSTRUCT);
    assertFailure("x / 0", scope, Code.UNSUPPORTED_CONSTRUCT);
    assertFailure("x / -0", scope, Code.UNSUPPORTED_CONSTRUCT);
    assertFailure("x % -(1 - 1)", scope, Code.UNSUPPORTED_CONSTRUCT);
    assertFailure("speed / -0.0", scope, Code.UNSUPPORTED_CONSTRUCT);
    assertFailure("flag ? 1 : true", scope, Code.UNSUPPORTED_CONSTRUCT);
    assertFailure("missing > 1", scope, Code.UNRESOLVED_REFERENCE);
  }

  @Test
  public void testConditionsAndAssignments() throws CompilerException {
    final Scope scope = scope();
    ExpressionTypeChecker.checkCondition(ExpressionParser.parse("x >= 0"), scope);
    try {
      ExpressionTypeChecker.checkCondition(ExpressionParser.parse("x + 1"), scope);
      fail("Expected a non-boolean condition to be rejected");
    } catch (CompilerException expected) {
      assertEquals(Code.UNSUPPORTED_CONSTRUCT, expected.getCode());
    }

    assertFailure("Math.random() > 0.5", scope, Code.UNSUPPORTED_CONSTRUCT);
    assertEquals(ExpressionType.REAL,
        ExpressionTypeChecker.checkAssigned(ExpressionParser.parse("Math.random()"), scope));

    ExpressionTypeChecker.checkAssignable(ExpressionType.REAL, ExpressionParser.parse("x"), scope);
    try {
      ExpressionTypeChecker.checkAssignable(ExpressionType.INT, ExpressionParser.parse("1.5"),
          scope);
      fail("Expected a real value not to narrow into an int");
    } catch (CompilerException expected) {
      assertEquals(Code.UNSUPPORTED_CONSTRUCT, expected.getCode());
    }
  }

  private static void assertFailure(final String text, final Scope scope, final Code code) {
    try {
      typeOf(text, scope);
      fail("Expected " + code + " for '" + text + "'");
    } catch (CompilerException expected) {
      assertEquals(text, code, expected.getCode());
    }
  }
}
