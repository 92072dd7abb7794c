package com.github.scxmljani;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.github.scxmljani.CompilerException.Code;

/**
 * Single-pass recursive descent parser for the ECMAScript expression subset used in statechart
 * conditions, assignments and data declarations. Parsing never evaluates anything.
 *
 * Malformed text fails with STRUCTURAL_VALIDITY, well-formed ECMAScript outside the subset fails
 * with UNSUPPORTED_CONSTRUCT. Both name the 1-based column.
 */
public final class ExpressionParser {
  private static final Set<String> unsupportedKeywords = new HashSet<>(Arrays.asList("function",
      "for", "while", "do", "new", "var", "let", "const", "return", "if", "else", "switch",
      "typeof", "instanceof", "delete", "this", "null", "undefined", "class", "void", "in", "of",
      "yield", "await", "async", "try", "catch", "throw"));

  // longest first so that prefixes do not shadow longer operators
  private static final String[] symbols = {"===", "!==", "==", "!=", "<=", ">=", "&&", "||", "++",
      "--", "+=", "-=", "*=", "/=", "=>", "<<", ">>", "<", ">", "+", "-", "*", "/", "%", "!", "?",
      ":", "(", ")", "[", "]", ",", ".", "=", "{", "}", ";", "&", "|", "^", "~"};

  private static final Set<String> unsupportedSymbols = new HashSet<>(
      Arrays.asList("++", "--", "+=", "-=", "*=", "/=", "=>", "<<", ">>", "=", "{", "}", ";", "&",
          "|", "^", "~"));

  private final String text;
  private final List<Token> tokens;
  private int position;

  private ExpressionParser(final String text) throws CompilerException {
    this.text = text;
    this.tokens = tokenize(text);
    this.position = 0;
  }

  /**
   * Parses one complete expression.
   */
  public static Expression parse(final String text) throws CompilerException {
    if (text == null || text.trim().isEmpty()) {
      throw new CompilerException(Code.STRUCTURAL_VALIDITY, "Empty expression");
    }
    final ExpressionParser parser = new ExpressionParser(text);
    final Expression expression = parser.parseConditional();
    final Token trailing = parser.peek();
    if (trailing.type != TokenType.END) {
      throw parser.syntaxError("unexpected '" + trailing.text + "'", trailing);
    }
    return expression;
  }

  private Expression parseConditional() throws CompilerException {
    final Expression condition = parseBinary(1);
    final Token next = peek();
    if (next.isSymbol("?")) {
      advance();
      final Expression whenTrue = parseConditional();
      expectSymbol(":");
      final Expression whenFalse = parseConditional();
      return new Expression.Conditional(condition, whenTrue, whenFalse, next.column);
    }
    return condition;
  }

  private Expression parseBinary(final int minPrecedence) throws CompilerException {
    Expression left = parseUnary();
    while (true) {
      final Token next = peek();
      if (next.type != TokenType.SYMBOL) {
        return left;
      }
      final Operator operator = Operator.binary(next.text);
      if (operator == null || operator.getPrecedence() < minPrecedence) {
        return left;
      }
      advance();
      final Expression right = parseBinary(operator.getPrecedence() + 1);
      left = new Expression.BinaryOp(operator, left, right, next.column);
    }
  }

  private Expression parseUnary() throws CompilerException {
    final Token next = peek();
    if (next.isSymbol("!")) {
      advance();
      return new Expression.UnaryOp(Operator.NOT, parseUnary(), next.column);
    }
    if (next.isSymbol("-")) {
      advance();
      final Expression operand = parseUnary();
      if (operand instanceof Expression.Literal) {
        final Object value = ((Expression.Literal) operand).getValue();
        if (value instanceof Long) {
          return new Expression.Literal(-((Long) value), next.column);
        }
        if (value instanceof Double) {
          return new Expression.Literal(-((Double) value), next.column);
        }
      }
      return new Expression.UnaryOp(Operator.NEGATE, operand, next.column);
    }
    if (next.isSymbol("+")) {
      advance();
      return parseUnary();
    }
    return parsePostfix();
  }

  private Expression parsePostfix() throws CompilerException {
    Expression expression = parsePrimary();
    while (true) {
      final Token next = peek();
      if (next.isSymbol("[")) {
        advance();
        final Expression position = parseConditional();
        expectSymbol("]");
        expression = new Expression.Index(expression, position, next.column);
      } else if (next.isSymbol(".")) {
        advance();
        final Token member = peek();
        if (member.type != TokenType.IDENTIFIER) {
          throw syntaxError("expected a member name after '.'", member);
        }
        advance();
        if (!(expression instanceof Expression.VariableRef)) {
          throw unsupported("member access on a computed value", member);
        }
        expression = new Expression.VariableRef(
            ((Expression.VariableRef) expression).getName() + "." + member.text,
            expression.getColumn());
      } else if (next.isSymbol("(")) {
        expression = parseCall(expression, next);
      } else {
        return constantOrSelf(expression);
      }
    }
  }

  private Expression parseCall(final Expression callee, final Token open)
      throws CompilerException {
    if (!(callee instanceof Expression.VariableRef)) {
      throw unsupported("call of a computed value", open);
    }
    final String name = ((Expression.VariableRef) callee).getName();
    final Operator.Function function = Operator.Function.bySourceName(name);
    if (function == null) {
      throw unsupported("function call '" + name + "'", open);
    }
    advance();
    final List<Expression> arguments = new ArrayList<>();
    if (!peek().isSymbol(")")) {
      do {
        final Token argument = peek();
        if (argument.type == TokenType.STRING) {
          if (function != Operator.Function.IN) {
            throw unsupported("string literal", argument);
          }
          advance();
          arguments.add(new Expression.Literal(argument.text, argument.column));
        } else {
          arguments.add(parseConditional());
        }
      } while (acceptSymbol(","));
    }
    expectSymbol(")");
    if (arguments.size() != function.getArity()) {
      throw syntaxError(name + " expects " + function.getArity() + " argument(s), got "
          + arguments.size(), open);
    }
    if (function == Operator.Function.IN && !(arguments.get(0) instanceof Expression.Literal
        && ((Expression.Literal) arguments.get(0)).isString())) {
      throw unsupported("In() with a computed state id", open);
    }
    return new Expression.Call(function, arguments, callee.getColumn());
  }

  private Expression parsePrimary() throws CompilerException {
    final Token token = peek();
    switch (token.type) {
      case NUMBER:
        advance();
        return new Expression.Literal(parseNumber(token), token.column);
      case IDENTIFIER:
        advance();
        if ("true".equals(token.text) || "false".equals(token.text)) {
          return new Expression.Literal(Boolean.valueOf(token.text), token.column);
        }
        if (unsupportedKeywords.contains(token.text)) {
          throw unsupported("'" + token.text + "'", token);
        }
        return new Expression.VariableRef(token.text, token.column);
      case STRING:
        throw unsupported("string literal", token);
      case SYMBOL:
        if (token.isSymbol("(")) {
          advance();
          final Expression inner = parseConditional();
          expectSymbol(")");
          return inner;
        }
        if (token.isSymbol("[")) {
          advance();
          final List<Expression> elements = new ArrayList<>();
          if (!peek().isSymbol("]")) {
            do {
              elements.add(parseConditional());
            } while (acceptSymbol(","));
          }
          expectSymbol("]");
          return new Expression.ArrayLiteral(elements, token.column);
        }
        if (token.isSymbol("{")) {
          throw unsupported("object literal", token);
        }
        if (unsupportedSymbols.contains(token.text)) {
          throw unsupported("operator '" + token.text + "'", token);
        }
        throw syntaxError("unexpected '" + token.text + "'", token);
      default:
        throw syntaxError("unexpected end of expression", token);
    }
  }

  private static Expression constantOrSelf(final Expression expression) {
    if (expression instanceof Expression.VariableRef) {
      final String name = ((Expression.VariableRef) expression).getName();
      if ("Math.PI".equals(name)) {
        return new Expression.Literal(Math.PI, expression.getColumn());
      }
      if ("Math.E".equals(name)) {
        return new Expression.Literal(Math.E, expression.getColumn());
      }
    }
    return expression;
  }

  private Object parseNumber(final Token token) throws CompilerException {
    try {
      if (token.text.contains(".") || token.text.contains("e") || token.text.contains("E")) {
        return Double.valueOf(token.text);
      }
      return Long.valueOf(token.text);
    } catch (NumberFormatException malformed) {
      throw syntaxError("malformed number '" + token.text + "'", token);
    }
  }

  private Token peek() {
    return tokens.get(position);
  }

  private void advance() {
    if (position < tokens.size() - 1) {
      position++;
    }
  }

  private boolean acceptSymbol(final String symbol) {
    if (peek().isSymbol(symbol)) {
      advance();
      return true;
    }
    return false;
  }

  private void expectSymbol(final String symbol) throws CompilerException {
    final Token token = peek();
    if (!token.isSymbol(symbol)) {
      if (token.type == TokenType.SYMBOL && unsupportedSymbols.contains(token.text)) {
        throw unsupported("operator '" + token.text + "'", token);
      }
      throw syntaxError("expected '" + symbol + "' but found "
          + (token.type == TokenType.END ? "end of expression" : "'" + token.text + "'"), token);
    }
    advance();
  }

  private CompilerException syntaxError(final String message, final Token token) {
    return new CompilerException(Code.STRUCTURAL_VALIDITY,
        "Syntax error in expression '" + text + "' at column " + token.column + ": " + message);
  }

  private CompilerException unsupported(final String construct, final Token token) {
    return new CompilerException(Code.UNSUPPORTED_CONSTRUCT, "Unsupported expression construct "
        + construct + " in '" + text + "' at column " + token.column);
  }

  private static List<Token> tokenize(final String text) throws CompilerException {
    final List<Token> tokens = new ArrayList<>();
    int i = 0;
    while (i < text.length()) {
      final char c = text.charAt(i);
      if (Character.isWhitespace(c)) {
        i++;
        continue;
      }
      final int column = i + 1;
      if (Character.isDigit(c) || (c == '.' && i + 1 < text.length()
          && Character.isDigit(text.charAt(i + 1)))) {
        int end = i;
        while (end < text.length() && (Character.isDigit(text.charAt(end))
            || text.charAt(end) == '.')) {
          end++;
        }
        if (end < text.length() && (text.charAt(end) == 'e' || text.charAt(end) == 'E')) {
          end++;
          if (end < text.length() && (text.charAt(end) == '+' || text.charAt(end) == '-')) {
            end++;
          }
          while (end < text.length() && Character.isDigit(text.charAt(end))) {
            end++;
          }
        }
        tokens.add(new Token(TokenType.NUMBER, text.substring(i, end), column));
        i = end;
      } else if (Character.isLetter(c) || c == '_' || c == '$') {
        int end = i;
        while (end < text.length() && (Character.isLetterOrDigit(text.charAt(end))
            || text.charAt(end) == '_' || text.charAt(end) == '$')) {
          end++;
        }
        tokens.add(new Token(TokenType.IDENTIFIER, text.substring(i, end), column));
        i = end;
      } else if (c == '\'' || c == '"') {
        final int end = text.indexOf(c, i + 1);
        if (end < 0) {
          throw new CompilerException(Code.STRUCTURAL_VALIDITY, "Syntax error in expression '"
              + text + "' at column " + column + ": unterminated string");
        }
        tokens.add(new Token(TokenType.STRING, text.substring(i + 1, end), column));
        i = end + 1;
      } else {
        String matched = null;
        for (String symbol : symbols) {
          if (text.startsWith(symbol, i)) {
            matched = symbol;
            break;
          }
        }
        if (matched == null) {
          throw new CompilerException(Code.STRUCTURAL_VALIDITY, "Syntax error in expression '"
              + text + "' at column " + column + ": unexpected character '" + c + "'");
        }
        tokens.add(new Token(TokenType.SYMBOL, matched, column));
        i += matched.length();
      }
    }
    tokens.add(new Token(TokenType.END, "", text.length() + 1));
    return tokens;
  }

  private static enum TokenType {
    NUMBER, IDENTIFIER, STRING, SYMBOL, END;
  }

  private static final class Token {
    private final TokenType type;
    private final String text;
    private final int column;

    private Token(final TokenType type, final String text, final int column) {
      this.type = type;
      this.text = text;
      this.column = column;
    }

    private boolean isSymbol(final String symbol) {
      return type == TokenType.SYMBOL && text.equals(symbol);
    }
  }
}
