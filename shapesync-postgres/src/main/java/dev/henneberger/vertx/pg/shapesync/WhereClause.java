/*
 * Copyright (C) 2026 Daniel Henneberger
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package dev.henneberger.vertx.pg.shapesync;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A shape's row filter: the boolean SQL expression of a {@code WHERE} clause, evaluated against
 * decoded rows.
 *
 * <p>Supported are comparisons ({@code = <> != < > <= >=}), {@code AND}, {@code OR}, {@code NOT},
 * {@code IS [NOT] NULL}, {@code IS [NOT] TRUE|FALSE}, {@code [NOT] IN (...)},
 * {@code [NOT] LIKE|ILIKE}, {@code [NOT] BETWEEN}, parentheses and {@code ::type} casts, which are
 * ignored. Values compare numerically when both sides are numbers and as text otherwise. SQL
 * three-valued logic applies; a row matches only when the expression is true.
 */
public final class WhereClause {

  private final String text;
  private final Expr root;
  private final Set<String> referencedColumns;

  private WhereClause(String text, Expr root, Set<String> referencedColumns) {
    this.text = text;
    this.root = root;
    this.referencedColumns = Collections.unmodifiableSet(referencedColumns);
  }

  /**
   * @throws IllegalArgumentException if {@code text} is empty or not a supported expression
   */
  public static WhereClause parse(String text) {
    Objects.requireNonNull(text, "text");
    Parser parser = new Parser(text);
    Expr root = parser.parseExpression();
    parser.expectEnd();
    return new WhereClause(text, root, parser.columns);
  }

  public String text() {
    return text;
  }

  /** Column names the expression reads. */
  public Set<String> referencedColumns() {
    return referencedColumns;
  }

  /** Whether {@code row} holds a value, possibly NULL, for every referenced column. */
  public boolean isDecidable(Map<String, ColumnValue> row) {
    for (String column : referencedColumns) {
      ColumnValue value = row.get(column);
      if (value == null || value.isUnchanged()) {
        return false;
      }
    }
    return true;
  }

  /**
   * Evaluates the clause. Columns missing from {@code row} or marked unchanged read as NULL.
   *
   * @throws IllegalArgumentException if the expression does not yield a boolean for this row
   */
  public boolean matches(Map<String, ColumnValue> row) {
    Object result = root.evaluate(row);
    return Boolean.TRUE.equals(truth(result));
  }

  @Override
  public String toString() {
    return text;
  }

  private interface Expr {
    Object evaluate(Map<String, ColumnValue> row);
  }

  private static Boolean truth(Object value) {
    if (value == null || value instanceof Boolean) {
      return (Boolean) value;
    }
    String text = value.toString().toLowerCase(Locale.ROOT);
    switch (text) {
      case "t":
      case "true":
        return Boolean.TRUE;
      case "f":
      case "false":
        return Boolean.FALSE;
      default:
        throw new IllegalArgumentException("not a boolean value: " + value);
    }
  }

  private static BigDecimal number(Object value) {
    if (value instanceof BigDecimal) {
      return (BigDecimal) value;
    }
    if (value instanceof String) {
      try {
        return new BigDecimal(((String) value).trim());
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return null;
  }

  private static int compare(Object left, Object right) {
    BigDecimal leftNumber = number(left);
    BigDecimal rightNumber = number(right);
    if (leftNumber != null && rightNumber != null) {
      return leftNumber.compareTo(rightNumber);
    }
    if (left instanceof Boolean || right instanceof Boolean) {
      return Boolean.compare(truth(left), truth(right));
    }
    return asText(left).compareTo(asText(right));
  }

  private static String asText(Object value) {
    if (value instanceof BigDecimal) {
      return ((BigDecimal) value).toPlainString();
    }
    return value.toString();
  }

  private static Pattern likePattern(String pattern, boolean caseInsensitive) {
    StringBuilder regex = new StringBuilder();
    for (int i = 0; i < pattern.length(); i++) {
      char c = pattern.charAt(i);
      if (c == '%') {
        regex.append(".*");
      } else if (c == '_') {
        regex.append('.');
      } else if (c == '\\' && i + 1 < pattern.length()) {
        regex.append(Pattern.quote(String.valueOf(pattern.charAt(++i))));
      } else {
        regex.append(Pattern.quote(String.valueOf(c)));
      }
    }
    return Pattern.compile(regex.toString(), caseInsensitive ? Pattern.CASE_INSENSITIVE | Pattern.DOTALL : Pattern.DOTALL);
  }

  private enum TokenType {
    IDENTIFIER,
    QUOTED_IDENTIFIER,
    STRING,
    NUMBER,
    OPERATOR,
    LEFT_PAREN,
    RIGHT_PAREN,
    COMMA,
    CAST,
    END
  }

  private static final class Token {
    private final TokenType type;
    private final String text;
    private final int position;

    private Token(TokenType type, String text, int position) {
      this.type = type;
      this.text = text;
      this.position = position;
    }

    private boolean isKeyword(String keyword) {
      return type == TokenType.IDENTIFIER && text.equalsIgnoreCase(keyword);
    }
  }

  private static final class Parser {
    private final String source;
    private final List<Token> tokens;
    private final Set<String> columns = new LinkedHashSet<>();
    private int index;

    private Parser(String source) {
      this.source = source;
      this.tokens = tokenize(source);
    }

    private Expr parseExpression() {
      if (peek().type == TokenType.END) {
        throw error("empty expression", peek());
      }
      return parseOr();
    }

    private void expectEnd() {
      if (peek().type != TokenType.END) {
        throw error("unexpected '" + peek().text + "'", peek());
      }
    }

    private Expr parseOr() {
      Expr left = parseAnd();
      while (peek().isKeyword("OR")) {
        next();
        Expr l = left;
        Expr r = parseAnd();
        left = row -> {
          Boolean a = truth(l.evaluate(row));
          if (Boolean.TRUE.equals(a)) {
            return true;
          }
          Boolean b = truth(r.evaluate(row));
          if (Boolean.TRUE.equals(b)) {
            return true;
          }
          return a == null || b == null ? null : Boolean.FALSE;
        };
      }
      return left;
    }

    private Expr parseAnd() {
      Expr left = parseNot();
      while (peek().isKeyword("AND")) {
        next();
        Expr l = left;
        Expr r = parseNot();
        left = row -> {
          Boolean a = truth(l.evaluate(row));
          if (Boolean.FALSE.equals(a)) {
            return false;
          }
          Boolean b = truth(r.evaluate(row));
          if (Boolean.FALSE.equals(b)) {
            return false;
          }
          return a == null || b == null ? null : Boolean.TRUE;
        };
      }
      return left;
    }

    private Expr parseNot() {
      if (peek().isKeyword("NOT")) {
        next();
        Expr operand = parseNot();
        return row -> {
          Boolean value = truth(operand.evaluate(row));
          return value == null ? null : !value;
        };
      }
      return parsePredicate();
    }

    private Expr parsePredicate() {
      Expr left = parseOperand();
      Token token = peek();
      if (token.type == TokenType.OPERATOR) {
        next();
        String operator = token.text;
        Expr right = parseOperand();
        return row -> {
          Object a = left.evaluate(row);
          Object b = right.evaluate(row);
          if (a == null || b == null) {
            return null;
          }
          int cmp = compare(a, b);
          switch (operator) {
            case "=":
              return cmp == 0;
            case "<>":
            case "!=":
              return cmp != 0;
            case "<":
              return cmp < 0;
            case ">":
              return cmp > 0;
            case "<=":
              return cmp <= 0;
            default:
              return cmp >= 0;
          }
        };
      }
      if (token.isKeyword("IS")) {
        next();
        boolean negated = acceptKeyword("NOT");
        Token what = next();
        if (what.isKeyword("NULL")) {
          return row -> (left.evaluate(row) == null) != negated;
        }
        if (what.isKeyword("TRUE") || what.isKeyword("FALSE")) {
          boolean expected = what.isKeyword("TRUE");
          return row -> {
            Boolean value = truth(left.evaluate(row));
            boolean is = value != null && value == expected;
            return is != negated;
          };
        }
        throw error("expected NULL, TRUE or FALSE after IS", what);
      }

      boolean negated = false;
      if (token.isKeyword("NOT")) {
        next();
        negated = true;
        token = peek();
      }
      if (token.isKeyword("IN")) {
        next();
        return in(left, parseList(), negated);
      }
      if (token.isKeyword("LIKE") || token.isKeyword("ILIKE")) {
        next();
        return like(left, parseOperand(), token.isKeyword("ILIKE"), negated);
      }
      if (token.isKeyword("BETWEEN")) {
        next();
        Expr low = parseOperand();
        if (!acceptKeyword("AND")) {
          throw error("expected AND in BETWEEN", peek());
        }
        Expr high = parseOperand();
        return between(left, low, high, negated);
      }
      if (negated) {
        throw error("expected IN, LIKE, ILIKE or BETWEEN after NOT", token);
      }
      return left;
    }

    private Expr in(Expr left, List<Expr> items, boolean negated) {
      return row -> {
        Object value = left.evaluate(row);
        if (value == null) {
          return null;
        }
        boolean sawNull = false;
        for (Expr item : items) {
          Object candidate = item.evaluate(row);
          if (candidate == null) {
            sawNull = true;
          } else if (compare(value, candidate) == 0) {
            return !negated;
          }
        }
        return sawNull ? null : negated;
      };
    }

    private Expr like(Expr left, Expr pattern, boolean caseInsensitive, boolean negated) {
      return row -> {
        Object value = left.evaluate(row);
        Object p = pattern.evaluate(row);
        if (value == null || p == null) {
          return null;
        }
        boolean matched = likePattern(asText(p), caseInsensitive).matcher(asText(value)).matches();
        return matched != negated;
      };
    }

    private Expr between(Expr left, Expr low, Expr high, boolean negated) {
      return row -> {
        Object value = left.evaluate(row);
        Object from = low.evaluate(row);
        Object to = high.evaluate(row);
        if (value == null || from == null || to == null) {
          return null;
        }
        boolean inside = compare(value, from) >= 0 && compare(value, to) <= 0;
        return inside != negated;
      };
    }

    private List<Expr> parseList() {
      expect(TokenType.LEFT_PAREN);
      List<Expr> items = new ArrayList<>();
      items.add(parseOperand());
      while (peek().type == TokenType.COMMA) {
        next();
        items.add(parseOperand());
      }
      expect(TokenType.RIGHT_PAREN);
      return items;
    }

    private Expr parseOperand() {
      Expr operand = parsePrimary();
      while (peek().type == TokenType.CAST) {
        next();
        Token type = next();
        if (type.type != TokenType.IDENTIFIER && type.type != TokenType.QUOTED_IDENTIFIER) {
          throw error("expected a type name after ::", type);
        }
      }
      return operand;
    }

    private Expr parsePrimary() {
      Token token = next();
      switch (token.type) {
        case LEFT_PAREN: {
          Expr inner = parseOr();
          expect(TokenType.RIGHT_PAREN);
          return inner;
        }
        case STRING: {
          String value = token.text;
          return row -> value;
        }
        case NUMBER: {
          BigDecimal value = new BigDecimal(token.text);
          return row -> value;
        }
        case QUOTED_IDENTIFIER:
          return column(token.text);
        case IDENTIFIER:
          if (token.isKeyword("NULL")) {
            return row -> null;
          }
          if (token.isKeyword("TRUE")) {
            return row -> Boolean.TRUE;
          }
          if (token.isKeyword("FALSE")) {
            return row -> Boolean.FALSE;
          }
          if (isReserved(token)) {
            throw error("unexpected keyword " + token.text, token);
          }
          return column(token.text.toLowerCase(Locale.ROOT));
        default:
          throw error(token.type == TokenType.END ? "unexpected end of expression" : "unexpected '" + token.text + "'",
            token);
      }
    }

    private Expr column(String name) {
      columns.add(name);
      return row -> {
        ColumnValue value = row.get(name);
        return value == null || !value.isText() ? null : value.text();
      };
    }

    private static boolean isReserved(Token token) {
      for (String keyword : new String[] {"AND", "OR", "NOT", "IS", "IN", "LIKE", "ILIKE", "BETWEEN"}) {
        if (token.isKeyword(keyword)) {
          return true;
        }
      }
      return false;
    }

    private boolean acceptKeyword(String keyword) {
      if (peek().isKeyword(keyword)) {
        next();
        return true;
      }
      return false;
    }

    private void expect(TokenType type) {
      Token token = next();
      if (token.type != type) {
        throw error("expected " + type.name().toLowerCase(Locale.ROOT).replace('_', ' '), token);
      }
    }

    private Token peek() {
      return tokens.get(index);
    }

    private Token next() {
      Token token = tokens.get(index);
      if (token.type != TokenType.END) {
        index++;
      }
      return token;
    }

    private IllegalArgumentException error(String message, Token at) {
      return new IllegalArgumentException("Invalid where clause '" + source + "' at position " + at.position
        + ": " + message);
    }

    private static List<Token> tokenize(String source) {
      List<Token> tokens = new ArrayList<>();
      int i = 0;
      while (i < source.length()) {
        char c = source.charAt(i);
        int start = i;
        if (Character.isWhitespace(c)) {
          i++;
        } else if (c == '\'') {
          StringBuilder value = new StringBuilder();
          i++;
          while (true) {
            if (i >= source.length()) {
              throw new IllegalArgumentException("Invalid where clause '" + source + "': unterminated string at position "
                + start);
            }
            char ch = source.charAt(i++);
            if (ch == '\'') {
              if (i < source.length() && source.charAt(i) == '\'') {
                value.append('\'');
                i++;
              } else {
                break;
              }
            } else {
              value.append(ch);
            }
          }
          tokens.add(new Token(TokenType.STRING, value.toString(), start));
        } else if (c == '"') {
          int end = source.indexOf('"', i + 1);
          if (end < 0) {
            throw new IllegalArgumentException("Invalid where clause '" + source
              + "': unterminated identifier at position " + start);
          }
          tokens.add(new Token(TokenType.QUOTED_IDENTIFIER, source.substring(i + 1, end), start));
          i = end + 1;
        } else if (Character.isDigit(c) || (c == '.' && i + 1 < source.length() && Character.isDigit(source.charAt(i + 1)))
          || (c == '-' && i + 1 < source.length() && Character.isDigit(source.charAt(i + 1)) && startsOperand(tokens))) {
          i++;
          while (i < source.length() && (Character.isDigit(source.charAt(i)) || source.charAt(i) == '.')) {
            i++;
          }
          tokens.add(new Token(TokenType.NUMBER, source.substring(start, i), start));
        } else if (Character.isLetter(c) || c == '_') {
          while (i < source.length() && (Character.isLetterOrDigit(source.charAt(i)) || source.charAt(i) == '_')) {
            i++;
          }
          tokens.add(new Token(TokenType.IDENTIFIER, source.substring(start, i), start));
        } else if (c == '(') {
          tokens.add(new Token(TokenType.LEFT_PAREN, "(", i++));
        } else if (c == ')') {
          tokens.add(new Token(TokenType.RIGHT_PAREN, ")", i++));
        } else if (c == ',') {
          tokens.add(new Token(TokenType.COMMA, ",", i++));
        } else if (source.startsWith("::", i)) {
          tokens.add(new Token(TokenType.CAST, "::", i));
          i += 2;
        } else if (source.startsWith("<>", i) || source.startsWith("!=", i) || source.startsWith("<=", i)
          || source.startsWith(">=", i)) {
          tokens.add(new Token(TokenType.OPERATOR, source.substring(i, i + 2), i));
          i += 2;
        } else if (c == '=' || c == '<' || c == '>') {
          tokens.add(new Token(TokenType.OPERATOR, String.valueOf(c), i++));
        } else {
          throw new IllegalArgumentException("Invalid where clause '" + source + "': unexpected character '" + c
            + "' at position " + i);
        }
      }
      tokens.add(new Token(TokenType.END, "", source.length()));
      return tokens;
    }

    private static boolean startsOperand(List<Token> tokens) {
      if (tokens.isEmpty()) {
        return true;
      }
      TokenType previous = tokens.get(tokens.size() - 1).type;
      return previous == TokenType.OPERATOR || previous == TokenType.LEFT_PAREN || previous == TokenType.COMMA
        || tokens.get(tokens.size() - 1).type == TokenType.IDENTIFIER && isReserved(tokens.get(tokens.size() - 1));
    }
  }
}
