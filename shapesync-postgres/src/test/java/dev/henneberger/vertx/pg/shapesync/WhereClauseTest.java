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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class WhereClauseTest {

  @Test
  void comparesNumbersNumericallyAndTextLexically() {
    Map<String, ColumnValue> row = row("id", "10", "name", "bob");

    assertTrue(WhereClause.parse("id > 9").matches(row));
    assertTrue(WhereClause.parse("id > '9'::int").matches(row));
    assertFalse(WhereClause.parse("name > 'c'").matches(row));
    assertTrue(WhereClause.parse("id = 10.0").matches(row));
    assertTrue(WhereClause.parse("name >= 'b' AND name < 'c'").matches(row));
    assertTrue(WhereClause.parse("name <> 'alice'").matches(row));
    assertTrue(WhereClause.parse("id != -1").matches(row));
  }

  @Test
  void followsThreeValuedLogic() {
    Map<String, ColumnValue> row = row("id", "1");
    row.put("name", ColumnValue.NULL);

    assertFalse(WhereClause.parse("name = 'x'").matches(row));
    assertFalse(WhereClause.parse("NOT (name = 'x')").matches(row));
    assertTrue(WhereClause.parse("name = 'x' OR id = 1").matches(row));
    assertFalse(WhereClause.parse("name = 'x' AND id = 1").matches(row));
    assertTrue(WhereClause.parse("name IS NULL").matches(row));
    assertFalse(WhereClause.parse("id IS NULL").matches(row));
    assertTrue(WhereClause.parse("id IS NOT NULL").matches(row));
    assertFalse(WhereClause.parse("id IN (2, NULL)").matches(row));
  }

  @Test
  void supportsInLikeAndBetween() {
    Map<String, ColumnValue> row = row("id", "5", "email", "Bob@Example.com");

    assertTrue(WhereClause.parse("id IN (1, 5, 9)").matches(row));
    assertTrue(WhereClause.parse("id NOT IN (1, 2)").matches(row));
    assertTrue(WhereClause.parse("email LIKE '%@Example.com'").matches(row));
    assertFalse(WhereClause.parse("email LIKE 'bob%'").matches(row));
    assertTrue(WhereClause.parse("email ILIKE 'bob%'").matches(row));
    assertTrue(WhereClause.parse("email NOT LIKE '_x%'").matches(row));
    assertTrue(WhereClause.parse("id BETWEEN 1 AND 5").matches(row));
    assertTrue(WhereClause.parse("id NOT BETWEEN 6 AND 9 AND id > 0").matches(row));
  }

  @Test
  void readsBooleanColumnsAndQuotedIdentifiers() {
    Map<String, ColumnValue> row = row("active", "t", "Display Name", "O'Brien");

    assertTrue(WhereClause.parse("active").matches(row));
    assertTrue(WhereClause.parse("active IS TRUE").matches(row));
    assertFalse(WhereClause.parse("NOT active").matches(row));
    assertTrue(WhereClause.parse("active = true").matches(row));
    assertTrue(WhereClause.parse("\"Display Name\" = 'O''Brien'").matches(row));
    assertEquals(Set.of("Display Name"), WhereClause.parse("\"Display Name\" = 'x'").referencedColumns());
  }

  @Test
  void missingAndUnchangedColumnsReadAsNull() {
    Map<String, ColumnValue> row = row("id", "1");
    row.put("bio", ColumnValue.UNCHANGED);
    WhereClause clause = WhereClause.parse("bio IS NULL AND status IS NULL");

    assertTrue(clause.matches(row));
    assertFalse(clause.isDecidable(row));
    assertTrue(WhereClause.parse("id = 1").isDecidable(row));
  }

  @Test
  void unquotedIdentifiersAreCaseInsensitive() {
    WhereClause clause = WhereClause.parse("ID = 1 and Name = 'a'");

    assertEquals(Set.of("id", "name"), clause.referencedColumns());
    assertTrue(clause.matches(row("id", "1", "name", "a")));
  }

  @Test
  void rejectsMalformedExpressions() {
    assertThrows(IllegalArgumentException.class, () -> WhereClause.parse(""));
    assertThrows(IllegalArgumentException.class, () -> WhereClause.parse("id = "));
    assertThrows(IllegalArgumentException.class, () -> WhereClause.parse("id = 'open"));
    assertThrows(IllegalArgumentException.class, () -> WhereClause.parse("(id = 1"));
    assertThrows(IllegalArgumentException.class, () -> WhereClause.parse("id = 1 extra"));
    assertThrows(IllegalArgumentException.class, () -> WhereClause.parse("id ; drop"));
    assertThrows(IllegalArgumentException.class, () -> WhereClause.parse("id IS 5"));
  }

  @Test
  void nonBooleanResultIsAnError() {
    WhereClause clause = WhereClause.parse("name");

    assertThrows(IllegalArgumentException.class, () -> clause.matches(row("name", "bob")));
  }

  private static Map<String, ColumnValue> row(String... pairs) {
    Map<String, ColumnValue> row = new HashMap<>();
    for (int i = 0; i < pairs.length; i += 2) {
      row.put(pairs[i], ColumnValue.text(pairs[i + 1]));
    }
    return row;
  }
}
