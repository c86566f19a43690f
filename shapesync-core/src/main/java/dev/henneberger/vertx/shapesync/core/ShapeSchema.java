package dev.henneberger.vertx.shapesync.core;

import java.util.List;
import java.util.Objects;

/**
 * Table layout stored alongside a shape snapshot.
 */
public final class ShapeSchema {

  public static final class Column {
    private final String name;
    private final String type;
    private final int primaryKeyIndex;

    /**
     * @param primaryKeyIndex position within the primary key, or {@code -1}
     */
    public Column(String name, String type, int primaryKeyIndex) {
      this.name = Objects.requireNonNull(name, "name");
      this.type = type;
      this.primaryKeyIndex = primaryKeyIndex;
    }

    public String name() {
      return name;
    }

    public String type() {
      return type;
    }

    public int primaryKeyIndex() {
      return primaryKeyIndex;
    }
  }

  private final String schema;
  private final String table;
  private final List<Column> columns;

  public ShapeSchema(String schema, String table, List<Column> columns) {
    this.schema = Objects.requireNonNull(schema, "schema");
    this.table = Objects.requireNonNull(table, "table");
    this.columns = List.copyOf(columns);
  }

  public String schema() {
    return schema;
  }

  public String table() {
    return table;
  }

  public List<Column> columns() {
    return columns;
  }
}
