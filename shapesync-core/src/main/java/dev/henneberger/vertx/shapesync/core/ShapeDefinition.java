package dev.henneberger.vertx.shapesync.core;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.Collection;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.TreeSet;

/**
 * The table, filter and column selection a client subscribes to.
 *
 * <p>Two definitions with the same schema, table, where clause, columns (in any order) and
 * replica mode are equal and share a {@link #hash()}.
 */
public final class ShapeDefinition {

  public static final String DEFAULT_SCHEMA = "public";

  public enum ReplicaMode {
    /** Updates carry changed columns and the key. */
    DEFAULT,
    /** Updates carry full rows, including the previous values. */
    FULL;

    String wireName() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  private final String schema;
  private final String table;
  private final String where;
  private final List<String> columns;
  private final ReplicaMode replica;

  private ShapeDefinition(Builder builder) {
    this.schema = builder.schema == null || builder.schema.isBlank() ? DEFAULT_SCHEMA : builder.schema;
    this.table = builder.table;
    this.where = builder.where == null ? "" : builder.where.trim();
    this.columns = List.copyOf(builder.columns);
    this.replica = builder.replica == null ? ReplicaMode.DEFAULT : builder.replica;
  }

  public static Builder builder(String table) {
    return new Builder(table);
  }

  public static ShapeDefinition of(String schema, String table) {
    return builder(table).schema(schema).build();
  }

  public String schema() {
    return schema;
  }

  public String table() {
    return table;
  }

  /** Opaque filter text, empty when the shape covers the whole table. */
  public String where() {
    return where;
  }

  /** Selected columns in sorted order, empty for all columns. */
  public List<String> columns() {
    return columns;
  }

  public ReplicaMode replica() {
    return replica;
  }

  /**
   * First 16 hex characters of the SHA-256 over the definition's canonical form.
   */
  public String hash() {
    String canonical = String.join("\u0000",
      schema,
      table,
      String.join(",", columns),
      where,
      replica.wireName());
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] bytes = digest.digest(canonical.getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(bytes, 0, 8);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ShapeDefinition)) {
      return false;
    }
    ShapeDefinition that = (ShapeDefinition) o;
    return schema.equals(that.schema)
      && table.equals(that.table)
      && where.equals(that.where)
      && columns.equals(that.columns)
      && replica == that.replica;
  }

  @Override
  public int hashCode() {
    return Objects.hash(schema, table, where, columns, replica);
  }

  @Override
  public String toString() {
    return "ShapeDefinition{" + schema + '.' + table
      + (where.isEmpty() ? "" : ", where=" + where)
      + (columns.isEmpty() ? "" : ", columns=" + columns)
      + ", replica=" + replica.wireName() + '}';
  }

  public static final class Builder {
    private final String table;
    private String schema = DEFAULT_SCHEMA;
    private String where;
    private final TreeSet<String> columns = new TreeSet<>();
    private ReplicaMode replica = ReplicaMode.DEFAULT;

    private Builder(String table) {
      this.table = table;
    }

    public Builder schema(String schema) {
      this.schema = schema;
      return this;
    }

    public Builder where(String where) {
      this.where = where;
      return this;
    }

    public Builder columns(String... columns) {
      return columns(Arrays.asList(columns));
    }

    public Builder columns(Collection<String> columns) {
      for (String column : columns) {
        OptionValidation.require("column", column);
        this.columns.add(column);
      }
      return this;
    }

    public Builder replica(ReplicaMode replica) {
      this.replica = replica;
      return this;
    }

    public ShapeDefinition build() {
      OptionValidation.require("table", table);
      return new ShapeDefinition(this);
    }
  }
}
