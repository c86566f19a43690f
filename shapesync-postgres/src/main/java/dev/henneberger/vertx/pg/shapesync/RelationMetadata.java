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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Table layout announced by a pgoutput Relation message.
 */
public final class RelationMetadata {

  public enum ReplicaIdentity {
    DEFAULT('d'),
    NOTHING('n'),
    FULL('f'),
    INDEX('i');

    private final char code;

    ReplicaIdentity(char code) {
      this.code = code;
    }

    public char code() {
      return code;
    }

    public static ReplicaIdentity fromCode(char code) {
      for (ReplicaIdentity identity : values()) {
        if (identity.code == code) {
          return identity;
        }
      }
      throw new IllegalArgumentException("Unknown replica identity: " + code);
    }
  }

  public static final class Column {
    private final String name;
    private final int typeOid;
    private final int typeModifier;
    private final boolean key;

    public Column(String name, int typeOid, int typeModifier, boolean key) {
      this.name = Objects.requireNonNull(name, "name");
      this.typeOid = typeOid;
      this.typeModifier = typeModifier;
      this.key = key;
    }

    public String name() {
      return name;
    }

    public int typeOid() {
      return typeOid;
    }

    public int typeModifier() {
      return typeModifier;
    }

    public boolean isKey() {
      return key;
    }
  }

  private final int relationId;
  private final String schema;
  private final String table;
  private final List<Column> columns;
  private final ReplicaIdentity replicaIdentity;

  public RelationMetadata(int relationId,
                          String schema,
                          String table,
                          List<Column> columns,
                          ReplicaIdentity replicaIdentity) {
    this.relationId = relationId;
    this.schema = Objects.requireNonNull(schema, "schema");
    this.table = Objects.requireNonNull(table, "table");
    this.columns = List.copyOf(columns);
    this.replicaIdentity = Objects.requireNonNull(replicaIdentity, "replicaIdentity");
  }

  public int relationId() {
    return relationId;
  }

  public String schema() {
    return schema;
  }

  public String table() {
    return table;
  }

  public TableRef tableRef() {
    return TableRef.of(schema, table);
  }

  public List<Column> columns() {
    return columns;
  }

  public List<Column> keyColumns() {
    List<Column> keys = new ArrayList<>();
    for (Column column : columns) {
      if (column.isKey()) {
        keys.add(column);
      }
    }
    return keys;
  }

  public ReplicaIdentity replicaIdentity() {
    return replicaIdentity;
  }
}
