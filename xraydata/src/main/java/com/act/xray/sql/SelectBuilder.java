/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.act.xray.sql;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Accumulates the pieces of a SELECT statement (columns, joins, filters, ordering) so that several resolvers can
 * contribute to the same query.  Table, alias and column names must be plain SQL identifiers; values are only ever
 * bound as parameters.
 *
 * A builder is not thread safe and is meant to be owned by the call that creates it.
 */
public class SelectBuilder {
  private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");
  private static final Set<String> OPERATORS =
      Collections.unmodifiableSet(new HashSet<>(Arrays.asList("=", "!=", "<>", "<", "<=", ">", ">=")));

  private final List<Pair<String, String>> selects = new ArrayList<>();
  private String fromTable;
  // Keyed by alias (or table name when no alias is given) so a table can only be joined once per alias.
  private final Map<String, Join> joins = new LinkedHashMap<>();
  private final List<List<Condition>> wheres = new ArrayList<>();
  private final List<Pair<String, String>> orderBys = new ArrayList<>();

  public SelectBuilder addSelect(String table, String column) {
    selects.add(Pair.of(checkIdentifier(table), checkIdentifier(column)));
    return this;
  }

  public SelectBuilder addFrom(String table) {
    checkIdentifier(table);
    if (fromTable != null && !fromTable.equals(table)) {
      throw new IllegalArgumentException(
          String.format("Query already selects from %s, cannot select from %s", fromTable, table));
    }
    fromTable = table;
    return this;
  }

  public SelectBuilder addJoin(String table, String key, String fromTable, String fromKey) {
    return addJoin(table, key, fromTable, fromKey, null);
  }

  /**
   * Joins {@code table} (optionally renamed to {@code alias}) on {@code alias.key = fromTable.fromKey}.  Adding the
   * same join twice is a no-op; joining a different table or on different keys under an alias already in use is an
   * error.
   */
  public SelectBuilder addJoin(String table, String key, String fromTable, String fromKey, String alias) {
    Join join = new Join(checkIdentifier(table), checkIdentifier(key), checkIdentifier(fromTable),
        checkIdentifier(fromKey), alias == null ? null : checkIdentifier(alias));

    Join existing = joins.get(join.getName());
    if (existing == null) {
      joins.put(join.getName(), join);
    } else if (!existing.equals(join)) {
      throw new IllegalArgumentException(String.format("Conflicting joins for %s: %s and %s",
          join.getName(), existing.toSql(), join.toSql()));
    }
    return this;
  }

  public SelectBuilder addWhere(String table, String column, String operator, Object value) {
    return addWhere(Condition.of(table, column, operator, value));
  }

  /**
   * Adds a filter.  When alternatives are given, the filter matches if any one of the conditions does.
   */
  public SelectBuilder addWhere(Condition condition, Condition... alternatives) {
    List<Condition> disjunction = new ArrayList<>(1 + alternatives.length);
    disjunction.add(Objects.requireNonNull(condition, "condition"));
    for (Condition alternative : alternatives) {
      disjunction.add(Objects.requireNonNull(alternative, "condition"));
    }
    wheres.add(Collections.unmodifiableList(disjunction));
    return this;
  }

  public SelectBuilder addOrderBy(String table, String column) {
    orderBys.add(Pair.of(checkIdentifier(table), checkIdentifier(column)));
    return this;
  }

  public boolean hasJoin(String aliasOrTable) {
    return joins.containsKey(aliasOrTable);
  }

  public SqlQuery build() {
    if (selects.isEmpty()) {
      throw new IllegalStateException("No column selected");
    }
    if (fromTable == null) {
      throw new IllegalStateException("No table to select from");
    }
    if (joins.containsKey(fromTable)) {
      throw new IllegalStateException(String.format("Table %s is joined to itself without an alias", fromTable));
    }

    List<String> parts = new ArrayList<>();
    List<Object> parameters = new ArrayList<>();

    List<String> columns = new ArrayList<>(selects.size());
    for (Pair<String, String> select : selects) {
      columns.add(qualify(select.getLeft(), select.getRight()));
    }
    parts.add("SELECT");
    parts.add(StringUtils.join(columns, ", "));
    parts.add("FROM");
    parts.add(fromTable);

    for (Join join : joins.values()) {
      parts.add(join.toSql());
    }

    if (!wheres.isEmpty()) {
      List<String> clauses = new ArrayList<>(wheres.size());
      for (List<Condition> disjunction : wheres) {
        List<String> predicates = new ArrayList<>(disjunction.size());
        for (Condition condition : disjunction) {
          predicates.add(condition.toSql());
          parameters.add(condition.getValue());
        }
        String clause = StringUtils.join(predicates, " OR ");
        clauses.add(predicates.size() > 1 ? "(" + clause + ")" : clause);
      }
      parts.add("WHERE");
      parts.add(StringUtils.join(clauses, " AND "));
    }

    if (!orderBys.isEmpty()) {
      List<String> orderings = new ArrayList<>(orderBys.size());
      for (Pair<String, String> orderBy : orderBys) {
        orderings.add(qualify(orderBy.getLeft(), orderBy.getRight()));
      }
      parts.add("ORDER BY");
      parts.add(StringUtils.join(orderings, ", "));
    }

    return new SqlQuery(StringUtils.join(parts, " "), parameters);
  }

  private static String qualify(String table, String column) {
    return table + "." + column;
  }

  static String checkIdentifier(String identifier) {
    if (identifier == null || !IDENTIFIER_PATTERN.matcher(identifier).matches()) {
      throw new IllegalArgumentException(String.format("Invalid SQL identifier: %s", identifier));
    }
    return identifier;
  }

  /**
   * A single comparison between a column and a bound value.
   */
  public static final class Condition {
    private final String table;
    private final String column;
    private final String operator;
    private final Object value;

    private Condition(String table, String column, String operator, Object value) {
      this.table = checkIdentifier(table);
      this.column = checkIdentifier(column);
      if (!OPERATORS.contains(operator)) {
        throw new IllegalArgumentException(String.format("Unsupported operator: %s", operator));
      }
      if (value == null) {
        throw new IllegalArgumentException(String.format("Cannot compare %s.%s to null", table, column));
      }
      this.operator = operator;
      this.value = value;
    }

    public static Condition of(String table, String column, String operator, Object value) {
      return new Condition(table, column, operator, value);
    }

    public static Condition equalTo(String table, String column, Object value) {
      return new Condition(table, column, "=", value);
    }

    public String getTable() {
      return table;
    }

    public String getColumn() {
      return column;
    }

    public String getOperator() {
      return operator;
    }

    public Object getValue() {
      return value;
    }

    String toSql() {
      return String.format("%s %s ?", qualify(table, column), operator);
    }
  }

  private static final class Join {
    private final String table;
    private final String key;
    private final String fromTable;
    private final String fromKey;
    private final String alias;

    Join(String table, String key, String fromTable, String fromKey, String alias) {
      this.table = table;
      this.key = key;
      this.fromTable = fromTable;
      this.fromKey = fromKey;
      this.alias = alias;
    }

    String getName() {
      return alias == null ? table : alias;
    }

    String toSql() {
      String target = alias == null ? table : table + " AS " + alias;
      return String.format("JOIN %s ON %s = %s", target, qualify(getName(), key), qualify(fromTable, fromKey));
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (o == null || getClass() != o.getClass()) return false;

      Join that = (Join) o;
      return table.equals(that.table) && key.equals(that.key) && fromTable.equals(that.fromTable) &&
          fromKey.equals(that.fromKey) && Objects.equals(alias, that.alias);
    }

    @Override
    public int hashCode() {
      return Objects.hash(table, key, fromTable, fromKey, alias);
    }
  }
}
