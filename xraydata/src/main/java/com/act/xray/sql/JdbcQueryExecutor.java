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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

public class JdbcQueryExecutor implements QueryExecutor {
  private static final Logger LOGGER = LogManager.getFormatterLogger(JdbcQueryExecutor.class);

  public static final int DEFAULT_QUERY_TIMEOUT_SECONDS = 30;

  private final DB db;
  private final int queryTimeoutSeconds;

  public JdbcQueryExecutor(DB db) {
    this(db, DEFAULT_QUERY_TIMEOUT_SECONDS);
  }

  public JdbcQueryExecutor(DB db, int queryTimeoutSeconds) {
    if (queryTimeoutSeconds < 0) {
      throw new IllegalArgumentException(String.format("Query timeout must be >= 0, got %d", queryTimeoutSeconds));
    }
    this.db = db;
    this.queryTimeoutSeconds = queryTimeoutSeconds;
  }

  @Override
  public List<List<Object>> executeQuery(SqlQuery query) throws SQLException {
    LOGGER.debug("Executing %s with parameters %s", query.getSql(), query.getParameters());
    try (PreparedStatement stmt = db.getConn().prepareStatement(query.getSql())) {
      stmt.setQueryTimeout(queryTimeoutSeconds);
      List<Object> parameters = query.getParameters();
      for (int i = 0; i < parameters.size(); i++) {
        stmt.setObject(i + 1, parameters.get(i));
      }

      try (ResultSet resultSet = stmt.executeQuery()) {
        return rowsFromResultSet(resultSet);
      }
    }
  }

  protected static List<List<Object>> rowsFromResultSet(ResultSet resultSet) throws SQLException {
    int columnCount = resultSet.getMetaData().getColumnCount();
    List<List<Object>> rows = new ArrayList<>();
    while (resultSet.next()) {
      List<Object> row = new ArrayList<>(columnCount);
      for (int i = 1; i <= columnCount; i++) {
        row.add(resultSet.getObject(i));
      }
      rows.add(row);
    }
    return rows;
  }
}
