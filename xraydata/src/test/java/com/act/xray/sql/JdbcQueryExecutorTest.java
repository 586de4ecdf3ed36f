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

import org.junit.Before;
import org.junit.Test;
import org.mockito.Mockito;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

public class JdbcQueryExecutorTest {
  private static final SqlQuery QUERY = new SqlQuery(
      "SELECT xray_transitionset_association.xray_transitionset_id, xray_transitionset.count " +
          "FROM xray_transitionset_association WHERE xray_transitionset_association.xray_transition_id = ?",
      Arrays.<Object>asList(7));

  private DB db;
  private Connection connection;
  private PreparedStatement statement;
  private ResultSet resultSet;

  @Before
  public void setup() throws Exception {
    db = Mockito.mock(DB.class);
    connection = Mockito.mock(Connection.class);
    statement = Mockito.mock(PreparedStatement.class);
    resultSet = Mockito.mock(ResultSet.class);
    ResultSetMetaData metaData = Mockito.mock(ResultSetMetaData.class);

    Mockito.doReturn(connection).when(db).getConn();
    Mockito.doReturn(statement).when(connection).prepareStatement(QUERY.getSql());
    Mockito.doReturn(resultSet).when(statement).executeQuery();
    Mockito.doReturn(metaData).when(resultSet).getMetaData();
    Mockito.doReturn(2).when(metaData).getColumnCount();
  }

  @Test
  public void testParametersAreBoundAndRowsRead() throws Exception {
    Mockito.when(resultSet.next()).thenReturn(true, true, false);
    Mockito.when(resultSet.getObject(1)).thenReturn(1, 2);
    Mockito.when(resultSet.getObject(2)).thenReturn(2L, 1L);

    List<List<Object>> rows = new JdbcQueryExecutor(db, 5).executeQuery(QUERY);

    assertEquals(Arrays.asList(Arrays.<Object>asList(1, 2L), Arrays.<Object>asList(2, 1L)), rows);
    Mockito.verify(statement).setQueryTimeout(5);
    Mockito.verify(statement).setObject(1, 7);
    Mockito.verify(resultSet).close();
    Mockito.verify(statement).close();
  }

  @Test
  public void testBackendErrorsPropagate() throws Exception {
    SQLTimeoutException timeout = new SQLTimeoutException("canceling statement due to statement timeout");
    Mockito.doThrow(timeout).when(statement).executeQuery();

    try {
      new JdbcQueryExecutor(db).executeQuery(QUERY);
      fail("The timeout should have been rethrown");
    } catch (SQLException e) {
      assertSame(timeout, e);
    }
    Mockito.verify(statement).setQueryTimeout(JdbcQueryExecutor.DEFAULT_QUERY_TIMEOUT_SECONDS);
    Mockito.verify(statement).close();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeTimeoutIsRejected() {
    new JdbcQueryExecutor(db, -1);
  }
}
