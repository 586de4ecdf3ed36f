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

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class SelectBuilderTest {

  private SelectBuilder builder;

  @Before
  public void setup() {
    builder = new SelectBuilder();
    builder.addSelect("xray_transition", "id");
    builder.addFrom("xray_transition");
  }

  @Test
  public void testSameTableJoinedUnderTwoAliases() {
    builder.addJoin("atomic_subshell", "id", "xray_transition", "source_subshell_id", "srcsubshell");
    builder.addJoin("atomic_subshell", "id", "xray_transition", "destination_subshell_id", "dstsubshell");
    assertTrue(builder.hasJoin("srcsubshell"));
    assertFalse(builder.hasJoin("atomic_subshell"));

    SqlQuery query = builder.build();
    assertEquals("SELECT xray_transition.id FROM xray_transition " +
        "JOIN atomic_subshell AS srcsubshell ON srcsubshell.id = xray_transition.source_subshell_id " +
        "JOIN atomic_subshell AS dstsubshell ON dstsubshell.id = xray_transition.destination_subshell_id",
        query.getSql());
    assertEquals(Collections.emptyList(), query.getParameters());
  }

  @Test
  public void testBuildIsIdempotent() {
    builder.addJoin("atomic_subshell", "id", "xray_transition", "source_subshell_id", "srcsubshell");
    builder.addWhere("srcsubshell", "azimuthal_quantum_number", "=", 1);
    builder.addOrderBy("xray_transition", "id");

    SqlQuery first = builder.build();
    SqlQuery second = builder.build();
    assertEquals(first, second);
    assertEquals(first.getSql(), second.getSql());
    assertEquals(Arrays.<Object>asList(1), second.getParameters());
  }

  @Test
  public void testRepeatedIdenticalJoinIsAddedOnce() {
    builder.addJoin("atomic_subshell", "id", "xray_transition", "source_subshell_id", "srcsubshell");
    builder.addJoin("atomic_subshell", "id", "xray_transition", "source_subshell_id", "srcsubshell");

    String sql = builder.build().getSql();
    assertEquals(sql.indexOf("JOIN atomic_subshell"), sql.lastIndexOf("JOIN atomic_subshell"));
  }

  @Test
  public void testConflictingJoinsUnderTheSameAliasAreRejected() {
    builder.addJoin("atomic_subshell", "id", "xray_transition", "source_subshell_id", "subshell");
    try {
      builder.addJoin("atomic_subshell", "id", "xray_transition", "destination_subshell_id", "subshell");
      fail("Two different joins cannot share an alias");
    } catch (IllegalArgumentException e) {
      assertTrue(e.getMessage().contains("subshell"));
    }

    try {
      builder.addJoin("atomic_shell", "id", "xray_transition", "source_subshell_id", "subshell");
      fail("Two tables cannot share an alias");
    } catch (IllegalArgumentException e) {
      // expected
    }
  }

  @Test
  public void testJoiningATableTwiceWithoutAliasIsRejected() {
    builder.addJoin("atomic_subshell", "id", "xray_transition", "source_subshell_id");
    try {
      builder.addJoin("atomic_subshell", "id", "xray_transition", "destination_subshell_id");
      fail("The second join needs an alias");
    } catch (IllegalArgumentException e) {
      // expected
    }
  }

  @Test
  public void testAlternativesAreOred() {
    builder.addJoin("xray_transition_notation", "xray_transition_id", "xray_transition", "id");
    builder.addWhere(
        SelectBuilder.Condition.equalTo("xray_transition_notation", "ascii", "Ka1"),
        SelectBuilder.Condition.equalTo("xray_transition_notation", "utf16", "Kα1"));
    builder.addWhere("xray_transition", "id", ">", 0);

    SqlQuery query = builder.build();
    assertEquals("SELECT xray_transition.id FROM xray_transition " +
        "JOIN xray_transition_notation ON xray_transition_notation.xray_transition_id = xray_transition.id " +
        "WHERE (xray_transition_notation.ascii = ? OR xray_transition_notation.utf16 = ?) " +
        "AND xray_transition.id > ?", query.getSql());
    assertEquals(Arrays.<Object>asList("Ka1", "Kα1", 0), query.getParameters());
  }

  @Test
  public void testValuesAreNeverInlined() {
    String malicious = "Fe'; DROP TABLE element; --";
    builder.addWhere("xray_transition", "id", "=", malicious);

    SqlQuery query = builder.build();
    assertTrue(query.getSql().endsWith("WHERE xray_transition.id = ?"));
    assertEquals(Collections.singletonList(malicious), query.getParameters());
  }

  @Test
  public void testUnsafeIdentifiersAndOperatorsAreRejected() {
    String[][] badWheres = {
        {"element; DROP TABLE element", "id", "="},
        {"element", "atomic_number = 1 OR 1", "="},
        {"element", "atomic_number", "LIKE"},
        {"element", "atomic_number", "= 1 OR 1 ="},
    };
    for (String[] where : badWheres) {
      try {
        builder.addWhere(where[0], where[1], where[2], 1);
        fail(String.format("%s.%s %s should be rejected", where[0], where[1], where[2]));
      } catch (IllegalArgumentException e) {
        // expected
      }
    }

    try {
      builder.addJoin("element", "id", "xray_transition", "id", "e e");
      fail("Aliases must be identifiers");
    } catch (IllegalArgumentException e) {
      // expected
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNullValuesAreRejected() {
    builder.addWhere("xray_transition", "id", "=", null);
  }

  @Test
  public void testOrderBy() {
    builder.addOrderBy("xray_transition", "source_subshell_id");
    builder.addOrderBy("xray_transition", "destination_subshell_id");
    assertTrue(builder.build().getSql().endsWith(
        "ORDER BY xray_transition.source_subshell_id, xray_transition.destination_subshell_id"));
  }

  @Test(expected = IllegalStateException.class)
  public void testBuildWithoutSelectFails() {
    new SelectBuilder().addFrom("element").build();
  }

  @Test(expected = IllegalStateException.class)
  public void testBuildWithoutFromFails() {
    new SelectBuilder().addSelect("element", "id").build();
  }

  @Test(expected = IllegalStateException.class)
  public void testJoiningTheFromTableWithoutAliasFails() {
    builder.addJoin("xray_transition", "id", "atomic_subshell", "id");
    builder.build();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testOnlyOneFromTable() {
    builder.addFrom("element");
  }
}
