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

package com.act.xray.resolve;

import com.act.xray.descriptor.AtomicSubshell;
import com.act.xray.descriptor.Reference;
import com.act.xray.descriptor.XrayTransition;
import com.act.xray.sql.SelectBuilder;
import com.act.xray.sql.SqlQuery;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ResolversTest {
  private static final AtomicSubshell K = new AtomicSubshell(1, 0, 1);
  private static final AtomicSubshell L3 = new AtomicSubshell(2, 1, 3);

  private Resolvers resolvers;

  @Before
  public void setup() {
    resolvers = new Resolvers(null, ReferencePreferences.builder()
        .setDefault("xray_transition_energy", "deslattes2003")
        .build());
  }

  private static SelectBuilder select(String table, String column) {
    return new SelectBuilder().addSelect(table, column).addFrom(table);
  }

  @Test
  public void testEveryKindHasAResolver() {
    for (EntityKind kind : EntityKind.values()) {
      assertEquals(kind, resolvers.get(kind).getKind());
    }
  }

  @Test
  public void testElementByAtomicNumber() throws Exception {
    SelectBuilder builder = select("element_atomic_weight", "value");
    resolvers.resolve(EntityKind.ELEMENT, 26, builder, "element_atomic_weight", "element_id");

    SqlQuery query = builder.build();
    assertEquals("SELECT element_atomic_weight.value FROM element_atomic_weight " +
        "JOIN element ON element.id = element_atomic_weight.element_id " +
        "WHERE element.atomic_number = ?", query.getSql());
    assertEquals(Collections.<Object>singletonList(26), query.getParameters());
  }

  @Test
  public void testElementByNameOrSymbol() throws Exception {
    SelectBuilder builder = select("element_atomic_weight", "value");
    resolvers.resolve(EntityKind.ELEMENT, "Fe", builder, "element_atomic_weight", "element_id");

    SqlQuery query = builder.build();
    assertEquals("SELECT element_atomic_weight.value FROM element_atomic_weight " +
        "JOIN element_name ON element_name.element_id = element_atomic_weight.element_id " +
        "JOIN element_symbol ON element_symbol.element_id = element_atomic_weight.element_id " +
        "WHERE (element_name.name = ? OR element_symbol.symbol = ?)", query.getSql());
    assertEquals(Arrays.<Object>asList("Fe", "Fe"), query.getParameters());
  }

  @Test
  public void testElementLabelOnItsOwnSymbolTable() throws Exception {
    SelectBuilder builder = select("element_symbol", "symbol");
    resolvers.resolve(EntityKind.ELEMENT, "Iron", builder, "element_symbol", "element_id");

    SqlQuery query = builder.build();
    assertEquals("SELECT element_symbol.symbol FROM element_symbol " +
        "JOIN element_name ON element_name.element_id = element_symbol.element_id " +
        "JOIN element_symbol AS labelsymbol ON labelsymbol.element_id = element_symbol.element_id " +
        "WHERE (element_name.name = ? OR labelsymbol.symbol = ?)", query.getSql());
    assertEquals(Arrays.<Object>asList("Iron", "Iron"), query.getParameters());
  }

  @Test
  public void testNotationLabelOnItsOwnNotationTable() throws Exception {
    SelectBuilder builder = select("atomic_subshell_notation", "ascii");
    resolvers.resolve(EntityKind.NOTATION, "siegbahn", builder, "atomic_subshell_notation", "notation_id");
    resolvers.resolve(EntityKind.ATOMIC_SUBSHELL, "L3", builder, "atomic_subshell_notation", "atomic_subshell_id");

    SqlQuery query = builder.build();
    assertEquals("SELECT atomic_subshell_notation.ascii FROM atomic_subshell_notation " +
        "JOIN notation ON notation.id = atomic_subshell_notation.notation_id " +
        "JOIN atomic_subshell_notation AS labelnotation " +
        "ON labelnotation.atomic_subshell_id = atomic_subshell_notation.atomic_subshell_id " +
        "WHERE notation.name = ? AND (labelnotation.ascii = ? OR labelnotation.utf16 = ?)", query.getSql());
    assertEquals(Arrays.<Object>asList("siegbahn", "L3", "L3"), query.getParameters());
  }

  @Test
  public void testTransitionEnergyOfIron() throws Exception {
    SelectBuilder builder = select("xray_transition_energy", "value_eV");
    resolvers.resolve(EntityKind.ELEMENT, 26, builder, "xray_transition_energy", "element_id");
    resolvers.resolve(EntityKind.XRAY_TRANSITION, new XrayTransition(L3, K),
        builder, "xray_transition_energy", "xray_transition_id");

    SqlQuery query = builder.build();
    assertEquals("SELECT xray_transition_energy.value_eV FROM xray_transition_energy " +
        "JOIN element ON element.id = xray_transition_energy.element_id " +
        "JOIN xray_transition ON xray_transition.id = xray_transition_energy.xray_transition_id " +
        "JOIN atomic_subshell AS srcsubshell ON srcsubshell.id = xray_transition.source_subshell_id " +
        "JOIN atomic_shell AS srcshell ON srcshell.id = srcsubshell.atomic_shell_id " +
        "JOIN atomic_subshell AS dstsubshell ON dstsubshell.id = xray_transition.destination_subshell_id " +
        "JOIN atomic_shell AS dstshell ON dstshell.id = dstsubshell.atomic_shell_id " +
        "WHERE element.atomic_number = ? AND srcshell.principal_quantum_number = ? " +
        "AND srcsubshell.azimuthal_quantum_number = ? AND srcsubshell.total_angular_momentum_nominator = ? " +
        "AND dstshell.principal_quantum_number = ? AND dstsubshell.azimuthal_quantum_number = ? " +
        "AND dstsubshell.total_angular_momentum_nominator = ?", query.getSql());
    assertEquals(Arrays.<Object>asList(26, 2, 1, 3, 1, 0, 1), query.getParameters());
  }

  @Test
  public void testSubshellByValueAndByNotation() throws Exception {
    SelectBuilder byValue = select("atomic_subshell_binding_energy", "value_eV");
    resolvers.resolve(EntityKind.ATOMIC_SUBSHELL, new int[]{2, 1, 3},
        byValue, "atomic_subshell_binding_energy", "atomic_subshell_id");
    assertEquals("SELECT atomic_subshell_binding_energy.value_eV FROM atomic_subshell_binding_energy " +
        "JOIN atomic_subshell ON atomic_subshell.id = atomic_subshell_binding_energy.atomic_subshell_id " +
        "JOIN atomic_shell ON atomic_shell.id = atomic_subshell.atomic_shell_id " +
        "WHERE atomic_shell.principal_quantum_number = ? AND atomic_subshell.azimuthal_quantum_number = ? " +
        "AND atomic_subshell.total_angular_momentum_nominator = ?", byValue.build().getSql());

    SelectBuilder byNotation = select("atomic_subshell_binding_energy", "value_eV");
    resolvers.resolve(EntityKind.ATOMIC_SUBSHELL, "L3",
        byNotation, "atomic_subshell_binding_energy", "atomic_subshell_id");
    SqlQuery query = byNotation.build();
    assertEquals("SELECT atomic_subshell_binding_energy.value_eV FROM atomic_subshell_binding_energy " +
        "JOIN atomic_subshell_notation " +
        "ON atomic_subshell_notation.atomic_subshell_id = atomic_subshell_binding_energy.atomic_subshell_id " +
        "WHERE (atomic_subshell_notation.ascii = ? OR atomic_subshell_notation.utf16 = ?)", query.getSql());
    assertEquals(Arrays.<Object>asList("L3", "L3"), query.getParameters());
  }

  @Test
  public void testShellByPrincipalQuantumNumber() throws Exception {
    SelectBuilder builder = select("atomic_shell_notation", "ascii");
    resolvers.resolve(EntityKind.ATOMIC_SHELL, 1, builder, "atomic_shell_notation", "atomic_shell_id");
    assertTrue(builder.build().getSql().endsWith(
        "JOIN atomic_shell ON atomic_shell.id = atomic_shell_notation.atomic_shell_id " +
            "WHERE atomic_shell.principal_quantum_number = ?"));
  }

  @Test
  public void testNotationAndLanguage() throws Exception {
    SelectBuilder builder = select("element_name", "name");
    resolvers.resolve(EntityKind.LANGUAGE, "DE", builder, "element_name", "language_id");
    resolvers.resolve(EntityKind.REFERENCE, "unattributed", builder, "element_name", "reference_id");

    SqlQuery query = builder.build();
    assertEquals("SELECT element_name.name FROM element_name " +
        "JOIN language ON language.id = element_name.language_id " +
        "JOIN ref ON ref.id = element_name.reference_id " +
        "WHERE language.code = ? AND ref.bibtexkey = ?", query.getSql());
    assertEquals(Arrays.<Object>asList("de", "unattributed"), query.getParameters());

    SelectBuilder notation = select("xray_transition_notation", "ascii");
    resolvers.resolve(EntityKind.NOTATION, "IUPAC", notation, "xray_transition_notation", "notation_id");
    assertEquals(Collections.<Object>singletonList("iupac"), notation.build().getParameters());
  }

  @Test
  public void testUnspecifiedReferenceUsesDefault() throws Exception {
    SelectBuilder builder = select("xray_transition_energy", "value_eV");
    resolvers.resolve(EntityKind.REFERENCE, null, builder, "xray_transition_energy", "reference_id");

    SqlQuery query = builder.build();
    assertTrue(query.getSql().endsWith("JOIN ref ON ref.id = xray_transition_energy.reference_id " +
        "WHERE ref.bibtexkey = ?"));
    assertEquals(Collections.<Object>singletonList("deslattes2003"), query.getParameters());
  }

  @Test
  public void testUnspecifiedReferenceWithoutDefaultOrdersRows() throws Exception {
    SelectBuilder builder = select("xray_transition_probability", "value");
    resolvers.resolve(EntityKind.REFERENCE, null, builder, "xray_transition_probability", "reference_id");

    assertEquals("SELECT xray_transition_probability.value FROM xray_transition_probability " +
        "ORDER BY xray_transition_probability.reference_id", builder.build().getSql());
  }

  @Test
  public void testEmptyReferenceIsUnspecified() throws Exception {
    SelectBuilder builder = select("xray_transition_probability", "value");
    resolvers.resolve(EntityKind.REFERENCE, "", builder, "xray_transition_probability", "reference_id");

    SqlQuery query = builder.build();
    assertEquals("SELECT xray_transition_probability.value FROM xray_transition_probability " +
        "ORDER BY xray_transition_probability.reference_id", query.getSql());
    assertTrue(query.getParameters().isEmpty());
  }

  @Test
  public void testExplicitReferenceOverridesDefault() throws Exception {
    SelectBuilder builder = select("xray_transition_energy", "value_eV");
    resolvers.resolve(EntityKind.REFERENCE, new Reference("bearden1967"),
        builder, "xray_transition_energy", "reference_id");
    assertEquals(Collections.<Object>singletonList("bearden1967"), builder.build().getParameters());
  }

  @Test
  public void testTransitionSetByNotation() throws Exception {
    SelectBuilder builder = select("xray_transitionset_energy", "value_eV");
    resolvers.resolve(EntityKind.XRAY_TRANSITIONSET, "Ka", builder, "xray_transitionset_energy",
        "xray_transitionset_id");
    assertTrue(builder.build().getSql().contains("JOIN xray_transitionset_notation " +
        "ON xray_transitionset_notation.xray_transitionset_id = xray_transitionset_energy.xray_transitionset_id"));
  }

  @Test
  public void testTransitionSetMatchingNeedsDatabase() throws Exception {
    SelectBuilder builder = select("xray_transitionset_energy", "value_eV");
    String before = builder.build().getSql();
    try {
      resolvers.resolve(EntityKind.XRAY_TRANSITIONSET, Collections.singletonList(new XrayTransition(L3, K)),
          builder, "xray_transitionset_energy", "xray_transitionset_id");
      fail("Matching without a database should fail");
    } catch (ResolutionException e) {
      assertEquals(before, builder.build().getSql());
    }

    try {
      resolvers.matchTransitionSet(Collections.singletonList(new XrayTransition(L3, K)));
      fail("Matching without a database should fail");
    } catch (ResolutionException e) {
      // expected
    }
  }

  @Test
  public void testUnresolvedIdentifierLeavesQueryUntouched() throws Exception {
    SelectBuilder builder = select("element_atomic_weight", "value");
    SqlQuery before = builder.build();
    try {
      resolvers.resolve(EntityKind.ELEMENT, 26.0, builder, "element_atomic_weight", "element_id");
      fail("Floating point atomic numbers are not accepted");
    } catch (UnresolvedIdentifierException e) {
      assertEquals("Cannot parse element: 26.0", e.getMessage());
    }
    assertEquals(before, builder.build());
  }

  @Test
  public void testMatchTransitionSetWithDatabase() throws Exception {
    XrayTransition kl3 = new XrayTransition(L3, K);
    FakeQueryExecutor executor = new FakeQueryExecutor()
        .addTransitionSet(7, Collections.singleton(kl3));
    Resolvers withDatabase = new Resolvers(executor, ReferencePreferences.NONE);
    assertEquals(7, withDatabase.matchTransitionSet(Collections.singletonList(new int[]{2, 1, 3, 1, 0, 1})));
  }
}
