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
import com.act.xray.sql.Schema;
import com.act.xray.sql.SelectBuilder;

/**
 * Subshells are matched on (n, l, 2j) through the subshell and shell tables, or through the subshell notation table
 * when given as a string.
 */
public class AtomicSubshellResolver extends AbstractEntityResolver<AtomicSubshell> {

  public AtomicSubshellResolver() {
    super(EntityKind.ATOMIC_SUBSHELL);
  }

  @Override
  protected Identifier<AtomicSubshell> normalize(Object identifier) throws UnresolvedIdentifierException {
    return IdentifierNormalizer.atomicSubshell(identifier);
  }

  @Override
  protected void resolveValue(AtomicSubshell subshell, SelectBuilder builder, String table, String column) {
    addSubshellFilter(builder, table, column, null, null, subshell);
  }

  @Override
  protected void resolveLabel(String label, SelectBuilder builder, String table, String column) {
    addNotationFilter(builder, Schema.ATOMIC_SUBSHELL_NOTATION, Schema.ATOMIC_SUBSHELL_ID, table, column, label);
  }

  /**
   * Joins the subshell referenced by {@code table.column} and its shell, optionally under aliases so the same query
   * can constrain more than one subshell, and filters on the subshell's quantum numbers.
   */
  static void addSubshellFilter(SelectBuilder builder, String table, String column,
                                String subshellAlias, String shellAlias, AtomicSubshell subshell) {
    String subshellName = subshellAlias == null ? Schema.ATOMIC_SUBSHELL : subshellAlias;
    String shellName = shellAlias == null ? Schema.ATOMIC_SHELL : shellAlias;

    builder.addJoin(Schema.ATOMIC_SUBSHELL, Schema.ID, table, column, subshellAlias);
    builder.addJoin(Schema.ATOMIC_SHELL, Schema.ID, subshellName, Schema.ATOMIC_SHELL_ID, shellAlias);
    builder.addWhere(shellName, Schema.PRINCIPAL_QUANTUM_NUMBER, "=", subshell.getPrincipalQuantumNumber());
    builder.addWhere(subshellName, Schema.AZIMUTHAL_QUANTUM_NUMBER, "=", subshell.getAzimuthalQuantumNumber());
    builder.addWhere(subshellName, Schema.TOTAL_ANGULAR_MOMENTUM_NOMINATOR, "=",
        subshell.getTotalAngularMomentumNominator());
  }
}
