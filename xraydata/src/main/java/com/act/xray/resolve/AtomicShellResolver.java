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

import com.act.xray.descriptor.AtomicShell;
import com.act.xray.sql.Schema;
import com.act.xray.sql.SelectBuilder;

public class AtomicShellResolver extends AbstractEntityResolver<AtomicShell> {

  public AtomicShellResolver() {
    super(EntityKind.ATOMIC_SHELL);
  }

  @Override
  protected Identifier<AtomicShell> normalize(Object identifier) throws UnresolvedIdentifierException {
    return IdentifierNormalizer.atomicShell(identifier);
  }

  @Override
  protected void resolveValue(AtomicShell shell, SelectBuilder builder, String table, String column) {
    builder.addJoin(Schema.ATOMIC_SHELL, Schema.ID, table, column);
    builder.addWhere(Schema.ATOMIC_SHELL, Schema.PRINCIPAL_QUANTUM_NUMBER, "=", shell.getPrincipalQuantumNumber());
  }

  @Override
  protected void resolveLabel(String label, SelectBuilder builder, String table, String column) {
    addNotationFilter(builder, Schema.ATOMIC_SHELL_NOTATION, Schema.ATOMIC_SHELL_ID, table, column, label);
  }
}
