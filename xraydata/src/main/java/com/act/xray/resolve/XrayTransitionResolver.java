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

import com.act.xray.descriptor.XrayTransition;
import com.act.xray.sql.Schema;
import com.act.xray.sql.SelectBuilder;

/**
 * Transitions are matched on the quantum numbers of both of their subshells, or through the transition notation
 * table when given as a string.
 */
public class XrayTransitionResolver extends AbstractEntityResolver<XrayTransition> {
  public static final String SOURCE_SUBSHELL_ALIAS = "srcsubshell";
  public static final String SOURCE_SHELL_ALIAS = "srcshell";
  public static final String DESTINATION_SUBSHELL_ALIAS = "dstsubshell";
  public static final String DESTINATION_SHELL_ALIAS = "dstshell";

  public XrayTransitionResolver() {
    super(EntityKind.XRAY_TRANSITION);
  }

  @Override
  protected Identifier<XrayTransition> normalize(Object identifier) throws UnresolvedIdentifierException {
    return IdentifierNormalizer.xrayTransition(identifier);
  }

  @Override
  protected void resolveValue(XrayTransition transition, SelectBuilder builder, String table, String column) {
    addTransitionFilter(builder, table, column, transition);
  }

  @Override
  protected void resolveLabel(String label, SelectBuilder builder, String table, String column) {
    addNotationFilter(builder, Schema.XRAY_TRANSITION_NOTATION, Schema.XRAY_TRANSITION_ID, table, column, label);
  }

  static void addTransitionFilter(SelectBuilder builder, String table, String column, XrayTransition transition) {
    builder.addJoin(Schema.XRAY_TRANSITION, Schema.ID, table, column);
    AtomicSubshellResolver.addSubshellFilter(builder, Schema.XRAY_TRANSITION, Schema.SOURCE_SUBSHELL_ID,
        SOURCE_SUBSHELL_ALIAS, SOURCE_SHELL_ALIAS, transition.getSourceSubshell());
    AtomicSubshellResolver.addSubshellFilter(builder, Schema.XRAY_TRANSITION, Schema.DESTINATION_SUBSHELL_ID,
        DESTINATION_SUBSHELL_ALIAS, DESTINATION_SHELL_ALIAS, transition.getDestinationSubshell());
  }
}
