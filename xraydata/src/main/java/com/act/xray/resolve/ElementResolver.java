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

import com.act.xray.descriptor.Element;
import com.act.xray.sql.Schema;
import com.act.xray.sql.SelectBuilder;

/**
 * Elements are matched on their atomic number, or on their name or symbol when given as a string.
 */
public class ElementResolver extends AbstractEntityResolver<Element> {
  public static final String LABEL_NAME_ALIAS = "labelname";
  public static final String LABEL_SYMBOL_ALIAS = "labelsymbol";

  public ElementResolver() {
    super(EntityKind.ELEMENT);
  }

  @Override
  protected Identifier<Element> normalize(Object identifier) throws UnresolvedIdentifierException {
    return IdentifierNormalizer.element(identifier);
  }

  @Override
  protected void resolveValue(Element element, SelectBuilder builder, String table, String column) {
    builder.addJoin(Schema.ELEMENT, Schema.ID, table, column);
    builder.addWhere(Schema.ELEMENT, Schema.ATOMIC_NUMBER, "=", element.getAtomicNumber());
  }

  @Override
  protected void resolveLabel(String label, SelectBuilder builder, String table, String column) {
    String nameAlias = labelAlias(Schema.ELEMENT_NAME, table, LABEL_NAME_ALIAS);
    String symbolAlias = labelAlias(Schema.ELEMENT_SYMBOL, table, LABEL_SYMBOL_ALIAS);
    builder.addJoin(Schema.ELEMENT_NAME, Schema.ELEMENT_ID, table, column, nameAlias);
    builder.addJoin(Schema.ELEMENT_SYMBOL, Schema.ELEMENT_ID, table, column, symbolAlias);
    builder.addWhere(
        SelectBuilder.Condition.equalTo(nameAlias == null ? Schema.ELEMENT_NAME : nameAlias, Schema.NAME, label),
        SelectBuilder.Condition.equalTo(symbolAlias == null ? Schema.ELEMENT_SYMBOL : symbolAlias, Schema.SYMBOL,
            label));
  }
}
