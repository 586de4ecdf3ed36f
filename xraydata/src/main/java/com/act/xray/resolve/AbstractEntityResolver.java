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

import com.act.xray.sql.Schema;
import com.act.xray.sql.SelectBuilder;

/**
 * Normalizes the identifier and dispatches on its form, so exactly one resolution path runs for each identifier.
 * Forms a kind does not support end in a {@link NotFoundException}.
 */
public abstract class AbstractEntityResolver<T> implements EntityResolver {
  public static final String LABEL_NOTATION_ALIAS = "labelnotation";

  private final EntityKind kind;

  protected AbstractEntityResolver(EntityKind kind) {
    this.kind = kind;
  }

  @Override
  public EntityKind getKind() {
    return kind;
  }

  protected abstract Identifier<T> normalize(Object identifier) throws UnresolvedIdentifierException;

  @Override
  public void resolve(Object identifier, SelectBuilder builder, String table, String column)
      throws ResolutionException {
    Identifier<T> normalized = normalize(identifier);
    switch (normalized.getForm()) {
      case VALUE:
        resolveValue(normalized.getValue(), builder, table, column);
        return;
      case LABEL:
        resolveLabel(normalized.getLabel(), builder, table, column);
        return;
      case UNSPECIFIED:
        resolveUnspecified(builder, table, column);
        return;
      default:
        throw new NotFoundException(kind, identifier);
    }
  }

  protected abstract void resolveValue(T value, SelectBuilder builder, String table, String column)
      throws ResolutionException;

  protected void resolveLabel(String label, SelectBuilder builder, String table, String column)
      throws ResolutionException {
    throw new NotFoundException(kind, label);
  }

  protected void resolveUnspecified(SelectBuilder builder, String table, String column) throws ResolutionException {
    throw new NotFoundException(kind, null);
  }

  /**
   * Matches {@code label} against either rendering of a notation table.  When the query already selects from the
   * notation table, the label is matched on a second copy of it joined through the entity key.
   */
  protected static void addNotationFilter(SelectBuilder builder, String notationTable, String notationKey,
                                          String table, String column, String label) {
    String alias = labelAlias(notationTable, table, LABEL_NOTATION_ALIAS);
    String name = alias == null ? notationTable : alias;
    builder.addJoin(notationTable, notationKey, table, column, alias);
    builder.addWhere(
        SelectBuilder.Condition.equalTo(name, Schema.ASCII, label),
        SelectBuilder.Condition.equalTo(name, Schema.UTF16, label));
  }

  /**
   * @return {@code alias} if {@code lookupTable} is the table being selected from, null otherwise.
   */
  protected static String labelAlias(String lookupTable, String table, String alias) {
    return lookupTable.equals(table) ? alias : null;
  }
}
