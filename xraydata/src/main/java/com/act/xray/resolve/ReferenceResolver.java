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

import com.act.xray.descriptor.Reference;
import com.act.xray.sql.Schema;
import com.act.xray.sql.SelectBuilder;

/**
 * References are matched on their BibTeX key.  When no reference is given, the configured default for the property
 * table is used; without a default, rows are ordered by reference so callers can pick the first one.
 */
public class ReferenceResolver extends AbstractEntityResolver<Reference> {
  private final ReferencePreferences preferences;

  public ReferenceResolver(ReferencePreferences preferences) {
    super(EntityKind.REFERENCE);
    this.preferences = preferences == null ? ReferencePreferences.NONE : preferences;
  }

  @Override
  protected Identifier<Reference> normalize(Object identifier) throws UnresolvedIdentifierException {
    return IdentifierNormalizer.reference(identifier);
  }

  @Override
  protected void resolveValue(Reference reference, SelectBuilder builder, String table, String column) {
    builder.addJoin(Schema.REFERENCE, Schema.ID, table, column);
    builder.addWhere(Schema.REFERENCE, Schema.BIBTEXKEY, "=", reference.getBibtexKey());
  }

  @Override
  protected void resolveUnspecified(SelectBuilder builder, String table, String column) {
    Reference defaultReference = Schema.PROPERTY_TABLES.contains(table) ? preferences.getDefault(table) : null;
    if (defaultReference != null) {
      resolveValue(defaultReference, builder, table, column);
    } else {
      builder.addOrderBy(table, column);
    }
  }
}
