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

import com.act.xray.descriptor.XrayTransitionSet;
import com.act.xray.sql.QueryExecutor;
import com.act.xray.sql.Schema;
import com.act.xray.sql.SelectBuilder;

/**
 * Transition sets given as transitions are first matched against the stored sets (see {@link TransitionSetMatcher})
 * and then filtered on the matching set's key; sets given as a string go through the transition set notation table.
 */
public class XrayTransitionSetResolver extends AbstractEntityResolver<XrayTransitionSet> {
  private final TransitionSetMatcher matcher;
  private final QueryExecutor executor;

  /**
   * @param executor runs the matcher's queries; may be null, in which case only notation strings can be resolved.
   */
  public XrayTransitionSetResolver(TransitionSetMatcher matcher, QueryExecutor executor) {
    super(EntityKind.XRAY_TRANSITIONSET);
    this.matcher = matcher;
    this.executor = executor;
  }

  @Override
  protected Identifier<XrayTransitionSet> normalize(Object identifier) throws UnresolvedIdentifierException {
    return IdentifierNormalizer.xrayTransitionSet(identifier);
  }

  @Override
  protected void resolveValue(XrayTransitionSet transitionSet, SelectBuilder builder, String table, String column)
      throws ResolutionException {
    if (executor == null) {
      throw new ResolutionException(
          String.format("Matching %s needs a database connection", transitionSet));
    }
    // Only touch the builder once the match is known, so a failed match leaves it as it was.
    int transitionSetId = matcher.match(transitionSet, executor);
    builder.addJoin(Schema.XRAY_TRANSITIONSET, Schema.ID, table, column);
    builder.addWhere(Schema.XRAY_TRANSITIONSET, Schema.ID, "=", transitionSetId);
  }

  @Override
  protected void resolveLabel(String label, SelectBuilder builder, String table, String column) {
    addNotationFilter(builder, Schema.XRAY_TRANSITIONSET_NOTATION, Schema.XRAY_TRANSITIONSET_ID,
        table, column, label);
  }
}
