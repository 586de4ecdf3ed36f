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

import com.act.xray.sql.SelectBuilder;

/**
 * Turns an identifier of one entity kind into joins and filters on a {@link SelectBuilder}.  Resolvers only add to
 * the builder, so several of them can be combined into one query.
 */
public interface EntityResolver {

  EntityKind getKind();

  /**
   * Restricts the rows of {@code table} to those whose {@code column} references the entity named by
   * {@code identifier}.
   *
   * @throws UnresolvedIdentifierException if the identifier has none of the shapes accepted for this kind.
   * @throws NotFoundException if no filter can be built for the identifier.
   * @throws ResolutionException if resolution needed the database and the query failed.
   */
  void resolve(Object identifier, SelectBuilder builder, String table, String column) throws ResolutionException;
}
