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

import java.util.Collections;
import java.util.List;

/**
 * Thrown when more than one stored row matches an identifier that should be unique, which means the database holds
 * duplicated rows.
 */
public class AmbiguousMatchException extends ResolutionException {
  private final EntityKind kind;
  private final Object identifier;
  private final List<Integer> candidateIds;

  public AmbiguousMatchException(EntityKind kind, Object identifier, List<Integer> candidateIds) {
    super(String.format("Found %d %s rows for %s (ids %s), expected one",
        candidateIds.size(), kind, UnresolvedIdentifierException.describe(identifier), candidateIds));
    this.kind = kind;
    this.identifier = identifier;
    this.candidateIds = Collections.unmodifiableList(candidateIds);
  }

  public EntityKind getKind() {
    return kind;
  }

  public Object getIdentifier() {
    return identifier;
  }

  public List<Integer> getCandidateIds() {
    return candidateIds;
  }
}
