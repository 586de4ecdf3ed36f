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

import java.util.Arrays;

/**
 * Thrown when an identifier does not have any of the shapes accepted for its entity kind.
 */
public class UnresolvedIdentifierException extends ResolutionException {
  private final EntityKind kind;
  private final Object identifier;

  public UnresolvedIdentifierException(EntityKind kind, Object identifier) {
    super(String.format("Cannot parse %s: %s", kind, describe(identifier)));
    this.kind = kind;
    this.identifier = identifier;
  }

  public EntityKind getKind() {
    return kind;
  }

  public Object getIdentifier() {
    return identifier;
  }

  static String describe(Object identifier) {
    if (identifier instanceof int[]) {
      return Arrays.toString((int[]) identifier);
    }
    return String.valueOf(identifier);
  }
}
