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

import com.act.xray.sql.QueryExecutor;
import com.act.xray.sql.SelectBuilder;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * One resolver per {@link EntityKind}, sharing a query executor (for transition set matching) and the reference
 * defaults.  Instances hold no per-query state and can be shared between threads as long as the executor can.
 */
public class Resolvers {
  private final Map<EntityKind, EntityResolver> resolvers;
  private final TransitionSetMatcher matcher = new TransitionSetMatcher();
  private final QueryExecutor executor;

  /**
   * @param executor may be null when no database is available; transition sets can then only be resolved by
   *                 notation.
   */
  public Resolvers(QueryExecutor executor, ReferencePreferences preferences) {
    this.executor = executor;
    Map<EntityKind, EntityResolver> map = new EnumMap<>(EntityKind.class);
    for (EntityKind kind : EntityKind.values()) {
      map.put(kind, createResolver(kind, preferences));
    }
    this.resolvers = Collections.unmodifiableMap(map);
  }

  private EntityResolver createResolver(EntityKind kind, ReferencePreferences preferences) {
    switch (kind) {
      case ELEMENT:
        return new ElementResolver();
      case ATOMIC_SHELL:
        return new AtomicShellResolver();
      case ATOMIC_SUBSHELL:
        return new AtomicSubshellResolver();
      case XRAY_TRANSITION:
        return new XrayTransitionResolver();
      case XRAY_TRANSITIONSET:
        return new XrayTransitionSetResolver(matcher, executor);
      case NOTATION:
        return new NotationResolver();
      case LANGUAGE:
        return new LanguageResolver();
      case REFERENCE:
        return new ReferenceResolver(preferences);
      default:
        throw new IllegalStateException(String.format("No resolver for %s", kind));
    }
  }

  public EntityResolver get(EntityKind kind) {
    return resolvers.get(kind);
  }

  public void resolve(EntityKind kind, Object identifier, SelectBuilder builder, String table, String column)
      throws ResolutionException {
    get(kind).resolve(identifier, builder, table, column);
  }

  /**
   * @return the surrogate key of the stored transition set made of exactly {@code transitions}.
   */
  public int matchTransitionSet(Object transitions) throws ResolutionException {
    if (executor == null) {
      throw new ResolutionException("Matching transition sets needs a database connection");
    }
    return matcher.match(transitions, executor);
  }
}
