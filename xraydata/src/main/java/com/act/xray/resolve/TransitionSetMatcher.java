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
import com.act.xray.descriptor.XrayTransitionSet;
import com.act.xray.sql.QueryExecutor;
import com.act.xray.sql.Schema;
import com.act.xray.sql.SelectBuilder;
import com.act.xray.sql.SqlQuery;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;

/**
 * Finds the stored transition set whose members are exactly a given set of transitions.
 *
 * No single join expresses set equality, so the lookup runs in rounds: for each requested transition, fetch the ids
 * (and cached member counts) of every stored set containing it, and intersect these ids across rounds.  A set that
 * survives every round contains all requested transitions; keeping only those whose member count equals the number
 * of requested transitions drops the strict supersets.
 */
public class TransitionSetMatcher {
  private static final Logger LOGGER = LogManager.getFormatterLogger(TransitionSetMatcher.class);

  /**
   * @param transitions an {@link XrayTransitionSet} or a collection of transitions in any shape accepted by
   *                    {@link IdentifierNormalizer#xrayTransitionSet(Object)}, except a notation string.
   * @return the surrogate key of the matching transition set.
   */
  public int match(Object transitions, QueryExecutor executor) throws ResolutionException {
    Identifier<XrayTransitionSet> identifier = IdentifierNormalizer.xrayTransitionSet(transitions);
    if (identifier.getForm() != Identifier.Form.VALUE) {
      throw new UnresolvedIdentifierException(EntityKind.XRAY_TRANSITIONSET, transitions);
    }
    return match(identifier.getValue(), executor);
  }

  public int match(XrayTransitionSet transitionSet, QueryExecutor executor) throws ResolutionException {
    // Transition set id -> number of members.
    Map<Integer, Integer> candidates = null;
    for (XrayTransition transition : transitionSet.getTransitions()) {
      if (Thread.currentThread().isInterrupted()) {
        throw new CancellationException(String.format("Interrupted while matching %s", transitionSet));
      }

      Map<Integer, Integer> containing = findSetsContaining(transition, executor);
      if (candidates == null) {
        candidates = new LinkedHashMap<>(containing);
      } else {
        candidates.keySet().retainAll(containing.keySet());
      }
      LOGGER.debug("%d transition set(s) left after matching %s", candidates.size(), transition);

      if (candidates.isEmpty()) {
        throw new NotFoundException(EntityKind.XRAY_TRANSITIONSET, transitionSet);
      }
    }

    List<Integer> matches = new ArrayList<>();
    for (Map.Entry<Integer, Integer> candidate : candidates.entrySet()) {
      if (candidate.getValue() == transitionSet.size()) {
        matches.add(candidate.getKey());
      }
    }
    Collections.sort(matches);

    if (matches.isEmpty()) {
      LOGGER.debug("Only strict supersets of %s are stored: %s", transitionSet, candidates.keySet());
      throw new NotFoundException(EntityKind.XRAY_TRANSITIONSET, transitionSet);
    }
    if (matches.size() > 1) {
      LOGGER.error("Duplicated transition sets %s for %s", matches, transitionSet);
      throw new AmbiguousMatchException(EntityKind.XRAY_TRANSITIONSET, transitionSet, matches);
    }
    return matches.get(0);
  }

  private Map<Integer, Integer> findSetsContaining(XrayTransition transition, QueryExecutor executor)
      throws ResolutionException {
    SqlQuery query = buildMembershipQuery(transition);
    List<List<Object>> rows;
    try {
      rows = executor.executeQuery(query);
    } catch (SQLException e) {
      throw new ResolutionException(
          String.format("Unable to fetch the transition sets containing %s", transition), e);
    }

    Map<Integer, Integer> result = new HashMap<>();
    for (List<Object> row : rows) {
      result.put(((Number) row.get(0)).intValue(), ((Number) row.get(1)).intValue());
    }
    return result;
  }

  /**
   * @return a query selecting (transition set id, member count) for every stored set having {@code transition} as a
   * member.
   */
  static SqlQuery buildMembershipQuery(XrayTransition transition) {
    SelectBuilder builder = new SelectBuilder();
    builder.addSelect(Schema.XRAY_TRANSITIONSET_ASSOCIATION, Schema.XRAY_TRANSITIONSET_ID);
    builder.addSelect(Schema.XRAY_TRANSITIONSET, Schema.COUNT);
    builder.addFrom(Schema.XRAY_TRANSITIONSET_ASSOCIATION);
    builder.addJoin(Schema.XRAY_TRANSITIONSET, Schema.ID,
        Schema.XRAY_TRANSITIONSET_ASSOCIATION, Schema.XRAY_TRANSITIONSET_ID);
    XrayTransitionResolver.addTransitionFilter(builder,
        Schema.XRAY_TRANSITIONSET_ASSOCIATION, Schema.XRAY_TRANSITION_ID, transition);
    return builder.build();
  }
}
