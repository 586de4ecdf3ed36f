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

package com.act.xray.descriptor;

import org.apache.commons.lang3.tuple.Pair;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * An unordered group of transitions that is reported as a single line (e.g. Ka = K-L2 + K-L3).  Duplicated
 * transitions collapse into one member, and equality is set equality.
 */
public final class XrayTransitionSet {
  private final Set<XrayTransition> transitions;

  public XrayTransitionSet(Collection<XrayTransition> transitions) {
    Set<XrayTransition> members = new LinkedHashSet<>();
    if (transitions != null) {
      for (XrayTransition transition : transitions) {
        if (transition == null) {
          throw new ValidationException("Transition", "not null", null);
        }
        members.add(transition);
      }
    }

    if (members.isEmpty()) {
      throw new ValidationException("Transitions", "at least one transition", 0);
    }

    this.transitions = Collections.unmodifiableSet(members);
  }

  public XrayTransitionSet(XrayTransition... transitions) {
    this(Arrays.asList(transitions));
  }

  public static XrayTransitionSet fromSubshellPairs(Collection<Pair<AtomicSubshell, AtomicSubshell>> pairs) {
    List<XrayTransition> transitions = new ArrayList<>(pairs.size());
    for (Pair<AtomicSubshell, AtomicSubshell> pair : pairs) {
      transitions.add(new XrayTransition(pair.getLeft(), pair.getRight()));
    }
    return new XrayTransitionSet(transitions);
  }

  /**
   * Each row holds the six quantum numbers (source n, l, 2j, destination n, l, 2j) of one transition.
   */
  public static XrayTransitionSet fromQuantumNumbers(int[]... rows) {
    List<XrayTransition> transitions = new ArrayList<>(rows == null ? 0 : rows.length);
    for (int[] row : rows == null ? new int[0][] : rows) {
      if (row == null) {
        throw new ValidationException("Transition quantum numbers", "not null", null);
      }
      if (row.length != 6) {
        throw new ValidationException("Transition quantum numbers", "6 values", row.length);
      }
      transitions.add(new XrayTransition(row[0], row[1], row[2], row[3], row[4], row[5]));
    }
    return new XrayTransitionSet(transitions);
  }

  public Set<XrayTransition> getTransitions() {
    return transitions;
  }

  public int size() {
    return transitions.size();
  }

  public boolean contains(XrayTransition transition) {
    return transitions.contains(transition);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    XrayTransitionSet that = (XrayTransitionSet) o;
    return transitions.equals(that.transitions);
  }

  @Override
  public int hashCode() {
    return transitions.hashCode();
  }

  @Override
  public String toString() {
    return String.format("XrayTransitionSet(%d possible transitions)", transitions.size());
  }
}
