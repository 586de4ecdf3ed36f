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

package com.act.xray.tools;

import com.act.xray.resolve.EntityKind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns command line text into the raw identifier shapes understood by
 * {@link com.act.xray.resolve.IdentifierNormalizer}:
 * <ul>
 *   <li>{@code 26}: an integer (elements and shells);</li>
 *   <li>{@code 2,1,3}: an (n, l, 2j) subshell;</li>
 *   <li>{@code 2,1,3->1,0,1}: a transition from the first subshell to the second;</li>
 *   <li>{@code 2,1,3->1,0,1;2,1,1->1,0,1}: a set of transitions.</li>
 * </ul>
 * Any other text is passed through as a name or notation.
 */
public class IdentifierParser {
  private static final String NUMBER = "\\s*(-?\\d{1,9})\\s*";
  private static final String TRIPLE = NUMBER + "," + NUMBER + "," + NUMBER;

  private static final Pattern INTEGER_PATTERN = Pattern.compile("^" + NUMBER + "$");
  private static final Pattern SUBSHELL_PATTERN = Pattern.compile("^" + TRIPLE + "$");
  private static final Pattern TRANSITION_PATTERN = Pattern.compile("^" + TRIPLE + "->" + TRIPLE + "$");

  private IdentifierParser() {
  }

  public static Object parse(EntityKind kind, String text) {
    if (text == null) {
      return null;
    }

    switch (kind) {
      case ELEMENT:
      case ATOMIC_SHELL: {
        Matcher matcher = INTEGER_PATTERN.matcher(text);
        return matcher.matches() ? Integer.valueOf(matcher.group(1)) : text;
      }
      case ATOMIC_SUBSHELL: {
        Matcher matcher = SUBSHELL_PATTERN.matcher(text);
        return matcher.matches() ? integers(matcher, 1, 3) : text;
      }
      case XRAY_TRANSITION: {
        List<List<Integer>> transition = parseTransition(text);
        return transition == null ? text : transition;
      }
      case XRAY_TRANSITIONSET: {
        List<List<List<Integer>>> transitions = new ArrayList<>();
        for (String part : text.split(";")) {
          List<List<Integer>> transition = parseTransition(part);
          if (transition == null) {
            return text;
          }
          transitions.add(transition);
        }
        return transitions;
      }
      default:
        return text;
    }
  }

  private static List<List<Integer>> parseTransition(String text) {
    Matcher matcher = TRANSITION_PATTERN.matcher(text);
    if (!matcher.matches()) {
      return null;
    }
    return Arrays.asList(integers(matcher, 1, 3), integers(matcher, 4, 3));
  }

  private static List<Integer> integers(Matcher matcher, int firstGroup, int count) {
    List<Integer> values = new ArrayList<>(count);
    for (int i = firstGroup; i < firstGroup + count; i++) {
      values.add(Integer.valueOf(matcher.group(i)));
    }
    return values;
  }
}
