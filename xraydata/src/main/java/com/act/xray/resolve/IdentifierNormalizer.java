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

import com.act.xray.descriptor.AtomicShell;
import com.act.xray.descriptor.AtomicSubshell;
import com.act.xray.descriptor.Element;
import com.act.xray.descriptor.Language;
import com.act.xray.descriptor.Notation;
import com.act.xray.descriptor.Reference;
import com.act.xray.descriptor.XrayTransition;
import com.act.xray.descriptor.XrayTransitionSet;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.lang3.tuple.Triple;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Classifies the raw identifiers callers pass in (descriptors, integers, quantum number tuples or strings) into an
 * {@link Identifier}.  The accepted shapes are:
 * <ul>
 *   <li>element: {@link Element}, atomic number, or name/symbol string;</li>
 *   <li>atomic shell: {@link AtomicShell}, principal quantum number, or notation string;</li>
 *   <li>atomic subshell: {@link AtomicSubshell}, (n, l, 2j) as an int[3], a List of 3 integers or a {@link Triple},
 *   or notation string;</li>
 *   <li>X-ray transition: {@link XrayTransition}, a {@link Pair} or 2-element List of subshells in any accepted
 *   non-string shape, the six quantum numbers as an int[6] or List of 6 integers, or notation string;</li>
 *   <li>X-ray transition set: {@link XrayTransitionSet}, a Collection of transitions in any accepted non-string
 *   shape, or notation string;</li>
 *   <li>notation, language and reference: the descriptor or its key as a string.  A null or empty reference means none
 *   was specified.</li>
 * </ul>
 * Anything else is rejected with an {@link UnresolvedIdentifierException}; out-of-range quantum numbers are rejected
 * by the descriptor constructors with a {@link com.act.xray.descriptor.ValidationException}.
 */
public class IdentifierNormalizer {

  private IdentifierNormalizer() {
  }

  public static Identifier<?> normalize(EntityKind kind, Object identifier) throws UnresolvedIdentifierException {
    switch (kind) {
      case ELEMENT:
        return element(identifier);
      case ATOMIC_SHELL:
        return atomicShell(identifier);
      case ATOMIC_SUBSHELL:
        return atomicSubshell(identifier);
      case XRAY_TRANSITION:
        return xrayTransition(identifier);
      case XRAY_TRANSITIONSET:
        return xrayTransitionSet(identifier);
      case NOTATION:
        return notation(identifier);
      case LANGUAGE:
        return language(identifier);
      case REFERENCE:
        return reference(identifier);
      default:
        throw new UnresolvedIdentifierException(kind, identifier);
    }
  }

  public static Identifier<Element> element(Object identifier) throws UnresolvedIdentifierException {
    if (identifier instanceof Element) {
      return Identifier.ofValue(EntityKind.ELEMENT, (Element) identifier);
    }
    Integer atomicNumber = asInteger(identifier);
    if (atomicNumber != null) {
      return Identifier.ofValue(EntityKind.ELEMENT, new Element(atomicNumber));
    }
    if (isLabel(identifier)) {
      return Identifier.ofLabel(EntityKind.ELEMENT, (String) identifier);
    }
    throw new UnresolvedIdentifierException(EntityKind.ELEMENT, identifier);
  }

  public static Identifier<AtomicShell> atomicShell(Object identifier) throws UnresolvedIdentifierException {
    if (identifier instanceof AtomicShell) {
      return Identifier.ofValue(EntityKind.ATOMIC_SHELL, (AtomicShell) identifier);
    }
    Integer n = asInteger(identifier);
    if (n != null) {
      return Identifier.ofValue(EntityKind.ATOMIC_SHELL, new AtomicShell(n));
    }
    if (isLabel(identifier)) {
      return Identifier.ofLabel(EntityKind.ATOMIC_SHELL, (String) identifier);
    }
    throw new UnresolvedIdentifierException(EntityKind.ATOMIC_SHELL, identifier);
  }

  public static Identifier<AtomicSubshell> atomicSubshell(Object identifier) throws UnresolvedIdentifierException {
    if (isLabel(identifier)) {
      return Identifier.ofLabel(EntityKind.ATOMIC_SUBSHELL, (String) identifier);
    }
    AtomicSubshell subshell = asAtomicSubshell(identifier);
    if (subshell == null) {
      throw new UnresolvedIdentifierException(EntityKind.ATOMIC_SUBSHELL, identifier);
    }
    return Identifier.ofValue(EntityKind.ATOMIC_SUBSHELL, subshell);
  }

  public static Identifier<XrayTransition> xrayTransition(Object identifier) throws UnresolvedIdentifierException {
    if (isLabel(identifier)) {
      return Identifier.ofLabel(EntityKind.XRAY_TRANSITION, (String) identifier);
    }
    XrayTransition transition = asXrayTransition(identifier);
    if (transition == null) {
      throw new UnresolvedIdentifierException(EntityKind.XRAY_TRANSITION, identifier);
    }
    return Identifier.ofValue(EntityKind.XRAY_TRANSITION, transition);
  }

  public static Identifier<XrayTransitionSet> xrayTransitionSet(Object identifier)
      throws UnresolvedIdentifierException {
    if (isLabel(identifier)) {
      return Identifier.ofLabel(EntityKind.XRAY_TRANSITIONSET, (String) identifier);
    }
    if (identifier instanceof XrayTransitionSet) {
      return Identifier.ofValue(EntityKind.XRAY_TRANSITIONSET, (XrayTransitionSet) identifier);
    }
    if (identifier instanceof Collection) {
      Collection<?> members = (Collection<?>) identifier;
      List<XrayTransition> transitions = new ArrayList<>(members.size());
      for (Object member : members) {
        XrayTransition transition = asXrayTransition(member);
        if (transition == null) {
          throw new UnresolvedIdentifierException(EntityKind.XRAY_TRANSITIONSET, identifier);
        }
        transitions.add(transition);
      }
      // An empty collection is rejected here by the descriptor.
      return Identifier.ofValue(EntityKind.XRAY_TRANSITIONSET, new XrayTransitionSet(transitions));
    }
    throw new UnresolvedIdentifierException(EntityKind.XRAY_TRANSITIONSET, identifier);
  }

  public static Identifier<Notation> notation(Object identifier) throws UnresolvedIdentifierException {
    if (identifier instanceof Notation) {
      return Identifier.ofValue(EntityKind.NOTATION, (Notation) identifier);
    }
    if (identifier instanceof String) {
      return Identifier.ofValue(EntityKind.NOTATION, new Notation((String) identifier));
    }
    throw new UnresolvedIdentifierException(EntityKind.NOTATION, identifier);
  }

  public static Identifier<Language> language(Object identifier) throws UnresolvedIdentifierException {
    if (identifier instanceof Language) {
      return Identifier.ofValue(EntityKind.LANGUAGE, (Language) identifier);
    }
    if (identifier instanceof String) {
      return Identifier.ofValue(EntityKind.LANGUAGE, new Language((String) identifier));
    }
    throw new UnresolvedIdentifierException(EntityKind.LANGUAGE, identifier);
  }

  public static Identifier<Reference> reference(Object identifier) throws UnresolvedIdentifierException {
    if (identifier == null || (identifier instanceof String && ((String) identifier).isEmpty())) {
      return Identifier.unspecified(EntityKind.REFERENCE);
    }
    if (identifier instanceof Reference) {
      return Identifier.ofValue(EntityKind.REFERENCE, (Reference) identifier);
    }
    if (identifier instanceof String) {
      return Identifier.ofValue(EntityKind.REFERENCE, new Reference((String) identifier));
    }
    throw new UnresolvedIdentifierException(EntityKind.REFERENCE, identifier);
  }

  private static boolean isLabel(Object identifier) {
    return identifier instanceof String && !((String) identifier).trim().isEmpty();
  }

  /**
   * @return the value of an integral boxed number that fits in an int, or null for anything else (including
   * floating point numbers, which are never rounded).
   */
  private static Integer asInteger(Object o) {
    if (o instanceof Integer || o instanceof Short || o instanceof Byte) {
      return ((Number) o).intValue();
    }
    if (o instanceof Long) {
      long value = (Long) o;
      if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
        return (int) value;
      }
    }
    return null;
  }

  /**
   * @return the integers held by an int[] or a List of integers, or null if the shape does not match.
   */
  private static int[] asIntegers(Object o) {
    if (o instanceof int[]) {
      return (int[]) o;
    }
    if (o instanceof List) {
      List<?> values = (List<?>) o;
      int[] result = new int[values.size()];
      for (int i = 0; i < result.length; i++) {
        Integer value = asInteger(values.get(i));
        if (value == null) {
          return null;
        }
        result[i] = value;
      }
      return result;
    }
    return null;
  }

  private static AtomicSubshell asAtomicSubshell(Object o) {
    if (o instanceof AtomicSubshell) {
      return (AtomicSubshell) o;
    }
    if (o instanceof Triple) {
      Triple<?, ?, ?> triple = (Triple<?, ?, ?>) o;
      Integer n = asInteger(triple.getLeft());
      Integer l = asInteger(triple.getMiddle());
      Integer jN = asInteger(triple.getRight());
      if (n == null || l == null || jN == null) {
        return null;
      }
      return new AtomicSubshell(n, l, jN);
    }
    int[] quantumNumbers = asIntegers(o);
    if (quantumNumbers == null || quantumNumbers.length != 3) {
      return null;
    }
    return new AtomicSubshell(quantumNumbers[0], quantumNumbers[1], quantumNumbers[2]);
  }

  private static XrayTransition asXrayTransition(Object o) {
    if (o instanceof XrayTransition) {
      return (XrayTransition) o;
    }

    Object source = null;
    Object destination = null;
    if (o instanceof Pair) {
      source = ((Pair<?, ?>) o).getLeft();
      destination = ((Pair<?, ?>) o).getRight();
    } else if (o instanceof List && ((List<?>) o).size() == 2) {
      source = ((List<?>) o).get(0);
      destination = ((List<?>) o).get(1);
    }
    if (source != null && destination != null) {
      AtomicSubshell sourceSubshell = asAtomicSubshell(source);
      AtomicSubshell destinationSubshell = asAtomicSubshell(destination);
      if (sourceSubshell == null || destinationSubshell == null) {
        return null;
      }
      return new XrayTransition(sourceSubshell, destinationSubshell);
    }

    int[] quantumNumbers = asIntegers(o);
    if (quantumNumbers == null || quantumNumbers.length != 6) {
      return null;
    }
    return new XrayTransition(quantumNumbers[0], quantumNumbers[1], quantumNumbers[2],
        quantumNumbers[3], quantumNumbers[4], quantumNumbers[5]);
  }
}
