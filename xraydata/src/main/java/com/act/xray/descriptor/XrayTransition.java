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

import java.util.Comparator;
import java.util.Objects;

/**
 * A transition of an electron from a source subshell to a destination subshell (the subshell holding the vacancy).
 * Two transitions are equal when their subshells are, however they were constructed.
 */
public final class XrayTransition implements Comparable<XrayTransition> {
  private static final Comparator<XrayTransition> ORDER =
      Comparator.comparing(XrayTransition::getSourceSubshell)
          .thenComparing(XrayTransition::getDestinationSubshell);

  private final AtomicSubshell sourceSubshell;
  private final AtomicSubshell destinationSubshell;

  public XrayTransition(AtomicSubshell sourceSubshell, AtomicSubshell destinationSubshell) {
    this.sourceSubshell = Objects.requireNonNull(sourceSubshell, "sourceSubshell");
    this.destinationSubshell = Objects.requireNonNull(destinationSubshell, "destinationSubshell");
  }

  public XrayTransition(int sourceN, int sourceL, int sourceJN, int destinationN, int destinationL, int destinationJN) {
    this(new AtomicSubshell(sourceN, sourceL, sourceJN),
        new AtomicSubshell(destinationN, destinationL, destinationJN));
  }

  /**
   * Builds a transition from two (n, l, 2j) triples.
   */
  public XrayTransition(int[] source, int[] destination) {
    this(subshellFromTriple("Source subshell", source), subshellFromTriple("Destination subshell", destination));
  }

  private static AtomicSubshell subshellFromTriple(String field, int[] quantumNumbers) {
    if (quantumNumbers == null || quantumNumbers.length != 3) {
      throw new ValidationException(field, "a (n, l, 2j) triple",
          quantumNumbers == null ? null : quantumNumbers.length + " values");
    }
    return new AtomicSubshell(quantumNumbers[0], quantumNumbers[1], quantumNumbers[2]);
  }

  public AtomicSubshell getSourceSubshell() {
    return sourceSubshell;
  }

  public AtomicSubshell getDestinationSubshell() {
    return destinationSubshell;
  }

  public boolean isRadiative() {
    return SelectionRules.isRadiative(sourceSubshell, destinationSubshell);
  }

  public boolean isCosterKronig() {
    return sourceSubshell.getPrincipalQuantumNumber() == destinationSubshell.getPrincipalQuantumNumber();
  }

  @Override
  public int compareTo(XrayTransition o) {
    return ORDER.compare(this, o);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    XrayTransition that = (XrayTransition) o;
    if (!sourceSubshell.equals(that.sourceSubshell)) return false;
    return destinationSubshell.equals(that.destinationSubshell);
  }

  @Override
  public int hashCode() {
    int result = sourceSubshell.hashCode();
    result = 31 * result + destinationSubshell.hashCode();
    return result;
  }

  @Override
  public String toString() {
    return String.format("XrayTransition([n=%d, l=%d, j=%.1f] -> [n=%d, l=%d, j=%.1f])",
        sourceSubshell.getN(), sourceSubshell.getL(), sourceSubshell.getTotalAngularMomentum(),
        destinationSubshell.getN(), destinationSubshell.getL(), destinationSubshell.getTotalAngularMomentum());
  }
}
