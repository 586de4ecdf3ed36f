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
 * An electron subshell, characterized by its principal (n), azimuthal (l) and total angular momentum (j) quantum
 * numbers.  j is always a half-integer, so it is stored as its nominator over 2 (2j) to keep equality exact.
 */
public final class AtomicSubshell implements Comparable<AtomicSubshell> {
  private static final Comparator<AtomicSubshell> ORDER =
      Comparator.comparingInt(AtomicSubshell::getPrincipalQuantumNumber)
          .thenComparingInt(AtomicSubshell::getAzimuthalQuantumNumber)
          .thenComparingInt(AtomicSubshell::getTotalAngularMomentumNominator);

  private final AtomicShell atomicShell;
  private final int azimuthalQuantumNumber;
  private final int totalAngularMomentumNominator;

  public AtomicSubshell(int principalQuantumNumber, int azimuthalQuantumNumber, int totalAngularMomentumNominator) {
    this(new AtomicShell(principalQuantumNumber), azimuthalQuantumNumber, totalAngularMomentumNominator);
  }

  public AtomicSubshell(AtomicShell atomicShell, int azimuthalQuantumNumber, int totalAngularMomentumNominator) {
    Objects.requireNonNull(atomicShell, "atomicShell");

    int lmax = atomicShell.getPrincipalQuantumNumber() - 1;
    if (azimuthalQuantumNumber < 0 || azimuthalQuantumNumber > lmax) {
      throw new ValidationException("Azimuthal quantum number", String.format("in [0, %d]", lmax),
          azimuthalQuantumNumber);
    }

    // j = l - 1/2 or l + 1/2, and never negative.
    int jminN = Math.abs(2 * azimuthalQuantumNumber - 1);
    int jmaxN = 2 * azimuthalQuantumNumber + 1;
    if (totalAngularMomentumNominator != jminN && totalAngularMomentumNominator != jmaxN) {
      throw new ValidationException("Total angular momentum nominator", String.format("%d or %d", jminN, jmaxN),
          totalAngularMomentumNominator);
    }

    this.atomicShell = atomicShell;
    this.azimuthalQuantumNumber = azimuthalQuantumNumber;
    this.totalAngularMomentumNominator = totalAngularMomentumNominator;
  }

  public AtomicShell getAtomicShell() {
    return atomicShell;
  }

  public int getPrincipalQuantumNumber() {
    return atomicShell.getPrincipalQuantumNumber();
  }

  public int getAzimuthalQuantumNumber() {
    return azimuthalQuantumNumber;
  }

  public int getTotalAngularMomentumNominator() {
    return totalAngularMomentumNominator;
  }

  public double getTotalAngularMomentum() {
    return totalAngularMomentumNominator / 2.0;
  }

  public int getN() {
    return getPrincipalQuantumNumber();
  }

  public int getL() {
    return azimuthalQuantumNumber;
  }

  public int getJN() {
    return totalAngularMomentumNominator;
  }

  @Override
  public int compareTo(AtomicSubshell o) {
    return ORDER.compare(this, o);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    AtomicSubshell that = (AtomicSubshell) o;
    if (azimuthalQuantumNumber != that.azimuthalQuantumNumber) return false;
    if (totalAngularMomentumNominator != that.totalAngularMomentumNominator) return false;
    return atomicShell.equals(that.atomicShell);
  }

  @Override
  public int hashCode() {
    int result = atomicShell.hashCode();
    result = 31 * result + azimuthalQuantumNumber;
    result = 31 * result + totalAngularMomentumNominator;
    return result;
  }

  @Override
  public String toString() {
    return String.format("AtomicSubshell(n=%d, l=%d, j=%.1f)",
        getPrincipalQuantumNumber(), azimuthalQuantumNumber, getTotalAngularMomentum());
  }
}
