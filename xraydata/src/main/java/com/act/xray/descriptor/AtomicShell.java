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

/**
 * An electron shell (K, L, M, ...), identified by its principal quantum number.
 */
public final class AtomicShell implements Comparable<AtomicShell> {
  private final int principalQuantumNumber;

  public AtomicShell(int principalQuantumNumber) {
    if (principalQuantumNumber < 1) {
      throw new ValidationException("Principal quantum number", "in [1, inf[", principalQuantumNumber);
    }
    this.principalQuantumNumber = principalQuantumNumber;
  }

  public int getPrincipalQuantumNumber() {
    return principalQuantumNumber;
  }

  public int getN() {
    return principalQuantumNumber;
  }

  @Override
  public int compareTo(AtomicShell o) {
    return Integer.compare(principalQuantumNumber, o.principalQuantumNumber);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    AtomicShell that = (AtomicShell) o;
    return principalQuantumNumber == that.principalQuantumNumber;
  }

  @Override
  public int hashCode() {
    return Integer.hashCode(principalQuantumNumber);
  }

  @Override
  public String toString() {
    return String.format("AtomicShell(n=%d)", principalQuantumNumber);
  }
}
