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
 * A chemical element, identified by its atomic number.
 */
public final class Element implements Comparable<Element> {
  public static final int MIN_ATOMIC_NUMBER = 1;
  public static final int MAX_ATOMIC_NUMBER = 118;

  private final int atomicNumber;

  public Element(int atomicNumber) {
    if (atomicNumber < MIN_ATOMIC_NUMBER || atomicNumber > MAX_ATOMIC_NUMBER) {
      throw new ValidationException("Atomic number",
          String.format("in [%d, %d]", MIN_ATOMIC_NUMBER, MAX_ATOMIC_NUMBER), atomicNumber);
    }
    this.atomicNumber = atomicNumber;
  }

  public int getAtomicNumber() {
    return atomicNumber;
  }

  public int getZ() {
    return atomicNumber;
  }

  @Override
  public int compareTo(Element o) {
    return Integer.compare(atomicNumber, o.atomicNumber);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    Element that = (Element) o;
    return atomicNumber == that.atomicNumber;
  }

  @Override
  public int hashCode() {
    return Integer.hashCode(atomicNumber);
  }

  @Override
  public String toString() {
    return String.format("Element(z=%d)", atomicNumber);
  }
}
