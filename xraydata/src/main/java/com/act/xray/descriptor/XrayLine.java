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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A characteristic X-ray line of an element: the transitions it is made of, its IUPAC and Siegbahn labels, and its
 * energy.  Lines order by element, then by energy.
 */
public final class XrayLine implements Comparable<XrayLine> {
  private final Element element;
  private final List<XrayTransition> transitions;
  private final String iupac;
  private final String siegbahn;
  private final double energyEV;

  public XrayLine(Element element, Collection<XrayTransition> transitions, String iupac, String siegbahn,
                  double energyEV) {
    if (element == null) {
      throw new ValidationException("Element", "not null", null);
    }
    if (transitions == null || transitions.isEmpty()) {
      throw new ValidationException("Transitions", "at least one transition", 0);
    }
    List<XrayTransition> copy = new ArrayList<>(transitions.size());
    for (XrayTransition transition : transitions) {
      if (transition == null) {
        throw new ValidationException("Transition", "not null", null);
      }
      copy.add(transition);
    }
    if (iupac == null || iupac.isEmpty()) {
      throw new ValidationException("IUPAC notation", "not empty", iupac);
    }
    if (siegbahn == null || siegbahn.isEmpty()) {
      throw new ValidationException("Siegbahn notation", "not empty", siegbahn);
    }
    if (Double.isNaN(energyEV) || Double.isInfinite(energyEV)) {
      throw new ValidationException("Energy (eV)", "finite", energyEV);
    }

    this.element = element;
    this.transitions = Collections.unmodifiableList(copy);
    this.iupac = iupac;
    this.siegbahn = siegbahn;
    this.energyEV = energyEV;
  }

  public XrayLine(int atomicNumber, Collection<XrayTransition> transitions, String iupac, String siegbahn,
                  double energyEV) {
    this(new Element(atomicNumber), transitions, iupac, siegbahn, energyEV);
  }

  public Element getElement() {
    return element;
  }

  public int getAtomicNumber() {
    return element.getAtomicNumber();
  }

  public int getZ() {
    return element.getAtomicNumber();
  }

  public List<XrayTransition> getTransitions() {
    return transitions;
  }

  public String getIupac() {
    return iupac;
  }

  public String getSiegbahn() {
    return siegbahn;
  }

  public double getEnergyEV() {
    return energyEV;
  }

  @Override
  public int compareTo(XrayLine o) {
    int result = element.compareTo(o.element);
    if (result != 0) {
      return result;
    }
    result = Double.compare(energyEV, o.energyEV);
    if (result != 0) {
      return result;
    }
    return iupac.compareTo(o.iupac);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    XrayLine that = (XrayLine) o;
    return Double.compare(energyEV, that.energyEV) == 0 && element.equals(that.element) &&
        transitions.equals(that.transitions) && iupac.equals(that.iupac) && siegbahn.equals(that.siegbahn);
  }

  @Override
  public int hashCode() {
    return Objects.hash(element, transitions, iupac, siegbahn, energyEV);
  }

  @Override
  public String toString() {
    return String.format("XrayLine(%s)", iupac);
  }
}
