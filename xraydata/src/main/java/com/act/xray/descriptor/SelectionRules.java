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
 * Selection rules deciding whether an electron can fill a vacancy by emitting a photon.  Adapted from the NIST EPQ
 * library by Nicholas Ritchie.
 */
public class SelectionRules {

  private SelectionRules() {
  }

  /**
   * Returns true if a transition from {@code source} to {@code destination} is allowed as an electric dipole or
   * electric quadrupole transition.  Transitions within the same shell (Coster-Kronig) are never radiative.
   */
  public static boolean isRadiative(AtomicSubshell source, AtomicSubshell destination) {
    if (source.getPrincipalQuantumNumber() == destination.getPrincipalQuantumNumber()) {
      return false;
    }

    return isElectricDipolePermitted(source, destination) || isElectricQuadrupolePermitted(source, destination);
  }

  static boolean isElectricDipolePermitted(AtomicSubshell source, AtomicSubshell destination) {
    int deltaJN = Math.abs(destination.getTotalAngularMomentumNominator() - source.getTotalAngularMomentumNominator());
    if (deltaJN > 2) {
      return false;
    }

    int deltaL = Math.abs(destination.getAzimuthalQuantumNumber() - source.getAzimuthalQuantumNumber());
    return deltaL == 1;
  }

  static boolean isElectricQuadrupolePermitted(AtomicSubshell source, AtomicSubshell destination) {
    int sourceJN = source.getTotalAngularMomentumNominator();
    int destinationJN = destination.getTotalAngularMomentumNominator();
    if (Math.abs(destinationJN - sourceJN) > 4) {
      return false;
    }
    // j = 1/2 -> j = 1/2 is forbidden.
    if (sourceJN == 1 && destinationJN == 1) {
      return false;
    }

    int deltaL = Math.abs(destination.getAzimuthalQuantumNumber() - source.getAzimuthalQuantumNumber());
    return deltaL == 0 || deltaL == 2;
  }
}
