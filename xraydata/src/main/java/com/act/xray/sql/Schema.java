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

package com.act.xray.sql;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Table and column names of the X-ray database.  Every table has an integer surrogate key named {@link #ID}.
 */
public final class Schema {

  private Schema() {
  }

  public static final String ID = "id";

  // Entities
  public static final String ELEMENT = "element";
  public static final String ATOMIC_SHELL = "atomic_shell";
  public static final String ATOMIC_SUBSHELL = "atomic_subshell";
  public static final String XRAY_TRANSITION = "xray_transition";
  public static final String XRAY_TRANSITIONSET = "xray_transitionset";
  public static final String XRAY_TRANSITIONSET_ASSOCIATION = "xray_transitionset_association";
  public static final String LANGUAGE = "language";
  public static final String NOTATION = "notation";
  public static final String REFERENCE = "ref";

  // Columns
  public static final String ATOMIC_NUMBER = "atomic_number";
  public static final String PRINCIPAL_QUANTUM_NUMBER = "principal_quantum_number";
  public static final String AZIMUTHAL_QUANTUM_NUMBER = "azimuthal_quantum_number";
  public static final String TOTAL_ANGULAR_MOMENTUM_NOMINATOR = "total_angular_momentum_nominator";
  public static final String SOURCE_SUBSHELL_ID = "source_subshell_id";
  public static final String DESTINATION_SUBSHELL_ID = "destination_subshell_id";
  public static final String COUNT = "count";
  public static final String CODE = "code";
  public static final String NAME = "name";
  public static final String SYMBOL = "symbol";
  public static final String BIBTEXKEY = "bibtexkey";

  // Foreign keys
  public static final String ELEMENT_ID = "element_id";
  public static final String ATOMIC_SHELL_ID = "atomic_shell_id";
  public static final String ATOMIC_SUBSHELL_ID = "atomic_subshell_id";
  public static final String XRAY_TRANSITION_ID = "xray_transition_id";
  public static final String XRAY_TRANSITIONSET_ID = "xray_transitionset_id";
  public static final String LANGUAGE_ID = "language_id";
  public static final String NOTATION_ID = "notation_id";
  public static final String REFERENCE_ID = "reference_id";

  // Notation renderings
  public static final String ASCII = "ascii";
  public static final String UTF16 = "utf16";

  // Property tables
  public static final String ELEMENT_NAME = "element_name";
  public static final String ELEMENT_SYMBOL = "element_symbol";
  public static final String ELEMENT_ATOMIC_WEIGHT = "element_atomic_weight";
  public static final String ELEMENT_MASS_DENSITY = "element_mass_density";
  public static final String ATOMIC_SHELL_NOTATION = "atomic_shell_notation";
  public static final String ATOMIC_SUBSHELL_NOTATION = "atomic_subshell_notation";
  public static final String ATOMIC_SUBSHELL_BINDING_ENERGY = "atomic_subshell_binding_energy";
  public static final String ATOMIC_SUBSHELL_RADIATIVE_WIDTH = "atomic_subshell_radiative_width";
  public static final String ATOMIC_SUBSHELL_NONRADIATIVE_WIDTH = "atomic_subshell_nonradiative_width";
  public static final String ATOMIC_SUBSHELL_OCCUPANCY = "atomic_subshell_occupancy";
  public static final String XRAY_TRANSITION_NOTATION = "xray_transition_notation";
  public static final String XRAY_TRANSITION_ENERGY = "xray_transition_energy";
  public static final String XRAY_TRANSITION_PROBABILITY = "xray_transition_probability";
  public static final String XRAY_TRANSITION_RELATIVE_WEIGHT = "xray_transition_relative_weight";
  public static final String XRAY_TRANSITIONSET_NOTATION = "xray_transitionset_notation";
  public static final String XRAY_TRANSITIONSET_ENERGY = "xray_transitionset_energy";
  public static final String XRAY_TRANSITIONSET_RELATIVE_WEIGHT = "xray_transitionset_relative_weight";

  public static final Set<String> PROPERTY_TABLES = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(
      ELEMENT_NAME,
      ELEMENT_SYMBOL,
      ELEMENT_ATOMIC_WEIGHT,
      ELEMENT_MASS_DENSITY,
      ATOMIC_SHELL_NOTATION,
      ATOMIC_SUBSHELL_NOTATION,
      ATOMIC_SUBSHELL_BINDING_ENERGY,
      ATOMIC_SUBSHELL_RADIATIVE_WIDTH,
      ATOMIC_SUBSHELL_NONRADIATIVE_WIDTH,
      ATOMIC_SUBSHELL_OCCUPANCY,
      XRAY_TRANSITION_NOTATION,
      XRAY_TRANSITION_ENERGY,
      XRAY_TRANSITION_PROBABILITY,
      XRAY_TRANSITION_RELATIVE_WEIGHT,
      XRAY_TRANSITIONSET_NOTATION,
      XRAY_TRANSITIONSET_ENERGY,
      XRAY_TRANSITIONSET_RELATIVE_WEIGHT
  )));
}
