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
 * Thrown when a descriptor is constructed with a value outside of its physical range.
 */
public class ValidationException extends IllegalArgumentException {
  private final String field;
  private final String constraint;
  private final Object actual;

  public ValidationException(String field, String constraint, Object actual) {
    super(String.format("%s (%s) must be %s", field, actual, constraint));
    this.field = field;
    this.constraint = constraint;
    this.actual = actual;
  }

  public String getField() {
    return field;
  }

  public String getConstraint() {
    return constraint;
  }

  public Object getActual() {
    return actual;
  }
}
