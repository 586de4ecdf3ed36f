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

import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.fail;

public class ElementTest {

  @Test
  public void testEveryKnownAtomicNumberIsValid() {
    for (int z = 1; z <= 118; z++) {
      Element element = new Element(z);
      assertEquals(z, element.getAtomicNumber());
      assertEquals(z, element.getZ());
    }
  }

  @Test
  public void testAtomicNumberOutOfRange() {
    for (int z : new int[] {0, 119, -5}) {
      try {
        new Element(z);
        fail(String.format("Element(%d) should not be valid", z));
      } catch (ValidationException e) {
        assertEquals("Atomic number", e.getField());
        assertEquals(z, e.getActual());
        assertEquals("in [1, 118]", e.getConstraint());
      }
    }
  }

  @Test
  public void testEqualityAndOrder() {
    assertEquals(new Element(26), new Element(26));
    assertEquals(new Element(26).hashCode(), new Element(26).hashCode());
    assertNotEquals(new Element(26), new Element(29));

    List<Element> elements = new ArrayList<>(Arrays.asList(new Element(29), new Element(1), new Element(26)));
    Collections.sort(elements);
    assertEquals(Arrays.asList(new Element(1), new Element(26), new Element(29)), elements);
  }

  @Test
  public void testToString() {
    assertEquals("Element(z=26)", new Element(26).toString());
  }
}
