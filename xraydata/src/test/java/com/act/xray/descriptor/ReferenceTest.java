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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

public class ReferenceTest {

  @Test
  public void testReferenceIdentityIsTheBibtexKey() {
    Reference full = Reference.builder("bearden1967")
        .author("J. A. Bearden and A. F. Burr")
        .title("Reevaluation of X-Ray Atomic Energy Levels")
        .journal("Reviews of Modern Physics")
        .year("1967")
        .doi("10.1103/RevModPhys.39.125")
        .build();
    Reference bare = new Reference("bearden1967");

    assertEquals(full, bare);
    assertEquals(full.hashCode(), bare.hashCode());
    assertEquals("1967", full.getYear());
    assertEquals("Reviews of Modern Physics", full.getField(Reference.Field.JOURNAL));
    assertEquals("10.1103/RevModPhys.39.125", full.getDoi());
    assertNull(bare.getAuthor());
    assertEquals(0, bare.getFields().size());
    assertEquals("Reference(bearden1967)", full.toString());
  }

  @Test
  public void testSettingAFieldToNullClearsIt() {
    Reference reference = Reference.builder("doe2016").author("Doe").set(Reference.Field.AUTHOR, null).build();
    assertNull(reference.getAuthor());
  }

  @Test(expected = ValidationException.class)
  public void testEmptyKeyIsRejected() {
    new Reference("");
  }
}
