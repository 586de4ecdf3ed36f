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

import org.apache.commons.lang3.tuple.Pair;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class XrayTransitionSetTest {
  private static final AtomicSubshell K = new AtomicSubshell(1, 0, 1);
  private static final AtomicSubshell L2 = new AtomicSubshell(2, 1, 1);
  private static final AtomicSubshell L3 = new AtomicSubshell(2, 1, 3);

  private static final XrayTransition KL2 = new XrayTransition(L2, K);
  private static final XrayTransition KL3 = new XrayTransition(L3, K);

  @Test
  public void testDuplicatesCollapseAndOrderIsIrrelevant() {
    XrayTransitionSet withDuplicate = new XrayTransitionSet(KL2, KL2, KL3);
    XrayTransitionSet reversed = new XrayTransitionSet(KL3, KL2);

    assertEquals(2, withDuplicate.size());
    assertEquals(withDuplicate, reversed);
    assertEquals(withDuplicate.hashCode(), reversed.hashCode());
    assertTrue(withDuplicate.contains(KL2));
    assertTrue(withDuplicate.contains(KL3));
  }

  @Test
  public void testTransitionsExpressedDifferentlyCollapse() {
    XrayTransitionSet fromPairs = XrayTransitionSet.fromSubshellPairs(Arrays.asList(
        Pair.of(L2, K), Pair.of(new AtomicSubshell(2, 1, 1), new AtomicSubshell(1, 0, 1)), Pair.of(L3, K)));
    XrayTransitionSet fromQuantumNumbers = XrayTransitionSet.fromQuantumNumbers(
        new int[] {2, 1, 1, 1, 0, 1}, new int[] {2, 1, 3, 1, 0, 1}, new int[] {2, 1, 3, 1, 0, 1});

    assertEquals(2, fromPairs.size());
    assertEquals(fromPairs, fromQuantumNumbers);
    assertEquals(new XrayTransitionSet(KL2, KL3), fromPairs);
  }

  @Test
  public void testSubsetIsNotEqual() {
    assertNotEquals(new XrayTransitionSet(KL2), new XrayTransitionSet(KL2, KL3));
    assertFalse(new XrayTransitionSet(KL2).contains(KL3));
  }

  @Test
  public void testEmptySetIsRejected() {
    try {
      new XrayTransitionSet(Collections.<XrayTransition>emptyList());
      fail("An empty transition set should not be valid");
    } catch (ValidationException e) {
      assertEquals("Transitions", e.getField());
    }
  }

  @Test(expected = ValidationException.class)
  public void testQuantumNumberRowsMustHaveSixValues() {
    XrayTransitionSet.fromQuantumNumbers(new int[] {2, 1, 1, 1, 0});
  }

  @Test
  public void testNullQuantumNumberRowIsRejected() {
    try {
      XrayTransitionSet.fromQuantumNumbers(new int[] {2, 1, 1, 1, 0, 1}, null);
      fail("A missing row is not a transition");
    } catch (ValidationException e) {
      assertEquals("Transition quantum numbers", e.getField());
      assertEquals("not null", e.getConstraint());
    }
  }

  @Test(expected = UnsupportedOperationException.class)
  public void testTransitionsCannotBeModified() {
    new XrayTransitionSet(KL2).getTransitions().add(KL3);
  }
}
