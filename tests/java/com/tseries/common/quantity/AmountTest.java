// =================================================================================================
// Copyright 2011 Twitter, Inc.
// -------------------------------------------------------------------------------------------------
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this work except in compliance with the License.
// You may obtain a copy of the License in the LICENSE file, or at:
//
//  http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
// =================================================================================================

package com.tseries.common.quantity;

import com.google.common.collect.Lists;
import com.google.common.collect.Ordering;
import com.google.common.testing.EqualsTester;
import com.google.common.testing.SerializableTester;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class AmountTest {

  @Test
  public void testEquals() {
    new EqualsTester()
        .addEqualityGroup(Amount.of(1, Time.DAYS), Amount.of(24, Time.HOURS),
            Amount.of(1440, Time.MINUTES))
        .addEqualityGroup(Amount.of(25, Time.HOURS))
        .addEqualityGroup(Amount.of(0, Time.NANOSECONDS), Amount.of(0, Time.DAYS))
        .testEquals();
  }

  @Test
  public void testConversionIsExactTowardFinerUnits() {
    assertEquals(86400000000000L, Amount.of(1, Time.DAYS).as(Time.NANOSECONDS));
    assertEquals(90, Amount.of(90, Time.MINUTES).as(Time.MINUTES));
    assertEquals("coarser units truncate toward zero",
        1, Amount.of(119, Time.MINUTES).as(Time.HOURS));
    assertEquals(-1, Amount.of(-119, Time.MINUTES).as(Time.HOURS));
  }

  @Test(expected = ArithmeticException.class)
  public void testConversionOverflow() {
    Amount.of(Long.MAX_VALUE / 2, Time.DAYS).asBaseUnits();
  }

  @Test
  public void testComparisonMixedUnits() {
    assertTrue(Amount.of(1, Time.MINUTES).compareTo(Amount.of(59, Time.SECONDS)) > 0);
    assertTrue(Amount.of(1, Time.MINUTES).compareTo(Amount.of(60, Time.SECONDS)) == 0);
    assertTrue(Amount.of(1, Time.MINUTES).compareTo(Amount.of(61, Time.SECONDS)) < 0);
  }

  @Test
  public void testOrderingMixedUnits() {
    assertEquals(
        Lists.newArrayList(
            Amount.of(1, Time.MILLISECONDS),
            Amount.of(1, Time.SECONDS),
            Amount.of(1, Time.HOURS),
            Amount.of(60, Time.MINUTES)),
        Ordering.natural().sortedCopy(Lists.newArrayList(
            Amount.of(1, Time.HOURS),
            Amount.of(1, Time.SECONDS),
            Amount.of(60, Time.MINUTES),
            Amount.of(1, Time.MILLISECONDS))));
  }

  @Test
  public void testNegate() {
    assertEquals(Amount.of(-2, Time.HOURS), Amount.of(2, Time.HOURS).negate());
    assertFalse(Amount.of(2, Time.HOURS).equals(Amount.of(2, Time.HOURS).negate()));
  }

  @Test
  public void testSerializable() {
    SerializableTester.reserializeAndAssert(Amount.of(3, Time.MINUTES));
  }

  @Test
  public void testToString() {
    assertEquals("2 hrs", Amount.of(2, Time.HOURS).toString());
  }

  @Test
  public void testAliases() {
    assertEquals("H", Time.HOURS.getAlias());
    assertEquals("T", Time.MINUTES.getAlias());
    assertEquals("L", Time.MILLISECONDS.getAlias());
    assertEquals(3600000000000L, Time.HOURS.multiplier());
  }
}
