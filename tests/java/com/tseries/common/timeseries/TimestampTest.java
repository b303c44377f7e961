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

package com.tseries.common.timeseries;

import java.time.LocalDateTime;
import java.time.ZoneId;

import com.google.common.testing.EqualsTester;
import com.google.common.testing.SerializableTester;

import org.junit.Test;

import com.tseries.common.offsets.BusinessDay;
import com.tseries.common.quantity.Amount;
import com.tseries.common.quantity.Time;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class TimestampTest {

  private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");

  @Test
  public void testParse() {
    assertEquals(Timestamp.of(2014, 7, 1), Timestamp.parse("2014-07-01"));
    assertEquals(Timestamp.of(2014, 7, 1, 10, 30), Timestamp.parse("2014-07-01 10:30"));
    assertEquals(Timestamp.of(2014, 7, 1, 10, 30, 15, 5),
        Timestamp.parse("2014-07-01 10:30:15.000000005"));
    assertSame(Timestamp.NOT_A_TIME, Timestamp.parse("NaT"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testParseGarbage() {
    Timestamp.parse("July 1st");
  }

  @Test
  public void testToString() {
    assertEquals("2014-07-01 10:30:00", Timestamp.of(2014, 7, 1, 10, 30).toString());
    assertEquals("2014-07-01 10:30:00.000000005",
        Timestamp.of(2014, 7, 1, 10, 30, 0, 5).toString());
    assertEquals("NaT", Timestamp.NOT_A_TIME.toString());
    assertEquals("2014-07-01 10:30:00 America/New_York",
        Timestamp.of(2014, 7, 1, 10, 30).localize(NEW_YORK).toString());
  }

  @Test
  public void testFields() {
    Timestamp timestamp = Timestamp.of(2014, 7, 5, 13, 0);
    assertEquals(5, timestamp.getDayOfWeek());
    assertEquals(13 * Time.HOURS.multiplier(), timestamp.getNanoOfDay());
    assertEquals(Timestamp.of(2014, 7, 5), timestamp.normalize());
    assertFalse(timestamp.isNormalized());
    assertTrue(timestamp.normalize().isNormalized());
  }

  @Test
  public void testPreEpochFields() {
    Timestamp timestamp = Timestamp.of(1969, 12, 31, 23, 0);
    assertEquals(-1, timestamp.getEpochDay());
    assertEquals(23 * Time.HOURS.multiplier(), timestamp.getNanoOfDay());
    assertEquals(2, timestamp.getDayOfWeek());
  }

  @Test
  public void testLocalizeKeepsWallClock() {
    Timestamp local = Timestamp.of(2014, 7, 1, 10, 0);
    Timestamp aware = local.localize(NEW_YORK);
    assertEquals(local.getValue(), aware.getLocalValue());
    assertEquals(local.getValue() + 4 * Time.HOURS.multiplier(), aware.getValue());
    assertEquals(LocalDateTime.of(2014, 7, 1, 10, 0), aware.toLocalDateTime());
  }

  @Test
  public void testEqualityIncludesZone() {
    Timestamp utc = Timestamp.of(2014, 7, 1);
    new EqualsTester()
        .addEqualityGroup(utc, Timestamp.ofNanos(utc.getValue()))
        .addEqualityGroup(utc.atZone(NEW_YORK))
        .addEqualityGroup(Timestamp.NOT_A_TIME, Timestamp.ofNanos(Timestamp.NAT_VALUE))
        .testEquals();
  }

  @Test
  public void testSerializable() {
    SerializableTester.reserializeAndAssert(Timestamp.of(2014, 7, 1).localize(NEW_YORK));
  }

  @Test
  public void testArithmetic() {
    Timestamp friday = Timestamp.of(2014, 7, 4, 9, 0);
    assertEquals(Timestamp.of(2014, 7, 7, 9, 0), friday.plus(new BusinessDay()));
    assertEquals(Timestamp.of(2014, 7, 3, 9, 0), friday.minus(new BusinessDay()));
    assertEquals(Timestamp.of(2014, 7, 4, 11, 0), friday.plus(Amount.of(2, Time.HOURS)));
    assertSame(Timestamp.NOT_A_TIME, Timestamp.NOT_A_TIME.plus(Amount.of(2, Time.HOURS)));
  }

  @Test(expected = OutOfBoundsDatetimeException.class)
  public void testArithmeticOverflow() {
    Timestamp.ofNanos(Long.MAX_VALUE - 1).plus(Amount.of(1, Time.DAYS));
  }

  @Test(expected = OutOfBoundsDatetimeException.class)
  public void testOutOfBoundsConstruction() {
    Timestamp.of(2300, 1, 1);
  }
}
