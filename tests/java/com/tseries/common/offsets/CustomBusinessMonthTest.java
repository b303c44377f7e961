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

package com.tseries.common.offsets;

import java.time.LocalDate;

import com.google.common.collect.ImmutableList;

import org.junit.Test;

import com.tseries.common.timeseries.Timestamp;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class CustomBusinessMonthTest {

  private static void assertApply(DateOffset offset, Timestamp base, Timestamp expected) {
    assertEquals(offset + " applied to " + base, expected, offset.apply(base));
  }

  @Test
  public void testMonthEnd() {
    CustomBusinessMonthEnd offset = new CustomBusinessMonthEnd();
    assertApply(offset, Timestamp.of(2008, 1, 1), Timestamp.of(2008, 1, 31));
    assertApply(offset, Timestamp.of(2008, 1, 31), Timestamp.of(2008, 2, 29));
    assertApply(offset, Timestamp.of(2008, 2, 29, 12, 0), Timestamp.of(2008, 3, 31, 12, 0));
    assertApply(new CustomBusinessMonthEnd(-1), Timestamp.of(2008, 1, 31),
        Timestamp.of(2007, 12, 31));
    assertApply(new CustomBusinessMonthEnd(0), Timestamp.of(2008, 1, 15),
        Timestamp.of(2008, 1, 31));
    // 2008-05-31 is a Saturday.
    assertApply(offset, Timestamp.of(2008, 5, 1), Timestamp.of(2008, 5, 30));
  }

  @Test
  public void testMonthEndHolidays() {
    BusinessCalendar calendar = BusinessCalendar.of(Weekmask.WEEKDAYS, ImmutableList.of(
        LocalDate.of(2012, 1, 31), LocalDate.of(2012, 2, 28), LocalDate.of(2012, 2, 29)));
    assertApply(new CustomBusinessMonthEnd(1, false, calendar), Timestamp.of(2012, 1, 1),
        Timestamp.of(2012, 1, 30));
    assertApply(new CustomBusinessMonthEnd(2, false, calendar), Timestamp.of(2012, 1, 1),
        Timestamp.of(2012, 2, 27));
  }

  @Test
  public void testMonthEndWeekmask() {
    BusinessCalendar calendar =
        BusinessCalendar.of(Weekmask.parse("Sun Mon Tue Wed Thu"), ImmutableList.<LocalDate>of());
    assertApply(new CustomBusinessMonthEnd(1, false, calendar), Timestamp.of(2013, 5, 1),
        Timestamp.of(2013, 5, 30));
  }

  @Test
  public void testMonthBegin() {
    CustomBusinessMonthBegin offset = new CustomBusinessMonthBegin();
    assertApply(offset, Timestamp.of(2008, 1, 1), Timestamp.of(2008, 2, 1));
    assertApply(offset, Timestamp.of(2008, 1, 31), Timestamp.of(2008, 2, 1));
    // 2008-03-01 is a Saturday.
    assertApply(offset, Timestamp.of(2008, 2, 1), Timestamp.of(2008, 3, 3));
    assertApply(new CustomBusinessMonthBegin(-1), Timestamp.of(2008, 2, 15),
        Timestamp.of(2008, 2, 1));
    assertApply(new CustomBusinessMonthBegin(-1), Timestamp.of(2008, 2, 1),
        Timestamp.of(2008, 1, 1));
  }

  @Test
  public void testMonthBeginHolidaysAndWeekmask() {
    BusinessCalendar holidays = BusinessCalendar.of(Weekmask.WEEKDAYS, ImmutableList.of(
        LocalDate.of(2012, 2, 1), LocalDate.of(2012, 2, 2), LocalDate.of(2012, 3, 1)));
    assertApply(new CustomBusinessMonthBegin(2, false, holidays), Timestamp.of(2012, 1, 1),
        Timestamp.of(2012, 2, 3));

    BusinessCalendar egypt =
        BusinessCalendar.of(Weekmask.parse("Sun Mon Tue Wed Thu"), ImmutableList.<LocalDate>of());
    assertApply(new CustomBusinessMonthBegin(1, false, egypt), Timestamp.of(2013, 5, 1),
        Timestamp.of(2013, 6, 2));
  }

  @Test
  public void testOnOffsetAndRoll() {
    CustomBusinessMonthEnd end = new CustomBusinessMonthEnd();
    assertTrue(end.onOffset(Timestamp.of(2008, 5, 30)));
    assertFalse(end.onOffset(Timestamp.of(2008, 5, 31)));
    assertEquals(Timestamp.of(2007, 12, 31), end.rollback(Timestamp.of(2008, 1, 2)));
    assertEquals(Timestamp.of(2008, 1, 31), end.rollforward(Timestamp.of(2008, 1, 2)));

    CustomBusinessMonthBegin begin = new CustomBusinessMonthBegin();
    assertTrue(begin.onOffset(Timestamp.of(2008, 3, 3)));
    assertFalse(begin.onOffset(Timestamp.of(2008, 3, 1)));
    assertEquals(Timestamp.of(2008, 3, 3), begin.rollforward(Timestamp.of(2008, 3, 1)));
    assertEquals(Timestamp.of(2008, 2, 1), begin.rollback(Timestamp.of(2008, 3, 1)));
  }

  @Test
  public void testRollConvention() {
    assertEquals(0, CustomBusinessMonth.rollConvention(1, 1, 31));
    assertEquals(1, CustomBusinessMonth.rollConvention(31, 1, 31));
    assertEquals(0, CustomBusinessMonth.rollConvention(31, -1, 30));
    assertEquals(-1, CustomBusinessMonth.rollConvention(15, -1, 15));
    assertEquals(0, CustomBusinessMonth.rollConvention(15, 0, 31));
  }

  @Test
  public void testRepr() {
    assertEquals("<CustomBusinessMonthEnd>", new CustomBusinessMonthEnd().toString());
    assertEquals("<2 * CustomBusinessMonthBegins>", new CustomBusinessMonthBegin(2).toString());
    assertEquals("CBM", new CustomBusinessMonthEnd().getFreqstr());
    assertEquals("-1CBMS", new CustomBusinessMonthBegin(-1).getFreqstr());
  }
}
