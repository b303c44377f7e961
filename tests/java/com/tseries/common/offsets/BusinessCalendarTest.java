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

public class BusinessCalendarTest {

  private static long day(int year, int month, int day) {
    return LocalDate.of(year, month, day).toEpochDay();
  }

  @Test
  public void testWeekendHolidaysAreDropped() {
    BusinessCalendar calendar = BusinessCalendar.of(Weekmask.WEEKDAYS,
        ImmutableList.of(LocalDate.of(2014, 7, 5), LocalDate.of(2014, 7, 6)));
    assertEquals(BusinessCalendar.WEEKDAYS, calendar);
    assertTrue(calendar.getHolidays().isEmpty());
  }

  @Test
  public void testHolidaysSortedAndDistinct() {
    BusinessCalendar calendar = BusinessCalendar.of(Weekmask.WEEKDAYS, ImmutableList.of(
        LocalDate.of(2014, 7, 4), LocalDate.of(2014, 1, 1), LocalDate.of(2014, 7, 4)));
    assertEquals(ImmutableList.of(LocalDate.of(2014, 1, 1), LocalDate.of(2014, 7, 4)),
        calendar.getHolidays());
    assertFalse(calendar.isBusinessDay(day(2014, 7, 4)));
    assertTrue(calendar.isBusinessDay(day(2014, 7, 3)));
  }

  @Test
  public void testRolls() {
    BusinessCalendar calendar = BusinessCalendar.of(Weekmask.WEEKDAYS,
        ImmutableList.of(LocalDate.of(2014, 7, 4), LocalDate.of(2014, 7, 7)));
    assertEquals(day(2014, 7, 8), calendar.rollForward(day(2014, 7, 4)));
    assertEquals(day(2014, 7, 3), calendar.rollBackward(day(2014, 7, 7)));
    assertEquals(day(2014, 7, 3), calendar.rollBackward(day(2014, 7, 3)));
  }

  @Test
  public void testOffset() {
    BusinessCalendar calendar = BusinessCalendar.WEEKDAYS;
    // From a Saturday: forward counts from Friday, backward from Monday.
    assertEquals(day(2014, 7, 7), calendar.offset(day(2014, 7, 5), 1));
    assertEquals(day(2014, 7, 4), calendar.offset(day(2014, 7, 5), -1));
    assertEquals(day(2014, 7, 7), calendar.offset(day(2014, 7, 5), 0));
    assertEquals(day(2014, 7, 14), calendar.offset(day(2014, 7, 4), 6));
  }

  @Test
  public void testOffsetMatchesDayByDayWalk() {
    BusinessCalendar calendar = BusinessCalendar.of(Weekmask.parse("Sun Mon Tue Wed Thu"),
        ImmutableList.of(LocalDate.of(2014, 7, 1), LocalDate.of(2014, 7, 2),
            LocalDate.of(2014, 7, 3), LocalDate.of(2014, 7, 6), LocalDate.of(2014, 7, 20),
            LocalDate.of(2014, 8, 31), LocalDate.of(2014, 6, 15), LocalDate.of(2014, 5, 1)));
    for (long start = day(2014, 6, 25); start <= day(2014, 7, 10); start++) {
      for (int n = -60; n <= 60; n++) {
        assertEquals("offset " + n + " from " + LocalDate.ofEpochDay(start),
            walk(calendar, start, n), calendar.offset(start, n));
      }
    }
  }

  @Test
  public void testOffsetLarge() {
    assertEquals(day(2014, 7, 7) + 7000, BusinessCalendar.WEEKDAYS.offset(day(2014, 7, 7), 5000));
    assertEquals(day(2014, 7, 7) - 7000,
        BusinessCalendar.WEEKDAYS.offset(day(2014, 7, 7), -5000));

    BusinessCalendar calendar = BusinessCalendar.of(Weekmask.WEEKDAYS,
        ImmutableList.of(LocalDate.of(2014, 7, 4), LocalDate.of(2015, 12, 25)));
    // Two holidays push the landing day from a Thursday past Friday to Monday.
    assertEquals(day(2014, 7, 3) + 7004, calendar.offset(day(2014, 7, 3), 5000));
  }

  private static long walk(BusinessCalendar calendar, long start, int n) {
    long day = n > 0 ? calendar.rollBackward(start) : calendar.rollForward(start);
    for (int remaining = Math.abs(n); remaining > 0; ) {
      day += n > 0 ? 1 : -1;
      if (calendar.isBusinessDay(day)) {
        remaining--;
      }
    }
    return day;
  }

  @Test
  public void testEqualityAndCustomBusinessDays() {
    BusinessCalendar first = BusinessCalendar.of(Weekmask.parse("1111100"),
        ImmutableList.of(LocalDate.of(2014, 7, 4)));
    BusinessCalendar second = BusinessCalendar.of(Weekmask.WEEKDAYS,
        ImmutableList.of(LocalDate.of(2014, 7, 4), LocalDate.of(2014, 7, 5)));
    assertEquals(first, second);
    assertEquals(first.hashCode(), second.hashCode());
    assertEquals(new CustomBusinessDay(1, false, first), new CustomBusinessDay(1, false, second));
    assertEquals(Timestamp.of(2014, 7, 7),
        new CustomBusinessDay(1, false, first).apply(Timestamp.of(2014, 7, 3)));
  }
}
