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

package com.tseries.common.calendar;

import java.time.LocalDate;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import com.tseries.common.base.MorePreconditions;

/**
 * Gregorian calendar primitives operating on {@code (year, month, day)} integer triples and on
 * epoch days (days since 1970-01-01).  Months are 1-based, weekdays are 0-based starting with
 * Monday.
 */
public final class CalendarUtil {

  /**
   * Three letter month abbreviations, January first.
   */
  public static final ImmutableList<String> MONTHS = ImmutableList.of(
      "JAN", "FEB", "MAR", "APR", "MAY", "JUN", "JUL", "AUG", "SEP", "OCT", "NOV", "DEC");

  /**
   * Three letter weekday abbreviations, Monday first.
   */
  public static final ImmutableList<String> DAYS = ImmutableList.of(
      "MON", "TUE", "WED", "THU", "FRI", "SAT", "SUN");

  private static final ImmutableMap<String, Integer> MONTH_NUMBERS;
  private static final ImmutableMap<String, Integer> DAY_NUMBERS;
  static {
    ImmutableMap.Builder<String, Integer> months = ImmutableMap.builder();
    for (int i = 0; i < MONTHS.size(); i++) {
      months.put(MONTHS.get(i), i + 1);
    }
    MONTH_NUMBERS = months.build();

    ImmutableMap.Builder<String, Integer> days = ImmutableMap.builder();
    for (int i = 0; i < DAYS.size(); i++) {
      days.put(DAYS.get(i), i);
    }
    DAY_NUMBERS = days.build();
  }

  private static final int[] DAYS_PER_MONTH = {31, 28, 31, 30, 31, 30, 31, 31, 30, 31, 30, 31};

  // Cumulative days before each month, non-leap row then leap row.
  private static final int[][] MONTH_OFFSET = {
      {0, 31, 59, 90, 120, 151, 181, 212, 243, 273, 304, 334, 365},
      {0, 31, 60, 91, 121, 152, 182, 213, 244, 274, 305, 335, 366}
  };

  private static final int[] SAKAMOTO = {0, 3, 2, 5, 0, 3, 5, 1, 4, 6, 2, 4};

  private CalendarUtil() {
    // utility
  }

  public static boolean isLeapYear(long year) {
    return year % 4 == 0 && (year % 100 != 0 || year % 400 == 0);
  }

  /**
   * Returns the number of days in the given month.
   */
  public static int daysInMonth(int year, int month) {
    checkMonth(month);
    if (month == 2 && isLeapYear(year)) {
      return 29;
    }
    return DAYS_PER_MONTH[month - 1];
  }

  /**
   * Returns the 1-based ordinal of the date within its year, so January 1st is day 1.
   */
  public static int dayOfYear(int year, int month, int day) {
    checkMonth(month);
    return MONTH_OFFSET[isLeapYear(year) ? 1 : 0][month - 1] + day;
  }

  /**
   * Returns the day of the week of a date, 0 for Monday through 6 for Sunday.
   */
  public static int dayOfWeek(int year, int month, int day) {
    checkMonth(month);
    int y = month < 3 ? year - 1 : year;
    int sunday = Math.floorMod(
        y + Math.floorDiv(y, 4) - Math.floorDiv(y, 100) + Math.floorDiv(y, 400)
            + SAKAMOTO[month - 1] + day, 7);
    return (sunday + 6) % 7;
  }

  /**
   * Returns the day of the week of an epoch day, 0 for Monday through 6 for Sunday.
   */
  public static int dayOfWeek(long epochDay) {
    // 1970-01-01 was a Thursday.
    return (int) Math.floorMod(epochDay + 3, 7L);
  }

  /**
   * Computes the ISO-8601 year, week and weekday of a date.  The first ISO week of a year is the
   * one containing its first Thursday, so late December dates may belong to the following ISO
   * year and early January dates to the preceding one.
   */
  public static IsoCalendarDate isoCalendar(int year, int month, int day) {
    int doy = dayOfYear(year, month, day);
    int dow = dayOfWeek(year, month, day);

    int isoWeek = (doy - 1) - dow + 3;
    if (isoWeek >= 0) {
      isoWeek = isoWeek / 7 + 1;
    }

    if (isoWeek < 0) {
      if (isoWeek > -2 || (isoWeek == -2 && isLeapYear(year - 1))) {
        isoWeek = 53;
      } else {
        isoWeek = 52;
      }
    } else if (isoWeek == 53) {
      if (31 - day + dow < 3) {
        isoWeek = 1;
      }
    }

    int isoYear = year;
    if (isoWeek == 1 && month == 12) {
      isoYear++;
    } else if (isoWeek >= 52 && month == 1) {
      isoYear--;
    }
    return new IsoCalendarDate(isoYear, isoWeek, dow + 1);
  }

  /**
   * Returns the ISO-8601 week number of a date.
   */
  public static int weekOfYear(int year, int month, int day) {
    return isoCalendar(year, month, day).getWeek();
  }

  /**
   * Returns the day of month of the first weekday (Monday to Friday) of the month.
   */
  public static int firstBusinessDay(int year, int month) {
    int weekday = dayOfWeek(year, month, 1);
    if (weekday == 5) {
      return 3;
    } else if (weekday == 6) {
      return 2;
    }
    return 1;
  }

  /**
   * Returns the day of month of the last weekday (Monday to Friday) of the month.
   */
  public static int lastBusinessDay(int year, int month) {
    int weekday = dayOfWeek(year, month, 1);
    int days = daysInMonth(year, month);
    return days - Math.max(((weekday + days - 1) % 7) - 4, 0);
  }

  public static long toEpochDay(int year, int month, int day) {
    return LocalDate.of(year, month, day).toEpochDay();
  }

  /**
   * Returns the three letter abbreviation of a 1-based month.
   */
  public static String monthAlias(int month) {
    return MONTHS.get(checkMonth(month) - 1);
  }

  /**
   * Returns the 1-based month number of a three letter month abbreviation.
   *
   * @throws IllegalArgumentException if the abbreviation is unknown
   */
  public static int monthNumber(String alias) {
    Integer month = MONTH_NUMBERS.get(MorePreconditions.checkNotBlank(alias).toUpperCase());
    Preconditions.checkArgument(month != null, "Unknown month: %s", alias);
    return month;
  }

  /**
   * Returns the three letter abbreviation of a 0-based (Monday) weekday.
   */
  public static String weekdayAlias(int weekday) {
    return DAYS.get(MorePreconditions.checkArgumentRange(weekday, 0, 6, "Invalid weekday: %s"));
  }

  /**
   * Returns the 0-based weekday of a three letter weekday abbreviation.
   *
   * @throws IllegalArgumentException if the abbreviation is unknown
   */
  public static int weekdayNumber(String alias) {
    Integer day = DAY_NUMBERS.get(MorePreconditions.checkNotBlank(alias).toUpperCase());
    Preconditions.checkArgument(day != null, "Unknown weekday: %s", alias);
    return day;
  }

  private static int checkMonth(int month) {
    return MorePreconditions.checkArgumentRange(month, 1, 12, "Invalid month: %s");
  }
}
