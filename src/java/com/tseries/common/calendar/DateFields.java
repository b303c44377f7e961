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

/**
 * The calendar fields of one epoch day.
 */
public final class DateFields {

  private final long epochDay;
  private final int year;
  private final int month;
  private final int day;
  private final int dayOfWeek;

  private DateFields(long epochDay, int year, int month, int day) {
    this.epochDay = epochDay;
    this.year = year;
    this.month = month;
    this.day = day;
    this.dayOfWeek = CalendarUtil.dayOfWeek(epochDay);
  }

  public static DateFields ofEpochDay(long epochDay) {
    LocalDate date = LocalDate.ofEpochDay(epochDay);
    return new DateFields(epochDay, date.getYear(), date.getMonthValue(), date.getDayOfMonth());
  }

  public long getEpochDay() {
    return epochDay;
  }

  public int getYear() {
    return year;
  }

  /** 1-based. */
  public int getMonth() {
    return month;
  }

  public int getDay() {
    return day;
  }

  /** 0 for Monday. */
  public int getDayOfWeek() {
    return dayOfWeek;
  }

  public int getDaysInMonth() {
    return CalendarUtil.daysInMonth(year, month);
  }

  @Override
  public String toString() {
    return String.format("%04d-%02d-%02d", year, month, day);
  }
}
