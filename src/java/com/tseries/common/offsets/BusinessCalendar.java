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

import java.io.Serializable;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.SortedSet;
import java.util.logging.Logger;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import com.google.common.math.LongMath;
import com.google.common.primitives.Longs;

import org.apache.commons.lang.builder.EqualsBuilder;
import org.apache.commons.lang.builder.HashCodeBuilder;

import com.tseries.common.calendar.CalendarUtil;

/**
 * A business day calendar: a weekmask plus a set of holidays.  Days are addressed as epoch days.
 *
 * <p>Holidays that fall on days the weekmask already excludes are dropped, so two calendars that
 * accept exactly the same days compare equal.
 */
public final class BusinessCalendar implements Serializable {

  private static final long serialVersionUID = 1L;

  private static final Logger LOG = Logger.getLogger(BusinessCalendar.class.getName());

  /**
   * Monday through Friday without holidays.
   */
  public static final BusinessCalendar WEEKDAYS =
      new BusinessCalendar(Weekmask.WEEKDAYS, new long[0]);

  private final Weekmask weekmask;
  // Sorted, distinct epoch days.
  private final long[] holidays;

  private BusinessCalendar(Weekmask weekmask, long[] holidays) {
    this.weekmask = weekmask;
    this.holidays = holidays;
  }

  public static BusinessCalendar of(Weekmask weekmask, Iterable<LocalDate> holidays) {
    return of(weekmask, holidays, null);
  }

  /**
   * Creates a calendar from explicit holidays merged with those of an external provider.
   *
   * @param weekmask the days of the week business is conducted
   * @param holidays explicit holidays
   * @param provider an optional provider, queried over the configured holiday window
   * @return the calendar
   */
  public static BusinessCalendar of(Weekmask weekmask, Iterable<LocalDate> holidays,
      @Nullable HolidayCalendar provider) {
    Preconditions.checkNotNull(weekmask);
    Preconditions.checkNotNull(holidays);

    SortedSet<Long> days = Sets.newTreeSet();
    for (LocalDate holiday : holidays) {
      days.add(Preconditions.checkNotNull(holiday).toEpochDay());
    }
    if (provider != null) {
      OffsetDefaults defaults = OffsetDefaults.get();
      int before = days.size();
      for (LocalDate holiday : Preconditions.checkNotNull(provider.holidays(
          defaults.getHolidayWindowStart(), defaults.getHolidayWindowEnd()))) {
        days.add(holiday.toEpochDay());
      }
      LOG.fine("Merged " + (days.size() - before) + " holidays from calendar " + provider);
    }

    SortedSet<Long> effective = Sets.newTreeSet();
    for (Long day : days) {
      if (weekmask.isBusinessDay(CalendarUtil.dayOfWeek(day))) {
        effective.add(day);
      }
    }
    if (effective.isEmpty() && weekmask.equals(Weekmask.WEEKDAYS)) {
      return WEEKDAYS;
    }
    return new BusinessCalendar(weekmask, Longs.toArray(effective));
  }

  public Weekmask getWeekmask() {
    return weekmask;
  }

  /**
   * Returns the holidays that fall on weekmask days, in ascending order.
   */
  public ImmutableList<LocalDate> getHolidays() {
    ImmutableList.Builder<LocalDate> dates = ImmutableList.builder();
    for (long day : holidays) {
      dates.add(LocalDate.ofEpochDay(day));
    }
    return dates.build();
  }

  public boolean isBusinessDay(long epochDay) {
    return weekmask.isBusinessDay(CalendarUtil.dayOfWeek(epochDay))
        && Arrays.binarySearch(holidays, epochDay) < 0;
  }

  /**
   * Returns {@code epochDay} if it is a business day, otherwise the next business day.
   */
  public long rollForward(long epochDay) {
    long day = epochDay;
    while (!isBusinessDay(day)) {
      day++;
    }
    return day;
  }

  /**
   * Returns {@code epochDay} if it is a business day, otherwise the previous business day.
   */
  public long rollBackward(long epochDay) {
    long day = epochDay;
    while (!isBusinessDay(day)) {
      day--;
    }
    return day;
  }

  /**
   * Moves {@code n} business days from {@code epochDay}.  A day that is not a business day is
   * first rolled backward when {@code n} is positive and forward otherwise, so {@code n = 0}
   * snaps to the next business day and {@code n = 1} from a Saturday lands on Monday.
   *
   * @param epochDay the starting day
   * @param n the signed number of business days to move
   * @return the resulting business day
   */
  public long offset(long epochDay, long n) {
    long day = n > 0 ? rollBackward(epochDay) : rollForward(epochDay);
    long step = n > 0 ? 1 : -1;
    long remaining = Math.abs(n);

    // Every run of seven days holds count() weekmask days; holidays in the run are given back.
    int perWeek = weekmask.count();
    long weeks;
    while ((weeks = (remaining - 1) / perWeek) > 0) {
      long span = LongMath.checkedMultiply(weeks, 7);
      long end = LongMath.checkedAdd(day, step * span);
      int skipped = n > 0 ? countHolidays(day + 1, end) : countHolidays(end, day - 1);
      remaining -= weeks * perWeek - skipped;
      day = end;
    }

    while (remaining > 0) {
      day = LongMath.checkedAdd(day, step);
      if (isBusinessDay(day)) {
        remaining--;
      }
    }
    return day;
  }

  // Number of holidays in [from, to].
  private int countHolidays(long from, long to) {
    return insertionPoint(LongMath.checkedAdd(to, 1)) - insertionPoint(from);
  }

  private int insertionPoint(long epochDay) {
    int index = Arrays.binarySearch(holidays, epochDay);
    return index >= 0 ? index : -index - 1;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof BusinessCalendar)) {
      return false;
    }
    BusinessCalendar other = (BusinessCalendar) o;
    return new EqualsBuilder()
        .append(weekmask, other.weekmask)
        .append(holidays, other.holidays)
        .isEquals();
  }

  @Override
  public int hashCode() {
    return new HashCodeBuilder().append(weekmask).append(holidays).toHashCode();
  }

  @Override
  public String toString() {
    return "BusinessCalendar{weekmask=" + weekmask + ", holidays=" + getHolidays() + "}";
  }
}
