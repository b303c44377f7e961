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

import com.google.common.base.Preconditions;
import com.google.common.math.LongMath;

/**
 * Steps between one fixed business day of each month, the first or last day of the month that a
 * {@link BusinessCalendar} accepts.  The time of day is kept.
 */
public abstract class CustomBusinessMonth extends DateOffset {

  private static final long serialVersionUID = 1L;

  private final BusinessCalendar calendar;

  protected CustomBusinessMonth(int n, boolean normalize, BusinessCalendar calendar) {
    super(n, normalize);
    this.calendar = Preconditions.checkNotNull(calendar);
  }

  public BusinessCalendar getCalendar() {
    return calendar;
  }

  /**
   * Returns the calendar anchor of the month containing {@code date}: its first or last day.
   */
  protected abstract LocalDate monthAnchor(LocalDate date);

  /**
   * Moves a calendar anchor onto a business day of the calendar.
   */
  protected abstract long toBusinessDay(long epochDay);

  @Override
  protected long applyLocal(long local) {
    long day = Math.floorDiv(local, NANOS_PER_DAY);
    long nanoOfDay = Math.floorMod(local, NANOS_PER_DAY);

    LocalDate date = LocalDate.ofEpochDay(day);
    LocalDate anchor = monthAnchor(date);
    LocalDate businessAnchor = LocalDate.ofEpochDay(toBusinessDay(anchor.toEpochDay()));
    int months = rollConvention(date.getDayOfMonth(), getN(), businessAnchor.getDayOfMonth());

    LocalDate target = monthAnchor(anchor.plusMonths(months));
    return LongMath.checkedAdd(
        LongMath.checkedMultiply(toBusinessDay(target.toEpochDay()), NANOS_PER_DAY), nanoOfDay);
  }

  /**
   * A date before this month's business day has already consumed a forward step by rolling to
   * it, and a date after it has consumed a backward one.
   */
  static int rollConvention(int dayOfMonth, int n, int anchorDay) {
    if (n > 0 && dayOfMonth < anchorDay) {
      return n - 1;
    } else if (n <= 0 && dayOfMonth > anchorDay) {
      return n + 1;
    }
    return n;
  }

  @Override
  protected boolean isOnOffsetLocal(long local) {
    long day = Math.floorDiv(local, NANOS_PER_DAY);
    return toBusinessDay(monthAnchor(LocalDate.ofEpochDay(day)).toEpochDay()) == day;
  }

  @Override
  protected Object[] getParams() {
    return new Object[] {calendar};
  }
}
