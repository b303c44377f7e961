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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.math.LongMath;

import com.tseries.common.quantity.Time;

/**
 * Steps through business hours: the {@link OpeningHours} of each business day.  One step is one
 * hour of open time; a step that runs past the close of an interval continues at the next
 * opening, skipping closed days.  Intervals may run past midnight, in which case the part after
 * midnight belongs to the business day the interval opened on.
 *
 * <p>Stepping is exact to the nanosecond: a timestamp a few nanoseconds past a whole hour lands
 * the same few nanoseconds past the resulting hour.
 */
public class BusinessHour extends DateOffset {

  private static final long serialVersionUID = 1L;

  private static final long NANOS_PER_SECOND = Time.SECONDS.multiplier();
  private static final long NANOS_PER_MINUTE = Time.MINUTES.multiplier();

  private final OpeningHours hours;
  private final BusinessCalendar calendar;

  public BusinessHour() {
    this(1);
  }

  public BusinessHour(int n) {
    this(n, false);
  }

  public BusinessHour(int n, boolean normalize) {
    this(n, normalize, OffsetDefaults.get().getOpeningHours());
  }

  /**
   * Creates a business hour offset open between {@code start} and {@code end}, given as
   * {@code HH:MM}.
   */
  public BusinessHour(int n, boolean normalize, String start, String end) {
    this(n, normalize, OpeningHours.of(start, end));
  }

  public BusinessHour(int n, boolean normalize, OpeningHours hours) {
    this(n, normalize, hours, BusinessCalendar.WEEKDAYS);
  }

  protected BusinessHour(int n, boolean normalize, OpeningHours hours,
      BusinessCalendar calendar) {
    super(n, normalize);
    this.hours = Preconditions.checkNotNull(hours);
    this.calendar = Preconditions.checkNotNull(calendar);
  }

  public OpeningHours getOpeningHours() {
    return hours;
  }

  protected BusinessCalendar getBusinessCalendar() {
    return calendar;
  }

  @Override
  public String getRuleCode() {
    return "BH";
  }

  @Override
  protected BusinessHour withN(int newN) {
    return new BusinessHour(newN, isNormalize(), hours, calendar);
  }

  @Override
  protected Object[] getParams() {
    return new Object[] {hours, calendar};
  }

  @Override
  protected String getReprAttrs() {
    return ": " + getRuleCode() + "=" + hours;
  }

  @Override
  protected String describe() {
    return "business hour";
  }

  /**
   * Returns the opening time reached by looking forward from {@code local}, or backward when
   * {@code n} is negative.  A timestamp exactly at an opening is its own opening.
   */
  @VisibleForTesting
  long nextOpeningTime(long local) {
    return openingTime(local, 1);
  }

  /**
   * Returns the opening time reached by looking backward from {@code local}, or forward when
   * {@code n} is negative.
   */
  @VisibleForTesting
  long prevOpeningTime(long local) {
    return openingTime(local, -1);
  }

  private long openingTime(long local, int sign) {
    long day = Math.floorDiv(local, NANOS_PER_DAY);
    long nanoOfDay = Math.floorMod(local, NANOS_PER_DAY);
    boolean forward = (long) getN() * sign >= 0;
    int dayStep = sign * (getN() >= 0 ? 1 : -1);

    long start;
    if (!calendar.isBusinessDay(day)) {
      day = calendar.offset(day, dayStep);
      start = forward ? hours.getEarliestStart() : hours.getLatestStart();
    } else if (forward) {
      if (hours.getLatestStart() < nanoOfDay) {
        day = calendar.offset(day, dayStep);
        start = hours.getEarliestStart();
      } else {
        start = firstStartAtOrAfter(nanoOfDay);
      }
    } else {
      if (nanoOfDay < hours.getEarliestStart()) {
        day = calendar.offset(day, dayStep);
        start = hours.getLatestStart();
      } else {
        start = lastStartAtOrBefore(nanoOfDay);
      }
    }
    return LongMath.checkedAdd(LongMath.checkedMultiply(day, NANOS_PER_DAY), start);
  }

  private long firstStartAtOrAfter(long nanoOfDay) {
    for (int i = 0; i < hours.size(); i++) {
      if (nanoOfDay <= hours.getStart(i)) {
        return hours.getStart(i);
      }
    }
    throw new IllegalStateException("No opening at or after " + nanoOfDay + " in " + hours);
  }

  private long lastStartAtOrBefore(long nanoOfDay) {
    for (int i = hours.size() - 1; i >= 0; i--) {
      if (nanoOfDay >= hours.getStart(i)) {
        return hours.getStart(i);
      }
    }
    throw new IllegalStateException("No opening at or before " + nanoOfDay + " in " + hours);
  }

  /**
   * Returns the close of the interval opening at {@code opening}.
   */
  @VisibleForTesting
  long closingTime(long opening) {
    int interval = hours.indexOfStart(Math.floorMod(opening, NANOS_PER_DAY));
    Preconditions.checkState(interval >= 0, "%s is not an opening time of %s", opening, hours);
    return LongMath.checkedAdd(opening, hours.getDuration(interval));
  }

  /**
   * Returns the length of the interval opening at {@code opening}, or 0 if none opens then.
   */
  private long durationFrom(long opening) {
    int interval = hours.indexOfStart(Math.floorMod(opening, NANOS_PER_DAY));
    return interval < 0 ? 0 : hours.getDuration(interval);
  }

  @Override
  protected boolean isOnOffsetLocal(long local) {
    // An interval past midnight spills into the next day, so measure from its opening.
    long opening = getN() >= 0 ? prevOpeningTime(local) : nextOpeningTime(local);
    return local - opening <= durationFrom(opening);
  }

  @Override
  protected long rollbackLocal(long local) {
    long opening = getN() >= 0 ? prevOpeningTime(local) : nextOpeningTime(local);
    return closingTime(opening);
  }

  @Override
  protected long rollforwardLocal(long local) {
    return getN() >= 0 ? nextOpeningTime(local) : prevOpeningTime(local);
  }

  @Override
  protected long applyLocal(long local) {
    long other = local;
    int n = getN();
    long nanoOfDay = Math.floorMod(other, NANOS_PER_DAY);

    // Start from within an interval so only whole days and a remainder are left to step.
    if (n >= 0) {
      if (hours.isEnd(nanoOfDay) || !isOnOffsetLocal(other)) {
        other = nextOpeningTime(other);
      }
    } else {
      if (hours.indexOfStart(nanoOfDay) >= 0) {
        other -= NANOS_PER_SECOND;
      }
      if (!isOnOffsetLocal(other)) {
        other = closingTime(nextOpeningTime(other));
      }
    }

    long businessMinutes = hours.getTotalDuration() / NANOS_PER_MINUTE;
    long totalMinutes = Math.abs((long) n) * 60;
    long businessDays = totalMinutes / businessMinutes;
    long remainder = (totalMinutes % businessMinutes) * NANOS_PER_MINUTE;
    if (n < 0) {
      businessDays = -businessDays;
      remainder = -remainder;
    }

    if (businessDays != 0) {
      long day = Math.floorDiv(other, NANOS_PER_DAY);
      if (!calendar.isBusinessDay(day)) {
        // Past midnight of an interval opened on the previous business day.
        long opening = prevOpeningTime(other);
        other = LongMath.checkedAdd(shiftBusinessDays(opening, businessDays), other - opening);
      } else {
        other = shiftBusinessDays(other, businessDays);
      }
    }

    Step step = new Step(other, remainder);
    while (step.remaining != 0) {
      step = n >= 0 ? stepForward(step) : stepBackward(step);
    }
    return step.timestamp;
  }

  private long shiftBusinessDays(long local, long businessDays) {
    long day = Math.floorDiv(local, NANOS_PER_DAY);
    long nanoOfDay = Math.floorMod(local, NANOS_PER_DAY);
    return LongMath.checkedAdd(
        LongMath.checkedMultiply(calendar.offset(day, businessDays), NANOS_PER_DAY), nanoOfDay);
  }

  /**
   * Consumes positive remaining open time: finishes within the current interval or moves to the
   * next opening with the current interval's open time deducted.
   */
  @VisibleForTesting
  Step stepForward(Step step) {
    long other = step.timestamp;
    long untilClose = closingTime(prevOpeningTime(other)) - other;
    if (step.remaining < untilClose) {
      return new Step(other + step.remaining, 0);
    }
    return new Step(nextOpeningTime(other + untilClose), step.remaining - untilClose);
  }

  /**
   * Consumes negative remaining open time: finishes within the current interval or moves to the
   * close of the previous interval with the current interval's open time deducted.
   */
  @VisibleForTesting
  Step stepBackward(Step step) {
    long other = step.timestamp;
    long sinceOpen = nextOpeningTime(other) - other;
    if (step.remaining > sinceOpen) {
      return new Step(other + step.remaining, 0);
    }
    long previousClose =
        closingTime(nextOpeningTime(other + sinceOpen - NANOS_PER_SECOND));
    return new Step(previousClose, step.remaining - sinceOpen);
  }

  /**
   * A position in a business hour walk: a local wall clock value and the signed open time, in
   * nanoseconds, still to be stepped.
   */
  @VisibleForTesting
  static final class Step {
    final long timestamp;
    final long remaining;

    Step(long timestamp, long remaining) {
      this.timestamp = timestamp;
      this.remaining = remaining;
    }

    @Override
    public String toString() {
      return "Step{timestamp=" + timestamp + ", remaining=" + remaining + "}";
    }
  }
}
