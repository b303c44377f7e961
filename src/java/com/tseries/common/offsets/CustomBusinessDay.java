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
import com.google.common.collect.ImmutableList;
import com.google.common.math.LongMath;

import com.tseries.common.quantity.Amount;
import com.tseries.common.quantity.Time;

/**
 * Steps over the days accepted by a {@link BusinessCalendar}: a weekmask and a set of holidays.
 *
 * <p>A day that is not a business day is first rolled onto one, backward when {@code n > 0} and
 * forward otherwise, and {@code n} business days are then counted from there.  The time of day is
 * kept and an optional time delta is added afterwards.
 */
public class CustomBusinessDay extends DateOffset {

  private static final long serialVersionUID = 1L;

  private final BusinessCalendar calendar;
  private final Amount<Time> offset;

  public CustomBusinessDay() {
    this(1);
  }

  public CustomBusinessDay(int n) {
    this(n, false);
  }

  public CustomBusinessDay(int n, boolean normalize) {
    this(n, normalize, defaultCalendar());
  }

  public CustomBusinessDay(int n, boolean normalize, BusinessCalendar calendar) {
    this(n, normalize, calendar, BusinessDay.NO_OFFSET);
  }

  /**
   * @param n the signed number of business days to step
   * @param normalize whether to reset results to midnight
   * @param calendar the business days to step over
   * @param offset a time delta added after stepping
   */
  public CustomBusinessDay(int n, boolean normalize, BusinessCalendar calendar,
      Amount<Time> offset) {
    super(n, normalize);
    this.calendar = Preconditions.checkNotNull(calendar);
    this.offset = Preconditions.checkNotNull(offset);
  }

  /**
   * Returns a calendar with the configured default weekmask and no holidays.
   */
  static BusinessCalendar defaultCalendar() {
    return BusinessCalendar.of(OffsetDefaults.get().getWeekmask(),
        ImmutableList.<LocalDate>of());
  }

  public BusinessCalendar getCalendar() {
    return calendar;
  }

  public Amount<Time> getOffset() {
    return offset;
  }

  @Override
  public String getRuleCode() {
    return "C";
  }

  @Override
  public String getFreqstr() {
    return super.getFreqstr() + BusinessDay.formatOffset(offset);
  }

  @Override
  protected long applyLocal(long local) {
    long day = Math.floorDiv(local, NANOS_PER_DAY);
    long nanoOfDay = Math.floorMod(local, NANOS_PER_DAY);
    long shifted = LongMath.checkedAdd(
        LongMath.checkedMultiply(calendar.offset(day, getN()), NANOS_PER_DAY), nanoOfDay);
    return LongMath.checkedAdd(shifted, offset.asBaseUnits());
  }

  @Override
  protected boolean isOnOffsetLocal(long local) {
    return calendar.isBusinessDay(Math.floorDiv(local, NANOS_PER_DAY));
  }

  @Override
  protected CustomBusinessDay withN(int newN) {
    return new CustomBusinessDay(newN, isNormalize(), calendar, offset);
  }

  /**
   * Returns a custom business day offset whose time delta is extended by {@code delta}.
   */
  @Override
  public CustomBusinessDay plus(Amount<Time> delta) {
    return new CustomBusinessDay(getN(), isNormalize(), calendar,
        Amount.of(LongMath.checkedAdd(offset.asBaseUnits(), delta.asBaseUnits()),
            Time.NANOSECONDS));
  }

  @Override
  protected Object[] getParams() {
    return new Object[] {calendar, offset};
  }

  @Override
  protected String getReprAttrs() {
    return offset.getValue() == 0 ? "" : ": offset=" + offset;
  }

  @Override
  protected String describe() {
    return "custom business day";
  }
}
