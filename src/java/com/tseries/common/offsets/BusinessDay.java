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

import com.google.common.base.Preconditions;
import com.google.common.math.LongMath;

import com.tseries.common.calendar.CalendarUtil;
import com.tseries.common.quantity.Amount;
import com.tseries.common.quantity.Time;

/**
 * Steps over weekdays, Monday through Friday, with no notion of holidays.  An optional fixed time
 * delta is added after stepping, giving eg: "one business day plus two hours".
 */
public class BusinessDay extends DateOffset {

  private static final long serialVersionUID = 1L;

  static final Amount<Time> NO_OFFSET = Amount.of(0, Time.NANOSECONDS);

  private final Amount<Time> offset;

  public BusinessDay() {
    this(1);
  }

  public BusinessDay(int n) {
    this(n, false);
  }

  public BusinessDay(int n, boolean normalize) {
    this(n, normalize, NO_OFFSET);
  }

  /**
   * @param n the signed number of business days to step
   * @param normalize whether to reset results to midnight
   * @param offset a time delta added after stepping
   */
  public BusinessDay(int n, boolean normalize, Amount<Time> offset) {
    super(n, normalize);
    this.offset = Preconditions.checkNotNull(offset);
  }

  public Amount<Time> getOffset() {
    return offset;
  }

  @Override
  public String getRuleCode() {
    return "B";
  }

  @Override
  public String getFreqstr() {
    return super.getFreqstr() + formatOffset(offset);
  }

  @Override
  protected long applyLocal(long local) {
    long day = Math.floorDiv(local, NANOS_PER_DAY);
    int weekday = CalendarUtil.dayOfWeek(day);

    // Whole weeks first, leaving 0 <= k <= 5 single days to place.
    long k = getN();
    long weeks = Math.floorDiv(k, 5L);
    if (k <= 0 && weekday > 4) {
      k += 1;
    }
    k -= 5 * weeks;

    long days;
    if (k == 0 && weekday > 4) {
      days = 4 - weekday;
    } else if (weekday > 4) {
      days = (7 - weekday) + (k - 1);
    } else if (weekday + k <= 4) {
      days = k;
    } else {
      days = k + 2;
    }

    long shifted = LongMath.checkedAdd(local,
        LongMath.checkedMultiply(7 * weeks + days, NANOS_PER_DAY));
    return LongMath.checkedAdd(shifted, offset.asBaseUnits());
  }

  @Override
  protected boolean isOnOffsetLocal(long local) {
    return CalendarUtil.dayOfWeek(Math.floorDiv(local, NANOS_PER_DAY)) < 5;
  }

  @Override
  protected BusinessDay withN(int newN) {
    return new BusinessDay(newN, isNormalize(), offset);
  }

  /**
   * Returns a business day offset whose time delta is extended by {@code delta}.
   */
  @Override
  public BusinessDay plus(Amount<Time> delta) {
    return new BusinessDay(getN(), isNormalize(),
        Amount.of(LongMath.checkedAdd(offset.asBaseUnits(), delta.asBaseUnits()),
            Time.NANOSECONDS));
  }

  @Override
  protected Object[] getParams() {
    return new Object[] {offset};
  }

  @Override
  protected String getReprAttrs() {
    return offset.getValue() == 0 ? "" : ": offset=" + offset;
  }

  @Override
  protected String describe() {
    return "business day";
  }

  /**
   * Formats a time delta as a signed suffix in the coarsest exact unit, eg: {@code "+2H"}.
   */
  static String formatOffset(Amount<Time> offset) {
    long nanos = offset.asBaseUnits();
    if (nanos == 0) {
      return "";
    }
    Time[] units = Time.values();
    for (int i = units.length - 1; i >= 0; i--) {
      if (nanos % units[i].multiplier() == 0) {
        return (nanos > 0 ? "+" : "") + nanos / units[i].multiplier() + units[i].getAlias();
      }
    }
    throw new IllegalStateException("Nanoseconds always divide " + nanos);
  }
}
