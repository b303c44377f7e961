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

/**
 * The first business day of each month.
 */
public class CustomBusinessMonthBegin extends CustomBusinessMonth {

  private static final long serialVersionUID = 1L;

  public CustomBusinessMonthBegin() {
    this(1);
  }

  public CustomBusinessMonthBegin(int n) {
    this(n, false);
  }

  public CustomBusinessMonthBegin(int n, boolean normalize) {
    this(n, normalize, CustomBusinessDay.defaultCalendar());
  }

  public CustomBusinessMonthBegin(int n, boolean normalize, BusinessCalendar calendar) {
    super(n, normalize, calendar);
  }

  @Override
  public String getRuleCode() {
    return "CBMS";
  }

  @Override
  protected LocalDate monthAnchor(LocalDate date) {
    return date.withDayOfMonth(1);
  }

  @Override
  protected long toBusinessDay(long epochDay) {
    return getCalendar().rollForward(epochDay);
  }

  @Override
  protected CustomBusinessMonthBegin withN(int newN) {
    return new CustomBusinessMonthBegin(newN, isNormalize(), getCalendar());
  }
}
