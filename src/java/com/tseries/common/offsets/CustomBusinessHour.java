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

/**
 * Business hours whose business days come from a {@link BusinessCalendar}, so holidays and
 * non-standard weekmasks close the whole day.
 */
public class CustomBusinessHour extends BusinessHour {

  private static final long serialVersionUID = 1L;

  public CustomBusinessHour() {
    this(1);
  }

  public CustomBusinessHour(int n) {
    this(n, false);
  }

  public CustomBusinessHour(int n, boolean normalize) {
    this(n, normalize, CustomBusinessDay.defaultCalendar());
  }

  public CustomBusinessHour(int n, boolean normalize, BusinessCalendar calendar) {
    this(n, normalize, calendar, OffsetDefaults.get().getOpeningHours());
  }

  public CustomBusinessHour(int n, boolean normalize, BusinessCalendar calendar,
      OpeningHours hours) {
    super(n, normalize, hours, calendar);
  }

  public BusinessCalendar getCalendar() {
    return getBusinessCalendar();
  }

  @Override
  public String getRuleCode() {
    return "CBH";
  }

  @Override
  protected CustomBusinessHour withN(int newN) {
    return new CustomBusinessHour(newN, isNormalize(), getBusinessCalendar(), getOpeningHours());
  }

  @Override
  protected String describe() {
    return "custom business hour";
  }
}
