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

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

/**
 * Where a set of dates sits within their months.  A set of dates has a position only if every
 * date in it agrees on it.
 */
public enum MonthPosition {
  CALENDAR_END("ce"),
  BUSINESS_END("be"),
  CALENDAR_START("cs"),
  BUSINESS_START("bs");

  private final String code;

  private MonthPosition(String code) {
    this.code = code;
  }

  public String getCode() {
    return code;
  }

  /**
   * Determines the month position shared by all the given dates.  Calendar positions take
   * precedence over business positions and ends take precedence over starts.  A business start is
   * the 1st, or a Monday falling on the 2nd or 3rd; a business end is the last day of the month,
   * or a Friday within the last three days.
   *
   * @param dates the dates to inspect
   * @return the common position, or {@code null} if the dates do not share one
   */
  @Nullable
  public static MonthPosition check(DateFields[] dates) {
    Preconditions.checkNotNull(dates);
    boolean calendarEnd = true;
    boolean businessEnd = true;
    boolean calendarStart = true;
    boolean businessStart = true;

    for (DateFields date : dates) {
      int d = date.getDay();
      int weekday = date.getDayOfWeek();

      if (calendarStart) {
        calendarStart = d == 1;
      }
      if (businessStart) {
        businessStart = d == 1 || (d <= 3 && weekday == 0);
      }
      if (calendarEnd || businessEnd) {
        int daysInMonth = date.getDaysInMonth();
        boolean isLast = d == daysInMonth;
        if (calendarEnd) {
          calendarEnd = isLast;
        }
        if (businessEnd) {
          businessEnd = isLast || (daysInMonth - d < 3 && weekday == 4);
        }
      } else if (!calendarStart && !businessStart) {
        break;
      }
    }

    if (calendarEnd) {
      return CALENDAR_END;
    } else if (businessEnd) {
      return BUSINESS_END;
    } else if (calendarStart) {
      return CALENDAR_START;
    } else if (businessStart) {
      return BUSINESS_START;
    }
    return null;
  }
}
