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

import org.apache.commons.lang.builder.EqualsBuilder;
import org.apache.commons.lang.builder.HashCodeBuilder;

/**
 * An ISO-8601 week date: ISO year, week of that year and weekday (1 for Monday through 7 for
 * Sunday).
 */
public final class IsoCalendarDate {

  private final int year;
  private final int week;
  private final int weekday;

  public IsoCalendarDate(int year, int week, int weekday) {
    this.year = year;
    this.week = week;
    this.weekday = weekday;
  }

  public int getYear() {
    return year;
  }

  public int getWeek() {
    return week;
  }

  public int getWeekday() {
    return weekday;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof IsoCalendarDate)) {
      return false;
    }
    IsoCalendarDate other = (IsoCalendarDate) o;
    return new EqualsBuilder()
        .append(year, other.year)
        .append(week, other.week)
        .append(weekday, other.weekday)
        .isEquals();
  }

  @Override
  public int hashCode() {
    return new HashCodeBuilder().append(year).append(week).append(weekday).toHashCode();
  }

  @Override
  public String toString() {
    return "(" + year + ", " + week + ", " + weekday + ")";
  }
}
