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

package com.tseries.common.quantity;

import java.util.concurrent.TimeUnit;

/**
 * Time units with nanosecond resolution.  The multiplier of each unit is the number of
 * nanoseconds it spans, which makes {@link #multiplier()} double as the "periods per unit"
 * constant used in frequency divisibility tests.
 */
public enum Time implements Unit<Time> {
  NANOSECONDS(1, TimeUnit.NANOSECONDS, "ns", "N"),
  MICROSECONDS(1000, NANOSECONDS, TimeUnit.MICROSECONDS, "us", "U"),
  MILLISECONDS(1000, MICROSECONDS, TimeUnit.MILLISECONDS, "ms", "L"),
  SECONDS(1000, MILLISECONDS, TimeUnit.SECONDS, "secs", "S"),
  MINUTES(60, SECONDS, TimeUnit.MINUTES, "mins", "T"),
  HOURS(60, MINUTES, TimeUnit.HOURS, "hrs", "H"),
  DAYS(24, HOURS, TimeUnit.DAYS, "days", "D");

  private final long multiplier;
  private final TimeUnit timeUnit;
  private final String display;
  private final String alias;

  private Time(long multiplier, TimeUnit timeUnit, String display, String alias) {
    this.multiplier = multiplier;
    this.timeUnit = timeUnit;
    this.display = display;
    this.alias = alias;
  }

  private Time(long multiplier, Time base, TimeUnit timeUnit, String display, String alias) {
    this(multiplier * base.multiplier, timeUnit, display, alias);
  }

  /**
   * Returns the number of nanoseconds in one of this unit.
   */
  @Override
  public long multiplier() {
    return multiplier;
  }

  /**
   * Returns the equivalent {@code TimeUnit}.
   */
  public TimeUnit getTimeUnit() {
    return timeUnit;
  }

  /**
   * Returns the frequency alias of a fixed step of this unit, eg: {@code "H"} for hours.
   */
  public String getAlias() {
    return alias;
  }

  @Override
  public String toString() {
    return display;
  }
}
