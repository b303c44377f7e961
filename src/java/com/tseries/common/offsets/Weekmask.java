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
import java.util.Arrays;
import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.Lists;

import com.tseries.common.base.MorePreconditions;
import com.tseries.common.calendar.CalendarUtil;

/**
 * The days of the week, Monday first, on which business is conducted.
 */
public final class Weekmask implements Serializable {

  private static final long serialVersionUID = 1L;

  private static final String[] NAMES = {"Mon", "Tue", "Wed", "Thu", "Fri", "Sat", "Sun"};

  /**
   * Monday through Friday.
   */
  public static final Weekmask WEEKDAYS = of(true, true, true, true, true, false, false);

  private final boolean[] days;

  private Weekmask(boolean[] days) {
    this.days = days;
  }

  /**
   * Creates a weekmask from seven flags, Monday first.
   *
   * @throws IllegalArgumentException if there are not exactly seven flags or none is set
   */
  public static Weekmask of(boolean... days) {
    Preconditions.checkNotNull(days);
    Preconditions.checkArgument(days.length == 7,
        "A business day weekmask must have length 7, got %s", days.length);
    boolean any = false;
    for (boolean day : days) {
      any |= day;
    }
    Preconditions.checkArgument(any, "Cannot construct a business day weekmask of all zeros");
    return new Weekmask(days.clone());
  }

  /**
   * Creates a weekmask from seven 0/1 flags, Monday first.
   */
  public static Weekmask fromFlags(int... flags) {
    Preconditions.checkNotNull(flags);
    boolean[] days = new boolean[flags.length];
    for (int i = 0; i < flags.length; i++) {
      Preconditions.checkArgument(flags[i] == 0 || flags[i] == 1,
          "Weekmask flags must be 0 or 1, got %s", flags[i]);
      days[i] = flags[i] == 1;
    }
    return of(days);
  }

  /**
   * Parses either a seven character 0/1 string such as {@code "1111100"} or a whitespace
   * separated list of weekday names such as {@code "Mon Tue Wed Thu Fri"}.
   *
   * @throws IllegalArgumentException if the text is neither form
   */
  public static Weekmask parse(String text) {
    String mask = MorePreconditions.checkNotBlank(text, "Weekmask cannot be blank").trim();
    if (mask.matches("[01]{7}")) {
      boolean[] days = new boolean[7];
      for (int i = 0; i < 7; i++) {
        days[i] = mask.charAt(i) == '1';
      }
      return of(days);
    }

    boolean[] days = new boolean[7];
    for (String name : Splitter.onPattern("\\s+").omitEmptyStrings().split(mask)) {
      int weekday;
      try {
        weekday = CalendarUtil.weekdayNumber(name);
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException("Invalid business day weekmask string " + text, e);
      }
      days[weekday] = true;
    }
    return of(days);
  }

  /**
   * Returns whether business is conducted on a 0-based (Monday) weekday.
   */
  public boolean isBusinessDay(int weekday) {
    return days[weekday];
  }

  /**
   * Returns the number of business days per week.
   */
  public int count() {
    int count = 0;
    for (boolean day : days) {
      if (day) {
        count++;
      }
    }
    return count;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Weekmask && Arrays.equals(days, ((Weekmask) o).days);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(days);
  }

  /**
   * Returns the weekday names, eg: {@code "Mon Tue Wed Thu Fri"}.
   */
  @Override
  public String toString() {
    List<String> names = Lists.newArrayList();
    for (int i = 0; i < days.length; i++) {
      if (days[i]) {
        names.add(NAMES[i]);
      }
    }
    return Joiner.on(' ').join(names);
  }
}
