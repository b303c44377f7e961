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
import java.time.LocalTime;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import com.tseries.common.quantity.Time;

/**
 * The daily opening intervals of a business hour offset.  Intervals are kept sorted by opening
 * time; an interval whose end is not after its start closes on the following calendar day.
 */
public final class OpeningHours implements Serializable {

  private static final long serialVersionUID = 1L;

  private static final Pattern HOUR_MINUTE = Pattern.compile("(\\d{1,2}):(\\d{1,2})");

  private static final long NANOS_PER_MINUTE = Time.MINUTES.multiplier();
  private static final int MINUTES_PER_DAY = 24 * 60;

  // Minutes of the day, sorted by start.
  private final int[] starts;
  private final int[] ends;

  private OpeningHours(int[] starts, int[] ends) {
    this.starts = starts;
    this.ends = ends;
  }

  /**
   * Creates single interval opening hours from {@code HH:MM} strings.
   */
  public static OpeningHours of(String start, String end) {
    return of(ImmutableList.of(start), ImmutableList.of(end));
  }

  /**
   * Creates opening hours from parallel lists of {@code HH:MM} strings.
   *
   * @throws IllegalArgumentException if a list is empty, the lists differ in length, a time does
   *     not parse, or two intervals touch or overlap
   */
  public static OpeningHours of(List<String> starts, List<String> ends) {
    Preconditions.checkNotNull(starts);
    Preconditions.checkNotNull(ends);
    int[] startMinutes = new int[starts.size()];
    for (int i = 0; i < startMinutes.length; i++) {
      startMinutes[i] = parseMinutes(starts.get(i));
    }
    int[] endMinutes = new int[ends.size()];
    for (int i = 0; i < endMinutes.length; i++) {
      endMinutes[i] = parseMinutes(ends.get(i));
    }
    return create(startMinutes, endMinutes);
  }

  /**
   * Creates opening hours from times of day, which must carry no seconds or fractions.
   */
  public static OpeningHours ofTimes(List<LocalTime> starts, List<LocalTime> ends) {
    Preconditions.checkNotNull(starts);
    Preconditions.checkNotNull(ends);
    int[] startMinutes = new int[starts.size()];
    for (int i = 0; i < startMinutes.length; i++) {
      startMinutes[i] = toMinutes(starts.get(i));
    }
    int[] endMinutes = new int[ends.size()];
    for (int i = 0; i < endMinutes.length; i++) {
      endMinutes[i] = toMinutes(ends.get(i));
    }
    return create(startMinutes, endMinutes);
  }

  private static OpeningHours create(int[] starts, int[] ends) {
    Preconditions.checkArgument(starts.length > 0, "Must include at least 1 start time");
    Preconditions.checkArgument(ends.length > 0, "Must include at least 1 end time");
    Preconditions.checkArgument(starts.length == ends.length,
        "number of starting time and ending time must be the same");

    Integer[] order = new Integer[starts.length];
    for (int i = 0; i < order.length; i++) {
      order[i] = i;
    }
    final int[] unsorted = starts;
    Arrays.sort(order, new Comparator<Integer>() {
      @Override public int compare(Integer a, Integer b) {
        return Integer.compare(unsorted[a], unsorted[b]);
      }
    });
    int[] sortedStarts = new int[starts.length];
    int[] sortedEnds = new int[ends.length];
    for (int i = 0; i < order.length; i++) {
      sortedStarts[i] = starts[order[i]];
      sortedEnds[i] = ends[order[i]];
    }

    // Open and closed spans tile exactly one day only when no two intervals touch or overlap.
    int total = 0;
    for (int i = 0; i < sortedStarts.length; i++) {
      total += spanMinutes(sortedStarts[i], sortedEnds[i]);
      total += spanMinutes(sortedEnds[i], sortedStarts[(i + 1) % sortedStarts.length]);
    }
    Preconditions.checkArgument(total == MINUTES_PER_DAY,
        "invalid starting and ending time(s): opening hours should not touch or overlap with one"
            + " another");
    return new OpeningHours(sortedStarts, sortedEnds);
  }

  private static int parseMinutes(String time) {
    Preconditions.checkNotNull(time);
    Matcher matcher = HOUR_MINUTE.matcher(time.trim());
    Preconditions.checkArgument(matcher.matches(), "time data must match '%H:%M' format");
    int hour = Integer.parseInt(matcher.group(1));
    int minute = Integer.parseInt(matcher.group(2));
    Preconditions.checkArgument(hour < 24 && minute < 60, "time data must match '%H:%M' format");
    return hour * 60 + minute;
  }

  private static int toMinutes(LocalTime time) {
    Preconditions.checkNotNull(time);
    Preconditions.checkArgument(time.getSecond() == 0 && time.getNano() == 0,
        "time data must be specified only with hour and minute");
    return time.getHour() * 60 + time.getMinute();
  }

  private static int spanMinutes(int start, int end) {
    return start < end ? end - start : end - start + MINUTES_PER_DAY;
  }

  public int size() {
    return starts.length;
  }

  /**
   * Returns the opening time of interval {@code i} as nanoseconds into the day.
   */
  public long getStart(int i) {
    return starts[i] * NANOS_PER_MINUTE;
  }

  /**
   * Returns the closing time of interval {@code i} as nanoseconds into the day it closes on.
   */
  public long getEnd(int i) {
    return ends[i] * NANOS_PER_MINUTE;
  }

  /**
   * Returns the length of interval {@code i} in nanoseconds.
   */
  public long getDuration(int i) {
    return spanMinutes(starts[i], ends[i]) * NANOS_PER_MINUTE;
  }

  /**
   * Returns the summed length of all intervals in nanoseconds.
   */
  public long getTotalDuration() {
    long total = 0;
    for (int i = 0; i < starts.length; i++) {
      total += getDuration(i);
    }
    return total;
  }

  public long getEarliestStart() {
    return getStart(0);
  }

  public long getLatestStart() {
    return getStart(starts.length - 1);
  }

  /**
   * Returns the index of the interval opening exactly at {@code nanoOfDay}, or -1.
   */
  public int indexOfStart(long nanoOfDay) {
    for (int i = 0; i < starts.length; i++) {
      if (getStart(i) == nanoOfDay) {
        return i;
      }
    }
    return -1;
  }

  public boolean isEnd(long nanoOfDay) {
    for (int i = 0; i < ends.length; i++) {
      if (getEnd(i) == nanoOfDay) {
        return true;
      }
    }
    return false;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof OpeningHours)) {
      return false;
    }
    OpeningHours other = (OpeningHours) o;
    return Arrays.equals(starts, other.starts) && Arrays.equals(ends, other.ends);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(starts) + Arrays.hashCode(ends);
  }

  /**
   * Returns the intervals as {@code HH:MM-HH:MM}, comma separated.
   */
  @Override
  public String toString() {
    List<String> intervals = Lists.newArrayList();
    for (int i = 0; i < starts.length; i++) {
      intervals.add(format(starts[i]) + "-" + format(ends[i]));
    }
    return Joiner.on(',').join(intervals);
  }

  private static String format(int minutes) {
    return String.format("%02d:%02d", minutes / 60, minutes % 60);
  }
}
