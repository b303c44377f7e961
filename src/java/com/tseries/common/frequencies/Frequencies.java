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

package com.tseries.common.frequencies;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import com.tseries.common.calendar.CalendarUtil;
import com.tseries.common.offsets.DateOffset;
import com.tseries.common.timeseries.DatetimeIndex;
import com.tseries.common.timeseries.PeriodIndex;
import com.tseries.common.timeseries.TimeIndex;
import com.tseries.common.timeseries.TimedeltaIndex;
import com.tseries.common.timeseries.Timestamp;

/**
 * Frequency inference and comparison over frequency aliases such as {@code "D"}, {@code "BM"} or
 * {@code "Q-DEC"}.
 */
public final class Frequencies {

  private static final ImmutableSet<String> DAILY_AND_FINER =
      ImmutableSet.of("D", "C", "B", "H", "T", "S", "L", "U", "N");

  private static final ImmutableSet<String> MONTHLY_AND_FINER =
      ImmutableSet.<String>builder().addAll(DAILY_AND_FINER).add("M").build();

  // Each intraday alias upsamples to itself and every finer alias.
  private static final ImmutableMap<String, ImmutableSet<String>> INTRADAY_FINER =
      ImmutableMap.<String, ImmutableSet<String>>builder()
          .put("H", ImmutableSet.of("H", "T", "S", "L", "U", "N"))
          .put("T", ImmutableSet.of("T", "S", "L", "U", "N"))
          .put("S", ImmutableSet.of("S", "L", "U", "N"))
          .put("L", ImmutableSet.of("L", "U", "N"))
          .put("U", ImmutableSet.of("U", "N"))
          .put("N", ImmutableSet.of("N"))
          .build();

  private static final ImmutableMap<String, String> OFFSET_TO_PERIOD = buildOffsetToPeriod();

  private static ImmutableMap<String, String> buildOffsetToPeriod() {
    ImmutableMap<String, String> base = ImmutableMap.<String, String>builder()
        .put("WEEKDAY", "D").put("EOM", "M").put("BM", "M").put("BQS", "Q").put("QS", "Q")
        .put("BQ", "Q").put("BA", "A").put("AS", "A").put("BAS", "A").put("MS", "M")
        .put("D", "D").put("B", "B").put("T", "T").put("S", "S").put("L", "L").put("U", "U")
        .put("N", "N").put("H", "H").put("Q", "Q").put("A", "A").put("W", "W").put("M", "M")
        .put("Y", "A").put("BY", "A").put("YS", "A").put("BYS", "A")
        .build();

    ImmutableMap.Builder<String, String> aliases = ImmutableMap.builder();
    aliases.putAll(base);
    for (String prefix : ImmutableSet.of("QS", "BQ", "BQS", "YS", "AS", "BY", "BA", "BYS", "BAS")) {
      for (String month : CalendarUtil.MONTHS) {
        aliases.put(prefix + "-" + month, base.get(prefix));
      }
    }
    for (String prefix : ImmutableSet.of("A", "Q")) {
      for (String month : CalendarUtil.MONTHS) {
        aliases.put(prefix + "-" + month, prefix + "-" + month);
      }
    }
    for (String day : CalendarUtil.DAYS) {
      aliases.put("W-" + day, "W-" + day);
    }
    return aliases.build();
  }

  private Frequencies() {
    // utility
  }

  /**
   * Infers the frequency of timestamps.
   *
   * @return the alias, or {@code null} if the timestamps have no discernible frequency
   * @throws IllegalArgumentException if fewer than three timestamps are given
   */
  @Nullable
  public static String inferFreq(Iterable<Timestamp> timestamps) {
    return inferFreq(DatetimeIndex.of(timestamps));
  }

  /**
   * Infers the frequency of an index of timestamps or durations.
   *
   * @return the alias, or {@code null} if the index has no discernible frequency
   * @throws IllegalArgumentException if the index holds fewer than three values, or is a period
   *     index or of another non-temporal kind
   */
  @Nullable
  public static String inferFreq(TimeIndex index) {
    Preconditions.checkNotNull(index);
    if (index instanceof PeriodIndex) {
      throw new IllegalArgumentException(
          "PeriodIndex given. Check the freq attribute instead of using inferFreq.");
    } else if (index instanceof TimedeltaIndex) {
      return new TimedeltaFrequencyInferer((TimedeltaIndex) index).getFreq();
    } else if (index instanceof DatetimeIndex) {
      return new FrequencyInferer((DatetimeIndex) index).getFreq();
    }
    throw new IllegalArgumentException(
        "cannot infer freq from a non-convertible index of type " + index.getClass().getName());
  }

  /**
   * Returns whether data at frequency {@code source} can be downsampled to {@code target}.
   * Accepts aliases or {@link DateOffset}s; {@code null} on either side yields false.
   */
  public static boolean isSubperiod(@Nullable Object source, @Nullable Object target) {
    return isSuperperiod(target, source);
  }

  /**
   * Returns whether data at frequency {@code source} can be upsampled to {@code target}.
   * Accepts aliases or {@link DateOffset}s; {@code null} on either side yields false.
   */
  public static boolean isSuperperiod(@Nullable Object source, @Nullable Object target) {
    if (source == null || target == null) {
      return false;
    }
    String coarse = coerce(source);
    String fine = coerce(target);

    if (isAnnual(coarse)) {
      if (isAnnual(fine)) {
        return getRuleMonth(coarse).equals(getRuleMonth(fine));
      }
      if (isQuarterly(fine)) {
        return quarterMonthsConform(getRuleMonth(coarse), getRuleMonth(fine));
      }
      return MONTHLY_AND_FINER.contains(fine);
    } else if (isQuarterly(coarse)) {
      return MONTHLY_AND_FINER.contains(fine);
    } else if (isMonthly(coarse)) {
      return DAILY_AND_FINER.contains(fine);
    } else if (isWeekly(coarse)) {
      return coarse.equals(fine) || DAILY_AND_FINER.contains(fine);
    } else if (coarse.equals("B") || coarse.equals("C") || coarse.equals("D")) {
      return DAILY_AND_FINER.contains(fine);
    } else if (INTRADAY_FINER.containsKey(coarse)) {
      return INTRADAY_FINER.get(coarse).contains(fine);
    }
    return false;
  }

  private static String coerce(Object code) {
    if (code instanceof DateOffset) {
      return ((DateOffset) code).getRuleCode().toUpperCase();
    } else if (code instanceof String) {
      return ((String) code).toUpperCase();
    }
    throw new IllegalArgumentException("Not a frequency: " + code);
  }

  /**
   * Returns the anchor month of an alias, {@code "DEC"} when it has no month suffix.
   */
  public static String getRuleMonth(String alias) {
    String upper = Preconditions.checkNotNull(alias).toUpperCase();
    int dash = upper.indexOf('-');
    if (dash < 0) {
      return "DEC";
    }
    int end = upper.indexOf('-', dash + 1);
    return end < 0 ? upper.substring(dash + 1) : upper.substring(dash + 1, end);
  }

  /**
   * Returns whether quarters anchored on the two months coincide, ie: the months agree modulo 3.
   *
   * @throws IllegalArgumentException if either month abbreviation is unknown
   */
  public static boolean quarterMonthsConform(String sourceMonth, String targetMonth) {
    return quarterMonthsConform(
        CalendarUtil.monthNumber(sourceMonth), CalendarUtil.monthNumber(targetMonth));
  }

  public static boolean quarterMonthsConform(int sourceMonth, int targetMonth) {
    return sourceMonth % 3 == targetMonth % 3;
  }

  /**
   * Maps an offset alias to the alias of the closest period frequency, eg: {@code "BQ"} to
   * {@code "Q"}.
   *
   * @return the period alias, or {@code null} if there is none
   */
  @Nullable
  public static String getPeriodAlias(String offsetAlias) {
    return OFFSET_TO_PERIOD.get(offsetAlias);
  }

  static boolean isAnnual(String rule) {
    String upper = rule.toUpperCase();
    return upper.equals("A") || upper.startsWith("A-");
  }

  static boolean isQuarterly(String rule) {
    String upper = rule.toUpperCase();
    return upper.equals("Q") || upper.startsWith("Q-") || upper.startsWith("BQ");
  }

  static boolean isMonthly(String rule) {
    String upper = rule.toUpperCase();
    return upper.equals("M") || upper.equals("BM");
  }

  static boolean isWeekly(String rule) {
    String upper = rule.toUpperCase();
    return upper.equals("W") || upper.startsWith("W-");
  }
}
