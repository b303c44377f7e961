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

import java.util.Set;
import java.util.logging.Logger;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Sets;

import com.tseries.common.calendar.CalendarUtil;
import com.tseries.common.calendar.DateFields;
import com.tseries.common.calendar.MonthPosition;
import com.tseries.common.quantity.Time;
import com.tseries.common.timeseries.DatetimeIndex;
import com.tseries.common.timeseries.Deltas;

/**
 * Infers the frequency alias of a sequence of timestamps, eg: {@code "B"} for timestamps one
 * business day apart.  An inferer is built for one sequence and computes each derived view
 * (deltas, calendar fields, month and year steps) once, on first use.
 *
 * <p>Daily spacing is classified, in order, as annual, quarterly, monthly, evenly spaced days or
 * weeks, business days, or a fixed week of the month.  Sub-daily spacing is classified as business
 * hours or as an even step of hours, minutes, seconds, milliseconds, microseconds or nanoseconds.
 */
public class FrequencyInferer {

  private static final Logger LOG = Logger.getLogger(FrequencyInferer.class.getName());

  static final long PERIODS_PER_DAY = Time.DAYS.multiplier();
  static final long PERIODS_PER_HOUR = Time.HOURS.multiplier();

  // Sub-daily units tried coarsest first.
  private static final Time[] INTRADAY_UNITS = {
      Time.HOURS, Time.MINUTES, Time.SECONDS, Time.MILLISECONDS, Time.MICROSECONDS
  };

  // Hour deltas of hourly business data: overnight (17) and over a weekend (65).
  private static final long[][] BUSINESS_HOUR_DELTAS = {{1, 17}, {1, 65}, {1, 17, 65}};

  private static final ImmutableMap<MonthPosition, String> ANNUAL_RULES = ImmutableMap.of(
      MonthPosition.CALENDAR_START, "AS",
      MonthPosition.BUSINESS_START, "BAS",
      MonthPosition.CALENDAR_END, "A",
      MonthPosition.BUSINESS_END, "BA");

  private static final ImmutableMap<MonthPosition, String> QUARTERLY_RULES = ImmutableMap.of(
      MonthPosition.CALENDAR_START, "QS",
      MonthPosition.BUSINESS_START, "BQS",
      MonthPosition.CALENDAR_END, "Q",
      MonthPosition.BUSINESS_END, "BQ");

  private static final ImmutableMap<MonthPosition, String> MONTHLY_RULES = ImmutableMap.of(
      MonthPosition.CALENDAR_START, "MS",
      MonthPosition.BUSINESS_START, "BMS",
      MonthPosition.CALENDAR_END, "M",
      MonthPosition.BUSINESS_END, "BM");

  // Quarter anchor month by (month % 3).
  private static final int[] QUARTER_END_MONTH = {12, 10, 11};

  private final long[] values;
  private final long[] localValues;
  private final boolean monotonic;
  private final boolean unique;

  private long[] deltas = null;
  private long[] deltasAsi8 = null;
  private DateFields[] fields = null;
  private long[] mdiffs = null;
  private long[] ydiffs = null;

  /**
   * @param index the timestamps, at least three
   * @throws IllegalArgumentException if the index holds fewer than three timestamps
   */
  public FrequencyInferer(DatetimeIndex index) {
    this(Preconditions.checkNotNull(index).asi8(), index.getLocalValues(),
        index.isMonotonicIncreasing() || index.isMonotonicDecreasing(), index.isUnique());
  }

  /**
   * @param values the raw values
   * @param localValues the values on the local wall clock, used for calendar decisions
   * @param monotonic whether the values never change direction
   * @param unique whether no value repeats
   */
  protected FrequencyInferer(long[] values, long[] localValues, boolean monotonic,
      boolean unique) {
    Preconditions.checkArgument(values.length >= 3, "Need at least 3 dates to infer frequency");
    Preconditions.checkArgument(values.length == localValues.length);
    this.values = values;
    this.localValues = localValues;
    this.monotonic = monotonic;
    this.unique = unique;
  }

  /**
   * Returns the inferred frequency alias, or {@code null} when the spacing matches no frequency.
   */
  @Nullable
  public String getFreq() {
    if (!monotonic || !unique) {
      LOG.fine("No frequency: values are not monotonic and unique");
      return null;
    }

    long delta = getDeltas()[0];
    if (delta != 0 && delta % PERIODS_PER_DAY == 0) {
      return inferDailyRule();
    }

    if (isBusinessHourly()) {
      return "BH";
    }

    // Raw values, since local values jump at daylight saving transitions.
    if (getDeltasAsi8().length != 1) {
      LOG.fine("No frequency: irregular intraday spacing " + getDeltasAsi8().length);
      return null;
    }

    delta = getDeltasAsi8()[0];
    for (Time unit : INTRADAY_UNITS) {
      if (delta % unit.multiplier() == 0) {
        return maybeAddCount(unit.getAlias(), delta / unit.multiplier());
      }
    }
    return maybeAddCount(Time.NANOSECONDS.getAlias(), delta);
  }

  /**
   * Classifies spacing that is a whole number of days.
   */
  @Nullable
  protected String inferDailyRule() {
    String annualRule = getAnnualRule();
    if (annualRule != null) {
      String month = CalendarUtil.monthAlias(getFields()[0].getMonth());
      return maybeAddCount(annualRule + "-" + month, getYdiffs()[0]);
    }

    String quarterlyRule = getQuarterlyRule();
    if (quarterlyRule != null) {
      int month = QUARTER_END_MONTH[getFields()[0].getMonth() % 3];
      return maybeAddCount(quarterlyRule + "-" + CalendarUtil.monthAlias(month),
          getMdiffs()[0] / 3);
    }

    String monthlyRule = getMonthlyRule();
    if (monthlyRule != null) {
      return maybeAddCount(monthlyRule, getMdiffs()[0]);
    }

    if (isUnique()) {
      return getDailyRule();
    }

    if (isBusinessDaily()) {
      return "B";
    }

    String womRule = getWeekOfMonthRule();
    if (womRule == null) {
      LOG.fine("No frequency: irregular daily spacing");
    }
    return womRule;
  }

  /**
   * Returns {@code "D"} or {@code "W-<DAY>"} for evenly spaced days, counted.
   */
  protected String getDailyRule() {
    long days = getDeltas()[0] / PERIODS_PER_DAY;
    if (days % 7 == 0) {
      String weekday = CalendarUtil.weekdayAlias(
          CalendarUtil.dayOfWeek(Math.floorDiv(localValues[0], PERIODS_PER_DAY)));
      return maybeAddCount("W-" + weekday, days / 7);
    }
    return maybeAddCount("D", days);
  }

  @Nullable
  private String getAnnualRule() {
    if (getYdiffs().length > 1) {
      return null;
    }
    Set<Integer> months = Sets.newHashSet();
    for (DateFields field : getFields()) {
      months.add(field.getMonth());
    }
    if (months.size() > 1) {
      return null;
    }
    MonthPosition position = MonthPosition.check(getFields());
    return position == null ? null : ANNUAL_RULES.get(position);
  }

  @Nullable
  private String getQuarterlyRule() {
    if (getMdiffs().length > 1 || getMdiffs()[0] % 3 != 0) {
      return null;
    }
    MonthPosition position = MonthPosition.check(getFields());
    return position == null ? null : QUARTERLY_RULES.get(position);
  }

  @Nullable
  private String getMonthlyRule() {
    if (getMdiffs().length > 1) {
      return null;
    }
    MonthPosition position = MonthPosition.check(getFields());
    return position == null ? null : MONTHLY_RULES.get(position);
  }

  /**
   * Day steps are exactly one and three days, and replaying them from the first weekday lands
   * every three day step on a Monday and every one day step on Tuesday through Friday.
   */
  private boolean isBusinessDaily() {
    if (!deltasEqual(getDeltas(), PERIODS_PER_DAY, 1, 3)) {
      return false;
    }

    long weekday = getFields()[0].getDayOfWeek();
    long[] shifts = Deltas.diff(localValues);
    for (long shift : shifts) {
      long days = Math.floorDiv(shift, PERIODS_PER_DAY);
      weekday = Math.floorMod(weekday + days, 7L);
      boolean mondayAfterWeekend = weekday == 0 && days == 3;
      boolean midweek = weekday > 0 && weekday <= 4 && days == 1;
      if (!mondayAfterWeekend && !midweek) {
        return false;
      }
    }
    return true;
  }

  @Nullable
  private String getWeekOfMonthRule() {
    Set<Integer> weekdays = Sets.newHashSet();
    Set<Integer> weeksOfMonth = Sets.newHashSet();
    for (DateFields field : getFields()) {
      weekdays.add(field.getDayOfWeek());
      int week = (field.getDay() - 1) / 7;
      // WOM-5 is never inferred.
      if (week < 4) {
        weeksOfMonth.add(week);
      }
    }
    if (weekdays.size() > 1 || weeksOfMonth.size() != 1) {
      return null;
    }
    int week = weeksOfMonth.iterator().next() + 1;
    return "WOM-" + week + CalendarUtil.weekdayAlias(weekdays.iterator().next());
  }

  private boolean isBusinessHourly() {
    for (long[] hourDeltas : BUSINESS_HOUR_DELTAS) {
      if (deltasEqual(getDeltas(), PERIODS_PER_HOUR, hourDeltas)) {
        return true;
      }
    }
    return false;
  }

  private static boolean deltasEqual(long[] deltas, long unit, long... expected) {
    if (deltas.length != expected.length) {
      return false;
    }
    for (int i = 0; i < deltas.length; i++) {
      if (deltas[i] != expected[i] * unit) {
        return false;
      }
    }
    return true;
  }

  static String maybeAddCount(String base, long count) {
    return count == 1 ? base : count + base;
  }

  /**
   * Returns whether the local values are evenly spaced.
   */
  protected boolean isUnique() {
    return getDeltas().length == 1;
  }

  /**
   * Returns the sorted unique deltas of the local values.
   */
  protected long[] getDeltas() {
    if (deltas == null) {
      deltas = Deltas.uniqueDeltas(localValues);
    }
    return deltas;
  }

  private long[] getDeltasAsi8() {
    if (deltasAsi8 == null) {
      deltasAsi8 = Deltas.uniqueDeltas(values);
    }
    return deltasAsi8;
  }

  private DateFields[] getFields() {
    if (fields == null) {
      fields = new DateFields[localValues.length];
      for (int i = 0; i < localValues.length; i++) {
        fields[i] = DateFields.ofEpochDay(Math.floorDiv(localValues[i], PERIODS_PER_DAY));
      }
    }
    return fields;
  }

  private long[] getMdiffs() {
    if (mdiffs == null) {
      long[] months = new long[getFields().length];
      for (int i = 0; i < months.length; i++) {
        months[i] = fields[i].getYear() * 12L + fields[i].getMonth();
      }
      mdiffs = Deltas.uniqueDeltas(months);
    }
    return mdiffs;
  }

  private long[] getYdiffs() {
    if (ydiffs == null) {
      long[] years = new long[getFields().length];
      for (int i = 0; i < years.length; i++) {
        years[i] = fields[i].getYear();
      }
      ydiffs = Deltas.uniqueDeltas(years);
    }
    return ydiffs;
  }
}
