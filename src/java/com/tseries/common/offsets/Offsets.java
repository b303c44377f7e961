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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Function;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

import com.tseries.common.base.MorePreconditions;

/**
 * Builds business offsets from frequency strings such as {@code "B"}, {@code "-2C"} or
 * {@code "3BH"}.  Offsets built here use the configured defaults for any parameters beyond the
 * multiplier.
 */
public final class Offsets {

  private static final Pattern FREQUENCY = Pattern.compile("([+-]?\\d*)\\s*([A-Za-z]+)");

  private static final ImmutableMap<String, Function<Integer, DateOffset>> PREFIX_MAPPING =
      ImmutableMap.<String, Function<Integer, DateOffset>>builder()
          .put("B", new Function<Integer, DateOffset>() {
            @Override public DateOffset apply(Integer n) {
              return new BusinessDay(n);
            }
          })
          .put("C", new Function<Integer, DateOffset>() {
            @Override public DateOffset apply(Integer n) {
              return new CustomBusinessDay(n);
            }
          })
          .put("BH", new Function<Integer, DateOffset>() {
            @Override public DateOffset apply(Integer n) {
              return new BusinessHour(n);
            }
          })
          .put("CBH", new Function<Integer, DateOffset>() {
            @Override public DateOffset apply(Integer n) {
              return new CustomBusinessHour(n);
            }
          })
          .put("CBM", new Function<Integer, DateOffset>() {
            @Override public DateOffset apply(Integer n) {
              return new CustomBusinessMonthEnd(n);
            }
          })
          .put("CBMS", new Function<Integer, DateOffset>() {
            @Override public DateOffset apply(Integer n) {
              return new CustomBusinessMonthBegin(n);
            }
          })
          .build();

  private Offsets() {
    // utility
  }

  /**
   * Returns the rule codes {@link #toOffset(String)} understands.
   */
  public static Iterable<String> ruleCodes() {
    return PREFIX_MAPPING.keySet();
  }

  /**
   * Parses a frequency string: an optional signed count followed by a rule code.
   *
   * @param freq eg: {@code "3BH"}
   * @return the offset
   * @throws IllegalArgumentException if the string is malformed or the rule code unknown
   */
  public static DateOffset toOffset(String freq) {
    MorePreconditions.checkNotBlank(freq, "Invalid frequency: %s", freq);
    Matcher matcher = FREQUENCY.matcher(freq.trim());
    Preconditions.checkArgument(matcher.matches(), "Invalid frequency: %s", freq);

    Function<Integer, DateOffset> factory = PREFIX_MAPPING.get(matcher.group(2).toUpperCase());
    Preconditions.checkArgument(factory != null, "Invalid frequency: %s", freq);
    return factory.apply(parseCount(matcher.group(1), freq));
  }

  private static int parseCount(String count, String freq) {
    if (count.isEmpty() || "+".equals(count)) {
      return 1;
    } else if ("-".equals(count)) {
      return -1;
    }
    try {
      return Integer.parseInt(count.startsWith("+") ? count.substring(1) : count);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid frequency: " + freq, e);
    }
  }
}
