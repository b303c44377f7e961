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

package com.tseries.common.base;

import com.google.common.base.Preconditions;

import org.apache.commons.lang.StringUtils;

/**
 * Argument checks used across the time series packages that {@link Preconditions} lacks.
 */
public final class MorePreconditions {

  private static final String BLANK_MSG = "Argument cannot be blank";

  private MorePreconditions() {
    // utility
  }

  /**
   * Rejects null and blank strings with a generic message.
   *
   * @see #checkNotBlank(String, String, Object...)
   */
  public static String checkNotBlank(String text) {
    return checkNotBlank(text, BLANK_MSG);
  }

  /**
   * Rejects null strings and strings holding only whitespace.
   *
   * @param text the string to check
   * @param message a {@code %s} template for the failure message
   * @param args the template arguments
   * @return {@code text}
   * @throws NullPointerException if {@code text} is null
   * @throws IllegalArgumentException if {@code text} is empty or whitespace
   */
  public static String checkNotBlank(String text, String message, Object... args) {
    Preconditions.checkNotNull(text, message, args);
    Preconditions.checkArgument(!StringUtils.isBlank(text), message, args);
    return text;
  }

  /**
   * Rejects values outside {@code [minimum, maximum]}.
   *
   * @param value the value to check
   * @param minimum the smallest accepted value
   * @param maximum the largest accepted value
   * @param message a {@code %s} template, filled with the offending value
   * @return {@code value}
   */
  public static int checkArgumentRange(int value, int minimum, int maximum, String message) {
    Preconditions.checkArgument(minimum <= value && value <= maximum, message, value);
    return value;
  }

  /**
   * Rejects arrays shorter than {@code minimum}.
   */
  public static long[] checkMinLength(long[] values, int minimum, String message) {
    Preconditions.checkNotNull(values);
    Preconditions.checkArgument(values.length >= minimum, message);
    return values;
  }
}
