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

import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;

import com.tseries.common.base.MorePreconditions;

/**
 * Loads the default parameters of the business offsets from a classpath properties resource.
 * Missing resources and malformed values fall back to built-in defaults.
 */
public final class OffsetDefaults {

  private static final Logger LOG = Logger.getLogger(OffsetDefaults.class.getName());

  static final String DEFAULT_PROPERTIES_PATH = "tseries-offsets.properties";

  private static final String DEFAULT_START = "09:00";
  private static final String DEFAULT_END = "17:00";
  private static final String DEFAULT_WEEKMASK = "Mon Tue Wed Thu Fri";
  private static final LocalDate DEFAULT_WINDOW_START = LocalDate.of(1970, 1, 1);
  private static final LocalDate DEFAULT_WINDOW_END = LocalDate.of(2200, 12, 31);

  private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

  private static volatile OffsetDefaults instance;

  private final String resourcePath;

  private Properties properties = null;

  /**
   * Creates defaults that will be read from the default properties resource.
   */
  public OffsetDefaults() {
    this(DEFAULT_PROPERTIES_PATH);
  }

  /**
   * Creates defaults that will be read from the given classpath resource.
   *
   * @param resourcePath The resource path to read properties from.
   */
  public OffsetDefaults(String resourcePath) {
    this.resourcePath = MorePreconditions.checkNotBlank(resourcePath);
  }

  @VisibleForTesting
  OffsetDefaults(Properties properties) {
    this.resourcePath = null;
    this.properties = Preconditions.checkNotNull(properties);
  }

  /**
   * Returns the process wide defaults, loading them on first use.
   */
  public static OffsetDefaults get() {
    if (instance == null) {
      synchronized (OffsetDefaults.class) {
        if (instance == null) {
          instance = new OffsetDefaults();
        }
      }
    }
    return instance;
  }

  private void fetchProperties() {
    properties = new Properties();
    LOG.info("Loading offset defaults from " + resourcePath);
    InputStream in = OffsetDefaults.class.getClassLoader().getResourceAsStream(resourcePath);
    if (in == null) {
      LOG.warning("Failed to find offset defaults at " + resourcePath + ", using built-ins");
      return;
    }

    try {
      properties.load(in);
    } catch (IOException e) {
      LOG.log(Level.WARNING, "Failed to load properties file " + resourcePath, e);
    } finally {
      try {
        in.close();
      } catch (IOException e) {
        LOG.log(Level.FINE, "Failed to close " + resourcePath, e);
      }
    }
  }

  /**
   * Fetches the properties stored in the resource location.
   *
   * @return The loaded properties, or an empty properties object if there was a problem loading
   *    the specified properties resource.
   */
  public synchronized Properties getProperties() {
    if (properties == null) fetchProperties();
    return properties;
  }

  private String getValue(Key key, String defaultValue) {
    return getProperties().getProperty(key.value, defaultValue).trim();
  }

  /**
   * Returns the default opening hours of business hour offsets.
   */
  public OpeningHours getOpeningHours() {
    List<String> starts = LIST_SPLITTER.splitToList(getValue(Key.START, DEFAULT_START));
    List<String> ends = LIST_SPLITTER.splitToList(getValue(Key.END, DEFAULT_END));
    try {
      return OpeningHours.of(starts, ends);
    } catch (IllegalArgumentException e) {
      LOG.log(Level.WARNING, "Invalid default business hours " + starts + "-" + ends, e);
      return OpeningHours.of(DEFAULT_START, DEFAULT_END);
    }
  }

  /**
   * Returns the default weekmask of custom business offsets.
   */
  public Weekmask getWeekmask() {
    String weekmask = getValue(Key.WEEKMASK, DEFAULT_WEEKMASK);
    try {
      return Weekmask.parse(weekmask);
    } catch (IllegalArgumentException e) {
      LOG.log(Level.WARNING, "Invalid default weekmask " + weekmask, e);
      return Weekmask.WEEKDAYS;
    }
  }

  /**
   * Returns the first day requested from external holiday calendars.
   */
  public LocalDate getHolidayWindowStart() {
    return getDate(Key.HOLIDAY_WINDOW_START, DEFAULT_WINDOW_START);
  }

  /**
   * Returns the last day requested from external holiday calendars.
   */
  public LocalDate getHolidayWindowEnd() {
    return getDate(Key.HOLIDAY_WINDOW_END, DEFAULT_WINDOW_END);
  }

  private LocalDate getDate(Key key, LocalDate defaultValue) {
    String value = getProperties().getProperty(key.value);
    if (value == null) {
      return defaultValue;
    }
    try {
      return LocalDate.parse(value.trim());
    } catch (DateTimeParseException e) {
      LOG.log(Level.WARNING, "Invalid date for " + key.value + ": " + value, e);
      return defaultValue;
    }
  }

  /**
   * Keys recognized in the properties resource.
   */
  public enum Key {
    START("business.hours.start"),
    END("business.hours.end"),
    WEEKMASK("business.weekmask"),
    HOLIDAY_WINDOW_START("holiday.calendar.start"),
    HOLIDAY_WINDOW_END("holiday.calendar.end");

    public final String value;
    private Key(String value) {
      this.value = value;
    }
  }
}
