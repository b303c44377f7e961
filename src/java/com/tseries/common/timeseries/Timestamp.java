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

package com.tseries.common.timeseries;

import java.io.Serializable;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;

import javax.annotation.Nullable;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.math.LongMath;

import com.tseries.common.base.MorePreconditions;
import com.tseries.common.calendar.DateFields;
import com.tseries.common.offsets.DateOffset;
import com.tseries.common.quantity.Amount;
import com.tseries.common.quantity.Time;

/**
 * A point in time as a signed count of nanoseconds since 1970-01-01T00:00:00Z, optionally tagged
 * with a time zone.  Calendar fields are read from the local wall clock of the zone, or from the
 * UTC clock when no zone is attached.
 *
 * <p>{@link #NOT_A_TIME} stands for a missing value; offsets return it unchanged.
 */
public final class Timestamp implements Comparable<Timestamp>, Serializable {

  private static final long serialVersionUID = 1L;

  /**
   * The raw value reserved for {@link #NOT_A_TIME}.
   */
  public static final long NAT_VALUE = Long.MIN_VALUE;

  public static final Timestamp NOT_A_TIME = new Timestamp(NAT_VALUE, null);

  private static final long NANOS_PER_SECOND = Time.SECONDS.multiplier();
  private static final long NANOS_PER_DAY = Time.DAYS.multiplier();

  private static final DateTimeFormatter PARSER = new DateTimeFormatterBuilder()
      .appendPattern("uuuu-MM-dd")
      .optionalStart()
        .appendLiteral(' ')
        .appendPattern("HH:mm")
        .optionalStart()
          .appendPattern(":ss")
          .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
          .optionalEnd()
        .optionalEnd()
      .optionalEnd()
      .parseDefaulting(ChronoField.HOUR_OF_DAY, 0)
      .parseDefaulting(ChronoField.MINUTE_OF_HOUR, 0)
      .parseDefaulting(ChronoField.SECOND_OF_MINUTE, 0)
      .toFormatter();

  private final long value;
  @Nullable private final ZoneId zone;

  private Timestamp(long value, @Nullable ZoneId zone) {
    this.value = value;
    this.zone = zone;
  }

  /**
   * Creates a zone-less timestamp.
   */
  public static Timestamp ofNanos(long value) {
    return ofNanos(value, null);
  }

  /**
   * Creates a timestamp from an absolute nanosecond value.
   *
   * @param value nanoseconds since the epoch in UTC
   * @param zone the zone to read calendar fields in, or {@code null} for none
   */
  public static Timestamp ofNanos(long value, @Nullable ZoneId zone) {
    if (value == NAT_VALUE) {
      return NOT_A_TIME;
    }
    return new Timestamp(value, zone);
  }

  /**
   * Creates a timestamp from a local wall clock value, resolving it against {@code zone}.
   *
   * @param localValue nanoseconds since the epoch on the local wall clock
   * @param zone the zone to resolve in, or {@code null} for a zone-less timestamp
   * @throws OutOfBoundsDatetimeException if the resolved value is not representable
   */
  public static Timestamp ofLocal(long localValue, @Nullable ZoneId zone) {
    checkInBounds(localValue);
    if (zone == null) {
      return new Timestamp(localValue, null);
    }
    LocalDateTime local = LocalDateTime.ofEpochSecond(
        Math.floorDiv(localValue, NANOS_PER_SECOND),
        (int) Math.floorMod(localValue, NANOS_PER_SECOND),
        ZoneOffset.UTC);
    return new Timestamp(toNanos(ZonedDateTime.of(local, zone).toInstant()), zone);
  }

  public static Timestamp of(int year, int month, int day) {
    return of(year, month, day, 0, 0, 0, 0);
  }

  public static Timestamp of(int year, int month, int day, int hour, int minute) {
    return of(year, month, day, hour, minute, 0, 0);
  }

  public static Timestamp of(int year, int month, int day, int hour, int minute, int second) {
    return of(year, month, day, hour, minute, second, 0);
  }

  public static Timestamp of(int year, int month, int day, int hour, int minute, int second,
      int nanoOfSecond) {
    return fromLocalDateTime(
        LocalDateTime.of(year, month, day, hour, minute, second, nanoOfSecond), null);
  }

  /**
   * Parses {@code yyyy-MM-dd[ HH:mm[:ss[.fffffffff]]]} as a zone-less timestamp, or
   * {@code "NaT"} as {@link #NOT_A_TIME}.
   *
   * @throws IllegalArgumentException if the text cannot be parsed
   */
  public static Timestamp parse(String text) {
    MorePreconditions.checkNotBlank(text);
    if ("NaT".equals(text)) {
      return NOT_A_TIME;
    }
    try {
      return fromLocalDateTime(LocalDateTime.parse(text.trim(), PARSER), null);
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Could not parse timestamp: " + text, e);
    }
  }

  /**
   * Interprets a local date time as wall clock time in {@code zone}.
   */
  public static Timestamp fromLocalDateTime(LocalDateTime local, @Nullable ZoneId zone) {
    Preconditions.checkNotNull(local);
    if (zone == null) {
      return new Timestamp(toNanos(local.toInstant(ZoneOffset.UTC)), null);
    }
    return new Timestamp(toNanos(ZonedDateTime.of(local, zone).toInstant()), zone);
  }

  private static long toNanos(Instant instant) {
    try {
      long nanos = LongMath.checkedAdd(
          LongMath.checkedMultiply(instant.getEpochSecond(), NANOS_PER_SECOND), instant.getNano());
      return checkInBounds(nanos);
    } catch (ArithmeticException e) {
      throw new OutOfBoundsDatetimeException("Out of bounds nanosecond timestamp: " + instant, e);
    }
  }

  private static long checkInBounds(long value) {
    if (value == NAT_VALUE) {
      throw new OutOfBoundsDatetimeException("Out of bounds nanosecond timestamp");
    }
    return value;
  }

  public boolean isNaT() {
    return value == NAT_VALUE;
  }

  /**
   * Returns the absolute value in nanoseconds since the epoch.
   */
  public long getValue() {
    return value;
  }

  @Nullable
  public ZoneId getZone() {
    return zone;
  }

  /**
   * Returns the nanoseconds since the epoch on this timestamp's local wall clock.  For a
   * zone-less timestamp this is the raw value.
   */
  public long getLocalValue() {
    if (zone == null || isNaT()) {
      return value;
    }
    try {
      return LongMath.checkedAdd(value,
          LongMath.checkedMultiply(zone.getRules().getOffset(toInstant()).getTotalSeconds(),
              NANOS_PER_SECOND));
    } catch (ArithmeticException e) {
      throw new OutOfBoundsDatetimeException("Out of bounds nanosecond timestamp: " + value, e);
    }
  }

  /**
   * Returns a timestamp in the same zone whose local wall clock reads {@code localValue}.
   */
  public Timestamp withLocalValue(long localValue) {
    return ofLocal(localValue, zone);
  }

  /**
   * Attaches a zone to a zone-less timestamp, keeping its wall clock reading.
   */
  public Timestamp localize(ZoneId newZone) {
    Preconditions.checkNotNull(newZone);
    Preconditions.checkState(zone == null, "Timestamp is already zone aware");
    return isNaT() ? this : ofLocal(value, newZone);
  }

  /**
   * Returns the same instant read in another zone.
   */
  public Timestamp atZone(@Nullable ZoneId newZone) {
    return isNaT() ? this : new Timestamp(value, newZone);
  }

  public Instant toInstant() {
    Preconditions.checkState(!isNaT(), "NaT has no instant");
    return Instant.ofEpochSecond(
        Math.floorDiv(value, NANOS_PER_SECOND), Math.floorMod(value, NANOS_PER_SECOND));
  }

  public LocalDateTime toLocalDateTime() {
    long local = getLocalValue();
    return LocalDateTime.ofEpochSecond(Math.floorDiv(local, NANOS_PER_SECOND),
        (int) Math.floorMod(local, NANOS_PER_SECOND), ZoneOffset.UTC);
  }

  public long getEpochDay() {
    return Math.floorDiv(getLocalValue(), NANOS_PER_DAY);
  }

  public long getNanoOfDay() {
    return Math.floorMod(getLocalValue(), NANOS_PER_DAY);
  }

  public DateFields getFields() {
    return DateFields.ofEpochDay(getEpochDay());
  }

  /** 0 for Monday. */
  public int getDayOfWeek() {
    return getFields().getDayOfWeek();
  }

  /**
   * Returns this timestamp with its wall clock reset to midnight.
   */
  public Timestamp normalize() {
    return isNaT() ? this : withLocalValue(getEpochDay() * NANOS_PER_DAY);
  }

  public boolean isNormalized() {
    return isNaT() || getNanoOfDay() == 0;
  }

  /**
   * Equivalent to {@code offset.apply(this)}.
   */
  public Timestamp plus(DateOffset offset) {
    return offset.apply(this);
  }

  /**
   * Equivalent to {@code offset.negate().apply(this)}.
   */
  public Timestamp minus(DateOffset offset) {
    return offset.negate().apply(this);
  }

  /**
   * Adds an absolute time delta.
   *
   * @throws OutOfBoundsDatetimeException if the result is not representable
   */
  public Timestamp plus(Amount<Time> delta) {
    if (isNaT()) {
      return this;
    }
    try {
      return new Timestamp(checkInBounds(LongMath.checkedAdd(value, delta.asBaseUnits())), zone);
    } catch (ArithmeticException e) {
      throw new OutOfBoundsDatetimeException(
          "Out of bounds nanosecond timestamp: " + this + " + " + delta, e);
    }
  }

  @Override
  public int compareTo(Timestamp other) {
    return Long.compare(value, other.value);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Timestamp)) {
      return false;
    }
    Timestamp other = (Timestamp) o;
    return value == other.value && Objects.equal(zone, other.zone);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(value, zone);
  }

  @Override
  public String toString() {
    if (isNaT()) {
      return "NaT";
    }
    LocalDateTime local = toLocalDateTime();
    StringBuilder text = new StringBuilder(String.format("%04d-%02d-%02d %02d:%02d:%02d",
        local.getYear(), local.getMonthValue(), local.getDayOfMonth(),
        local.getHour(), local.getMinute(), local.getSecond()));
    if (local.getNano() != 0) {
      text.append(String.format(".%09d", local.getNano()));
    }
    if (zone != null) {
      text.append(' ').append(zone.getId());
    }
    return text.toString();
  }
}
