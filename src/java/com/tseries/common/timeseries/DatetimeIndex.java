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

import java.time.ZoneId;
import java.util.Arrays;
import java.util.List;

import javax.annotation.Nullable;

import com.google.common.base.Joiner;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

import com.tseries.common.offsets.DateOffset;

/**
 * An immutable sequence of timestamps sharing one (possibly absent) zone.
 */
public final class DatetimeIndex implements TimeIndex {

  private final long[] values;
  @Nullable private final ZoneId zone;

  private DatetimeIndex(long[] values, @Nullable ZoneId zone) {
    this.values = values;
    this.zone = zone;
  }

  /**
   * Creates an index over raw UTC nanosecond values.
   */
  public static DatetimeIndex fromValues(long[] values, @Nullable ZoneId zone) {
    Preconditions.checkNotNull(values);
    return new DatetimeIndex(values.clone(), zone);
  }

  public static DatetimeIndex of(Timestamp... timestamps) {
    return of(Arrays.asList(timestamps));
  }

  /**
   * Creates an index from timestamps, which must all carry the same zone.
   */
  public static DatetimeIndex of(Iterable<Timestamp> timestamps) {
    Preconditions.checkNotNull(timestamps);
    List<Timestamp> list = Lists.newArrayList(timestamps);
    long[] values = new long[list.size()];
    ZoneId zone = list.isEmpty() ? null : list.get(0).getZone();
    for (int i = 0; i < values.length; i++) {
      Timestamp timestamp = Preconditions.checkNotNull(list.get(i));
      Preconditions.checkArgument(Objects.equal(zone, timestamp.getZone()),
          "Timestamps must share one zone, found %s and %s", zone, timestamp.getZone());
      values[i] = timestamp.getValue();
    }
    return new DatetimeIndex(values, zone);
  }

  /**
   * Generates {@code periods} timestamps spaced by {@code offset}.  The first element is
   * {@code start} rolled onto the offset (forward for non-negative multipliers, backward
   * otherwise); each following element applies the offset to its predecessor.
   *
   * @throws IllegalArgumentException if the offset does not move timestamps
   */
  public static DatetimeIndex dateRange(Timestamp start, int periods, DateOffset offset) {
    Preconditions.checkNotNull(start);
    Preconditions.checkNotNull(offset);
    Preconditions.checkArgument(!start.isNaT(), "Cannot generate a range from NaT");
    Preconditions.checkArgument(periods >= 0, "periods must be non-negative, got %s", periods);
    Preconditions.checkArgument(offset.getN() != 0, "Offset %s did not increment date", offset);

    long[] values = new long[periods];
    Timestamp current = offset.getN() > 0 ? offset.rollforward(start) : offset.rollback(start);
    for (int i = 0; i < periods; i++) {
      values[i] = current.getValue();
      if (i + 1 < periods) {
        Timestamp next = offset.apply(current);
        boolean advanced = offset.getN() > 0
            ? next.compareTo(current) > 0 : next.compareTo(current) < 0;
        Preconditions.checkArgument(advanced, "Offset %s did not increment date", offset);
        current = next;
      }
    }
    return new DatetimeIndex(values, start.getZone());
  }

  @Override
  public long[] asi8() {
    return values.clone();
  }

  /**
   * Returns the local wall clock values; identical to {@link #asi8()} for a zone-less index.
   */
  public long[] getLocalValues() {
    if (zone == null) {
      return values.clone();
    }
    long[] local = new long[values.length];
    for (int i = 0; i < values.length; i++) {
      local[i] = get(i).getLocalValue();
    }
    return local;
  }

  @Override
  public int size() {
    return values.length;
  }

  public Timestamp get(int i) {
    return Timestamp.ofNanos(values[i], zone);
  }

  @Nullable
  public ZoneId getZone() {
    return zone;
  }

  public boolean isMonotonicIncreasing() {
    for (int i = 1; i < values.length; i++) {
      if (values[i] < values[i - 1]) {
        return false;
      }
    }
    return true;
  }

  public boolean isMonotonicDecreasing() {
    for (int i = 1; i < values.length; i++) {
      if (values[i] > values[i - 1]) {
        return false;
      }
    }
    return true;
  }

  public boolean isUnique() {
    long[] sorted = values.clone();
    Arrays.sort(sorted);
    for (int i = 1; i < sorted.length; i++) {
      if (sorted[i] == sorted[i - 1]) {
        return false;
      }
    }
    return true;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof DatetimeIndex)) {
      return false;
    }
    DatetimeIndex other = (DatetimeIndex) o;
    return Arrays.equals(values, other.values) && Objects.equal(zone, other.zone);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(Arrays.hashCode(values), zone);
  }

  @Override
  public String toString() {
    List<Timestamp> timestamps = Lists.newArrayListWithCapacity(values.length);
    for (int i = 0; i < values.length; i++) {
      timestamps.add(get(i));
    }
    return "DatetimeIndex[" + Joiner.on(", ").join(timestamps) + "]";
  }
}
