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

import java.util.Arrays;

import com.google.common.base.Preconditions;

import com.tseries.common.quantity.Amount;
import com.tseries.common.quantity.Time;

/**
 * An immutable sequence of signed nanosecond durations.
 */
public final class TimedeltaIndex implements TimeIndex {

  private final long[] values;

  private TimedeltaIndex(long[] values) {
    this.values = values;
  }

  public static TimedeltaIndex fromValues(long[] nanos) {
    Preconditions.checkNotNull(nanos);
    return new TimedeltaIndex(nanos.clone());
  }

  @SafeVarargs
  public static TimedeltaIndex of(Amount<Time>... deltas) {
    long[] values = new long[deltas.length];
    for (int i = 0; i < deltas.length; i++) {
      values[i] = deltas[i].asBaseUnits();
    }
    return new TimedeltaIndex(values);
  }

  @Override
  public long[] asi8() {
    return values.clone();
  }

  @Override
  public int size() {
    return values.length;
  }

  public Amount<Time> get(int i) {
    return Amount.of(values[i], Time.NANOSECONDS);
  }

  public boolean isMonotonic() {
    boolean increasing = true;
    boolean decreasing = true;
    for (int i = 1; i < values.length; i++) {
      increasing &= values[i] >= values[i - 1];
      decreasing &= values[i] <= values[i - 1];
    }
    return increasing || decreasing;
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
  public String toString() {
    return "TimedeltaIndex" + Arrays.toString(values);
  }
}
