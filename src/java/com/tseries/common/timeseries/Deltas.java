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

import com.google.common.math.LongMath;

import com.tseries.common.base.MorePreconditions;

/**
 * Utilities over sequences of consecutive differences.
 */
public final class Deltas {

  private Deltas() {
    // utility
  }

  /**
   * Computes {@code values[i + 1] - values[i]} for every adjacent pair.
   *
   * @param values at least two values
   * @return the {@code values.length - 1} differences, in input order
   * @throws OutOfBoundsDatetimeException if a difference does not fit in a {@code long}
   */
  public static long[] diff(long[] values) {
    MorePreconditions.checkMinLength(values, 2, "Need at least 2 values to compute deltas");
    long[] deltas = new long[values.length - 1];
    for (int i = 0; i < deltas.length; i++) {
      try {
        deltas[i] = LongMath.checkedSubtract(values[i + 1], values[i]);
      } catch (ArithmeticException e) {
        throw new OutOfBoundsDatetimeException(
            "Delta between " + values[i] + " and " + values[i + 1] + " overflows", e);
      }
    }
    return deltas;
  }

  /**
   * Returns the sorted distinct differences between adjacent values.  A result of length one
   * means the values are evenly spaced.
   *
   * @param values at least two values
   * @return the ascending unique deltas
   */
  public static long[] uniqueDeltas(long[] values) {
    long[] deltas = diff(values);
    Arrays.sort(deltas);
    int unique = 0;
    for (int i = 0; i < deltas.length; i++) {
      if (i == 0 || deltas[i] != deltas[unique - 1]) {
        deltas[unique++] = deltas[i];
      }
    }
    return Arrays.copyOf(deltas, unique);
  }
}
