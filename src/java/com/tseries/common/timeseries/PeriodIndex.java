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

import com.tseries.common.base.MorePreconditions;

/**
 * A sequence of period ordinals of one fixed frequency.  The frequency of a period index is
 * part of its definition and is never inferred.
 */
public final class PeriodIndex implements TimeIndex {

  private final long[] ordinals;
  private final String freq;

  public PeriodIndex(long[] ordinals, String freq) {
    this.ordinals = Preconditions.checkNotNull(ordinals).clone();
    this.freq = MorePreconditions.checkNotBlank(freq);
  }

  public String getFreq() {
    return freq;
  }

  @Override
  public long[] asi8() {
    return ordinals.clone();
  }

  @Override
  public int size() {
    return ordinals.length;
  }

  @Override
  public String toString() {
    return "PeriodIndex" + Arrays.toString(ordinals) + ", freq=" + freq;
  }
}
