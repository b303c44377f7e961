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

import com.tseries.common.timeseries.TimedeltaIndex;

/**
 * Infers the frequency of a sequence of durations.  Durations have no calendar, so spacing of
 * whole days is only reported as evenly spaced days or weeks.
 */
public class TimedeltaFrequencyInferer extends FrequencyInferer {

  public TimedeltaFrequencyInferer(TimedeltaIndex index) {
    super(Preconditions.checkNotNull(index).asi8(), index.asi8(), index.isMonotonic(),
        index.isUnique());
  }

  @Nullable
  @Override
  protected String inferDailyRule() {
    return isUnique() ? getDailyRule() : null;
  }
}
