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

import java.time.LocalDate;
import java.util.Set;

/**
 * A source of holiday dates, such as an exchange or national holiday schedule.  Implementations
 * are consulted once, when a custom business offset is constructed.
 */
public interface HolidayCalendar {

  /**
   * Returns the holidays falling between {@code start} and {@code end}, both inclusive.
   *
   * @param start the first date of the window
   * @param end the last date of the window
   * @return the holidays in the window, never {@code null}
   */
  Set<LocalDate> holidays(LocalDate start, LocalDate end);
}
