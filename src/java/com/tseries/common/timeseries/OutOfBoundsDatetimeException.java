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

/**
 * Thrown when timestamp arithmetic would leave the range representable as signed 64-bit
 * nanoseconds since the epoch.
 */
public class OutOfBoundsDatetimeException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public OutOfBoundsDatetimeException(String message) {
    super(message);
  }

  public OutOfBoundsDatetimeException(String message, Throwable cause) {
    super(message, cause);
  }
}
