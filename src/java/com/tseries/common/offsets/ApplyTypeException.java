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

/**
 * Thrown when an offset is combined with an operand it cannot be applied to, such as subtracting
 * a timestamp from an offset.
 */
public class ApplyTypeException extends IllegalArgumentException {

  private static final long serialVersionUID = 1L;

  public ApplyTypeException(String message) {
    super(message);
  }
}
