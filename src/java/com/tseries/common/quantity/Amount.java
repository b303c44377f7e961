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

package com.tseries.common.quantity;

import java.io.Serializable;

import com.google.common.base.Preconditions;
import com.google.common.math.LongMath;

import org.apache.commons.lang.builder.HashCodeBuilder;

/**
 * Represents an integral value in a unit system and facilitates unambiguous communication of
 * amounts such as the fixed time delta carried by an offset.  Instances are created via the static
 * factory {@link #of(long, Unit)}.
 *
 * @param <U> the type of unit that this amount quantifies
 */
public final class Amount<U extends Unit<U>> implements Comparable<Amount<U>>, Serializable {

  private static final long serialVersionUID = 1L;

  private final long value;
  private final U unit;

  private Amount(long value, U unit) {
    this.value = value;
    this.unit = Preconditions.checkNotNull(unit);
  }

  /**
   * Creates an amount of {@code number} {@code unit}s.
   *
   * @param number the number of units the returned amount should quantify
   * @param unit the unit the returned amount is expressed in terms of
   * @param <U> the type of unit that the returned amount quantifies
   * @return an amount quantifying the given {@code number} of {@code unit}s
   */
  public static <U extends Unit<U>> Amount<U> of(long number, U unit) {
    return new Amount<U>(number, unit);
  }

  public long getValue() {
    return value;
  }

  public U getUnit() {
    return unit;
  }

  /**
   * Expresses this amount in another unit.  Conversion to a finer unit is exact, conversion to a
   * coarser unit truncates toward zero.
   *
   * @throws ArithmeticException if the converted value does not fit in a {@code long}
   */
  public long as(U other) {
    if (unit.equals(other)) {
      return value;
    }
    if (unit.multiplier() >= other.multiplier()) {
      return LongMath.checkedMultiply(value, unit.multiplier() / other.multiplier());
    }
    return value / (other.multiplier() / unit.multiplier());
  }

  /**
   * Returns this amount expressed in the hierarchy's base unit.
   */
  public long asBaseUnits() {
    return LongMath.checkedMultiply(value, unit.multiplier());
  }

  /**
   * Returns an amount with the same unit and a negated value.
   */
  public Amount<U> negate() {
    return of(LongMath.checkedMultiply(value, -1), unit);
  }

  @Override
  public int compareTo(Amount<U> other) {
    return Long.compare(asBaseUnits(), other.asBaseUnits());
  }

  /**
   * Two amounts are equal when they quantify the same number of base units, so one hour equals
   * sixty minutes.
   */
  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Amount)) {
      return false;
    }
    Amount<?> other = (Amount<?>) obj;
    return unit.getClass() == other.unit.getClass()
        && value * unit.multiplier() == other.value * other.unit.multiplier();
  }

  @Override
  public int hashCode() {
    return new HashCodeBuilder().append(unit.getClass()).append(value * unit.multiplier())
        .toHashCode();
  }

  @Override
  public String toString() {
    return value + " " + unit;
  }
}
