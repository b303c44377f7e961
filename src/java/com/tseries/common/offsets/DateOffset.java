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

import java.io.Serializable;
import java.time.DateTimeException;

import com.google.common.base.Preconditions;
import com.google.common.math.IntMath;

import org.apache.commons.lang.builder.EqualsBuilder;
import org.apache.commons.lang.builder.HashCodeBuilder;

import com.tseries.common.quantity.Amount;
import com.tseries.common.quantity.Time;
import com.tseries.common.timeseries.OutOfBoundsDatetimeException;
import com.tseries.common.timeseries.Timestamp;

/**
 * A calendar offset: a rule for stepping timestamps between valid positions, such as business
 * days or business hours.  Every offset carries a signed multiplier {@code n}, the number and
 * direction of steps taken by {@link #apply(Timestamp)}, and a {@code normalize} flag that resets
 * results to midnight.
 *
 * <p>Offsets are immutable and compare equal when they are of the same class and agree on
 * {@code n}, {@code normalize} and their variant specific parameters.  All stepping happens on
 * the local wall clock of the timestamp's zone.  {@link Timestamp#NOT_A_TIME} passes through every
 * operation unchanged.
 */
public abstract class DateOffset implements Serializable {

  private static final long serialVersionUID = 1L;

  protected static final long NANOS_PER_DAY = Time.DAYS.multiplier();

  private final int n;
  private final boolean normalize;

  protected DateOffset(int n, boolean normalize) {
    this.n = n;
    this.normalize = normalize;
  }

  public final int getN() {
    return n;
  }

  public final boolean isNormalize() {
    return normalize;
  }

  /**
   * Returns the alias of this kind of offset, eg: {@code "BH"}.
   */
  public abstract String getRuleCode();

  /**
   * Returns the rule code prefixed by {@code n} when it is not 1, eg: {@code "3BH"}.
   */
  public String getFreqstr() {
    return n == 1 ? getRuleCode() : n + getRuleCode();
  }

  /**
   * Returns the name used in {@link #toString()}.
   */
  public String getName() {
    return getClass().getSimpleName();
  }

  public boolean isAnchored() {
    return n == 1;
  }

  /**
   * Steps {@code |n|} positions forward ({@code n > 0}) or backward ({@code n < 0}).  With
   * {@code n == 0} a timestamp that is not on the offset moves forward onto it.
   *
   * @throws OutOfBoundsDatetimeException if the result is not representable
   */
  public final Timestamp apply(Timestamp other) {
    Preconditions.checkNotNull(other);
    if (other.isNaT()) {
      return other;
    }
    return finish(other, new LocalStep() {
      @Override long compute(long local) {
        return applyLocal(local);
      }
    });
  }

  /**
   * Returns {@code dt} when it is on the offset, otherwise the latest earlier valid position.
   */
  public final Timestamp rollback(Timestamp dt) {
    Preconditions.checkNotNull(dt);
    if (dt.isNaT() || onOffset(dt)) {
      return dt;
    }
    return finish(dt, new LocalStep() {
      @Override long compute(long local) {
        return rollbackLocal(local);
      }
    });
  }

  /**
   * Returns {@code dt} when it is on the offset, otherwise the earliest later valid position.
   */
  public final Timestamp rollforward(Timestamp dt) {
    Preconditions.checkNotNull(dt);
    if (dt.isNaT() || onOffset(dt)) {
      return dt;
    }
    return finish(dt, new LocalStep() {
      @Override long compute(long local) {
        return rollforwardLocal(local);
      }
    });
  }

  /**
   * Returns whether {@code dt} is a valid position of this offset.  A normalizing offset only
   * accepts timestamps at midnight.
   */
  public final boolean onOffset(Timestamp dt) {
    Preconditions.checkNotNull(dt);
    if (dt.isNaT()) {
      return false;
    }
    if (normalize && !dt.isNormalized()) {
      return false;
    }
    return isOnOffsetLocal(dt.getLocalValue());
  }

  private Timestamp finish(Timestamp dt, LocalStep step) {
    long result;
    try {
      result = step.compute(dt.getLocalValue());
    } catch (ArithmeticException e) {
      throw new OutOfBoundsDatetimeException(
          "Out of bounds nanosecond timestamp: " + dt + " + " + this, e);
    } catch (DateTimeException e) {
      throw new OutOfBoundsDatetimeException(
          "Out of bounds nanosecond timestamp: " + dt + " + " + this, e);
    }
    if (normalize) {
      result = Math.floorDiv(result, NANOS_PER_DAY) * NANOS_PER_DAY;
    }
    return dt.withLocalValue(result);
  }

  private abstract static class LocalStep {
    abstract long compute(long local);
  }

  /**
   * Applies this offset to a local wall clock value, ignoring {@code normalize}.
   */
  protected abstract long applyLocal(long local);

  /**
   * Tests a local wall clock value, ignoring {@code normalize}.
   */
  protected abstract boolean isOnOffsetLocal(long local);

  /**
   * Moves a value that is not on the offset back.  By default this is one backward step.
   */
  protected long rollbackLocal(long local) {
    return withN(-1).applyLocal(local);
  }

  /**
   * Moves a value that is not on the offset forward.  By default this is one forward step.
   */
  protected long rollforwardLocal(long local) {
    return withN(1).applyLocal(local);
  }

  /**
   * Returns an offset of the same kind and parameters with a different multiplier.
   */
  protected abstract DateOffset withN(int newN);

  /**
   * Returns the variant specific parameters that take part in equality.
   */
  protected abstract Object[] getParams();

  /**
   * Returns the variant specific part of {@link #toString()}, empty by default.
   */
  protected String getReprAttrs() {
    return "";
  }

  /**
   * Returns an offset taking {@code k} times as many steps; a negative {@code k} reverses the
   * direction.
   */
  public DateOffset multiply(int k) {
    return withN(IntMath.checkedMultiply(n, k));
  }

  public DateOffset negate() {
    return multiply(-1);
  }

  /**
   * Returns an equal, independent instance.
   */
  public DateOffset copy() {
    return withN(n);
  }

  /**
   * Equivalent to {@link #apply(Timestamp)}.
   */
  public Timestamp plus(Timestamp other) {
    return apply(other);
  }

  /**
   * Always fails: a timestamp may have an offset subtracted from it, but not the reverse.
   *
   * @throws ApplyTypeException always
   */
  public Timestamp minus(Timestamp other) {
    throw new ApplyTypeException("Cannot subtract datetime from offset");
  }

  /**
   * Adds a fixed time delta to this offset.  Only offsets carrying a time delta support this.
   *
   * @throws ApplyTypeException if this offset cannot absorb a time delta
   */
  public DateOffset plus(Amount<Time> delta) {
    throw new ApplyTypeException(
        "Only know how to combine " + describe() + " with datetime, not timedelta");
  }

  /**
   * Always fails: offsets are applied to timestamps, never to one another.
   *
   * @throws ApplyTypeException always
   */
  public DateOffset combine(DateOffset other) {
    Preconditions.checkNotNull(other);
    throw new ApplyTypeException("Only know how to combine " + describe()
        + " with datetime or timedelta, not " + other.getName());
  }

  /**
   * Returns a lower case description of this kind of offset for error messages.
   */
  protected String describe() {
    return getName();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || o.getClass() != getClass()) {
      return false;
    }
    DateOffset other = (DateOffset) o;
    return new EqualsBuilder()
        .append(n, other.n)
        .append(normalize, other.normalize)
        .append(getParams(), other.getParams())
        .isEquals();
  }

  @Override
  public int hashCode() {
    return new HashCodeBuilder()
        .append(getClass().getName())
        .append(n)
        .append(normalize)
        .append(getParams())
        .toHashCode();
  }

  /**
   * Returns eg: {@code <3 * BusinessHours: BH=09:00-17:00>}.
   */
  @Override
  public String toString() {
    String count = n == 1 ? "" : n + " * ";
    String plural = Math.abs(n) == 1 ? "" : "s";
    return "<" + count + getName() + plural + getReprAttrs() + ">";
  }
}
