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

import com.google.common.collect.ImmutableList;

import org.junit.Test;

import com.tseries.common.timeseries.Timestamp;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class BusinessHourTest {

  private static final Timestamp D = Timestamp.of(2014, 7, 1, 10, 0);

  private static Timestamp at(int month, int day, int hour, int minute) {
    return Timestamp.of(2014, month, day, hour, minute);
  }

  private static Timestamp plusNanos(Timestamp timestamp, long nanos) {
    return Timestamp.ofNanos(timestamp.getValue() + nanos);
  }

  private static void assertApply(DateOffset offset, Timestamp base, Timestamp expected) {
    assertEquals(offset + " applied to " + base, expected, offset.apply(base));
  }

  private static BusinessHour hours(int n, String[] starts, String[] ends) {
    return new BusinessHour(n, false,
        OpeningHours.of(ImmutableList.copyOf(starts), ImmutableList.copyOf(ends)));
  }

  @Test
  public void testApplySimple() {
    assertApply(new BusinessHour(), D, at(7, 1, 11, 0));
    assertApply(new BusinessHour(3), D, at(7, 1, 13, 0));
    assertApply(new BusinessHour(-1), D, at(6, 30, 17, 0));
    assertApply(new BusinessHour(-4), D, at(6, 30, 14, 0));
  }

  @Test
  public void testApplyMultipleIntervals() {
    assertApply(hours(1, new String[] {"09:00", "13:00"}, new String[] {"12:00", "17:00"}),
        D, at(7, 1, 11, 0));
    assertApply(hours(3, new String[] {"09:00", "22:00"}, new String[] {"13:00", "03:00"}),
        D, at(7, 1, 22, 0));
    assertApply(hours(-1, new String[] {"23:00", "13:00"}, new String[] {"02:00", "17:00"}),
        D, at(7, 1, 1, 0));
  }

  @Test
  public void testApplyAcrossWeekend() {
    BusinessHour offset = new BusinessHour();
    assertApply(offset, at(7, 4, 16, 0), at(7, 7, 9, 0));
    assertApply(offset, at(7, 4, 16, 30), at(7, 7, 9, 30));
    assertApply(offset, at(7, 5, 15, 0), at(7, 7, 10, 0));
    assertApply(new BusinessHour(-1), at(7, 7, 9, 30), at(7, 4, 16, 30));
    assertApply(new BusinessHour(-1), at(7, 5, 15, 0), at(7, 4, 16, 0));
  }

  @Test
  public void testApplyWholeDays() {
    assertApply(new BusinessHour(8), D, at(7, 2, 10, 0));
    assertApply(new BusinessHour(-8), D, at(6, 30, 10, 0));
    assertApply(new BusinessHour(40), D, at(7, 8, 10, 0));
  }

  @Test
  public void testApplyLarge() {
    BusinessHour offset =
        hours(28, new String[] {"21:00", "03:00"}, new String[] {"01:00", "04:00"});
    assertApply(offset, at(7, 5, 0, 0), at(7, 14, 22, 0));
  }

  @Test
  public void testApplyNanoseconds() {
    BusinessHour forward = new BusinessHour();
    assertApply(forward, plusNanos(at(7, 4, 15, 0), 5), plusNanos(at(7, 4, 16, 0), 5));
    assertApply(forward, plusNanos(at(7, 4, 16, 0), 5), plusNanos(at(7, 7, 9, 0), 5));
    assertApply(forward, plusNanos(at(7, 4, 16, 0), -5), plusNanos(at(7, 4, 17, 0), -5));

    BusinessHour backward = new BusinessHour(-1);
    assertApply(backward, plusNanos(at(7, 4, 15, 0), 5), plusNanos(at(7, 4, 14, 0), 5));
    assertApply(backward, plusNanos(at(7, 4, 10, 0), 5), plusNanos(at(7, 4, 9, 0), 5));
    assertApply(backward, plusNanos(at(7, 4, 10, 0), -5), plusNanos(at(7, 3, 17, 0), -5));
  }

  @Test
  public void testNormalize() {
    BusinessHour forward = new BusinessHour(1, true);
    assertApply(forward, at(7, 1, 17, 0), Timestamp.of(2014, 7, 2));
    assertApply(forward, at(7, 4, 16, 30), Timestamp.of(2014, 7, 7));
    assertApply(new BusinessHour(-1, true), at(7, 1, 8, 0), Timestamp.of(2014, 6, 30));
  }

  @Test
  public void testOpeningTimes() {
    BusinessHour offset = new BusinessHour();
    assertEquals(at(7, 2, 9, 0).getValue(), offset.nextOpeningTime(at(7, 1, 11, 0).getValue()));
    assertEquals(at(7, 1, 9, 0).getValue(), offset.prevOpeningTime(at(7, 1, 11, 0).getValue()));
    assertEquals(at(7, 2, 9, 0).getValue(), offset.nextOpeningTime(at(7, 2, 9, 0).getValue()));
    assertEquals(at(7, 2, 9, 0).getValue(), offset.prevOpeningTime(at(7, 2, 9, 0).getValue()));
    assertEquals(at(7, 7, 9, 0).getValue(), offset.nextOpeningTime(at(7, 5, 10, 0).getValue()));
    assertEquals(at(7, 4, 9, 0).getValue(), offset.prevOpeningTime(at(7, 5, 10, 0).getValue()));
    assertEquals(at(7, 4, 17, 0).getValue(), offset.closingTime(at(7, 4, 9, 0).getValue()));
  }

  @Test
  public void testOnOffset() {
    BusinessHour offset = new BusinessHour();
    assertTrue(offset.onOffset(at(7, 1, 9, 0)));
    assertTrue(offset.onOffset(at(7, 1, 17, 0)));
    assertFalse(offset.onOffset(at(7, 1, 8, 59)));
    assertFalse(offset.onOffset(at(7, 1, 17, 1)));
    assertFalse(offset.onOffset(at(7, 5, 12, 0)));
  }

  @Test
  public void testOnOffsetPastMidnight() {
    BusinessHour offset = new BusinessHour(1, false, "19:00", "05:00");
    assertTrue(offset.onOffset(at(7, 1, 19, 0)));
    assertTrue(offset.onOffset(at(7, 2, 3, 0)));
    // Saturday morning closes Friday night's interval.
    assertTrue(offset.onOffset(at(7, 5, 4, 0)));
    assertFalse(offset.onOffset(at(7, 5, 19, 0)));
    assertFalse(offset.onOffset(at(7, 2, 12, 0)));
  }

  @Test
  public void testApplyPastMidnight() {
    BusinessHour offset = new BusinessHour(1, false, "20:00", "05:00");
    assertTrue(offset.onOffset(at(7, 1, 23, 0)));
    assertTrue(offset.onOffset(at(7, 2, 2, 0)));
    assertFalse(offset.onOffset(at(7, 1, 10, 0)));

    assertApply(offset, at(7, 1, 23, 30), at(7, 2, 0, 30));
    assertApply(offset, at(7, 4, 23, 30), at(7, 5, 0, 30));

    BusinessHour evening = new BusinessHour(1, false, "19:00", "05:00");
    assertApply(evening, at(7, 4, 23, 0), at(7, 5, 0, 0));
    assertApply(evening, at(7, 5, 4, 30), at(7, 7, 19, 30));
  }

  @Test
  public void testMultiplyKeepsCalendar() {
    BusinessCalendar calendar = BusinessCalendar.of(Weekmask.parse("Sun Mon Tue Wed Thu"),
        ImmutableList.<LocalDate>of());
    BusinessHour offset =
        new BusinessHour(2, false, OpeningHours.of("09:00", "17:00"), calendar) { };
    BusinessHour negated = (BusinessHour) offset.negate();
    assertEquals(-2, negated.getN());
    assertEquals(calendar, negated.getBusinessCalendar());
    assertEquals(calendar, ((BusinessHour) offset.multiply(3)).getBusinessCalendar());
  }

  @Test
  public void testRoll() {
    BusinessHour offset = new BusinessHour();
    assertEquals(at(7, 4, 17, 0), offset.rollback(at(7, 6, 15, 0)));
    assertEquals(at(7, 7, 9, 0), offset.rollforward(at(7, 6, 15, 0)));
    assertEquals(at(7, 1, 17, 0), offset.rollback(at(7, 1, 19, 0)));
    assertEquals(at(7, 2, 9, 0), offset.rollforward(at(7, 1, 19, 0)));
    assertEquals(D, offset.rollback(D));
    assertEquals(D, offset.rollforward(D));
  }

  @Test
  public void testStepForward() {
    BusinessHour offset = new BusinessHour();
    long hour = 3600L * 1000000000L;
    BusinessHour.Step step =
        offset.stepForward(new BusinessHour.Step(at(7, 4, 16, 0).getValue(), 3 * hour));
    assertEquals(at(7, 7, 9, 0).getValue(), step.timestamp);
    assertEquals(2 * hour, step.remaining);
    step = offset.stepForward(step);
    assertEquals(at(7, 7, 11, 0).getValue(), step.timestamp);
    assertEquals(0, step.remaining);
  }

  @Test
  public void testStepBackward() {
    BusinessHour offset = new BusinessHour(-1);
    long hour = 3600L * 1000000000L;
    BusinessHour.Step step =
        offset.stepBackward(new BusinessHour.Step(at(7, 7, 10, 0).getValue(), -3 * hour));
    assertEquals(at(7, 4, 17, 0).getValue(), step.timestamp);
    assertEquals(-2 * hour, step.remaining);
    step = offset.stepBackward(step);
    assertEquals(at(7, 4, 15, 0).getValue(), step.timestamp);
    assertEquals(0, step.remaining);
  }

  @Test
  public void testRepr() {
    assertEquals("<BusinessHour: BH=09:00-17:00>", new BusinessHour().toString());
    assertEquals("<3 * BusinessHours: BH=09:00-17:00>", new BusinessHour(3).toString());
    assertEquals("<-1 * BusinessHour: BH=09:00-17:00>", new BusinessHour(-1).toString());
    assertEquals("<-1 * BusinessHour: BH=13:00-17:00,23:00-02:00>",
        hours(-1, new String[] {"13:00", "23:00"}, new String[] {"17:00", "02:00"}).toString());
    assertEquals("2BH", new BusinessHour(2).getFreqstr());
  }

  @Test
  public void testInvalidHours() {
    assertInvalid("09:00", "25:00", "time data must match '%H:%M' format");
    assertInvalid("9am", "17:00", "time data must match '%H:%M' format");
    assertInvalid("09:00", "09:00",
        "invalid starting and ending time(s): opening hours should not touch or overlap with one"
            + " another");
  }

  private static void assertInvalid(String start, String end, String message) {
    try {
      new BusinessHour(1, false, start, end);
      fail("Expected " + start + "-" + end + " to be rejected");
    } catch (IllegalArgumentException e) {
      assertEquals(message, e.getMessage());
    }
  }
}
