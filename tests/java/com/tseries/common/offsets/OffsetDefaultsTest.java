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
import java.util.Properties;

import com.google.common.collect.ImmutableList;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class OffsetDefaultsTest {

  @Test
  public void testBundledDefaults() {
    OffsetDefaults defaults = OffsetDefaults.get();
    assertEquals(OpeningHours.of("09:00", "17:00"), defaults.getOpeningHours());
    assertEquals(Weekmask.WEEKDAYS, defaults.getWeekmask());
    assertEquals(LocalDate.of(1970, 1, 1), defaults.getHolidayWindowStart());
    assertEquals(LocalDate.of(2200, 12, 31), defaults.getHolidayWindowEnd());
  }

  @Test
  public void testResource() {
    OffsetDefaults defaults = new OffsetDefaults("tseries-offsets-split.properties");
    assertEquals(OpeningHours.of(ImmutableList.of("08:00", "13:00"),
        ImmutableList.of("12:00", "18:00")), defaults.getOpeningHours());
    assertEquals(Weekmask.parse("1111001"), defaults.getWeekmask());
    assertEquals(LocalDate.of(2000, 1, 1), defaults.getHolidayWindowStart());
    assertEquals(LocalDate.of(2030, 12, 31), defaults.getHolidayWindowEnd());
  }

  @Test
  public void testMissingResource() {
    OffsetDefaults defaults = new OffsetDefaults("no-such-resource.properties");
    assertTrue(defaults.getProperties().isEmpty());
    assertEquals(OpeningHours.of("09:00", "17:00"), defaults.getOpeningHours());
    assertEquals(Weekmask.WEEKDAYS, defaults.getWeekmask());
  }

  @Test
  public void testMalformedValuesFallBack() {
    Properties properties = new Properties();
    properties.setProperty(OffsetDefaults.Key.START.value, "09:00");
    properties.setProperty(OffsetDefaults.Key.END.value, "09:00");
    properties.setProperty(OffsetDefaults.Key.WEEKMASK.value, "Someday");
    properties.setProperty(OffsetDefaults.Key.HOLIDAY_WINDOW_START.value, "yesterday");
    OffsetDefaults defaults = new OffsetDefaults(properties);

    assertEquals(OpeningHours.of("09:00", "17:00"), defaults.getOpeningHours());
    assertEquals(Weekmask.WEEKDAYS, defaults.getWeekmask());
    assertEquals(LocalDate.of(1970, 1, 1), defaults.getHolidayWindowStart());
  }
}
