/*
 * Copyright 2015 VMware, Inc. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not
 * use this file except in compliance with the License.  You may obtain a copy of
 * the License at http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed
 * under the License is distributed on an "AS IS" BASIS, without warranties or
 * conditions of any kind, EITHER EXPRESS OR IMPLIED.  See the License for the
 * specific language governing permissions and limitations under the License.
 */

package com.edgemetal.dhcp.responder.protocol;

import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;

/**
 * Tests {@link HardwareAddress}.
 */
public class HardwareAddressTest {

  @Test(dataProvider = "Notations")
  public void testParse(String notation) {
    HardwareAddress mac = HardwareAddress.parse(notation);
    assertThat(mac.toString(), is("00:1a:2b:3c:4d:5e"));
    assertThat(mac.sanitized(), is("001a2b3c4d5e"));
  }

  @DataProvider(name = "Notations")
  public Object[][] getNotations() {
    return new Object[][]{
        {"00:1a:2b:3c:4d:5e"},
        {"00-1A-2B-3C-4D-5E"},
        {"001a2b3c4d5e"},
        {" 00:1A:2b:3C:4d:5E "},
    };
  }

  @Test(dataProvider = "Invalid", expectedExceptions = IllegalArgumentException.class)
  public void testParseRejectsInvalid(String notation) {
    HardwareAddress.parse(notation);
  }

  @DataProvider(name = "Invalid")
  public Object[][] getInvalid() {
    return new Object[][]{
        {"00:1a:2b:3c:4d"},
        {"00:1a:2b:3c:4d:5e:6f"},
        {"zz:1a:2b:3c:4d:5e"},
        {""},
    };
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testOfRejectsWrongLength() {
    HardwareAddress.of(new byte[8]);
  }

  @Test
  public void testEquality() {
    assertThat(HardwareAddress.parse("00:1a:2b:3c:4d:5e"), is(HardwareAddress.parse("001A2B3C4D5E")));
    assertThat(HardwareAddress.parse("00:1a:2b:3c:4d:5e").hashCode(),
        is(HardwareAddress.parse("001A2B3C4D5E").hashCode()));
    assertThat(HardwareAddress.parse("00:1a:2b:3c:4d:5e"), is(not(HardwareAddress.parse("00:1a:2b:3c:4d:5f"))));
  }

  @Test
  public void testHasPrefix() {
    HardwareAddress mac = HardwareAddress.parse("00:1a:2b:3c:4d:5e");
    assertThat(mac.hasPrefix("00:1a:2b"), is(true));
    assertThat(mac.hasPrefix("00-1A"), is(true));
    assertThat(mac.hasPrefix("00:1a:2c"), is(false));
    assertThat(mac.hasPrefix(""), is(false));
  }

  @Test
  public void testGetBytesIsACopy() {
    HardwareAddress mac = HardwareAddress.parse("00:1a:2b:3c:4d:5e");
    mac.getBytes()[0] = 0x7f;
    assertThat(mac.toString(), is("00:1a:2b:3c:4d:5e"));
  }
}
