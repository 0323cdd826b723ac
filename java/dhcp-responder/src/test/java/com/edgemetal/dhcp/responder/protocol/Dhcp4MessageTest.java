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

import org.testng.annotations.Test;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

import static com.edgemetal.dhcp.responder.protocol.TestMessages.discover;
import static com.edgemetal.dhcp.responder.protocol.TestMessages.ipv4;

/**
 * Tests {@link Dhcp4Message}.
 */
public class Dhcp4MessageTest {

  @Test
  public void testUnsetAddressesAreNull() {
    Dhcp4Message message = discover("00:1a:2b:3c:4d:5e");
    message.setClientAddress(ipv4("0.0.0.0"));

    assertThat(message.getClientAddress(), is(nullValue()));
    assertThat(message.getYourAddress(), is(nullValue()));
    assertThat(message.getRequestedAddress(), is(nullValue()));
  }

  @Test
  public void testRequestedAddress() {
    Dhcp4Message message = discover("00:1a:2b:3c:4d:5e");
    message.setRequestedAddress(ipv4("10.0.0.7"));

    assertThat(message.getRequestedAddress(), is(ipv4("10.0.0.7")));
    assertThat(message.hasOption(Dhcp4Message.OPTION_REQUESTED_IP_ADDRESS), is(true));
  }

  @Test
  public void testMalformedRequestedAddressIsIgnored() {
    Dhcp4Message message = discover("00:1a:2b:3c:4d:5e");
    message.setOption(Dhcp4Message.OPTION_REQUESTED_IP_ADDRESS, new byte[]{10, 0, 0});

    assertThat(message.getRequestedAddress(), is(nullValue()));
  }

  @Test
  public void testMessageType() {
    Dhcp4Message message = discover("00:1a:2b:3c:4d:5e");
    assertThat(message.getMessageType(), is(Dhcp4Message.MessageType.DISCOVER));

    message.setOption(Dhcp4Message.OPTION_MESSAGE_TYPE, new byte[]{42});
    assertThat(message.getMessageType(), is(nullValue()));
  }
}
