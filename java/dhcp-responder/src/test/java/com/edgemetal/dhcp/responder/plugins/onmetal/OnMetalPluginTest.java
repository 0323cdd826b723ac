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

package com.edgemetal.dhcp.responder.plugins.onmetal;

import com.edgemetal.dhcp.common.config.BadConfigException;
import com.edgemetal.dhcp.responder.handler.Dhcp6Handler;
import com.edgemetal.dhcp.responder.handler.HandlerResult;
import com.edgemetal.dhcp.responder.protocol.Dhcp6ClientMessage;
import com.edgemetal.dhcp.responder.protocol.IaAddressOption;
import com.edgemetal.dhcp.responder.protocol.IaNaOption;
import com.edgemetal.dhcp.responder.protocol.IaPdOption;
import com.edgemetal.dhcp.responder.protocol.IaPrefixOption;

import com.google.common.collect.ImmutableList;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;

import static com.edgemetal.dhcp.responder.protocol.TestMessages.advertise;
import static com.edgemetal.dhcp.responder.protocol.TestMessages.ipv6;
import static com.edgemetal.dhcp.responder.protocol.TestMessages.relay;
import static com.edgemetal.dhcp.responder.protocol.TestMessages.solicit;
import static com.edgemetal.dhcp.responder.protocol.TestMessages.solicitAddress;

import java.time.Duration;

/**
 * Tests {@link OnMetalPlugin} and {@link OnMetalHandler}.
 */
public class OnMetalPluginTest {

  private static final String LINK = "2001:db8:1:2::1";
  private static final String PEER = "fe80::21a:2bff:fe3c:4d5e";

  private Dhcp6Handler handler;

  @BeforeMethod
  public void setUp() throws BadConfigException {
    handler = new OnMetalPlugin().setup6(ImmutableList.of(config("onmetal.yml")));
  }

  @Test
  public void testAddsIncrementedLinkAddress() {
    HandlerResult<Dhcp6ClientMessage> result = handler.handle(relay(LINK, PEER, solicitAddress(3)), advertise());

    assertThat(result.isContinue(), is(true));
    IaNaOption iaNa = result.getReply().getIaNa();
    assertThat(iaNa.getIaId(), is(3));
    assertThat(iaNa.getAddresses(), hasSize(1));
    IaAddressOption address = iaNa.getAddresses().get(0);
    assertThat(address.getAddress(), is(ipv6("2001:db8:1:2::2")));
    assertThat(address.getPreferredLifetime(), is(Duration.ofSeconds(30)));
    assertThat(address.getValidLifetime(), is(Duration.ofSeconds(30)));
    assertThat(result.getReply().getIaPd(), is(nullValue()));
  }

  @Test
  public void testDelegatesPrefixOfConfiguredLength() {
    Dhcp6ClientMessage solicit = solicit();
    solicit.addOption(new IaPdOption(9));

    HandlerResult<Dhcp6ClientMessage> result = handler.handle(relay(LINK, PEER, solicit), advertise());

    assertThat(result.getReply().getIaNa(), is(nullValue()));
    IaPdOption iaPd = result.getReply().getIaPd();
    assertThat(iaPd, is(notNullValue()));
    assertThat(iaPd.getIaId(), is(9));
    IaPrefixOption prefix = iaPd.getPrefixes().get(0);
    assertThat(prefix.getPrefix(), is(ipv6("2001:db8:1:2::")));
    assertThat(prefix.getPrefixLength(), is(80));
    assertThat(prefix.getValidLifetime(), is(Duration.ofSeconds(30)));
  }

  @DataProvider(name = "hints")
  public Object[][] getHints() {
    return new Object[][]{
        {64, 64},
        {0, 80},
        {128, 80}
    };
  }

  @Test(dataProvider = "hints")
  public void testPrefixLengthHint(int hint, int delegated) {
    Dhcp6ClientMessage solicit = solicitAddress(3);
    IaPdOption requested = new IaPdOption(9);
    requested.addPrefix(new IaPrefixOption(ipv6("::"), hint, Duration.ZERO, Duration.ZERO));
    solicit.addOption(requested);

    HandlerResult<Dhcp6ClientMessage> result = handler.handle(relay(LINK, PEER, solicit), advertise());

    assertThat(result.getReply().getIaNa(), is(notNullValue()));
    assertThat(result.getReply().getIaPd().getPrefixes().get(0).getPrefixLength(), is(delegated));
  }

  @Test
  public void testUnspecifiedLinkAddressIsDropped() {
    HandlerResult<Dhcp6ClientMessage> result = handler.handle(relay("::", PEER, solicitAddress(3)), advertise());

    assertThat(result.getKind(), is(HandlerResult.Kind.DROP));
  }

  @Test
  public void testNonRelayIsDropped() {
    assertThat(handler.handle(solicitAddress(3), advertise()).getKind(), is(HandlerResult.Kind.DROP));
  }

  @DataProvider(name = "invalidConfigs")
  public Object[][] getInvalidConfigs() {
    return new Object[][]{
        {"onmetal_zero.yml"},
        {"onmetal_128.yml"}
    };
  }

  @Test(dataProvider = "invalidConfigs", expectedExceptions = BadConfigException.class)
  public void testPrefixLengthOutOfRangeIsRejected(String file) throws BadConfigException {
    new OnMetalPlugin().setup6(ImmutableList.of(config(file)));
  }

  @Test(expectedExceptions = BadConfigException.class)
  public void testNoDhcp4() throws BadConfigException {
    new OnMetalPlugin().setup4(ImmutableList.of(config("onmetal.yml")));
  }

  private static String config(String name) {
    return OnMetalPluginTest.class.getResource("/configs/" + name).getPath();
  }
}
