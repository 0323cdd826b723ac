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

package com.edgemetal.dhcp.responder.plugins.oob;

import com.edgemetal.dhcp.common.config.BadConfigException;
import com.edgemetal.dhcp.responder.handler.Dhcp4Handler;
import com.edgemetal.dhcp.responder.handler.Dhcp6Handler;
import com.edgemetal.dhcp.responder.handler.HandlerResult;
import com.edgemetal.dhcp.responder.protocol.Dhcp4Message;
import com.edgemetal.dhcp.responder.protocol.Dhcp6ClientMessage;
import com.edgemetal.dhcp.responder.protocol.HardwareAddress;
import com.edgemetal.dhcp.responder.protocol.IaAddressOption;
import com.edgemetal.dhcp.responder.protocol.IaNaOption;
import com.edgemetal.dhcp.responder.reservation.PollingStateAwaiter;
import com.edgemetal.dhcp.responder.reservation.ReservationControllerSimulator;
import com.edgemetal.dhcp.responder.reservation.ReservationManager;
import com.edgemetal.dhcp.responder.subnet.SubnetSelector;
import com.edgemetal.dhcp.store.AddressReservationState;
import com.edgemetal.dhcp.store.LabelSelector;
import com.edgemetal.dhcp.store.SubnetState;
import com.edgemetal.dhcp.store.exceptions.StoreException;
import com.edgemetal.dhcp.store.memory.InMemoryResourceStore;

import com.google.common.collect.ImmutableList;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasEntry;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.testng.Assert.fail;

import static com.edgemetal.dhcp.responder.protocol.TestMessages.advertise;
import static com.edgemetal.dhcp.responder.protocol.TestMessages.discover;
import static com.edgemetal.dhcp.responder.protocol.TestMessages.ipv4;
import static com.edgemetal.dhcp.responder.protocol.TestMessages.ipv6;
import static com.edgemetal.dhcp.responder.protocol.TestMessages.offer;
import static com.edgemetal.dhcp.responder.protocol.TestMessages.relay;
import static com.edgemetal.dhcp.responder.protocol.TestMessages.relayWithClientLinkLayer;
import static com.edgemetal.dhcp.responder.protocol.TestMessages.solicit;
import static com.edgemetal.dhcp.responder.protocol.TestMessages.solicitAddress;
import static com.edgemetal.dhcp.responder.reservation.ReservationControllerSimulator.subnet;

import java.time.Duration;
import java.util.List;

/**
 * Tests {@link OobPlugin}, {@link OobHandler4} and {@link OobHandler6}.
 */
public class OobPluginTest {

  private static final String NAMESPACE = "oob-ns";
  private static final String MAC = "00:1a:2b:3c:4d:5e";
  private static final String PEER = "fe80::21a:2bff:fe3c:4d5e";

  private InMemoryResourceStore store;
  private ReservationControllerSimulator controller;
  private OobPlugin plugin;

  @BeforeMethod
  public void setUp() throws StoreException {
    store = new InMemoryResourceStore();
    store.create(labelled(subnet(NAMESPACE, "oob-v4", SubnetState.AddressType.IPv4, "10.0.0.0/24")));
    store.create(labelled(subnet(NAMESPACE, "oob-v6", SubnetState.AddressType.IPv6, "2001:db8:5::/64")));
    store.create(subnet(NAMESPACE, "other-v6", SubnetState.AddressType.IPv6, "2001:db8:6::/64"));
    controller = new ReservationControllerSimulator(store);
    ReservationManager manager = new ReservationManager(store, new PollingStateAwaiter(store, Duration.ofMillis(10)),
        Duration.ofMillis(500), Duration.ofMillis(500));
    plugin = new OobPlugin(new SubnetSelector(store), manager);
  }

  @AfterMethod
  public void tearDown() {
    controller.close();
  }

  @Test
  public void testDhcp4OffersReservedAddress() throws Exception {
    Dhcp4Handler handler = plugin.setup4(ImmutableList.of(config("oob.yml")));
    Dhcp4Message request = discover(MAC);

    HandlerResult<Dhcp4Message> result = handler.handle(request, offer(request));

    assertThat(result.isContinue(), is(true));
    assertThat(result.getReply().getYourAddress(), is(ipv4("10.0.0.10")));

    AddressReservationState reservation = store.get(AddressReservationState.class, NAMESPACE,
        ReservationManager.reservationName(HardwareAddress.parse(MAC), "oob", "oob-v4"));
    assertThat(reservation.labels, hasEntry("subnet", "dhcp"));
    assertThat(reservation.labels, hasEntry(ReservationManager.LABEL_ORIGIN, "oob"));
    assertThat(reservation.requestedAddress, is(nullValue()));
  }

  @Test
  public void testDhcp4KeepsRequestedAddress() throws Exception {
    Dhcp4Handler handler = plugin.setup4(ImmutableList.of(config("oob.yml")));
    Dhcp4Message request = discover(MAC);
    request.setRequestedAddress(ipv4("10.0.0.77"));

    HandlerResult<Dhcp4Message> result = handler.handle(request, offer(request));

    assertThat(result.isContinue(), is(true));
    assertThat(result.getReply().getYourAddress(), is(ipv4("10.0.0.77")));
  }

  @Test
  public void testDhcp4WithoutHardwareAddressIsDropped() throws Exception {
    Dhcp4Handler handler = plugin.setup4(ImmutableList.of(config("oob.yml")));
    Dhcp4Message request = discover(MAC);
    request.setClientHardwareAddress(null);

    assertThat(handler.handle(request, offer(request)).getKind(), is(HandlerResult.Kind.DROP));
  }

  @Test
  public void testDhcp6AddsAddressFromLabelledSubnet() throws Exception {
    Dhcp6Handler handler = plugin.setup6(ImmutableList.of(config("oob.yml")));

    HandlerResult<Dhcp6ClientMessage> result = handler.handle(relay("2001:db8:5::1", PEER, solicitAddress(7)),
        advertise());

    assertThat(result.isContinue(), is(true));
    IaNaOption iaNa = result.getReply().getIaNa();
    assertThat(iaNa, is(notNullValue()));
    assertThat(iaNa.getIaId(), is(7));
    assertThat(iaNa.getAddresses(), hasSize(1));
    IaAddressOption address = iaNa.getAddresses().get(0);
    assertThat(address.getAddress(), is(ipv6("2001:db8:5::a")));
    assertThat(address.getPreferredLifetime(), is(Duration.ofHours(24)));
    assertThat(address.getValidLifetime(), is(Duration.ofHours(24)));
  }

  @Test
  public void testDhcp6PrefersClientLinkLayerAddress() throws Exception {
    Dhcp6Handler handler = plugin.setup6(ImmutableList.of(config("oob.yml")));

    handler.handle(relayWithClientLinkLayer("2001:db8:5::1", PEER, "aa:bb:cc:dd:ee:ff", solicitAddress(7)),
        advertise());

    AddressReservationState reservation = store.get(AddressReservationState.class, NAMESPACE,
        ReservationManager.reservationName(HardwareAddress.parse("aa:bb:cc:dd:ee:ff"), "oob", "oob-v6"));
    assertThat(reservation.getLabel(ReservationManager.LABEL_MAC), is("aabbccddeeff"));
  }

  @Test
  public void testDhcp6WithoutAddressRequestContinues() throws Exception {
    Dhcp6Handler handler = plugin.setup6(ImmutableList.of(config("oob.yml")));

    HandlerResult<Dhcp6ClientMessage> result = handler.handle(relay("2001:db8:5::1", PEER, solicit()), advertise());

    assertThat(result.isContinue(), is(true));
    assertThat(result.getReply().getIaNa(), is(nullValue()));
    assertThat(reservations(), is(empty()));
  }

  @Test
  public void testDhcp6LinkOutsideLabelledSubnetsIsAnError() throws Exception {
    Dhcp6Handler handler = plugin.setup6(ImmutableList.of(config("oob.yml")));

    HandlerResult<Dhcp6ClientMessage> result = handler.handle(relay("2001:db8:6::1", PEER, solicitAddress(7)),
        advertise());

    assertThat(result.getKind(), is(HandlerResult.Kind.ERROR));
    assertThat(reservations(), is(empty()));
  }

  @Test
  public void testNoLabelledSubnetsIsAnError() throws Exception {
    store.delete(SubnetState.class, NAMESPACE, "oob-v6");
    Dhcp6Handler handler = plugin.setup6(ImmutableList.of(config("oob.yml")));

    HandlerResult<Dhcp6ClientMessage> result = handler.handle(relay("2001:db8:5::1", PEER, solicitAddress(7)),
        advertise());

    assertThat(result.getKind(), is(HandlerResult.Kind.ERROR));
  }

  @Test
  public void testDhcp6NonRelayIsDropped() throws Exception {
    Dhcp6Handler handler = plugin.setup6(ImmutableList.of(config("oob.yml")));

    assertThat(handler.handle(solicitAddress(7), advertise()).getKind(), is(HandlerResult.Kind.DROP));
  }

  @Test
  public void testFailedReservationIsAnError() throws Exception {
    controller.setMode(ReservationControllerSimulator.Mode.FAIL);
    Dhcp4Handler handler = plugin.setup4(ImmutableList.of(config("oob.yml")));
    Dhcp4Message request = discover(MAC);
    Dhcp4Message reply = offer(request);

    HandlerResult<Dhcp4Message> result = handler.handle(request, reply);

    assertThat(result.getKind(), is(HandlerResult.Kind.ERROR));
    assertThat(reply.getYourAddress(), is(nullValue()));
  }

  @Test(expectedExceptions = BadConfigException.class)
  public void testLabelWithoutValueIsRejected() throws BadConfigException {
    plugin.setup6(ImmutableList.of(config("oob_bad_label.yml")));
  }

  @Test(expectedExceptions = BadConfigException.class)
  public void testLabelWithoutKeyIsRejected() throws BadConfigException {
    plugin.setup4(ImmutableList.of(config("oob_empty_key.yml")));
  }

  @Test
  public void testReservedLabelKeyIsRejected() {
    try {
      plugin.setup4(ImmutableList.of(config("oob_reserved_key.yml")));
      fail("a subnet label on the mac key should be rejected");
    } catch (BadConfigException e) {
      assertThat(e.getMessage(), containsString("mac"));
    }
  }

  @Test(expectedExceptions = BadConfigException.class)
  public void testSetupRequiresOneArgument() throws BadConfigException {
    plugin.setup4(ImmutableList.<String>of());
  }

  private List<AddressReservationState> reservations() throws StoreException {
    return store.list(AddressReservationState.class, null, LabelSelector.everything());
  }

  private static SubnetState labelled(SubnetState subnet) {
    subnet.labels.put("subnet", "dhcp");
    return subnet;
  }

  private static String config(String name) {
    return OobPluginTest.class.getResource("/configs/" + name).getPath();
  }
}
