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

package com.edgemetal.dhcp.responder.reservation;

import com.edgemetal.dhcp.common.IpHelper;
import com.edgemetal.dhcp.responder.derivation.CandidateAddress;
import com.edgemetal.dhcp.responder.protocol.HardwareAddress;
import com.edgemetal.dhcp.store.AddressReservationState;
import com.edgemetal.dhcp.store.LabelSelector;
import com.edgemetal.dhcp.store.ResourceStore;
import com.edgemetal.dhcp.store.SubnetState;
import com.edgemetal.dhcp.store.exceptions.StoreException;
import com.edgemetal.dhcp.store.memory.InMemoryResourceStore;

import com.google.common.base.Optional;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasEntry;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.mockito.AdditionalAnswers.delegatesTo;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.testng.Assert.fail;

import static com.edgemetal.dhcp.responder.protocol.TestMessages.ipv4;
import static com.edgemetal.dhcp.responder.reservation.ReservationControllerSimulator.subnet;

import java.net.InetAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Tests {@link ReservationManager}.
 */
public class ReservationManagerTest {

  private static final String NAMESPACE = "oob-ns";

  private static final HardwareAddress MAC = HardwareAddress.parse("00:1a:2b:3c:4d:5e");

  private InMemoryResourceStore store;
  private ReservationControllerSimulator controller;
  private ReservationManager manager;

  @BeforeMethod
  public void setUp() throws StoreException {
    store = new InMemoryResourceStore();
    store.create(subnet(NAMESPACE, "oob-v4", SubnetState.AddressType.IPv4, "10.0.0.0/24"));
    store.create(subnet(NAMESPACE, "oob-v4-b", SubnetState.AddressType.IPv4, "10.1.0.0/24"));
    controller = new ReservationControllerSimulator(store);
    manager = new ReservationManager(store, new PollingStateAwaiter(store, Duration.ofMillis(10)),
        Duration.ofMillis(500), Duration.ofMillis(500));
  }

  @AfterMethod
  public void tearDown() {
    controller.close();
  }

  @Test
  public void testReserveCreatesLabelledReservation() throws Exception {
    ReservedAddress reserved = manager.reserve(request("oob-v4").build());

    assertThat(IpHelper.toAddressString(reserved.getAddress()), is("10.0.0.10"));
    assertThat(reserved.getSubnet(), is("oob-v4"));
    assertThat(reserved.getReservationName(), is("001a2b3c4d5e-oob-oob-v4"));

    AddressReservationState stored = store.get(AddressReservationState.class, NAMESPACE,
        reserved.getReservationName());
    assertThat(stored.labels, hasEntry(ReservationManager.LABEL_MAC, "001a2b3c4d5e"));
    assertThat(stored.labels, hasEntry(ReservationManager.LABEL_ORIGIN, "oob"));
    assertThat(stored.uid, is(reserved.getReservationUid()));
  }

  @Test
  public void testReserveExactAddress() throws Exception {
    ReservedAddress reserved = manager.reserve(request("oob-v4")
        .candidate(CandidateAddress.exact(ipv4("10.0.0.77")))
        .build());

    assertThat(reserved.getAddress(), is((InetAddress) ipv4("10.0.0.77")));
  }

  @Test
  public void testSubnetHintIsNotRequested() throws Exception {
    manager.reserve(request("oob-v4").candidate(CandidateAddress.subnetHint(ipv4("10.0.0.1"))).build());

    AddressReservationState stored = store.get(AddressReservationState.class, NAMESPACE,
        ReservationManager.reservationName(MAC, "oob", "oob-v4"));
    assertThat(stored.requestedAddress == null, is(true));
  }

  @Test
  public void testReserveIsIdempotent() throws Exception {
    ReservedAddress first = manager.reserve(request("oob-v4").build());
    ReservedAddress second = manager.reserve(request("oob-v4").build());

    assertThat(second.getAddress(), is(first.getAddress()));
    assertThat(second.getReservationUid(), is(first.getReservationUid()));
    assertThat(controller.getCreated(), is(1));
  }

  @Test
  public void testOneReservationPerSubnet() throws Exception {
    ReservedAddress first = manager.reserve(request("oob-v4").build());
    ReservedAddress second = manager.reserve(request("oob-v4-b").build());

    assertThat(second.getReservationName(), is(not(first.getReservationName())));
    assertThat(controller.getCreated(), is(2));
  }

  @Test
  public void testConcurrentReserveConverges() throws Exception {
    final int callers = 8;
    final CountDownLatch start = new CountDownLatch(1);
    ExecutorService executor = Executors.newFixedThreadPool(callers);
    try {
      Callable<ReservedAddress> reserve = () -> {
        start.await();
        return manager.reserve(request("oob-v4").build());
      };
      List<Future<ReservedAddress>> results = new ArrayList<>();
      for (int i = 0; i < callers; i++) {
        results.add(executor.submit(reserve));
      }
      start.countDown();

      InetAddress address = results.get(0).get(5, TimeUnit.SECONDS).getAddress();
      for (Future<ReservedAddress> result : results) {
        assertThat(result.get(5, TimeUnit.SECONDS).getAddress(), is(address));
      }
    } finally {
      executor.shutdownNow();
    }

    assertThat(store.list(AddressReservationState.class, NAMESPACE,
        LabelSelector.of(ReservationManager.LABEL_MAC, MAC.sanitized())), hasSize(1));
    assertThat(controller.getCreated(), is(1));
  }

  @Test
  public void testFailedReservationIsReported() throws StoreException {
    controller.setMode(ReservationControllerSimulator.Mode.FAIL);
    try {
      manager.reserve(request("oob-v4").build());
      fail("reservation should have failed");
    } catch (ReservationException e) {
      assertThat(e.getMessage().contains("failed"), is(true));
    }
  }

  @Test
  public void testFailedReservationIsReplaced() throws Exception {
    String failedUid = seedFailedReservation();

    controller.setMode(ReservationControllerSimulator.Mode.ALLOCATE);
    ReservedAddress reserved = manager.reserve(request("oob-v4").build());

    assertThat(reserved.getReservationUid(), is(not(failedUid)));
    assertThat(reserved.getReservationName(), is(ReservationManager.reservationName(MAC, "oob", "oob-v4")));
    assertThat(controller.getCreated(), is(2));
  }

  @Test
  public void testStaleFailedReservationDoesNotRemoveReplacement() throws Exception {
    String failedUid = seedFailedReservation();
    List<AddressReservationState> staleListing = store.list(AddressReservationState.class, NAMESPACE,
        LabelSelector.of(ReservationManager.LABEL_MAC, MAC.sanitized()));

    controller.setMode(ReservationControllerSimulator.Mode.ALLOCATE);
    ReservedAddress first = manager.reserve(request("oob-v4").build());

    // The second caller still sees the failed reservation that the first caller already replaced.
    ResourceStore staleStore = mock(ResourceStore.class, delegatesTo(store));
    doReturn(staleListing).when(staleStore).list(eq(AddressReservationState.class), any(), any());
    ReservationManager lagging = new ReservationManager(staleStore,
        new PollingStateAwaiter(store, Duration.ofMillis(10)), Duration.ofMillis(500), Duration.ofMillis(500));
    ReservedAddress second = lagging.reserve(request("oob-v4").build());

    assertThat(second.getAddress(), is(first.getAddress()));
    assertThat(second.getReservationUid(), is(first.getReservationUid()));
    assertThat(first.getReservationUid(), is(not(failedUid)));
    assertThat(store.get(AddressReservationState.class, NAMESPACE, first.getReservationName()).uid,
        is(first.getReservationUid()));
    assertThat(controller.getCreated(), is(2));
  }

  @Test
  public void testConcurrentReserveReplacesFailedReservationOnce() throws Exception {
    String failedUid = seedFailedReservation();
    controller.setMode(ReservationControllerSimulator.Mode.ALLOCATE);

    final int callers = 8;
    final CountDownLatch start = new CountDownLatch(1);
    ExecutorService executor = Executors.newFixedThreadPool(callers);
    List<ReservedAddress> reserved = new ArrayList<>();
    try {
      Callable<ReservedAddress> reserve = () -> {
        start.await();
        return manager.reserve(request("oob-v4").build());
      };
      List<Future<ReservedAddress>> results = new ArrayList<>();
      for (int i = 0; i < callers; i++) {
        results.add(executor.submit(reserve));
      }
      start.countDown();

      for (Future<ReservedAddress> result : results) {
        reserved.add(result.get(5, TimeUnit.SECONDS));
      }
    } finally {
      executor.shutdownNow();
    }

    List<AddressReservationState> live = store.list(AddressReservationState.class, NAMESPACE,
        LabelSelector.of(ReservationManager.LABEL_MAC, MAC.sanitized()));
    assertThat(live, hasSize(1));
    assertThat(live.get(0).uid, is(not(failedUid)));
    for (ReservedAddress result : reserved) {
      assertThat(result.getAddress(), is(reserved.get(0).getAddress()));
      assertThat(result.getReservationUid(), is(live.get(0).uid));
    }
    assertThat(controller.getCreated(), is(2));
  }

  @Test
  public void testUnresolvedReservationTimesOut() throws StoreException {
    controller.setMode(ReservationControllerSimulator.Mode.IGNORE);
    manager = new ReservationManager(store, new PollingStateAwaiter(store, Duration.ofMillis(10)),
        Duration.ofMillis(50), Duration.ofMillis(50));
    try {
      manager.reserve(request("oob-v4").build());
      fail("reservation should have timed out");
    } catch (ReservationException e) {
      assertThat(e.getCause(), is(instanceOf(AwaitTimeoutException.class)));
    }
  }

  @Test
  public void testMissingLabelsArePatched() throws Exception {
    ReservedAddress first = manager.reserve(request("oob-v4").build());
    ReservedAddress second = manager.reserve(request("oob-v4").label("subnet", "dhcp").build());

    assertThat(second.getReservationUid(), is(first.getReservationUid()));
    AddressReservationState stored = store.get(AddressReservationState.class, NAMESPACE,
        first.getReservationName());
    assertThat(stored.labels, hasEntry("subnet", "dhcp"));
    assertThat(stored.labels, hasEntry(ReservationManager.LABEL_MAC, MAC.sanitized()));
  }

  @Test
  public void testLaterLabelValueWins() {
    ReservationRequest request = request("oob-v4").label("subnet", "dhcp").label("subnet", "pxe").build();

    assertThat(request.getExtraLabels(), hasEntry("subnet", "pxe"));
    assertThat(request.getExtraLabels().size(), is(1));
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testManagedLabelCannotBeOverridden() {
    request("oob-v4").label(ReservationManager.LABEL_ORIGIN, "metal");
  }

  @Test
  public void testReserveWithWatchingAwaiter() throws Exception {
    manager = new ReservationManager(store, new WatchingStateAwaiter(store), Duration.ofMillis(500),
        Duration.ofMillis(500));

    ReservedAddress reserved = manager.reserve(request("oob-v4").build());
    assertThat(IpHelper.toAddressString(reserved.getAddress()), is("10.0.0.10"));
  }

  @Test
  public void testFindReserved() throws Exception {
    assertThat(manager.findReserved(null, MAC, SubnetState.AddressType.IPv4).isPresent(), is(false));

    manager.reserve(request("oob-v4").build());

    Optional<InetAddress> v4 = manager.findReserved(null, MAC, SubnetState.AddressType.IPv4);
    assertThat(v4.get(), is((InetAddress) ipv4("10.0.0.10")));
    assertThat(manager.findReserved(NAMESPACE, MAC, SubnetState.AddressType.IPv4).isPresent(), is(true));
    assertThat(manager.findReserved("elsewhere", MAC, SubnetState.AddressType.IPv4).isPresent(), is(false));
    assertThat(manager.findReserved(null, MAC, SubnetState.AddressType.IPv6).isPresent(), is(false));
  }

  private String seedFailedReservation() throws StoreException {
    controller.setMode(ReservationControllerSimulator.Mode.FAIL);
    try {
      manager.reserve(request("oob-v4").build());
      fail("reservation should have failed");
    } catch (ReservationException e) {
      // expected
    }
    return store.get(AddressReservationState.class, NAMESPACE,
        ReservationManager.reservationName(MAC, "oob", "oob-v4")).uid;
  }

  private static ReservationRequest.Builder request(String subnet) {
    return ReservationRequest.builder()
        .namespace(NAMESPACE)
        .hardwareAddress(MAC)
        .subnet(subnet)
        .origin("oob");
  }
}
