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

import com.edgemetal.dhcp.store.AddressReservationState;
import com.edgemetal.dhcp.store.exceptions.StoreException;
import com.edgemetal.dhcp.store.memory.InMemoryResourceStore;

import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Tests {@link PollingStateAwaiter} and {@link WatchingStateAwaiter}.
 */
public class ResourceStateAwaiterTest {

  private static final String NAMESPACE = "ns";

  private InMemoryResourceStore store;
  private ScheduledExecutorService executor;

  @BeforeMethod
  public void setUp() {
    store = new InMemoryResourceStore();
    executor = Executors.newSingleThreadScheduledExecutor();
  }

  @AfterMethod
  public void tearDown() {
    executor.shutdownNow();
  }

  @DataProvider(name = "Awaiters")
  public Object[][] getAwaiters() {
    return new Object[][]{
        {"polling"},
        {"watching"},
    };
  }

  @Test(dataProvider = "Awaiters")
  public void testAwaitStateReturnsCurrentState(String kind) throws StoreException {
    AddressReservationState reservation = reservation("r1");
    reservation.state = AddressReservationState.State.FINISHED;
    store.create(reservation);

    AddressReservationState terminal = awaiter(kind).awaitState(AddressReservationState.class, NAMESPACE, "r1",
        AddressReservationState::isTerminal, Duration.ofMillis(200));
    assertThat(terminal.state, is(AddressReservationState.State.FINISHED));
  }

  @Test(dataProvider = "Awaiters")
  public void testAwaitStateSeesLaterChange(String kind) throws StoreException {
    store.create(reservation("r1"));
    executor.schedule(() -> {
      store.patch(AddressReservationState.class, NAMESPACE, "r1", r -> {
        r.state = AddressReservationState.State.FINISHED;
        r.reservedAddress = "10.0.0.3";
      });
      return null;
    }, 50, TimeUnit.MILLISECONDS);

    AddressReservationState terminal = awaiter(kind).awaitState(AddressReservationState.class, NAMESPACE, "r1",
        AddressReservationState::isTerminal, Duration.ofSeconds(2));
    assertThat(terminal.reservedAddress, is("10.0.0.3"));
  }

  @Test(dataProvider = "Awaiters")
  public void testAwaitStateSeesLaterCreation(String kind) throws StoreException {
    executor.schedule(() -> {
      AddressReservationState reservation = reservation("r2");
      reservation.state = AddressReservationState.State.FAILED;
      store.create(reservation);
      return null;
    }, 50, TimeUnit.MILLISECONDS);

    AddressReservationState terminal = awaiter(kind).awaitState(AddressReservationState.class, NAMESPACE, "r2",
        AddressReservationState::isTerminal, Duration.ofSeconds(2));
    assertThat(terminal.state, is(AddressReservationState.State.FAILED));
  }

  @Test(dataProvider = "Awaiters", expectedExceptions = AwaitTimeoutException.class)
  public void testAwaitStateTimesOut(String kind) throws StoreException {
    store.create(reservation("r1"));
    awaiter(kind).awaitState(AddressReservationState.class, NAMESPACE, "r1", AddressReservationState::isTerminal,
        Duration.ofMillis(50));
  }

  @Test(dataProvider = "Awaiters")
  public void testAwaitDeletion(String kind) throws StoreException {
    store.create(reservation("r1"));
    executor.schedule(() -> {
      store.delete(AddressReservationState.class, NAMESPACE, "r1");
      return null;
    }, 50, TimeUnit.MILLISECONDS);

    awaiter(kind).awaitDeletion(AddressReservationState.class, NAMESPACE, "r1", null, Duration.ofSeconds(2));
  }

  @Test(dataProvider = "Awaiters")
  public void testAwaitDeletionOfMissingResource(String kind) throws StoreException {
    awaiter(kind).awaitDeletion(AddressReservationState.class, NAMESPACE, "missing", "uid", Duration.ofMillis(50));
  }

  @Test(dataProvider = "Awaiters", expectedExceptions = AwaitTimeoutException.class)
  public void testAwaitDeletionTimesOut(String kind) throws StoreException {
    AddressReservationState created = store.create(reservation("r1"));
    awaiter(kind).awaitDeletion(AddressReservationState.class, NAMESPACE, "r1", created.uid, Duration.ofMillis(50));
  }

  @Test(dataProvider = "Awaiters")
  public void testAwaitDeletionEndsWhenNameIsReused(String kind) throws StoreException {
    AddressReservationState stale = store.create(reservation("r1"));
    store.delete(AddressReservationState.class, NAMESPACE, "r1");
    store.create(reservation("r1"));

    awaiter(kind).awaitDeletion(AddressReservationState.class, NAMESPACE, "r1", stale.uid, Duration.ofSeconds(2));
  }

  @Test(dataProvider = "Awaiters")
  public void testAwaitDeletionSeesLaterReplacement(String kind) throws StoreException {
    AddressReservationState stale = store.create(reservation("r1"));
    executor.schedule(() -> {
      store.delete(AddressReservationState.class, NAMESPACE, "r1");
      store.create(reservation("r1"));
      return null;
    }, 50, TimeUnit.MILLISECONDS);

    awaiter(kind).awaitDeletion(AddressReservationState.class, NAMESPACE, "r1", stale.uid, Duration.ofSeconds(2));
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testPollIntervalMustBePositive() {
    new PollingStateAwaiter(store, Duration.ZERO);
  }

  private ResourceStateAwaiter awaiter(String kind) {
    return "polling".equals(kind)
        ? new PollingStateAwaiter(store, Duration.ofMillis(10))
        : new WatchingStateAwaiter(store);
  }

  private static AddressReservationState reservation(String name) {
    AddressReservationState reservation = new AddressReservationState();
    reservation.namespace = NAMESPACE;
    reservation.name = name;
    reservation.subnet = "subnet";
    return reservation;
  }
}
