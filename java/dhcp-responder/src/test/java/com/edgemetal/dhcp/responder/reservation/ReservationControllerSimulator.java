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
import com.edgemetal.dhcp.store.AddressReservationState;
import com.edgemetal.dhcp.store.SubnetState;
import com.edgemetal.dhcp.store.Subscription;
import com.edgemetal.dhcp.store.WatchEvent;
import com.edgemetal.dhcp.store.exceptions.ResourceNotFoundException;
import com.edgemetal.dhcp.store.memory.InMemoryResourceStore;

import java.net.InetAddress;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Stands in for the controller resolving reservations: every new reservation is answered with the requested
 * address or the next free address of its subnet, or marked failed.
 */
public class ReservationControllerSimulator implements AutoCloseable {

  /**
   * How new reservations are resolved.
   */
  public enum Mode {
    ALLOCATE,
    FAIL,
    IGNORE
  }

  private final InMemoryResourceStore store;
  private final AtomicInteger nextHost = new AtomicInteger(10);
  private final AtomicInteger created = new AtomicInteger();
  private final Subscription subscription;
  private volatile Mode mode = Mode.ALLOCATE;

  public ReservationControllerSimulator(InMemoryResourceStore store) {
    this.store = store;
    this.subscription = store.watchAll(AddressReservationState.class, this::onEvent);
  }

  public void setMode(Mode mode) {
    this.mode = mode;
  }

  /**
   * Number of reservations created while the simulator was running.
   */
  public int getCreated() {
    return created.get();
  }

  public static SubnetState subnet(String namespace, String name, SubnetState.AddressType type, String reserved) {
    SubnetState subnet = new SubnetState();
    subnet.namespace = namespace;
    subnet.name = name;
    subnet.addressType = type;
    subnet.reserved = reserved;
    return subnet;
  }

  @Override
  public void close() {
    subscription.close();
  }

  private void onEvent(WatchEvent<AddressReservationState> event) {
    if (event.getType() != WatchEvent.Type.ADDED) {
      return;
    }
    created.incrementAndGet();

    final AddressReservationState reservation = event.getDocument();
    final Mode current = mode;
    if (current == Mode.IGNORE) {
      return;
    }

    try {
      if (current == Mode.FAIL) {
        store.patch(AddressReservationState.class, reservation.getNamespace(), reservation.name,
            r -> r.state = AddressReservationState.State.FAILED);
        return;
      }

      final String address = reservation.requestedAddress != null
          ? reservation.requestedAddress
          : allocate(store.get(SubnetState.class, reservation.getNamespace(), reservation.subnet));
      store.patch(AddressReservationState.class, reservation.getNamespace(), reservation.name, r -> {
        r.reservedAddress = address;
        r.state = AddressReservationState.State.FINISHED;
      });
    } catch (ResourceNotFoundException e) {
      throw new IllegalStateException("Reservation " + reservation.name + " refers to a missing subnet", e);
    }
  }

  private String allocate(SubnetState subnet) {
    byte[] bytes = IpHelper.parse(subnet.reserved.substring(0, subnet.reserved.indexOf('/'))).getAddress();
    bytes[bytes.length - 1] += (byte) nextHost.getAndIncrement();
    InetAddress address = IpHelper.fromBytes(bytes);
    return IpHelper.toAddressString(address);
  }
}
