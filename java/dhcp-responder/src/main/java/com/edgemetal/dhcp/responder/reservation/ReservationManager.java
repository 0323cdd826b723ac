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
import com.edgemetal.dhcp.responder.protocol.HardwareAddress;
import com.edgemetal.dhcp.store.AddressReservationState;
import com.edgemetal.dhcp.store.LabelSelector;
import com.edgemetal.dhcp.store.ResourceStore;
import com.edgemetal.dhcp.store.SubnetState;
import com.edgemetal.dhcp.store.exceptions.ResourceAlreadyExistsException;
import com.edgemetal.dhcp.store.exceptions.ResourceConflictException;
import com.edgemetal.dhcp.store.exceptions.ResourceNotFoundException;
import com.edgemetal.dhcp.store.exceptions.StoreException;

import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Owns the lifecycle of address reservations.
 * <p>
 * There is at most one live (not failed) reservation per hardware address and subnet. Reservations are named
 * after the hardware address, the origin and the subnet, so concurrent responders asking for the same pair
 * collide on create and end up waiting for the same record.
 */
public class ReservationManager {

  public static final String LABEL_MAC = "mac";

  public static final String LABEL_ORIGIN = "origin";

  public static final String LABEL_IP = "ip";

  private static final Logger logger = LoggerFactory.getLogger(ReservationManager.class);

  private final ResourceStore store;
  private final ResourceStateAwaiter awaiter;
  private final Duration creationTimeout;
  private final Duration deletionTimeout;

  public ReservationManager(ResourceStore store, ResourceStateAwaiter awaiter, Duration creationTimeout,
                            Duration deletionTimeout) {
    this.store = Preconditions.checkNotNull(store);
    this.awaiter = Preconditions.checkNotNull(awaiter);
    this.creationTimeout = Preconditions.checkNotNull(creationTimeout);
    this.deletionTimeout = Preconditions.checkNotNull(deletionTimeout);
  }

  /**
   * Returns the address reserved for the client, creating the reservation when there is none and waiting for
   * the controller to resolve it.
   *
   * @param request client, subnet and optional exact address
   * @return the reserved address
   * @throws ReservationException if the reservation failed, timed out, or the store could not be used
   */
  public ReservedAddress reserve(ReservationRequest request) throws ReservationException {
    try {
      AddressReservationState reservation = findLive(request);
      if (reservation == null) {
        reservation = create(request);
      } else {
        logger.info("Found reservation {} for {}", reservation.name, request);
        reservation = applyLabels(reservation, request);
      }
      return awaitReserved(reservation);
    } catch (StoreException e) {
      throw new ReservationException(String.format("Could not reserve an address for %s: %s", request,
          e.getMessage()), e);
    }
  }

  /**
   * Looks up the address reserved for a hardware address in any subnet of the given family, without creating
   * anything.
   *
   * @param namespace       namespace to search, null for all
   * @param hardwareAddress client
   * @param addressType     family of the address
   * @return reserved address, absent when the client has none yet
   * @throws StoreException if the reservations could not be listed
   */
  public Optional<InetAddress> findReserved(String namespace, HardwareAddress hardwareAddress,
                                            SubnetState.AddressType addressType) throws StoreException {
    List<AddressReservationState> reservations = store.list(AddressReservationState.class, namespace,
        LabelSelector.of(LABEL_MAC, hardwareAddress.sanitized()));

    for (AddressReservationState reservation : reservations) {
      if (reservation.reservedAddress == null) {
        continue;
      }

      InetAddress address;
      try {
        address = IpHelper.parse(reservation.reservedAddress);
      } catch (IllegalArgumentException e) {
        logger.warn("Reservation {} holds malformed address {}", reservation.name, reservation.reservedAddress);
        continue;
      }

      if (addressType == SubnetState.AddressType.IPv4 ? IpHelper.isIpv4(address) : IpHelper.isIpv6(address)) {
        return Optional.of(address);
      }
    }
    return Optional.absent();
  }

  /**
   * Name of the reservation for a client in a subnet.
   */
  public static String reservationName(HardwareAddress hardwareAddress, String origin, String subnet) {
    return String.format("%s-%s-%s", hardwareAddress.sanitized(), origin, subnet);
  }

  private AddressReservationState findLive(ReservationRequest request) throws StoreException {
    List<AddressReservationState> reservations = store.list(AddressReservationState.class, request.getNamespace(),
        LabelSelector.of(LABEL_MAC, request.getHardwareAddress().sanitized()));

    for (AddressReservationState reservation : reservations) {
      if (!request.getSubnet().equals(reservation.subnet)) {
        continue;
      }

      if (reservation.state == AddressReservationState.State.FAILED) {
        logger.info("Deleting failed reservation {} for {}", reservation.name, request);
        try {
          store.delete(AddressReservationState.class, reservation.getNamespace(), reservation.name,
              reservation.uid);
        } catch (ResourceNotFoundException e) {
          logger.debug("Failed reservation {} is already gone", reservation.name);
        } catch (ResourceConflictException e) {
          logger.debug("Failed reservation {} was already replaced", reservation.name);
        }
        awaiter.awaitDeletion(AddressReservationState.class, reservation.getNamespace(), reservation.name,
            reservation.uid, deletionTimeout);
        continue;
      }

      return reservation;
    }
    return null;
  }

  private AddressReservationState create(ReservationRequest request) throws StoreException {
    AddressReservationState reservation = new AddressReservationState();
    reservation.namespace = request.getNamespace();
    reservation.name = reservationName(request.getHardwareAddress(), request.getOrigin(), request.getSubnet());
    reservation.subnet = request.getSubnet();
    if (request.getExactAddress() != null) {
      reservation.requestedAddress = IpHelper.toAddressString(request.getExactAddress());
    }
    reservation.labels.putAll(request.getExtraLabels());
    reservation.labels.put(LABEL_MAC, request.getHardwareAddress().sanitized());
    reservation.labels.put(LABEL_ORIGIN, request.getOrigin());

    try {
      AddressReservationState created = store.create(reservation);
      logger.info("Created reservation {} for {}", created.name, request);
      return created;
    } catch (ResourceAlreadyExistsException e) {
      logger.info("Reservation {} was created concurrently, waiting for it", reservation.name);
      return reservation;
    }
  }

  private AddressReservationState applyLabels(AddressReservationState reservation, ReservationRequest request)
      throws StoreException {
    boolean missing = false;
    for (Map.Entry<String, String> label : request.getExtraLabels().entrySet()) {
      if (!label.getValue().equals(reservation.getLabel(label.getKey()))) {
        missing = true;
        break;
      }
    }
    if (!missing) {
      return reservation;
    }

    logger.info("Updating labels of reservation {} to {}", reservation.name, request.getExtraLabels());
    return store.patch(AddressReservationState.class, reservation.getNamespace(), reservation.name,
        r -> r.labels.putAll(request.getExtraLabels()));
  }

  private ReservedAddress awaitReserved(AddressReservationState reservation) throws StoreException,
      ReservationException {
    AddressReservationState terminal = awaiter.awaitState(AddressReservationState.class, reservation.getNamespace(),
        reservation.name, AddressReservationState::isTerminal, creationTimeout);

    if (terminal.state == AddressReservationState.State.FAILED) {
      throw new ReservationException(String.format("Reservation %s/%s failed", terminal.getNamespace(),
          terminal.name));
    }
    if (terminal.reservedAddress == null) {
      throw new ReservationException(String.format("Reservation %s/%s finished without an address",
          terminal.getNamespace(), terminal.name));
    }

    InetAddress address;
    try {
      address = IpHelper.parse(terminal.reservedAddress);
    } catch (IllegalArgumentException e) {
      throw new ReservationException(String.format("Reservation %s/%s holds malformed address %s",
          terminal.getNamespace(), terminal.name, terminal.reservedAddress), e);
    }

    logger.info("Reservation {} holds {}", terminal.name, terminal.reservedAddress);
    return new ReservedAddress(address, terminal.name, terminal.uid, terminal.subnet);
  }
}
