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

package com.edgemetal.dhcp.responder.plugins.ipam;

import com.edgemetal.dhcp.common.IpHelper;
import com.edgemetal.dhcp.responder.derivation.AddressDerivationException;
import com.edgemetal.dhcp.responder.derivation.AddressDeriver;
import com.edgemetal.dhcp.responder.derivation.CandidateAddress;
import com.edgemetal.dhcp.responder.handler.Dhcp6Handler;
import com.edgemetal.dhcp.responder.handler.HandlerResult;
import com.edgemetal.dhcp.responder.protocol.Dhcp6ClientMessage;
import com.edgemetal.dhcp.responder.protocol.Dhcp6Message;
import com.edgemetal.dhcp.responder.protocol.Dhcp6RelayMessage;
import com.edgemetal.dhcp.responder.protocol.HardwareAddress;
import com.edgemetal.dhcp.responder.reservation.ReservationException;
import com.edgemetal.dhcp.responder.reservation.ReservationManager;
import com.edgemetal.dhcp.responder.reservation.ReservationRequest;
import com.edgemetal.dhcp.responder.reservation.ReservedAddress;
import com.edgemetal.dhcp.responder.subnet.SubnetSelector;
import com.edgemetal.dhcp.store.SubnetState;
import com.edgemetal.dhcp.store.exceptions.StoreException;

import com.google.common.base.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.Inet6Address;

/**
 * DHCPv6 handler of the ipam plugin. Records the reservation only; the reply is passed on unchanged.
 */
public class IpamHandler implements Dhcp6Handler {

  private static final Logger logger = LoggerFactory.getLogger(IpamHandler.class);

  private final IpamConfig config;
  private final SubnetSelector subnetSelector;
  private final ReservationManager reservationManager;

  public IpamHandler(IpamConfig config, SubnetSelector subnetSelector, ReservationManager reservationManager) {
    this.config = config;
    this.subnetSelector = subnetSelector;
    this.reservationManager = reservationManager;
  }

  @Override
  public HandlerResult<Dhcp6ClientMessage> handle(Dhcp6Message request, Dhcp6ClientMessage reply) {
    HardwareAddress mac;
    Inet6Address address;
    try {
      Dhcp6RelayMessage relay = AddressDeriver.requireRelay(request);
      mac = AddressDeriver.hardwareAddress(relay);
      address = AddressDeriver.incrementLinkAddress(relay);
    } catch (AddressDerivationException e) {
      logger.info("Dropping request: {}", e.getMessage());
      return HandlerResult.drop(e.getMessage());
    }

    try {
      Optional<SubnetState> subnet = subnetSelector.select(config.getNamespace(), config.getSubnets(),
          CandidateAddress.exact(address));
      if (!subnet.isPresent()) {
        logger.warn("No subnet of {} contains {}, not reserving it for {}", config.getSubnets(),
            IpHelper.toAddressString(address), mac);
        return HandlerResult.next(reply);
      }

      ReservationRequest reservationRequest = ReservationRequest.builder()
          .namespace(config.getNamespace())
          .hardwareAddress(mac)
          .subnet(subnet.get().name)
          .exactAddress(address)
          .origin(IpamPlugin.NAME)
          .label(ReservationManager.LABEL_IP, IpHelper.toLongForm(address))
          .build();
      ReservedAddress reserved = reservationManager.reserve(reservationRequest);
      logger.info("Client {} holds {}", mac, reserved);
      return HandlerResult.next(reply);
    } catch (StoreException | ReservationException e) {
      logger.error("Could not reserve {} for {}", IpHelper.toAddressString(address), mac, e);
      return HandlerResult.error(e);
    }
  }

  @Override
  public String toString() {
    return IpamPlugin.NAME;
  }
}
