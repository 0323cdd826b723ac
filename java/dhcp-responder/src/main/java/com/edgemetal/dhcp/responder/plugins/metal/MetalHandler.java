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

package com.edgemetal.dhcp.responder.plugins.metal;

import com.edgemetal.dhcp.responder.derivation.AddressDerivationException;
import com.edgemetal.dhcp.responder.derivation.AddressDeriver;
import com.edgemetal.dhcp.responder.endpoint.EndpointPublishException;
import com.edgemetal.dhcp.responder.endpoint.EndpointPublisher;
import com.edgemetal.dhcp.responder.endpoint.Inventory;
import com.edgemetal.dhcp.responder.endpoint.PublishResult;
import com.edgemetal.dhcp.responder.handler.Dhcp4Handler;
import com.edgemetal.dhcp.responder.handler.Dhcp6Handler;
import com.edgemetal.dhcp.responder.handler.HandlerResult;
import com.edgemetal.dhcp.responder.protocol.Dhcp4Message;
import com.edgemetal.dhcp.responder.protocol.Dhcp6ClientMessage;
import com.edgemetal.dhcp.responder.protocol.Dhcp6Message;
import com.edgemetal.dhcp.responder.protocol.HardwareAddress;
import com.edgemetal.dhcp.responder.reservation.ReservationManager;
import com.edgemetal.dhcp.store.SubnetState;
import com.edgemetal.dhcp.store.exceptions.StoreException;

import com.google.common.base.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;

/**
 * Handler of the metal plugin for one address family. Never changes the reply.
 */
public class MetalHandler implements Dhcp4Handler, Dhcp6Handler {

  private static final Logger logger = LoggerFactory.getLogger(MetalHandler.class);

  private final String namespace;
  private final Inventory inventory;
  private final EndpointPublisher publisher;
  private final ReservationManager reservationManager;
  private final SubnetState.AddressType addressType;

  public MetalHandler(String namespace, Inventory inventory, EndpointPublisher publisher,
                      ReservationManager reservationManager, SubnetState.AddressType addressType) {
    this.namespace = namespace;
    this.inventory = inventory;
    this.publisher = publisher;
    this.reservationManager = reservationManager;
    this.addressType = addressType;
  }

  @Override
  public HandlerResult<Dhcp4Message> handle(Dhcp4Message request, Dhcp4Message reply) {
    HardwareAddress mac = request.getClientHardwareAddress();
    if (mac == null) {
      return HandlerResult.drop("Request carries no client hardware address");
    }

    Throwable failure = apply(mac);
    return failure == null ? HandlerResult.next(reply) : HandlerResult.<Dhcp4Message>error(failure);
  }

  @Override
  public HandlerResult<Dhcp6ClientMessage> handle(Dhcp6Message request, Dhcp6ClientMessage reply) {
    HardwareAddress mac;
    try {
      mac = AddressDeriver.hardwareAddress(AddressDeriver.requireRelay(request));
    } catch (AddressDerivationException e) {
      logger.info("Dropping request: {}", e.getMessage());
      return HandlerResult.drop(e.getMessage());
    }

    Throwable failure = apply(mac);
    return failure == null ? HandlerResult.next(reply) : HandlerResult.<Dhcp6ClientMessage>error(failure);
  }

  /**
   * Publishes the endpoint of the machine.
   *
   * @return the failure, null if the endpoint was published or there was nothing to publish
   */
  private Throwable apply(HardwareAddress mac) {
    if (!inventory.isKnown(mac)) {
      logger.debug("Unknown inventory MAC address {}", mac);
      return null;
    }

    try {
      Optional<InetAddress> address = reservationManager.findReserved(namespace, mac, addressType);
      if (!address.isPresent()) {
        logger.info("No {} address reserved for {} yet", addressType, mac);
        return null;
      }

      PublishResult result = publisher.publish(mac, address.get());
      logger.debug("Endpoint of {}: {}", mac, result);
      return null;
    } catch (StoreException | EndpointPublishException e) {
      logger.error("Could not apply endpoint for {}", mac, e);
      return e;
    }
  }

  @Override
  public String toString() {
    return MetalPlugin.NAME;
  }
}
