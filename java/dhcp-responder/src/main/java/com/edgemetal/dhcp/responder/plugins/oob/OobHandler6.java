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

import com.edgemetal.dhcp.responder.derivation.AddressDerivationException;
import com.edgemetal.dhcp.responder.derivation.AddressDeriver;
import com.edgemetal.dhcp.responder.derivation.CandidateAddress;
import com.edgemetal.dhcp.responder.handler.Dhcp6Handler;
import com.edgemetal.dhcp.responder.handler.HandlerResult;
import com.edgemetal.dhcp.responder.protocol.Dhcp6ClientMessage;
import com.edgemetal.dhcp.responder.protocol.Dhcp6Message;
import com.edgemetal.dhcp.responder.protocol.Dhcp6RelayMessage;
import com.edgemetal.dhcp.responder.protocol.HardwareAddress;
import com.edgemetal.dhcp.responder.protocol.IaAddressOption;
import com.edgemetal.dhcp.responder.protocol.IaNaOption;
import com.edgemetal.dhcp.responder.protocol.MessageDecodeException;
import com.edgemetal.dhcp.responder.reservation.ReservationException;
import com.edgemetal.dhcp.responder.reservation.ReservationManager;
import com.edgemetal.dhcp.responder.reservation.ReservedAddress;
import com.edgemetal.dhcp.responder.subnet.SubnetSelector;
import com.edgemetal.dhcp.store.LabelSelector;
import com.edgemetal.dhcp.store.SubnetState;
import com.edgemetal.dhcp.store.exceptions.StoreException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.Inet6Address;
import java.time.Duration;

/**
 * DHCPv6 handler of the oob plugin. The relay link address selects the subnet; the reserved address is
 * offered in an IA_NA.
 */
public class OobHandler6 extends OobHandler implements Dhcp6Handler {

  public static final Duration PREFERRED_LIFETIME = Duration.ofHours(24);

  public static final Duration VALID_LIFETIME = Duration.ofHours(24);

  private static final Logger logger = LoggerFactory.getLogger(OobHandler6.class);

  public OobHandler6(String namespace, LabelSelector subnetLabel, SubnetSelector subnetSelector,
                     ReservationManager reservationManager) {
    super(namespace, subnetLabel, subnetSelector, reservationManager);
  }

  @Override
  public HandlerResult<Dhcp6ClientMessage> handle(Dhcp6Message request, Dhcp6ClientMessage reply) {
    HardwareAddress mac;
    Inet6Address linkAddress;
    Dhcp6ClientMessage inner;
    try {
      Dhcp6RelayMessage relay = AddressDeriver.requireRelay(request);
      mac = AddressDeriver.hardwareAddress(relay);
      linkAddress = AddressDeriver.requireLinkAddress(relay);
      inner = relay.getInnerMessage();
    } catch (AddressDerivationException | MessageDecodeException e) {
      logger.info("Dropping request: {}", e.getMessage());
      return HandlerResult.drop(e.getMessage());
    }

    IaNaOption requested = inner.getIaNa();
    if (requested == null) {
      logger.debug("No address requested by {}", mac);
      return HandlerResult.next(reply);
    }

    CandidateAddress candidate = CandidateAddress.subnetHint(linkAddress);
    try {
      ReservedAddress reserved = lease(mac, candidate, SubnetState.AddressType.IPv6);
      if (!(reserved.getAddress() instanceof Inet6Address)) {
        throw new ReservationException("Reserved address " + reserved + " is not an IPv6 address");
      }

      IaNaOption iaNa = new IaNaOption(requested.getIaId())
          .addAddress(new IaAddressOption((Inet6Address) reserved.getAddress(), PREFERRED_LIFETIME, VALID_LIFETIME));
      reply.addOption(iaNa);
      logger.info("Client {}: added option {}", mac, iaNa);
      return HandlerResult.next(reply);
    } catch (StoreException | ReservationException e) {
      logger.error("Could not lease an address for {} near {}", mac, candidate, e);
      return HandlerResult.error(e);
    }
  }
}
