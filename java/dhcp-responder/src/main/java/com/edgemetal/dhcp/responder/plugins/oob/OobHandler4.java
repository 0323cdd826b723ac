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

import com.edgemetal.dhcp.common.IpHelper;
import com.edgemetal.dhcp.responder.derivation.AddressDeriver;
import com.edgemetal.dhcp.responder.derivation.CandidateAddress;
import com.edgemetal.dhcp.responder.handler.Dhcp4Handler;
import com.edgemetal.dhcp.responder.handler.HandlerResult;
import com.edgemetal.dhcp.responder.protocol.Dhcp4Message;
import com.edgemetal.dhcp.responder.protocol.HardwareAddress;
import com.edgemetal.dhcp.responder.reservation.ReservationException;
import com.edgemetal.dhcp.responder.reservation.ReservationManager;
import com.edgemetal.dhcp.responder.reservation.ReservedAddress;
import com.edgemetal.dhcp.responder.subnet.SubnetSelector;
import com.edgemetal.dhcp.store.LabelSelector;
import com.edgemetal.dhcp.store.SubnetState;
import com.edgemetal.dhcp.store.exceptions.StoreException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.Inet4Address;

/**
 * DHCPv4 handler of the oob plugin. Sets yiaddr to the reserved address.
 */
public class OobHandler4 extends OobHandler implements Dhcp4Handler {

  private static final Logger logger = LoggerFactory.getLogger(OobHandler4.class);

  public OobHandler4(String namespace, LabelSelector subnetLabel, SubnetSelector subnetSelector,
                     ReservationManager reservationManager) {
    super(namespace, subnetLabel, subnetSelector, reservationManager);
  }

  @Override
  public HandlerResult<Dhcp4Message> handle(Dhcp4Message request, Dhcp4Message reply) {
    HardwareAddress mac = request.getClientHardwareAddress();
    if (mac == null) {
      return HandlerResult.drop("Request carries no client hardware address");
    }

    CandidateAddress candidate = AddressDeriver.v4Candidate(request, reply);
    try {
      ReservedAddress reserved = lease(mac, candidate, SubnetState.AddressType.IPv4);
      if (!(reserved.getAddress() instanceof Inet4Address)) {
        throw new ReservationException("Reserved address " + reserved + " is not an IPv4 address");
      }

      reply.setYourAddress((Inet4Address) reserved.getAddress());
      logger.info("Client {}: offering {}", mac, IpHelper.toAddressString(reserved.getAddress()));
      return HandlerResult.next(reply);
    } catch (StoreException | ReservationException e) {
      logger.error("Could not lease an address for {} near {}", mac, candidate, e);
      return HandlerResult.error(e);
    }
  }
}
