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

package com.edgemetal.dhcp.responder.plugins.management;

import com.edgemetal.dhcp.responder.derivation.AddressDerivationException;
import com.edgemetal.dhcp.responder.derivation.AddressDeriver;
import com.edgemetal.dhcp.responder.derivation.Eui64;
import com.edgemetal.dhcp.responder.handler.Dhcp6Handler;
import com.edgemetal.dhcp.responder.handler.HandlerResult;
import com.edgemetal.dhcp.responder.protocol.Dhcp6ClientMessage;
import com.edgemetal.dhcp.responder.protocol.Dhcp6Message;
import com.edgemetal.dhcp.responder.protocol.Dhcp6RelayMessage;
import com.edgemetal.dhcp.responder.protocol.HardwareAddress;
import com.edgemetal.dhcp.responder.protocol.IaAddressOption;
import com.edgemetal.dhcp.responder.protocol.IaNaOption;
import com.edgemetal.dhcp.responder.protocol.MessageDecodeException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.Inet6Address;
import java.time.Duration;

/**
 * DHCPv6 handler of the management plugin.
 */
public class ManagementHandler implements Dhcp6Handler {

  public static final Duration PREFERRED_LIFETIME = Duration.ofHours(24);

  public static final Duration VALID_LIFETIME = Duration.ofHours(24);

  private static final Logger logger = LoggerFactory.getLogger(ManagementHandler.class);

  @Override
  public HandlerResult<Dhcp6ClientMessage> handle(Dhcp6Message request, Dhcp6ClientMessage reply) {
    HardwareAddress mac;
    Inet6Address address;
    Dhcp6ClientMessage inner;
    try {
      Dhcp6RelayMessage relay = AddressDeriver.requireRelay(request);
      Inet6Address linkAddress = AddressDeriver.requireLinkAddress(relay);
      mac = AddressDeriver.hardwareAddress(relay);
      address = Eui64.feEui64(linkAddress, mac);
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

    IaNaOption iaNa = new IaNaOption(requested.getIaId())
        .addAddress(new IaAddressOption(address, PREFERRED_LIFETIME, VALID_LIFETIME));
    reply.addOption(iaNa);
    logger.info("Client {}: added option {}", mac, iaNa);
    return HandlerResult.next(reply);
  }

  @Override
  public String toString() {
    return ManagementPlugin.NAME;
  }
}
