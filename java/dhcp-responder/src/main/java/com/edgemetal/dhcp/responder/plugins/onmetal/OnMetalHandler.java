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

package com.edgemetal.dhcp.responder.plugins.onmetal;

import com.edgemetal.dhcp.common.IpHelper;
import com.edgemetal.dhcp.responder.derivation.AddressDerivationException;
import com.edgemetal.dhcp.responder.derivation.AddressDeriver;
import com.edgemetal.dhcp.responder.derivation.PrefixDelegation;
import com.edgemetal.dhcp.responder.handler.Dhcp6Handler;
import com.edgemetal.dhcp.responder.handler.HandlerResult;
import com.edgemetal.dhcp.responder.protocol.Dhcp6ClientMessage;
import com.edgemetal.dhcp.responder.protocol.Dhcp6Message;
import com.edgemetal.dhcp.responder.protocol.Dhcp6RelayMessage;
import com.edgemetal.dhcp.responder.protocol.IaAddressOption;
import com.edgemetal.dhcp.responder.protocol.IaNaOption;
import com.edgemetal.dhcp.responder.protocol.IaPdOption;
import com.edgemetal.dhcp.responder.protocol.IaPrefixOption;
import com.edgemetal.dhcp.responder.protocol.MessageDecodeException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.Inet6Address;
import java.time.Duration;

/**
 * DHCPv6 handler of the onmetal plugin. Leases are short so that a re-cabled machine picks up its new address
 * quickly.
 */
public class OnMetalHandler implements Dhcp6Handler {

  public static final Duration PREFERRED_LIFETIME = Duration.ofSeconds(30);

  public static final Duration VALID_LIFETIME = Duration.ofSeconds(30);

  private static final Logger logger = LoggerFactory.getLogger(OnMetalHandler.class);

  private final PrefixDelegation prefixDelegation;

  public OnMetalHandler(PrefixDelegation prefixDelegation) {
    this.prefixDelegation = prefixDelegation;
  }

  @Override
  public HandlerResult<Dhcp6ClientMessage> handle(Dhcp6Message request, Dhcp6ClientMessage reply) {
    Inet6Address address;
    Dhcp6ClientMessage inner;
    try {
      Dhcp6RelayMessage relay = AddressDeriver.requireRelay(request);
      address = AddressDeriver.incrementLinkAddress(relay);
      inner = relay.getInnerMessage();
    } catch (AddressDerivationException | MessageDecodeException e) {
      logger.info("Dropping request: {}", e.getMessage());
      return HandlerResult.drop(e.getMessage());
    }
    logger.info("Generated address {}", IpHelper.toAddressString(address));

    IaNaOption requestedNa = inner.getIaNa();
    if (requestedNa == null) {
      logger.debug("No address requested");
    } else {
      IaNaOption iaNa = new IaNaOption(requestedNa.getIaId())
          .addAddress(new IaAddressOption(address, PREFERRED_LIFETIME, VALID_LIFETIME));
      reply.addOption(iaNa);
      logger.info("Added option {}", iaNa);
    }

    IaPdOption requestedPd = inner.getIaPd();
    if (requestedPd != null) {
      int length = prefixDelegation.lengthFor(requestedPd);
      IaPdOption iaPd = new IaPdOption(requestedPd.getIaId())
          .addPrefix(new IaPrefixOption(prefixDelegation.delegate(address, length), length, PREFERRED_LIFETIME,
              VALID_LIFETIME));
      reply.addOption(iaPd);
      logger.info("Added option {}", iaPd);
    }

    return HandlerResult.next(reply);
  }

  @Override
  public String toString() {
    return OnMetalPlugin.NAME;
  }
}
