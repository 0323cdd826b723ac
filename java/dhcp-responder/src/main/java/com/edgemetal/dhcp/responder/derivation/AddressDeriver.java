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

package com.edgemetal.dhcp.responder.derivation;

import com.edgemetal.dhcp.common.IpHelper;
import com.edgemetal.dhcp.responder.protocol.ClientLinkLayerAddressOption;
import com.edgemetal.dhcp.responder.protocol.Dhcp4Message;
import com.edgemetal.dhcp.responder.protocol.Dhcp6Message;
import com.edgemetal.dhcp.responder.protocol.Dhcp6RelayMessage;
import com.edgemetal.dhcp.responder.protocol.HardwareAddress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.Inet4Address;
import java.net.Inet6Address;

/**
 * Derives the client identity and candidate addresses from inbound requests. No I/O.
 */
public class AddressDeriver {

  private static final Logger logger = LoggerFactory.getLogger(AddressDeriver.class);

  /**
   * @throws AddressDerivationException if the message was not relayed
   */
  public static Dhcp6RelayMessage requireRelay(Dhcp6Message message) throws AddressDerivationException {
    if (message == null || !message.isRelay()) {
      throw new AddressDerivationException("Received non-relay DHCPv6 request");
    }
    return (Dhcp6RelayMessage) message;
  }

  /**
   * Returns the client's hardware address. An Ethernet Client Link-Layer Address option inserted by the relay
   * wins over the address embedded in the relay's peer address.
   *
   * @throws AddressDerivationException if neither source yields a 6 byte address
   */
  public static HardwareAddress hardwareAddress(Dhcp6RelayMessage relay) throws AddressDerivationException {
    ClientLinkLayerAddressOption option = relay.getClientLinkLayerAddress();
    if (option != null && option.isEthernet()) {
      byte[] address = option.getAddress();
      if (address.length != HardwareAddress.LENGTH) {
        throw new AddressDerivationException(
            String.format("Client link-layer address has %d bytes, expected %d", address.length,
                HardwareAddress.LENGTH));
      }
      return HardwareAddress.of(address);
    }

    if (option != null) {
      logger.debug("Ignoring client link-layer address of hardware type {}", option.getHardwareType());
    }
    return Eui64.toHardwareAddress(relay.getPeerAddress());
  }

  /**
   * The relay link address with its last byte incremented by one. Relays on the switches own the first address
   * of each /127 and the client gets the second.
   */
  public static Inet6Address incrementLinkAddress(Dhcp6RelayMessage relay) throws AddressDerivationException {
    byte[] ip = requireLinkAddress(relay).getAddress();
    ip[ip.length - 1] += 1;
    return (Inet6Address) IpHelper.fromBytes(ip);
  }

  /**
   * @throws AddressDerivationException if the relay did not set a link address
   */
  public static Inet6Address requireLinkAddress(Dhcp6RelayMessage relay) throws AddressDerivationException {
    Inet6Address linkAddress = relay.getLinkAddress();
    if (IpHelper.isUnknown(linkAddress)) {
      throw new AddressDerivationException("Relay message carries no link address");
    }
    return linkAddress;
  }

  /**
   * Picks the address to look a DHCPv4 client up with, in order: the address the client holds, the address it
   * requested, the address of the answering server (subnet selection only), and finally the unknown address.
   *
   * @param request client request
   * @param reply   reply being built
   * @return candidate
   */
  public static CandidateAddress v4Candidate(Dhcp4Message request, Dhcp4Message reply) {
    Inet4Address clientAddress = request.getClientAddress();
    if (clientAddress != null) {
      logger.debug("Using client address {}", IpHelper.toAddressString(clientAddress));
      return CandidateAddress.exact(clientAddress);
    }

    Inet4Address requestedAddress = request.getRequestedAddress();
    if (requestedAddress != null) {
      logger.debug("Using requested address {}", IpHelper.toAddressString(requestedAddress));
      return CandidateAddress.exact(requestedAddress);
    }

    Inet4Address serverAddress = reply.getServerAddress();
    if (serverAddress != null) {
      logger.debug("Using server address {}", IpHelper.toAddressString(serverAddress));
      return CandidateAddress.subnetHint(serverAddress);
    }

    return CandidateAddress.unknown();
  }
}
