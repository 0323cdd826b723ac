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

package com.edgemetal.dhcp.responder.protocol;

import com.edgemetal.dhcp.common.IpHelper;

import com.google.common.base.Preconditions;

import java.net.Inet6Address;

/**
 * A Relay-Forward or Relay-Reply message, RFC 8415 section 9.
 */
public class Dhcp6RelayMessage extends Dhcp6Message {

  private final int hopCount;
  private final Inet6Address linkAddress;
  private final Inet6Address peerAddress;
  private final Dhcp6Message relayedMessage;

  /**
   * @param relayedMessage content of the Relay Message option, null when it was missing or could not be decoded
   */
  public Dhcp6RelayMessage(MessageType messageType, int hopCount, Inet6Address linkAddress, Inet6Address peerAddress,
                           Dhcp6Message relayedMessage) {
    super(messageType);
    Preconditions.checkArgument(messageType.isRelay(), "%s is not a relay message type", messageType);
    this.hopCount = hopCount;
    this.linkAddress = Preconditions.checkNotNull(linkAddress);
    this.peerAddress = Preconditions.checkNotNull(peerAddress);
    this.relayedMessage = relayedMessage;
  }

  public static Dhcp6RelayMessage forward(Inet6Address linkAddress, Inet6Address peerAddress,
                                          Dhcp6Message relayedMessage) {
    int hopCount = relayedMessage instanceof Dhcp6RelayMessage
        ? ((Dhcp6RelayMessage) relayedMessage).getHopCount() + 1
        : 0;
    return new Dhcp6RelayMessage(MessageType.RELAY_FORW, hopCount, linkAddress, peerAddress, relayedMessage);
  }

  public int getHopCount() {
    return hopCount;
  }

  /**
   * Address identifying the link the client is on, set by the relay agent.
   */
  public Inet6Address getLinkAddress() {
    return linkAddress;
  }

  /**
   * Address of the client or relay the message was received from.
   */
  public Inet6Address getPeerAddress() {
    return peerAddress;
  }

  public Dhcp6Message getRelayedMessage() {
    return relayedMessage;
  }

  /**
   * Unwraps nested relay messages down to the client message.
   *
   * @throws MessageDecodeException if some relay level carries no decodable message
   */
  public Dhcp6ClientMessage getInnerMessage() throws MessageDecodeException {
    Dhcp6Message current = this;
    while (current instanceof Dhcp6RelayMessage) {
      Dhcp6Message next = ((Dhcp6RelayMessage) current).relayedMessage;
      if (next == null) {
        throw new MessageDecodeException("relay message at hop " + ((Dhcp6RelayMessage) current).hopCount
            + " carries no decodable inner message");
      }
      current = next;
    }
    return (Dhcp6ClientMessage) current;
  }

  public ClientLinkLayerAddressOption getClientLinkLayerAddress() {
    return getOption(ClientLinkLayerAddressOption.class);
  }

  @Override
  public String summary() {
    return String.format("DHCPv6 %s hops=%d link=%s peer=%s", getMessageType(), hopCount,
        IpHelper.toAddressString(linkAddress), IpHelper.toAddressString(peerAddress));
  }
}
