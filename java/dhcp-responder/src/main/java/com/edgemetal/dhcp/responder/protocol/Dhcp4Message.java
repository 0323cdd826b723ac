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

import java.net.Inet4Address;
import java.util.Arrays;
import java.util.Map;
import java.util.TreeMap;

/**
 * A decoded DHCPv4 message. Replies are built by the protocol layer and augmented in place by handlers.
 */
public class Dhcp4Message {

  public static final int OPTION_REQUESTED_IP_ADDRESS = 50;

  public static final int OPTION_MESSAGE_TYPE = 53;

  /**
   * DHCPv4 message types, option 53.
   */
  public enum MessageType {
    DISCOVER(1),
    OFFER(2),
    REQUEST(3),
    DECLINE(4),
    ACK(5),
    NAK(6),
    RELEASE(7),
    INFORM(8);

    private final int code;

    MessageType(int code) {
      this.code = code;
    }

    public int getCode() {
      return code;
    }

    public static MessageType fromCode(int code) {
      for (MessageType type : values()) {
        if (type.code == code) {
          return type;
        }
      }
      return null;
    }
  }

  private int transactionId;
  private HardwareAddress clientHardwareAddress;
  private Inet4Address clientAddress;
  private Inet4Address yourAddress;
  private Inet4Address serverAddress;
  private Inet4Address gatewayAddress;
  private final Map<Integer, byte[]> options = new TreeMap<>();

  public int getTransactionId() {
    return transactionId;
  }

  public void setTransactionId(int transactionId) {
    this.transactionId = transactionId;
  }

  /**
   * chaddr.
   */
  public HardwareAddress getClientHardwareAddress() {
    return clientHardwareAddress;
  }

  public void setClientHardwareAddress(HardwareAddress clientHardwareAddress) {
    this.clientHardwareAddress = clientHardwareAddress;
  }

  /**
   * ciaddr, or null when the client has no address yet.
   */
  public Inet4Address getClientAddress() {
    return nonZero(clientAddress);
  }

  public void setClientAddress(Inet4Address clientAddress) {
    this.clientAddress = clientAddress;
  }

  /**
   * yiaddr, the address offered to the client.
   */
  public Inet4Address getYourAddress() {
    return nonZero(yourAddress);
  }

  public void setYourAddress(Inet4Address yourAddress) {
    this.yourAddress = yourAddress;
  }

  /**
   * siaddr.
   */
  public Inet4Address getServerAddress() {
    return nonZero(serverAddress);
  }

  public void setServerAddress(Inet4Address serverAddress) {
    this.serverAddress = serverAddress;
  }

  /**
   * giaddr, set when the message went through a relay agent.
   */
  public Inet4Address getGatewayAddress() {
    return nonZero(gatewayAddress);
  }

  public void setGatewayAddress(Inet4Address gatewayAddress) {
    this.gatewayAddress = gatewayAddress;
  }

  public MessageType getMessageType() {
    byte[] value = options.get(OPTION_MESSAGE_TYPE);
    return value == null || value.length != 1 ? null : MessageType.fromCode(value[0] & 0xff);
  }

  public void setMessageType(MessageType messageType) {
    setOption(OPTION_MESSAGE_TYPE, new byte[]{(byte) messageType.getCode()});
  }

  /**
   * Value of the Requested IP Address option, or null when absent or malformed.
   */
  public Inet4Address getRequestedAddress() {
    byte[] value = options.get(OPTION_REQUESTED_IP_ADDRESS);
    if (value == null || value.length != IpHelper.IPV4_LENGTH) {
      return null;
    }
    return nonZero((Inet4Address) IpHelper.fromBytes(value));
  }

  public void setRequestedAddress(Inet4Address requestedAddress) {
    setOption(OPTION_REQUESTED_IP_ADDRESS, requestedAddress.getAddress());
  }

  public boolean hasOption(int code) {
    return options.containsKey(code);
  }

  public byte[] getOption(int code) {
    byte[] value = options.get(code);
    return value == null ? null : Arrays.copyOf(value, value.length);
  }

  public void setOption(int code, byte[] value) {
    options.put(code, Arrays.copyOf(value, value.length));
  }

  public String summary() {
    return String.format("DHCPv4 %s xid=0x%08x chaddr=%s ciaddr=%s yiaddr=%s siaddr=%s", getMessageType(),
        transactionId, clientHardwareAddress, format(getClientAddress()), format(getYourAddress()),
        format(getServerAddress()));
  }

  @Override
  public String toString() {
    return summary();
  }

  private static Inet4Address nonZero(Inet4Address address) {
    return IpHelper.isUnknown(address) ? null : address;
  }

  private static String format(Inet4Address address) {
    return address == null ? "-" : IpHelper.toAddressString(address);
  }
}
