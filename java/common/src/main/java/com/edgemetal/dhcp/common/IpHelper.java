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

package com.edgemetal.dhcp.common;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.net.InetAddresses;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Utility methods for dealing with IPv4 and IPv6 addresses.
 */
public class IpHelper {

  public static final int IPV4_LENGTH = 4;

  public static final int IPV6_LENGTH = 16;

  /**
   * The address used when nothing better is known about a client, {@code 0.0.0.0}.
   */
  public static final Inet4Address UNKNOWN_IPV4 = (Inet4Address) InetAddresses.forString("0.0.0.0");

  /**
   * Convert an Inet4Address to host byte order long.
   *
   * @param ip IPv4 address
   * @return host byte order equivalent
   */
  public static long ipToLong(Inet4Address ip) {
    byte[] octets = ip.getAddress();
    long result = 0;

    for (byte octet : octets) {
      result <<= 8;
      result |= octet & 0xff;
    }
    return result;
  }

  /**
   * Convert an host byte order long to an IPv4 address.
   *
   * @param ip long value storing ipv4 bytes in host byte order
   * @return InetAddress
   */
  public static Inet4Address longToIp(long ip) {
    byte[] octets = new byte[]{(byte) (ip >>> 24), (byte) (ip >>> 16), (byte) (ip >>> 8), (byte) ip};
    return (Inet4Address) fromBytes(octets);
  }

  /**
   * Parses an address literal. Host names are never resolved.
   *
   * @param ip address literal
   * @return parsed address
   * @throws IllegalArgumentException if the literal is not an IPv4 or IPv6 address
   */
  public static InetAddress parse(String ip) {
    Preconditions.checkArgument(ip != null && !ip.isEmpty(), "ip address is empty");
    return InetAddresses.forString(ip);
  }

  /**
   * Builds an address from raw bytes. Sixteen byte arrays always produce an {@link Inet6Address}, including
   * IPv4-mapped ones.
   *
   * @param bytes 4 or 16 bytes in network byte order
   * @return address
   */
  public static InetAddress fromBytes(byte[] bytes) {
    Preconditions.checkArgument(bytes != null, "address bytes are null");
    try {
      switch (bytes.length) {
        case IPV4_LENGTH:
          return InetAddress.getByAddress(bytes);
        case IPV6_LENGTH:
          return Inet6Address.getByAddress(null, bytes, -1);
        default:
          throw new IllegalArgumentException("Invalid address length " + bytes.length);
      }
    } catch (UnknownHostException e) {
      throw new IllegalArgumentException("Invalid address " + Arrays.toString(bytes), e);
    }
  }

  /**
   * Canonical text form, RFC 5952 compressed for IPv6.
   */
  public static String toAddressString(InetAddress ip) {
    return InetAddresses.toAddrString(ip);
  }

  public static boolean isIpv4(InetAddress ip) {
    return ip instanceof Inet4Address;
  }

  public static boolean isIpv6(InetAddress ip) {
    return ip instanceof Inet6Address;
  }

  public static boolean isUnknown(InetAddress ip) {
    return ip == null || ip.isAnyLocalAddress();
  }

  /**
   * Zeroes every bit of the address past the first {@code prefixLength} bits.
   *
   * @param ip           address
   * @param prefixLength number of leading bits to keep
   * @return masked address of the same family
   */
  public static InetAddress mask(InetAddress ip, int prefixLength) {
    byte[] bytes = ip.getAddress();
    int bits = bytes.length * 8;
    Preconditions.checkArgument(prefixLength >= 0 && prefixLength <= bits,
        String.format("prefix length %d is out of range for %s", prefixLength, toAddressString(ip)));

    for (int i = 0; i < bytes.length; i++) {
      int keep = prefixLength - i * 8;
      if (keep <= 0) {
        bytes[i] = 0;
      } else if (keep < 8) {
        bytes[i] = (byte) (bytes[i] & (0xff << (8 - keep)));
      }
    }
    return fromBytes(bytes);
  }

  /**
   * Checks whether an address falls inside a CIDR block, e.g. {@code 10.0.0.0/24} or {@code 2001:db8::/64}.
   * Addresses of the other family are never contained.
   *
   * @param ip   address
   * @param cidr block in address/length notation
   * @return true if contained
   * @throws IllegalArgumentException if the block is malformed
   */
  public static boolean isInCidr(InetAddress ip, String cidr) {
    Preconditions.checkArgument(cidr != null, "cidr is null");
    int slash = cidr.indexOf('/');
    Preconditions.checkArgument(slash > 0 && slash < cidr.length() - 1, "Invalid CIDR " + cidr);

    InetAddress network = parse(cidr.substring(0, slash));
    int prefixLength;
    try {
      prefixLength = Integer.parseInt(cidr.substring(slash + 1));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid CIDR prefix length " + cidr, e);
    }

    if (network.getAddress().length != ip.getAddress().length) {
      return false;
    }
    return Arrays.equals(mask(network, prefixLength).getAddress(), mask(ip, prefixLength).getAddress());
  }

  /**
   * Checks whether a string is a valid CIDR block.
   */
  public static boolean isCidr(String cidr) {
    try {
      InetAddress network = parse(cidr.substring(0, cidr.indexOf('/')));
      return isInCidr(network, cidr);
    } catch (RuntimeException e) {
      return false;
    }
  }

  /**
   * Fully expanded IPv6 form with dashes instead of colons, e.g.
   * {@code 2001-0db8-0000-0000-0000-0000-0000-0001}. The result is safe to use in resource names and label values.
   *
   * @param ip IPv6 address
   * @return long dashed form
   */
  public static String toLongForm(Inet6Address ip) {
    byte[] bytes = ip.getAddress();
    List<String> groups = new ArrayList<>(8);
    for (int i = 0; i < bytes.length; i += 2) {
      groups.add(String.format("%02x%02x", bytes[i] & 0xff, bytes[i + 1] & 0xff));
    }
    return Joiner.on('-').join(groups);
  }
}
