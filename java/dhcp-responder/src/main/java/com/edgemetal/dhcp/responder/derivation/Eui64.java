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
import com.edgemetal.dhcp.responder.protocol.HardwareAddress;

import java.net.Inet6Address;

/**
 * Conversions between hardware addresses and EUI-64 based IPv6 interface identifiers.
 */
public class Eui64 {

  private static final int UNIVERSAL_LOCAL_BIT = 0x02;

  /**
   * Recovers the hardware address embedded in a modified EUI-64 interface identifier (RFC 4291 appendix A), as
   * found in SLAAC link-local addresses.
   *
   * @param address address whose lower 64 bits are {@code xxxx:xxff:fexx:xxxx}
   * @return embedded hardware address, universal/local bit restored
   * @throws AddressDerivationException if the interface identifier is not EUI-64 shaped
   */
  public static HardwareAddress toHardwareAddress(Inet6Address address) throws AddressDerivationException {
    byte[] ip = address.getAddress();
    if ((ip[11] & 0xff) != 0xff || (ip[12] & 0xff) != 0xfe) {
      throw new AddressDerivationException(
          IpHelper.toAddressString(address) + " does not carry an EUI-64 interface identifier");
    }

    byte[] mac = new byte[]{ip[8], ip[9], ip[10], ip[13], ip[14], ip[15]};
    mac[0] ^= UNIVERSAL_LOCAL_BIT;
    return HardwareAddress.of(mac);
  }

  /**
   * Builds the address a client self-assigns on the management network: the upper 64 bits of {@code prefix}
   * followed by the three high MAC octets, {@code fe:fe}, and the three low MAC octets.
   * <p>
   * Unlike modified EUI-64 the universal/local bit is left untouched and the filler is {@code fe:fe}, not
   * {@code ff:fe}. Devices rely on this exact layout.
   *
   * @param prefix address providing the upper 64 bits
   * @param mac    hardware address of the client
   * @return synthesized address
   */
  public static Inet6Address feEui64(Inet6Address prefix, HardwareAddress mac) {
    byte[] ip = prefix.getAddress();
    byte[] hw = mac.getBytes();

    ip[8] = hw[0];
    ip[9] = hw[1];
    ip[10] = hw[2];
    ip[11] = (byte) 0xfe;
    ip[12] = (byte) 0xfe;
    ip[13] = hw[3];
    ip[14] = hw[4];
    ip[15] = hw[5];
    return (Inet6Address) IpHelper.fromBytes(ip);
  }
}
