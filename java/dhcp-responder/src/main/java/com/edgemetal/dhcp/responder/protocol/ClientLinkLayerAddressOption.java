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

import com.google.common.base.Preconditions;

import java.util.Arrays;

/**
 * Client Link-Layer Address option, RFC 6939. Inserted by the first relay agent into its Relay-Forward message.
 */
public class ClientLinkLayerAddressOption implements Dhcp6Option {

  public static final int HARDWARE_TYPE_ETHERNET = 1;

  private final int hardwareType;
  private final byte[] address;

  public ClientLinkLayerAddressOption(int hardwareType, byte[] address) {
    this.hardwareType = hardwareType;
    this.address = Arrays.copyOf(Preconditions.checkNotNull(address), address.length);
  }

  @Override
  public int getCode() {
    return OPTION_CLIENT_LINKLAYER_ADDR;
  }

  public int getHardwareType() {
    return hardwareType;
  }

  public byte[] getAddress() {
    return Arrays.copyOf(address, address.length);
  }

  public boolean isEthernet() {
    return hardwareType == HARDWARE_TYPE_ETHERNET;
  }
}
