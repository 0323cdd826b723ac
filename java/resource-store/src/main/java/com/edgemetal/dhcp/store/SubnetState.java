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

package com.edgemetal.dhcp.store;

/**
 * An address range that reservations are carved from. Read-only for the responder.
 */
public class SubnetState extends ResourceDocument {

  /**
   * Address family of a subnet.
   */
  public enum AddressType {
    IPv4,
    IPv6
  }

  public AddressType addressType;

  /**
   * The block reservations of this subnet are taken from, in CIDR notation.
   */
  public String reserved;

  public void copyTo(SubnetState target) {
    super.copyTo(target);
    target.addressType = this.addressType;
    target.reserved = this.reserved;
  }
}
