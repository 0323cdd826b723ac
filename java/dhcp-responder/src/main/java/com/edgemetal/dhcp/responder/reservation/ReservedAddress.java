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

package com.edgemetal.dhcp.responder.reservation;

import com.edgemetal.dhcp.common.IpHelper;

import java.net.InetAddress;

/**
 * An address held by a finished reservation.
 */
public class ReservedAddress {

  private final InetAddress address;
  private final String reservationName;
  private final String reservationUid;
  private final String subnet;

  public ReservedAddress(InetAddress address, String reservationName, String reservationUid, String subnet) {
    this.address = address;
    this.reservationName = reservationName;
    this.reservationUid = reservationUid;
    this.subnet = subnet;
  }

  public InetAddress getAddress() {
    return address;
  }

  public String getReservationName() {
    return reservationName;
  }

  public String getReservationUid() {
    return reservationUid;
  }

  public String getSubnet() {
    return subnet;
  }

  @Override
  public String toString() {
    return String.format("%s (reservation %s in subnet %s)", IpHelper.toAddressString(address), reservationName,
        subnet);
  }
}
