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

import com.google.common.base.Preconditions;

import java.net.InetAddress;

/**
 * An address derived from a request, together with how much it can be trusted.
 * <p>
 * An exact candidate is what the client already holds or asked for and may be requested verbatim from the
 * subnet. A non-exact candidate only tells which subnet the client is on.
 */
public class CandidateAddress {

  private final InetAddress address;
  private final boolean exact;

  private CandidateAddress(InetAddress address, boolean exact) {
    this.address = Preconditions.checkNotNull(address);
    this.exact = exact;
  }

  public static CandidateAddress exact(InetAddress address) {
    return new CandidateAddress(address, true);
  }

  public static CandidateAddress subnetHint(InetAddress address) {
    return new CandidateAddress(address, false);
  }

  public static CandidateAddress unknown() {
    return new CandidateAddress(IpHelper.UNKNOWN_IPV4, false);
  }

  public InetAddress getAddress() {
    return address;
  }

  public boolean isExact() {
    return exact;
  }

  public boolean isUnknown() {
    return IpHelper.isUnknown(address);
  }

  @Override
  public String toString() {
    return IpHelper.toAddressString(address) + (exact ? " (exact)" : "");
  }
}
