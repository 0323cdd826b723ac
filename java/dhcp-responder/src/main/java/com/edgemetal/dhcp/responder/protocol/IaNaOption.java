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
import com.google.common.collect.ImmutableList;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Identity Association for Non-temporary Addresses option, RFC 8415 section 21.4.
 */
public class IaNaOption implements Dhcp6Option {

  private final int iaId;
  private final Duration t1;
  private final Duration t2;
  private final List<IaAddressOption> addresses = new ArrayList<>();

  public IaNaOption(int iaId) {
    this(iaId, Duration.ZERO, Duration.ZERO);
  }

  public IaNaOption(int iaId, Duration t1, Duration t2) {
    this.iaId = iaId;
    this.t1 = Preconditions.checkNotNull(t1);
    this.t2 = Preconditions.checkNotNull(t2);
  }

  @Override
  public int getCode() {
    return OPTION_IA_NA;
  }

  public int getIaId() {
    return iaId;
  }

  public Duration getT1() {
    return t1;
  }

  public Duration getT2() {
    return t2;
  }

  public List<IaAddressOption> getAddresses() {
    return ImmutableList.copyOf(addresses);
  }

  public IaNaOption addAddress(IaAddressOption option) {
    addresses.add(Preconditions.checkNotNull(option));
    return this;
  }

  @Override
  public String toString() {
    return String.format("IANA{iaId=0x%08x, addresses=%s}", iaId, addresses);
  }
}
