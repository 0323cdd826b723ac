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
import java.time.Duration;

/**
 * IA Address option, RFC 8415 section 21.6.
 */
public class IaAddressOption implements Dhcp6Option {

  private final Inet6Address address;
  private final Duration preferredLifetime;
  private final Duration validLifetime;

  public IaAddressOption(Inet6Address address, Duration preferredLifetime, Duration validLifetime) {
    this.address = Preconditions.checkNotNull(address);
    this.preferredLifetime = Preconditions.checkNotNull(preferredLifetime);
    this.validLifetime = Preconditions.checkNotNull(validLifetime);
  }

  @Override
  public int getCode() {
    return OPTION_IAADDR;
  }

  public Inet6Address getAddress() {
    return address;
  }

  public Duration getPreferredLifetime() {
    return preferredLifetime;
  }

  public Duration getValidLifetime() {
    return validLifetime;
  }

  @Override
  public String toString() {
    return String.format("IAAddress{address=%s, preferred=%ds, valid=%ds}", IpHelper.toAddressString(address),
        preferredLifetime.getSeconds(), validLifetime.getSeconds());
  }
}
