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
 * IA Prefix option, RFC 8415 section 21.22. In a request the prefix may be unspecified and only carry a length
 * hint.
 */
public class IaPrefixOption implements Dhcp6Option {

  private final Inet6Address prefix;
  private final int prefixLength;
  private final Duration preferredLifetime;
  private final Duration validLifetime;

  public IaPrefixOption(Inet6Address prefix, int prefixLength, Duration preferredLifetime, Duration validLifetime) {
    Preconditions.checkArgument(prefixLength >= 0 && prefixLength <= 128, "Invalid prefix length %s", prefixLength);
    this.prefix = prefix;
    this.prefixLength = prefixLength;
    this.preferredLifetime = Preconditions.checkNotNull(preferredLifetime);
    this.validLifetime = Preconditions.checkNotNull(validLifetime);
  }

  @Override
  public int getCode() {
    return OPTION_IAPREFIX;
  }

  public Inet6Address getPrefix() {
    return prefix;
  }

  public int getPrefixLength() {
    return prefixLength;
  }

  public Duration getPreferredLifetime() {
    return preferredLifetime;
  }

  public Duration getValidLifetime() {
    return validLifetime;
  }

  @Override
  public String toString() {
    return String.format("IAPrefix{prefix=%s/%d, preferred=%ds, valid=%ds}",
        prefix == null ? "::" : IpHelper.toAddressString(prefix), prefixLength,
        preferredLifetime.getSeconds(), validLifetime.getSeconds());
  }
}
