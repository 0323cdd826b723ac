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
import com.edgemetal.dhcp.common.config.BadConfigException;
import com.edgemetal.dhcp.responder.protocol.IaPdOption;
import com.edgemetal.dhcp.responder.protocol.IaPrefixOption;

import java.net.Inet6Address;

/**
 * Computes delegated prefixes from derived client addresses.
 */
public class PrefixDelegation {

  public static final int MIN_LENGTH = 1;

  public static final int MAX_LENGTH = 127;

  private final int defaultLength;

  private PrefixDelegation(int defaultLength) {
    this.defaultLength = defaultLength;
  }

  /**
   * @param defaultLength length used when the client gives no usable hint
   * @throws BadConfigException if the length is outside [1, 127]
   */
  public static PrefixDelegation withDefaultLength(int defaultLength) throws BadConfigException {
    if (!isValidLength(defaultLength)) {
      throw new BadConfigException(String.format("Prefix delegation length %d is outside [%d, %d]", defaultLength,
          MIN_LENGTH, MAX_LENGTH));
    }
    return new PrefixDelegation(defaultLength);
  }

  public static boolean isValidLength(int length) {
    return length >= MIN_LENGTH && length <= MAX_LENGTH;
  }

  public int getDefaultLength() {
    return defaultLength;
  }

  /**
   * The prefix length hinted in the client's IA_PD, when valid, else the default.
   */
  public int lengthFor(IaPdOption requested) {
    if (requested != null) {
      for (IaPrefixOption hint : requested.getPrefixes()) {
        if (isValidLength(hint.getPrefixLength())) {
          return hint.getPrefixLength();
        }
      }
    }
    return defaultLength;
  }

  /**
   * Masks the address to {@code length} bits.
   */
  public Inet6Address delegate(Inet6Address address, int length) {
    return (Inet6Address) IpHelper.mask(address, length);
  }
}
