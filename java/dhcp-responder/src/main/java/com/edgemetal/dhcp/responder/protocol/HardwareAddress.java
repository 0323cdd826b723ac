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
import com.google.common.io.BaseEncoding;

import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * A 6 byte Ethernet hardware address.
 */
public final class HardwareAddress {

  public static final int LENGTH = 6;

  private static final Pattern SEPARATORS = Pattern.compile("[:-]");

  private static final BaseEncoding HEX = BaseEncoding.base16().lowerCase();

  private final byte[] bytes;

  private HardwareAddress(byte[] bytes) {
    this.bytes = bytes;
  }

  /**
   * @throws IllegalArgumentException if the address is not 6 bytes long
   */
  public static HardwareAddress of(byte[] bytes) {
    Preconditions.checkArgument(bytes != null && bytes.length == LENGTH,
        "hardware address must be %s bytes, got %s", LENGTH, bytes == null ? null : bytes.length);
    return new HardwareAddress(Arrays.copyOf(bytes, LENGTH));
  }

  /**
   * Parses {@code aa:bb:cc:dd:ee:ff}, {@code AA-BB-CC-DD-EE-FF} or {@code aabbccddeeff}.
   *
   * @throws IllegalArgumentException if the string is not a 6 byte hardware address
   */
  public static HardwareAddress parse(String mac) {
    Preconditions.checkArgument(mac != null, "hardware address is null");
    String hex = normalize(mac);
    Preconditions.checkArgument(hex.length() == LENGTH * 2 && HEX.canDecode(hex), "Invalid hardware address %s", mac);
    return new HardwareAddress(HEX.decode(hex));
  }

  /**
   * Strips separators and lower-cases a MAC address or MAC prefix.
   */
  public static String normalize(String mac) {
    return SEPARATORS.matcher(mac.trim()).replaceAll("").toLowerCase(Locale.ROOT);
  }

  public byte[] getBytes() {
    return Arrays.copyOf(bytes, LENGTH);
  }

  /**
   * Returns the address without separators, as used in label values and resource names.
   */
  public String sanitized() {
    return HEX.encode(bytes);
  }

  /**
   * Checks the address against a prefix written in any of the forms accepted by {@link #parse(String)}.
   */
  public boolean hasPrefix(String prefix) {
    String normalized = normalize(prefix);
    return !normalized.isEmpty() && sanitized().startsWith(normalized);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return Arrays.equals(bytes, ((HardwareAddress) o).bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder(17);
    for (int i = 0; i < LENGTH; i++) {
      if (i > 0) {
        builder.append(':');
      }
      builder.append(String.format("%02x", bytes[i] & 0xff));
    }
    return builder.toString();
  }
}
