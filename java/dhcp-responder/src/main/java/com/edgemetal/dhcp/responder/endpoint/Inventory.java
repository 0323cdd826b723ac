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

package com.edgemetal.dhcp.responder.endpoint;

import com.edgemetal.dhcp.responder.protocol.HardwareAddress;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;

/**
 * The machines this responder publishes endpoints for. Immutable.
 */
public class Inventory {

  public static final String DEFAULT_NAME_PREFIX = "compute-";

  private final ImmutableMap<HardwareAddress, String> hosts;
  private final ImmutableList<String> macPrefixes;
  private final String namePrefix;

  public Inventory(Map<HardwareAddress, String> hosts, List<String> macPrefixes, String namePrefix) {
    this.hosts = ImmutableMap.copyOf(hosts);
    ImmutableList.Builder<String> prefixes = ImmutableList.builder();
    for (String prefix : macPrefixes) {
      String normalized = HardwareAddress.normalize(prefix);
      Preconditions.checkArgument(!normalized.isEmpty(), "empty MAC prefix");
      prefixes.add(normalized);
    }
    this.macPrefixes = prefixes.build();
    this.namePrefix = namePrefix == null || namePrefix.isEmpty() ? DEFAULT_NAME_PREFIX : namePrefix;
  }

  public ImmutableMap<HardwareAddress, String> getHosts() {
    return hosts;
  }

  public ImmutableList<String> getMacPrefixes() {
    return macPrefixes;
  }

  public String getNamePrefix() {
    return namePrefix;
  }

  /**
   * Inventory name of the machine, or null.
   */
  public String nameFor(HardwareAddress hardwareAddress) {
    return hosts.get(hardwareAddress);
  }

  /**
   * Whether endpoints are published for the machine. Hosts take precedence over MAC prefixes.
   */
  public boolean isKnown(HardwareAddress hardwareAddress) {
    return hosts.isEmpty() ? matchesPrefix(hardwareAddress) : hosts.containsKey(hardwareAddress);
  }

  public boolean matchesPrefix(HardwareAddress hardwareAddress) {
    for (String prefix : macPrefixes) {
      if (hardwareAddress.hasPrefix(prefix)) {
        return true;
      }
    }
    return false;
  }
}
