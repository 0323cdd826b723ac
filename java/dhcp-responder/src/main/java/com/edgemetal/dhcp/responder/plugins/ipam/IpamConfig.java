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

package com.edgemetal.dhcp.responder.plugins.ipam;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import static com.google.common.base.Preconditions.checkNotNull;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotEmpty;

import java.util.List;

/**
 * Configuration of the ipam plugin.
 */
public class IpamConfig {

  @NotBlank
  @JsonProperty
  private String namespace;

  @NotEmpty
  @JsonProperty
  private List<String> subnets;

  public String getNamespace() {
    return checkNotNull(namespace);
  }

  /**
   * Subnet names, in order of preference.
   */
  public ImmutableList<String> getSubnets() {
    return ImmutableList.copyOf(checkNotNull(subnets));
  }
}
