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

package com.edgemetal.dhcp.responder.plugins.metal;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import javax.validation.Valid;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration of the metal plugin: the machine inventory and how endpoints are named.
 */
public class MetalConfig {

  @JsonProperty
  private String namePrefix;

  @JsonProperty
  private String namespace;

  @Valid
  @NotNull
  @JsonProperty
  private List<Host> hosts = new ArrayList<>();

  @Valid
  @NotNull
  @JsonProperty
  private Filter filter = new Filter();

  /**
   * Prefix of generated endpoint names, may be null.
   */
  public String getNamePrefix() {
    return namePrefix;
  }

  /**
   * Namespace of the reservations to look addresses up in, null for all namespaces.
   */
  public String getNamespace() {
    return namespace;
  }

  public ImmutableList<Host> getHosts() {
    return ImmutableList.copyOf(hosts);
  }

  public Filter getFilter() {
    return filter;
  }

  /**
   * One inventory entry.
   */
  public static class Host {

    @NotBlank
    @JsonProperty
    private String name;

    @NotBlank
    @JsonProperty
    private String macAddress;

    public String getName() {
      return name;
    }

    public String getMacAddress() {
      return macAddress;
    }
  }

  /**
   * MAC prefixes of the machines endpoints are published for when there is no static inventory.
   */
  public static class Filter {

    @NotNull
    @JsonProperty
    private List<@NotBlank String> macPrefix = new ArrayList<>();

    public ImmutableList<String> getMacPrefix() {
      return ImmutableList.copyOf(macPrefix);
    }
  }
}
