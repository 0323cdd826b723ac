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

package com.edgemetal.dhcp.responder.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import javax.validation.Valid;
import javax.validation.constraints.NotEmpty;

import java.util.List;

/**
 * The ordered plugin chain of one address family.
 */
public class ServerConfig {

  @Valid
  @NotEmpty
  @JsonProperty
  private List<PluginConfig> plugins;

  public ServerConfig() {
  }

  public ServerConfig(List<PluginConfig> plugins) {
    this.plugins = plugins;
  }

  public ImmutableList<PluginConfig> getPlugins() {
    return plugins == null ? ImmutableList.<PluginConfig>of() : ImmutableList.copyOf(plugins);
  }
}
