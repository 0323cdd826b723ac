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

import javax.validation.constraints.NotBlank;

import java.util.List;

/**
 * One entry of a plugin chain: the plugin name and its arguments.
 */
public class PluginConfig {

  @NotBlank
  @JsonProperty
  private String name;

  @JsonProperty
  private List<String> args;

  public PluginConfig() {
  }

  public PluginConfig(String name, List<String> args) {
    this.name = name;
    this.args = args;
  }

  public String getName() {
    return name;
  }

  public ImmutableList<String> getArgs() {
    return args == null ? ImmutableList.<String>of() : ImmutableList.copyOf(args);
  }

  @Override
  public String toString() {
    return name + " " + getArgs();
  }
}
