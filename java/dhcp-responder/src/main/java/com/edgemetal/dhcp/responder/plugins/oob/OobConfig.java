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

package com.edgemetal.dhcp.responder.plugins.oob;

import com.edgemetal.dhcp.store.LabelSelector;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import static com.google.common.base.Preconditions.checkNotNull;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.Pattern;

/**
 * Configuration of the oob plugin.
 */
public class OobConfig {

  @NotBlank
  @JsonProperty
  private String namespace;

  @NotBlank
  @Pattern(regexp = ".*=.*", message = "should be 'key=value'")
  @JsonProperty
  private String subnetLabel;

  public String getNamespace() {
    return checkNotNull(namespace);
  }

  public String getSubnetLabel() {
    return checkNotNull(subnetLabel);
  }

  /**
   * @throws IllegalArgumentException if the label is not a valid selector
   */
  @JsonIgnore
  public LabelSelector getSubnetSelector() {
    return LabelSelector.parse(getSubnetLabel());
  }
}
