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

package com.edgemetal.dhcp.responder.plugins.onmetal;

import com.edgemetal.dhcp.responder.derivation.PrefixDelegation;

import com.fasterxml.jackson.annotation.JsonProperty;
import static com.google.common.base.Preconditions.checkNotNull;

import javax.validation.Valid;
import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;

/**
 * Configuration of the onmetal plugin.
 */
public class OnMetalConfig {

  @Valid
  @NotNull
  @JsonProperty
  private PrefixDelegationConfig prefixDelegation;

  public PrefixDelegationConfig getPrefixDelegation() {
    return checkNotNull(prefixDelegation);
  }

  /**
   * Delegated prefix length used when the client does not ask for a valid one.
   */
  public static class PrefixDelegationConfig {

    @Min(PrefixDelegation.MIN_LENGTH)
    @Max(PrefixDelegation.MAX_LENGTH)
    @JsonProperty
    private int length;

    public int getLength() {
      return length;
    }
  }
}
