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

import com.edgemetal.dhcp.common.logging.LoggingConfiguration;

import com.fasterxml.jackson.annotation.JsonProperty;
import static com.google.common.base.Preconditions.checkNotNull;

import javax.validation.Valid;
import javax.validation.constraints.AssertTrue;
import javax.validation.constraints.NotNull;

/**
 * This class implements configuration state for the DHCP responder service.
 */
public class ResponderConfig {

  @Valid
  @NotNull
  @JsonProperty
  private LoggingConfiguration logging = new LoggingConfiguration();

  @Valid
  @NotNull
  @JsonProperty
  private ReservationConfig reservation = new ReservationConfig();

  @Valid
  @JsonProperty
  private ServerConfig server4;

  @Valid
  @JsonProperty
  private ServerConfig server6;

  @AssertTrue(message = "at least one of server4 and server6 must be configured")
  public boolean isAnyServerConfigured() {
    return server4 != null || server6 != null;
  }

  public LoggingConfiguration getLogging() {
    return checkNotNull(logging);
  }

  public ReservationConfig getReservation() {
    return checkNotNull(reservation);
  }

  /**
   * DHCPv4 plugin chain, or null when DHCPv4 is not served.
   */
  public ServerConfig getServer4() {
    return server4;
  }

  /**
   * DHCPv6 plugin chain, or null when DHCPv6 is not served.
   */
  public ServerConfig getServer6() {
    return server6;
  }
}
