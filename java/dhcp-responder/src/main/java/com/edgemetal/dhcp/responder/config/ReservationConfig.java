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

import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;

import java.time.Duration;

/**
 * Bounded waits of the reservation manager.
 */
public class ReservationConfig {

  /**
   * How reservation state changes are observed.
   */
  public enum AwaitMode {
    /**
     * Re-read the reservation at a fixed interval.
     */
    POLL,
    /**
     * Subscribe to change events of the reservation.
     */
    WATCH
  }

  @NotNull
  @JsonProperty
  private AwaitMode awaitMode = AwaitMode.POLL;

  @Min(10)
  @JsonProperty
  private long pollIntervalMillis = 500;

  @Min(1)
  @JsonProperty
  private long creationTimeoutSeconds = 10;

  @Min(1)
  @JsonProperty
  private long deletionTimeoutSeconds = 5;

  public AwaitMode getAwaitMode() {
    return awaitMode;
  }

  public Duration getPollInterval() {
    return Duration.ofMillis(pollIntervalMillis);
  }

  public Duration getCreationTimeout() {
    return Duration.ofSeconds(creationTimeoutSeconds);
  }

  public Duration getDeletionTimeout() {
    return Duration.ofSeconds(deletionTimeoutSeconds);
  }
}
