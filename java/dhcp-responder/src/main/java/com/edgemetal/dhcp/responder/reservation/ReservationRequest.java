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

package com.edgemetal.dhcp.responder.reservation;

import com.edgemetal.dhcp.responder.derivation.CandidateAddress;
import com.edgemetal.dhcp.responder.protocol.HardwareAddress;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

import java.net.InetAddress;

/**
 * What {@link ReservationManager#reserve(ReservationRequest)} is asked for: an address for one client out of one
 * subnet.
 */
public class ReservationRequest {

  private final String namespace;
  private final HardwareAddress hardwareAddress;
  private final String subnet;
  private final InetAddress exactAddress;
  private final String origin;
  private final ImmutableMap<String, String> extraLabels;

  private ReservationRequest(Builder builder) {
    this.namespace = Preconditions.checkNotNull(builder.namespace, "namespace");
    this.hardwareAddress = Preconditions.checkNotNull(builder.hardwareAddress, "hardwareAddress");
    this.subnet = Preconditions.checkNotNull(builder.subnet, "subnet");
    this.origin = Preconditions.checkNotNull(builder.origin, "origin");
    this.exactAddress = builder.exactAddress;
    this.extraLabels = builder.extraLabels.buildKeepingLast();
  }

  public static Builder builder() {
    return new Builder();
  }

  public String getNamespace() {
    return namespace;
  }

  public HardwareAddress getHardwareAddress() {
    return hardwareAddress;
  }

  public String getSubnet() {
    return subnet;
  }

  /**
   * The address to ask the subnet for verbatim, or null to let the controller pick one.
   */
  public InetAddress getExactAddress() {
    return exactAddress;
  }

  /**
   * Marks which component created a reservation.
   */
  public String getOrigin() {
    return origin;
  }

  /**
   * Labels the reservation must carry besides the MAC and origin labels.
   */
  public ImmutableMap<String, String> getExtraLabels() {
    return extraLabels;
  }

  @Override
  public String toString() {
    return String.format("%s in %s/%s%s", hardwareAddress, namespace, subnet,
        exactAddress == null ? "" : " for " + exactAddress.getHostAddress());
  }

  /**
   * Builder for {@link ReservationRequest}.
   */
  public static class Builder {
    private String namespace;
    private HardwareAddress hardwareAddress;
    private String subnet;
    private InetAddress exactAddress;
    private String origin;
    private final ImmutableMap.Builder<String, String> extraLabels = ImmutableMap.builder();

    public Builder namespace(String namespace) {
      this.namespace = namespace;
      return this;
    }

    public Builder hardwareAddress(HardwareAddress hardwareAddress) {
      this.hardwareAddress = hardwareAddress;
      return this;
    }

    public Builder subnet(String subnet) {
      this.subnet = subnet;
      return this;
    }

    /**
     * Carries the candidate as exact address only when it is exact and known.
     */
    public Builder candidate(CandidateAddress candidate) {
      this.exactAddress = candidate.isExact() && !candidate.isUnknown() ? candidate.getAddress() : null;
      return this;
    }

    public Builder exactAddress(InetAddress exactAddress) {
      this.exactAddress = exactAddress;
      return this;
    }

    public Builder origin(String origin) {
      this.origin = origin;
      return this;
    }

    /**
     * Adds a label the reservation must carry. A later value for the same key wins.
     */
    public Builder label(String key, String value) {
      Preconditions.checkArgument(!ReservationManager.LABEL_MAC.equals(key)
          && !ReservationManager.LABEL_ORIGIN.equals(key), "label %s is set by the reservation manager", key);
      this.extraLabels.put(key, value);
      return this;
    }

    public ReservationRequest build() {
      return new ReservationRequest(this);
    }
  }
}
