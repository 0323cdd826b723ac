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

import java.net.InetAddress;

/**
 * Publishes the name, hardware address and IP of a provisioned machine as an endpoint record.
 */
public interface EndpointPublisher {

  /**
   * Endpoints are cluster scoped.
   */
  String CLUSTER_SCOPE = "";

  /**
   * How endpoint names are determined.
   */
  enum Strategy {
    /**
     * Names come from a static inventory; the endpoint is keyed by name.
     */
    STATIC,
    /**
     * Machines are recognized by MAC prefix and endpoints get generated names; the endpoint is keyed by MAC.
     */
    DYNAMIC
  }

  Strategy getStrategy();

  PublishResult publish(HardwareAddress hardwareAddress, InetAddress address) throws EndpointPublishException;
}
