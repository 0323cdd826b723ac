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

import com.edgemetal.dhcp.common.IpHelper;
import com.edgemetal.dhcp.responder.protocol.HardwareAddress;
import com.edgemetal.dhcp.store.EndpointState;
import com.edgemetal.dhcp.store.ResourceStore;
import com.edgemetal.dhcp.store.exceptions.ResourceAlreadyExistsException;
import com.edgemetal.dhcp.store.exceptions.ResourceNotFoundException;
import com.edgemetal.dhcp.store.exceptions.StoreException;

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;

/**
 * Publishes endpoints named after the static inventory. Create-or-patch keyed by the inventory name.
 */
public class StaticEndpointPublisher implements EndpointPublisher {

  private static final Logger logger = LoggerFactory.getLogger(StaticEndpointPublisher.class);

  private final ResourceStore store;
  private final Inventory inventory;

  public StaticEndpointPublisher(ResourceStore store, Inventory inventory) {
    this.store = Preconditions.checkNotNull(store);
    this.inventory = Preconditions.checkNotNull(inventory);
  }

  @Override
  public Strategy getStrategy() {
    return Strategy.STATIC;
  }

  @Override
  public PublishResult publish(HardwareAddress hardwareAddress, InetAddress address)
      throws EndpointPublishException {
    String name = inventory.nameFor(hardwareAddress);
    if (name == null) {
      logger.info("Unknown inventory MAC address {}, not publishing", hardwareAddress);
      return PublishResult.SKIPPED;
    }

    String mac = hardwareAddress.toString();
    String ip = IpHelper.toAddressString(address);
    try {
      try {
        EndpointState existing = store.get(EndpointState.class, CLUSTER_SCOPE, name);
        if (mac.equals(existing.macAddress) && ip.equals(existing.ip)) {
          logger.debug("Endpoint {} is up to date", name);
          return PublishResult.ALREADY_EXISTS;
        }
      } catch (ResourceNotFoundException e) {
        EndpointState endpoint = new EndpointState();
        endpoint.name = name;
        endpoint.namespace = CLUSTER_SCOPE;
        endpoint.macAddress = mac;
        endpoint.ip = ip;
        try {
          store.create(endpoint);
          logger.info("Created endpoint {} for {} with {}", name, mac, ip);
          return PublishResult.CREATED;
        } catch (ResourceAlreadyExistsException raced) {
          logger.debug("Endpoint {} was created concurrently, patching it", name);
        }
      }

      store.patch(EndpointState.class, CLUSTER_SCOPE, name, endpoint -> {
        endpoint.macAddress = mac;
        endpoint.ip = ip;
      });
      logger.info("Updated endpoint {} to {} with {}", name, mac, ip);
      return PublishResult.UPDATED;
    } catch (StoreException e) {
      throw new EndpointPublishException(String.format("Could not apply endpoint %s for %s", name, mac), e);
    }
  }
}
