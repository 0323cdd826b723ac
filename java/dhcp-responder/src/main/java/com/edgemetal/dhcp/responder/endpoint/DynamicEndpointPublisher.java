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
import com.edgemetal.dhcp.store.LabelSelector;
import com.edgemetal.dhcp.store.ResourceStore;
import com.edgemetal.dhcp.store.exceptions.StoreException;

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;

/**
 * Publishes endpoints for machines recognized by MAC prefix. Endpoints are looked up by hardware address and new
 * ones get a name generated from the configured prefix.
 * <p>
 * A changed IP is written with one optimistic update. A concurrent modification fails the publish; it is not
 * retried.
 */
public class DynamicEndpointPublisher implements EndpointPublisher {

  private static final Logger logger = LoggerFactory.getLogger(DynamicEndpointPublisher.class);

  private final ResourceStore store;
  private final Inventory inventory;

  public DynamicEndpointPublisher(ResourceStore store, Inventory inventory) {
    this.store = Preconditions.checkNotNull(store);
    this.inventory = Preconditions.checkNotNull(inventory);
  }

  @Override
  public Strategy getStrategy() {
    return Strategy.DYNAMIC;
  }

  @Override
  public PublishResult publish(HardwareAddress hardwareAddress, InetAddress address)
      throws EndpointPublishException {
    if (!inventory.matchesPrefix(hardwareAddress)) {
      logger.info("MAC address {} matches no configured prefix, not publishing", hardwareAddress);
      return PublishResult.SKIPPED;
    }

    try {
      EndpointState existing = findByHardwareAddress(hardwareAddress);
      if (existing != null) {
        if (sameAddress(existing.ip, address)) {
          logger.info("Endpoint {} for {} already exists", existing.name, hardwareAddress);
          return PublishResult.ALREADY_EXISTS;
        }

        String previous = existing.ip;
        existing.ip = IpHelper.toAddressString(address);
        store.update(existing);
        logger.info("Updated endpoint {} for {} from {} to {}", existing.name, hardwareAddress, previous,
            existing.ip);
        return PublishResult.UPDATED;
      }

      EndpointState endpoint = new EndpointState();
      endpoint.generateName = inventory.getNamePrefix();
      endpoint.namespace = CLUSTER_SCOPE;
      endpoint.macAddress = hardwareAddress.toString();
      endpoint.ip = IpHelper.toAddressString(address);
      EndpointState created = store.create(endpoint);
      logger.info("Created endpoint {} for {} with {}", created.name, hardwareAddress, created.ip);
      return PublishResult.CREATED;
    } catch (StoreException e) {
      throw new EndpointPublishException(String.format("Could not apply endpoint for %s", hardwareAddress), e);
    }
  }

  private EndpointState findByHardwareAddress(HardwareAddress hardwareAddress) throws StoreException {
    for (EndpointState endpoint : store.list(EndpointState.class, CLUSTER_SCOPE, LabelSelector.everything())) {
      if (endpoint.macAddress == null) {
        continue;
      }
      try {
        if (HardwareAddress.parse(endpoint.macAddress).equals(hardwareAddress)) {
          return endpoint;
        }
      } catch (IllegalArgumentException e) {
        logger.debug("Endpoint {} has malformed MAC address {}", endpoint.name, endpoint.macAddress);
      }
    }
    return null;
  }

  private static boolean sameAddress(String stored, InetAddress address) {
    if (stored == null) {
      return false;
    }
    try {
      return IpHelper.parse(stored).equals(address);
    } catch (IllegalArgumentException e) {
      return false;
    }
  }
}
