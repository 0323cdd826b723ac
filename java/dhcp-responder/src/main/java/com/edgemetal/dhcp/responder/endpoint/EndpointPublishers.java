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

import com.edgemetal.dhcp.common.config.BadConfigException;
import com.edgemetal.dhcp.store.ResourceStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the endpoint publishing strategy for an inventory, once, at setup.
 */
public class EndpointPublishers {

  private static final Logger logger = LoggerFactory.getLogger(EndpointPublishers.class);

  /**
   * A static inventory takes precedence over MAC prefixes.
   *
   * @throws BadConfigException if the inventory has neither hosts nor MAC prefixes
   */
  public static EndpointPublisher forInventory(ResourceStore store, Inventory inventory) throws BadConfigException {
    if (!inventory.getHosts().isEmpty()) {
      if (!inventory.getMacPrefixes().isEmpty()) {
        logger.warn("Both hosts and MAC prefixes configured, ignoring the MAC prefixes");
      }
      logger.info("Publishing endpoints for {} inventory hosts", inventory.getHosts().size());
      return new StaticEndpointPublisher(store, inventory);
    }

    if (!inventory.getMacPrefixes().isEmpty()) {
      logger.info("Publishing endpoints named {}* for MAC prefixes {}", inventory.getNamePrefix(),
          inventory.getMacPrefixes());
      return new DynamicEndpointPublisher(store, inventory);
    }

    throw new BadConfigException("Neither hosts nor MAC prefix filter configured");
  }
}
