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

package com.edgemetal.dhcp.responder.plugins.metal;

import com.edgemetal.dhcp.common.config.BadConfigException;
import com.edgemetal.dhcp.common.config.ConfigBuilder;
import com.edgemetal.dhcp.responder.endpoint.EndpointPublisher;
import com.edgemetal.dhcp.responder.endpoint.EndpointPublishers;
import com.edgemetal.dhcp.responder.endpoint.Inventory;
import com.edgemetal.dhcp.responder.handler.AbstractPlugin;
import com.edgemetal.dhcp.responder.handler.Dhcp4Handler;
import com.edgemetal.dhcp.responder.handler.Dhcp6Handler;
import com.edgemetal.dhcp.responder.protocol.HardwareAddress;
import com.edgemetal.dhcp.responder.reservation.ReservationManager;
import com.edgemetal.dhcp.store.ResourceStore;
import com.edgemetal.dhcp.store.SubnetState;

import com.google.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Publishes an endpoint record for every inventory machine that has been given an address.
 */
public class MetalPlugin extends AbstractPlugin {

  public static final String NAME = "metal";

  private static final Logger logger = LoggerFactory.getLogger(MetalPlugin.class);

  private final ResourceStore store;
  private final ReservationManager reservationManager;

  @Inject
  public MetalPlugin(ResourceStore store, ReservationManager reservationManager) {
    super(NAME);
    this.store = store;
    this.reservationManager = reservationManager;
  }

  @Override
  public boolean supportsDhcp4() {
    return true;
  }

  @Override
  public boolean supportsDhcp6() {
    return true;
  }

  @Override
  public Dhcp4Handler setup4(List<String> args) throws BadConfigException {
    return newHandler(args, SubnetState.AddressType.IPv4);
  }

  @Override
  public Dhcp6Handler setup6(List<String> args) throws BadConfigException {
    return newHandler(args, SubnetState.AddressType.IPv6);
  }

  private MetalHandler newHandler(List<String> args, SubnetState.AddressType addressType)
      throws BadConfigException {
    MetalConfig config = ConfigBuilder.build(MetalConfig.class, configFileArgument(args));
    Inventory inventory = toInventory(config);
    EndpointPublisher publisher = EndpointPublishers.forInventory(store, inventory);
    logger.info("Loaded metal plugin for {} with {} endpoints", addressType, publisher.getStrategy());
    return new MetalHandler(config.getNamespace(), inventory, publisher, reservationManager, addressType);
  }

  static Inventory toInventory(MetalConfig config) throws BadConfigException {
    Map<HardwareAddress, String> hosts = new LinkedHashMap<>();
    for (MetalConfig.Host host : config.getHosts()) {
      HardwareAddress mac;
      try {
        mac = HardwareAddress.parse(host.getMacAddress());
      } catch (IllegalArgumentException e) {
        throw new BadConfigException(String.format("Invalid MAC address %s of host %s", host.getMacAddress(),
            host.getName()), e);
      }

      String previous = hosts.put(mac, host.getName());
      if (previous != null) {
        throw new BadConfigException(String.format("MAC address %s is listed for both %s and %s", mac, previous,
            host.getName()));
      }
    }
    return new Inventory(hosts, config.getFilter().getMacPrefix(), config.getNamePrefix());
  }
}
