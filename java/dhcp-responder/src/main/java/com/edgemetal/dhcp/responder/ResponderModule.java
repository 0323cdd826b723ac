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

package com.edgemetal.dhcp.responder;

import com.edgemetal.dhcp.responder.config.ReservationConfig;
import com.edgemetal.dhcp.responder.config.ResponderConfig;
import com.edgemetal.dhcp.responder.handler.PluginRegistry;
import com.edgemetal.dhcp.responder.plugins.ipam.IpamPlugin;
import com.edgemetal.dhcp.responder.plugins.management.ManagementPlugin;
import com.edgemetal.dhcp.responder.plugins.metal.MetalPlugin;
import com.edgemetal.dhcp.responder.plugins.onmetal.OnMetalPlugin;
import com.edgemetal.dhcp.responder.plugins.oob.OobPlugin;
import com.edgemetal.dhcp.responder.reservation.PollingStateAwaiter;
import com.edgemetal.dhcp.responder.reservation.ReservationManager;
import com.edgemetal.dhcp.responder.reservation.ResourceStateAwaiter;
import com.edgemetal.dhcp.responder.reservation.WatchingStateAwaiter;
import com.edgemetal.dhcp.responder.subnet.SubnetSelector;
import com.edgemetal.dhcp.store.ResourceStore;
import com.edgemetal.dhcp.store.memory.InMemoryResourceStore;

import com.google.common.collect.ImmutableList;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;

/**
 * This class implements a Guice module for the DHCP responder service.
 */
public class ResponderModule extends AbstractModule {

  private final ResponderConfig responderConfig;
  private final ResourceStore resourceStore;

  public ResponderModule(ResponderConfig responderConfig) {
    this(responderConfig, new InMemoryResourceStore());
  }

  public ResponderModule(ResponderConfig responderConfig, ResourceStore resourceStore) {
    this.responderConfig = responderConfig;
    this.resourceStore = resourceStore;
  }

  @Override
  protected void configure() {
    bind(ResponderConfig.class).toInstance(responderConfig);
    bind(ReservationConfig.class).toInstance(responderConfig.getReservation());
    bind(ResourceStore.class).toInstance(resourceStore);
  }

  @Provides
  @Singleton
  ResourceStateAwaiter getResourceStateAwaiter(ReservationConfig config, ResourceStore store) {
    switch (config.getAwaitMode()) {
      case WATCH:
        return new WatchingStateAwaiter(store);
      case POLL:
        return new PollingStateAwaiter(store, config.getPollInterval());
      default:
        throw new IllegalStateException("Unknown await mode " + config.getAwaitMode());
    }
  }

  @Provides
  @Singleton
  ReservationManager getReservationManager(ReservationConfig config, ResourceStore store,
                                           ResourceStateAwaiter awaiter) {
    return new ReservationManager(store, awaiter, config.getCreationTimeout(), config.getDeletionTimeout());
  }

  @Provides
  @Singleton
  SubnetSelector getSubnetSelector(ResourceStore store) {
    return new SubnetSelector(store);
  }

  @Provides
  @Singleton
  PluginRegistry getPluginRegistry(IpamPlugin ipam, OobPlugin oob, MetalPlugin metal, OnMetalPlugin onMetal,
                                   ManagementPlugin management) {
    return new PluginRegistry(ImmutableList.of(ipam, oob, metal, onMetal, management));
  }
}
