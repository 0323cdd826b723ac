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

package com.edgemetal.dhcp.responder.plugins.ipam;

import com.edgemetal.dhcp.common.config.BadConfigException;
import com.edgemetal.dhcp.common.config.ConfigBuilder;
import com.edgemetal.dhcp.responder.handler.AbstractPlugin;
import com.edgemetal.dhcp.responder.handler.Dhcp6Handler;
import com.edgemetal.dhcp.responder.reservation.ReservationManager;
import com.edgemetal.dhcp.responder.subnet.SubnetSelector;

import com.google.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Reserves the address derived from the relay link address in an explicitly configured list of subnets.
 */
public class IpamPlugin extends AbstractPlugin {

  public static final String NAME = "ipam";

  private static final Logger logger = LoggerFactory.getLogger(IpamPlugin.class);

  private final SubnetSelector subnetSelector;
  private final ReservationManager reservationManager;

  @Inject
  public IpamPlugin(SubnetSelector subnetSelector, ReservationManager reservationManager) {
    super(NAME);
    this.subnetSelector = subnetSelector;
    this.reservationManager = reservationManager;
  }

  @Override
  public boolean supportsDhcp6() {
    return true;
  }

  @Override
  public Dhcp6Handler setup6(List<String> args) throws BadConfigException {
    IpamConfig config = ConfigBuilder.build(IpamConfig.class, configFileArgument(args));
    logger.info("Loaded ipam plugin for DHCPv6 with subnets {} in namespace {}", config.getSubnets(),
        config.getNamespace());
    return new IpamHandler(config, subnetSelector, reservationManager);
  }
}
