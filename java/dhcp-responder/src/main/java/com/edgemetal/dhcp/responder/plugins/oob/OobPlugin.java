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

package com.edgemetal.dhcp.responder.plugins.oob;

import com.edgemetal.dhcp.common.config.BadConfigException;
import com.edgemetal.dhcp.common.config.ConfigBuilder;
import com.edgemetal.dhcp.responder.handler.AbstractPlugin;
import com.edgemetal.dhcp.responder.handler.Dhcp4Handler;
import com.edgemetal.dhcp.responder.handler.Dhcp6Handler;
import com.edgemetal.dhcp.responder.reservation.ReservationManager;
import com.edgemetal.dhcp.responder.subnet.SubnetSelector;
import com.edgemetal.dhcp.store.LabelSelector;

import com.google.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Leases addresses from the out-of-band subnets, which are discovered by label.
 */
public class OobPlugin extends AbstractPlugin {

  public static final String NAME = "oob";

  private static final Logger logger = LoggerFactory.getLogger(OobPlugin.class);

  private final SubnetSelector subnetSelector;
  private final ReservationManager reservationManager;

  @Inject
  public OobPlugin(SubnetSelector subnetSelector, ReservationManager reservationManager) {
    super(NAME);
    this.subnetSelector = subnetSelector;
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
    OobConfig config = loadConfig(args);
    logger.info("Loaded oob plugin for DHCPv4 with subnets labelled {}", config.getSubnetLabel());
    return new OobHandler4(config.getNamespace(), config.getSubnetSelector(), subnetSelector, reservationManager);
  }

  @Override
  public Dhcp6Handler setup6(List<String> args) throws BadConfigException {
    OobConfig config = loadConfig(args);
    logger.info("Loaded oob plugin for DHCPv6 with subnets labelled {}", config.getSubnetLabel());
    return new OobHandler6(config.getNamespace(), config.getSubnetSelector(), subnetSelector, reservationManager);
  }

  private OobConfig loadConfig(List<String> args) throws BadConfigException {
    OobConfig config = ConfigBuilder.build(OobConfig.class, configFileArgument(args));
    LabelSelector selector;
    try {
      selector = LabelSelector.parse(config.getSubnetLabel());
    } catch (IllegalArgumentException e) {
      throw new BadConfigException("Invalid subnet label " + config.getSubnetLabel() + ": " + e.getMessage(), e);
    }
    for (String key : selector.getTerms().keySet()) {
      if (ReservationManager.LABEL_MAC.equals(key) || ReservationManager.LABEL_ORIGIN.equals(key)) {
        throw new BadConfigException("Subnet label key " + key + " is reserved for reservation bookkeeping");
      }
    }
    return config;
  }
}
