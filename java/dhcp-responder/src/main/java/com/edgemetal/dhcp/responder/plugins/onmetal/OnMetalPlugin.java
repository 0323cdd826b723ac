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

package com.edgemetal.dhcp.responder.plugins.onmetal;

import com.edgemetal.dhcp.common.config.BadConfigException;
import com.edgemetal.dhcp.common.config.ConfigBuilder;
import com.edgemetal.dhcp.responder.derivation.PrefixDelegation;
import com.edgemetal.dhcp.responder.handler.AbstractPlugin;
import com.edgemetal.dhcp.responder.handler.Dhcp6Handler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Leases the address following the relay link address, for switches relaying from /127 point-to-point
 * subnets, and delegates a prefix covering it.
 */
public class OnMetalPlugin extends AbstractPlugin {

  public static final String NAME = "onmetal";

  private static final Logger logger = LoggerFactory.getLogger(OnMetalPlugin.class);

  public OnMetalPlugin() {
    super(NAME);
  }

  @Override
  public boolean supportsDhcp6() {
    return true;
  }

  @Override
  public Dhcp6Handler setup6(List<String> args) throws BadConfigException {
    OnMetalConfig config = ConfigBuilder.build(OnMetalConfig.class, configFileArgument(args));
    PrefixDelegation prefixDelegation = PrefixDelegation.withDefaultLength(config.getPrefixDelegation().getLength());
    logger.info("Loaded onmetal plugin for DHCPv6, delegating /{} prefixes", prefixDelegation.getDefaultLength());
    return new OnMetalHandler(prefixDelegation);
  }
}
