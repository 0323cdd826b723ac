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

import com.edgemetal.dhcp.common.config.BadConfigException;
import com.edgemetal.dhcp.responder.config.ResponderConfig;
import com.edgemetal.dhcp.responder.handler.Dhcp4HandlerChain;
import com.edgemetal.dhcp.responder.handler.Dhcp6HandlerChain;
import com.edgemetal.dhcp.responder.handler.HandlerResult;
import com.edgemetal.dhcp.responder.handler.PluginRegistry;
import com.edgemetal.dhcp.responder.protocol.Dhcp4Message;
import com.edgemetal.dhcp.responder.protocol.Dhcp6ClientMessage;
import com.edgemetal.dhcp.responder.protocol.Dhcp6Message;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the protocol server into the handler chains. The protocol server decodes a request, builds
 * the default reply and sends whatever reply a continuing chain returns.
 */
public class Responder {

  private static final Logger logger = LoggerFactory.getLogger(Responder.class);

  private final Dhcp4HandlerChain chain4;
  private final Dhcp6HandlerChain chain6;

  public Responder(Dhcp4HandlerChain chain4, Dhcp6HandlerChain chain6) {
    this.chain4 = chain4;
    this.chain6 = chain6;
  }

  /**
   * Sets up the plugin chains of the configured address families.
   *
   * @throws BadConfigException if a plugin is unknown or rejects its arguments
   */
  public static Responder fromConfig(ResponderConfig config, PluginRegistry registry) throws BadConfigException {
    Dhcp4HandlerChain chain4 = null;
    if (config.getServer4() != null) {
      chain4 = registry.buildChain4(config.getServer4());
      logger.info("DHCPv4 chain has {} plugins", chain4.size());
    }

    Dhcp6HandlerChain chain6 = null;
    if (config.getServer6() != null) {
      chain6 = registry.buildChain6(config.getServer6());
      logger.info("DHCPv6 chain has {} plugins", chain6.size());
    }
    return new Responder(chain4, chain6);
  }

  public boolean servesDhcp4() {
    return chain4 != null;
  }

  public boolean servesDhcp6() {
    return chain6 != null;
  }

  public HandlerResult<Dhcp4Message> handle4(Dhcp4Message request, Dhcp4Message reply) {
    if (chain4 == null) {
      return HandlerResult.drop("DHCPv4 is not served");
    }
    return chain4.handle(request, reply);
  }

  public HandlerResult<Dhcp6ClientMessage> handle6(Dhcp6Message request, Dhcp6ClientMessage reply) {
    if (chain6 == null) {
      return HandlerResult.drop("DHCPv6 is not served");
    }
    return chain6.handle(request, reply);
  }
}
