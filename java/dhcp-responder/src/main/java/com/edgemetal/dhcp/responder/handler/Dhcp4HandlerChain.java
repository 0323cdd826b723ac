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

package com.edgemetal.dhcp.responder.handler;

import com.edgemetal.dhcp.common.logging.LoggingUtils;
import com.edgemetal.dhcp.responder.protocol.Dhcp4Message;

import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs DHCPv4 handlers in configuration order. The chain stops at the first handler that does not continue.
 */
public class Dhcp4HandlerChain implements Dhcp4Handler {

  private static final Logger logger = LoggerFactory.getLogger(Dhcp4HandlerChain.class);

  private final ImmutableList<Dhcp4Handler> handlers;

  public Dhcp4HandlerChain(List<Dhcp4Handler> handlers) {
    this.handlers = ImmutableList.copyOf(handlers);
  }

  public int size() {
    return handlers.size();
  }

  @Override
  public HandlerResult<Dhcp4Message> handle(Dhcp4Message request, Dhcp4Message reply) {
    LoggingUtils.setRequestId(LoggingUtils.formatTransactionId(request.getTransactionId()));
    try {
      logger.debug("Handling {}", request.summary());
      HandlerResult<Dhcp4Message> result = HandlerResult.next(reply);
      for (Dhcp4Handler handler : handlers) {
        try {
          result = handler.handle(request, result.getReply());
        } catch (RuntimeException e) {
          logger.error("Handler {} failed", handler, e);
          result = HandlerResult.error(e);
        }

        if (!result.isContinue()) {
          logger.info("Chain stopped at {}: {}", handler, result);
          return result;
        }
      }
      logger.debug("Replying {}", result.getReply().summary());
      return result;
    } finally {
      LoggingUtils.clearRequestId();
    }
  }
}
