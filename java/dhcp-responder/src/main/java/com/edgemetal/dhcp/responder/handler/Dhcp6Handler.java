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

import com.edgemetal.dhcp.responder.protocol.Dhcp6ClientMessage;
import com.edgemetal.dhcp.responder.protocol.Dhcp6Message;

/**
 * Handles a DHCPv6 request as one link of a {@link HandlerChain}.
 */
public interface Dhcp6Handler {

  /**
   * @param request the request as received, usually a relay message
   * @param reply   the reply to the innermost client message, built so far
   */
  HandlerResult<Dhcp6ClientMessage> handle(Dhcp6Message request, Dhcp6ClientMessage reply);
}
