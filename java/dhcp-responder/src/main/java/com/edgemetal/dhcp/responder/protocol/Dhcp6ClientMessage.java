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

package com.edgemetal.dhcp.responder.protocol;

import com.google.common.base.Preconditions;

/**
 * A DHCPv6 client or server message (anything but a relay message).
 */
public class Dhcp6ClientMessage extends Dhcp6Message {

  private final int transactionId;

  public Dhcp6ClientMessage(MessageType messageType, int transactionId) {
    super(messageType);
    Preconditions.checkArgument(!messageType.isRelay(), "%s is a relay message type", messageType);
    this.transactionId = transactionId;
  }

  /**
   * The 24 bit transaction id.
   */
  public int getTransactionId() {
    return transactionId;
  }

  public IaNaOption getIaNa() {
    return getOption(IaNaOption.class);
  }

  public IaPdOption getIaPd() {
    return getOption(IaPdOption.class);
  }

  @Override
  public String summary() {
    return String.format("DHCPv6 %s xid=0x%06x options=%s", getMessageType(), transactionId, getOptions());
  }
}
