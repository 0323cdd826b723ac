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
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;

/**
 * A decoded DHCPv6 message, either a client/server message or a relay message wrapping one.
 */
public abstract class Dhcp6Message {

  /**
   * DHCPv6 message types, RFC 8415 section 7.3.
   */
  public enum MessageType {
    SOLICIT(1),
    ADVERTISE(2),
    REQUEST(3),
    CONFIRM(4),
    RENEW(5),
    REBIND(6),
    REPLY(7),
    RELEASE(8),
    DECLINE(9),
    RECONFIGURE(10),
    INFORMATION_REQUEST(11),
    RELAY_FORW(12),
    RELAY_REPL(13);

    private final int code;

    MessageType(int code) {
      this.code = code;
    }

    public int getCode() {
      return code;
    }

    public boolean isRelay() {
      return this == RELAY_FORW || this == RELAY_REPL;
    }
  }

  private final MessageType messageType;
  private final List<Dhcp6Option> options = new ArrayList<>();

  protected Dhcp6Message(MessageType messageType) {
    this.messageType = Preconditions.checkNotNull(messageType);
  }

  public MessageType getMessageType() {
    return messageType;
  }

  public boolean isRelay() {
    return messageType.isRelay();
  }

  public List<Dhcp6Option> getOptions() {
    return ImmutableList.copyOf(options);
  }

  /**
   * Returns the first option of the given type, or null.
   */
  public <T extends Dhcp6Option> T getOption(Class<T> optionType) {
    for (Dhcp6Option option : options) {
      if (optionType.isInstance(option)) {
        return optionType.cast(option);
      }
    }
    return null;
  }

  public void addOption(Dhcp6Option option) {
    options.add(Preconditions.checkNotNull(option));
  }

  public abstract String summary();

  @Override
  public String toString() {
    return summary();
  }
}
