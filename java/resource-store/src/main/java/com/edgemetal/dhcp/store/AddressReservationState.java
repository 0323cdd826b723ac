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

package com.edgemetal.dhcp.store;

/**
 * A request for an address out of a subnet, resolved asynchronously by an external controller.
 */
public class AddressReservationState extends ResourceDocument {

  /**
   * Processing state of a reservation. A reservation without a state has not been picked up yet.
   */
  public enum State {
    PROCESSING,
    FINISHED,
    FAILED
  }

  /**
   * Name of the subnet the address is reserved from, in the reservation's namespace.
   */
  public String subnet;

  /**
   * The exact address asked for, if any.
   */
  public String requestedAddress;

  /**
   * The address the controller reserved. Set once the reservation is {@link State#FINISHED}.
   */
  public String reservedAddress;

  public State state;

  public boolean isTerminal() {
    return state == State.FINISHED || state == State.FAILED;
  }

  public void copyTo(AddressReservationState target) {
    super.copyTo(target);
    target.subnet = this.subnet;
    target.requestedAddress = this.requestedAddress;
    target.reservedAddress = this.reservedAddress;
    target.state = this.state;
  }
}
