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

import com.edgemetal.dhcp.responder.derivation.CandidateAddress;
import com.edgemetal.dhcp.responder.protocol.HardwareAddress;
import com.edgemetal.dhcp.responder.reservation.ReservationException;
import com.edgemetal.dhcp.responder.reservation.ReservationManager;
import com.edgemetal.dhcp.responder.reservation.ReservationRequest;
import com.edgemetal.dhcp.responder.reservation.ReservedAddress;
import com.edgemetal.dhcp.responder.subnet.SubnetSelector;
import com.edgemetal.dhcp.store.LabelSelector;
import com.edgemetal.dhcp.store.SubnetState;
import com.edgemetal.dhcp.store.exceptions.StoreException;

import com.google.common.base.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Reservation logic shared by both address families of the oob plugin.
 */
abstract class OobHandler {

  private static final Logger logger = LoggerFactory.getLogger(OobHandler.class);

  private final String namespace;
  private final LabelSelector subnetLabel;
  private final SubnetSelector subnetSelector;
  private final ReservationManager reservationManager;

  protected OobHandler(String namespace, LabelSelector subnetLabel, SubnetSelector subnetSelector,
                       ReservationManager reservationManager) {
    this.namespace = namespace;
    this.subnetLabel = subnetLabel;
    this.subnetSelector = subnetSelector;
    this.reservationManager = reservationManager;
  }

  /**
   * Reserves an address for the client in the first out-of-band subnet matching the candidate.
   *
   * @throws ReservationException if there is no matching subnet or the reservation did not succeed
   * @throws StoreException       if the subnets could not be read
   */
  protected ReservedAddress lease(HardwareAddress mac, CandidateAddress candidate,
                                  SubnetState.AddressType addressType) throws ReservationException, StoreException {
    List<String> subnets = subnetSelector.discover(namespace, subnetLabel, addressType);
    if (subnets.isEmpty()) {
      throw new ReservationException(String.format("No %s subnets labelled %s in namespace %s", addressType,
          subnetLabel, namespace));
    }

    Optional<SubnetState> subnet = subnetSelector.select(namespace, subnets, candidate);
    if (!subnet.isPresent()) {
      throw new ReservationException(String.format("None of the subnets %s contains %s", subnets, candidate));
    }
    logger.debug("Leasing from subnet {} for {}", subnet.get().name, mac);

    ReservationRequest.Builder request = ReservationRequest.builder()
        .namespace(namespace)
        .hardwareAddress(mac)
        .subnet(subnet.get().name)
        .candidate(candidate)
        .origin(OobPlugin.NAME);
    for (Map.Entry<String, String> term : subnetLabel.getTerms().entrySet()) {
      request.label(term.getKey(), term.getValue());
    }
    return reservationManager.reserve(request.build());
  }

  @Override
  public String toString() {
    return OobPlugin.NAME;
  }
}
