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

package com.edgemetal.dhcp.responder.subnet;

import com.edgemetal.dhcp.common.IpHelper;
import com.edgemetal.dhcp.responder.derivation.CandidateAddress;
import com.edgemetal.dhcp.store.LabelSelector;
import com.edgemetal.dhcp.store.ResourceStore;
import com.edgemetal.dhcp.store.SubnetState;
import com.edgemetal.dhcp.store.exceptions.ResourceNotFoundException;
import com.edgemetal.dhcp.store.exceptions.StoreException;

import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Finds the subnet a candidate address belongs to.
 */
public class SubnetSelector {

  private static final Logger logger = LoggerFactory.getLogger(SubnetSelector.class);

  private final ResourceStore store;

  public SubnetSelector(ResourceStore store) {
    this.store = Preconditions.checkNotNull(store);
  }

  /**
   * Returns the first of the named subnets whose reserved block contains the candidate. With an unknown
   * candidate the first existing subnet is returned. Subnets that do not exist are skipped.
   *
   * @param namespace   namespace of the subnets
   * @param subnetNames candidates, in order of preference
   * @param candidate   candidate address
   * @return the matching subnet, absent if none matched
   * @throws StoreException if a subnet could not be fetched
   */
  public Optional<SubnetState> select(String namespace, List<String> subnetNames, CandidateAddress candidate)
      throws StoreException {
    for (String subnetName : subnetNames) {
      SubnetState subnet;
      try {
        subnet = store.get(SubnetState.class, namespace, subnetName);
      } catch (ResourceNotFoundException e) {
        logger.debug("Subnet {}/{} not found, skipping", namespace, subnetName);
        continue;
      }

      if (candidate.isUnknown()) {
        logger.debug("No address known yet, selecting subnet {}", subnetName);
        return Optional.of(subnet);
      }

      if (contains(subnet, candidate)) {
        logger.debug("Selected subnet {} for {}", subnetName, candidate);
        return Optional.of(subnet);
      }
    }

    logger.debug("None of the subnets {} in {} contains {}", subnetNames, namespace, candidate);
    return Optional.absent();
  }

  /**
   * Lists the names of the subnets of one address family carrying the given labels, ordered by name.
   */
  public List<String> discover(String namespace, LabelSelector selector, SubnetState.AddressType addressType)
      throws StoreException {
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (SubnetState subnet : store.list(SubnetState.class, namespace, selector)) {
      if (subnet.addressType == addressType) {
        names.add(subnet.name);
      }
    }
    return names.build();
  }

  private static boolean contains(SubnetState subnet, CandidateAddress candidate) {
    if (subnet.reserved == null) {
      logger.debug("Subnet {} has no reserved block yet", subnet.name);
      return false;
    }

    try {
      return IpHelper.isInCidr(candidate.getAddress(), subnet.reserved);
    } catch (IllegalArgumentException e) {
      logger.warn("Subnet {} has a malformed reserved block {}: {}", subnet.name, subnet.reserved, e.getMessage());
      return false;
    }
  }
}
