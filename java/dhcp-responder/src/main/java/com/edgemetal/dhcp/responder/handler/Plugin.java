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

import com.edgemetal.dhcp.common.config.BadConfigException;

import java.util.List;

/**
 * A named responder plugin contributing handlers to the DHCPv4 and/or DHCPv6 chains.
 */
public interface Plugin {

  String getName();

  boolean supportsDhcp4();

  boolean supportsDhcp6();

  /**
   * Builds the DHCPv4 handler from the plugin's arguments.
   *
   * @throws BadConfigException if the arguments or the configuration they point at are invalid
   */
  Dhcp4Handler setup4(List<String> args) throws BadConfigException;

  /**
   * Builds the DHCPv6 handler from the plugin's arguments.
   *
   * @throws BadConfigException if the arguments or the configuration they point at are invalid
   */
  Dhcp6Handler setup6(List<String> args) throws BadConfigException;
}
