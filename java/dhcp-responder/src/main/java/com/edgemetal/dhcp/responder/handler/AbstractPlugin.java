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
 * Base class for plugins. Families the plugin does not override are rejected at setup.
 */
public abstract class AbstractPlugin implements Plugin {

  private final String name;

  protected AbstractPlugin(String name) {
    this.name = name;
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public boolean supportsDhcp4() {
    return false;
  }

  @Override
  public boolean supportsDhcp6() {
    return false;
  }

  @Override
  public Dhcp4Handler setup4(List<String> args) throws BadConfigException {
    throw new BadConfigException("Plugin " + name + " does not support DHCPv4");
  }

  @Override
  public Dhcp6Handler setup6(List<String> args) throws BadConfigException {
    throw new BadConfigException("Plugin " + name + " does not support DHCPv6");
  }

  /**
   * Returns the single argument naming the plugin's configuration file.
   *
   * @throws BadConfigException if not exactly one argument was given
   */
  protected String configFileArgument(List<String> args) throws BadConfigException {
    if (args == null || args.size() != 1) {
      throw new BadConfigException(String.format("Exactly one argument must be passed to the %s plugin, got %d",
          name, args == null ? 0 : args.size()));
    }
    return args.get(0);
  }

  @Override
  public String toString() {
    return name;
  }
}
