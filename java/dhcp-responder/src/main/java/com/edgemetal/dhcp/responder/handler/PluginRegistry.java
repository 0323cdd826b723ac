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
import com.edgemetal.dhcp.responder.config.PluginConfig;
import com.edgemetal.dhcp.responder.config.ServerConfig;

import com.google.common.collect.ImmutableSortedMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Known plugins by name. Builds the handler chains of a server configuration.
 */
public class PluginRegistry {

  private static final Logger logger = LoggerFactory.getLogger(PluginRegistry.class);

  private final ImmutableSortedMap<String, Plugin> plugins;

  public PluginRegistry(Collection<? extends Plugin> plugins) {
    ImmutableSortedMap.Builder<String, Plugin> builder = ImmutableSortedMap.naturalOrder();
    for (Plugin plugin : plugins) {
      builder.put(plugin.getName(), plugin);
    }
    this.plugins = builder.build();
  }

  public Set<String> getNames() {
    return plugins.keySet();
  }

  public Collection<Plugin> getPlugins() {
    return plugins.values();
  }

  /**
   * @throws BadConfigException if no plugin of that name is registered
   */
  public Plugin getPlugin(String name) throws BadConfigException {
    Plugin plugin = plugins.get(name);
    if (plugin == null) {
      throw new BadConfigException(String.format("Unknown plugin '%s', known plugins are %s", name,
          plugins.keySet()));
    }
    return plugin;
  }

  public Dhcp4HandlerChain buildChain4(ServerConfig config) throws BadConfigException {
    List<Dhcp4Handler> handlers = new ArrayList<>();
    for (PluginConfig pluginConfig : config.getPlugins()) {
      Plugin plugin = getPlugin(pluginConfig.getName());
      if (!plugin.supportsDhcp4()) {
        throw new BadConfigException("Plugin " + plugin.getName() + " does not support DHCPv4");
      }
      logger.info("Setting up DHCPv4 plugin {}", pluginConfig);
      handlers.add(plugin.setup4(pluginConfig.getArgs()));
    }
    return new Dhcp4HandlerChain(handlers);
  }

  public Dhcp6HandlerChain buildChain6(ServerConfig config) throws BadConfigException {
    List<Dhcp6Handler> handlers = new ArrayList<>();
    for (PluginConfig pluginConfig : config.getPlugins()) {
      Plugin plugin = getPlugin(pluginConfig.getName());
      if (!plugin.supportsDhcp6()) {
        throw new BadConfigException("Plugin " + plugin.getName() + " does not support DHCPv6");
      }
      logger.info("Setting up DHCPv6 plugin {}", pluginConfig);
      handlers.add(plugin.setup6(pluginConfig.getArgs()));
    }
    return new Dhcp6HandlerChain(handlers);
  }
}
