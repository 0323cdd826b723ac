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

package com.edgemetal.dhcp.responder;

import com.edgemetal.dhcp.common.config.BadConfigException;
import com.edgemetal.dhcp.common.config.ConfigBuilder;
import com.edgemetal.dhcp.common.logging.LoggingFactory;
import com.edgemetal.dhcp.responder.config.ResponderConfig;
import com.edgemetal.dhcp.responder.handler.Plugin;
import com.edgemetal.dhcp.responder.handler.PluginRegistry;

import com.google.common.base.Joiner;
import com.google.inject.Guice;
import com.google.inject.Injector;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.impl.Arguments;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.Namespace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * DHCP responder entry point. Loads the configuration and sets up the plugin chains.
 */
public class Main {

  private static final Logger logger = LoggerFactory.getLogger(Main.class);

  public static void main(String[] args) throws Throwable {
    LoggingFactory.bootstrap();

    ArgumentParser parser = ArgumentParsers.newFor("edgemetal-dhcp").build()
        .defaultHelp(true)
        .description("Edge Metal DHCP responder");
    parser.addArgument("file").nargs("?").help("configuration file");
    parser.addArgument("--list-plugins").action(Arguments.storeTrue()).help("list the known plugins and exit");

    Namespace namespace = parser.parseArgsOrFail(args);

    if (namespace.getBoolean("list_plugins")) {
      listPlugins(Guice.createInjector(new ResponderModule(new ResponderConfig())).getInstance(PluginRegistry.class));
      return;
    }

    if (namespace.getString("file") == null) {
      parser.printUsage();
      System.exit(1);
    }

    ResponderConfig responderConfig = getConfig(namespace);

    new LoggingFactory(responderConfig.getLogging(), "dhcp-responder").configure();

    Runtime.getRuntime().addShutdownHook(new Thread() {
      @Override
      public void run() {
        logger.info("Shutting down");
        LoggingFactory.detachAndStop();
      }
    });

    Injector injector = Guice.createInjector(new ResponderModule(responderConfig));
    PluginRegistry registry = injector.getInstance(PluginRegistry.class);

    Responder responder = null;
    try {
      responder = Responder.fromConfig(responderConfig, registry);
    } catch (BadConfigException e) {
      logger.error("Could not set up plugins: {}", e.getMessage());
      System.exit(1);
    }

    logger.info("Responder ready (DHCPv4: {}, DHCPv6: {})", responder.servesDhcp4(), responder.servesDhcp6());
  }

  private static ResponderConfig getConfig(Namespace namespace) {
    ResponderConfig config = null;
    try {
      config = ConfigBuilder.build(ResponderConfig.class, namespace.getString("file"));
    } catch (BadConfigException e) {
      logger.error(e.getMessage());
      System.exit(1);
    }
    return config;
  }

  private static void listPlugins(PluginRegistry registry) {
    for (Plugin plugin : registry.getPlugins()) {
      List<String> families = new ArrayList<>();
      if (plugin.supportsDhcp4()) {
        families.add("DHCPv4");
      }
      if (plugin.supportsDhcp6()) {
        families.add("DHCPv6");
      }
      System.out.println(plugin.getName() + "\t" + Joiner.on(", ").join(families));
    }
  }
}
