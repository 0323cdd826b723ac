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

package com.edgemetal.dhcp.common.logging;

import static com.edgemetal.dhcp.common.logging.LoggingConfiguration.ConsoleConfiguration;
import static com.edgemetal.dhcp.common.logging.LoggingConfiguration.FileConfiguration;

import ch.qos.logback.classic.AsyncAppender;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.filter.ThresholdFilter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.FileAppender;
import ch.qos.logback.core.OutputStreamAppender;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Programmatic Logback setup driven by {@link LoggingConfiguration}.
 */
public class LoggingFactory {

  /**
   * Installs WARN+ console logging until the service configuration has been read.
   */
  public static void bootstrap() {
    ConsoleConfiguration console = new ConsoleConfiguration();
    console.setThreshold(Level.WARN.toString());

    Logger root = getCleanRoot();
    root.addAppender(buildConsoleAppender(console, root.getLoggerContext()));
  }

  public static void detachAndStop() {
    Logger root = (Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
    root.detachAndStopAllAppenders();
  }

  private final LoggingConfiguration config;
  private final String name;

  public LoggingFactory(LoggingConfiguration config, String name) {
    this.config = config;
    this.name = name;
  }

  public void configure() {
    Logger root = configureLevels();
    LoggerContext context = root.getLoggerContext();
    context.putProperty("service", name);

    ConsoleConfiguration console = config.getConsoleConfiguration();
    if (console.isEnabled()) {
      root.addAppender(wrapAsyncAppender(buildConsoleAppender(console, context)));
    }

    FileConfiguration file = config.getFileConfiguration();
    if (file.isEnabled()) {
      root.addAppender(wrapAsyncAppender(buildFileAppender(file, context)));
    }
  }

  private Logger configureLevels() {
    Logger root = (Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
    root.getLoggerContext().reset();
    root.setLevel(Level.toLevel(config.getLevel(), Level.INFO));

    for (Map.Entry<String, String> entry : config.getLoggers().entrySet()) {
      ((Logger) LoggerFactory.getLogger(entry.getKey())).setLevel(Level.toLevel(entry.getValue(), Level.INFO));
    }

    return root;
  }

  private static ConsoleAppender<ILoggingEvent> buildConsoleAppender(ConsoleConfiguration console,
                                                                    LoggerContext context) {
    ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
    appender.setName("console");
    return start(appender, context, console.getThreshold(), console.getLogFormat());
  }

  private static FileAppender<ILoggingEvent> buildFileAppender(FileConfiguration file, LoggerContext context) {
    FileAppender<ILoggingEvent> appender = new FileAppender<>();
    appender.setName("file");
    appender.setAppend(true);
    appender.setFile(file.getCurrentLogFilename());
    return start(appender, context, file.getThreshold(), file.getLogFormat());
  }

  private static <A extends OutputStreamAppender<ILoggingEvent>> A start(A appender, LoggerContext context,
                                                                        String threshold, String logFormat) {
    appender.setContext(context);

    PatternLayoutEncoder encoder = new PatternLayoutEncoder();
    encoder.setContext(context);
    encoder.setPattern(logFormat);
    encoder.start();
    appender.setEncoder(encoder);

    ThresholdFilter filter = new ThresholdFilter();
    filter.setContext(context);
    filter.setLevel(threshold);
    filter.start();
    appender.addFilter(filter);

    appender.start();
    return appender;
  }

  private static Logger getCleanRoot() {
    Logger root = (Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
    root.detachAndStopAllAppenders();
    return root;
  }

  private static Appender<ILoggingEvent> wrapAsyncAppender(Appender<ILoggingEvent> appender) {
    AsyncAppender asyncAppender = new AsyncAppender();
    asyncAppender.setContext(appender.getContext());
    asyncAppender.addAppender(appender);
    asyncAppender.start();
    return asyncAppender;
  }
}
