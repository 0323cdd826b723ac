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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableMap;

import javax.validation.Valid;
import javax.validation.constraints.AssertTrue;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Pattern;

import java.util.Map;

/**
 * Configuration parameters for logging.
 */
@SuppressWarnings("UnusedDeclaration")
public class LoggingConfiguration {

  static final String LEVEL_PATTERN = "(?i)ALL|TRACE|DEBUG|INFO|WARN|ERROR|OFF";

  static final String DEFAULT_LOG_FORMAT =
      "%-5level [%d{ISO8601}] [%thread]%X{request} %logger{36}: %message%n%xException";

  /**
   * Configuration params for logging outputs that go to console out.
   */
  public static class ConsoleConfiguration {
    @JsonProperty
    private boolean enabled = true;

    @NotNull
    @Pattern(regexp = LEVEL_PATTERN)
    @JsonProperty
    private String threshold = "ALL";

    @JsonProperty
    private String logFormat;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getThreshold() {
      return threshold;
    }

    public void setThreshold(String threshold) {
      this.threshold = threshold;
    }

    public String getLogFormat() {
      return logFormat != null ? logFormat : DEFAULT_LOG_FORMAT;
    }

    public void setLogFormat(String logFormat) {
      this.logFormat = logFormat;
    }
  }

  /**
   * Configuration params for logging outputs that go to a file.
   */
  public static class FileConfiguration {
    @JsonProperty
    private boolean enabled = false;

    @NotNull
    @Pattern(regexp = LEVEL_PATTERN)
    @JsonProperty
    private String threshold = "ALL";

    @JsonProperty
    private String currentLogFilename;

    @JsonProperty
    private String logFormat;

    @AssertTrue(message = "must have logging.file.currentLogFilename if logging.file.enabled is true")
    public boolean isConfigured() {
      return !enabled || (currentLogFilename != null);
    }

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getThreshold() {
      return threshold;
    }

    public void setThreshold(String threshold) {
      this.threshold = threshold;
    }

    public String getCurrentLogFilename() {
      return currentLogFilename;
    }

    public void setCurrentLogFilename(String filename) {
      this.currentLogFilename = filename;
    }

    public String getLogFormat() {
      return logFormat != null ? logFormat : DEFAULT_LOG_FORMAT;
    }

    public void setLogFormat(String logFormat) {
      this.logFormat = logFormat;
    }
  }

  @NotNull
  @Pattern(regexp = LEVEL_PATTERN)
  @JsonProperty
  private String level = "INFO";

  @NotNull
  @JsonProperty
  private ImmutableMap<String, String> loggers = ImmutableMap.of();

  @Valid
  @NotNull
  @JsonProperty
  private ConsoleConfiguration console = new ConsoleConfiguration();

  @Valid
  @NotNull
  @JsonProperty
  private FileConfiguration file = new FileConfiguration();

  public String getLevel() {
    return level;
  }

  public void setLevel(String level) {
    this.level = level;
  }

  public ImmutableMap<String, String> getLoggers() {
    return loggers;
  }

  public void setLoggers(Map<String, String> loggers) {
    this.loggers = ImmutableMap.copyOf(loggers);
  }

  public ConsoleConfiguration getConsoleConfiguration() {
    return console;
  }

  public void setConsoleConfiguration(ConsoleConfiguration config) {
    this.console = config;
  }

  public FileConfiguration getFileConfiguration() {
    return file;
  }

  public void setFileConfiguration(FileConfiguration config) {
    this.file = config;
  }
}
