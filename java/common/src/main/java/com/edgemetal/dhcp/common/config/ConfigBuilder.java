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

package com.edgemetal.dhcp.common.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.google.common.base.Joiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.validation.ConstraintViolation;
import javax.validation.Validation;
import javax.validation.Validator;
import javax.validation.ValidatorFactory;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * ConfigBuilder parses and validates a YAML config file into a config bean.
 * <p>
 * Used both for the responder service configuration and for the per-plugin configuration files
 * named in the plugin arguments.
 *
 * @param <T> the config bean type.
 */
public class ConfigBuilder<T> {

  private static final Logger logger = LoggerFactory.getLogger(ConfigBuilder.class);

  private static final ObjectMapper mapper = new ObjectMapper(new YAMLFactory())
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

  private static final ValidatorFactory validatorFactory = Validation.buildDefaultValidatorFactory();

  private final Class<T> configClass;
  private final File configFile;
  private T config = null;

  private ConfigBuilder(Class<T> configClass, File configFile) {
    this.configClass = configClass;
    this.configFile = configFile;
  }

  /**
   * Builds the config bean by parsing the config file and then running any validations.
   *
   * @param configClass config bean class for initialization.
   * @param configFile  path to the YAML encoded config file.
   * @param <T>         the config bean type.
   * @return validated config.
   * @throws BadConfigException if the config was invalid.
   */
  public static <T> T build(Class<T> configClass, String configFile) throws BadConfigException {
    if (configFile == null || configFile.isEmpty()) {
      throw new BadConfigException("No configuration file given for " + configClass.getSimpleName());
    }
    ConfigBuilder<T> builder = new ConfigBuilder<>(configClass, new File(configFile));
    builder.parse();
    validate(builder.config);
    return builder.config;
  }

  /**
   * Runs bean validation over an already constructed config bean.
   *
   * @param config config bean.
   * @param <T>    the config bean type.
   * @throws BadConfigException if any constraint is violated.
   */
  public static <T> void validate(T config) throws BadConfigException {
    if (config == null) {
      throw new BadConfigException("Configuration is empty");
    }

    Validator validator = validatorFactory.getValidator();
    Set<ConstraintViolation<T>> violations = validator.validate(config);

    if (!violations.isEmpty()) {
      List<String> errors = new ArrayList<>();
      for (ConstraintViolation<T> violation : violations) {
        String error = String.format("\t%s %s (was %s)", violation.getPropertyPath(), violation.getMessage(),
            violation.getInvalidValue());
        errors.add(error);
      }
      // violation order is not stable across runs
      Collections.sort(errors);
      errors.add(0, "Configuration is not valid:");
      throw new BadConfigException(Joiner.on("\n").join(errors));
    }
  }

  private void parse() throws BadConfigException {
    logger.debug("Loading {} from {}", configClass.getSimpleName(), configFile);
    try {
      config = mapper.readValue(configFile, configClass);
    } catch (FileNotFoundException e) {
      throw new BadConfigException("Could not find configuration file: " + configFile);
    } catch (JsonProcessingException e) {
      throw new BadConfigException("Could not parse configuration " + configFile + ": " + e.getOriginalMessage(), e);
    } catch (IOException e) {
      throw new BadConfigException("Could not read configuration file " + configFile + ": " + e.getMessage(), e);
    }
  }
}
