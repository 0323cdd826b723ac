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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.common.base.Strings;

import java.util.HashMap;
import java.util.Map;

/**
 * Metadata shared by every record kept in a {@link ResourceStore}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class ResourceDocument {

  private static final ObjectMapper mapper = new ObjectMapper()
      .configure(SerializationFeature.INDENT_OUTPUT, true);

  /**
   * Name of the resource, unique per kind and namespace. Assigned by the store when {@link #generateName} is
   * used instead.
   */
  public String name;

  /**
   * Namespace of the resource. Empty for cluster scoped kinds.
   */
  public String namespace;

  /**
   * Prefix the store appends a random suffix to when {@link #name} is not set on create.
   */
  public String generateName;

  public Map<String, String> labels = new HashMap<>();

  /**
   * Unique id assigned by the store on create. A resource recreated under the same name gets a new uid.
   */
  public String uid;

  /**
   * Version assigned by the store on every mutation, used for optimistic updates.
   */
  public long resourceVersion;

  public String getLabel(String key) {
    return labels == null ? null : labels.get(key);
  }

  public String getNamespace() {
    return Strings.nullToEmpty(namespace);
  }

  public void copyTo(ResourceDocument target) {
    target.name = this.name;
    target.namespace = this.namespace;
    target.generateName = this.generateName;
    target.labels = this.labels == null ? new HashMap<>() : new HashMap<>(this.labels);
    target.uid = this.uid;
    target.resourceVersion = this.resourceVersion;
  }

  /**
   * Returns a deep copy of the document.
   */
  @SuppressWarnings("unchecked")
  public static <T extends ResourceDocument> T clone(T document) {
    return (T) mapper.convertValue(document, document.getClass());
  }

  /**
   * Renders the document for log output.
   */
  public static String toJson(ResourceDocument document) {
    try {
      return mapper.writeValueAsString(document);
    } catch (JsonProcessingException e) {
      return document.toString();
    }
  }

  @Override
  public String toString() {
    return String.format("%s{namespace=%s, name=%s, version=%d}", getClass().getSimpleName(), getNamespace(), name,
        resourceVersion);
  }
}
