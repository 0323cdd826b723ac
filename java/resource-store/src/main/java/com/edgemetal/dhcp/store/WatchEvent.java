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

/**
 * A change to a watched document, carrying the document as it was after the change (or before a deletion).
 *
 * @param <T> document type.
 */
public class WatchEvent<T extends ResourceDocument> {

  /**
   * Kind of change.
   */
  public enum Type {
    ADDED,
    MODIFIED,
    DELETED
  }

  private final Type type;
  private final T document;

  public WatchEvent(Type type, T document) {
    this.type = type;
    this.document = document;
  }

  public Type getType() {
    return type;
  }

  public T getDocument() {
    return document;
  }

  @Override
  public String toString() {
    return type + " " + document;
  }
}
