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

import com.edgemetal.dhcp.store.exceptions.ResourceAlreadyExistsException;
import com.edgemetal.dhcp.store.exceptions.ResourceConflictException;
import com.edgemetal.dhcp.store.exceptions.ResourceNotFoundException;
import com.edgemetal.dhcp.store.exceptions.StoreException;

import java.util.List;
import java.util.function.Consumer;

/**
 * API to the store holding subnets, address reservations and endpoints.
 * <p>
 * Documents handed out are copies; mutating them has no effect until they are written back.
 */
public interface ResourceStore {

  <T extends ResourceDocument> T get(Class<T> documentType, String namespace, String name)
      throws ResourceNotFoundException, StoreException;

  /**
   * Lists the documents of a kind in a namespace whose labels match the selector, ordered by name. A null
   * namespace lists across all namespaces.
   */
  <T extends ResourceDocument> List<T> list(Class<T> documentType, String namespace, LabelSelector selector)
      throws StoreException;

  /**
   * Creates a document. When the name is empty a name is generated from {@link ResourceDocument#generateName}.
   *
   * @return the stored document with its uid and resource version assigned
   */
  <T extends ResourceDocument> T create(T document)
      throws ResourceAlreadyExistsException, StoreException;

  /**
   * Replaces a document if its resource version still matches the stored one.
   */
  <T extends ResourceDocument> T update(T document)
      throws ResourceNotFoundException, ResourceConflictException, StoreException;

  /**
   * Applies a mutation to the latest stored version of a document. Last write wins.
   */
  <T extends ResourceDocument> T patch(Class<T> documentType, String namespace, String name, Consumer<T> mutation)
      throws ResourceNotFoundException, StoreException;

  void delete(Class<? extends ResourceDocument> documentType, String namespace, String name)
      throws ResourceNotFoundException, StoreException;

  /**
   * Deletes a document only if it is still the instance with the given uid. A null uid deletes whatever is stored
   * under the name.
   *
   * @throws ResourceConflictException if the name now holds a different instance
   */
  void delete(Class<? extends ResourceDocument> documentType, String namespace, String name, String uid)
      throws ResourceNotFoundException, ResourceConflictException, StoreException;

  /**
   * Subscribes to changes of a single document. Events for mutations that happened before the subscription are
   * not replayed.
   */
  <T extends ResourceDocument> Subscription watch(Class<T> documentType, String namespace, String name,
                                                  ResourceWatcher<T> watcher)
      throws StoreException;
}
