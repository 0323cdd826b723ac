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

package com.edgemetal.dhcp.responder.reservation;

import com.edgemetal.dhcp.store.ResourceDocument;
import com.edgemetal.dhcp.store.exceptions.StoreException;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Blocks until a resource reaches a state or disappears. Implementations never wait past the timeout.
 */
public interface ResourceStateAwaiter {

  /**
   * Waits until the resource exists and satisfies the predicate.
   *
   * @return the resource as it was when the predicate held
   * @throws AwaitTimeoutException if the predicate did not hold within the timeout
   * @throws StoreException        if the store could not be read
   */
  <T extends ResourceDocument> T awaitState(Class<T> documentType, String namespace, String name,
                                            Predicate<T> predicate, Duration timeout)
      throws AwaitTimeoutException, StoreException;

  /**
   * Waits until the instance with the given uid no longer exists. A name that has been taken over by a new
   * instance counts as deleted. A null uid waits for the name to be free.
   *
   * @throws AwaitTimeoutException if the instance still existed at the timeout
   * @throws StoreException        if the store could not be read
   */
  void awaitDeletion(Class<? extends ResourceDocument> documentType, String namespace, String name, String uid,
                     Duration timeout)
      throws AwaitTimeoutException, StoreException;
}
