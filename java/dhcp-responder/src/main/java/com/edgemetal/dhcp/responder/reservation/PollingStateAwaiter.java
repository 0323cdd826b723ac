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
import com.edgemetal.dhcp.store.ResourceStore;
import com.edgemetal.dhcp.store.exceptions.ResourceNotFoundException;
import com.edgemetal.dhcp.store.exceptions.StoreException;

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * {@link ResourceStateAwaiter} re-reading the resource at a fixed interval.
 */
public class PollingStateAwaiter implements ResourceStateAwaiter {

  private static final Logger logger = LoggerFactory.getLogger(PollingStateAwaiter.class);

  private final ResourceStore store;
  private final Duration pollInterval;

  public PollingStateAwaiter(ResourceStore store, Duration pollInterval) {
    Preconditions.checkArgument(!pollInterval.isNegative() && !pollInterval.isZero(), "poll interval must be positive");
    this.store = Preconditions.checkNotNull(store);
    this.pollInterval = pollInterval;
  }

  @Override
  public <T extends ResourceDocument> T awaitState(Class<T> documentType, String namespace, String name,
                                                   Predicate<T> predicate, Duration timeout)
      throws AwaitTimeoutException, StoreException {
    long iterations = iterations(timeout);
    for (long i = 0; i < iterations; i++) {
      try {
        T document = store.get(documentType, namespace, name);
        if (predicate.test(document)) {
          return document;
        }
      } catch (ResourceNotFoundException e) {
        logger.debug("{} {}/{} not visible yet", documentType.getSimpleName(), namespace, name);
      }
      if (i < iterations - 1) {
        sleep();
      }
    }

    String message = String.format("Timed out after %dms waiting for %s %s/%s", timeout.toMillis(),
        documentType.getSimpleName(), namespace, name);
    logger.warn(message);
    throw new AwaitTimeoutException(message);
  }

  @Override
  public void awaitDeletion(Class<? extends ResourceDocument> documentType, String namespace, String name,
                            String uid, Duration timeout)
      throws AwaitTimeoutException, StoreException {
    long iterations = iterations(timeout);
    for (long i = 0; i < iterations; i++) {
      try {
        ResourceDocument current = store.get(documentType, namespace, name);
        if (uid != null && !uid.equals(current.uid)) {
          logger.debug("{} {}/{} was replaced by {}", documentType.getSimpleName(), namespace, name, current.uid);
          return;
        }
      } catch (ResourceNotFoundException e) {
        return;
      }
      if (i < iterations - 1) {
        sleep();
      }
    }

    String message = String.format("Timed out after %dms waiting for deletion of %s %s/%s", timeout.toMillis(),
        documentType.getSimpleName(), namespace, name);
    logger.warn(message);
    throw new AwaitTimeoutException(message);
  }

  private long iterations(Duration timeout) {
    return Math.max(1, timeout.toMillis() / pollInterval.toMillis()) + 1;
  }

  private void sleep() throws StoreException {
    try {
      Thread.sleep(pollInterval.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StoreException("Interrupted while waiting for resource", e);
    }
  }
}
