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
import com.edgemetal.dhcp.store.Subscription;
import com.edgemetal.dhcp.store.WatchEvent;
import com.edgemetal.dhcp.store.exceptions.ResourceNotFoundException;
import com.edgemetal.dhcp.store.exceptions.StoreException;

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

/**
 * {@link ResourceStateAwaiter} subscribing to change events of the one resource it waits for.
 * <p>
 * The subscription is opened before the current state is read, so a change racing with the read is not lost.
 */
public class WatchingStateAwaiter implements ResourceStateAwaiter {

  private static final Logger logger = LoggerFactory.getLogger(WatchingStateAwaiter.class);

  private final ResourceStore store;

  public WatchingStateAwaiter(ResourceStore store) {
    this.store = Preconditions.checkNotNull(store);
  }

  @Override
  public <T extends ResourceDocument> T awaitState(Class<T> documentType, String namespace, String name,
                                                   Predicate<T> predicate, Duration timeout)
      throws AwaitTimeoutException, StoreException {
    BlockingQueue<WatchEvent<T>> events = new LinkedBlockingQueue<>();
    long deadline = System.nanoTime() + timeout.toNanos();

    try (Subscription subscription = store.watch(documentType, namespace, name, events::add)) {
      try {
        T current = store.get(documentType, namespace, name);
        if (predicate.test(current)) {
          return current;
        }
      } catch (ResourceNotFoundException e) {
        logger.debug("{} {}/{} not visible yet", documentType.getSimpleName(), namespace, name);
      }

      WatchEvent<T> event;
      while ((event = next(events, deadline)) != null) {
        if (event.getType() != WatchEvent.Type.DELETED && predicate.test(event.getDocument())) {
          return event.getDocument();
        }
      }
    }

    String message = String.format("Timed out after %dms watching %s %s/%s", timeout.toMillis(),
        documentType.getSimpleName(), namespace, name);
    logger.warn(message);
    throw new AwaitTimeoutException(message);
  }

  @Override
  public void awaitDeletion(Class<? extends ResourceDocument> documentType, String namespace, String name,
                            String uid, Duration timeout)
      throws AwaitTimeoutException, StoreException {
    awaitDeletionOf(documentType, namespace, name, uid, timeout);
  }

  private <T extends ResourceDocument> void awaitDeletionOf(Class<T> documentType, String namespace, String name,
                                                            String uid, Duration timeout)
      throws AwaitTimeoutException, StoreException {
    BlockingQueue<WatchEvent<T>> events = new LinkedBlockingQueue<>();
    long deadline = System.nanoTime() + timeout.toNanos();

    try (Subscription subscription = store.watch(documentType, namespace, name, events::add)) {
      try {
        T current = store.get(documentType, namespace, name);
        if (isReplacement(current, uid)) {
          return;
        }
      } catch (ResourceNotFoundException e) {
        return;
      }

      WatchEvent<T> event;
      while ((event = next(events, deadline)) != null) {
        if (event.getType() == WatchEvent.Type.DELETED || isReplacement(event.getDocument(), uid)) {
          return;
        }
      }
    }

    String message = String.format("Timed out after %dms waiting for deletion of %s %s/%s", timeout.toMillis(),
        documentType.getSimpleName(), namespace, name);
    logger.warn(message);
    throw new AwaitTimeoutException(message);
  }

  private static boolean isReplacement(ResourceDocument document, String uid) {
    return uid != null && !uid.equals(document.uid);
  }

  private static <E> E next(BlockingQueue<E> events, long deadline) throws StoreException {
    long remaining = deadline - System.nanoTime();
    if (remaining <= 0) {
      return events.poll();
    }
    try {
      return events.poll(remaining, TimeUnit.NANOSECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StoreException("Interrupted while watching resource", e);
    }
  }
}
