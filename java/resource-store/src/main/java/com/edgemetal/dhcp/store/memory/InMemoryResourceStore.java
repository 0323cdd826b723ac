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

package com.edgemetal.dhcp.store.memory;

import com.edgemetal.dhcp.store.LabelSelector;
import com.edgemetal.dhcp.store.ResourceDocument;
import com.edgemetal.dhcp.store.ResourceStore;
import com.edgemetal.dhcp.store.ResourceWatcher;
import com.edgemetal.dhcp.store.Subscription;
import com.edgemetal.dhcp.store.WatchEvent;
import com.edgemetal.dhcp.store.exceptions.ResourceAlreadyExistsException;
import com.edgemetal.dhcp.store.exceptions.ResourceConflictException;
import com.edgemetal.dhcp.store.exceptions.ResourceNotFoundException;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Consumer;

/**
 * {@link ResourceStore} kept in process memory.
 * <p>
 * Mutations are serialized under one lock. Watch events are delivered on the mutating thread after the lock has
 * been released.
 */
public class InMemoryResourceStore implements ResourceStore {

  private static final Logger logger = LoggerFactory.getLogger(InMemoryResourceStore.class);

  private static final String NAME_SUFFIX_ALPHABET = "bcdfghjklmnpqrstvwxz2456789";

  private static final int NAME_SUFFIX_LENGTH = 5;

  private final Object lock = new Object();

  private final Map<String, ResourceDocument> documents = new HashMap<>();

  private final Map<String, List<ResourceWatcher<?>>> watchers = new HashMap<>();

  private final List<KindWatcher<?>> kindWatchers = new CopyOnWriteArrayList<>();

  private long lastVersion = 0;

  @Override
  public <T extends ResourceDocument> T get(Class<T> documentType, String namespace, String name)
      throws ResourceNotFoundException {
    synchronized (lock) {
      ResourceDocument stored = documents.get(key(documentType, namespace, name));
      if (stored == null) {
        throw notFound(documentType, namespace, name);
      }
      return documentType.cast(ResourceDocument.clone(stored));
    }
  }

  @Override
  public <T extends ResourceDocument> List<T> list(Class<T> documentType, String namespace, LabelSelector selector) {
    String prefix = namespace == null
        ? documentType.getSimpleName() + "/"
        : documentType.getSimpleName() + "/" + namespace + "/";
    List<T> result = new ArrayList<>();
    synchronized (lock) {
      for (Map.Entry<String, ResourceDocument> entry : documents.entrySet()) {
        if (entry.getKey().startsWith(prefix) && selector.matches(entry.getValue().labels)) {
          result.add(documentType.cast(ResourceDocument.clone(entry.getValue())));
        }
      }
    }
    result.sort(Comparator.comparing((T document) -> document.name));
    return result;
  }

  @Override
  public <T extends ResourceDocument> T create(T document) throws ResourceAlreadyExistsException {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(document.name) || !Strings.isNullOrEmpty(document.generateName),
        "either name or generateName must be set");

    T stored = ResourceDocument.clone(document);
    synchronized (lock) {
      if (Strings.isNullOrEmpty(stored.name)) {
        do {
          stored.name = stored.generateName + randomSuffix();
        } while (documents.containsKey(key(stored)));
      } else if (documents.containsKey(key(stored))) {
        throw new ResourceAlreadyExistsException(
            String.format("%s %s already exists", stored.getClass().getSimpleName(), path(stored)));
      }

      stored.uid = UUID.randomUUID().toString();
      stored.resourceVersion = ++lastVersion;
      documents.put(key(stored), stored);
    }

    logger.debug("Created {}", ResourceDocument.toJson(stored));
    notifyWatchers(WatchEvent.Type.ADDED, stored);
    return ResourceDocument.clone(stored);
  }

  @Override
  public <T extends ResourceDocument> T update(T document)
      throws ResourceNotFoundException, ResourceConflictException {
    T stored = ResourceDocument.clone(document);
    synchronized (lock) {
      ResourceDocument current = documents.get(key(stored));
      if (current == null) {
        throw notFound(stored.getClass(), stored.namespace, stored.name);
      }
      if (current.resourceVersion != stored.resourceVersion) {
        throw new ResourceConflictException(String.format("%s %s was modified (version %d, expected %d)",
            stored.getClass().getSimpleName(), path(stored), current.resourceVersion, stored.resourceVersion));
      }

      stored.uid = current.uid;
      stored.resourceVersion = ++lastVersion;
      documents.put(key(stored), stored);
    }

    logger.debug("Updated {}", ResourceDocument.toJson(stored));
    notifyWatchers(WatchEvent.Type.MODIFIED, stored);
    return ResourceDocument.clone(stored);
  }

  @Override
  public <T extends ResourceDocument> T patch(Class<T> documentType, String namespace, String name,
                                              Consumer<T> mutation) throws ResourceNotFoundException {
    T stored;
    synchronized (lock) {
      ResourceDocument current = documents.get(key(documentType, namespace, name));
      if (current == null) {
        throw notFound(documentType, namespace, name);
      }

      stored = documentType.cast(ResourceDocument.clone(current));
      mutation.accept(stored);
      // identity is not patchable
      stored.name = current.name;
      stored.namespace = current.namespace;
      stored.uid = current.uid;
      stored.resourceVersion = ++lastVersion;
      documents.put(key(stored), stored);
    }

    logger.debug("Patched {}", ResourceDocument.toJson(stored));
    notifyWatchers(WatchEvent.Type.MODIFIED, stored);
    return ResourceDocument.clone(stored);
  }

  @Override
  public void delete(Class<? extends ResourceDocument> documentType, String namespace, String name)
      throws ResourceNotFoundException {
    try {
      delete(documentType, namespace, name, null);
    } catch (ResourceConflictException e) {
      throw new IllegalStateException("Unconditional delete of " + name + " reported a conflict", e);
    }
  }

  @Override
  public void delete(Class<? extends ResourceDocument> documentType, String namespace, String name, String uid)
      throws ResourceNotFoundException, ResourceConflictException {
    ResourceDocument removed;
    synchronized (lock) {
      String key = key(documentType, namespace, name);
      ResourceDocument stored = documents.get(key);
      if (stored == null) {
        throw notFound(documentType, namespace, name);
      }
      if (uid != null && !uid.equals(stored.uid)) {
        throw new ResourceConflictException(String.format("%s %s has uid %s, expected %s",
            documentType.getSimpleName(), name, stored.uid, uid));
      }
      removed = documents.remove(key);
    }

    logger.debug("Deleted {}", removed);
    notifyWatchers(WatchEvent.Type.DELETED, removed);
  }

  @Override
  public <T extends ResourceDocument> Subscription watch(Class<T> documentType, String namespace, String name,
                                                         ResourceWatcher<T> watcher) {
    final String key = key(documentType, namespace, name);
    synchronized (lock) {
      watchers.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(watcher);
    }

    return () -> {
      synchronized (lock) {
        List<ResourceWatcher<?>> registered = watchers.get(key);
        if (registered != null) {
          registered.remove(watcher);
          if (registered.isEmpty()) {
            watchers.remove(key);
          }
        }
      }
    };
  }

  /**
   * Subscribes to changes of every document of a kind. Meant for components standing in for external
   * controllers.
   */
  public <T extends ResourceDocument> Subscription watchAll(Class<T> documentType, ResourceWatcher<T> watcher) {
    final KindWatcher<T> kindWatcher = new KindWatcher<>(documentType, watcher);
    kindWatchers.add(kindWatcher);
    return () -> kindWatchers.remove(kindWatcher);
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  private void notifyWatchers(WatchEvent.Type type, ResourceDocument document) {
    List<ResourceWatcher<?>> registered;
    synchronized (lock) {
      List<ResourceWatcher<?>> current = watchers.get(key(document));
      registered = current == null ? new ArrayList<>() : new ArrayList<>(current);
    }

    for (ResourceWatcher watcher : registered) {
      watcher.onEvent(new WatchEvent(type, ResourceDocument.clone(document)));
    }

    for (KindWatcher<?> kindWatcher : kindWatchers) {
      if (kindWatcher.documentType.isInstance(document)) {
        ((ResourceWatcher) kindWatcher.watcher).onEvent(new WatchEvent(type, ResourceDocument.clone(document)));
      }
    }
  }

  private static String randomSuffix() {
    StringBuilder suffix = new StringBuilder(NAME_SUFFIX_LENGTH);
    for (int i = 0; i < NAME_SUFFIX_LENGTH; i++) {
      suffix.append(NAME_SUFFIX_ALPHABET.charAt(ThreadLocalRandom.current().nextInt(NAME_SUFFIX_ALPHABET.length())));
    }
    return suffix.toString();
  }

  private static String key(ResourceDocument document) {
    return key(document.getClass(), document.namespace, document.name);
  }

  private static String key(Class<?> documentType, String namespace, String name) {
    return documentType.getSimpleName() + "/" + Strings.nullToEmpty(namespace) + "/" + name;
  }

  private static String path(ResourceDocument document) {
    return Strings.isNullOrEmpty(document.namespace) ? document.name : document.namespace + "/" + document.name;
  }

  private static ResourceNotFoundException notFound(Class<?> documentType, String namespace, String name) {
    String path = Strings.isNullOrEmpty(namespace) ? name : namespace + "/" + name;
    return new ResourceNotFoundException(String.format("%s %s not found", documentType.getSimpleName(), path));
  }

  private static class KindWatcher<T extends ResourceDocument> {
    private final Class<T> documentType;
    private final ResourceWatcher<T> watcher;

    private KindWatcher(Class<T> documentType, ResourceWatcher<T> watcher) {
      this.documentType = documentType;
      this.watcher = watcher;
    }
  }
}
