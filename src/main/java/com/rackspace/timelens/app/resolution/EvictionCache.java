/*
 * Copyright 2020 Rackspace US, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.rackspace.timelens.app.resolution;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;

/**
 * Fixed-capacity least-recently-used map. Both {@link #get(Object)} and {@link #put(Object, Object)}
 * count as an access; {@link #has(Object)} does not. Entries are evicted whole, one per insert.
 * <p>
 * Not thread-safe: owners confine access to a single thread.
 * </p>
 */
public class EvictionCache<K, V> {

  private final LinkedHashMap<K, V> entries;
  @Getter
  private final int capacity;

  public EvictionCache(int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("Capacity must be at least 1, was " + capacity);
    }
    this.capacity = capacity;
    // access ordered, eldest entry is the least recently used
    this.entries = new LinkedHashMap<>(capacity, 0.75f, true);
  }

  /**
   * @return the cached value, promoted to most-recently-used, or null when absent
   */
  public V get(K key) {
    return entries.get(key);
  }

  /**
   * Inserts or refreshes the entry.
   *
   * @return the key that was evicted to make room, or null
   */
  public K put(K key, V value) {
    K evicted = null;
    if (!entries.containsKey(key) && entries.size() >= capacity) {
      final Iterator<K> eldest = entries.keySet().iterator();
      evicted = eldest.next();
      eldest.remove();
    }
    entries.put(key, value);

    if (entries.size() > capacity) {
      throw new CacheCorruptionException(
          String.format("Eviction cache holds %d entries, capacity is %d", entries.size(), capacity));
    }
    return evicted;
  }

  public boolean has(K key) {
    return entries.containsKey(key);
  }

  public V remove(K key) {
    return entries.remove(key);
  }

  public void clear() {
    entries.clear();
  }

  public int size() {
    return entries.size();
  }

  /**
   * @return keys ordered from least to most recently used
   */
  public List<K> keys() {
    return Collections.unmodifiableList(new ArrayList<>(entries.keySet()));
  }

  /**
   * Read-only view of the values that does not affect recency.
   */
  public Collection<V> values() {
    return Collections.unmodifiableCollection(entries.values());
  }

  public Map<K, V> snapshot() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(entries));
  }
}
