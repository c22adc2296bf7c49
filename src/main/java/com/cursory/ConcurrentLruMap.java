/*
 * Copyright 2022-2026 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.cursory;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiConsumer;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * A thread-safe, strictly bounded LRU {@link Map}.
 * <p>
 * Design notes:
 * <ul>
 *   <li>All operations take one coarse lock around an access-ordered {@link LinkedHashMap}.</li>
 *   <li>Reads count as access and move the entry to the most-recently-used end.</li>
 *   <li>Eviction happens on insert, before the lock is released; the listener is invoked after.</li>
 * </ul>
 * <p>
 * Null keys and values are not supported.
 *
 * @param <K> key type
 * @param <V> value type
 * @since 1.0.0
 */
@ThreadSafe
class ConcurrentLruMap<K, V> extends AbstractMap<K, V> {
	// ===================================================================================
	// Core State
	// ===================================================================================

	private final int capacity;
	@NonNull
	private final BiConsumer<K, V> evictionListener;
	@NonNull
	private final ReentrantLock lock;

	/**
	 * Iteration order is least-recently-used first.
	 */
	@GuardedBy("lock")
	@NonNull
	private final LinkedHashMap<K, V> entries;

	// ===================================================================================
	// Constructors
	// ===================================================================================

	public ConcurrentLruMap(int capacity) {
		this(capacity, null);
	}

	public ConcurrentLruMap(int capacity,
													@Nullable BiConsumer<K, V> evictionListener) {
		if (capacity <= 0)
			throw new IllegalArgumentException("Capacity must be greater than zero");

		this.capacity = capacity;
		this.evictionListener = evictionListener != null ? evictionListener : (k, v) -> {};
		this.lock = new ReentrantLock();
		this.entries = new LinkedHashMap<>(16, 0.75f, true);
	}

	// ===================================================================================
	// Map Interface
	// ===================================================================================

	@Override
	public int size() {
		this.lock.lock();

		try {
			return this.entries.size();
		} finally {
			this.lock.unlock();
		}
	}

	@Override
	public boolean containsKey(Object key) {
		this.lock.lock();

		try {
			// Note: does not count as access for LRU purposes
			return this.entries.containsKey(key);
		} finally {
			this.lock.unlock();
		}
	}

	@Override
	@Nullable
	public V get(Object key) {
		this.lock.lock();

		try {
			return this.entries.get(key);
		} finally {
			this.lock.unlock();
		}
	}

	@Override
	@Nullable
	public V put(@NonNull K key,
							 @NonNull V value) {
		requireNonNull(key);
		requireNonNull(value);

		List<Map.Entry<K, V>> evicted;
		V previous;

		this.lock.lock();

		try {
			previous = this.entries.put(key, value);
			evicted = evictIfNecessary();
		} finally {
			this.lock.unlock();
		}

		notifyEvicted(evicted);
		return previous;
	}

	@Override
	@Nullable
	public V putIfAbsent(@NonNull K key,
											 @NonNull V value) {
		requireNonNull(key);
		requireNonNull(value);

		List<Map.Entry<K, V>> evicted;
		V existing;

		this.lock.lock();

		try {
			existing = this.entries.get(key);

			if (existing != null)
				return existing;

			this.entries.put(key, value);
			evicted = evictIfNecessary();
		} finally {
			this.lock.unlock();
		}

		notifyEvicted(evicted);
		return null;
	}

	@Override
	@NonNull
	public V computeIfAbsent(@NonNull K key,
													 @NonNull Function<? super K, ? extends V> mappingFunction) {
		requireNonNull(key);
		requireNonNull(mappingFunction);

		V existing = get(key);

		if (existing != null)
			return existing;

		// Computed outside the lock; a concurrent writer for the same key wins
		V computed = requireNonNull(mappingFunction.apply(key));
		V raced = putIfAbsent(key, computed);
		return raced == null ? computed : raced;
	}

	@Override
	@Nullable
	public V remove(Object key) {
		this.lock.lock();

		try {
			return this.entries.remove(key);
		} finally {
			this.lock.unlock();
		}
	}

	@Override
	public void clear() {
		this.lock.lock();

		try {
			this.entries.clear();
		} finally {
			this.lock.unlock();
		}
	}

	/**
	 * A snapshot of this map's entries, least-recently-used first.
	 *
	 * @return the entries at the time of the call
	 */
	@Override
	@NonNull
	public Set<Map.Entry<K, V>> entrySet() {
		this.lock.lock();

		try {
			Map<K, V> snapshot = new LinkedHashMap<>(this.entries.size());

			for (Map.Entry<K, V> entry : this.entries.entrySet())
				snapshot.put(entry.getKey(), entry.getValue());

			return snapshot.entrySet();
		} finally {
			this.lock.unlock();
		}
	}

	// ===================================================================================
	// LRU Inspection
	// ===================================================================================

	@NonNull
	public List<K> keysInAccessOrder() {
		this.lock.lock();

		try {
			return new ArrayList<>(this.entries.keySet());
		} finally {
			this.lock.unlock();
		}
	}

	public int capacity() {
		return this.capacity;
	}

	// ===================================================================================
	// Eviction
	// ===================================================================================

	@GuardedBy("lock")
	@NonNull
	private List<Map.Entry<K, V>> evictIfNecessary() {
		if (this.entries.size() <= this.capacity)
			return List.of();

		List<Map.Entry<K, V>> evicted = new ArrayList<>(1);

		while (this.entries.size() > this.capacity) {
			Map.Entry<K, V> eldest = this.entries.entrySet().iterator().next();
			evicted.add(new SimpleImmutableEntry<>(eldest.getKey(), eldest.getValue()));
			this.entries.remove(eldest.getKey());
		}

		return evicted;
	}

	private void notifyEvicted(@NonNull List<Map.Entry<K, V>> evicted) {
		for (Map.Entry<K, V> entry : evicted)
			this.evictionListener.accept(entry.getKey(), entry.getValue());
	}
}
