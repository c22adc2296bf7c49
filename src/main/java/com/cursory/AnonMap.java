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

import javax.annotation.concurrent.NotThreadSafe;
import java.util.IdentityHashMap;
import java.util.Map;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Assigns small sequential ids to objects by identity during a single traversal.
 * <p>
 * Two traversals over structurally identical trees assign the same ids in the same order, which is what makes the
 * resulting keys comparable. This class also carries the "uncacheable" flag for the traversal.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public final class AnonMap {
	@NonNull
	private final Map<Object, String> idsByObject;
	private int nextId;
	private boolean uncacheable;

	public AnonMap() {
		this.idsByObject = new IdentityHashMap<>();
	}

	/**
	 * Returns the id for {@code object}, assigning the next one if it has not been seen.
	 *
	 * @param object the object to identify
	 * @return the object's id
	 */
	@NonNull
	public String idFor(@NonNull Object object) {
		requireNonNull(object);
		return this.idsByObject.computeIfAbsent(object, ignored -> String.valueOf(this.nextId++));
	}

	public boolean contains(@NonNull Object object) {
		requireNonNull(object);
		return this.idsByObject.containsKey(object);
	}

	public void markUncacheable() {
		this.uncacheable = true;
	}

	public boolean isUncacheable() {
		return this.uncacheable;
	}

	@Override
	public String toString() {
		return format("%s{size=%d, uncacheable=%s}", getClass().getSimpleName(), this.idsByObject.size(), isUncacheable());
	}
}
