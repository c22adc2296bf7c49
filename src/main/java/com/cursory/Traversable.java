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

import java.util.Optional;

/**
 * Contract for construct-tree nodes that can be turned into a {@link CacheKey} and compared structurally.
 * <p>
 * Node identity is object identity: implementations must not override {@link Object#equals(Object)} or
 * {@link Object#hashCode()}, since nodes are used as lookup keys for the columns they declare.
 *
 * @since 1.0.0
 */
public interface Traversable {
	/**
	 * The node's kind name. Two nodes can only be structurally equal if their visit names match.
	 *
	 * @return the visit name, e.g. {@code "column"}
	 */
	@NonNull
	String getVisitName();

	/**
	 * The node's structure, or empty if this node cannot take part in caching.
	 *
	 * @return the traversal spec for this node, if available
	 */
	@NonNull
	Optional<TraversalSpec<?>> getTraversalSpec();
}
