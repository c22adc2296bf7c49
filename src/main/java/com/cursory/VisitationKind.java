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

/**
 * How an attribute of a {@link Traversable} node is folded into a cache key and compared structurally.
 *
 * @since 1.0.0
 */
public enum VisitationKind {
	/**
	 * A single child node.
	 */
	NODE,
	/**
	 * An ordered list of child nodes.
	 */
	NODE_LIST,
	/**
	 * An ordered list of ordered node tuples, e.g. the {@code WHEN}/{@code THEN} pairs of a {@code CASE}.
	 */
	NODE_TUPLES,
	/**
	 * A plain immutable value (string, number, enum constant) which is embedded in the key as-is.
	 */
	PLAIN_VALUE,
	/**
	 * A {@link TypeDescriptor}, which contributes its static cache key.
	 */
	TYPE,
	/**
	 * A name which is either a plain string or an {@link AnonymousName}.
	 */
	ANON_NAME,
	/**
	 * A set of child nodes without meaningful order.
	 */
	UNORDERED_NODE_SET,
	/**
	 * A map of plain keys to plain values.
	 */
	PLAIN_MAP,
	/**
	 * A map of string keys to child nodes.
	 */
	STRING_NODE_MAP,
	/**
	 * A literal value bound at execution time; it is never embedded in the key.
	 */
	BOUND_VALUE,
	/**
	 * Something the generator cannot describe; a node carrying one is uncacheable.
	 */
	UNKNOWN_STRUCTURE
}
