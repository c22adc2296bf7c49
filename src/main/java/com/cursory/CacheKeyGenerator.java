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

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Derives a {@link CacheKey} from a construct tree.
 * <p>
 * Each node contributes {@code [id, nodeClass, attributeName, attributeKey, ...]}, where {@code id} comes from an
 * {@link AnonMap} scoped to one generation. A node seen a second time contributes only {@code [id, nodeClass]}, so
 * shared subtrees and cycles terminate. Attributes which are {@code null} or empty collections are omitted.
 * <p>
 * If any node has no {@link TraversalSpec}, or declares an attribute of kind
 * {@link VisitationKind#UNKNOWN_STRUCTURE}, the whole tree is uncacheable and {@link #generate(Traversable)} returns
 * empty.
 *
 * @since 1.0.0
 */
@ThreadSafe
public class CacheKeyGenerator {
	@NonNull
	private static final Comparator<Object> CHILD_KEY_ORDERING = Comparator.comparing(String::valueOf);

	@NonNull
	private final Map<VisitationKind, AttributeKeyFunction> attributeKeyFunctions;

	public CacheKeyGenerator() {
		Map<VisitationKind, AttributeKeyFunction> attributeKeyFunctions = new EnumMap<>(VisitationKind.class);
		attributeKeyFunctions.put(VisitationKind.NODE, this::childNodeKey);
		attributeKeyFunctions.put(VisitationKind.NODE_LIST, this::nodeListKey);
		attributeKeyFunctions.put(VisitationKind.NODE_TUPLES, this::nodeTuplesKey);
		attributeKeyFunctions.put(VisitationKind.PLAIN_VALUE, this::plainValueKey);
		attributeKeyFunctions.put(VisitationKind.TYPE, this::typeKey);
		attributeKeyFunctions.put(VisitationKind.ANON_NAME, this::anonNameKey);
		attributeKeyFunctions.put(VisitationKind.UNORDERED_NODE_SET, this::unorderedNodeSetKey);
		attributeKeyFunctions.put(VisitationKind.PLAIN_MAP, this::plainMapKey);
		attributeKeyFunctions.put(VisitationKind.STRING_NODE_MAP, this::stringNodeMapKey);
		attributeKeyFunctions.put(VisitationKind.BOUND_VALUE, this::boundValueKey);
		attributeKeyFunctions.put(VisitationKind.UNKNOWN_STRUCTURE, this::unknownStructureKey);

		for (VisitationKind visitationKind : VisitationKind.values())
			if (!attributeKeyFunctions.containsKey(visitationKind))
				throw new IllegalStateException(format("No cache key handling for %s.%s",
						VisitationKind.class.getSimpleName(), visitationKind.name()));

		this.attributeKeyFunctions = Collections.unmodifiableMap(attributeKeyFunctions);
	}

	/**
	 * Generates a cache key for {@code node}.
	 *
	 * @param node the root of the construct tree
	 * @return the cache key, or empty if the tree is uncacheable
	 */
	@NonNull
	public Optional<CacheKey> generate(@NonNull Traversable node) {
		requireNonNull(node);

		AnonMap anonMap = new AnonMap();
		List<BindParameter> bindParameters = new ArrayList<>();
		List<Object> key = nodeKey(node, anonMap, bindParameters);

		if (anonMap.isUncacheable())
			return Optional.empty();

		return Optional.of(new CacheKey(key, bindParameters));
	}

	@NonNull
	protected List<Object> nodeKey(@NonNull Traversable node,
																 @NonNull AnonMap anonMap,
																 @NonNull List<BindParameter> bindParameters) {
		requireNonNull(node);
		requireNonNull(anonMap);
		requireNonNull(bindParameters);

		if (anonMap.contains(node))
			return List.of(anonMap.idFor(node), node.getClass());

		String id = anonMap.idFor(node);
		TraversalSpec<?> traversalSpec = node.getTraversalSpec().orElse(null);

		if (traversalSpec == null) {
			anonMap.markUncacheable();
			return List.of();
		}

		List<Object> key = new ArrayList<>(2 + traversalSpec.getEntries().size() * 2);
		key.add(id);
		key.add(node.getClass());

		for (TraversalEntry<?> entry : traversalSpec.getEntries()) {
			Object value = entry.valueFrom(node);

			if (entry.getVisitationKind() == VisitationKind.BOUND_VALUE) {
				if (node instanceof BindParameter)
					bindParameters.add((BindParameter) node);

				continue;
			}

			if (value == null)
				continue;

			Object attributeKey = this.attributeKeyFunctions.get(entry.getVisitationKind())
					.keyFor(value, anonMap, bindParameters);

			if (attributeKey == null)
				continue;

			key.add(entry.getAttributeName());
			key.add(attributeKey);
		}

		return Collections.unmodifiableList(key);
	}

	@Nullable
	private Object childNodeKey(@NonNull Object value,
															@NonNull AnonMap anonMap,
															@NonNull List<BindParameter> bindParameters) {
		return nodeKey(asNode(value), anonMap, bindParameters);
	}

	@Nullable
	private Object nodeListKey(@NonNull Object value,
														 @NonNull AnonMap anonMap,
														 @NonNull List<BindParameter> bindParameters) {
		Collection<?> nodes = asCollection(value);

		if (nodes.isEmpty())
			return null;

		List<Object> keys = new ArrayList<>(nodes.size());

		for (Object node : nodes)
			keys.add(nodeKey(asNode(node), anonMap, bindParameters));

		return Collections.unmodifiableList(keys);
	}

	@Nullable
	private Object nodeTuplesKey(@NonNull Object value,
															 @NonNull AnonMap anonMap,
															 @NonNull List<BindParameter> bindParameters) {
		Collection<?> tuples = asCollection(value);

		if (tuples.isEmpty())
			return null;

		List<Object> keys = new ArrayList<>(tuples.size());

		for (Object tuple : tuples) {
			List<Object> tupleKeys = new ArrayList<>();

			for (Object node : asCollection(tuple))
				tupleKeys.add(nodeKey(asNode(node), anonMap, bindParameters));

			keys.add(Collections.unmodifiableList(tupleKeys));
		}

		return Collections.unmodifiableList(keys);
	}

	@Nullable
	private Object plainValueKey(@NonNull Object value,
															 @NonNull AnonMap anonMap,
															 @NonNull List<BindParameter> bindParameters) {
		if (value instanceof Collection)
			return Collections.unmodifiableList(new ArrayList<>((Collection<?>) value));

		return value;
	}

	@Nullable
	private Object typeKey(@NonNull Object value,
												 @NonNull AnonMap anonMap,
												 @NonNull List<BindParameter> bindParameters) {
		if (!(value instanceof TypeDescriptor))
			throw new IllegalArgumentException(format("Expected a %s but got %s", TypeDescriptor.class.getSimpleName(), value));

		return ((TypeDescriptor) value).getStaticCacheKey();
	}

	@Nullable
	private Object anonNameKey(@NonNull Object value,
														 @NonNull AnonMap anonMap,
														 @NonNull List<BindParameter> bindParameters) {
		if (value instanceof AnonymousName)
			return ((AnonymousName) value).apply(anonMap);

		return value;
	}

	@Nullable
	private Object unorderedNodeSetKey(@NonNull Object value,
																		 @NonNull AnonMap anonMap,
																		 @NonNull List<BindParameter> bindParameters) {
		Collection<?> nodes = asCollection(value);

		if (nodes.isEmpty())
			return null;

		List<Object> keys = new ArrayList<>(nodes.size());

		for (Object node : nodes)
			keys.add(nodeKey(asNode(node), anonMap, bindParameters));

		keys.sort(CHILD_KEY_ORDERING);
		return Collections.unmodifiableList(keys);
	}

	@Nullable
	private Object plainMapKey(@NonNull Object value,
														 @NonNull AnonMap anonMap,
														 @NonNull List<BindParameter> bindParameters) {
		Map<?, ?> map = asMap(value);

		if (map.isEmpty())
			return null;

		List<Object> keys = new ArrayList<>(map.size());

		for (Map.Entry<?, ?> entry : map.entrySet())
			keys.add(Collections.unmodifiableList(Arrays.asList(entry.getKey(), entry.getValue())));

		keys.sort(CHILD_KEY_ORDERING);
		return Collections.unmodifiableList(keys);
	}

	@Nullable
	private Object stringNodeMapKey(@NonNull Object value,
																	@NonNull AnonMap anonMap,
																	@NonNull List<BindParameter> bindParameters) {
		Map<?, ?> map = asMap(value);

		if (map.isEmpty())
			return null;

		List<String> names = new ArrayList<>(map.size());

		for (Object name : map.keySet())
			names.add((String) name);

		Collections.sort(names);

		List<Object> keys = new ArrayList<>(map.size());

		for (String name : names)
			keys.add(List.of(name, nodeKey(asNode(map.get(name)), anonMap, bindParameters)));

		return Collections.unmodifiableList(keys);
	}

	@Nullable
	private Object boundValueKey(@NonNull Object value,
															 @NonNull AnonMap anonMap,
															 @NonNull List<BindParameter> bindParameters) {
		// Handled in nodeKey, since the owning node is what gets collected
		return null;
	}

	@Nullable
	private Object unknownStructureKey(@NonNull Object value,
																		 @NonNull AnonMap anonMap,
																		 @NonNull List<BindParameter> bindParameters) {
		anonMap.markUncacheable();
		return null;
	}

	@NonNull
	private static Traversable asNode(@Nullable Object value) {
		if (!(value instanceof Traversable))
			throw new IllegalArgumentException(format("Expected a %s but got %s", Traversable.class.getSimpleName(), value));

		return (Traversable) value;
	}

	@NonNull
	private static Collection<?> asCollection(@NonNull Object value) {
		if (!(value instanceof Collection))
			throw new IllegalArgumentException(format("Expected a collection but got %s", value));

		return (Collection<?>) value;
	}

	@NonNull
	private static Map<?, ?> asMap(@NonNull Object value) {
		if (!(value instanceof Map))
			throw new IllegalArgumentException(format("Expected a map but got %s", value));

		return (Map<?, ?>) value;
	}

	@FunctionalInterface
	private interface AttributeKeyFunction {
		@Nullable
		Object keyFor(@NonNull Object value,
									@NonNull AnonMap anonMap,
									@NonNull List<BindParameter> bindParameters);
	}
}
