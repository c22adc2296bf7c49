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

import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.NotThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The ordered list of attributes that make up a node's structure.
 * <p>
 * Specs are declared once per node class and shared by all of its instances, for example:
 * <pre>{@code
 * private static final TraversalSpec<Label> TRAVERSAL_SPEC = TraversalSpec.forType(Label.class)
 *     .add("name", VisitationKind.ANON_NAME, Label::getNameForTraversal)
 *     .add("type", VisitationKind.TYPE, Label::getType)
 *     .add("element", VisitationKind.NODE, Label::getElement)
 *     .build();
 * }</pre>
 *
 * @param <T> the node type this spec describes
 * @since 1.0.0
 */
@Immutable
public final class TraversalSpec<T extends Traversable> {
	@NonNull
	private final List<TraversalEntry<T>> entries;

	private TraversalSpec(@NonNull Builder<T> builder) {
		requireNonNull(builder);
		this.entries = Collections.unmodifiableList(new ArrayList<>(builder.entries));
	}

	@NonNull
	public static <T extends Traversable> Builder<T> forType(@NonNull Class<T> nodeType) {
		requireNonNull(nodeType);
		return new Builder<>();
	}

	@NonNull
	public List<TraversalEntry<T>> getEntries() {
		return this.entries;
	}

	@Override
	public String toString() {
		return format("%s{entries=%s}", getClass().getSimpleName(), getEntries().stream()
				.map(entry -> format("%s:%s", entry.getAttributeName(), entry.getVisitationKind()))
				.collect(Collectors.joining(", ")));
	}

	/**
	 * Builder used to construct instances of {@link TraversalSpec}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder<T extends Traversable> {
		@NonNull
		private final List<TraversalEntry<T>> entries;
		@NonNull
		private final Set<String> attributeNames;

		private Builder() {
			this.entries = new ArrayList<>();
			this.attributeNames = new HashSet<>();
		}

		@NonNull
		public Builder<T> add(@NonNull String attributeName,
													@NonNull VisitationKind visitationKind,
													@NonNull Function<T, ?> accessor) {
			requireNonNull(attributeName);
			requireNonNull(visitationKind);
			requireNonNull(accessor);

			if (!this.attributeNames.add(attributeName))
				throw new IllegalArgumentException(format("Attribute '%s' was already declared", attributeName));

			this.entries.add(new TraversalEntry<>(attributeName, visitationKind, accessor));
			return this;
		}

		@NonNull
		public TraversalSpec<T> build() {
			return new TraversalSpec<>(this);
		}
	}
}
