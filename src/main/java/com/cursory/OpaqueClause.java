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
import java.util.function.Supplier;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A column expression rendered by caller-supplied code. Its structure cannot be inspected, so any statement that
 * contains one cannot be cached.
 *
 * @since 1.0.0
 */
public final class OpaqueClause extends ColumnElement {
	@NonNull
	private static final TraversalSpec<OpaqueClause> TRAVERSAL_SPEC = TraversalSpec.forType(OpaqueClause.class)
			.add("renderer", VisitationKind.UNKNOWN_STRUCTURE, OpaqueClause::getRenderer)
			.build();

	@NonNull
	private final Supplier<String> renderer;
	@NonNull
	private final TypeDescriptor type;

	public OpaqueClause(@NonNull Supplier<String> renderer,
											@NonNull TypeDescriptor type) {
		this.renderer = requireNonNull(renderer);
		this.type = requireNonNull(type);
	}

	@NonNull
	public Supplier<String> getRenderer() {
		return this.renderer;
	}

	@Override
	@NonNull
	public TypeDescriptor getType() {
		return this.type;
	}

	@Override
	@NonNull
	public String getVisitName() {
		return "opaque";
	}

	@Override
	@NonNull
	public Optional<TraversalSpec<?>> getTraversalSpec() {
		return Optional.of(TRAVERSAL_SPEC);
	}

	@Override
	public String toString() {
		return format("%s{type=%s}", getClass().getSimpleName(), getType());
	}
}
