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
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A column expression with a name, e.g. {@code count(*) AS n}. The name may be anonymous.
 *
 * @since 1.0.0
 */
public final class Label extends ColumnElement {
	@NonNull
	private static final TraversalSpec<Label> TRAVERSAL_SPEC = TraversalSpec.forType(Label.class)
			.add("name", VisitationKind.ANON_NAME, Label::getNameForTraversal)
			.add("type", VisitationKind.TYPE, Label::getType)
			.add("element", VisitationKind.NODE, Label::getElement)
			.build();

	@NonNull
	private final Object name;
	@NonNull
	private final ColumnElement element;

	private Label(@NonNull Object name,
								@NonNull ColumnElement element) {
		this.name = requireNonNull(name);
		this.element = requireNonNull(element);
	}

	@NonNull
	public static Label named(@NonNull String name,
														@NonNull ColumnElement element) {
		return new Label(requireNonNull(name), element);
	}

	@NonNull
	public static Label anonymous(@NonNull ColumnElement element) {
		return new Label(new AnonymousName("anon"), element);
	}

	@Override
	@NonNull
	public Set<ColumnElement> getProxySet() {
		Set<ColumnElement> proxySet = super.getProxySet();
		proxySet.addAll(getElement().getProxySet());
		return proxySet;
	}

	/**
	 * The label's name if it was given one explicitly.
	 *
	 * @return the name, or empty for anonymous labels
	 */
	@NonNull
	public Optional<String> getName() {
		return this.name instanceof String ? Optional.of((String) this.name) : Optional.empty();
	}

	public boolean isAnonymous() {
		return this.name instanceof AnonymousName;
	}

	@NonNull
	Object getNameForTraversal() {
		return this.name;
	}

	@Override
	@NonNull
	public TypeDescriptor getType() {
		return getElement().getType();
	}

	@NonNull
	public ColumnElement getElement() {
		return this.element;
	}

	@Override
	@NonNull
	public String getVisitName() {
		return "label";
	}

	@Override
	@NonNull
	public Optional<TraversalSpec<?>> getTraversalSpec() {
		return Optional.of(TRAVERSAL_SPEC);
	}

	@Override
	public String toString() {
		return format("%s{name=%s, element=%s}", getClass().getSimpleName(), this.name, getElement());
	}
}
