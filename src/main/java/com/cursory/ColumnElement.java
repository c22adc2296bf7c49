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

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Base class for nodes which produce a single column value: table columns, labels, literals and expressions.
 *
 * @since 1.0.0
 */
public abstract class ColumnElement implements Traversable {
	@NonNull
	public abstract TypeDescriptor getType();

	/**
	 * The set of column elements this element stands in for, including itself. A column of an aliased table proxies
	 * the column of the table it was derived from.
	 *
	 * @return an identity-based set containing this element and everything it proxies
	 */
	@NonNull
	public Set<ColumnElement> getProxySet() {
		Set<ColumnElement> proxySet = Collections.newSetFromMap(new IdentityHashMap<>());
		proxySet.add(this);
		return proxySet;
	}

	/**
	 * Do this element and {@code columnElement} derive from a common ancestor?
	 *
	 * @param columnElement the element to check
	 * @return {@code true} if the proxy sets of both elements intersect
	 */
	public boolean sharesLineage(@NonNull ColumnElement columnElement) {
		requireNonNull(columnElement);

		Set<ColumnElement> otherProxySet = columnElement.getProxySet();

		for (ColumnElement proxied : getProxySet())
			if (otherProxySet.contains(proxied))
				return true;

		return false;
	}

	@NonNull
	public Label label(@NonNull String name) {
		requireNonNull(name);
		return Label.named(name, this);
	}

	@NonNull
	public BinaryExpression operate(@NonNull Operator operator,
																	@NonNull ColumnElement right) {
		requireNonNull(operator);
		requireNonNull(right);
		return new BinaryExpression(this, right, operator, null);
	}

	/**
	 * Shorthand for comparing this element to a literal value, which becomes a {@link BindParameter}.
	 *
	 * @param value the value to compare against
	 * @return an equality expression
	 */
	@NonNull
	public BinaryExpression eq(@NonNull Object value) {
		requireNonNull(value);
		return operate(Operator.EQ, value instanceof ColumnElement ? (ColumnElement) value : BindParameter.of(value, getType()));
	}
}
