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

import static java.util.Objects.requireNonNull;

/**
 * SQL operators, with the algebraic properties the structural comparator relies on.
 *
 * @since 1.0.0
 */
public enum Operator {
	AND("AND", true, true),
	OR("OR", true, true),
	EQ("=", true, false),
	NE("<>", true, false),
	LT("<", false, false),
	LE("<=", false, false),
	GT(">", false, false),
	GE(">=", false, false),
	ADD("+", true, true),
	MUL("*", true, true),
	SUB("-", false, false),
	DIV("/", false, false),
	COMMA(",", false, false);

	@NonNull
	private final String sql;
	private final boolean commutative;
	private final boolean associative;

	Operator(@NonNull String sql,
					 boolean commutative,
					 boolean associative) {
		this.sql = requireNonNull(sql);
		this.commutative = commutative;
		this.associative = associative;
	}

	@NonNull
	public String getSql() {
		return this.sql;
	}

	/**
	 * Does {@code a op b} mean the same as {@code b op a}?
	 *
	 * @return {@code true} if this operator is commutative
	 */
	public boolean isCommutative() {
		return this.commutative;
	}

	/**
	 * Can a flat list of operands joined by this operator be regrouped (and, since all associative operators here are
	 * also commutative, reordered) freely?
	 *
	 * @return {@code true} if this operator is associative
	 */
	public boolean isAssociative() {
		return this.associative;
	}

	public boolean isComparison() {
		return this == EQ || this == NE || this == LT || this == LE || this == GT || this == GE;
	}
}
