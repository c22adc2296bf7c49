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
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Set;

/**
 * @since 1.0.0
 */
@ThreadSafe
public class StructuralComparatorTests {
	@NonNull
	private static Table accountTable() {
		return Table.withName("account")
				.column("id", SqlType.BIGINT)
				.column("balance", SqlType.NUMERIC)
				.column("owner", SqlType.VARCHAR)
				.build();
	}

	@Test
	public void testIndependentlyBuiltTreesAreEqual() {
		Table first = accountTable();
		Table second = accountTable();

		Select firstSelect = Select.columns(first.getColumn("id"), first.getColumn("owner"))
				.from(first)
				.where(first.getColumn("balance").eq(100))
				.orderBy(first.getColumn("id"))
				.build();

		Select secondSelect = Select.columns(second.getColumn("id"), second.getColumn("owner"))
				.from(second)
				.where(second.getColumn("balance").eq(100))
				.orderBy(second.getColumn("id"))
				.build();

		Assertions.assertTrue(new StructuralComparator().compare(firstSelect, secondSelect));
	}

	@Test
	public void testNullsAndDifferentNodeKinds() {
		StructuralComparator structuralComparator = new StructuralComparator();
		Column id = accountTable().getColumn("id");

		Assertions.assertTrue(structuralComparator.compare(null, null));
		Assertions.assertFalse(structuralComparator.compare(id, null));
		Assertions.assertFalse(structuralComparator.compare(id, id.label("id")));
	}

	@Test
	public void testCommutativeOperandsMayBeSwapped() {
		Table table = accountTable();
		Column id = table.getColumn("id");
		Column balance = table.getColumn("balance");
		StructuralComparator structuralComparator = new StructuralComparator();

		Assertions.assertTrue(structuralComparator.compare(id.operate(Operator.ADD, balance), balance.operate(Operator.ADD, id)));
		Assertions.assertTrue(structuralComparator.compare(id.operate(Operator.EQ, balance), balance.operate(Operator.EQ, id)));
		Assertions.assertFalse(structuralComparator.compare(id.operate(Operator.SUB, balance), balance.operate(Operator.SUB, id)));
		Assertions.assertFalse(structuralComparator.compare(id.operate(Operator.LT, balance), balance.operate(Operator.LT, id)));
		Assertions.assertFalse(structuralComparator.compare(id.operate(Operator.ADD, balance), id.operate(Operator.MUL, balance)));
	}

	@Test
	public void testAssociativeClauseListsAreUnordered() {
		Table table = accountTable();
		Traversable idClause = table.getColumn("id").eq(1);
		Traversable ownerClause = table.getColumn("owner").eq("alice");
		StructuralComparator structuralComparator = new StructuralComparator();

		Assertions.assertTrue(structuralComparator.compare(ClauseList.and(idClause, ownerClause),
				ClauseList.and(ownerClause, idClause)));
		Assertions.assertFalse(structuralComparator.compare(ClauseList.and(idClause, ownerClause),
				ClauseList.or(idClause, ownerClause)));
		Assertions.assertFalse(structuralComparator.compare(ClauseList.and(idClause, ownerClause),
				ClauseList.and(idClause)));
	}

	@Test
	public void testBoundValues() {
		Column balance = accountTable().getColumn("balance");
		StructuralComparator structuralComparator = new StructuralComparator();

		Assertions.assertFalse(structuralComparator.compare(balance.eq(1), balance.eq(2)));
		Assertions.assertTrue(structuralComparator.compare(balance.eq(1), balance.eq(2),
				ComparisonOptions.builder().compareValues(false).build()));
		Assertions.assertTrue(structuralComparator.compare(balance.eq(1), balance.eq(1)));
	}

	@Test
	public void testTypesCompareByAffinity() {
		Column integerId = Table.withName("account").column("id", SqlType.INTEGER).build().getColumn("id");
		Column bigintId = Table.withName("account").column("id", SqlType.BIGINT).build().getColumn("id");
		Column varcharId = Table.withName("account").column("id", SqlType.VARCHAR).build().getColumn("id");
		StructuralComparator structuralComparator = new StructuralComparator();

		Assertions.assertTrue(structuralComparator.compare(integerId, bigintId));
		Assertions.assertFalse(structuralComparator.compare(integerId, varcharId));
	}

	@Test
	public void testAnonymousLabelsCompareByPosition() {
		Table first = accountTable();
		Table second = accountTable();

		Select firstSelect = Select.columns(Label.anonymous(first.getColumn("id")), Label.anonymous(first.getColumn("owner"))).build();
		Select secondSelect = Select.columns(Label.anonymous(second.getColumn("id")), Label.anonymous(second.getColumn("owner"))).build();
		Select namedSelect = Select.columns(second.getColumn("id").label("x"), Label.anonymous(second.getColumn("owner"))).build();

		StructuralComparator structuralComparator = new StructuralComparator();

		Assertions.assertTrue(structuralComparator.compare(firstSelect, secondSelect));
		Assertions.assertFalse(structuralComparator.compare(firstSelect, namedSelect));
	}

	@Test
	public void testLineage() {
		Table table = accountTable();
		Table alias = table.alias("a1");
		Table unrelated = accountTable();
		StructuralComparator structuralComparator = new StructuralComparator();
		ComparisonOptions lineage = ComparisonOptions.builder().useLineage(true).build();

		Assertions.assertTrue(structuralComparator.compare(alias.getColumn("id"), table.getColumn("id"), lineage));
		Assertions.assertTrue(structuralComparator.compare(table.getColumn("id").label("x"), alias.getColumn("id").label("y"), lineage));
		Assertions.assertFalse(structuralComparator.compare(unrelated.getColumn("id"), table.getColumn("id"), lineage));
		Assertions.assertTrue(structuralComparator.compare(unrelated.getColumn("id"), table.getColumn("id")),
				"Without lineage, same-named tables are structurally equal");
		Assertions.assertFalse(structuralComparator.compare(unrelated, table, lineage));
		Assertions.assertFalse(structuralComparator.compare(alias.getColumn("id"), table.getColumn("id")),
				"Without lineage, an alias is a different table");
	}

	@Test
	public void testEquivalents() {
		Column id = accountTable().getColumn("id");
		Column otherId = accountTable().getColumn("id");
		StructuralComparator structuralComparator = new StructuralComparator();

		ComparisonOptions withoutEquivalents = ComparisonOptions.builder().useLineage(true).build();
		ComparisonOptions withEquivalents = ComparisonOptions.builder()
				.useLineage(true)
				.equivalent(otherId, Set.of(id))
				.build();

		Assertions.assertFalse(structuralComparator.compare(id, otherId, withoutEquivalents));
		Assertions.assertTrue(structuralComparator.compare(id, otherId, withEquivalents));
	}

	@Test
	public void testOpaqueClausesCannotBeCompared() {
		OpaqueClause opaqueClause = new OpaqueClause(() -> "now()", SqlType.TIMESTAMP);
		OpaqueClause otherOpaqueClause = new OpaqueClause(() -> "now()", SqlType.TIMESTAMP);

		Assertions.assertTrue(new StructuralComparator().compare(opaqueClause, opaqueClause), "Identical nodes short-circuit");
		Assertions.assertThrows(UnsupportedOperationException.class,
				() -> new StructuralComparator().compare(opaqueClause, otherOpaqueClause));
	}
}
