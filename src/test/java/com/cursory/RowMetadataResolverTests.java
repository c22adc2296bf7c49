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
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.math.BigDecimal;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static java.util.Objects.requireNonNull;

/**
 * @since 1.0.0
 */
@ThreadSafe
public class RowMetadataResolverTests {
	@NonNull
	private static final Dialect GENERIC = Dialect.forDatabaseType(DatabaseType.GENERIC);

	@NonNull
	private static Table userTable() {
		return Table.withName("app_user")
				.column("a", SqlType.INTEGER)
				.column("b", SqlType.INTEGER)
				.build();
	}

	@NonNull
	private static CursorRowMetadata resolve(@NonNull RowMetadataResolver rowMetadataResolver,
																					 @NonNull Dialect dialect,
																					 CompiledStatement compiledStatement,
																					 @NonNull List<RawColumnDescriptor> description) {
		requireNonNull(rowMetadataResolver);
		requireNonNull(dialect);
		requireNonNull(description);

		ExecutionContext executionContext = ExecutionContext.withDialect(dialect)
				.compiledStatement(compiledStatement)
				.rowMetadataResolver(rowMetadataResolver)
				.build();

		return (CursorRowMetadata) rowMetadataResolver.resolve(executionContext, description);
	}

	@NonNull
	private static CursorRowMetadata resolve(@NonNull Dialect dialect,
																					 CompiledStatement compiledStatement,
																					 @NonNull List<RawColumnDescriptor> description) {
		return resolve(RowMetadataResolver.withMetadataCachingEnabled(false).build(), dialect, compiledStatement,
				description);
	}

	@NonNull
	private static List<RawColumnDescriptor> integers(@NonNull String... names) {
		List<RawColumnDescriptor> description = new ArrayList<>(names.length);

		for (String name : names)
			description.add(RawColumnDescriptor.of(name, Types.INTEGER));

		return description;
	}

	@NonNull
	private static CompiledStatement compile(@NonNull Selectable selectable) {
		return CompiledStatement.forSelectable(selectable, new CacheKeyGenerator());
	}

	@Test
	public void testPurePositional() {
		Table table = userTable();
		Column a = table.getColumn("a");
		Column b = table.getColumn("b");

		CursorRowMetadata rowMetadata = resolve(GENERIC, compile(Select.columns(a, b).build()), integers("a", "b"));
		Row row = Row.fromRawValues(rowMetadata, new Object[]{1, 2});

		Assertions.assertEquals(MatchStrategy.POSITIONAL, rowMetadata.getMatchStrategy().orElseThrow());
		Assertions.assertEquals(List.of("a", "b"), rowMetadata.getKeys());
		Assertions.assertEquals(1, row.get(0));
		Assertions.assertEquals(1, row.get("a"));
		Assertions.assertEquals(2, row.get("b"));
		Assertions.assertEquals(1, row.get(a));
		Assertions.assertEquals(2, row.get(b));
		Assertions.assertEquals(2, row.get(-1));
		Assertions.assertEquals(1, rowMetadata.indexForKey(-1));
	}

	@Test
	public void testPositionalIgnoresDriverNames() {
		Table table = userTable();
		CursorRowMetadata rowMetadata = resolve(GENERIC,
				compile(Select.columns(table.getColumn("a"), table.getColumn("b")).build()), integers("X", "Y"));

		Assertions.assertEquals(List.of("a", "b"), rowMetadata.getKeys());
		Assertions.assertFalse(rowMetadata.hasKey("X"));
	}

	@Test
	public void testNoDeclaredColumns() {
		CursorRowMetadata rowMetadata = resolve(GENERIC, null, integers("n"));
		Row row = Row.fromRawValues(rowMetadata, new Object[]{5});

		Assertions.assertEquals(MatchStrategy.NONE, rowMetadata.getMatchStrategy().orElseThrow());
		Assertions.assertEquals(List.of("n"), row.fields());
		Assertions.assertEquals(5, row.get("n"));
	}

	@Test
	public void testTextualPositional() {
		Table table = userTable();
		Column a = table.getColumn("a");
		Column b = table.getColumn("b");
		TextualSelect textualSelect = TextualSelect.of("SELECT x, y, z FROM app_user", List.of(a, b), true);

		CursorRowMetadata rowMetadata = resolve(GENERIC, compile(textualSelect), integers("x", "y", "z"));
		Row row = Row.fromRawValues(rowMetadata, new Object[]{1, 2, 3});

		Assertions.assertEquals(MatchStrategy.TEXTUAL_POSITIONAL, rowMetadata.getMatchStrategy().orElseThrow());
		Assertions.assertEquals(List.of("x", "y", "z"), rowMetadata.getKeys());
		Assertions.assertEquals(1, row.get(a));
		Assertions.assertEquals(2, row.get(b));
		Assertions.assertEquals(3, row.get("z"));
		Assertions.assertEquals(1, row.get("x"));
	}

	@Test
	public void testTextualPositionalWarnsWhenDriverReturnsFewerColumns() {
		Table table = userTable();
		TextualSelect textualSelect = TextualSelect.of("SELECT a FROM app_user",
				List.of(table.getColumn("a"), table.getColumn("b")), true);

		Logger logger = Logger.getLogger(DefaultRowMetadataResolver.class.getName());
		List<LogRecord> logRecords = new ArrayList<>();
		Handler handler = new Handler() {
			@Override
			public void publish(LogRecord record) {
				logRecords.add(record);
			}

			@Override
			public void flush() {}

			@Override
			public void close() {}
		};

		logger.addHandler(handler);

		try {
			CursorRowMetadata rowMetadata = resolve(GENERIC, compile(textualSelect), integers("a"));
			Assertions.assertEquals(List.of("a"), rowMetadata.getKeys());
			Assertions.assertTrue(rowMetadata.hasKey(table.getColumn("a")));
		} finally {
			logger.removeHandler(handler);
		}

		Assertions.assertEquals(1, logRecords.size());
		Assertions.assertEquals(Level.WARNING, logRecords.get(0).getLevel());
		Assertions.assertTrue(logRecords.get(0).getMessage().contains("smaller than number of columns requested"));
	}

	@Test
	public void testTextualPositionalRejectsDuplicateColumnExpression() {
		Column a = userTable().getColumn("a");
		TextualSelect textualSelect = TextualSelect.of("SELECT a, a FROM app_user", List.of(a, a), true);

		InvalidRequestException e = Assertions.assertThrows(InvalidRequestException.class,
				() -> resolve(GENERIC, compile(textualSelect), integers("a", "a")));

		Assertions.assertTrue(e.getMessage().startsWith("Duplicate column expression requested in textual SQL"));
	}

	@Test
	public void testNameBased() {
		Table table = userTable();
		Column a = table.getColumn("a");
		Column b = table.getColumn("b");
		TextualSelect textualSelect = TextualSelect.of("SELECT * FROM app_user", List.of(b, a), false);

		CursorRowMetadata rowMetadata = resolve(GENERIC, compile(textualSelect), integers("a", "b", "c"));
		Row row = Row.fromRawValues(rowMetadata, new Object[]{1, 2, 3});

		Assertions.assertEquals(MatchStrategy.NAME, rowMetadata.getMatchStrategy().orElseThrow());
		Assertions.assertEquals(List.of("a", "b", "c"), rowMetadata.getKeys());
		Assertions.assertEquals(1, row.get(a));
		Assertions.assertEquals(2, row.get(b));
		Assertions.assertEquals(3, row.get("c"));
	}

	@Test
	public void testPositionalCountMismatchFallsBackToNames() {
		Table table = userTable();
		Column a = table.getColumn("a");
		Column b = table.getColumn("b");

		CursorRowMetadata rowMetadata = resolve(GENERIC, compile(Select.columns(a, b).build()), integers("b", "extra", "a"));
		Row row = Row.fromRawValues(rowMetadata, new Object[]{2, 99, 1});

		Assertions.assertEquals(MatchStrategy.NAME, rowMetadata.getMatchStrategy().orElseThrow());
		Assertions.assertEquals(1, row.get(a));
		Assertions.assertEquals(2, row.get(b));
		Assertions.assertEquals(99, row.get("extra"));
	}

	@Test
	public void testLooseMatchingUsesAlternateNames() {
		Column a = userTable().getColumn("a");
		CompiledStatement compiledStatement = CompiledStatement.withStatement(a)
				.resultColumns(List.of(ResultColumn.of("user_id", SqlType.INTEGER, "UID", a)))
				.columnsOrdered(false)
				.looseColumnNameMatching(true)
				.build();

		Dialect dialect = Dialect.withDatabaseType(DatabaseType.GENERIC).caseSensitive(false).build();
		CursorRowMetadata rowMetadata = resolve(dialect, compiledStatement, integers("uid"));

		Assertions.assertEquals(MatchStrategy.NAME, rowMetadata.getMatchStrategy().orElseThrow());
		Assertions.assertEquals(0, rowMetadata.indexForKey(a));
		Assertions.assertEquals(0, rowMetadata.indexForKey("Uid"));
	}

	@Test
	public void testWithoutLooseMatchingAlternateNamesDoNotMatch() {
		Column a = userTable().getColumn("a");
		CompiledStatement compiledStatement = CompiledStatement.withStatement(a)
				.resultColumns(List.of(ResultColumn.of("user_id", SqlType.INTEGER, "uid", a)))
				.columnsOrdered(false)
				.build();

		CursorRowMetadata rowMetadata = resolve(GENERIC, compiledStatement, integers("uid"));

		Assertions.assertFalse(rowMetadata.hasKey(a));
		Assertions.assertTrue(rowMetadata.hasKey("uid"));
	}

	@Test
	public void testCollidingNamesAreAmbiguousButObjectsAreNot() {
		Table first = Table.withName("first").column("id", SqlType.INTEGER).build();
		Table second = Table.withName("second").column("id", SqlType.INTEGER).build();
		Column firstId = first.getColumn("id");
		Column secondId = second.getColumn("id");

		CursorRowMetadata rowMetadata = resolve(GENERIC, compile(Select.columns(firstId, secondId).build()),
				integers("id", "id"));
		Row row = Row.fromRawValues(rowMetadata, new Object[]{1, 2});

		Assertions.assertEquals(List.of("id", "id"), rowMetadata.getKeys());
		AmbiguousColumnException e = Assertions.assertThrows(AmbiguousColumnException.class, () -> row.get("id"));
		Assertions.assertEquals("id", e.getKey());
		Assertions.assertEquals(1, row.get(firstId));
		Assertions.assertEquals(2, row.get(secondId));
		Assertions.assertEquals(1, row.get(0));
		Assertions.assertEquals(2, row.get(1));

		// Every row of the result fails the same way
		Row anotherRow = Row.fromRawValues(rowMetadata, new Object[]{3, 4});
		Assertions.assertThrows(AmbiguousColumnException.class, () -> anotherRow.get("id"));
		Assertions.assertTrue(rowMetadata.hasKey("id"), "Ambiguous keys are still known keys");
	}

	@Test
	public void testCaseFoldedCollisionIsAmbiguous() {
		Dialect dialect = Dialect.withDatabaseType(DatabaseType.GENERIC).caseSensitive(false).build();

		CursorRowMetadata rowMetadata = resolve(dialect, null, integers("Name", "NAME", "other"));

		Assertions.assertThrows(AmbiguousColumnException.class, () -> rowMetadata.indexForKey("name"));
		Assertions.assertThrows(AmbiguousColumnException.class, () -> rowMetadata.indexForKey("Name"));
		Assertions.assertEquals(2, rowMetadata.indexForKey("OTHER"));
	}

	@Test
	public void testCaseSensitiveNamesDoNotCollide() {
		CursorRowMetadata rowMetadata = resolve(GENERIC, null, integers("Name", "NAME"));

		Assertions.assertEquals(0, rowMetadata.indexForKey("Name"));
		Assertions.assertEquals(1, rowMetadata.indexForKey("NAME"));
		Assertions.assertThrows(NoSuchColumnException.class, () -> rowMetadata.indexForKey("name"));
	}

	@Test
	public void testAmbiguityDoesNotDependOnDeclarationOrder() {
		Table first = Table.withName("first").column("id", SqlType.INTEGER).build();
		Table second = Table.withName("second").column("id", SqlType.INTEGER).build();
		Column firstId = first.getColumn("id");
		Column secondId = second.getColumn("id");

		for (List<Column> declared : List.of(List.of(firstId, secondId), List.of(secondId, firstId))) {
			TextualSelect textualSelect = TextualSelect.of("SELECT * FROM first, second", declared, false);
			CursorRowMetadata rowMetadata = resolve(GENERIC, compile(textualSelect), integers("id", "id"));

			Assertions.assertThrows(AmbiguousColumnException.class, () -> rowMetadata.indexForKey("id"));
			Assertions.assertThrows(AmbiguousColumnException.class, () -> rowMetadata.indexForKey(firstId));
			Assertions.assertThrows(AmbiguousColumnException.class, () -> rowMetadata.indexForKey(secondId));
			Assertions.assertEquals(0, rowMetadata.indexForKey(0));
		}
	}

	@Test
	public void testUnknownKey() {
		CursorRowMetadata rowMetadata = resolve(GENERIC, null, integers("n"));

		NoSuchColumnException e = Assertions.assertThrows(NoSuchColumnException.class,
				() -> rowMetadata.indexForKey("missing"));

		Assertions.assertEquals("Could not locate column in row for column 'missing'", e.getMessage());
		Assertions.assertFalse(rowMetadata.hasKey("missing"));
		Assertions.assertFalse(rowMetadata.hasKey(null));
	}

	@Test
	public void testUppercaseIdentifiersAreNormalized() {
		Dialect dialect = Dialect.forDatabaseType(DatabaseType.HSQLDB);
		CursorRowMetadata rowMetadata = resolve(dialect, null, integers("N", "MixedCase", "x_1"));

		Assertions.assertEquals(List.of("n", "MixedCase", "x_1"), rowMetadata.getKeys());
		Assertions.assertEquals(0, rowMetadata.indexForKey("n"));
		Assertions.assertEquals(1, rowMetadata.indexForKey("MixedCase"));
	}

	@Test
	public void testUntranslatedNamesRemainKeys() {
		Dialect dialect = Dialect.withDatabaseType(DatabaseType.GENERIC)
				.columnNameTranslator(name -> name.contains(".") ? name.substring(name.indexOf('.') + 1) : name)
				.build();

		CursorRowMetadata rowMetadata = resolve(dialect, null, integers("app_user.a", "b"));

		Assertions.assertEquals(List.of("a", "b"), rowMetadata.getKeys());
		Assertions.assertEquals(0, rowMetadata.indexForKey("a"));
		Assertions.assertEquals(0, rowMetadata.indexForKey("app_user.a"));
		Assertions.assertEquals(1, rowMetadata.indexForKey("b"));
	}

	@Test
	public void testDeclaredTypeSelectsDecoder() {
		Table table = Table.withName("account").column("balance", SqlType.NUMERIC).column("id", SqlType.INTEGER).build();
		List<RawColumnDescriptor> description = List.of(RawColumnDescriptor.of("balance", Types.DOUBLE),
				RawColumnDescriptor.of("id", Types.INTEGER));

		CursorRowMetadata rowMetadata = resolve(GENERIC,
				compile(Select.columns(table.getColumn("balance"), table.getColumn("id")).build()), description);
		Row row = Row.fromRawValues(rowMetadata, new Object[]{12.5d, 7});

		Assertions.assertEquals(new BigDecimal("12.5"), row.get("balance"));
		Assertions.assertEquals(7, row.get("id"));
		Assertions.assertTrue(rowMetadata.getDecoders().get(1).isPassThrough(), "Matching driver type needs no decoder");
	}

	@Test
	public void testReduce() {
		Table table = userTable();
		Column a = table.getColumn("a");
		Column b = table.getColumn("b");

		CursorRowMetadata rowMetadata = resolve(GENERIC, compile(Select.columns(a, b).build()), integers("a", "b"));
		CursorRowMetadata reduced = rowMetadata.reduce(List.of(b, "a"));
		Row row = Row.fromRawValues(reduced, new Object[]{1, 2});

		Assertions.assertEquals(List.of("b", "a"), reduced.getKeys());
		Assertions.assertEquals(List.of(2, 1), row.values());
		Assertions.assertEquals(2, row.get(b));
		Assertions.assertEquals(1, row.get("a"));
		Assertions.assertEquals(1, row.get(-1));
		Assertions.assertThrows(NoSuchColumnException.class, () -> rowMetadata.reduce(List.of("missing")));
	}

	@Test
	public void testMetadataIsCachedPerStatementShape() {
		RowMetadataResolver rowMetadataResolver = RowMetadataResolver.withDefaultConfiguration();
		Table table = userTable();
		CompiledStatement compiledStatement = compile(Select.columns(table.getColumn("a"), table.getColumn("b")).build());

		CursorRowMetadata first = resolve(rowMetadataResolver, GENERIC, compiledStatement, integers("a", "b"));
		CursorRowMetadata second = resolve(rowMetadataResolver, GENERIC, compiledStatement, integers("a", "b"));
		CursorRowMetadata otherDescription = resolve(rowMetadataResolver, GENERIC, compiledStatement,
				List.of(RawColumnDescriptor.of("a", Types.BIGINT), RawColumnDescriptor.of("b", Types.INTEGER)));

		Assertions.assertSame(first, second);
		Assertions.assertNotSame(first, otherDescription, "A different driver description is a different cache entry");
	}

	@Test
	public void testCachingCanBeDisabled() {
		RowMetadataResolver rowMetadataResolver = RowMetadataResolver.withMetadataCachingEnabled(false).build();
		Table table = userTable();
		CompiledStatement compiledStatement = compile(Select.columns(table.getColumn("a")).build());

		Assertions.assertNotSame(resolve(rowMetadataResolver, GENERIC, compiledStatement, integers("a")),
				resolve(rowMetadataResolver, GENERIC, compiledStatement, integers("a")));
	}

	@Test
	public void testUncacheableStatementsAreNotCached() {
		OpaqueClause opaqueClause = new OpaqueClause(() -> "random()", SqlType.NUMERIC);
		CompiledStatement compiledStatement = compile(Select.columns(opaqueClause).build());
		DefaultRowMetadataResolver rowMetadataResolver = new DefaultRowMetadataResolver();

		Assertions.assertTrue(compiledStatement.getCacheKey().isEmpty());

		CursorRowMetadata first = resolve(rowMetadataResolver, GENERIC, compiledStatement, integers("col_1"));
		CursorRowMetadata second = resolve(rowMetadataResolver, GENERIC, compiledStatement, integers("col_1"));

		Assertions.assertNotSame(first, second);
		Assertions.assertTrue(rowMetadataResolver.getMetadataCache().isEmpty());
	}

	@Test
	public void testCacheCapacityIsBounded() {
		DefaultRowMetadataResolver rowMetadataResolver =
				(DefaultRowMetadataResolver) RowMetadataResolver.withMetadataCacheCapacity(2).build();
		Table table = userTable();

		for (int limit = 1; limit <= 5; ++limit) {
			CompiledStatement compiledStatement = compile(Select.columns(table.getColumn("a")).limit(limit).build());
			resolve(rowMetadataResolver, GENERIC, compiledStatement, integers("a"));
		}

		Assertions.assertEquals(2, rowMetadataResolver.getMetadataCache().size());
	}

	@Test
	public void testCachedMetadataIsAdaptedToEquivalentStatement() {
		RowMetadataResolver rowMetadataResolver = RowMetadataResolver.withDefaultConfiguration();

		Table firstTable = userTable();
		Column firstA = firstTable.getColumn("a");
		Column firstB = firstTable.getColumn("b");
		CompiledStatement firstStatement = compile(Select.columns(firstA, firstB).build());

		Table secondTable = userTable();
		Column secondA = secondTable.getColumn("a");
		Column secondB = secondTable.getColumn("b");
		CompiledStatement secondStatement = compile(Select.columns(secondA, secondB).build());

		Assertions.assertEquals(firstStatement.getCacheKey(), secondStatement.getCacheKey());

		CursorRowMetadata first = resolve(rowMetadataResolver, GENERIC, firstStatement, integers("a", "b"));
		CursorRowMetadata second = resolve(rowMetadataResolver, GENERIC, secondStatement, integers("a", "b"));

		Assertions.assertNotSame(first, second);
		Assertions.assertEquals(MatchStrategy.POSITIONAL, second.getMatchStrategy().orElseThrow());
		Assertions.assertEquals(first.getKeys(), second.getKeys());
		Assertions.assertEquals(0, second.indexForKey(secondA));
		Assertions.assertEquals(1, second.indexForKey(secondB));
		Assertions.assertEquals(1, second.indexForKey("b"));
		Assertions.assertFalse(first.hasKey(secondA), "The cached metadata itself is left untouched");
	}

	@Test
	public void testInvokedStatementDrivesAdaptation() {
		RowMetadataResolver rowMetadataResolver = RowMetadataResolver.withDefaultConfiguration();

		Table firstTable = userTable();
		CompiledStatement compiledStatement = compile(Select.columns(firstTable.getColumn("a")).build());
		resolve(rowMetadataResolver, GENERIC, compiledStatement, integers("a"));

		Table secondTable = userTable();
		Select invokedStatement = Select.columns(secondTable.getColumn("a")).build();

		ExecutionContext executionContext = ExecutionContext.withDialect(GENERIC)
				.compiledStatement(compiledStatement)
				.invokedStatement(invokedStatement)
				.rowMetadataResolver(rowMetadataResolver)
				.build();

		RowMetadata rowMetadata = rowMetadataResolver.resolve(executionContext, integers("a"));

		Assertions.assertEquals(0, rowMetadata.indexForKey(secondTable.getColumn("a")));
		Assertions.assertEquals(0, rowMetadata.indexForKey(firstTable.getColumn("a")));
	}

	@Test
	public void testSerializationKeepsOnlyNamesAndPositions() throws Exception {
		Table table = userTable();
		Column a = table.getColumn("a");
		Column b = table.getColumn("b");
		Dialect dialect = Dialect.withDatabaseType(DatabaseType.GENERIC).caseSensitive(false).build();

		CursorRowMetadata rowMetadata = resolve(dialect, compile(Select.columns(a, b).build()),
				List.of(RawColumnDescriptor.of("a", Types.BIGINT), RawColumnDescriptor.of("b", Types.INTEGER)));

		Assertions.assertFalse(rowMetadata.getDecoders().get(0).isPassThrough());

		CursorRowMetadata copy = roundTrip(rowMetadata);

		Assertions.assertEquals(List.of("a", "b"), copy.getKeys());
		Assertions.assertEquals(rowMetadata.isCaseSensitive(), copy.isCaseSensitive());
		Assertions.assertEquals(1, copy.indexForKey("B"));
		Assertions.assertEquals(0, copy.indexForKey(-2));
		Assertions.assertFalse(copy.hasKey(a), "Column objects do not survive serialization");

		for (ValueDecoder valueDecoder : copy.getDecoders())
			Assertions.assertTrue(valueDecoder.isPassThrough());

		// Already-decoded values pass through untouched
		Row row = Row.fromRawValues(copy, new Object[]{"1", 2});
		Assertions.assertEquals("1", row.get("a"));
	}

	@Test
	public void testSerializedReducedMetadataKeepsProjection() throws Exception {
		Table table = userTable();
		CursorRowMetadata rowMetadata = resolve(GENERIC,
				compile(Select.columns(table.getColumn("a"), table.getColumn("b")).build()), integers("a", "b"));

		CursorRowMetadata copy = roundTrip(rowMetadata.reduce(List.of("b")));

		Assertions.assertEquals(List.of("b"), copy.getKeys());
		Assertions.assertEquals(List.of(2), Row.fromRawValues(copy, new Object[]{1, 2}).values());
	}

	@NonNull
	private static <T> T roundTrip(@NonNull T object) throws IOException, ClassNotFoundException {
		ByteArrayOutputStream byteArrayOutputStream = new ByteArrayOutputStream();

		try (ObjectOutputStream objectOutputStream = new ObjectOutputStream(byteArrayOutputStream)) {
			objectOutputStream.writeObject(object);
		}

		try (ObjectInputStream objectInputStream = new ObjectInputStream(
				new ByteArrayInputStream(byteArrayOutputStream.toByteArray()))) {
			@SuppressWarnings("unchecked")
			T copy = (T) objectInputStream.readObject();
			return copy;
		}
	}
}
