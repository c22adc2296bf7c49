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
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Standard implementation of {@link RowMetadataResolver}.
 * <p>
 * One of four strategies lines declared columns up with raw driver columns (see {@link MatchStrategy}). The resulting
 * keymap always contains integer positions and primary names; declaring objects are added as extra keys. Any name or
 * object that ends up associated with more than one position becomes ambiguous.
 * <p>
 * When caching is enabled, metadata is cached per (statement {@link CacheKey}, driver description) and adapted on a
 * hit so that it also answers to the column objects of the statement actually invoked.
 *
 * @since 1.0.0
 */
@ThreadSafe
class DefaultRowMetadataResolver implements RowMetadataResolver {
	@NonNull
	private static final Logger LOGGER = Logger.getLogger(DefaultRowMetadataResolver.class.getName());

	@NonNull
	private final Boolean metadataCachingEnabled;
	@NonNull
	private final Map<MetadataCacheKey, CachedMetadata> metadataCache;

	DefaultRowMetadataResolver() {
		this(RowMetadataResolver.withMetadataCachingEnabled(true));
	}

	DefaultRowMetadataResolver(@NonNull Builder builder) {
		requireNonNull(builder);

		this.metadataCachingEnabled = builder.metadataCachingEnabled;
		this.metadataCache = createCache(builder.metadataCacheCapacity);
	}

	@NonNull
	private static <K, V> Map<K, V> createCache(@NonNull Integer capacity) {
		requireNonNull(capacity);

		if (capacity <= 0)
			return new ConcurrentHashMap<>();

		return new ConcurrentLruMap<>(capacity);
	}

	@Override
	@NonNull
	public RowMetadata resolve(@NonNull ExecutionContext executionContext,
														 @NonNull List<RawColumnDescriptor> description) {
		requireNonNull(executionContext);
		requireNonNull(description);

		Dialect dialect = executionContext.getDialect();
		CompiledStatement compiledStatement = executionContext.getCompiledStatement().orElse(null);
		CacheKey cacheKey = compiledStatement == null ? null : compiledStatement.getCacheKey().orElse(null);

		if (!getMetadataCachingEnabled() || cacheKey == null)
			return resolveUncached(compiledStatement, description, dialect);

		MetadataCacheKey metadataCacheKey = new MetadataCacheKey(cacheKey, buildDescriptionSignature(description, dialect));
		CachedMetadata cachedMetadata = getMetadataCache().get(metadataCacheKey);

		if (cachedMetadata == null) {
			CursorRowMetadata rowMetadata = resolveUncached(compiledStatement, description, dialect);
			cachedMetadata = new CachedMetadata(compiledStatement, rowMetadata);
			CachedMetadata raced = getMetadataCache().putIfAbsent(metadataCacheKey, cachedMetadata);

			if (raced == null)
				return rowMetadata;

			cachedMetadata = raced;
		}

		return adaptToContext(cachedMetadata, compiledStatement, executionContext.getInvokedStatement().orElse(null));
	}

	/**
	 * Makes cached metadata answer to the column objects of the statement being executed.
	 *
	 * @param cachedMetadata    the cache entry
	 * @param compiledStatement the statement compiled for this execution
	 * @param invokedStatement  the statement the caller executed
	 * @return metadata for this execution
	 */
	@NonNull
	protected CursorRowMetadata adaptToContext(@NonNull CachedMetadata cachedMetadata,
																						 @NonNull CompiledStatement compiledStatement,
																						 @Nullable Traversable invokedStatement) {
		requireNonNull(cachedMetadata);
		requireNonNull(compiledStatement);

		CursorRowMetadata rowMetadata = cachedMetadata.getRowMetadata();

		if (compiledStatement.getResultColumns().isEmpty())
			return rowMetadata;

		Traversable cachedStatement = cachedMetadata.getCompiledStatement().getStatement();
		Traversable currentStatement = invokedStatement == null ? compiledStatement.getStatement() : invokedStatement;

		if (cachedStatement == currentStatement)
			return rowMetadata;

		List<List<Object>> replacementObjects = new ArrayList<>(compiledStatement.getResultColumns().size());

		if (currentStatement instanceof Selectable selectable) {
			for (ColumnElement exportedColumn : selectable.getExportedColumns())
				replacementObjects.add(List.of(exportedColumn));
		} else {
			for (ResultColumn resultColumn : compiledStatement.getResultColumns())
				replacementObjects.add(resultColumn.getObjects());
		}

		return rowMetadata.adapt(cachedMetadata.getCompiledStatement().getResultColumns(), replacementObjects);
	}

	/**
	 * Resolves metadata without consulting the cache.
	 *
	 * @param compiledStatement the compiled statement, or {@code null} for raw SQL
	 * @param description       the driver's column descriptions
	 * @param dialect           the dialect in effect
	 * @return the resolved metadata
	 */
	@NonNull
	protected CursorRowMetadata resolveUncached(@Nullable CompiledStatement compiledStatement,
																							@NonNull List<RawColumnDescriptor> description,
																							@NonNull Dialect dialect) {
		requireNonNull(description);
		requireNonNull(dialect);

		List<ResultColumn> declaredColumns = compiledStatement == null ? List.of() : compiledStatement.getResultColumns();
		int declaredCount = declaredColumns.size();

		MatchStrategy matchStrategy;
		List<String> keys = new ArrayList<>(description.size());
		List<MetadataEntry> entries;

		if (declaredCount > 0 && compiledStatement.isColumnsOrdered() && !compiledStatement.isTextualOrdered()
				&& declaredCount == description.size()) {
			matchStrategy = MatchStrategy.POSITIONAL;
			entries = new ArrayList<>(declaredCount);

			// Raw names are not consulted at all
			for (int i = 0; i < declaredCount; ++i) {
				ResultColumn resultColumn = declaredColumns.get(i);
				keys.add(resultColumn.getName());
				entries.add(new MetadataEntry(i, resultColumn.getObjects(), dialect.foldKey(resultColumn.getName()),
						resultColumn.getRenderedName(), decoderFor(dialect, resultColumn.getType(), description.get(i)), null));
			}
		} else {
			List<DescribedColumn> describedColumns = describeColumns(description, dialect);

			for (DescribedColumn describedColumn : describedColumns)
				keys.add(describedColumn.getName());

			List<MatchedColumn> matchedColumns;

			if (declaredCount > 0 && compiledStatement.isTextualOrdered()) {
				matchStrategy = MatchStrategy.TEXTUAL_POSITIONAL;
				matchedColumns = matchByPosition(describedColumns, declaredColumns);
			} else if (declaredCount > 0) {
				matchStrategy = MatchStrategy.NAME;
				matchedColumns = matchByName(describedColumns, declaredColumns, dialect,
						compiledStatement.isLooseColumnNameMatching());
			} else {
				matchStrategy = MatchStrategy.NONE;
				matchedColumns = new ArrayList<>(describedColumns.size());

				for (DescribedColumn describedColumn : describedColumns)
					matchedColumns.add(new MatchedColumn(describedColumn, List.of(), SqlType.NULL));
			}

			entries = new ArrayList<>(matchedColumns.size());

			for (MatchedColumn matchedColumn : matchedColumns) {
				DescribedColumn describedColumn = matchedColumn.getDescribedColumn();
				entries.add(new MetadataEntry(describedColumn.getIndex(), matchedColumn.getObjects(),
						describedColumn.getLookupName(), describedColumn.getLookupName(),
						decoderFor(dialect, matchedColumn.getType(), describedColumn.getRawColumnDescriptor()),
						describedColumn.getUntranslatedName()));
			}
		}

		List<ValueDecoder> decoders = new ArrayList<>(entries.size());

		for (MetadataEntry entry : entries)
			decoders.add(entry.getDecoder());

		Map<Object, MetadataEntry> keymap = buildKeymap(entries, dialect,
				matchStrategy == MatchStrategy.NONE && dialect.hasColumnNameTranslator());

		return new CursorRowMetadata(keymap, keys, decoders, dialect.isCaseSensitive(), dialect.getNormalizationLocale(),
				null, matchStrategy);
	}

	@NonNull
	protected Map<Object, MetadataEntry> buildKeymap(@NonNull List<MetadataEntry> entries,
																									 @NonNull Dialect dialect,
																									 boolean includeUntranslatedNames) {
		requireNonNull(entries);
		requireNonNull(dialect);

		Map<Object, MetadataEntry> keymap = new HashMap<>(entries.size() * 4);
		int size = entries.size();

		for (MetadataEntry entry : entries) {
			keymap.put(entry.getIndex(), entry);
			keymap.put(entry.getIndex() - size, entry);
		}

		// Primary names take precedence over everything else; a later column wins until the ambiguity pass below
		Map<Object, MetadataEntry> entriesByLookupKey = new LinkedHashMap<>(size);

		for (MetadataEntry entry : entries)
			entriesByLookupKey.put(entry.getLookupKey(), entry);

		// Every possible key, across all entries, that refers to more than one position
		Map<Object, Integer> indexesByKey = new HashMap<>();
		Set<Object> ambiguousKeys = new HashSet<>();

		for (MetadataEntry entry : entries) {
			List<Object> candidateKeys = new ArrayList<>(1 + entry.getObjects().size());

			if (entry.getRenderedName() != null)
				candidateKeys.add(entry.getRenderedName());

			candidateKeys.addAll(entry.getObjects());

			for (Object candidateKey : candidateKeys) {
				Object key = foldKey(candidateKey, dialect);
				Integer existingIndex = indexesByKey.putIfAbsent(key, entry.getIndex());

				if (existingIndex != null && !existingIndex.equals(entry.getIndex()))
					ambiguousKeys.add(key);
			}
		}

		for (MetadataEntry entry : entries)
			for (Object object : entry.getObjects()) {
				Object key = foldKey(object, dialect);

				if (!ambiguousKeys.contains(key))
					keymap.put(key, entry);
			}

		for (Object ambiguousKey : ambiguousKeys)
			entriesByLookupKey.put(ambiguousKey, MetadataEntry.ambiguous(ambiguousKey));

		keymap.putAll(entriesByLookupKey);

		if (includeUntranslatedNames)
			for (MetadataEntry entry : entries)
				if (entry.getUntranslatedName() != null)
					keymap.put(dialect.foldKey(entry.getUntranslatedName()), keymap.get(entry.getLookupKey()));

		return keymap;
	}

	@NonNull
	protected List<DescribedColumn> describeColumns(@NonNull List<RawColumnDescriptor> description,
																									@NonNull Dialect dialect) {
		requireNonNull(description);
		requireNonNull(dialect);

		List<DescribedColumn> describedColumns = new ArrayList<>(description.size());

		for (int i = 0; i < description.size(); ++i) {
			RawColumnDescriptor rawColumnDescriptor = description.get(i);
			String name = rawColumnDescriptor.getName();
			String untranslatedName = null;
			String translatedName = dialect.translateColumnName(name).orElse(null);

			if (translatedName != null) {
				untranslatedName = name;
				name = translatedName;
			}

			if (dialect.isNameNormalizationRequired())
				name = dialect.normalizeName(name);

			describedColumns.add(new DescribedColumn(i, name, dialect.foldKey(name), untranslatedName, rawColumnDescriptor));
		}

		return describedColumns;
	}

	@NonNull
	protected List<MatchedColumn> matchByPosition(@NonNull List<DescribedColumn> describedColumns,
																								@NonNull List<ResultColumn> declaredColumns) {
		requireNonNull(describedColumns);
		requireNonNull(declaredColumns);

		if (declaredColumns.size() > describedColumns.size())
			LOGGER.warning(format("Number of columns in textual SQL (%d) is smaller than number of columns requested (%d)",
					describedColumns.size(), declaredColumns.size()));

		Set<Object> seen = Collections.newSetFromMap(new IdentityHashMap<>());
		List<MatchedColumn> matchedColumns = new ArrayList<>(describedColumns.size());

		for (DescribedColumn describedColumn : describedColumns) {
			int index = describedColumn.getIndex();

			if (index < declaredColumns.size()) {
				ResultColumn resultColumn = declaredColumns.get(index);
				List<Object> objects = resultColumn.getObjects();

				if (!objects.isEmpty() && !seen.add(objects.get(0)))
					throw new InvalidRequestException(format("Duplicate column expression requested in textual SQL: %s",
							objects.get(0)));

				matchedColumns.add(new MatchedColumn(describedColumn, objects, resultColumn.getType()));
			} else {
				matchedColumns.add(new MatchedColumn(describedColumn, List.of(), SqlType.NULL));
			}
		}

		return matchedColumns;
	}

	@NonNull
	protected List<MatchedColumn> matchByName(@NonNull List<DescribedColumn> describedColumns,
																						@NonNull List<ResultColumn> declaredColumns,
																						@NonNull Dialect dialect,
																						boolean looseColumnNameMatching) {
		requireNonNull(describedColumns);
		requireNonNull(declaredColumns);
		requireNonNull(dialect);

		Map<Object, DeclaredMatch> declaredMatchesByKey = new HashMap<>();

		for (ResultColumn resultColumn : declaredColumns) {
			String key = dialect.foldKey(resultColumn.getRenderedName());
			DeclaredMatch existing = declaredMatchesByKey.get(key);

			if (existing == null) {
				declaredMatchesByKey.put(key, new DeclaredMatch(resultColumn.getObjects(), resultColumn.getType()));
			} else {
				// Same rendered name twice: pool the objects so that all of them turn out ambiguous if the driver
				// reports the name twice as well
				List<Object> objects = new ArrayList<>(existing.getObjects());
				objects.addAll(resultColumn.getObjects());
				declaredMatchesByKey.put(key, new DeclaredMatch(objects, existing.getType()));
			}

			if (looseColumnNameMatching)
				for (Object object : resultColumn.getObjects())
					declaredMatchesByKey.putIfAbsent(foldKey(object, dialect),
							new DeclaredMatch(resultColumn.getObjects(), resultColumn.getType()));
		}

		List<MatchedColumn> matchedColumns = new ArrayList<>(describedColumns.size());

		for (DescribedColumn describedColumn : describedColumns) {
			DeclaredMatch declaredMatch = declaredMatchesByKey.get(describedColumn.getLookupName());

			if (declaredMatch == null)
				matchedColumns.add(new MatchedColumn(describedColumn, List.of(), SqlType.NULL));
			else
				matchedColumns.add(new MatchedColumn(describedColumn, declaredMatch.getObjects(), declaredMatch.getType()));
		}

		return matchedColumns;
	}

	@NonNull
	protected ValueDecoder decoderFor(@NonNull Dialect dialect,
																		@NonNull TypeDescriptor type,
																		@NonNull RawColumnDescriptor rawColumnDescriptor) {
		requireNonNull(dialect);
		requireNonNull(type);
		requireNonNull(rawColumnDescriptor);

		return dialect.getResultDecoderLookup().decoderFor(dialect, type, rawColumnDescriptor);
	}

	@NonNull
	protected String buildDescriptionSignature(@NonNull List<RawColumnDescriptor> description,
																						 @NonNull Dialect dialect) {
		requireNonNull(description);
		requireNonNull(dialect);

		StringBuilder sb = new StringBuilder(16 + description.size() * 16);
		sb.append(description.size());
		sb.append(dialect.isCaseSensitive() ? "|cs" : "|ci");

		for (RawColumnDescriptor rawColumnDescriptor : description) {
			sb.append('|');
			sb.append(rawColumnDescriptor.getName());
			sb.append(':');
			sb.append(rawColumnDescriptor.getJdbcTypeCode());
		}

		return sb.toString();
	}

	@NonNull
	private static Object foldKey(@NonNull Object key,
																@NonNull Dialect dialect) {
		return key instanceof String string ? dialect.foldKey(string) : key;
	}

	@NonNull
	protected Boolean getMetadataCachingEnabled() {
		return this.metadataCachingEnabled;
	}

	@NonNull
	protected Map<MetadataCacheKey, CachedMetadata> getMetadataCache() {
		return this.metadataCache;
	}

	/**
	 * A raw column after name translation and normalization.
	 */
	protected static final class DescribedColumn {
		private final int index;
		@NonNull
		private final String name;
		@NonNull
		private final String lookupName;
		@Nullable
		private final String untranslatedName;
		@NonNull
		private final RawColumnDescriptor rawColumnDescriptor;

		DescribedColumn(int index,
										@NonNull String name,
										@NonNull String lookupName,
										@Nullable String untranslatedName,
										@NonNull RawColumnDescriptor rawColumnDescriptor) {
			this.index = index;
			this.name = requireNonNull(name);
			this.lookupName = requireNonNull(lookupName);
			this.untranslatedName = untranslatedName;
			this.rawColumnDescriptor = requireNonNull(rawColumnDescriptor);
		}

		int getIndex() {
			return this.index;
		}

		@NonNull
		String getName() {
			return this.name;
		}

		@NonNull
		String getLookupName() {
			return this.lookupName;
		}

		@Nullable
		String getUntranslatedName() {
			return this.untranslatedName;
		}

		@NonNull
		RawColumnDescriptor getRawColumnDescriptor() {
			return this.rawColumnDescriptor;
		}
	}

	/**
	 * A raw column paired with whatever was declared for it.
	 */
	protected static final class MatchedColumn {
		@NonNull
		private final DescribedColumn describedColumn;
		@NonNull
		private final List<Object> objects;
		@NonNull
		private final TypeDescriptor type;

		MatchedColumn(@NonNull DescribedColumn describedColumn,
									@NonNull List<Object> objects,
									@NonNull TypeDescriptor type) {
			this.describedColumn = requireNonNull(describedColumn);
			this.objects = requireNonNull(objects);
			this.type = requireNonNull(type);
		}

		@NonNull
		DescribedColumn getDescribedColumn() {
			return this.describedColumn;
		}

		@NonNull
		List<Object> getObjects() {
			return this.objects;
		}

		@NonNull
		TypeDescriptor getType() {
			return this.type;
		}
	}

	private static final class DeclaredMatch {
		@NonNull
		private final List<Object> objects;
		@NonNull
		private final TypeDescriptor type;

		private DeclaredMatch(@NonNull List<Object> objects,
													@NonNull TypeDescriptor type) {
			this.objects = requireNonNull(objects);
			this.type = requireNonNull(type);
		}

		@NonNull
		List<Object> getObjects() {
			return this.objects;
		}

		@NonNull
		TypeDescriptor getType() {
			return this.type;
		}
	}

	/**
	 * Cache entry: metadata plus the compiled statement it was resolved against.
	 */
	protected static final class CachedMetadata {
		@NonNull
		private final CompiledStatement compiledStatement;
		@NonNull
		private final CursorRowMetadata rowMetadata;

		CachedMetadata(@NonNull CompiledStatement compiledStatement,
									 @NonNull CursorRowMetadata rowMetadata) {
			this.compiledStatement = requireNonNull(compiledStatement);
			this.rowMetadata = requireNonNull(rowMetadata);
		}

		@NonNull
		CompiledStatement getCompiledStatement() {
			return this.compiledStatement;
		}

		@NonNull
		CursorRowMetadata getRowMetadata() {
			return this.rowMetadata;
		}
	}

	protected static final class MetadataCacheKey {
		@NonNull
		private final CacheKey cacheKey;
		@NonNull
		private final String descriptionSignature;

		MetadataCacheKey(@NonNull CacheKey cacheKey,
										 @NonNull String descriptionSignature) {
			this.cacheKey = requireNonNull(cacheKey);
			this.descriptionSignature = requireNonNull(descriptionSignature);
		}

		@Override
		public boolean equals(Object object) {
			if (this == object)
				return true;

			if (!(object instanceof MetadataCacheKey metadataCacheKey))
				return false;

			return this.cacheKey.equals(metadataCacheKey.cacheKey)
					&& this.descriptionSignature.equals(metadataCacheKey.descriptionSignature);
		}

		@Override
		public int hashCode() {
			return Objects.hash(this.cacheKey, this.descriptionSignature);
		}
	}
}
