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

import javax.annotation.concurrent.Immutable;
import java.io.InvalidObjectException;
import java.io.ObjectInputStream;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * {@link RowMetadata} for a statement which returns rows, as produced by a {@link RowMetadataResolver}.
 * <p>
 * The keymap contains every valid lookup key: integer positions (negative positions count from the end), primary
 * column names (lowercased when the dialect is case-insensitive) and the objects that declared each column. Keys that
 * match more than one column map to an ambiguous record and fail on lookup.
 * <p>
 * Serialized instances keep only the string and integer keys; decoders become pass-through and declaring objects are
 * dropped.
 *
 * @since 1.0.0
 */
@Immutable
public final class CursorRowMetadata extends RowMetadata {
	private static final long serialVersionUID = 1L;

	@NonNull
	private final Map<Object, MetadataEntry> keymap;
	@NonNull
	private final List<String> keys;
	@NonNull
	private final List<ValueDecoder> decoders;
	private final boolean caseSensitive;
	@NonNull
	private final Locale foldingLocale;
	@Nullable
	private final List<Integer> translatedIndexes;
	@Nullable
	private final MatchStrategy matchStrategy;

	CursorRowMetadata(@NonNull Map<Object, MetadataEntry> keymap,
										@NonNull List<String> keys,
										@NonNull List<ValueDecoder> decoders,
										boolean caseSensitive,
										@NonNull Locale foldingLocale,
										@Nullable List<Integer> translatedIndexes,
										@Nullable MatchStrategy matchStrategy) {
		requireNonNull(keymap);
		requireNonNull(keys);
		requireNonNull(decoders);
		requireNonNull(foldingLocale);

		this.keymap = Collections.unmodifiableMap(new HashMap<>(keymap));
		this.keys = Collections.unmodifiableList(new ArrayList<>(keys));
		this.decoders = List.copyOf(decoders);
		this.caseSensitive = caseSensitive;
		this.foldingLocale = foldingLocale;
		this.translatedIndexes = translatedIndexes == null ? null : List.copyOf(translatedIndexes);
		this.matchStrategy = matchStrategy;
	}

	@Override
	public boolean returnsRows() {
		return true;
	}

	@Override
	@NonNull
	public List<String> getKeys() {
		return this.keys;
	}

	@Override
	public boolean hasKey(@Nullable Object key) {
		return key != null && this.keymap.containsKey(foldKey(key));
	}

	@Override
	public int indexForKey(@NonNull Object key) {
		requireNonNull(key);
		return entryForKey(key).getIndex();
	}

	@NonNull
	MetadataEntry entryForKey(@NonNull Object key) {
		requireNonNull(key);

		MetadataEntry entry = this.keymap.get(foldKey(key));

		if (entry == null)
			throw new NoSuchColumnException(key);

		if (entry.isAmbiguous())
			throw new AmbiguousColumnException(key);

		return entry;
	}

	@Override
	@NonNull
	public CursorRowMetadata reduce(@NonNull List<?> keys) {
		requireNonNull(keys);

		List<MetadataEntry> entries = new ArrayList<>(keys.size());

		for (Object key : keys)
			entries.add(entryForKey(key));

		List<Integer> indexes = new ArrayList<>(entries.size());
		List<String> newKeys = new ArrayList<>(entries.size());

		for (MetadataEntry entry : entries) {
			int index = entry.getIndex();
			indexes.add(this.translatedIndexes == null ? index : this.translatedIndexes.get(index));
			newKeys.add(String.valueOf(entry.getLookupKey()));
		}

		Map<Object, MetadataEntry> newKeymap = new HashMap<>();
		int size = entries.size();

		for (int i = 0; i < size; ++i) {
			MetadataEntry newEntry = entries.get(i).withIndex(i);
			newKeymap.put(newEntry.getLookupKey(), newEntry);
			newKeymap.put(i, newEntry);
			newKeymap.put(i - size, newEntry);
		}

		for (int i = 0; i < size; ++i) {
			MetadataEntry newEntry = newKeymap.get(i);

			for (Object object : newEntry.getObjects())
				newKeymap.put(foldKey(object), newEntry);
		}

		return new CursorRowMetadata(newKeymap, newKeys, getDecoders(), isCaseSensitive(), getFoldingLocale(), indexes,
				this.matchStrategy);
	}

	/**
	 * A copy of this metadata in which each declared column can also be found by the corresponding object of a
	 * structurally identical statement, so metadata cached for one statement serves another.
	 *
	 * @param declaredColumns     the declared columns this metadata was resolved against
	 * @param replacementObjects per declared column, additional objects to key it by
	 * @return the adapted metadata
	 */
	@NonNull
	CursorRowMetadata adapt(@NonNull List<ResultColumn> declaredColumns,
													@NonNull List<? extends List<?>> replacementObjects) {
		requireNonNull(declaredColumns);
		requireNonNull(replacementObjects);

		if (this.translatedIndexes != null)
			throw new IllegalStateException("Reduced metadata cannot be adapted");

		Map<Object, MetadataEntry> adaptedKeymap = new HashMap<>(this.keymap);
		int count = Math.min(declaredColumns.size(), replacementObjects.size());

		for (int i = 0; i < count; ++i) {
			MetadataEntry entry = this.keymap.get(foldKey(declaredColumns.get(i).getName()));

			if (entry == null)
				continue;

			for (Object replacementObject : replacementObjects.get(i))
				adaptedKeymap.put(replacementObject, entry);
		}

		return new CursorRowMetadata(adaptedKeymap, getKeys(), getDecoders(), isCaseSensitive(), getFoldingLocale(), null,
				this.matchStrategy);
	}

	@NonNull
	Object foldKey(@NonNull Object key) {
		if (!isCaseSensitive() && key instanceof String string)
			return string.toLowerCase(getFoldingLocale());

		return key;
	}

	/**
	 * How the declared columns were matched to the driver's columns.
	 *
	 * @return the match strategy, or empty for deserialized or hand-built metadata
	 */
	@NonNull
	public Optional<MatchStrategy> getMatchStrategy() {
		return Optional.ofNullable(this.matchStrategy);
	}

	public boolean isCaseSensitive() {
		return this.caseSensitive;
	}

	@NonNull
	Locale getFoldingLocale() {
		return this.foldingLocale;
	}

	@Override
	@NonNull
	List<ValueDecoder> getDecoders() {
		return this.decoders;
	}

	@Override
	@Nullable
	List<Integer> getTranslatedIndexes() {
		return this.translatedIndexes;
	}

	@NonNull
	Map<Object, MetadataEntry> getKeymap() {
		return this.keymap;
	}

	@Override
	public String toString() {
		return format("%s{keys=%s, caseSensitive=%s, matchStrategy=%s}", getClass().getSimpleName(), getKeys(),
				isCaseSensitive(), this.matchStrategy);
	}

	private Object writeReplace() {
		return new SerializedForm(this);
	}

	private void readObject(ObjectInputStream objectInputStream) throws InvalidObjectException {
		throw new InvalidObjectException(format("%s instances are deserialized through a proxy", getClass().getSimpleName()));
	}

	/**
	 * Index-only serialized form of {@link CursorRowMetadata}.
	 */
	private static final class SerializedForm implements Serializable {
		private static final long serialVersionUID = 1L;

		// Ambiguous keys are kept with a null index
		private final LinkedHashMap<Object, Integer> indexesByKey;
		private final ArrayList<String> keys;
		private final boolean caseSensitive;
		private final Locale foldingLocale;
		@Nullable
		private final ArrayList<Integer> translatedIndexes;

		private SerializedForm(@NonNull CursorRowMetadata cursorRowMetadata) {
			requireNonNull(cursorRowMetadata);

			this.indexesByKey = new LinkedHashMap<>();

			for (Map.Entry<Object, MetadataEntry> entry : cursorRowMetadata.getKeymap().entrySet())
				if (entry.getKey() instanceof String || entry.getKey() instanceof Integer)
					this.indexesByKey.put(entry.getKey(), entry.getValue().getIndex());

			this.keys = new ArrayList<>(cursorRowMetadata.getKeys());
			this.caseSensitive = cursorRowMetadata.isCaseSensitive();
			this.foldingLocale = cursorRowMetadata.getFoldingLocale();
			this.translatedIndexes = cursorRowMetadata.getTranslatedIndexes() == null
					? null : new ArrayList<>(cursorRowMetadata.getTranslatedIndexes());
		}

		private Object readResolve() {
			Map<Object, MetadataEntry> keymap = new HashMap<>(this.indexesByKey.size());

			for (Map.Entry<Object, Integer> entry : this.indexesByKey.entrySet())
				keymap.put(entry.getKey(), new MetadataEntry(entry.getValue(), List.of(), entry.getKey(),
						entry.getKey() instanceof String string ? string : null, ValueDecoder.passThrough(), null));

			int decoderCount = this.translatedIndexes == null ? this.keys.size()
					: this.translatedIndexes.stream().mapToInt(Integer::intValue).max().orElse(-1) + 1;

			return new CursorRowMetadata(keymap, this.keys, Collections.nCopies(decoderCount, ValueDecoder.passThrough()),
					this.caseSensitive, this.foldingLocale, this.translatedIndexes, null);
		}
	}
}
