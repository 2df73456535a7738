/*
 * Copyright 2015-2022 Transmogrify LLC, 2022-2026 Revetware LLC.
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

package com.fassung;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * One row of a result: an ordered, immutable mapping from column name to wire value.
 * <p>
 * Column names are matched case-sensitively. When a result repeats a column name, the first occurrence wins for
 * name-based lookups while every occurrence remains reachable by index.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class Row {
	@Nonnull
	private final List<String> columnNames;
	@Nonnull
	private final List<Object> values;
	@Nonnull
	private final Map<String, Integer> indicesByColumnName;

	private Row(@Nonnull List<String> columnNames,
				@Nonnull List<Object> values) {
		requireNonNull(columnNames);
		requireNonNull(values);

		if (columnNames.size() != values.size())
			throw new IllegalArgumentException(format("Row has %d column names but %d values", columnNames.size(), values.size()));

		Map<String, Integer> indicesByColumnName = new LinkedHashMap<>(columnNames.size());

		for (int i = 0; i < columnNames.size(); ++i)
			indicesByColumnName.putIfAbsent(requireNonNull(columnNames.get(i), "Column names cannot be null"), i);

		this.columnNames = Collections.unmodifiableList(new ArrayList<>(columnNames));
		this.values = Collections.unmodifiableList(new ArrayList<>(values));
		this.indicesByColumnName = Collections.unmodifiableMap(indicesByColumnName);
	}

	/**
	 * Creates a row from parallel lists of column names and values.
	 *
	 * @param columnNames the column names, in result order
	 * @param values      the column values, in result order (may include {@code null})
	 * @return a row
	 */
	@Nonnull
	public static Row of(@Nonnull List<String> columnNames,
						 @Nonnull List<Object> values) {
		return new Row(columnNames, values);
	}

	/**
	 * Creates a row from an ordered map of column name to value.
	 *
	 * @param valuesByColumnName the column values keyed by name, in result order
	 * @return a row
	 */
	@Nonnull
	public static Row of(@Nonnull Map<String, ?> valuesByColumnName) {
		requireNonNull(valuesByColumnName);
		return new Row(new ArrayList<>(valuesByColumnName.keySet()), new ArrayList<Object>(valuesByColumnName.values()));
	}

	@Nonnull
	public List<String> getColumnNames() {
		return this.columnNames;
	}

	@Nonnull
	public List<Object> getValues() {
		return this.values;
	}

	@Nonnull
	public Integer getColumnCount() {
		return this.columnNames.size();
	}

	@Nonnull
	public Boolean hasColumn(@Nonnull String columnName) {
		requireNonNull(columnName);
		return this.indicesByColumnName.containsKey(columnName);
	}

	/**
	 * Gets the value of the named column.
	 *
	 * @param columnName the case-sensitive column name
	 * @return the value, or empty if the column is absent or its value is {@code null}
	 */
	@Nonnull
	public Optional<Object> get(@Nonnull String columnName) {
		requireNonNull(columnName);

		Integer index = this.indicesByColumnName.get(columnName);
		return index == null ? Optional.empty() : Optional.ofNullable(this.values.get(index));
	}

	/**
	 * Gets the value at the given zero-based column index.
	 *
	 * @param columnIndex the zero-based column index
	 * @return the value, which may be {@code null}
	 */
	@Nullable
	public Object get(int columnIndex) {
		return this.values.get(columnIndex);
	}

	/**
	 * An ordered map view of this row; duplicate column names keep their first value.
	 *
	 * @return an unmodifiable map of column name to value
	 */
	@Nonnull
	public Map<String, Object> toMap() {
		Map<String, Object> map = new LinkedHashMap<>(this.indicesByColumnName.size());

		for (Map.Entry<String, Integer> entry : this.indicesByColumnName.entrySet())
			map.put(entry.getKey(), this.values.get(entry.getValue()));

		return Collections.unmodifiableMap(map);
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Row))
			return false;

		Row row = (Row) object;

		return Objects.equals(getColumnNames(), row.getColumnNames())
				&& Objects.deepEquals(getValues().toArray(), row.getValues().toArray());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getColumnNames());
	}

	@Override
	@Nonnull
	public String toString() {
		return format("%s{columnNames=%s}", getClass().getSimpleName(), getColumnNames());
	}
}
