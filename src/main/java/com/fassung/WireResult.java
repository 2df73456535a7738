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
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * What a {@link WireLink} returns for one statement: either rows, or an affected-row count.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class WireResult {
	@Nonnull
	private final List<String> columnNames;
	@Nonnull
	private final List<Row> rows;
	@Nonnull
	private final Long updateCount;
	@Nonnull
	private final Boolean hasRows;

	private WireResult(@Nonnull List<String> columnNames,
					   @Nonnull List<Row> rows,
					   @Nonnull Long updateCount,
					   @Nonnull Boolean hasRows) {
		this.columnNames = Collections.unmodifiableList(new ArrayList<>(requireNonNull(columnNames)));
		this.rows = Collections.unmodifiableList(new ArrayList<>(requireNonNull(rows)));
		this.updateCount = requireNonNull(updateCount);
		this.hasRows = requireNonNull(hasRows);
	}

	/**
	 * A row-returning result.
	 *
	 * @param columnNames the result's column names, known even when there are no rows
	 * @param rows        the rows, in result order
	 * @return the result
	 */
	@Nonnull
	public static WireResult ofRows(@Nonnull List<String> columnNames,
									@Nonnull List<Row> rows) {
		return new WireResult(columnNames, rows, (long) rows.size(), true);
	}

	/**
	 * A result with no rows, only a count of affected rows.
	 *
	 * @param updateCount the number of rows the statement affected
	 * @return the result
	 */
	@Nonnull
	public static WireResult ofUpdateCount(@Nonnull Long updateCount) {
		requireNonNull(updateCount);
		return new WireResult(List.of(), List.of(), updateCount, false);
	}

	@Nonnull
	public Boolean hasRows() {
		return this.hasRows;
	}

	@Nonnull
	public List<String> getColumnNames() {
		return this.columnNames;
	}

	@Nonnull
	public List<Row> getRows() {
		return this.rows;
	}

	/**
	 * Affected-row count for statements without rows; the row count otherwise.
	 *
	 * @return the count
	 */
	@Nonnull
	public Long getUpdateCount() {
		return this.updateCount;
	}

	@Nonnull
	public Optional<Row> getFirstRow() {
		return this.rows.isEmpty() ? Optional.empty() : Optional.of(this.rows.get(0));
	}

	@Override
	@Nonnull
	public String toString() {
		return hasRows()
				? format("%s{columnNames=%s, rowCount=%d}", getClass().getSimpleName(), getColumnNames(), getRows().size())
				: format("%s{updateCount=%d}", getClass().getSimpleName(), getUpdateCount());
	}
}
