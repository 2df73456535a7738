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
import javax.annotation.concurrent.NotThreadSafe;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Thrown when a {@link Row} cannot be mapped to the requested result type.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public class MappingException extends DatabaseException {
	@Nonnull
	private final Integer rowIndex;
	@Nullable
	private final String columnName;
	@Nullable
	private final String fieldName;

	public MappingException(@Nonnull Integer rowIndex,
							@Nullable String columnName,
							@Nullable String fieldName,
							@Nonnull String reason) {
		this(rowIndex, columnName, fieldName, reason, null);
	}

	public MappingException(@Nonnull Integer rowIndex,
							@Nullable String columnName,
							@Nullable String fieldName,
							@Nonnull String reason,
							@Nullable Throwable cause) {
		super(format("Unable to map row %d (column '%s', field '%s'): %s", requireNonNull(rowIndex),
				columnName, fieldName, requireNonNull(reason)), cause);

		this.rowIndex = rowIndex;
		this.columnName = columnName;
		this.fieldName = fieldName;
	}

	/**
	 * Zero-based index of the failing row within its result.
	 *
	 * @return the row index
	 */
	@Nonnull
	public Integer getRowIndex() {
		return this.rowIndex;
	}

	@Nonnull
	public Optional<String> getColumnName() {
		return Optional.ofNullable(this.columnName);
	}

	@Nonnull
	public Optional<String> getFieldName() {
		return Optional.ofNullable(this.fieldName);
	}
}
