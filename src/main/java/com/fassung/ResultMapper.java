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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Contract for mapping {@link Row}s to instances of a result type.
 * <p>
 * Implementations should be threadsafe.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
@FunctionalInterface
public interface ResultMapper {
	/**
	 * Maps a single row.
	 *
	 * @param row        the row to map
	 * @param rowIndex   zero-based position of the row within its result, used in error reporting
	 * @param resultType the type to map to
	 * @param <T>        result instance type token
	 * @return the mapped instance; {@code null} only when a single-column row holds {@code null}
	 * @throws MappingException if the row does not fit the result type
	 */
	@Nullable
	<T> T mapRow(@NonNull Row row,
				 @NonNull Integer rowIndex,
				 @NonNull Class<T> resultType);

	/**
	 * Maps rows in order, one instance per row.
	 *
	 * @param rows       the rows to map
	 * @param resultType the type to map to
	 * @param <T>        result instance type token
	 * @return the mapped instances, in row order
	 * @throws MappingException if any row does not fit the result type
	 */
	@NonNull
	default <T> List<@Nullable T> map(@NonNull List<Row> rows,
									  @NonNull Class<T> resultType) {
		requireNonNull(rows);
		requireNonNull(resultType);

		List<T> results = new ArrayList<>(rows.size());

		for (int i = 0; i < rows.size(); ++i)
			results.add(mapRow(rows.get(i), i, resultType));

		return results;
	}

	/**
	 * Parses the text payload of a {@link Notification} for a {@link NotificationListener}.
	 * <p>
	 * The default accepts only {@code String} and {@code Object}, returning the payload unchanged.
	 *
	 * @param payload     the payload text, empty if the notification had none
	 * @param payloadType the type to parse into
	 * @param <T>         payload instance type token
	 * @return the parsed payload
	 * @throws DatabaseException if the payload cannot be parsed as {@code payloadType}
	 */
	@Nullable
	default <T> T mapPayload(@NonNull String payload,
							 @NonNull Class<T> payloadType) {
		requireNonNull(payload);
		requireNonNull(payloadType);

		if (payloadType == String.class || payloadType == Object.class)
			return payloadType.cast(payload);

		throw new DatabaseException(format("Unable to parse notification payload '%s' as %s", payload, payloadType.getSimpleName()));
	}

	/**
	 * Acquires a concrete implementation of this interface which resolves zone-less date/time values in the system
	 * default time zone.
	 *
	 * @return a {@code ResultMapper} with default settings
	 */
	@NonNull
	static ResultMapper withDefaultConfiguration() {
		return new DefaultResultMapper(ZoneId.systemDefault());
	}

	/**
	 * Acquires a concrete implementation of this interface which resolves zone-less date/time values in the given
	 * time zone.
	 *
	 * @param timeZone the zone used when converting between zone-less and zoned date/time values
	 * @return a {@code ResultMapper} for the time zone
	 */
	@NonNull
	static ResultMapper withTimeZone(@NonNull ZoneId timeZone) {
		requireNonNull(timeZone);
		return new DefaultResultMapper(timeZone);
	}
}
