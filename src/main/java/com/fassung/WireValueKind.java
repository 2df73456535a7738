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
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.Date;
import java.util.Map;
import java.util.UUID;

/**
 * The fixed set of value kinds a {@link WireLink} may place in a {@link Row}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
public enum WireValueKind {
	NULL,
	BOOLEAN,
	/**
	 * {@link Byte}, {@link Short}, {@link Integer}, {@link Long} or {@link BigInteger}.
	 */
	INTEGER,
	/**
	 * {@link Float}, {@link Double} or {@link BigDecimal}.
	 */
	FLOAT,
	/**
	 * {@link String}, {@link Character} or {@link UUID}.
	 */
	TEXT,
	BYTES,
	/**
	 * {@code java.time} values and legacy {@link Date} subclasses.
	 */
	DATE_TIME,
	/**
	 * Arrays, {@link Collection}s and {@link Map}s standing for SQL arrays and composite values.
	 */
	COMPOSITE,
	/**
	 * Anything a driver produced that falls outside the kinds above.
	 */
	OTHER;

	/**
	 * Determines the kind of a wire value.
	 *
	 * @param value the wire value
	 * @return the value's kind
	 */
	@Nonnull
	public static WireValueKind of(@Nullable Object value) {
		if (value == null)
			return NULL;
		if (value instanceof Boolean)
			return BOOLEAN;
		if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long || value instanceof BigInteger)
			return INTEGER;
		if (value instanceof Float || value instanceof Double || value instanceof BigDecimal)
			return FLOAT;
		if (value instanceof String || value instanceof Character || value instanceof UUID)
			return TEXT;
		if (value instanceof byte[])
			return BYTES;
		if (value instanceof LocalDate || value instanceof LocalTime || value instanceof LocalDateTime
				|| value instanceof OffsetDateTime || value instanceof OffsetTime || value instanceof ZonedDateTime
				|| value instanceof Instant || value instanceof Date)
			return DATE_TIME;
		if (value instanceof Collection<?> || value instanceof Map<?, ?> || value.getClass().isArray())
			return COMPOSITE;

		return OTHER;
	}
}
