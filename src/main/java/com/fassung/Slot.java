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
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.Currency;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.Set;
import java.util.UUID;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Classification of a {@link Template} slot value, as seen by a {@link TemplateCompiler}.
 * <p>
 * Every slot value falls into exactly one case: a bindable {@link Scalar}, a {@link Nested} fragment spliced inline,
 * an {@link InList} expanded into a run of placeholders, or an {@link Invalid} value that cannot be compiled.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public sealed interface Slot permits Slot.Scalar, Slot.Nested, Slot.InList, Slot.Invalid {
	/**
	 * Value types which are bound as-is.
	 */
	@Nonnull
	Set<Class<?>> SCALAR_TYPES = Set.of(
			Boolean.class, Byte.class, Short.class, Integer.class, Long.class, Float.class, Double.class,
			BigInteger.class, BigDecimal.class, String.class, Character.class, byte[].class, UUID.class,
			LocalDate.class, LocalTime.class, LocalDateTime.class, OffsetDateTime.class, OffsetTime.class,
			ZonedDateTime.class, Instant.class, Locale.class, Currency.class
	);

	/**
	 * Classifies a raw slot value.
	 * <p>
	 * {@link Optional}, {@link OptionalInt}, {@link OptionalLong} and {@link OptionalDouble} are unwrapped first.
	 *
	 * @param value the slot value
	 * @return the classification
	 */
	@Nonnull
	static Slot classify(@Nullable Object value) {
		Object unwrappedValue = unwrapOptionalValue(value);

		if (unwrappedValue == null)
			return new Scalar(null);

		if (unwrappedValue instanceof SqlFragment sqlFragment)
			return new Nested(sqlFragment);

		if (unwrappedValue instanceof InListParameter inListParameter)
			return new InList(inListParameter.getElements());

		if (unwrappedValue instanceof ArrayParameter
				|| unwrappedValue instanceof Enum<?>
				|| unwrappedValue instanceof Date
				|| unwrappedValue instanceof ZoneId
				|| SCALAR_TYPES.contains(unwrappedValue.getClass()))
			return new Scalar(unwrappedValue);

		if (unwrappedValue instanceof Collection<?> || unwrappedValue.getClass().isArray())
			return new Invalid(unwrappedValue, "collections and arrays are not expanded; use Parameters.inList(...) or Parameters.arrayOf(...)");

		if (unwrappedValue instanceof Map<?, ?>)
			return new Invalid(unwrappedValue, "maps cannot be bound");

		return new Invalid(unwrappedValue, null);
	}

	@Nullable
	private static Object unwrapOptionalValue(@Nullable Object value) {
		if (value == null)
			return null;

		if (value instanceof Optional<?> optional)
			return optional.orElse(null);
		if (value instanceof OptionalInt optionalInt)
			return optionalInt.isPresent() ? optionalInt.getAsInt() : null;
		if (value instanceof OptionalLong optionalLong)
			return optionalLong.isPresent() ? optionalLong.getAsLong() : null;
		if (value instanceof OptionalDouble optionalDouble)
			return optionalDouble.isPresent() ? optionalDouble.getAsDouble() : null;

		return value;
	}

	/**
	 * A value bound to exactly one placeholder.
	 */
	@ThreadSafe
	final class Scalar implements Slot {
		@Nullable
		private final Object value;

		private Scalar(@Nullable Object value) {
			this.value = value;
		}

		@Nullable
		public Object getValue() {
			return this.value;
		}

		@Override
		@Nonnull
		public String toString() {
			return format("%s{type=%s}", getClass().getSimpleName(), this.value == null ? "null" : this.value.getClass().getSimpleName());
		}
	}

	/**
	 * A fragment whose template is spliced inline.
	 */
	@ThreadSafe
	final class Nested implements Slot {
		@Nonnull
		private final SqlFragment fragment;

		private Nested(@Nonnull SqlFragment fragment) {
			this.fragment = requireNonNull(fragment);
		}

		@Nonnull
		public SqlFragment getFragment() {
			return this.fragment;
		}

		@Override
		@Nonnull
		public String toString() {
			return format("%s{fragment=%s}", getClass().getSimpleName(), this.fragment.getClass().getSimpleName());
		}
	}

	/**
	 * Elements expanded into a comma-separated run of placeholders.
	 */
	@ThreadSafe
	final class InList implements Slot {
		@Nonnull
		private final List<Object> elements;

		private InList(@Nonnull List<Object> elements) {
			this.elements = requireNonNull(elements);
		}

		@Nonnull
		public List<Object> getElements() {
			return this.elements;
		}

		@Override
		@Nonnull
		public String toString() {
			return format("%s{elementCount=%d}", getClass().getSimpleName(), this.elements.size());
		}
	}

	/**
	 * A value that can be neither bound nor spliced.
	 */
	@ThreadSafe
	final class Invalid implements Slot {
		@Nonnull
		private final Object value;
		@Nullable
		private final String reason;

		private Invalid(@Nonnull Object value,
						@Nullable String reason) {
			this.value = requireNonNull(value);
			this.reason = reason;
		}

		@Nonnull
		public Object getValue() {
			return this.value;
		}

		@Nonnull
		public Optional<String> getReason() {
			return Optional.ofNullable(this.reason);
		}

		@Override
		@Nonnull
		public String toString() {
			return format("%s{type=%s}", getClass().getSimpleName(), this.value.getClass().getName());
		}
	}
}
