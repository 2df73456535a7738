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
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Fluent interface for acquiring instances of specialized slot value types.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class Parameters {
	private Parameters() {
		// Prevents instantiation
	}

	/**
	 * Acquires a SQL ARRAY parameter for a {@link List} given an appropriate database-specific element type name.
	 *
	 * @param baseTypeName the SQL ARRAY element type, e.g. {@code "text"}, {@code "uuid"}, {@code "int4"} ...
	 * @param list         the list whose elements will be used to populate the SQL ARRAY, or {@code null}
	 * @return a SQL ARRAY parameter for the given list
	 */
	@Nonnull
	public static ArrayParameter arrayOf(@Nonnull String baseTypeName,
										 @Nullable List<?> list) {
		requireNonNull(baseTypeName);
		return new DefaultArrayParameter(baseTypeName, list == null ? null : new ArrayList<Object>(list));
	}

	/**
	 * Acquires a SQL ARRAY parameter for a native Java array given an appropriate database-specific element type name.
	 *
	 * @param baseTypeName the SQL ARRAY element type, e.g. {@code "text"}, {@code "uuid"}, {@code "int4"} ...
	 * @param array        the native Java array whose elements will be used to populate the SQL ARRAY, or {@code null}
	 * @return a SQL ARRAY parameter for the given Java array
	 */
	@Nonnull
	public static ArrayParameter arrayOf(@Nonnull String baseTypeName,
										 @Nullable Object[] array) {
		requireNonNull(baseTypeName);
		return new DefaultArrayParameter(baseTypeName, array == null ? null : new ArrayList<Object>(Arrays.asList(array)));
	}

	/**
	 * Acquires a parameter for SQL {@code IN} list expansion using a {@link Collection}.
	 *
	 * @param elements the elements to expand into placeholders
	 * @return an IN-list parameter for the given elements
	 */
	@Nonnull
	public static InListParameter inList(@Nonnull Collection<?> elements) {
		requireNonNull(elements);
		return new DefaultInListParameter(new ArrayList<Object>(elements));
	}

	/**
	 * Acquires a parameter for SQL {@code IN} list expansion using a Java array.
	 *
	 * @param elements the elements to expand into placeholders
	 * @return an IN-list parameter for the given elements
	 */
	@Nonnull
	public static InListParameter inList(@Nonnull Object[] elements) {
		requireNonNull(elements);
		return new DefaultInListParameter(new ArrayList<Object>(Arrays.asList(elements)));
	}

	/**
	 * Default package-private implementation of {@link ArrayParameter}.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 * @since 1.0.0
	 */
	@ThreadSafe
	static final class DefaultArrayParameter implements ArrayParameter {
		@Nonnull
		private final String baseTypeName;
		@Nullable
		private final List<Object> elements;

		DefaultArrayParameter(@Nonnull String baseTypeName,
							  @Nullable List<Object> elements) {
			requireNonNull(baseTypeName);

			this.baseTypeName = baseTypeName;
			this.elements = elements == null ? null : Collections.unmodifiableList(elements);
		}

		@Nonnull
		@Override
		public String getBaseTypeName() {
			return this.baseTypeName;
		}

		@Nonnull
		@Override
		public Optional<List<Object>> getElements() {
			return Optional.ofNullable(this.elements);
		}

		@Override
		public boolean equals(Object object) {
			if (this == object)
				return true;

			if (!(object instanceof DefaultArrayParameter))
				return false;

			DefaultArrayParameter arrayParameter = (DefaultArrayParameter) object;

			return Objects.equals(getBaseTypeName(), arrayParameter.getBaseTypeName())
					&& Objects.equals(getElements(), arrayParameter.getElements());
		}

		@Override
		public int hashCode() {
			return Objects.hash(getBaseTypeName(), getElements());
		}

		@Override
		@Nonnull
		public String toString() {
			return format("%s{baseTypeName=%s, elements=%s}", getClass().getSimpleName(), getBaseTypeName(),
					getElements().map(Object::toString).orElse("null"));
		}
	}

	/**
	 * Default package-private implementation of {@link InListParameter}.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 * @since 1.0.0
	 */
	@ThreadSafe
	static final class DefaultInListParameter implements InListParameter {
		@Nonnull
		private final List<Object> elements;

		DefaultInListParameter(@Nonnull List<Object> elements) {
			requireNonNull(elements);
			this.elements = Collections.unmodifiableList(elements);
		}

		@Nonnull
		@Override
		public List<Object> getElements() {
			return this.elements;
		}

		@Override
		public boolean equals(Object object) {
			if (this == object)
				return true;

			if (!(object instanceof DefaultInListParameter))
				return false;

			return Objects.equals(getElements(), ((DefaultInListParameter) object).getElements());
		}

		@Override
		public int hashCode() {
			return Objects.hash(getElements());
		}

		@Override
		@Nonnull
		public String toString() {
			return format("%s{elementCount=%d}", getClass().getSimpleName(), getElements().size());
		}
	}
}
