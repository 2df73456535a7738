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
import java.util.List;
import java.util.Optional;

/**
 * Encapsulates slot data meant to be bound as a single SQL {@code ARRAY} parameter.
 * <p>
 * The {@code baseTypeName} is database-specific, e.g. {@code "text"}, {@code "int4"}, or {@code "uuid"} for
 * PostgreSQL, or {@code "INTEGER"} for HSQLDB.
 * <p>
 * Standard instances may be constructed via {@link Parameters#arrayOf(String, List)} and
 * {@link Parameters#arrayOf(String, Object[])}.
 * <p>
 * Implementations should be threadsafe.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public interface ArrayParameter {
	/**
	 * Gets the element type of this SQL ARRAY.
	 *
	 * @return the element type of this SQL ARRAY
	 */
	@Nonnull
	String getBaseTypeName();

	/**
	 * Gets the elements of this SQL ARRAY, or empty for a SQL {@code NULL} array.
	 *
	 * @return the elements of this SQL ARRAY
	 */
	@Nonnull
	Optional<List<Object>> getElements();
}
