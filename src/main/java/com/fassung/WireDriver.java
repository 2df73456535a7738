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

/**
 * Opens network links to a database server.
 * <p>
 * This is the seam between the library and a concrete wire protocol; {@link JdbcWireDriver} provides a JDBC-backed
 * implementation. A {@link Pool} owns a single driver and calls {@link #open()} whenever it needs a new link.
 * <p>
 * Implementations must be threadsafe.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public interface WireDriver {
	/**
	 * Opens a new link to the database.
	 *
	 * @return an open link
	 * @throws WireException if the link cannot be established
	 */
	@Nonnull
	WireLink open();

	/**
	 * The positional-parameter syntax this driver's links expect in statement text.
	 *
	 * @return the placeholder style, {@link PlaceholderStyle#DOLLAR_NUMBERED} by default
	 */
	@Nonnull
	default PlaceholderStyle getPlaceholderStyle() {
		return PlaceholderStyle.DOLLAR_NUMBERED;
	}

	/**
	 * Can this driver's links create, release and roll back to savepoints?
	 *
	 * @return {@code true} if savepoints are supported, {@code false} by default
	 */
	@Nonnull
	default Boolean supportsSavepoints() {
		return false;
	}
}
