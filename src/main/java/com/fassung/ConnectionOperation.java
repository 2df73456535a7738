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

import java.util.Optional;

/**
 * Represents work done on a leased {@link Connection}, optionally returning a value.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 * @see Pool#withConnection(ConnectionOperation)
 */
@FunctionalInterface
public interface ConnectionOperation<T> {
	/**
	 * Performs the work.
	 *
	 * @param connection the leased connection; it is released when this method returns or throws
	 * @return the result of the work
	 * @throws Exception if an error occurs while performing the work
	 */
	@NonNull
	Optional<T> perform(@NonNull Connection connection) throws Exception;
}
