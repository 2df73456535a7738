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

/**
 * A composable piece of SQL that expands to a {@link Template} at compile time.
 * <p>
 * Any slot value implementing this interface is spliced inline into the enclosing template rather than bound as a
 * parameter. {@link Template} is itself a fragment; applications may implement this interface for reusable clauses
 * (filters, paging, ordering) whose shape is decided by the application.
 * <p>
 * Implementations must return a non-null template and must not expand into themselves, directly or transitively.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@FunctionalInterface
public interface SqlFragment {
	/**
	 * Expands this fragment.
	 *
	 * @return the template this fragment stands for
	 */
	@Nonnull
	Template toTemplate();
}
