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

/**
 * Encapsulates a slot value intended for SQL {@code IN} list expansion.
 * <p>
 * The {@link TemplateCompiler} expands it into one placeholder per element, separated by commas, so
 * {@code Template.format("WHERE id IN ({})", Parameters.inList(List.of(1, 2, 3)))} compiles to
 * {@code WHERE id IN ($1, $2, $3)}.
 * <p>
 * Standard instances may be constructed via {@link Parameters#inList(java.util.Collection)} and
 * {@link Parameters#inList(Object[])}.
 * <p>
 * Implementations should be threadsafe.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public interface InListParameter {
	/**
	 * Gets the elements to be expanded into placeholders.
	 *
	 * @return the elements for the {@code IN} list
	 */
	@Nonnull
	List<Object> getElements();
}
