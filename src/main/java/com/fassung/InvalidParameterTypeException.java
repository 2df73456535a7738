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
import java.util.List;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Thrown when a {@link Template} slot holds a value that is neither a bindable scalar nor a nested {@link SqlFragment}.
 * <p>
 * The slot path identifies the offending slot: element {@code i} is the zero-based slot index at nesting depth
 * {@code i}, so {@code [2, 0]} is the first slot of the template found in slot 2 of the outermost template.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public class InvalidParameterTypeException extends TemplateCompileException {
	@Nonnull
	private final List<Integer> slotPath;
	@Nullable
	private final Class<?> valueType;

	public InvalidParameterTypeException(@Nonnull List<Integer> slotPath,
										 @Nullable Class<?> valueType,
										 @Nullable String reason) {
		super(format("Unsupported value of type %s in template slot %s%s",
				valueType == null ? "null" : valueType.getName(), requireNonNull(slotPath),
				reason == null ? "" : format(" (%s)", reason)));

		this.slotPath = List.copyOf(slotPath);
		this.valueType = valueType;
	}

	/**
	 * The position of the offending slot, outermost template first.
	 *
	 * @return the slot path
	 */
	@Nonnull
	public List<Integer> getSlotPath() {
		return this.slotPath;
	}

	@Nullable
	public Class<?> getValueType() {
		return this.valueType;
	}
}
