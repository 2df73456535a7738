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
import javax.annotation.concurrent.NotThreadSafe;
import java.util.List;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Thrown when a {@link SqlFragment} expands, directly or transitively, into itself.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public class CyclicTemplateException extends TemplateCompileException {
	@Nonnull
	private final List<Integer> slotPath;

	public CyclicTemplateException(@Nonnull List<Integer> slotPath) {
		super(format("Template nesting cycle detected at template slot %s", requireNonNull(slotPath)));
		this.slotPath = List.copyOf(slotPath);
	}

	@Nonnull
	public List<Integer> getSlotPath() {
		return this.slotPath;
	}
}
