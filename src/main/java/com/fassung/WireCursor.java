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
import java.time.Duration;
import java.util.List;

/**
 * A server-side cursor open on a {@link WireLink}, positioned before the next unread row.
 * <p>
 * Cursors are driven by the {@link Cursor} that owns them, one call at a time, and are only valid while the
 * transaction they were opened in is open.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public interface WireCursor extends AutoCloseable {
	/**
	 * Reads up to {@code count} rows. Fewer rows than requested means the cursor is exhausted.
	 *
	 * @param count   the maximum number of rows to read
	 * @param timeout how long to wait for the rows, or {@code null} to wait indefinitely
	 * @return the rows read, in result order
	 */
	@Nonnull
	List<Row> fetch(@Nonnull Integer count,
									@Nullable Duration timeout);

	/**
	 * Skips up to {@code count} rows without reading them.
	 *
	 * @param count   the maximum number of rows to skip
	 * @param timeout how long to wait, or {@code null} to wait indefinitely
	 * @return the number of rows actually skipped
	 */
	@Nonnull
	Long forward(@Nonnull Long count,
							 @Nullable Duration timeout);

	@Override
	void close();
}
