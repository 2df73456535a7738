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

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * Thrown by a {@link WireLink} when the database or the link itself reports a failure, for example a constraint
 * violation or a dropped network connection.
 * <p>
 * Wire failures are surfaced to callers unchanged; statements are never retried.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public class WireException extends DatabaseException {
	public WireException(@Nullable String message) {
		super(message);
	}

	public WireException(@Nullable String message,
						 @Nullable Throwable cause) {
		super(message, cause);
	}
}
