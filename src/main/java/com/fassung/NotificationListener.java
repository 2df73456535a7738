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
import org.jspecify.annotations.Nullable;

/**
 * Receives notifications sent on a channel registered via {@link Connection#addListener(String, Class, NotificationListener)}.
 * <p>
 * Listeners run on the thread that is using the connection, after the round trip that delivered the notification.
 *
 * @param <T> the type the notification payload is parsed into
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@FunctionalInterface
public interface NotificationListener<T> {
	/**
	 * Handles one notification.
	 *
	 * @param connection the connection the listener is registered on
	 * @param processId  the server process that sent the notification
	 * @param channel    the channel it was sent on
	 * @param payload    the parsed payload
	 */
	void onNotification(@NonNull Connection connection,
											@NonNull Integer processId,
											@NonNull String channel,
											@Nullable T payload);
}
