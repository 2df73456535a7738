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

import javax.annotation.concurrent.ThreadSafe;
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * An asynchronous notification delivered by the database, e.g. as a result of PostgreSQL's {@code NOTIFY}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class Notification {
	@NonNull
	private final Integer processId;
	@NonNull
	private final String channel;
	@NonNull
	private final String payload;

	/**
	 * @param processId the server process that sent the notification
	 * @param channel   the channel it was sent on
	 * @param payload   its payload, empty if none was given
	 */
	public Notification(@NonNull Integer processId,
											@NonNull String channel,
											@NonNull String payload) {
		requireNonNull(processId);
		requireNonNull(channel);
		requireNonNull(payload);

		this.processId = processId;
		this.channel = channel;
		this.payload = payload;
	}

	@NonNull
	public Integer getProcessId() {
		return this.processId;
	}

	@NonNull
	public String getChannel() {
		return this.channel;
	}

	@NonNull
	public String getPayload() {
		return this.payload;
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Notification))
			return false;

		Notification notification = (Notification) object;

		return Objects.equals(getProcessId(), notification.getProcessId())
				&& Objects.equals(getChannel(), notification.getChannel())
				&& Objects.equals(getPayload(), notification.getPayload());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getProcessId(), getChannel(), getPayload());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{processId=%d, channel=%s, payload=%s}", getClass().getSimpleName(), getProcessId(), getChannel(), getPayload());
	}
}
