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
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A pool-owned link plus the bookkeeping the {@link Pool} and the current {@link Connection} lessee share.
 * <p>
 * {@link #getState()} is written by the pool as the connection moves between idle, lent and closed; the in-flight
 * and discard flags are written by the lessee.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
final class PooledConnection {
	@NonNull
	private final Long id;
	@NonNull
	private final WireLink wireLink;
	@NonNull
	private final Instant createdAt;
	@NonNull
	private final AtomicBoolean inFlight;
	@NonNull
	private final AtomicBoolean discardRequested;
	@NonNull
	private volatile ConnectionState state;

	PooledConnection(@NonNull Long id,
									 @NonNull WireLink wireLink) {
		requireNonNull(id);
		requireNonNull(wireLink);

		this.id = id;
		this.wireLink = wireLink;
		this.createdAt = Instant.now();
		this.inFlight = new AtomicBoolean(false);
		this.discardRequested = new AtomicBoolean(false);
		this.state = ConnectionState.IDLE;
	}

	/**
	 * Claims the link for one round trip.
	 *
	 * @return {@code true} if no other round trip was in flight
	 */
	@NonNull
	Boolean tryBeginRoundTrip() {
		return this.inFlight.compareAndSet(false, true);
	}

	void endRoundTrip() {
		this.inFlight.set(false);
	}

	@NonNull
	Boolean isRoundTripInFlight() {
		return this.inFlight.get();
	}

	/**
	 * Ensures this connection is closed rather than reused when its lease ends.
	 */
	void requestDiscard() {
		this.discardRequested.set(true);
	}

	@NonNull
	Boolean isDiscardRequested() {
		return this.discardRequested.get();
	}

	/**
	 * Must this connection be closed instead of going back to the idle set?
	 *
	 * @return {@code true} if a discard was requested or the link reports itself broken
	 */
	@NonNull
	Boolean shouldDiscard() {
		return isDiscardRequested() || getWireLink().isBroken();
	}

	@NonNull
	Long getId() {
		return this.id;
	}

	@NonNull
	WireLink getWireLink() {
		return this.wireLink;
	}

	@NonNull
	Instant getCreatedAt() {
		return this.createdAt;
	}

	@NonNull
	ConnectionState getState() {
		return this.state;
	}

	void setState(@NonNull ConnectionState state) {
		requireNonNull(state);
		this.state = state;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{id=%s, state=%s, createdAt=%s}", getClass().getSimpleName(), getId(), getState(), getCreatedAt());
	}
}
