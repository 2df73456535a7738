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

/**
 * Snapshot of a {@link Pool}'s bookkeeping.
 * <p>
 * Lease counts ({@link #getLentCount()}, {@link #getAcquiredCount()}, {@link #getReleasedCount()}) are read under
 * the pool lock and are exact: {@code lent <= maximum} always holds, and once every lease has ended
 * {@link #getAcquiredCount()} equals {@link #getReleasedCount()}. Idle, waiting, created and discarded counts come
 * from the underlying object pool and may lag a connection that is moving between idle and lent.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class PoolStatistics {
	@NonNull
	private final Integer maximumPoolSize;
	@NonNull
	private final Integer idleCount;
	@NonNull
	private final Integer lentCount;
	@NonNull
	private final Integer waitingCount;
	@NonNull
	private final Long acquiredCount;
	@NonNull
	private final Long releasedCount;
	@NonNull
	private final Long discardedCount;
	@NonNull
	private final Long createdCount;

	PoolStatistics(@NonNull Integer maximumPoolSize,
								 @NonNull Integer idleCount,
								 @NonNull Integer lentCount,
								 @NonNull Integer waitingCount,
								 @NonNull Long acquiredCount,
								 @NonNull Long releasedCount,
								 @NonNull Long discardedCount,
								 @NonNull Long createdCount) {
		this.maximumPoolSize = Objects.requireNonNull(maximumPoolSize);
		this.idleCount = Objects.requireNonNull(idleCount);
		this.lentCount = Objects.requireNonNull(lentCount);
		this.waitingCount = Objects.requireNonNull(waitingCount);
		this.acquiredCount = Objects.requireNonNull(acquiredCount);
		this.releasedCount = Objects.requireNonNull(releasedCount);
		this.discardedCount = Objects.requireNonNull(discardedCount);
		this.createdCount = Objects.requireNonNull(createdCount);
	}

	@NonNull
	public Integer getMaximumPoolSize() {
		return this.maximumPoolSize;
	}

	/**
	 * Connections that are idle or lent.
	 *
	 * @return the total connection count
	 */
	@NonNull
	public Integer getTotalCount() {
		return getIdleCount() + getLentCount();
	}

	@NonNull
	public Integer getIdleCount() {
		return this.idleCount;
	}

	@NonNull
	public Integer getLentCount() {
		return this.lentCount;
	}

	@NonNull
	public Integer getWaitingCount() {
		return this.waitingCount;
	}

	/**
	 * Leases handed out since the pool was created.
	 *
	 * @return the cumulative acquire count
	 */
	@NonNull
	public Long getAcquiredCount() {
		return this.acquiredCount;
	}

	/**
	 * Leases ended since the pool was created, whether the connection went back to idle or was discarded.
	 *
	 * @return the cumulative release count
	 */
	@NonNull
	public Long getReleasedCount() {
		return this.releasedCount;
	}

	/**
	 * Connections closed since the pool was created, including those closed at shutdown.
	 *
	 * @return the cumulative discard count
	 */
	@NonNull
	public Long getDiscardedCount() {
		return this.discardedCount;
	}

	@NonNull
	public Long getCreatedCount() {
		return this.createdCount;
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof PoolStatistics))
			return false;

		PoolStatistics poolStatistics = (PoolStatistics) object;

		return Objects.equals(getMaximumPoolSize(), poolStatistics.getMaximumPoolSize())
				&& Objects.equals(getIdleCount(), poolStatistics.getIdleCount())
				&& Objects.equals(getLentCount(), poolStatistics.getLentCount())
				&& Objects.equals(getWaitingCount(), poolStatistics.getWaitingCount())
				&& Objects.equals(getAcquiredCount(), poolStatistics.getAcquiredCount())
				&& Objects.equals(getReleasedCount(), poolStatistics.getReleasedCount())
				&& Objects.equals(getDiscardedCount(), poolStatistics.getDiscardedCount())
				&& Objects.equals(getCreatedCount(), poolStatistics.getCreatedCount());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getMaximumPoolSize(), getIdleCount(), getLentCount(), getWaitingCount(),
				getAcquiredCount(), getReleasedCount(), getDiscardedCount(), getCreatedCount());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{maximumPoolSize=%d, idleCount=%d, lentCount=%d, waitingCount=%d, "
						+ "acquiredCount=%d, releasedCount=%d, discardedCount=%d, createdCount=%d}", getClass().getSimpleName(),
				getMaximumPoolSize(), getIdleCount(), getLentCount(), getWaitingCount(),
				getAcquiredCount(), getReleasedCount(), getDiscardedCount(), getCreatedCount());
	}
}
