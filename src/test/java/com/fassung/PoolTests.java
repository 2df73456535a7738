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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import static java.util.Objects.requireNonNull;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public class PoolTests {
	@Test
	public void testWaitersAreServedInArrivalOrder() throws Exception {
		FakeWireDriver wireDriver = new FakeWireDriver();
		List<String> servedOrder = new CopyOnWriteArrayList<>();
		List<Thread> threads = new ArrayList<>();

		try (Pool pool = Pool.withWireDriver(wireDriver).maximumPoolSize(2).build()) {
			Connection first = pool.acquire();
			Connection second = pool.acquire();

			for (String name : List.of("A", "B", "C", "D")) {
				Thread thread = new Thread(() -> {
					try (Connection connection = pool.acquire()) {
						servedOrder.add(name);
					}
				}, name);

				int expectedWaitingCount = threads.size() + 1;
				thread.start();
				threads.add(thread);

				waitUntil(() -> pool.getStatistics().getWaitingCount() == expectedWaitingCount);
			}

			first.close();

			for (Thread thread : threads)
				thread.join(10_000);

			second.close();

			Assertions.assertEquals(List.of("A", "B", "C", "D"), servedOrder);
			Assertions.assertEquals(2, wireDriver.getOpenedLinks().size(), "Released connections should be handed off, not reopened");
		}
	}

	@Test
	public void testNewCallersDoNotBargePastWaiters() throws Exception {
		FakeWireDriver wireDriver = new FakeWireDriver();

		try (Pool pool = Pool.withWireDriver(wireDriver).maximumPoolSize(1).build()) {
			Connection held = pool.acquire();
			AtomicReference<Connection> waiterConnection = new AtomicReference<>();
			Thread waiter = new Thread(() -> waiterConnection.set(pool.acquire()));

			waiter.start();
			waitUntil(() -> pool.getStatistics().getWaitingCount() == 1);

			held.close();
			waiter.join(10_000);

			Assertions.assertNotNull(waiterConnection.get(), "Waiter should receive the released connection");
			Assertions.assertThrows(DatabaseTimeoutException.class, () -> pool.acquire(Duration.ofMillis(10)));

			waiterConnection.get().close();
		}
	}

	@Test
	public void testSizeBoundUnderContention() throws Exception {
		FakeWireDriver wireDriver = new FakeWireDriver();
		AtomicInteger concurrentLeases = new AtomicInteger(0);
		AtomicInteger maximumConcurrentLeases = new AtomicInteger(0);
		AtomicBoolean statisticsViolated = new AtomicBoolean(false);
		ExecutorService executorService = Executors.newFixedThreadPool(10);

		try (Pool pool = Pool.withWireDriver(wireDriver).maximumPoolSize(3).build()) {
			List<Future<?>> futures = new ArrayList<>();

			for (int i = 0; i < 10; ++i) {
				futures.add(executorService.submit(() -> {
					for (int j = 0; j < 25; ++j) {
						pool.withConnection(connection -> {
							int leases = concurrentLeases.incrementAndGet();
							maximumConcurrentLeases.accumulateAndGet(leases, Math::max);

							PoolStatistics statistics = pool.getStatistics();

							if (statistics.getLentCount() > statistics.getMaximumPoolSize())
								statisticsViolated.set(true);

							connection.execute(Template.of("SELECT 1"));
							concurrentLeases.decrementAndGet();
							return Optional.empty();
						});
					}
				}));
			}

			for (Future<?> future : futures)
				future.get(30, TimeUnit.SECONDS);

			PoolStatistics statistics = pool.getStatistics();

			Assertions.assertTrue(maximumConcurrentLeases.get() <= 3, "Too many concurrent leases");
			Assertions.assertFalse(statisticsViolated.get(), "Pool exceeded its maximum size");
			Assertions.assertTrue(statistics.getCreatedCount() <= 3, "Too many links were opened");
			Assertions.assertEquals(250L, statistics.getAcquiredCount());
			Assertions.assertEquals(statistics.getAcquiredCount(), statistics.getReleasedCount());
			Assertions.assertEquals(0, statistics.getLentCount());
			Assertions.assertEquals(0, statistics.getWaitingCount());
		} finally {
			executorService.shutdownNow();
		}
	}

	@Test
	public void testBrokenIdleConnectionIsDiscarded() {
		FakeWireDriver wireDriver = new FakeWireDriver();

		try (Pool pool = Pool.withWireDriver(wireDriver).build()) {
			pool.acquire().close();
			wireDriver.getOpenedLinks().get(0).setBroken(true);

			try (Connection connection = pool.acquire()) {
				connection.execute(Template.of("SELECT 1"));
			}

			Assertions.assertEquals(2, wireDriver.getOpenedLinks().size());
			Assertions.assertEquals(1L, pool.getStatistics().getDiscardedCount());
			Assertions.assertTrue(wireDriver.getOpenedLinks().get(0).isClosed());
			Assertions.assertEquals(List.of("SELECT 1"), wireDriver.getOpenedLinks().get(1).getSentSql());
		}
	}

	@Test
	public void testDiscardOnReleaseLetsWaiterOpenNewLink() throws Exception {
		FakeWireDriver wireDriver = new FakeWireDriver();

		try (Pool pool = Pool.withWireDriver(wireDriver).maximumPoolSize(1).build()) {
			Connection held = pool.acquire();
			AtomicReference<Throwable> waiterFailure = new AtomicReference<>();
			Thread waiter = new Thread(() -> {
				try (Connection connection = pool.acquire()) {
					connection.execute(Template.of("SELECT 1"));
				} catch (Throwable t) {
					waiterFailure.set(t);
				}
			});

			waiter.start();
			waitUntil(() -> pool.getStatistics().getWaitingCount() == 1);

			wireDriver.getOpenedLinks().get(0).setBroken(true);
			held.close();
			waiter.join(10_000);

			Assertions.assertNull(waiterFailure.get());
			Assertions.assertEquals(2, wireDriver.getOpenedLinks().size());
			Assertions.assertEquals(1, pool.getStatistics().getTotalCount());
		}
	}

	@Test
	public void testAcquireTimeout() {
		FakeWireDriver wireDriver = new FakeWireDriver();

		try (Pool pool = Pool.withWireDriver(wireDriver).maximumPoolSize(1).acquireTimeout(Duration.ofMillis(50)).build()) {
			Connection held = pool.acquire();

			Assertions.assertThrows(DatabaseTimeoutException.class, pool::acquire);
			Assertions.assertThrows(DatabaseTimeoutException.class, () -> pool.acquire(Duration.ZERO));
			Assertions.assertEquals(0, pool.getStatistics().getWaitingCount(), "Timed-out callers must leave the queue");

			held.close();

			try (Connection connection = pool.acquire()) {
				Assertions.assertFalse(connection.isReleased());
			}
		}
	}

	@Test
	public void testInterruptedWaiterLeavesQueue() throws Exception {
		FakeWireDriver wireDriver = new FakeWireDriver();

		try (Pool pool = Pool.withWireDriver(wireDriver).maximumPoolSize(1).build()) {
			Connection held = pool.acquire();
			AtomicReference<Throwable> waiterFailure = new AtomicReference<>();
			AtomicBoolean interruptRestored = new AtomicBoolean(false);

			Thread waiter = new Thread(() -> {
				try {
					pool.acquire();
				} catch (Throwable t) {
					waiterFailure.set(t);
					interruptRestored.set(Thread.currentThread().isInterrupted());
				}
			});

			waiter.start();
			waitUntil(() -> pool.getStatistics().getWaitingCount() == 1);

			waiter.interrupt();
			waiter.join(10_000);

			Assertions.assertTrue(waiterFailure.get() instanceof DatabaseException);
			Assertions.assertTrue(waiterFailure.get().getCause() instanceof InterruptedException);
			Assertions.assertTrue(interruptRestored.get(), "Interrupt status should be restored");
			Assertions.assertEquals(0, pool.getStatistics().getWaitingCount());

			held.close();

			Assertions.assertEquals(1, pool.getStatistics().getIdleCount(), "Connection must not be handed to an abandoned waiter");
		}
	}

	@Test
	public void testShutdown() throws Exception {
		FakeWireDriver wireDriver = new FakeWireDriver();
		Pool pool = Pool.withWireDriver(wireDriver).maximumPoolSize(2).build();

		Connection idle = pool.acquire();
		Connection lent = pool.acquire();
		idle.close();

		Pool blockedPool = Pool.withWireDriver(new FakeWireDriver()).maximumPoolSize(1).build();
		Connection blockedPoolConnection = blockedPool.acquire();
		AtomicReference<Throwable> waiterFailure = new AtomicReference<>();
		Thread waiter = new Thread(() -> {
			try {
				blockedPool.acquire();
			} catch (Throwable t) {
				waiterFailure.set(t);
			}
		});

		waiter.start();
		waitUntil(() -> blockedPool.getStatistics().getWaitingCount() == 1);

		blockedPool.close();
		waiter.join(10_000);

		Assertions.assertTrue(waiterFailure.get() instanceof PoolClosedException, "Waiter should fail when the pool shuts down");
		Assertions.assertThrows(PoolClosedException.class, () -> blockedPoolConnection.execute(Template.of("SELECT 1")));
		blockedPoolConnection.close();

		pool.close();
		pool.close();

		Assertions.assertTrue(pool.isClosed());
		Assertions.assertEquals(2, wireDriver.getClosedCount(), "Idle and lent links should both be closed");
		Assertions.assertThrows(PoolClosedException.class, pool::acquire);
		Assertions.assertThrows(PoolClosedException.class, () -> lent.execute(Template.of("SELECT 1")));
		Assertions.assertEquals(2L, pool.getStatistics().getReleasedCount(), "Force-closing ends the lease");

		lent.close();
		lent.close();

		PoolStatistics statistics = pool.getStatistics();

		Assertions.assertEquals(0, statistics.getTotalCount());
		Assertions.assertEquals(2L, statistics.getReleasedCount(), "A force-closed lease must not be counted again when its handle closes");
		Assertions.assertEquals(statistics.getAcquiredCount(), statistics.getReleasedCount());
	}

	@Test
	public void testGracefulShutdownWaitsForLease() throws Exception {
		FakeWireDriver wireDriver = new FakeWireDriver();
		Pool pool = Pool.withWireDriver(wireDriver).build();
		CountDownLatch leased = new CountDownLatch(1);
		AtomicReference<Throwable> leaseFailure = new AtomicReference<>();

		Thread leaseHolder = new Thread(() -> {
			try (Connection connection = pool.acquire()) {
				leased.countDown();
				Thread.sleep(100);
				connection.execute(Template.of("SELECT 1"));
			} catch (Throwable t) {
				leaseFailure.set(t);
			}
		});

		leaseHolder.start();
		Assertions.assertTrue(leased.await(10, TimeUnit.SECONDS));

		pool.shutdown(Duration.ofSeconds(10));
		leaseHolder.join(10_000);

		Assertions.assertNull(leaseFailure.get(), "Lease should have been allowed to finish");
		Assertions.assertEquals(List.of("SELECT 1"), wireDriver.getSentSql());
		Assertions.assertEquals(1, wireDriver.getClosedCount());
	}

	@Test
	public void testFailedOpenReleasesCapacity() {
		FakeWireDriver wireDriver = new FakeWireDriver();

		try (Pool pool = Pool.withWireDriver(wireDriver).maximumPoolSize(1).build()) {
			wireDriver.setOpenFailure(new WireException("connection refused"));

			Assertions.assertThrows(WireException.class, pool::acquire);
			Assertions.assertEquals(0, pool.getStatistics().getTotalCount());

			wireDriver.setOpenFailure(null);

			try (Connection connection = pool.acquire()) {
				connection.execute(Template.of("SELECT 1"));
			}
		}
	}

	@Test
	public void testMinimumPoolSizePrefills() {
		FakeWireDriver wireDriver = new FakeWireDriver();

		try (Pool pool = Pool.withWireDriver(wireDriver).minimumPoolSize(2).maximumPoolSize(4).build()) {
			Assertions.assertEquals(2, wireDriver.getOpenedLinks().size());
			Assertions.assertEquals(2, pool.getStatistics().getIdleCount());
		}
	}

	@Test
	public void testInvalidConfiguration() {
		FakeWireDriver wireDriver = new FakeWireDriver();

		Assertions.assertThrows(ConfigurationException.class, () -> Pool.withWireDriver(wireDriver).maximumPoolSize(0).build());
		Assertions.assertThrows(ConfigurationException.class, () -> Pool.withWireDriver(wireDriver).maximumPoolSize(2).minimumPoolSize(3).build());
		Assertions.assertThrows(ConfigurationException.class, () -> Pool.withWireDriver(wireDriver).acquireTimeout(Duration.ofSeconds(-1)).build());
		Assertions.assertThrows(ConfigurationException.class, () -> Pool.fromConnectionString("not a connection string"));
		Assertions.assertTrue(wireDriver.getOpenedLinks().isEmpty());
	}

	protected void waitUntil(@Nonnull BooleanSupplier condition) throws InterruptedException {
		requireNonNull(condition);

		long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);

		while (!condition.getAsBoolean()) {
			if (System.nanoTime() > deadline)
				Assertions.fail("Timed out waiting for condition");

			Thread.sleep(5);
		}
	}
}
