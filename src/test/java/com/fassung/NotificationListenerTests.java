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

import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public class NotificationListenerTests {
	@Test
	public void testListenerReceivesNotification() {
		FakeWireDriver wireDriver = notifyingWireDriver();
		List<String> received = new CopyOnWriteArrayList<>();
		NotificationListener<String> listener = (connection, processId, channel, payload) ->
				received.add(processId + ":" + channel + ":" + payload);

		try (Pool pool = Pool.withWireDriver(wireDriver).build();
				 Connection connection = pool.acquire()) {
			connection.addListener("test_channel", String.class, listener);
			connection.execute(Template.of("NOTIFY test_channel, 'hello'"));
			connection.removeListener("test_channel", listener);
		}

		Assertions.assertEquals(List.of("1:test_channel:hello"), received);
		Assertions.assertEquals(List.of("LISTEN \"test_channel\"", "NOTIFY test_channel, 'hello'", "UNLISTEN \"test_channel\""),
				wireDriver.getSentSql());
	}

	@Test
	public void testPayloadIsParsed() {
		FakeWireDriver wireDriver = notifyingWireDriver();
		List<Integer> received = new CopyOnWriteArrayList<>();
		NotificationListener<Integer> listener = (connection, processId, channel, payload) -> received.add(payload);

		try (Pool pool = Pool.withWireDriver(wireDriver).build();
				 Connection connection = pool.acquire()) {
			connection.addListener("int_channel", Integer.class, listener);
			connection.execute(Template.of("NOTIFY int_channel, '42'"));
		}

		Assertions.assertEquals(List.of(42), received);
	}

	@Test
	public void testRemovedListenerReceivesNothing() {
		FakeWireDriver wireDriver = notifyingWireDriver();
		List<String> received = new CopyOnWriteArrayList<>();
		NotificationListener<String> listener = (connection, processId, channel, payload) -> received.add(payload);

		try (Pool pool = Pool.withWireDriver(wireDriver).build();
				 Connection connection = pool.acquire()) {
			connection.addListener("remove_test", String.class, listener);
			connection.removeListener("remove_test", listener);
			connection.execute(Template.of("NOTIFY remove_test, 'should_not_arrive'"));
		}

		Assertions.assertTrue(received.isEmpty());
	}

	@Test
	public void testRegistrationErrors() {
		FakeWireDriver wireDriver = notifyingWireDriver();
		NotificationListener<String> listener = (connection, processId, channel, payload) -> {};

		try (Pool pool = Pool.withWireDriver(wireDriver).build();
				 Connection connection = pool.acquire()) {
			Assertions.assertThrows(IllegalArgumentException.class, () -> connection.removeListener("nonexistent", listener));

			connection.addListener("duplicate", String.class, listener);

			Assertions.assertThrows(IllegalArgumentException.class, () -> connection.addListener("duplicate", String.class, listener));
		}

		Assertions.assertEquals(1L, wireDriver.countSent("LISTEN \"duplicate\""));
	}

	@Test
	public void testMultipleListenersOnSameChannel() {
		FakeWireDriver wireDriver = notifyingWireDriver();
		List<String> receivedByFirst = new CopyOnWriteArrayList<>();
		List<String> receivedBySecond = new CopyOnWriteArrayList<>();
		NotificationListener<String> firstListener = (connection, processId, channel, payload) -> receivedByFirst.add(payload);
		NotificationListener<String> secondListener = (connection, processId, channel, payload) -> receivedBySecond.add(payload);

		try (Pool pool = Pool.withWireDriver(wireDriver).build();
				 Connection connection = pool.acquire()) {
			connection.addListener("multi_channel", String.class, firstListener);
			connection.addListener("multi_channel", String.class, secondListener);
			connection.execute(Template.of("NOTIFY multi_channel, 'broadcast'"));

			connection.removeListener("multi_channel", firstListener);
			Assertions.assertEquals(0L, wireDriver.countSent("UNLISTEN \"multi_channel\""), "Channel still has a listener");

			connection.removeListener("multi_channel", secondListener);
			Assertions.assertEquals(1L, wireDriver.countSent("UNLISTEN \"multi_channel\""));
		}

		Assertions.assertEquals(List.of("broadcast"), receivedByFirst);
		Assertions.assertEquals(List.of("broadcast"), receivedBySecond);
		Assertions.assertEquals(1L, wireDriver.countSent("LISTEN \"multi_channel\""));
	}

	@Test
	public void testAwaitNotificationsFromAnotherConnection() {
		FakeWireDriver wireDriver = notifyingWireDriver();
		List<String> received = new CopyOnWriteArrayList<>();
		NotificationListener<String> listener = (connection, processId, channel, payload) -> received.add(processId + ":" + payload);

		try (Pool pool = Pool.withWireDriver(wireDriver).build();
				 Connection listening = pool.acquire();
				 Connection notifying = pool.acquire()) {
			listening.addListener("jobs", String.class, listener);

			Assertions.assertEquals(0, listening.awaitNotifications(Duration.ofMillis(20)));

			notifying.execute(Template.of("NOTIFY jobs, 'job 1'"));
			notifying.execute(Template.of("NOTIFY jobs, 'job 2'"));

			Assertions.assertTrue(received.isEmpty(), "Nothing is delivered until the listening connection talks to the server");
			Assertions.assertEquals(2, listening.awaitNotifications(Duration.ofSeconds(5)));
		}

		Assertions.assertEquals(List.of("2:job 1", "2:job 2"), received);
	}

	@Test
	public void testReleaseStopsListening() {
		FakeWireDriver wireDriver = notifyingWireDriver();
		List<String> received = new CopyOnWriteArrayList<>();
		NotificationListener<String> listener = (connection, processId, channel, payload) -> received.add(payload);

		try (Pool pool = Pool.withWireDriver(wireDriver).maximumPoolSize(1).build()) {
			try (Connection connection = pool.acquire()) {
				connection.addListener("events", String.class, listener);
			}

			FakeWireDriver.FakeWireLink wireLink = wireDriver.getOpenedLinks().get(0);

			Assertions.assertEquals(1L, wireDriver.countSent("UNLISTEN *"));
			Assertions.assertTrue(wireLink.getListenedChannels().isEmpty());

			try (Connection connection = pool.acquire()) {
				connection.execute(Template.of("NOTIFY events, 'after release'"));
			}

			Assertions.assertEquals(1, wireDriver.getOpenedLinks().size(), "A cleanly reset link should be reused");
		}

		Assertions.assertTrue(received.isEmpty());
	}

	@Test
	public void testListenerFailureDoesNotFailStatement() {
		FakeWireDriver wireDriver = notifyingWireDriver();
		List<String> received = new CopyOnWriteArrayList<>();
		NotificationListener<String> failingListener = (connection, processId, channel, payload) -> {
			throw new IllegalStateException("listener is broken");
		};
		NotificationListener<String> workingListener = (connection, processId, channel, payload) -> received.add(payload);
		NotificationListener<Integer> unparseableListener = (connection, processId, channel, payload) -> received.add("parsed " + payload);

		try (Pool pool = Pool.withWireDriver(wireDriver).build();
				 Connection connection = pool.acquire()) {
			connection.addListener("fragile", String.class, failingListener);
			connection.addListener("fragile", Integer.class, unparseableListener);
			connection.addListener("fragile", String.class, workingListener);

			Assertions.assertEquals(0L, connection.execute(Template.of("NOTIFY fragile, 'not a number'")));
		}

		Assertions.assertEquals(List.of("not a number"), received);
	}

	@Test
	public void testListenerMayUseItsConnection() {
		FakeWireDriver wireDriver = notifyingWireDriver();
		List<String> received = new CopyOnWriteArrayList<>();
		NotificationListener<String> listener = (connection, processId, channel, payload) -> {
			received.add(payload);

			if (payload.equals("first"))
				connection.execute(Template.of("NOTIFY chain, 'second'"));
		};

		try (Pool pool = Pool.withWireDriver(wireDriver).build();
				 Connection connection = pool.acquire()) {
			connection.addListener("chain", String.class, listener);
			connection.execute(Template.of("NOTIFY chain, 'first'"));
		}

		Assertions.assertEquals(List.of("first", "second"), received);
	}

	@Test
	public void testUnsupportedDriver() {
		FakeWireDriver wireDriver = new FakeWireDriver();
		NotificationListener<String> listener = (connection, processId, channel, payload) -> {};

		try (Pool pool = Pool.withWireDriver(wireDriver).build();
				 Connection connection = pool.acquire()) {
			Assertions.assertThrows(UnsupportedOperationException.class, () -> connection.addListener("events", String.class, listener));
			Assertions.assertThrows(UnsupportedOperationException.class, () -> connection.awaitNotifications(Duration.ZERO));
		}

		Assertions.assertTrue(wireDriver.getSentSql().isEmpty());
	}

	private static FakeWireDriver notifyingWireDriver() {
		FakeWireDriver wireDriver = new FakeWireDriver();
		wireDriver.setNotificationsSupported(true);
		return wireDriver;
	}
}
