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
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public class CursorTests {
	public record Student(Long id, String name) {}

	@Test
	public void testIterationReadsInPrefetchSizedBatches() {
		FakeWireDriver wireDriver = studentWireDriver(5);
		List<Student> students = new ArrayList<>();

		try (Pool pool = Pool.withWireDriver(wireDriver).build()) {
			pool.transaction(transaction -> {
				try (Cursor<Student> cursor = transaction.cursor(Template.of("SELECT id, name FROM student ORDER BY id"), Student.class, 2, null)) {
					for (Student student : cursor)
						students.add(student);
				}
			});
		}

		Assertions.assertEquals(List.of(1L, 2L, 3L, 4L, 5L), students.stream().map(Student::id).toList());

		FakeWireDriver.FakeWireCursor wireCursor = wireDriver.getOpenedLinks().get(0).getOpenedCursors().get(0);

		Assertions.assertEquals(List.of(2, 2, 2), wireCursor.getFetchCounts());
		Assertions.assertTrue(wireCursor.isClosed());
		Assertions.assertEquals(List.of("BEGIN", "SELECT id, name FROM student ORDER BY id", "COMMIT"), wireDriver.getSentSql());
	}

	@Test
	public void testFetchAndFetchRow() {
		FakeWireDriver wireDriver = studentWireDriver(3);

		try (Pool pool = Pool.withWireDriver(wireDriver).build()) {
			pool.transaction(transaction -> {
				Cursor<Student> cursor = transaction.cursor(Template.of("SELECT id, name FROM student ORDER BY id"), Student.class);

				Assertions.assertEquals(List.of(new Student(1L, "Student 1"), new Student(2L, "Student 2")), cursor.fetch(2));
				Assertions.assertEquals(Optional.of(new Student(3L, "Student 3")), cursor.fetchRow());
				Assertions.assertEquals(Optional.empty(), cursor.fetchRow());
				Assertions.assertEquals(Optional.empty(), cursor.fetchRow());
				Assertions.assertEquals(List.of(), cursor.fetch(10));
			});
		}

		FakeWireDriver.FakeWireCursor wireCursor = wireDriver.getOpenedLinks().get(0).getOpenedCursors().get(0);

		Assertions.assertEquals(List.of(2, 1, 1), wireCursor.getFetchCounts(), "An exhausted cursor should not go back to the database");
	}

	@Test
	public void testForward() {
		FakeWireDriver wireDriver = studentWireDriver(2);

		try (Pool pool = Pool.withWireDriver(wireDriver).build()) {
			pool.transaction(transaction -> {
				Cursor<Student> cursor = transaction.cursor(Template.of("SELECT id, name FROM student ORDER BY id"), Student.class);

				Assertions.assertEquals(1L, cursor.forward(1L));
				Assertions.assertEquals(Optional.of(new Student(2L, "Student 2")), cursor.fetchRow());
				Assertions.assertEquals(Optional.empty(), cursor.fetchRow());
				Assertions.assertEquals(0L, cursor.forward(5L));
			});
		}
	}

	@Test
	public void testIterationAndFetchShareOnePosition() {
		FakeWireDriver wireDriver = studentWireDriver(5);

		try (Pool pool = Pool.withWireDriver(wireDriver).build()) {
			pool.transaction(transaction -> {
				Cursor<Student> cursor = transaction.cursor(Template.of("SELECT id, name FROM student ORDER BY id"), Student.class, 2, null);
				Iterator<Student> iterator = cursor.iterator();

				Assertions.assertEquals(1L, iterator.next().id());
				Assertions.assertEquals(List.of(2L, 3L), cursor.fetch(2).stream().map(Student::id).toList());
				Assertions.assertEquals(1L, cursor.forward(1L));
				Assertions.assertEquals(5L, iterator.next().id());
				Assertions.assertFalse(iterator.hasNext());
			});
		}
	}

	@Test
	public void testCursorRequiresTransaction() {
		FakeWireDriver wireDriver = studentWireDriver(1);

		try (Pool pool = Pool.withWireDriver(wireDriver).build();
				 Connection connection = pool.acquire()) {
			Assertions.assertThrows(IllegalDatabaseStateException.class, () ->
					connection.cursor(Template.of("SELECT id, name FROM student"), Student.class));
		}

		Assertions.assertTrue(wireDriver.getSentSql().isEmpty());
	}

	@Test
	public void testTransactionEndClosesOpenCursors() {
		FakeWireDriver wireDriver = studentWireDriver(3);
		AtomicReference<Cursor<Student>> cursorReference = new AtomicReference<>();

		try (Pool pool = Pool.withWireDriver(wireDriver).build()) {
			pool.transaction(transaction -> {
				Cursor<Student> cursor = transaction.cursor(Template.of("SELECT id, name FROM student"), Student.class);
				cursor.fetchRow();
				cursorReference.set(cursor);
			});

			Assertions.assertTrue(cursorReference.get().isClosed());
			Assertions.assertTrue(wireDriver.getOpenedLinks().get(0).getOpenedCursors().get(0).isClosed());
			Assertions.assertThrows(IllegalDatabaseStateException.class, () -> cursorReference.get().fetchRow());
			Assertions.assertEquals(1, pool.getStatistics().getIdleCount(), "Connection should go back to the pool");
		}
	}

	@Test
	public void testInvalidArguments() {
		FakeWireDriver wireDriver = studentWireDriver(1);

		try (Pool pool = Pool.withWireDriver(wireDriver).build()) {
			pool.transaction(transaction -> {
				Assertions.assertThrows(IllegalArgumentException.class, () ->
						transaction.cursor(Template.of("SELECT id, name FROM student"), Student.class, 0, null));

				Cursor<Student> cursor = transaction.cursor(Template.of("SELECT id, name FROM student"), Student.class);

				Assertions.assertThrows(IllegalArgumentException.class, () -> cursor.fetch(-1));
				Assertions.assertThrows(IllegalArgumentException.class, () -> cursor.forward(-1L));
			});
		}
	}

	private static FakeWireDriver studentWireDriver(int studentCount) {
		FakeWireDriver wireDriver = new FakeWireDriver();
		List<Row> rows = new ArrayList<>();

		for (long id = 1; id <= studentCount; ++id)
			rows.add(Row.of(List.of("id", "name"), List.of(id, "Student " + id)));

		wireDriver.setResponder((sql, parameters, timeout) -> sql.startsWith("SELECT")
				? WireResult.ofRows(List.of("id", "name"), rows)
				: WireResult.ofUpdateCount(0L));

		return wireDriver;
	}
}
