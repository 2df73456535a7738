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
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public class DefaultResultMapperTests {
	public enum Role {
		ADMIN,
		MEMBER
	}

	public record Employee(Long id, @NonNull String name, @Nullable String email, Optional<String> nickname, int age) {}

	public record Team(@DatabaseColumn("team_name") String name, Role role, List<Integer> scores, Set<String> tags) {}

	public record Audit(Instant createdAt, LocalDateTime updatedAt, LocalDate day) {}

	public record Profile(Boolean active, byte[] avatar, UUID externalId, int[] luckyNumbers, List<Long> visits) {}

	public static class EmployeeBean {
		private Long id;
		@DatabaseColumn({"full_name", "name"})
		private String displayName;
		private Locale locale;
		private @Nullable UUID externalId;

		public Long getId() {
			return this.id;
		}

		public void setId(Long id) {
			this.id = id;
		}

		public String getDisplayName() {
			return this.displayName;
		}

		public void setDisplayName(String displayName) {
			this.displayName = displayName;
		}

		public Locale getLocale() {
			return this.locale;
		}

		public void setLocale(Locale locale) {
			this.locale = locale;
		}

		public @Nullable UUID getExternalId() {
			return this.externalId;
		}

		public void setExternalId(@Nullable UUID externalId) {
			this.externalId = externalId;
		}
	}

	public static class NoDefaultConstructor {
		public NoDefaultConstructor(String unused) {}
	}

	@Test
	public void testRecordMapping() {
		ResultMapper resultMapper = ResultMapper.withTimeZone(ZoneOffset.UTC);

		Employee employee = resultMapper.mapRow(row("id", 1, "name", "Alice", "email", "alice@example.com",
				"nickname", "Al", "age", 40, "unused", "ignored"), 0, Employee.class);

		Assertions.assertEquals(new Employee(1L, "Alice", "alice@example.com", Optional.of("Al"), 40), employee);
	}

	@Test
	public void testOptionalAndNullableComponentsMayBeAbsent() {
		ResultMapper resultMapper = ResultMapper.withTimeZone(ZoneOffset.UTC);

		Employee employee = resultMapper.mapRow(row("id", 2L, "name", "Bob", "age", 30), 0, Employee.class);

		Assertions.assertNull(employee.email());
		Assertions.assertEquals(Optional.empty(), employee.nickname());

		Employee nullNickname = resultMapper.mapRow(row("id", 2L, "name", "Bob", "nickname", null, "age", 30), 0, Employee.class);

		Assertions.assertEquals(Optional.empty(), nullNickname.nickname());
	}

	@Test
	public void testMissingRequiredColumn() {
		ResultMapper resultMapper = ResultMapper.withTimeZone(ZoneOffset.UTC);

		MappingException e = Assertions.assertThrows(MappingException.class, () ->
				resultMapper.mapRow(row("id", 1L, "age", 30), 0, Employee.class));

		Assertions.assertEquals(Optional.of("name"), e.getFieldName());
	}

	@Test
	public void testNullIntoNonNullableField() {
		ResultMapper resultMapper = ResultMapper.withTimeZone(ZoneOffset.UTC);

		MappingException nonNullException = Assertions.assertThrows(MappingException.class, () ->
				resultMapper.mapRow(row("id", 1L, "name", null, "age", 30), 0, Employee.class));

		Assertions.assertEquals(Optional.of("name"), nonNullException.getColumnName());

		MappingException primitiveException = Assertions.assertThrows(MappingException.class, () ->
				resultMapper.mapRow(row("id", 1L, "name", "Alice", "age", null), 0, Employee.class));

		Assertions.assertEquals(Optional.of("age"), primitiveException.getFieldName());

		Employee nullId = resultMapper.mapRow(row("id", null, "name", "Alice", "age", 1), 0, Employee.class);

		Assertions.assertNull(nullId.id(), "Unannotated reference components accept NULL");
	}

	@Test
	public void testRowIndexIsReported() {
		ResultMapper resultMapper = ResultMapper.withTimeZone(ZoneOffset.UTC);

		List<Row> rows = List.of(
				row("id", 1L, "name", "Alice", "age", 30),
				row("id", 2L, "name", "Bob", "age", "thirty"));

		MappingException e = Assertions.assertThrows(MappingException.class, () -> resultMapper.map(rows, Employee.class));

		Assertions.assertEquals(1, e.getRowIndex());
		Assertions.assertEquals(Optional.of("age"), e.getColumnName());
	}

	@Test
	public void testBeanMapping() {
		ResultMapper resultMapper = ResultMapper.withTimeZone(ZoneOffset.UTC);
		UUID externalId = UUID.randomUUID();

		EmployeeBean employeeBean = resultMapper.mapRow(row("id", 7, "name", "Carol", "locale", "pt-BR",
				"externalId", externalId.toString()), 0, EmployeeBean.class);

		Assertions.assertEquals(7L, employeeBean.getId());
		Assertions.assertEquals("Carol", employeeBean.getDisplayName(), "Alternate column name was not used");
		Assertions.assertEquals(Locale.forLanguageTag("pt-BR"), employeeBean.getLocale());
		Assertions.assertEquals(externalId, employeeBean.getExternalId());

		EmployeeBean withoutExternalId = resultMapper.mapRow(row("id", 8, "full_name", "Dan", "locale", "en"), 0, EmployeeBean.class);

		Assertions.assertEquals("Dan", withoutExternalId.getDisplayName());
		Assertions.assertNull(withoutExternalId.getExternalId());
	}

	@Test
	public void testCompositeAndEnumCoercion() {
		ResultMapper resultMapper = ResultMapper.withTimeZone(ZoneOffset.UTC);

		Team team = resultMapper.mapRow(row("team_name", "Core", "role", "ADMIN", "scores", new Long[]{1L, 2L, 3L},
				"tags", List.of("a", "b", "a")), 0, Team.class);

		Assertions.assertEquals("Core", team.name());
		Assertions.assertEquals(Role.ADMIN, team.role());
		Assertions.assertEquals(List.of(1, 2, 3), team.scores());
		Assertions.assertEquals(Set.of("a", "b"), team.tags());

		Assertions.assertThrows(MappingException.class, () ->
				resultMapper.mapRow(row("team_name", "Core", "role", "OWNER", "scores", List.of(), "tags", List.of()), 0, Team.class));
	}

	@Test
	public void testNumericCoercion() {
		ResultMapper resultMapper = ResultMapper.withTimeZone(ZoneOffset.UTC);

		Assertions.assertEquals(42L, resultMapper.mapRow(row("v", 42), 0, Long.class));
		Assertions.assertEquals(42.0, resultMapper.mapRow(row("v", 42), 0, Double.class));
		Assertions.assertEquals(new BigDecimal("42"), resultMapper.mapRow(row("v", 42L), 0, BigDecimal.class));
		Assertions.assertEquals(5, resultMapper.mapRow(row("v", new BigDecimal("5")), 0, Integer.class));

		Assertions.assertThrows(MappingException.class, () -> resultMapper.mapRow(row("v", Long.MAX_VALUE), 0, Integer.class),
				"Out-of-range integers must not be truncated");
		Assertions.assertThrows(MappingException.class, () -> resultMapper.mapRow(row("v", 1.5), 0, Integer.class),
				"Floating-point values must not narrow to integers");
		Assertions.assertThrows(MappingException.class, () -> resultMapper.mapRow(row("v", new BigDecimal("1.5")), 0, Long.class));
		Assertions.assertThrows(MappingException.class, () -> resultMapper.mapRow(row("v", "12"), 0, Integer.class),
				"Text must not convert to numbers");
		Assertions.assertThrows(MappingException.class, () -> resultMapper.mapRow(row("v", 12), 0, String.class),
				"Numbers must not convert to text");
	}

	@Test
	public void testFloatingPointCoercionIsExact() {
		ResultMapper resultMapper = ResultMapper.withTimeZone(ZoneOffset.UTC);

		Assertions.assertEquals(0.5f, resultMapper.mapRow(row("v", 0.5d), 0, Float.class));
		Assertions.assertEquals(42.0f, resultMapper.mapRow(row("v", 42L), 0, Float.class));
		Assertions.assertEquals((double) 0.1f, resultMapper.mapRow(row("v", 0.1f), 0, Double.class));
		Assertions.assertEquals(Float.NaN, resultMapper.mapRow(row("v", Double.NaN), 0, Float.class));
		Assertions.assertEquals(0.1f, resultMapper.mapRow(row("v", new BigDecimal("0.1")), 0, Float.class));

		Assertions.assertThrows(MappingException.class, () -> resultMapper.mapRow(row("v", 0.1d), 0, Float.class),
				"Doubles must not lose precision when narrowed to Float");
		Assertions.assertThrows(MappingException.class, () -> resultMapper.mapRow(row("v", 1e300d), 0, Float.class),
				"Doubles beyond Float range must not become infinity");
		Assertions.assertThrows(MappingException.class, () -> resultMapper.mapRow(row("v", Long.MAX_VALUE - 1), 0, Double.class),
				"Integers beyond 2^53 must not round silently");
		Assertions.assertThrows(MappingException.class, () -> resultMapper.mapRow(row("v", (1L << 53) + 1), 0, Double.class));
		Assertions.assertEquals((double) (1L << 53), resultMapper.mapRow(row("v", 1L << 53), 0, Double.class));
		Assertions.assertThrows(MappingException.class, () -> resultMapper.mapRow(row("v", 16_777_217), 0, Float.class));
		Assertions.assertThrows(MappingException.class, () -> resultMapper.mapRow(row("v", new BigDecimal("1e400")), 0, Float.class),
				"Decimals beyond Float range must not become infinity");
	}

	@Test
	public void testBinaryBooleanAndCompositeRoundTrips() {
		ResultMapper resultMapper = ResultMapper.withTimeZone(ZoneOffset.UTC);
		UUID externalId = UUID.randomUUID();
		byte[] avatar = new byte[]{1, 2, 3};

		Profile profile = resultMapper.mapRow(row("active", true, "avatar", avatar, "externalId", externalId.toString(),
				"luckyNumbers", List.of(7L, 13L), "visits", new Integer[]{1, 2}), 0, Profile.class);

		Assertions.assertEquals(true, profile.active());
		Assertions.assertArrayEquals(avatar, profile.avatar());
		Assertions.assertEquals(externalId, profile.externalId());
		Assertions.assertArrayEquals(new int[]{7, 13}, profile.luckyNumbers());
		Assertions.assertEquals(List.of(1L, 2L), profile.visits());

		Assertions.assertThrows(MappingException.class, () -> resultMapper.mapRow(row("v", 1), 0, Boolean.class),
				"Integers must not convert to booleans");
		Assertions.assertThrows(MappingException.class, () -> resultMapper.mapRow(row("v", "AQID"), 0, byte[].class),
				"Text must not convert to binary");
		Assertions.assertThrows(MappingException.class, () -> resultMapper.mapRow(row("v", "not-a-uuid"), 0, UUID.class));
		Assertions.assertThrows(MappingException.class, () -> resultMapper.mapRow(row("v", Arrays.asList(1L, null)), 0, int[].class),
				"NULL elements cannot be stored in a primitive array");
	}

	@Test
	public void testPayloadParsing() {
		ResultMapper resultMapper = ResultMapper.withTimeZone(ZoneOffset.UTC);

		Assertions.assertEquals(" raw ", resultMapper.mapPayload(" raw ", String.class));
		Assertions.assertEquals(42, resultMapper.mapPayload("42", Integer.class));
		Assertions.assertEquals(42L, resultMapper.mapPayload(" 42 ", long.class));
		Assertions.assertEquals(new BigDecimal("1.50"), resultMapper.mapPayload("1.50", BigDecimal.class));
		Assertions.assertEquals(true, resultMapper.mapPayload("T", Boolean.class));
		Assertions.assertEquals(false, resultMapper.mapPayload("false", Boolean.class));
		Assertions.assertEquals(LocalDate.of(2024, 1, 15), resultMapper.mapPayload("2024-01-15", LocalDate.class));
		Assertions.assertEquals(Role.MEMBER, resultMapper.mapPayload("MEMBER", Role.class));

		Assertions.assertThrows(DatabaseException.class, () -> resultMapper.mapPayload("3000000000", Integer.class));
		Assertions.assertThrows(DatabaseException.class, () -> resultMapper.mapPayload("yes", Boolean.class));
		Assertions.assertThrows(DatabaseException.class, () -> resultMapper.mapPayload("1.5", Integer.class));
		Assertions.assertThrows(DatabaseException.class, () -> resultMapper.mapPayload("{}", Team.class));
	}

	@Test
	public void testDateTimeCoercionUsesConfiguredZone() {
		ZoneId zoneId = ZoneId.of("America/New_York");
		ResultMapper resultMapper = ResultMapper.withTimeZone(zoneId);
		LocalDateTime localDateTime = LocalDateTime.of(2024, 1, 15, 9, 30);

		Audit audit = resultMapper.mapRow(row("createdAt", localDateTime, "updatedAt", Timestamp.valueOf(localDateTime),
				"day", localDateTime), 0, Audit.class);

		Assertions.assertEquals(localDateTime.atZone(zoneId).toInstant(), audit.createdAt());
		Assertions.assertEquals(localDateTime, audit.updatedAt());
		Assertions.assertEquals(LocalDate.of(2024, 1, 15), audit.day());

		OffsetDateTime offsetDateTime = OffsetDateTime.of(localDateTime, ZoneOffset.UTC);

		Assertions.assertEquals(LocalDateTime.of(2024, 1, 15, 4, 30),
				resultMapper.mapRow(row("v", offsetDateTime), 0, LocalDateTime.class));
		Assertions.assertThrows(MappingException.class, () -> resultMapper.mapRow(row("v", "2024-01-15"), 0, LocalDate.class));
	}

	@Test
	public void testStandardTypesRequireOneColumn() {
		ResultMapper resultMapper = ResultMapper.withTimeZone(ZoneOffset.UTC);

		Assertions.assertThrows(MappingException.class, () -> resultMapper.mapRow(row("a", 1, "b", 2), 0, Long.class));
		Assertions.assertNull(resultMapper.mapRow(row("a", null), 0, String.class));
		Assertions.assertThrows(MappingException.class, () -> resultMapper.mapRow(row("a", null), 0, long.class));
	}

	@Test
	@SuppressWarnings("unchecked")
	public void testRowAndMapPassThrough() {
		ResultMapper resultMapper = ResultMapper.withTimeZone(ZoneOffset.UTC);
		Row row = row("a", 1, "b", null);

		Assertions.assertSame(row, resultMapper.mapRow(row, 0, Row.class));

		Map<String, Object> map = resultMapper.mapRow(row, 0, Map.class);

		Assertions.assertEquals(Arrays.asList("a", "b"), List.copyOf(map.keySet()));
		Assertions.assertNull(map.get("b"));
	}

	@Test
	public void testUnmappableResultType() {
		ResultMapper resultMapper = ResultMapper.withTimeZone(ZoneOffset.UTC);

		Assertions.assertThrows(MappingException.class, () -> resultMapper.mapRow(row("unused", 1, "other", 2), 0, NoDefaultConstructor.class));
	}

	@NonNull
	protected Row row(@Nullable Object... columnNamesAndValues) {
		Map<String, Object> valuesByColumnName = new LinkedHashMap<>();

		for (int i = 0; i < columnNamesAndValues.length; i += 2)
			valuesByColumnName.put((String) columnNamesAndValues[i], columnNamesAndValues[i + 1]);

		return Row.of(valuesByColumnName);
	}
}
