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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public class TemplateCompilerTests {
	@Test
	public void testScalarValuesBecomePlaceholders() {
		TemplateCompiler templateCompiler = TemplateCompiler.withDefaultConfiguration();

		CompiledStatement compiledStatement = templateCompiler.compile(
				Template.format("SELECT * FROM t WHERE id = {} AND name = {}", 5, "x"));

		Assertions.assertEquals("SELECT * FROM t WHERE id = $1 AND name = $2", compiledStatement.getSql());
		Assertions.assertEquals(List.of(5, "x"), compiledStatement.getParameters());
	}

	@Test
	public void testNestedTemplatesShareOneNumbering() {
		TemplateCompiler templateCompiler = TemplateCompiler.withDefaultConfiguration();

		Template nameFilter = Template.format("name = {} AND team_id = {}", "Alice", 7);
		Template query = Template.format("SELECT * FROM employee WHERE id > {} AND {} ORDER BY {} LIMIT {}",
				10, nameFilter, Template.of("name"), 25);

		CompiledStatement compiledStatement = templateCompiler.compile(query);

		Assertions.assertEquals("SELECT * FROM employee WHERE id > $1 AND name = $2 AND team_id = $3 ORDER BY name LIMIT $4",
				compiledStatement.getSql());
		Assertions.assertEquals(List.of(10, "Alice", 7, 25), compiledStatement.getParameters());
	}

	@Test
	public void testPlaceholderNumbersAreContiguous() {
		TemplateCompiler templateCompiler = TemplateCompiler.withDefaultConfiguration();

		Template deeplyNested = Template.format("a = {}", Template.format("{} + {}", 1, Template.format("{}", 2)));
		CompiledStatement compiledStatement = templateCompiler.compile(
				Template.format("SELECT {}, {} WHERE {}", "first", Template.empty(), deeplyNested));

		Assertions.assertEquals("SELECT $1,  WHERE a = $2 + $3", compiledStatement.getSql());
		Assertions.assertEquals(List.of("first", 1, 2), compiledStatement.getParameters());
	}

	@Test
	public void testEmptyTemplateSplicesToNothing() {
		TemplateCompiler templateCompiler = TemplateCompiler.withDefaultConfiguration();

		Template query = Template.format("SELECT * FROM employee WHERE id = {}{}", 1, Template.empty());

		Assertions.assertEquals(templateCompiler.compile(Template.format("SELECT * FROM employee WHERE id = {}", 1)),
				templateCompiler.compile(query));
		Assertions.assertEquals(CompiledStatement.of("", List.of()), templateCompiler.compile(Template.empty()));
	}

	@Test
	public void testNestingIsAssociative() {
		TemplateCompiler templateCompiler = TemplateCompiler.withDefaultConfiguration();

		Template a = Template.format("a = {}", 1);
		Template b = Template.format("b = {}", 2);
		Template c = Template.format("c = {}", 3);

		CompiledStatement leftNested = templateCompiler.compile(
				Template.format("{} AND {}", Template.format("{} AND {}", a, b), c));
		CompiledStatement rightNested = templateCompiler.compile(
				Template.format("{} AND {}", a, Template.format("{} AND {}", b, c)));

		Assertions.assertEquals(leftNested, rightNested);
		Assertions.assertEquals("a = $1 AND b = $2 AND c = $3", leftNested.getSql());
	}

	@Test
	public void testValuesNeverAppearInSqlText() {
		TemplateCompiler templateCompiler = TemplateCompiler.withDefaultConfiguration();
		String hostile = "'; DROP TABLE employee; --";

		CompiledStatement compiledStatement = templateCompiler.compile(
				Template.format("SELECT * FROM employee WHERE name = {} OR name IN ({})", hostile,
						Parameters.inList(List.of(hostile, "$1"))));

		Assertions.assertFalse(compiledStatement.getSql().contains("DROP"), "Value leaked into SQL text");
		Assertions.assertEquals("SELECT * FROM employee WHERE name = $1 OR name IN ($2, $3)", compiledStatement.getSql());
		Assertions.assertEquals(Arrays.asList(hostile, hostile, "$1"), compiledStatement.getParameters());
	}

	@Test
	public void testInListExpandsToPlaceholders() {
		TemplateCompiler templateCompiler = TemplateCompiler.withDefaultConfiguration();

		CompiledStatement compiledStatement = templateCompiler.compile(
				Template.format("SELECT * FROM employee WHERE team_id = {} AND id IN ({})", 3,
						Parameters.inList(new Object[]{10, 11, 12})));

		Assertions.assertEquals("SELECT * FROM employee WHERE team_id = $1 AND id IN ($2, $3, $4)", compiledStatement.getSql());
		Assertions.assertEquals(List.of(3, 10, 11, 12), compiledStatement.getParameters());
	}

	@Test
	public void testEmptyInListIsRejected() {
		TemplateCompiler templateCompiler = TemplateCompiler.withDefaultConfiguration();

		Assertions.assertThrows(TemplateCompileException.class, () ->
				templateCompiler.compile(Template.format("SELECT * FROM employee WHERE id IN ({})", Parameters.inList(List.of()))));
	}

	@Test
	public void testUnsupportedValueTypesAreRejected() {
		TemplateCompiler templateCompiler = TemplateCompiler.withDefaultConfiguration();

		InvalidParameterTypeException objectException = Assertions.assertThrows(InvalidParameterTypeException.class, () ->
				templateCompiler.compile(Template.format("SELECT {}, {}", 1, new Object())));

		Assertions.assertEquals(List.of(1), objectException.getSlotPath());
		Assertions.assertEquals(Object.class, objectException.getValueType());

		InvalidParameterTypeException nestedException = Assertions.assertThrows(InvalidParameterTypeException.class, () ->
				templateCompiler.compile(Template.format("SELECT {} WHERE {}", 1, Template.format("id IN ({})", List.of(1, 2)))));

		Assertions.assertEquals(List.of(1, 0), nestedException.getSlotPath());
	}

	@Test
	public void testOptionalValuesAreUnwrapped() {
		TemplateCompiler templateCompiler = TemplateCompiler.withDefaultConfiguration();
		UUID uuid = UUID.randomUUID();

		CompiledStatement compiledStatement = templateCompiler.compile(
				Template.format("UPDATE t SET a = {}, b = {}", Optional.of(uuid), Optional.empty()));

		Assertions.assertEquals(Arrays.asList(uuid, null), compiledStatement.getParameters());
	}

	@Test
	public void testSelfReferencingFragmentIsRejected() {
		TemplateCompiler templateCompiler = TemplateCompiler.withDefaultConfiguration();
		AtomicReference<SqlFragment> fragmentReference = new AtomicReference<>();

		SqlFragment selfReferencingFragment = () -> Template.format("x = {}", fragmentReference.get());
		fragmentReference.set(selfReferencingFragment);

		CyclicTemplateException e = Assertions.assertThrows(CyclicTemplateException.class, () ->
				templateCompiler.compile(Template.format("SELECT * FROM t WHERE {}", selfReferencingFragment)));

		Assertions.assertEquals(List.of(0, 0), e.getSlotPath());
	}

	@Test
	public void testEndlesslyExpandingFragmentIsRejected() {
		TemplateCompiler templateCompiler = TemplateCompiler.withDefaultConfiguration();

		Assertions.assertThrows(TemplateCompileException.class, () ->
				templateCompiler.compile(Template.format("SELECT {}", new EndlessFragment(0))));
	}

	@Test
	public void testQuestionMarkPlaceholders() {
		TemplateCompiler templateCompiler = TemplateCompiler.withPlaceholderStyle(PlaceholderStyle.QUESTION_MARK);

		CompiledStatement compiledStatement = templateCompiler.compile(
				Template.format("SELECT * FROM t WHERE a = {} AND b IN ({}) AND {}", "a",
						Parameters.inList(List.of(1, 2)), Template.format("c = {}", true)));

		Assertions.assertEquals("SELECT * FROM t WHERE a = ? AND b IN (?, ?) AND c = ?", compiledStatement.getSql());
		Assertions.assertEquals(List.of("a", 1, 2, true), compiledStatement.getParameters());
	}

	@Test
	public void testJoinedFragments() {
		TemplateCompiler templateCompiler = TemplateCompiler.withDefaultConfiguration();
		List<SqlFragment> filters = new ArrayList<>();

		filters.add(Template.format("name = {}", "Alice"));
		filters.add(Template.format("age > {}", 30));
		filters.add(() -> Template.format("team_id = {}", 2));

		CompiledStatement compiledStatement = templateCompiler.compile(
				Template.format("SELECT * FROM employee WHERE {}", Template.join(" AND ", filters)));

		Assertions.assertEquals("SELECT * FROM employee WHERE name = $1 AND age > $2 AND team_id = $3", compiledStatement.getSql());
		Assertions.assertEquals(List.of("Alice", 30, 2), compiledStatement.getParameters());
		Assertions.assertTrue(Template.join(" AND ", List.of()).isEmpty());
	}

	@Test
	public void testArrayParameterBindsAsOneValue() {
		TemplateCompiler templateCompiler = TemplateCompiler.withDefaultConfiguration();
		ArrayParameter arrayParameter = Parameters.arrayOf("text", List.of("a", "b"));

		CompiledStatement compiledStatement = templateCompiler.compile(
				Template.format("SELECT * FROM t WHERE tags && {}", arrayParameter));

		Assertions.assertEquals("SELECT * FROM t WHERE tags && $1", compiledStatement.getSql());
		Assertions.assertEquals(List.of(arrayParameter), compiledStatement.getParameters());
	}

	private static final class EndlessFragment implements SqlFragment {
		private final int depth;

		private EndlessFragment(int depth) {
			this.depth = depth;
		}

		@Nonnull
		@Override
		public Template toTemplate() {
			return Template.format("({})", new EndlessFragment(this.depth + 1));
		}
	}
}
