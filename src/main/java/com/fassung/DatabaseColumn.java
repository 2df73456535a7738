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

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Names the column(s) a record component or JavaBean field is read from, in place of its own name.
 * <p>
 * Useful in situations where column names are ugly, inconsistent, or do not map well to camel-case Java names.
 * Matching is case-sensitive; the first listed name present in the row wins.
 * <p>
 * For example:
 *
 * <pre>
 * record Student(&#064;DatabaseColumn(&quot;full_name&quot;) String fullName, Long id) {}
 *
 * connection.fetch(Template.of(&quot;SELECT id, full_name FROM student&quot;), Student.class);
 * </pre>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@Target({ElementType.FIELD, ElementType.RECORD_COMPONENT})
@Retention(RetentionPolicy.RUNTIME)
public @interface DatabaseColumn {
	@NonNull
	String[] value();
}
