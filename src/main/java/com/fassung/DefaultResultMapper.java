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

import javax.annotation.concurrent.ThreadSafe;
import java.beans.BeanInfo;
import java.beans.IntrospectionException;
import java.beans.Introspector;
import java.beans.PropertyDescriptor;
import java.lang.reflect.AnnotatedElement;
import java.lang.reflect.AnnotatedType;
import java.lang.reflect.Array;
import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Currency;
import java.util.Date;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link ResultMapper}.
 * <p>
 * Supports three kinds of result type:
 * <ul>
 *   <li>{@link Row} and {@link Map}, which receive the row as-is</li>
 *   <li>"standard" single-value types such as {@link String}, {@link Long}, {@link UUID} or {@link LocalDate}, which
 *   require a single-column row</li>
 *   <li>records and JavaBeans, whose components/properties are matched to columns by exact, case-sensitive name or
 *   by {@link DatabaseColumn}</li>
 * </ul>
 * A component or property is <em>required</em> (its column must be present) unless it is declared as
 * {@link Optional} or annotated {@code @Nullable}. It is <em>non-nullable</em> (a {@code NULL} value is an error) if
 * it is primitive or annotated {@code @NonNull}. Columns without a matching component are ignored.
 * <p>
 * Values are coerced according to a fixed table: integers widen to any integer type that holds them and to
 * floating-point types that represent them exactly, floating-point values never narrow to integer types and only
 * narrow from double to float when no precision is lost, decimals round to the nearest float or double within range,
 * text never converts to numbers, and date/time values convert between zoned and zone-less forms using the configured
 * time zone.
 * <p>
 * Notification payloads arrive as text and are parsed rather than coerced: see {@link #mapPayload(String, Class)}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
class DefaultResultMapper implements ResultMapper {
	@NonNull
	private static final Map<Class<?>, Class<?>> BOXED_CLASSES_BY_PRIMITIVE_CLASS;

	static {
		BOXED_CLASSES_BY_PRIMITIVE_CLASS = Map.of(
				boolean.class, Boolean.class,
				byte.class, Byte.class,
				short.class, Short.class,
				int.class, Integer.class,
				long.class, Long.class,
				float.class, Float.class,
				double.class, Double.class,
				char.class, Character.class
		);
	}

	@NonNull
	private final ZoneId timeZone;
	@NonNull
	private final ConcurrentMap<Class<?>, ResultShape> resultShapesByType;

	DefaultResultMapper(@NonNull ZoneId timeZone) {
		requireNonNull(timeZone);

		this.timeZone = timeZone;
		this.resultShapesByType = new ConcurrentHashMap<>();
	}

	@Nullable
	@Override
	@SuppressWarnings("unchecked")
	public <T> T mapRow(@NonNull Row row,
											@NonNull Integer rowIndex,
											@NonNull Class<T> resultType) {
		requireNonNull(row);
		requireNonNull(rowIndex);
		requireNonNull(resultType);

		if (resultType == Row.class)
			return (T) row;

		if (resultType == Map.class)
			return (T) row.toMap();

		if (isStandardType(resultType))
			return (T) mapRowToStandardType(row, rowIndex, resultType);

		ResultShape resultShape;

		try {
			resultShape = determineResultShape(resultType);
		} catch (RuntimeException e) {
			throw new MappingException(rowIndex, null, null, format("%s cannot be used as a result type", resultType.getName()), e);
		}

		return (T) mapRowToShape(row, rowIndex, resultShape);
	}

	/**
	 * Parses a notification payload.
	 * <p>
	 * Numbers are parsed with the same range checks as coerced numbers, booleans accept {@code true}/{@code false}
	 * and {@code t}/{@code f} in any case, date/time types accept their ISO-8601 forms, and text-backed types (UUIDs,
	 * enums, zones, locales and currencies) follow the coercion table.
	 */
	@Nullable
	@Override
	@SuppressWarnings("unchecked")
	public <T> T mapPayload(@NonNull String payload,
													@NonNull Class<T> payloadType) {
		requireNonNull(payload);
		requireNonNull(payloadType);

		try {
			return (T) parsePayload(payload, boxedClass(payloadType));
		} catch (CoercionException e) {
			throw new DatabaseException(format("Unable to parse notification payload '%s' as %s: %s", payload,
					payloadType.getSimpleName(), e.getMessage()), e);
		}
	}

	@NonNull
	protected Object parsePayload(@NonNull String payload,
																@NonNull Class<?> targetClass) throws CoercionException {
		requireNonNull(payload);
		requireNonNull(targetClass);

		if (targetClass == String.class || targetClass == Object.class)
			return payload;

		String trimmedPayload = payload.trim();

		try {
			if (targetClass == Double.class)
				return Double.valueOf(trimmedPayload);
			if (targetClass == Float.class)
				return Float.valueOf(trimmedPayload);
			if (targetClass == BigDecimal.class)
				return new BigDecimal(trimmedPayload);
			if (Number.class.isAssignableFrom(targetClass))
				return coerceNumber(new BigInteger(trimmedPayload), WireValueKind.INTEGER, targetClass);
		} catch (NumberFormatException e) {
			throw new CoercionException(format("'%s' is not a valid %s", payload, targetClass.getSimpleName()));
		}

		if (targetClass == Boolean.class) {
			if ("true".equalsIgnoreCase(trimmedPayload) || "t".equalsIgnoreCase(trimmedPayload))
				return true;
			if ("false".equalsIgnoreCase(trimmedPayload) || "f".equalsIgnoreCase(trimmedPayload))
				return false;

			throw new CoercionException(format("'%s' is not a valid boolean", payload));
		}

		if (isDateTimeType(targetClass)) {
			try {
				if (targetClass == LocalDate.class)
					return LocalDate.parse(trimmedPayload);
				if (targetClass == LocalDateTime.class)
					return LocalDateTime.parse(trimmedPayload);
				if (targetClass == LocalTime.class)
					return LocalTime.parse(trimmedPayload);
				if (targetClass == OffsetDateTime.class)
					return OffsetDateTime.parse(trimmedPayload);
				if (targetClass == OffsetTime.class)
					return OffsetTime.parse(trimmedPayload);
				if (targetClass == ZonedDateTime.class)
					return ZonedDateTime.parse(trimmedPayload);
				if (targetClass == Instant.class)
					return Instant.parse(trimmedPayload);
			} catch (DateTimeException e) {
				throw new CoercionException(format("'%s' is not a valid ISO-8601 %s", payload, targetClass.getSimpleName()));
			}

			throw new CoercionException(format("Notification payloads cannot be parsed as %s", targetClass.getName()));
		}

		return coerce(payload, targetClass);
	}

	@Nullable
	protected Object mapRowToStandardType(@NonNull Row row,
																				@NonNull Integer rowIndex,
																				@NonNull Class<?> resultType) {
		requireNonNull(row);
		requireNonNull(rowIndex);
		requireNonNull(resultType);

		if (row.getColumnCount() != 1)
			throw new MappingException(rowIndex, null, null, format("%s requires a row with exactly 1 column, but the row has %d: %s",
					resultType.getSimpleName(), row.getColumnCount(), row.getColumnNames()));

		String columnName = row.getColumnNames().get(0);
		Object value = row.get(0);

		if (value == null) {
			if (resultType.isPrimitive())
				throw new MappingException(rowIndex, columnName, null, format("NULL cannot be assigned to primitive type %s", resultType));

			return null;
		}

		try {
			return coerce(value, resultType);
		} catch (CoercionException e) {
			throw new MappingException(rowIndex, columnName, null, e.getMessage());
		}
	}

	@NonNull
	protected Object mapRowToShape(@NonNull Row row,
																 @NonNull Integer rowIndex,
																 @NonNull ResultShape resultShape) {
		requireNonNull(row);
		requireNonNull(rowIndex);
		requireNonNull(resultShape);

		List<ShapeField> fields = resultShape.getFields();
		Object[] values = new Object[fields.size()];
		boolean[] present = new boolean[fields.size()];

		for (int i = 0; i < fields.size(); ++i) {
			ShapeField field = fields.get(i);
			String columnName = null;

			for (String candidateColumnName : field.getColumnNames()) {
				if (row.hasColumn(candidateColumnName)) {
					columnName = candidateColumnName;
					break;
				}
			}

			if (columnName == null) {
				if (field.isRequired())
					throw new MappingException(rowIndex, field.getColumnNames().get(0), field.getName(),
							format("no matching column; the row has %s", row.getColumnNames()));

				values[i] = field.isOptionalWrapper() ? Optional.empty() : null;
				continue;
			}

			present[i] = true;
			Object rawValue = row.get(columnName).orElse(null);

			if (rawValue == null) {
				if (!field.isNullable())
					throw new MappingException(rowIndex, columnName, field.getName(),
							format("NULL cannot be assigned to non-nullable field of type %s", field.getValueType().getTypeName()));

				values[i] = field.isOptionalWrapper() ? Optional.empty() : null;
				continue;
			}

			Object value;

			try {
				value = coerce(rawValue, field.getValueType());
			} catch (CoercionException e) {
				throw new MappingException(rowIndex, columnName, field.getName(), e.getMessage());
			}

			values[i] = field.isOptionalWrapper() ? Optional.of(value) : value;
		}

		try {
			if (resultShape.isRecord())
				return resultShape.getConstructor().newInstance(values);

			Object instance = resultShape.getConstructor().newInstance();

			for (int i = 0; i < fields.size(); ++i)
				if (present[i] || fields.get(i).isOptionalWrapper())
					fields.get(i).getSetter().orElseThrow().invoke(instance, values[i]);

			return instance;
		} catch (InvocationTargetException e) {
			Throwable cause = e.getCause() == null ? e : e.getCause();
			throw new MappingException(rowIndex, null, null, format("%s rejected the mapped values", resultShape.getType().getName()), cause);
		} catch (ReflectiveOperationException e) {
			throw new MappingException(rowIndex, null, null, format("Unable to instantiate %s", resultShape.getType().getName()), e);
		}
	}

	/**
	 * Coerces a non-null wire value to the given target type according to the coercion table.
	 *
	 * @param value      the wire value
	 * @param targetType the declared type to coerce to
	 * @return the coerced value, an instance of {@code targetType}'s (boxed) raw class
	 * @throws CoercionException if the table has no coercion for this value and type
	 */
	@NonNull
	protected Object coerce(@NonNull Object value,
													@NonNull Type targetType) throws CoercionException {
		requireNonNull(value);
		requireNonNull(targetType);

		Class<?> targetClass = boxedClass(rawClass(targetType));
		Object normalizedValue = normalizeLegacyValue(value);
		WireValueKind kind = WireValueKind.of(normalizedValue);

		if (targetClass == Object.class)
			return normalizedValue;

		if (Number.class.isAssignableFrom(targetClass))
			return coerceNumber(normalizedValue, kind, targetClass);

		if (targetClass == Boolean.class) {
			if (normalizedValue instanceof Boolean)
				return normalizedValue;

			throw CoercionException.unsupported(kind, targetType);
		}

		if (targetClass == String.class) {
			if (kind == WireValueKind.TEXT)
				return normalizedValue.toString();

			throw CoercionException.unsupported(kind, targetType);
		}

		if (targetClass == Character.class) {
			if (normalizedValue instanceof Character)
				return normalizedValue;
			if (normalizedValue instanceof String string && string.length() == 1)
				return string.charAt(0);

			throw new CoercionException(format("%s value cannot be converted to a single character", kind));
		}

		if (targetClass == UUID.class) {
			if (normalizedValue instanceof UUID)
				return normalizedValue;

			if (normalizedValue instanceof String string) {
				try {
					return UUID.fromString(string);
				} catch (IllegalArgumentException e) {
					throw new CoercionException(format("'%s' is not a valid UUID", string));
				}
			}

			throw CoercionException.unsupported(kind, targetType);
		}

		if (targetClass.isEnum()) {
			if (normalizedValue instanceof String string) {
				for (Object enumConstant : targetClass.getEnumConstants())
					if (((Enum<?>) enumConstant).name().equals(string))
						return enumConstant;

				throw new CoercionException(format("'%s' is not a constant of %s", string, targetClass.getName()));
			}

			throw CoercionException.unsupported(kind, targetType);
		}

		if (targetClass == byte[].class) {
			if (normalizedValue instanceof byte[])
				return normalizedValue;

			throw CoercionException.unsupported(kind, targetType);
		}

		if (kind == WireValueKind.DATE_TIME || isDateTimeType(targetClass))
			return coerceDateTime(normalizedValue, kind, targetClass);

		if (targetClass == ZoneId.class || targetClass == Locale.class || targetClass == Currency.class) {
			if (!(normalizedValue instanceof String string))
				throw CoercionException.unsupported(kind, targetType);

			try {
				if (targetClass == ZoneId.class)
					return ZoneId.of(string);
				if (targetClass == Currency.class)
					return Currency.getInstance(string);

				Locale locale = Locale.forLanguageTag(string);

				if (locale.getLanguage().isEmpty())
					throw new CoercionException(format("'%s' is not a valid IETF BCP 47 language tag", string));

				return locale;
			} catch (DateTimeException | IllegalArgumentException e) {
				throw new CoercionException(format("'%s' is not a valid %s", string, targetClass.getSimpleName()));
			}
		}

		if (Collection.class.isAssignableFrom(targetClass))
			return coerceCollection(normalizedValue, kind, targetType, targetClass);

		if (targetClass.isArray())
			return coerceArray(normalizedValue, kind, targetClass);

		if (targetClass.isInstance(normalizedValue))
			return normalizedValue;

		throw CoercionException.unsupported(kind, targetType);
	}

	@NonNull
	protected Object coerceNumber(@NonNull Object value,
																@NonNull WireValueKind kind,
																@NonNull Class<?> targetClass) throws CoercionException {
		requireNonNull(value);
		requireNonNull(kind);
		requireNonNull(targetClass);

		BigInteger integerValue = null;

		if (kind == WireValueKind.INTEGER) {
			integerValue = value instanceof BigInteger bigInteger ? bigInteger : BigInteger.valueOf(((Number) value).longValue());
		} else if (kind == WireValueKind.FLOAT) {
			if (targetClass == Double.class || targetClass == Float.class)
				return coerceFloatingPoint(value, targetClass);

			BigDecimal decimalValue;

			try {
				decimalValue = value instanceof BigDecimal bigDecimal ? bigDecimal : new BigDecimal(value.toString());
			} catch (NumberFormatException e) {
				throw new CoercionException(format("%s cannot be represented as %s", value, targetClass.getSimpleName()));
			}

			if (targetClass == BigDecimal.class)
				return decimalValue;

			// Only exact decimals (e.g. NUMERIC(10, 0) columns) may become integers
			if (!(value instanceof BigDecimal))
				throw new CoercionException(format("floating-point value %s cannot be narrowed to %s", value, targetClass.getSimpleName()));

			try {
				integerValue = decimalValue.toBigIntegerExact();
			} catch (ArithmeticException e) {
				throw new CoercionException(format("decimal value %s has a fractional part and cannot be narrowed to %s", value, targetClass.getSimpleName()));
			}
		} else {
			throw CoercionException.unsupported(kind, targetClass);
		}

		try {
			if (targetClass == Long.class)
				return integerValue.longValueExact();
			if (targetClass == Integer.class)
				return integerValue.intValueExact();
			if (targetClass == Short.class)
				return integerValue.shortValueExact();
			if (targetClass == Byte.class)
				return integerValue.byteValueExact();
		} catch (ArithmeticException e) {
			throw new CoercionException(format("integer value %s is out of range for %s", integerValue, targetClass.getSimpleName()));
		}

		if (targetClass == BigInteger.class)
			return integerValue;
		if (targetClass == BigDecimal.class)
			return new BigDecimal(integerValue);
		if (targetClass == Double.class || targetClass == Float.class) {
			double doubleValue = targetClass == Float.class ? integerValue.floatValue() : integerValue.doubleValue();

			if (Double.isInfinite(doubleValue) || !new BigDecimal(doubleValue).toBigInteger().equals(integerValue))
				throw new CoercionException(format("integer value %s cannot be represented exactly as %s", integerValue, targetClass.getSimpleName()));

			if (targetClass == Float.class)
				return (float) doubleValue;

			return doubleValue;
		}

		throw CoercionException.unsupported(kind, targetClass);
	}

	@NonNull
	protected Object coerceFloatingPoint(@NonNull Object value,
																			 @NonNull Class<?> targetClass) throws CoercionException {
		requireNonNull(value);
		requireNonNull(targetClass);

		// Decimals are inexact in binary anyway, so rounding is fine as long as the magnitude fits
		if (value instanceof BigDecimal) {
			BigDecimal decimalValue = (BigDecimal) value;
			double doubleValue = targetClass == Float.class ? decimalValue.floatValue() : decimalValue.doubleValue();

			if (Double.isInfinite(doubleValue))
				throw new CoercionException(format("decimal value %s is out of range for %s", decimalValue, targetClass.getSimpleName()));

			if (targetClass == Float.class)
				return (float) doubleValue;

			return doubleValue;
		}

		double doubleValue = ((Number) value).doubleValue();

		if (targetClass == Double.class)
			return doubleValue;

		float floatValue = (float) doubleValue;

		if (Double.isFinite(doubleValue) && (double) floatValue != doubleValue)
			throw new CoercionException(format("floating-point value %s cannot be represented exactly as Float", value));

		return floatValue;
	}

	@NonNull
	protected Object coerceDateTime(@NonNull Object value,
																	@NonNull WireValueKind kind,
																	@NonNull Class<?> targetClass) throws CoercionException {
		requireNonNull(value);
		requireNonNull(kind);
		requireNonNull(targetClass);

		if (targetClass.isInstance(value))
			return value;

		ZoneId timeZone = getTimeZone();

		if (targetClass == LocalDateTime.class) {
			if (value instanceof LocalDate localDate)
				return localDate.atStartOfDay();
			if (value instanceof Instant instant)
				return instant.atZone(timeZone).toLocalDateTime();
			if (value instanceof OffsetDateTime offsetDateTime)
				return offsetDateTime.atZoneSameInstant(timeZone).toLocalDateTime();
			if (value instanceof ZonedDateTime zonedDateTime)
				return zonedDateTime.withZoneSameInstant(timeZone).toLocalDateTime();
		} else if (targetClass == LocalDate.class) {
			if (value instanceof LocalDateTime localDateTime)
				return localDateTime.toLocalDate();
		} else if (targetClass == Instant.class) {
			if (value instanceof LocalDateTime localDateTime)
				return localDateTime.atZone(timeZone).toInstant();
			if (value instanceof OffsetDateTime offsetDateTime)
				return offsetDateTime.toInstant();
			if (value instanceof ZonedDateTime zonedDateTime)
				return zonedDateTime.toInstant();
		} else if (targetClass == OffsetDateTime.class) {
			if (value instanceof LocalDateTime localDateTime)
				return localDateTime.atZone(timeZone).toOffsetDateTime();
			if (value instanceof Instant instant)
				return instant.atZone(timeZone).toOffsetDateTime();
			if (value instanceof ZonedDateTime zonedDateTime)
				return zonedDateTime.toOffsetDateTime();
		} else if (targetClass == ZonedDateTime.class) {
			if (value instanceof LocalDateTime localDateTime)
				return localDateTime.atZone(timeZone);
			if (value instanceof Instant instant)
				return instant.atZone(timeZone);
			if (value instanceof OffsetDateTime offsetDateTime)
				return offsetDateTime.toZonedDateTime();
		} else if (targetClass == LocalTime.class) {
			if (value instanceof OffsetTime offsetTime)
				return offsetTime.toLocalTime();
		} else if (targetClass == OffsetTime.class) {
			if (value instanceof LocalTime localTime) {
				ZoneOffset zoneOffset = timeZone.getRules().getOffset(Instant.EPOCH);
				return localTime.atOffset(zoneOffset);
			}
		}

		throw CoercionException.unsupported(kind, targetClass);
	}

	@NonNull
	protected Object coerceCollection(@NonNull Object value,
																		@NonNull WireValueKind kind,
																		@NonNull Type targetType,
																		@NonNull Class<?> targetClass) throws CoercionException {
		requireNonNull(value);
		requireNonNull(kind);
		requireNonNull(targetType);
		requireNonNull(targetClass);

		if (value instanceof Map<?, ?> || kind != WireValueKind.COMPOSITE)
			throw CoercionException.unsupported(kind, targetType);

		Type elementType = Object.class;

		if (targetType instanceof ParameterizedType parameterizedType && parameterizedType.getActualTypeArguments().length == 1)
			elementType = parameterizedType.getActualTypeArguments()[0];

		List<Object> elements = new ArrayList<>();

		for (Object element : compositeElements(value))
			elements.add(element == null ? null : coerce(element, elementType));

		if (targetClass.isAssignableFrom(List.class))
			return Collections.unmodifiableList(elements);
		if (targetClass.isAssignableFrom(Set.class))
			return Collections.unmodifiableSet(new LinkedHashSet<>(elements));

		throw CoercionException.unsupported(kind, targetType);
	}

	@NonNull
	protected Object coerceArray(@NonNull Object value,
															 @NonNull WireValueKind kind,
															 @NonNull Class<?> targetClass) throws CoercionException {
		requireNonNull(value);
		requireNonNull(kind);
		requireNonNull(targetClass);

		if (value instanceof Map<?, ?> || kind != WireValueKind.COMPOSITE)
			throw CoercionException.unsupported(kind, targetClass);

		Class<?> componentType = targetClass.getComponentType();
		List<Object> elements = compositeElements(value);
		Object array = Array.newInstance(componentType, elements.size());

		for (int i = 0; i < elements.size(); ++i) {
			Object element = elements.get(i);

			if (element == null) {
				if (componentType.isPrimitive())
					throw new CoercionException(format("array element %d is NULL but %s cannot hold NULL", i, targetClass.getSimpleName()));

				continue;
			}

			Array.set(array, i, coerce(element, componentType));
		}

		return array;
	}

	@NonNull
	protected ResultShape determineResultShape(@NonNull Class<?> resultType) {
		requireNonNull(resultType);
		return getResultShapesByType().computeIfAbsent(resultType, type -> type.isRecord() ? createRecordShape(type) : createBeanShape(type));
	}

	@NonNull
	protected ResultShape createRecordShape(@NonNull Class<?> recordType) {
		requireNonNull(recordType);

		RecordComponent[] recordComponents = recordType.getRecordComponents();
		List<ShapeField> fields = new ArrayList<>(recordComponents.length);
		Class<?>[] parameterTypes = new Class<?>[recordComponents.length];

		for (int i = 0; i < recordComponents.length; ++i) {
			RecordComponent recordComponent = recordComponents[i];
			parameterTypes[i] = recordComponent.getType();
			fields.add(createShapeField(recordComponent.getName(), recordComponent.getGenericType(), recordComponent,
					recordComponent.getAnnotatedType(), null));
		}

		try {
			Constructor<?> constructor = recordType.getDeclaredConstructor(parameterTypes);
			constructor.setAccessible(true);
			return new ResultShape(recordType, true, constructor, fields);
		} catch (NoSuchMethodException | SecurityException e) {
			throw new DatabaseException(format("Unable to access canonical constructor of %s", recordType.getName()), e);
		}
	}

	@NonNull
	protected ResultShape createBeanShape(@NonNull Class<?> beanType) {
		requireNonNull(beanType);

		if (beanType.isInterface() || beanType.isPrimitive() || beanType.isArray() || java.lang.reflect.Modifier.isAbstract(beanType.getModifiers()))
			throw new DatabaseException(format("%s is neither a record nor an instantiable JavaBean", beanType.getName()));

		BeanInfo beanInfo;

		try {
			beanInfo = Introspector.getBeanInfo(beanType);
		} catch (IntrospectionException e) {
			throw new DatabaseException(format("Unable to introspect %s", beanType.getName()), e);
		}

		List<ShapeField> fields = new ArrayList<>();

		for (PropertyDescriptor propertyDescriptor : beanInfo.getPropertyDescriptors()) {
			Method writeMethod = propertyDescriptor.getWriteMethod();

			if (writeMethod == null)
				continue;

			Field field = findField(beanType, propertyDescriptor.getName()).orElse(null);
			AnnotatedElement annotatedElement = field == null ? writeMethod : field;
			AnnotatedType annotatedType = field == null ? writeMethod.getAnnotatedParameterTypes()[0] : field.getAnnotatedType();

			fields.add(createShapeField(propertyDescriptor.getName(), writeMethod.getGenericParameterTypes()[0],
					annotatedElement, annotatedType, writeMethod));
		}

		try {
			Constructor<?> constructor = beanType.getDeclaredConstructor();
			constructor.setAccessible(true);
			return new ResultShape(beanType, false, constructor, fields);
		} catch (NoSuchMethodException | SecurityException e) {
			throw new DatabaseException(format("%s must have a no-argument constructor to be used as a JavaBean result type", beanType.getName()), e);
		}
	}

	@NonNull
	protected ShapeField createShapeField(@NonNull String name,
																				@NonNull Type declaredType,
																				@NonNull AnnotatedElement annotatedElement,
																				@NonNull AnnotatedType annotatedType,
																				@Nullable Method setter) {
		requireNonNull(name);
		requireNonNull(declaredType);
		requireNonNull(annotatedElement);
		requireNonNull(annotatedType);

		DatabaseColumn databaseColumn = annotatedElement.getAnnotation(DatabaseColumn.class);
		List<String> columnNames = databaseColumn == null || databaseColumn.value().length == 0
				? List.of(name)
				: List.of(databaseColumn.value());

		boolean optionalWrapper = rawClass(declaredType) == Optional.class;
		Type valueType = declaredType;

		if (optionalWrapper)
			valueType = declaredType instanceof ParameterizedType parameterizedType
					? parameterizedType.getActualTypeArguments()[0]
					: Object.class;

		boolean nullableAnnotated = annotatedType.isAnnotationPresent(Nullable.class)
				|| annotatedElement.isAnnotationPresent(javax.annotation.Nullable.class);
		boolean nonNullAnnotated = annotatedType.isAnnotationPresent(NonNull.class)
				|| annotatedElement.isAnnotationPresent(javax.annotation.Nonnull.class);

		return new ShapeField(name, columnNames, valueType, optionalWrapper, nullableAnnotated,
				nonNullAnnotated || rawClass(declaredType).isPrimitive(), setter);
	}

	@NonNull
	protected Boolean isStandardType(@NonNull Class<?> type) {
		requireNonNull(type);

		if (type.isPrimitive() || type.isEnum() || type.isArray())
			return true;

		return Slot.SCALAR_TYPES.contains(type)
				|| type == Object.class
				|| type == ZoneId.class
				|| type == List.class
				|| type == Set.class
				|| type == Collection.class;
	}

	@NonNull
	protected Boolean isDateTimeType(@NonNull Class<?> type) {
		requireNonNull(type);

		return type == LocalDate.class || type == LocalTime.class || type == LocalDateTime.class || type == OffsetDateTime.class
				|| type == OffsetTime.class || type == ZonedDateTime.class || type == Instant.class;
	}

	@NonNull
	protected Object normalizeLegacyValue(@NonNull Object value) {
		requireNonNull(value);

		if (value instanceof java.sql.Timestamp timestamp)
			return timestamp.toLocalDateTime();
		if (value instanceof java.sql.Date date)
			return date.toLocalDate();
		if (value instanceof java.sql.Time time)
			return time.toLocalTime();
		if (value instanceof Date date)
			return date.toInstant();

		return value;
	}

	@NonNull
	protected List<Object> compositeElements(@NonNull Object value) {
		requireNonNull(value);

		if (value instanceof Collection<?> collection)
			return new ArrayList<>(collection);

		if (value instanceof Object[] objects)
			return Arrays.asList(objects);

		int length = Array.getLength(value);
		List<Object> elements = new ArrayList<>(length);

		for (int i = 0; i < length; ++i)
			elements.add(Array.get(value, i));

		return elements;
	}

	@NonNull
	protected Optional<Field> findField(@NonNull Class<?> type,
																			@NonNull String name) {
		requireNonNull(type);
		requireNonNull(name);

		for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
			for (Field field : current.getDeclaredFields())
				if (field.getName().equals(name))
					return Optional.of(field);
		}

		return Optional.empty();
	}

	@NonNull
	protected static Class<?> rawClass(@NonNull Type type) {
		requireNonNull(type);

		if (type instanceof Class<?> clazz)
			return clazz;
		if (type instanceof ParameterizedType parameterizedType)
			return rawClass(parameterizedType.getRawType());
		if (type instanceof GenericArrayType genericArrayType)
			return Array.newInstance(rawClass(genericArrayType.getGenericComponentType()), 0).getClass();

		return Object.class;
	}

	@NonNull
	protected static Class<?> boxedClass(@NonNull Class<?> type) {
		requireNonNull(type);

		Class<?> boxedClass = BOXED_CLASSES_BY_PRIMITIVE_CLASS.get(type);
		return boxedClass == null ? type : boxedClass;
	}

	@NonNull
	protected ZoneId getTimeZone() {
		return this.timeZone;
	}

	@NonNull
	protected ConcurrentMap<Class<?>, ResultShape> getResultShapesByType() {
		return this.resultShapesByType;
	}

	/**
	 * How a record or JavaBean type is populated from a row.
	 */
	@ThreadSafe
	protected static final class ResultShape {
		@NonNull
		private final Class<?> type;
		@NonNull
		private final Boolean record;
		@NonNull
		private final Constructor<?> constructor;
		@NonNull
		private final List<ShapeField> fields;

		ResultShape(@NonNull Class<?> type,
								@NonNull Boolean record,
								@NonNull Constructor<?> constructor,
								@NonNull List<ShapeField> fields) {
			this.type = requireNonNull(type);
			this.record = requireNonNull(record);
			this.constructor = requireNonNull(constructor);
			this.fields = List.copyOf(requireNonNull(fields));
		}

		@NonNull
		public Class<?> getType() {
			return this.type;
		}

		@NonNull
		public Boolean isRecord() {
			return this.record;
		}

		@NonNull
		public Constructor<?> getConstructor() {
			return this.constructor;
		}

		@NonNull
		public List<ShapeField> getFields() {
			return this.fields;
		}
	}

	/**
	 * A record component or JavaBean property and the columns it can be read from.
	 */
	@ThreadSafe
	protected static final class ShapeField {
		@NonNull
		private final String name;
		@NonNull
		private final List<String> columnNames;
		@NonNull
		private final Type valueType;
		@NonNull
		private final Boolean optionalWrapper;
		@NonNull
		private final Boolean nullableAnnotated;
		@NonNull
		private final Boolean nonNullable;
		@Nullable
		private final Method setter;

		ShapeField(@NonNull String name,
							 @NonNull List<String> columnNames,
							 @NonNull Type valueType,
							 @NonNull Boolean optionalWrapper,
							 @NonNull Boolean nullableAnnotated,
							 @NonNull Boolean nonNullable,
							 @Nullable Method setter) {
			this.name = requireNonNull(name);
			this.columnNames = List.copyOf(requireNonNull(columnNames));
			this.valueType = requireNonNull(valueType);
			this.optionalWrapper = requireNonNull(optionalWrapper);
			this.nullableAnnotated = requireNonNull(nullableAnnotated);
			this.nonNullable = requireNonNull(nonNullable);
			this.setter = setter;
		}

		@NonNull
		public String getName() {
			return this.name;
		}

		@NonNull
		public List<String> getColumnNames() {
			return this.columnNames;
		}

		/**
		 * The declared type, with any {@link Optional} wrapper removed.
		 */
		@NonNull
		public Type getValueType() {
			return this.valueType;
		}

		@NonNull
		public Boolean isOptionalWrapper() {
			return this.optionalWrapper;
		}

		@NonNull
		public Boolean isRequired() {
			return !this.optionalWrapper && !this.nullableAnnotated;
		}

		@NonNull
		public Boolean isNullable() {
			return !this.nonNullable;
		}

		@NonNull
		public Optional<Method> getSetter() {
			return Optional.ofNullable(this.setter);
		}
	}

	/**
	 * Signals that the coercion table has no entry for a value and target type.
	 */
	protected static final class CoercionException extends Exception {
		CoercionException(@NonNull String message) {
			super(requireNonNull(message));
		}

		@NonNull
		static CoercionException unsupported(@NonNull WireValueKind kind,
																				 @NonNull Type targetType) {
			return new CoercionException(format("%s value cannot be coerced to %s", kind, targetType.getTypeName()));
		}
	}
}
