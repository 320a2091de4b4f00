/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.pgmirror.connector.postgresql;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.MonthDay;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.kafka.connect.data.Decimal;
import org.apache.kafka.connect.data.Schema;
import org.apache.kafka.connect.data.SchemaBuilder;
import org.postgresql.PGStatement;
import org.postgresql.util.PGbytea;

import io.pgmirror.annotation.ThreadSafe;
import io.pgmirror.relational.Column;
import io.pgmirror.relational.ValueConverter;

/**
 * Maps the values of source columns, as received in the server's text output format, to destination values and
 * describes the destination types with Kafka Connect schemas.
 * <p>
 * Converters are resolved once per column and are pure functions, so the initial load and the replication stream
 * produce identical values for identical input.
 */
@ThreadSafe
public class PostgresValueConverter {

    public static final String DATE_SCHEMA_NAME = "io.pgmirror.time.Date";
    public static final String MICRO_TIMESTAMP_SCHEMA_NAME = "io.pgmirror.time.MicroTimestamp";
    public static final String ZONED_TIMESTAMP_SCHEMA_NAME = "io.pgmirror.time.ZonedTimestamp";
    public static final String MICRO_TIME_SCHEMA_NAME = "io.pgmirror.time.MicroTime";
    public static final String UUID_SCHEMA_NAME = "io.pgmirror.data.Uuid";
    public static final String JSON_SCHEMA_NAME = "io.pgmirror.data.Json";
    public static final String ENUM_SCHEMA_NAME = "io.pgmirror.data.Enum";

    public static final String PRECISION_PARAMETER_KEY = "connect.decimal.precision";

    public static final int POSITIVE_INFINITY_DATE = Integer.MAX_VALUE;
    public static final int NEGATIVE_INFINITY_DATE = Integer.MIN_VALUE;
    public static final long POSITIVE_INFINITY_TIMESTAMP = PGStatement.DATE_POSITIVE_INFINITY;
    public static final long NEGATIVE_INFINITY_TIMESTAMP = PGStatement.DATE_NEGATIVE_INFINITY;
    public static final String POSITIVE_INFINITY_ZONED_TIMESTAMP = "infinity";
    public static final String NEGATIVE_INFINITY_ZONED_TIMESTAMP = "-infinity";

    private static final String POSITIVE_INFINITY = "infinity";
    private static final String NEGATIVE_INFINITY = "-infinity";
    private static final String BC_SUFFIX = " BC";

    private static final long MICROS_PER_DAY = TimeUnit.DAYS.toMicros(1);

    private static final DateTimeFormatter TIME_FORMAT = new DateTimeFormatterBuilder()
            .appendPattern("HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .optionalEnd()
            .toFormatter();

    private static final Pattern ZONE_OFFSET = Pattern.compile("^(.*?)([+-]\\d{2}(?::?\\d{2}(?::?\\d{2})?)?)$");

    private final TypeRegistry typeRegistry;

    public PostgresValueConverter(TypeRegistry typeRegistry) {
        this.typeRegistry = typeRegistry;
    }

    /**
     * Describe the destination type of the column.
     *
     * @param column the column; may not be null
     * @return the schema builder, optional if the column is nullable
     * @throws UnsupportedTypeException if the column's type cannot be replicated
     */
    public SchemaBuilder schemaBuilder(Column column) {
        final PostgresType type = typeRegistry.get(column.typeOid());
        SchemaBuilder builder;
        if (type.isArrayType()) {
            final PostgresType elementType = typeRegistry.get(type.getElementOid());
            final Schema elementSchema = scalarSchemaBuilder(column, elementType).optional().build();
            Schema nested = elementSchema;
            final int dimensions = Math.max(1, column.arrayDimensions());
            for (int i = 1; i < dimensions; i++) {
                nested = SchemaBuilder.array(nested).optional().build();
            }
            builder = SchemaBuilder.array(nested);
        }
        else {
            builder = scalarSchemaBuilder(column, type);
        }
        return column.isOptional() ? builder.optional() : builder;
    }

    private SchemaBuilder scalarSchemaBuilder(Column column, PostgresType type) {
        if (type.isEnumType()) {
            return SchemaBuilder.string().name(ENUM_SCHEMA_NAME).version(1);
        }
        switch (type.getOid()) {
            case PgOid.BOOL:
                return SchemaBuilder.bool();
            case PgOid.INT2:
                return SchemaBuilder.int16();
            case PgOid.INT4:
                return SchemaBuilder.int32();
            case PgOid.INT8:
                return SchemaBuilder.int64();
            case PgOid.FLOAT4:
                return SchemaBuilder.float32();
            case PgOid.FLOAT8:
                return SchemaBuilder.float64();
            case PgOid.NUMERIC:
                if (hasPrecisionAndScale(column)) {
                    return Decimal.builder(scale(column.typeModifier()))
                            .parameter(PRECISION_PARAMETER_KEY, String.valueOf(precision(column.typeModifier())));
                }
                return SchemaBuilder.string();
            case PgOid.TEXT:
            case PgOid.VARCHAR:
            case PgOid.BPCHAR:
            case PgOid.CHAR:
            case PgOid.NAME:
                return SchemaBuilder.string();
            case PgOid.UUID:
                return SchemaBuilder.string().name(UUID_SCHEMA_NAME).version(1);
            case PgOid.JSON:
            case PgOid.JSONB_OID:
                return SchemaBuilder.string().name(JSON_SCHEMA_NAME).version(1);
            case PgOid.DATE:
                return SchemaBuilder.int32().name(DATE_SCHEMA_NAME).version(1);
            case PgOid.TIMESTAMP:
                return SchemaBuilder.int64().name(MICRO_TIMESTAMP_SCHEMA_NAME).version(1);
            case PgOid.TIMESTAMPTZ:
                return SchemaBuilder.string().name(ZONED_TIMESTAMP_SCHEMA_NAME).version(1);
            case PgOid.TIME:
                return SchemaBuilder.int64().name(MICRO_TIME_SCHEMA_NAME).version(1);
            case PgOid.BYTEA:
                return SchemaBuilder.bytes();
            default:
                throw unsupported(column, type);
        }
    }

    /**
     * Returns a converter from the text output format of the column's type to the destination value.
     *
     * @param column the column; may not be null
     * @return the converter; never null, passes {@code null} through
     * @throws UnsupportedTypeException if the column's type cannot be replicated
     */
    public ValueConverter converter(Column column) {
        final PostgresType type = typeRegistry.get(column.typeOid());
        final ValueConverter converter;
        if (type.isArrayType()) {
            final ValueConverter elementConverter = scalarConverter(column, typeRegistry.get(type.getElementOid()));
            converter = data -> convertArray(elementConverter, PgArrayParser.parse(data.toString()));
        }
        else {
            converter = scalarConverter(column, type);
        }
        return guarded(column, converter).nullOr();
    }

    private ValueConverter scalarConverter(Column column, PostgresType type) {
        if (type.isEnumType()) {
            return ValueConverter.passthrough();
        }
        switch (type.getOid()) {
            case PgOid.BOOL:
                return data -> convertBoolean(data.toString());
            case PgOid.INT2:
                return data -> Short.valueOf(data.toString());
            case PgOid.INT4:
                return data -> Integer.valueOf(data.toString());
            case PgOid.INT8:
                return data -> Long.valueOf(data.toString());
            case PgOid.FLOAT4:
                return data -> Float.valueOf(data.toString());
            case PgOid.FLOAT8:
                return data -> Double.valueOf(data.toString());
            case PgOid.NUMERIC:
                if (hasPrecisionAndScale(column)) {
                    final int scale = scale(column.typeModifier());
                    return data -> convertDecimal(data.toString(), scale);
                }
                return data -> convertVariableNumeric(data.toString());
            case PgOid.TEXT:
            case PgOid.VARCHAR:
            case PgOid.BPCHAR:
            case PgOid.CHAR:
            case PgOid.NAME:
            case PgOid.UUID:
            case PgOid.JSON:
            case PgOid.JSONB_OID:
                return ValueConverter.passthrough();
            case PgOid.DATE:
                return data -> convertDate(data.toString());
            case PgOid.TIMESTAMP:
                return data -> convertTimestamp(data.toString());
            case PgOid.TIMESTAMPTZ:
                return data -> convertTimestampWithZone(data.toString());
            case PgOid.TIME:
                return data -> convertTime(data.toString());
            case PgOid.BYTEA:
                return data -> convertBinary(data.toString());
            default:
                throw unsupported(column, type);
        }
    }

    private static ValueConverter guarded(Column column, ValueConverter converter) {
        return data -> {
            try {
                return converter.convert(data);
            }
            catch (ValueConversionException e) {
                throw new ValueConversionException("Cannot convert value of column '" + column.name() + "': " + e.getMessage(), e);
            }
            catch (NumberFormatException | DateTimeException | ArithmeticException e) {
                throw new ValueConversionException("Cannot convert value '" + data + "' of column '" + column.name() + "'", e);
            }
        };
    }

    private static List<Object> convertArray(ValueConverter elementConverter, List<Object> elements) {
        final List<Object> result = new ArrayList<>(elements.size());
        for (Object element : elements) {
            if (element == null) {
                result.add(null);
            }
            else if (element instanceof List) {
                @SuppressWarnings("unchecked")
                final List<Object> nested = (List<Object>) element;
                result.add(convertArray(elementConverter, nested));
            }
            else {
                result.add(elementConverter.convert(element));
            }
        }
        return result;
    }

    protected Object convertBoolean(String data) {
        switch (data) {
            case "t":
            case "true":
                return Boolean.TRUE;
            case "f":
            case "false":
                return Boolean.FALSE;
            default:
                throw new ValueConversionException("'" + data + "' is not a boolean");
        }
    }

    protected Object convertDecimal(String data, int scale) {
        return new BigDecimal(data).setScale(scale, RoundingMode.HALF_UP);
    }

    protected Object convertVariableNumeric(String data) {
        // rejects NaN and the infinities
        new BigDecimal(data);
        return data;
    }

    protected Object convertDate(String data) {
        switch (data) {
            case POSITIVE_INFINITY:
                return POSITIVE_INFINITY_DATE;
            case NEGATIVE_INFINITY:
                return NEGATIVE_INFINITY_DATE;
            default:
                final boolean bc = data.endsWith(BC_SUFFIX);
                return (int) parseDate(bc ? stripEra(data) : data, bc).toEpochDay();
        }
    }

    protected Object convertTimestamp(String data) {
        switch (data) {
            case POSITIVE_INFINITY:
                return POSITIVE_INFINITY_TIMESTAMP;
            case NEGATIVE_INFINITY:
                return NEGATIVE_INFINITY_TIMESTAMP;
            default:
                final boolean bc = data.endsWith(BC_SUFFIX);
                return toEpochMicros(parseDateTime(bc ? stripEra(data) : data, bc), ZoneOffset.UTC);
        }
    }

    protected Object convertTimestampWithZone(String data) {
        switch (data) {
            case POSITIVE_INFINITY:
                return POSITIVE_INFINITY_ZONED_TIMESTAMP;
            case NEGATIVE_INFINITY:
                return NEGATIVE_INFINITY_ZONED_TIMESTAMP;
            default:
                break;
        }
        // the era follows the zone offset: 0044-03-15 12:00:00+00 BC
        final boolean bc = data.endsWith(BC_SUFFIX);
        final Matcher matcher = ZONE_OFFSET.matcher(bc ? stripEra(data) : data);
        if (!matcher.matches()) {
            throw new ValueConversionException("'" + data + "' is not a timestamp with time zone");
        }
        final LocalDateTime local = parseDateTime(matcher.group(1), bc);
        final ZoneOffset offset;
        try {
            offset = ZoneOffset.of(matcher.group(2));
        }
        catch (RuntimeException e) {
            throw new ValueConversionException("'" + data + "' has an invalid zone offset", e);
        }
        return local.toInstant(offset).toString();
    }

    protected Object convertTime(String data) {
        if (data.startsWith("24:00:00")) {
            return MICROS_PER_DAY;
        }
        return LocalTime.parse(data, TIME_FORMAT).toNanoOfDay() / 1_000L;
    }

    protected Object convertBinary(String data) {
        try {
            return ByteBuffer.wrap(PGbytea.toBytes(data.getBytes(StandardCharsets.UTF_8)));
        }
        catch (SQLException | IndexOutOfBoundsException e) {
            throw new ValueConversionException("'" + data + "' is not a bytea value", e);
        }
    }

    private static String stripEra(String data) {
        return data.substring(0, data.length() - BC_SUFFIX.length());
    }

    /**
     * Parses {@code yyyy-MM-dd}, where the year has four or more digits. BC years map to the proleptic calendar,
     * so 1 BC is year 0.
     */
    private static LocalDate parseDate(String data, boolean bc) {
        final int dash = data.indexOf('-', 1);
        if (dash < 0) {
            throw new ValueConversionException("'" + data + "' is not a date");
        }
        final int year = Integer.parseInt(data.substring(0, dash));
        final MonthDay monthDay = MonthDay.parse("--" + data.substring(dash + 1));
        return LocalDate.of(bc ? 1 - year : year, monthDay.getMonth(), monthDay.getDayOfMonth());
    }

    private static LocalDateTime parseDateTime(String data, boolean bc) {
        final int space = data.indexOf(' ');
        if (space < 0) {
            throw new ValueConversionException("'" + data + "' is not a timestamp");
        }
        final LocalDate date = parseDate(data.substring(0, space), bc);
        final LocalTime time = LocalTime.parse(data.substring(space + 1), TIME_FORMAT);
        return LocalDateTime.of(date, time);
    }

    private static long toEpochMicros(LocalDateTime dateTime, ZoneOffset offset) {
        return TimeUnit.SECONDS.toMicros(dateTime.toEpochSecond(offset)) + dateTime.getNano() / 1_000L;
    }

    private static boolean hasPrecisionAndScale(Column column) {
        return column.typeModifier() >= 4;
    }

    /**
     * @return the precision packed into a {@code numeric} type modifier
     */
    public static int precision(int typeModifier) {
        return ((typeModifier - 4) >> 16) & 0xffff;
    }

    /**
     * @return the scale packed into a {@code numeric} type modifier
     */
    public static int scale(int typeModifier) {
        // 11-bit two's complement since PostgreSQL 15, which allows negative scales
        final int raw = (typeModifier - 4) & 0x7ff;
        return (raw ^ 0x400) - 0x400;
    }

    private static UnsupportedTypeException unsupported(Column column, PostgresType type) {
        return new UnsupportedTypeException("Column '" + column.name() + "' has unsupported type " + type.getName()
                + " (oid " + column.typeOid() + ")");
    }
}
