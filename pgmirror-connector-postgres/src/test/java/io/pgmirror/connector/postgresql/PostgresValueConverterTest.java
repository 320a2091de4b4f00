/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.time.LocalDate;
import java.util.Arrays;

import org.apache.kafka.connect.data.Decimal;
import org.apache.kafka.connect.data.Schema;
import org.junit.Before;
import org.junit.Test;

import io.pgmirror.relational.Column;

public class PostgresValueConverterTest {

    private static final int MOOD_OID = 90001;

    private TypeRegistry typeRegistry;
    private PostgresValueConverter converters;

    @Before
    public void beforeEach() {
        typeRegistry = new TypeRegistry();
        typeRegistry.register(PostgresType.enumType(MOOD_OID, "mood"));
        converters = new PostgresValueConverter(typeRegistry);
    }

    private static Column column(int oid, int typeModifier, int dimensions) {
        return Column.editor()
                .name("c")
                .position(1)
                .type("t", oid)
                .typeModifier(typeModifier)
                .arrayDimensions(dimensions)
                .optional(true)
                .create();
    }

    private Object convert(int oid, String value) {
        return converters.converter(column(oid, -1, 0)).convert(value);
    }

    @Test
    public void shouldConvertNumbers() {
        assertThat(convert(PgOid.INT2, "-12")).isEqualTo((short) -12);
        assertThat(convert(PgOid.INT4, "2147483647")).isEqualTo(Integer.MAX_VALUE);
        assertThat(convert(PgOid.INT8, "9223372036854775807")).isEqualTo(Long.MAX_VALUE);
        assertThat(convert(PgOid.FLOAT4, "1.25")).isEqualTo(1.25f);
        assertThat(convert(PgOid.FLOAT8, "-0.5")).isEqualTo(-0.5d);
        assertThat(convert(PgOid.FLOAT8, "NaN")).isEqualTo(Double.NaN);
    }

    @Test
    public void shouldScaleBoundedNumeric() {
        final Column numeric = column(PgOid.NUMERIC, ((10 << 16) | 2) + 4, 0);
        assertThat(converters.converter(numeric).convert("1.5")).isEqualTo(new BigDecimal("1.50"));
        assertThat(converters.converter(numeric).convert("2.345")).isEqualTo(new BigDecimal("2.35"));

        final Schema schema = converters.schemaBuilder(numeric).build();
        assertThat(schema.name()).isEqualTo(Decimal.LOGICAL_NAME);
        assertThat(schema.parameters()).containsEntry(Decimal.SCALE_FIELD, "2");
        assertThat(schema.isOptional()).isTrue();
    }

    @Test
    public void shouldSupportNegativeNumericScale() {
        // numeric(5, -2) as stored by PostgreSQL 15: scale is an 11-bit two's complement field
        final Column numeric = column(PgOid.NUMERIC, ((5 << 16) | (-2 & 0x7ff)) + 4, 0);
        assertThat(PostgresValueConverter.precision(numeric.typeModifier())).isEqualTo(5);
        assertThat(PostgresValueConverter.scale(numeric.typeModifier())).isEqualTo(-2);
        assertThat(converters.converter(numeric).convert("12300")).isEqualTo(new BigDecimal("1.23E+4"));
        assertThat(converters.schemaBuilder(numeric).build().parameters()).containsEntry(Decimal.SCALE_FIELD, "-2");
    }

    @Test
    public void shouldKeepUnboundedNumericAsText() {
        assertThat(convert(PgOid.NUMERIC, "12345678901234567890.000000001")).isEqualTo("12345678901234567890.000000001");
        assertThat(converters.schemaBuilder(column(PgOid.NUMERIC, -1, 0)).build().type()).isEqualTo(Schema.Type.STRING);
        assertThatThrownBy(() -> convert(PgOid.NUMERIC, "NaN")).isInstanceOf(ValueConversionException.class)
                .hasMessageContaining("column 'c'");
    }

    @Test
    public void shouldConvertBooleans() {
        assertThat(convert(PgOid.BOOL, "t")).isEqualTo(true);
        assertThat(convert(PgOid.BOOL, "false")).isEqualTo(false);
        assertThatThrownBy(() -> convert(PgOid.BOOL, "yes")).isInstanceOf(ValueConversionException.class);
    }

    @Test
    public void shouldPassTextualTypesThrough() {
        assertThat(convert(PgOid.TEXT, "zażółć")).isEqualTo("zażółć");
        assertThat(convert(PgOid.UUID, "a0eebc99-9c0b-4ef8-bb6d-6bb9bd380a11")).isEqualTo("a0eebc99-9c0b-4ef8-bb6d-6bb9bd380a11");
        assertThat(convert(PgOid.JSONB_OID, "{\"a\": [1, 2]}")).isEqualTo("{\"a\": [1, 2]}");
        assertThat(convert(MOOD_OID, "happy")).isEqualTo("happy");
    }

    @Test
    public void shouldConvertTemporalTypes() {
        assertThat(convert(PgOid.DATE, "1970-01-02")).isEqualTo(1);
        assertThat(convert(PgOid.DATE, "2024-02-29")).isEqualTo((int) LocalDate.of(2024, 2, 29).toEpochDay());
        assertThat(convert(PgOid.TIMESTAMP, "1970-01-01 00:00:01.5")).isEqualTo(1_500_000L);
        assertThat(convert(PgOid.TIMESTAMP, "1970-01-01 00:01:00")).isEqualTo(60_000_000L);
        assertThat(convert(PgOid.TIME, "00:00:02.000001")).isEqualTo(2_000_001L);
        assertThat(convert(PgOid.TIME, "24:00:00")).isEqualTo(86_400_000_000L);
    }

    @Test
    public void shouldMapInfiniteTemporalValuesToSentinels() {
        assertThat(convert(PgOid.DATE, "infinity")).isEqualTo(PostgresValueConverter.POSITIVE_INFINITY_DATE);
        assertThat(convert(PgOid.DATE, "-infinity")).isEqualTo(PostgresValueConverter.NEGATIVE_INFINITY_DATE);
        assertThat(convert(PgOid.TIMESTAMP, "infinity")).isEqualTo(PostgresValueConverter.POSITIVE_INFINITY_TIMESTAMP);
        assertThat(convert(PgOid.TIMESTAMP, "-infinity")).isEqualTo(PostgresValueConverter.NEGATIVE_INFINITY_TIMESTAMP);
        assertThat(convert(PgOid.TIMESTAMPTZ, "infinity")).isEqualTo("infinity");
        assertThat(convert(PgOid.TIMESTAMPTZ, "-infinity")).isEqualTo("-infinity");
    }

    @Test
    public void shouldConvertBeforeChristDates() {
        // 1 BC is the proleptic year 0
        assertThat(convert(PgOid.DATE, "0001-01-01 BC")).isEqualTo((int) LocalDate.of(0, 1, 1).toEpochDay());
        assertThat(convert(PgOid.DATE, "0044-03-15 BC")).isEqualTo((int) LocalDate.of(-43, 3, 15).toEpochDay());
        assertThat(convert(PgOid.TIMESTAMP, "0044-03-15 12:00:00 BC"))
                .isEqualTo(LocalDate.of(-43, 3, 15).toEpochDay() * 86_400_000_000L + 43_200_000_000L);
        assertThat(convert(PgOid.TIMESTAMPTZ, "0044-03-15 12:00:00+02 BC")).isEqualTo("-0043-03-15T10:00:00Z");
    }

    @Test
    public void shouldConvertYearsBeyondFourDigits() {
        assertThat(convert(PgOid.DATE, "10000-01-01")).isEqualTo((int) LocalDate.of(10000, 1, 1).toEpochDay());
        assertThat(convert(PgOid.TIMESTAMP, "10000-01-01 00:00:00"))
                .isEqualTo(LocalDate.of(10000, 1, 1).toEpochDay() * 86_400_000_000L);
        assertThat(convert(PgOid.TIMESTAMPTZ, "12345-06-07 08:09:10+00")).isEqualTo("+12345-06-07T08:09:10Z");
        assertThatThrownBy(() -> convert(PgOid.DATE, "2023-02-30")).isInstanceOf(ValueConversionException.class);
    }

    @Test
    public void shouldNormalizeTimestampWithZoneToUtc() {
        assertThat(convert(PgOid.TIMESTAMPTZ, "2024-01-02 03:04:05+02")).isEqualTo("2024-01-02T01:04:05Z");
        assertThat(convert(PgOid.TIMESTAMPTZ, "2024-01-02 03:04:05.25-05:30")).isEqualTo("2024-01-02T08:34:05.250Z");
        assertThat(convert(PgOid.TIMESTAMPTZ, "2024-01-02 00:00:00+00")).isEqualTo("2024-01-02T00:00:00Z");
        assertThatThrownBy(() -> convert(PgOid.TIMESTAMPTZ, "yesterday")).isInstanceOf(ValueConversionException.class);
    }

    @Test
    public void shouldDecodeBinaryFormats() {
        assertThat(convert(PgOid.BYTEA, "\\x0102ff")).isEqualTo(ByteBuffer.wrap(new byte[]{ 1, 2, (byte) 0xff }));
        assertThat(convert(PgOid.BYTEA, "a\\\\b\\001")).isEqualTo(ByteBuffer.wrap(new byte[]{ 'a', '\\', 'b', 1 }));
        assertThat(convert(PgOid.BYTEA, "\\xABcd")).isEqualTo(ByteBuffer.wrap(new byte[]{ (byte) 0xab, (byte) 0xcd }));
        assertThat(convert(PgOid.BYTEA, "\\x")).isEqualTo(ByteBuffer.wrap(new byte[0]));
        assertThat(convert(PgOid.BYTEA, "\\377\\000z")).isEqualTo(ByteBuffer.wrap(new byte[]{ (byte) 0xff, 0, 'z' }));
        assertThatThrownBy(() -> convert(PgOid.BYTEA, "ab\\0"))
                .isInstanceOf(ValueConversionException.class)
                .hasMessageContaining("column 'c'");
    }

    @Test
    public void shouldConvertArraysElementWise() {
        final Column array = column(PgOid.INT4_ARRAY, -1, 2);
        assertThat(converters.converter(array).convert("{{1,NULL},{3,4}}"))
                .isEqualTo(Arrays.asList(Arrays.asList(1, null), Arrays.asList(3, 4)));

        final Schema schema = converters.schemaBuilder(array).build();
        assertThat(schema.type()).isEqualTo(Schema.Type.ARRAY);
        assertThat(schema.valueSchema().type()).isEqualTo(Schema.Type.ARRAY);
        assertThat(schema.valueSchema().valueSchema().type()).isEqualTo(Schema.Type.INT32);
    }

    @Test
    public void shouldPassNullThrough() {
        assertThat(convert(PgOid.INT4, null)).isNull();
        assertThat(convert(PgOid.INT4_ARRAY, null)).isNull();
    }

    @Test
    public void shouldRejectUnsupportedTypes() {
        typeRegistry.register(PostgresType.base(600, "point", 'G'));
        assertThatThrownBy(() -> converters.converter(column(600, -1, 0)))
                .isInstanceOf(UnsupportedTypeException.class)
                .hasMessageContaining("unsupported type point");
        assertThatThrownBy(() -> converters.schemaBuilder(column(600, -1, 0)))
                .isInstanceOf(UnsupportedTypeException.class);
    }

    @Test
    public void shouldReportValueAndColumnOnConversionFailure() {
        assertThatThrownBy(() -> convert(PgOid.INT4, "12x"))
                .isInstanceOf(ValueConversionException.class)
                .hasMessage("Cannot convert value '12x' of column 'c'");
    }
}
