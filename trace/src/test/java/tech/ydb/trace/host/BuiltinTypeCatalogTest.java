package tech.ydb.trace.host;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import tech.ydb.trace.types.LiteralParser;

public class BuiltinTypeCatalogTest {
    private final BuiltinTypeCatalog catalog = new BuiltinTypeCatalog();

    private Object parse(String type, String literal) {
        LiteralParser parser = catalog.findParser(type);
        Assertions.assertNotNull(parser, "Type " + type + " must have input function");
        return parser.parse(literal);
    }

    @Test
    public void primitiveTypesTest() {
        Assertions.assertEquals(Boolean.TRUE, parse("Bool", "TRUE"));
        Assertions.assertEquals(Boolean.FALSE, parse("bool", " off "));
        Assertions.assertEquals((byte) -12, parse("Int8", "-12"));
        Assertions.assertEquals((short) 1234, parse("Int16", "1234"));
        Assertions.assertEquals(123456, parse("int32", " 123456 "));
        Assertions.assertEquals(9876543210L, parse("INT64", "9876543210"));
        Assertions.assertEquals(255, parse("Uint8", "255"));
        Assertions.assertEquals(65535, parse("Uint16", "65535"));
        Assertions.assertEquals(4294967295L, parse("Uint32", "4294967295"));
        Assertions.assertEquals(new BigInteger("18446744073709551615"), parse("Uint64", "18446744073709551615"));
        Assertions.assertEquals(1.5f, parse("Float", "1.5"));
        Assertions.assertEquals(-2.25d, parse("Double", "-2.25"));
        Assertions.assertEquals(new BigDecimal("123.4500"), parse("Decimal", "123.4500"));
    }

    @Test
    public void textTypesTest() {
        Assertions.assertEquals("'quoted' ", parse("Text", "'quoted' "));
        Assertions.assertArrayEquals("abc".getBytes(StandardCharsets.UTF_8), (byte[]) parse("Bytes", "abc"));
        Assertions.assertEquals(UUID.fromString("123e4567-e89b-12d3-a456-426614174000"),
                parse("Uuid", "123e4567-e89b-12d3-a456-426614174000"));
    }

    @Test
    public void dateTypesTest() {
        Assertions.assertEquals(LocalDate.of(2024, 2, 29), parse("Date", "2024-02-29"));
        Assertions.assertEquals(LocalDateTime.of(2024, 2, 29, 10, 15, 30), parse("Datetime", "2024-02-29T10:15:30"));
        Assertions.assertEquals(Instant.parse("2024-02-29T10:15:30Z"), parse("Timestamp", "2024-02-29T10:15:30Z"));
        Assertions.assertEquals(Duration.ofMinutes(90), parse("Interval", "PT1H30M"));
    }

    @ParameterizedTest(name = "[{index}] {1} is invalid for {0}")
    @CsvSource(value = {
        "Bool~maybe",
        "Int8~128",
        "Int32~abc",
        "Int32~1.5",
        "Int64~",
        "Uint8~256",
        "Uint16~-1",
        "Uint32~4294967296",
        "Uint64~-1",
        "Double~one",
        "Decimal~1,5",
        "Uuid~1-2-3-4-5",
        "Date~2024-02-30",
        "Datetime~2024-02-29",
        "Timestamp~yesterday",
        "Interval~1h",
    }, delimiter = '~', emptyValue = "")
    public void invalidLiteralTest(String type, String literal) {
        LiteralParser parser = catalog.findParser(type);
        Assertions.assertNotNull(parser);
        Assertions.assertThrows(RuntimeException.class, () -> parser.parse(literal));
    }

    @Test
    public void unknownTypeTest() {
        Assertions.assertNull(catalog.findParser("Json"));
        Assertions.assertNull(catalog.findParser("MyType"));
    }

    @Test
    public void registerTest() {
        catalog.register("Json", v -> v.trim());
        Assertions.assertEquals("{}", parse("json", " {} "));

        catalog.register("Int32", v -> Integer.valueOf(v.trim(), 16));
        Assertions.assertEquals(255, parse("Int32", "ff"));
    }
}
