package com.lakeindex.query;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class QueryModeTest {

    @ParameterizedTest
    @CsvSource({
        "conjunctive, CONJUNCTIVE",
        "AND, CONJUNCTIVE",
        "Disjunctive, DISJUNCTIVE",
        "' or ', DISJUNCTIVE"
    })
    void testParseAcceptedNames(String raw, QueryMode expected) {
        assertEquals(expected, QueryMode.parse(raw));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "  ", "phrase", "xor"})
    void testParseRejectsUnsupported(String raw) {
        assertThrows(InvalidQueryException.class, () -> QueryMode.parse(raw));
    }
}
