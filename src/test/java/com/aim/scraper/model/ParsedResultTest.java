package com.aim.scraper.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ParsedResultTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private static ParsedResult sample() {
        Map<String, Object> scalars = new LinkedHashMap<>();
        scalars.put(ParsedResult.TOTAL_GIBBS_FREE_ENERGY, -123.456);
        scalars.put(ParsedResult.PH, 4.56);
        Map<String, Double> molarities = new LinkedHashMap<>();
        molarities.put("H+", 1.23e-7);
        molarities.put("Na+", 0.1);
        return ParsedResult.structured(scalars, molarities);
    }

    @Test
    void scalarsSerialiseAtTopLevel() throws Exception {
        JsonNode json = mapper.readTree(mapper.writeValueAsString(sample()));

        assertEquals(-123.456, json.get("Total Gibbs Free Energy").asDouble());
        assertEquals(4.56, json.get("pH").asDouble());
        assertEquals(1.23e-7, json.get("molarities").get("H+").asDouble());
        assertFalse(json.has("raw"));
        assertFalse(json.has("scalars"));
    }

    @Test
    void rawResultSerialisesOnlyExcerpt() throws Exception {
        JsonNode json = mapper.readTree(mapper.writeValueAsString(ParsedResult.raw("no numbers here")));

        assertEquals(1, json.size());
        assertEquals("no numbers here", json.get("raw").asText());
    }

    @Test
    void emptyMolarityTableIsOmitted() throws Exception {
        ParsedResult result = ParsedResult.structured(Map.of(ParsedResult.PH, 7.0), Map.of());

        JsonNode json = mapper.readTree(mapper.writeValueAsString(result));

        assertFalse(json.has("molarities"));
        assertFalse(result.isRaw());
    }

    @Test
    void structuredNeedsSomething() {
        assertThrows(IllegalArgumentException.class, () -> ParsedResult.structured(Map.of(), Map.of()));
        assertThrows(IllegalArgumentException.class, () -> ParsedResult.structured(null, null));
    }

    @Test
    void rowsListScalarsThenMolarities() {
        List<ResultRow> rows = sample().toRows();

        assertEquals(List.of(
                new ResultRow("Total Gibbs Free Energy", "-123.456"),
                new ResultRow("pH", "4.56"),
                new ResultRow("H+", "1.23E-7"),
                new ResultRow("Na+", "0.1")), rows);
    }

    @Test
    void rawResultHasSingleRow() {
        ParsedResult raw = ParsedResult.raw(null);

        assertTrue(raw.isRaw());
        assertEquals(List.of(new ResultRow("raw", "")), raw.toRows());
        assertTrue(raw.scalar(ParsedResult.PH).isEmpty());
    }
}
