package com.cosmosdash.common.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class FieldExtractorTest {

    private final ObjectMapper mapper = JsonUtils.newMapper();

    private JsonNode doc(String json) throws Exception {
        return mapper.readTree(json);
    }

    @Test
    @DisplayName("first present, non-empty candidate wins")
    void text_SkipsBlankAndNullCandidates() throws Exception {
        JsonNode item = doc("{\"dataset_id\":\"\",\"id\":null,\"uuid\":\"OSD-87\"}");

        assertThat(FieldExtractor.text(item, List.of("dataset_id", "id", "uuid"))).isEqualTo("OSD-87");
    }

    @Test
    void text_NoCandidatePresent_ReturnsEmptyString() throws Exception {
        assertThat(FieldExtractor.text(doc("{\"other\":1}"), List.of("title", "name"))).isEmpty();
    }

    @Test
    void text_NumericValue_RenderedAsText() throws Exception {
        assertThat(FieldExtractor.text(doc("{\"id\":87}"), List.of("id"))).isEqualTo("87");
    }

    @Test
    @DisplayName("float, integer and numeric-string encodings coerce the same way")
    void number_AcceptsAllNumericEncodings() throws Exception {
        List<String> keys = List.of("latitude");

        assertThat(FieldExtractor.number(doc("{\"latitude\":51.5}"), keys)).isEqualTo(51.5);
        assertThat(FieldExtractor.number(doc("{\"latitude\":51}"), keys)).isEqualTo(51.0);
        assertThat(FieldExtractor.number(doc("{\"latitude\":\" 51.5 \"}"), keys)).isEqualTo(51.5);
    }

    @Test
    void number_Unparseable_DefaultsToZero() throws Exception {
        assertThat(FieldExtractor.number(doc("{\"latitude\":\"north\"}"), List.of("latitude"))).isZero();
        assertThat(FieldExtractor.number(doc("{}"), List.of("latitude"))).isZero();
    }

    @Test
    void instant_ParsesRfc3339AndEpochSeconds() throws Exception {
        List<String> keys = List.of("updated_at", "timestamp");

        assertThat(FieldExtractor.instant(doc("{\"updated_at\":\"2024-05-01T12:00:00+02:00\"}"), keys))
                .contains(Instant.parse("2024-05-01T10:00:00Z"));
        assertThat(FieldExtractor.instant(doc("{\"timestamp\":1700000000}"), keys))
                .contains(Instant.ofEpochSecond(1_700_000_000L));
        assertThat(FieldExtractor.instant(doc("{\"timestamp\":\"1700000000\"}"), keys))
                .contains(Instant.ofEpochSecond(1_700_000_000L));
    }

    @Test
    void instant_Garbage_IsAbsent() throws Exception {
        assertThat(FieldExtractor.instant(doc("{\"updated_at\":\"yesterday\"}"), List.of("updated_at"))).isEmpty();
    }

    @Test
    void first_NonObjectDocument_IsAbsent() throws Exception {
        assertThat(FieldExtractor.first(doc("[1,2]"), List.of("id"))).isEmpty();
    }
}
