package com.clan.clears.activity;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ActivityRecordTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private ActivityRecord parse(String json) throws Exception {
        JsonNode node = objectMapper.readTree(json);
        return ActivityRecord.from(node);
    }

    @Test
    void readsCanonicalShape() throws Exception {
        ActivityRecord record = parse("""
                {"period":"2024-05-01T20:00:00Z",
                 "activityDetails":{"referenceId":2582501063,"instanceId":"998877"},
                 "values":{"completed":{"basic":{"value":1.0}}}}
                """);

        assertThat(record.referenceId()).isEqualTo(2582501063L);
        assertThat(record.completed()).isTrue();
        assertThat(record.period()).isEqualTo(Instant.parse("2024-05-01T20:00:00Z"));
        assertThat(record.instanceId()).isEqualTo("998877");
        assertThat(record.isTraceable()).isTrue();
    }

    @Test
    void fallsBackThroughAliases() throws Exception {
        ActivityRecord record = parse("""
                {"periodStart":"2024-05-02T10:00:00Z","activityHash":"2032534090",
                 "isCompleted":true,"activityDetails":{"instanceIdHash":"42"}}
                """);

        assertThat(record.referenceId()).isEqualTo(2032534090L);
        assertThat(record.completed()).isTrue();
        assertThat(record.period()).isEqualTo(Instant.parse("2024-05-02T10:00:00Z"));
        assertThat(record.instanceId()).isEqualTo("42");
    }

    @Test
    void successFlagCountsWhenCompletedIsFalse() throws Exception {
        ActivityRecord record = parse("""
                {"referenceId":2032534090,"values":{"completed":{"value":0},"success":{"basic":{"value":1}}}}
                """);

        assertThat(record.completed()).isTrue();
        assertThat(record.isTraceable()).isFalse();
    }

    @Test
    void incompleteRecord() throws Exception {
        ActivityRecord record = parse("""
                {"activityHash":2032534090,"completed":false}
                """);

        assertThat(record.completed()).isFalse();
    }

    @Test
    void missingReferenceAndBadPeriod() throws Exception {
        ActivityRecord record = parse("""
                {"period":"yesterday","completed":1}
                """);

        assertThat(record.referenceId()).isNull();
        assertThat(record.period()).isNull();
    }
}
