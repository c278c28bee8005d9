package org.rapidrelief.engine.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.rapidrelief.engine.support.TestCandidates;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class JsonLinesAuditSinkTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("each run is appended as one snake_case JSON line")
    void appendsOneLinePerRun(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("audit/runs.jsonl");
        JsonLinesAuditSink sink = new JsonLinesAuditSink(file);

        Map<String, Long> timings = new LinkedHashMap<>();
        timings.put("rule_matching", 3L);
        timings.put("optimization", 120L);
        sink.record(new PipelineRunRecord.Builder()
                .runId("run-1")
                .eventId("EVT-1")
                .outcome("COMMITTED")
                .matchedRules(Arrays.asList("TRR-EM-001", "TRR-EM-002"))
                .taskSequence(Arrays.asList("EM01", "EM03"))
                .committedSolution(TestCandidates.solution("greedy-1", Collections.emptyList(), "r1"))
                .stageTimingsMillis(timings)
                .startedAt(Instant.parse("2025-11-29T08:00:00Z"))
                .completedAt(Instant.parse("2025-11-29T08:00:01Z"))
                .build());
        sink.record(new PipelineRunRecord.Builder()
                .runId("run-2")
                .outcome(PipelineRunRecord.OUTCOME_FAILED)
                .error("RESOURCE_LOCKED", "Resources already locked: [r1]")
                .build());

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertThat(lines).hasSize(2);

        JsonNode first = mapper.readTree(lines.get(0));
        assertThat(first.get("run_id").asText()).isEqualTo("run-1");
        assertThat(first.get("matched_rules")).hasSize(2);
        assertThat(first.get("stage_timings_millis").get("optimization").asLong()).isEqualTo(120L);
        assertThat(first.get("committed_solution").get("solution_id").asText()).isEqualTo("greedy-1");
        assertThat(first.get("started_at").asText()).isEqualTo("2025-11-29T08:00:00Z");

        JsonNode second = mapper.readTree(lines.get(1));
        assertThat(second.get("outcome").asText()).isEqualTo("FAILED");
        assertThat(second.get("error_code").asText()).isEqualTo("RESOURCE_LOCKED");
    }

    @Test
    @DisplayName("an existing audit file is appended to, never truncated")
    void appendsToExistingFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("runs.jsonl");
        Files.write(file, ("{\"run_id\":\"older\"}" + System.lineSeparator()).getBytes(StandardCharsets.UTF_8));

        new JsonLinesAuditSink(file).record(new PipelineRunRecord.Builder()
                .runId("run-3")
                .outcome("NO_MATCHING_RULES")
                .build());

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertThat(lines).hasSize(2);
        assertThat(lines.get(0)).contains("older");
        assertThat(mapper.readTree(lines.get(1)).get("run_id").asText()).isEqualTo("run-3");
    }
}
