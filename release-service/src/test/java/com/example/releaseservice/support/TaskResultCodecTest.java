package com.example.releaseservice.support;

import com.example.releaseservice.entity.TaskType;
import com.example.releaseservice.entity.result.CheckSummaryResult;
import com.example.releaseservice.entity.result.KeysImportResult;
import com.example.releaseservice.entity.result.TaskResult;
import com.example.releaseservice.entity.result.VoteInitiateResult;
import com.example.releaseservice.exception.UnknownResultShapeException;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskResultCodecTest {

    private final TaskResultCodec codec = new TaskResultCodec(JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build());

    @Test
    void testEveryTaskType_HasRegisteredShape() {
        assertThat(Arrays.stream(TaskType.values()).map(TaskType::resultType)).doesNotContainNull();
    }

    @Test
    void testVoteResult_DecodedIntoRecordOfItsType() {
        VoteInitiateResult result = new VoteInitiateResult("sent", "dev@tooling.apache.org",
                Instant.parse("2025-03-04T10:00:00Z"), "[VOTE] Release 1.0.0", "<mid@apache.org>", List.of("slow relay"));

        String json = codec.encode(TaskType.VOTE_INITIATE, result);
        TaskResult decoded = codec.decode("VOTE_INITIATE", json);

        assertThat(json).contains("\"voteEnd\":\"2025-03-04T10:00:00Z\"");
        assertThat(decoded).isInstanceOf(VoteInitiateResult.class).isEqualTo(result);
    }

    @Test
    void testNullResult_StaysNull() {
        assertThat(codec.encode(TaskType.HASHING_CHECK, null)).isNull();
        assertThat(codec.decode(TaskType.HASHING_CHECK, null)).isNull();
    }

    @Test
    void testEncode_ResultOfAnotherType_Rejected() {
        assertThatThrownBy(() -> codec.encode(TaskType.HASHING_CHECK, new KeysImportResult(3, 2, 1)))
                .isInstanceOf(UnknownResultShapeException.class);
    }

    @Test
    void testDecode_PayloadNotOfRegisteredShape_Rejected() {
        String keysJson = codec.encode(TaskType.KEYS_IMPORT_FILE, new KeysImportResult(3, 2, 1));

        assertThatThrownBy(() -> codec.decode(TaskType.HASHING_CHECK, keysJson))
                .isInstanceOf(UnknownResultShapeException.class);
        assertThatThrownBy(() -> codec.decode(TaskType.HASHING_CHECK, "not json"))
                .isInstanceOf(UnknownResultShapeException.class);
    }

    @Test
    void testDecode_UnknownDiscriminator_Rejected() {
        assertThatThrownBy(() -> codec.decode("RSYNC_ANALYSE", "{}"))
                .isInstanceOf(UnknownResultShapeException.class);
    }

    @Test
    void testCheckSummary_PassedDerivedNotStored() {
        String json = codec.encode(TaskType.LICENSE_HEADERS, new CheckSummaryResult(10, 2, 0, List.of()));

        assertThat(json).doesNotContain("passed");
        assertThat(((CheckSummaryResult) codec.decode(TaskType.LICENSE_HEADERS, json)).passed()).isTrue();
    }
}
