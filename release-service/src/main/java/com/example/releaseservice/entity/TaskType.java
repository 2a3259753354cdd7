package com.example.releaseservice.entity;

import com.example.releaseservice.entity.result.CheckSummaryResult;
import com.example.releaseservice.entity.result.KeysImportResult;
import com.example.releaseservice.entity.result.MessageSendResult;
import com.example.releaseservice.entity.result.OsvScanResult;
import com.example.releaseservice.entity.result.SbomGenerateResult;
import com.example.releaseservice.entity.result.SvnImportResult;
import com.example.releaseservice.entity.result.TaskResult;
import com.example.releaseservice.entity.result.VoteInitiateResult;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kinds of background job. Each kind is bound to the record type its
 * result payload is decoded into.
 */
public enum TaskType {
    HASHING_CHECK(CheckSummaryResult.class),
    LICENSE_FILES(CheckSummaryResult.class),
    LICENSE_HEADERS(CheckSummaryResult.class),
    PATHS_CHECK(CheckSummaryResult.class),
    SIGNATURE_CHECK(CheckSummaryResult.class),
    TARGZ_INTEGRITY(CheckSummaryResult.class),
    ZIPFORMAT_INTEGRITY(CheckSummaryResult.class),
    SBOM_GENERATE_CYCLONEDX(SbomGenerateResult.class),
    SBOM_OSV_SCAN(OsvScanResult.class),
    KEYS_IMPORT_FILE(KeysImportResult.class),
    SVN_IMPORT_FILES(SvnImportResult.class),
    VOTE_INITIATE(VoteInitiateResult.class),
    MESSAGE_SEND(MessageSendResult.class);

    private final Class<? extends TaskResult> resultType;

    TaskType(Class<? extends TaskResult> resultType) {
        this.resultType = resultType;
    }

    public Class<? extends TaskResult> resultType() {
        return resultType;
    }

    public static Optional<TaskType> fromName(String name) {
        return Arrays.stream(values())
            .filter(type -> type.name().equals(name))
            .findFirst();
    }
}
