package com.example.releaseservice.entity.result;

public record KeysImportResult(
    int submitted,
    int inserted,
    int linked
) implements TaskResult {
}
