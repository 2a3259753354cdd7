package com.example.releaseservice.entity.result;

public record SvnImportResult(
    String message,
    int filesImported
) implements TaskResult {
}
