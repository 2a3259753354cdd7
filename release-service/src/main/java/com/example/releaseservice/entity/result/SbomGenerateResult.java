package com.example.releaseservice.entity.result;

public record SbomGenerateResult(
    String message,
    String bomPath
) implements TaskResult {
}
