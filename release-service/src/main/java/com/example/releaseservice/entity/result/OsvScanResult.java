package com.example.releaseservice.entity.result;

import java.util.List;

public record OsvScanResult(
    String bomPath,
    int componentCount,
    List<String> vulnerabilityIds
) implements TaskResult {
}
