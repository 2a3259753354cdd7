package com.example.releaseservice.entity.result;

import java.util.List;

public record MessageSendResult(
    String mid,
    List<String> mailSendWarnings
) implements TaskResult {
}
