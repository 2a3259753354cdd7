package com.example.releaseservice.dto;

/**
 * Counters and name reserved for a new revision inside the current transaction.
 */
public record RevisionAllocation(int seq, int number, String name) {
}
