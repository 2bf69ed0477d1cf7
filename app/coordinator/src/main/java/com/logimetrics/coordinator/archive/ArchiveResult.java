package com.logimetrics.coordinator.archive;

/**
 * Totals for one source. {@code abandoned} is set when a batch could not be copied or deleted;
 * its rows stay in the live store for the next cycle.
 */
public record ArchiveResult(
    String source, long copied, long deleted, int batches, boolean abandoned) {}
