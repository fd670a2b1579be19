package dev.bookshelf.index;

/**
 * Record counts of one indexed location.
 *
 * @param total all indexed records
 * @param active records not soft-deleted
 * @param deleted soft-deleted records
 * @param corrupt files skipped during the last rebuild
 * @param conflicts duplicate ids resolved during the last rebuild
 */
public record IndexStats(int total, int active, int deleted, int corrupt, int conflicts) {}
