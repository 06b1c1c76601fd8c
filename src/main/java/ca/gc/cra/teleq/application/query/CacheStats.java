package ca.gc.cra.teleq.application.query;

/**
 * Snapshot of a cache directory.
 *
 * @param entries stored entries
 * @param expired entries past their lifetime
 * @param totalBytes bytes on disk
 * @param location cache directory
 */
public record CacheStats(int entries, int expired, long totalBytes, String location) {}
