/*
 * Where: Flock domain model
 * What: Snapshot of a row in the principals table
 * Why: Registration, the credential gate and submissions share one identity shape
 */
package com.flock.server.model;

import java.time.Instant;

public record Principal(String username, String name, String token, Instant createdAt) {}
