/**
 * Configuration aggregates and composition root wiring for the SafeKeeper CLI.
 * <p><strong>Role:</strong> Application bootstrap layer selecting clock, metrics, event, and persistence adapters.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Validates paths, topics, and bootstrap servers through {@code ca.gc.cra.safekeeper.validation}.</p>
 */
package ca.gc.cra.safekeeper.config;
