/**
 * Command-line entry points for deploying, operating, and inspecting a SafeKeeper ledger.
 * <p><strong>Role:</strong> Driving adapter; parses {@code key=value} arguments, configures logging and telemetry,
 * and runs ledger operations against the persisted state file.</p>
 * <p><strong>Concurrency:</strong> Each invocation runs one command on the calling thread.</p>
 * <p><strong>Security:</strong> Arguments are rejected when they contain control characters; state paths and
 * network targets are validated before use.</p>
 */
package ca.gc.cra.safekeeper.api;
