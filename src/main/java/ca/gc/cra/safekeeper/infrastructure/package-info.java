/**
 * Infrastructure adapters implementing the ledger ports: clock, value transfer, events, metrics, and state.
 *
 * @since 0.1.0
 */
package ca.gc.cra.safekeeper.infrastructure;
