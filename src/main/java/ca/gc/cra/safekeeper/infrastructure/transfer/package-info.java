/**
 * Value transfer adapters implementing {@link ca.gc.cra.safekeeper.application.port.ValueTransferPort}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.safekeeper.infrastructure.transfer;
