/**
 * Service provider interfaces: the {@link io.healing.spi.JobQueue} client handle, the
 * {@link io.healing.spi.JobStore} persistence contract, connection supply, metrics export and
 * dead-letter hand-off.
 */
package io.healing.spi;
