/**
 * Micrometer bridge for exporting healing queue metrics.
 *
 * @see io.healing.micrometer.MicrometerMetricsExporter
 */
package io.healing.micrometer;
