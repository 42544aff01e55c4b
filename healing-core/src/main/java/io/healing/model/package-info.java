/**
 * Persisted job model: {@link io.healing.model.JobState}, {@link io.healing.model.QueuedJob}
 * and the {@link io.healing.model.DeadLetterRecord} handed to dead-letter sinks.
 */
package io.healing.model;
