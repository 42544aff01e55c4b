/**
 * Queue lifecycle notifications: the {@link io.healing.event.QueueEventListener} contract,
 * the bounded {@link io.healing.event.QueueEventStream}, and the logging observer
 * {@link io.healing.event.HealingQueueEvents}.
 */
package io.healing.event;
