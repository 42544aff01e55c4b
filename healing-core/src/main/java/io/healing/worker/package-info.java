/**
 * Job execution: {@link io.healing.worker.HealingWorker} claims jobs from a
 * {@link io.healing.queue.HealingQueue} and routes them by job name through a
 * {@link io.healing.worker.ProcessorRegistry}.
 */
package io.healing.worker;
