/**
 * The store-backed delayed-job queue.
 */
package io.healing.queue;
