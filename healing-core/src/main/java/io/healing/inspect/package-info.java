/**
 * Operator inspection of a queue, read-only in production.
 */
package io.healing.inspect;
