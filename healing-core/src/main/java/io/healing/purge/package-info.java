/**
 * Age-based deletion of finished jobs.
 */
package io.healing.purge;
