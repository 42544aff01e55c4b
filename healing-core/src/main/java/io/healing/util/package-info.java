/**
 * Internal helpers: thread factories and the job payload codec.
 */
package io.healing.util;
