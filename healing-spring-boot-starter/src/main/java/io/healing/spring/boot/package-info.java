/**
 * Spring Boot auto-configuration for the CI healing queue.
 *
 * <p>Add the starter and a {@link javax.sql.DataSource}, create the {@code healing_job}
 * table from {@code io/healing/jdbc/schema/}, and annotate processors with
 * {@link io.healing.spring.boot.HealingJobHandler}. Inject
 * {@link io.healing.HealingJobProducer} to submit attempts.
 */
package io.healing.spring.boot;
