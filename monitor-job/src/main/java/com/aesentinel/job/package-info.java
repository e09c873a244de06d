/**
 * Batch job that runs the monitoring analysis over stored raw event files.
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.aesentinel.job.MonitoringJob}: main entry point</li>
 * <li>{@link com.aesentinel.job.JobConfig}: environment-driven
 * configuration</li>
 * <li>{@link com.aesentinel.job.RawEventReader} /
 * {@link com.aesentinel.job.ResultWriter}: JSON input and output</li>
 * <li>{@link com.aesentinel.job.LatestResults}: snapshot of the last
 * run</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.aesentinel.job;
