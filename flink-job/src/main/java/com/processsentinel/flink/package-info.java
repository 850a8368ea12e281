/**
 * Apache Flink streaming job for Process Sentinel.
 *
 * <p>
 * Wires the core monitoring engine into a Flink pipeline that consumes
 * process samples from Kafka, analyzes them per process, and publishes alerts
 * and metric snapshots back to Kafka.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.processsentinel.flink.ProcessMonitorJob}: main entry point</li>
 * <li>{@link com.processsentinel.flink.ProcessAnalysisFunction}: keyed process
 * function</li>
 * <li>{@link com.processsentinel.flink.JobConfig}: environment-driven
 * configuration</li>
 * <li>{@link com.processsentinel.flink.HealthServer}: HTTP health/readiness
 * endpoints</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.processsentinel.flink;
