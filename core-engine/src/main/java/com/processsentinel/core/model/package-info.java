/**
 * Domain model classes for Process Sentinel.
 *
 * <p>
 * This package contains the data transfer objects shared between the
 * analytics engine and the Flink job layer:
 * </p>
 * <ul>
 * <li>{@link com.processsentinel.core.model.Sample}: one resource-usage
 * reading of a process</li>
 * <li>{@link com.processsentinel.core.model.AnalysisResult}: anomaly score,
 * workload label and forecast for a sample</li>
 * <li>{@link com.processsentinel.core.model.Alert}: deduplicated alert with
 * its lifecycle</li>
 * <li>{@link com.processsentinel.core.model.MetricSnapshot}: record for the
 * metrics store</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.processsentinel.core.model;
