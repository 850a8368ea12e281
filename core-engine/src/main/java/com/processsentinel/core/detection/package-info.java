/**
 * Unsupervised anomaly scoring.
 *
 * <p>
 * All detectors implement
 * {@link com.processsentinel.core.detection.AnomalyDetector}. The built-in
 * {@link com.processsentinel.core.detection.IsolationForest} scores a feature
 * vector by how quickly random partitions isolate it.
 * </p>
 *
 * @since 1.0.0
 */
package com.processsentinel.core.detection;
