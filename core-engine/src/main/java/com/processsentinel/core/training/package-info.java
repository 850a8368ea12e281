/**
 * Model training: initial fits from historical samples, synthetic classifier
 * bootstrap and interval-based background retraining.
 *
 * @since 1.0.0
 */
package com.processsentinel.core.training;
