/**
 * Configuration loading and validation for the monitor.
 *
 * <p>
 * Thresholds, cooldowns and model hyperparameters are defined in YAML and
 * loaded by {@link com.processsentinel.core.config.MonitorConfigLoader} into a
 * {@link com.processsentinel.core.config.MonitorConfig} instance.
 * </p>
 *
 * @since 1.0.0
 */
package com.processsentinel.core.config;
