/**
 * Feature engineering, scaling and windowing of process samples.
 *
 * @since 1.0.0
 */
package com.processsentinel.core.features;
