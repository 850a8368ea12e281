/**
 * Workload classification of processes from their resource profile, backed
 * by Weka.
 *
 * @since 1.0.0
 */
package com.processsentinel.core.classification;
