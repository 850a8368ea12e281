/**
 * Alert conditions: per-process rules and two-tier system thresholds, built
 * from configuration by
 * {@link com.processsentinel.core.alert.rule.AlertRuleFactory}.
 */
package com.processsentinel.core.alert.rule;
