/**
 * Alert creation, deduplication and lifecycle.
 *
 * <p>
 * {@link com.processsentinel.core.alert.AlertEngine} evaluates the rules in
 * {@code alert.rule}, suppresses repeats through a
 * {@link com.processsentinel.core.alert.CooldownRegistry} and persists through
 * the {@link com.processsentinel.core.alert.AlertStore} collaborator.
 * </p>
 *
 * @since 1.0.0
 */
package com.processsentinel.core.alert;
