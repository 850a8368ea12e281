/**
 * The {@link com.processsentinel.core.engine.MonitoringEngine} facade tying
 * feature engineering, the three models, history and alerting together.
 */
package com.processsentinel.core.engine;
