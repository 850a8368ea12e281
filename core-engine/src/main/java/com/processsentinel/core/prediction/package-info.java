/**
 * Time-series forecasting of process resource usage with a Weka multilayer
 * perceptron over a sliding lag window.
 */
package com.processsentinel.core.prediction;
