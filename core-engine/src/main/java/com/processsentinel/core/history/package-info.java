/**
 * Bounded in-memory sample history, one FIFO buffer per process.
 */
package com.processsentinel.core.history;
