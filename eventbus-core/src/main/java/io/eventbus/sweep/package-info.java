/**
 * Age-based eviction of observations whose listeners never reported.
 *
 * @see io.eventbus.sweep.ObservationSweeper
 */
package io.eventbus.sweep;
