/**
 * Micrometer bridge for the event bus {@link io.eventbus.spi.MetricsExporter} SPI.
 */
package io.eventbus.micrometer;
