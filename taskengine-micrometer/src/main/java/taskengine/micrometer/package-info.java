/**
 * Micrometer bridge for the task engine's {@link taskengine.spi.MetricsExporter} SPI.
 *
 * @see taskengine.micrometer.MicrometerMetricsExporter
 */
package taskengine.micrometer;
