/**
 * Service provider interfaces: task storage and metrics export.
 *
 * @see taskengine.spi.TaskStore
 * @see taskengine.spi.MetricsExporter
 */
package taskengine.spi;
