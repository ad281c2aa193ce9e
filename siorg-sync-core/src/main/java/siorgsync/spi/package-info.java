/**
 * Service provider interfaces the worker core consumes: queue persistence, local records,
 * purging, connections and metrics.
 */
package siorgsync.spi;
