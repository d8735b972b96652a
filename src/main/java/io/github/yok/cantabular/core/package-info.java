/**
 * Export workflow package.
 *
 * <p>
 * Runs a static dataset query and writes the resulting table to a CSV file, streaming the response
 * so that large tables are never held in memory.
 * </p>
 */
package io.github.yok.cantabular.core;
