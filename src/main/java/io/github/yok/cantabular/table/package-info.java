/**
 * Dimensional table rendering package.
 *
 * <p>
 * Walks Cantabular tables in row-major order and renders them as CSV, either from a decoded
 * {@link io.github.yok.cantabular.model.Table} or straight from a GraphQL response stream.
 * </p>
 *
 * <p>
 * Failures are reported as checked {@link io.github.yok.cantabular.table.TableException}s.
 * </p>
 */
package io.github.yok.cantabular.table;
