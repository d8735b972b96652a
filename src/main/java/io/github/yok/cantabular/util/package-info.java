/**
 * Utility package for the Cantabular client.
 */
package io.github.yok.cantabular.util;
