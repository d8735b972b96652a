/**
 * Generic GraphQL shapes of the Cantabular extended API: variable connections, edges and nodes.
 */
package io.github.yok.cantabular.model.gql;
