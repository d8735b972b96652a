package io.github.yok.cantabular.client;

/**
 * GraphQL documents sent to the Cantabular extended API.
 */
public final class GraphQlQueries {

    /**
     * Static dataset counts: dimensions with their counts, values and table error.
     */
    public static final String STATIC_DATASET = String.join("\n",
            "query($dataset: String!, $variables: [String!]!, $filters: [Filter!]) {",
            "  dataset(name: $dataset) {",
            "    table(variables: $variables, filters: $filters) {",
            "      dimensions {",
            "        count",
            "        variable { name label }",
            "        categories { code label }",
            "      }",
            "      values",
            "      error",
            "    }",
            "  }",
            "}");

    /**
     * Dimension options: same table without the per-dimension {@code count}.
     */
    public static final String DIMENSION_OPTIONS = String.join("\n",
            "query($dataset: String!, $variables: [String!]!, $filters: [Filter!]) {",
            "  dataset(name: $dataset) {",
            "    table(variables: $variables, filters: $filters) {",
            "      dimensions {",
            "        variable { name label }",
            "        categories { code label }",
            "      }",
            "      values",
            "      error",
            "    }",
            "  }",
            "}");

    /**
     * Dimensions of a dataset: the variables derived from its rule base variable, with the
     * variables they are mapped from and their category counts.
     */
    public static final String DIMENSIONS = String.join("\n",
            "query($dataset: String!) {",
            "  dataset(name: $dataset) {",
            "    ruleBase {",
            "      name",
            "      isSourceOf {",
            "        edges {",
            "          node {",
            "            name",
            "            label",
            "            mapFrom { edges { node { filterOnly label name } } }",
            "            categories { totalCount }",
            "          }",
            "        }",
            "      }",
            "    }",
            "  }",
            "}");

    /**
     * Geography dimensions of a dataset, with their position in the area hierarchy.
     */
    public static final String GEOGRAPHY_DIMENSIONS = String.join("\n",
            "query($dataset: String!) {",
            "  dataset(name: $dataset) {",
            "    ruleBase {",
            "      name",
            "      isSourceOf {",
            "        totalCount",
            "        edges {",
            "          node {",
            "            name",
            "            label",
            "            description",
            "            meta { ONS_Variable { Geography_Hierarchy_Order } }",
            "            mapFrom { edges { node { name label } } }",
            "            categories { totalCount }",
            "          }",
            "        }",
            "      }",
            "    }",
            "  }",
            "}");

    /**
     * Datasets loaded in the server.
     */
    public static final String LIST_DATASETS = "query { datasets { name label description } }";

    /**
     * Query used by the extended API health check.
     */
    public static final String HEALTH = "{datasets{name}}";

    private GraphQlQueries() {
        // Constants holder; do not instantiate.
    }
}
