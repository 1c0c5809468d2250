package de.prgrm.cypher.ogm.runtime.query.clause;

import de.prgrm.cypher.ogm.runtime.errors.UsageException;

/**
 * Memgraph's built-in path expansions, written inside a relationship pattern:
 * {@code -[:Road *BFS ..10 (r, n | r.length <= 200)]->}.
 * <p>
 * Lambdas bind {@code r} to the relationship and {@code n} to the node being expanded. The weighted
 * variants also declare a variable holding the total weight of the returned path.
 */
public record PathAlgorithm(Kind kind, Integer lowerBound, Integer upperBound, String weightProperty,
        String totalWeight, String condition) {

    public static final String DEFAULT_TOTAL_WEIGHT = "total_weight";
    public static final String DEFAULT_WEIGHT_PROPERTY = "r.weight";

    public enum Kind {
        BFS(" *BFS"),
        DFS(" *"),
        WSHORTEST(" *WSHORTEST"),
        ALLSHORTEST(" *ALLSHORTEST");

        private final String expansion;

        Kind(String expansion) {
            this.expansion = expansion;
        }

        public boolean isWeighted() {
            return this == WSHORTEST || this == ALLSHORTEST;
        }
    }

    public PathAlgorithm {
        if (kind.isWeighted()) {
            if (lowerBound != null) {
                throw new UsageException(kind + " takes an upper bound only");
            }
            weightProperty = weightProperty == null ? DEFAULT_WEIGHT_PROPERTY : weightProperty;
            if (!weightProperty.contains(".")) {
                weightProperty = "r." + weightProperty;
            }
            totalWeight = totalWeight == null ? DEFAULT_TOTAL_WEIGHT : totalWeight;
        } else {
            weightProperty = null;
            totalWeight = null;
        }
    }

    public static PathAlgorithm bfs() {
        return bfs(null, null, null);
    }

    /**
     * @param lowerBound minimum path depth, or {@code null}
     * @param upperBound maximum path depth, or {@code null}
     * @param condition filter lambda body, or {@code null}
     */
    public static PathAlgorithm bfs(Integer lowerBound, Integer upperBound, String condition) {
        return new PathAlgorithm(Kind.BFS, lowerBound, upperBound, null, null, condition);
    }

    public static PathAlgorithm dfs() {
        return dfs(null, null, null);
    }

    public static PathAlgorithm dfs(Integer lowerBound, Integer upperBound, String condition) {
        return new PathAlgorithm(Kind.DFS, lowerBound, upperBound, null, null, condition);
    }

    public static PathAlgorithm weightedShortest() {
        return weightedShortest(null, null, null, null);
    }

    /**
     * @param weightProperty property summed along the path, {@code weight} is short for {@code r.weight}
     * @param totalWeight variable bound to the path's total weight
     */
    public static PathAlgorithm weightedShortest(Integer upperBound, String weightProperty, String totalWeight,
            String condition) {
        return new PathAlgorithm(Kind.WSHORTEST, null, upperBound, weightProperty, totalWeight, condition);
    }

    public static PathAlgorithm allShortest() {
        return allShortest(null, null, null, null);
    }

    public static PathAlgorithm allShortest(Integer upperBound, String weightProperty, String totalWeight,
            String condition) {
        return new PathAlgorithm(Kind.ALLSHORTEST, null, upperBound, weightProperty, totalWeight, condition);
    }

    public String render() {
        StringBuilder sb = new StringBuilder(kind.expansion);
        if (kind.isWeighted()) {
            if (upperBound != null) {
                sb.append(' ').append(upperBound);
            }
            sb.append(' ').append(lambda(weightProperty)).append(' ').append(totalWeight);
        } else if (lowerBound != null || upperBound != null) {
            sb.append(' ')
                    .append(lowerBound == null ? "" : lowerBound)
                    .append("..")
                    .append(upperBound == null ? "" : upperBound);
        }
        if (condition != null) {
            sb.append(' ').append(lambda(condition));
        }
        return sb.toString();
    }

    private static String lambda(String expression) {
        return "(r, n | " + expression + ")";
    }
}
