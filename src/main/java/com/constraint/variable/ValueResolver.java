package com.constraint.variable;

/**
 * Looks up values by dotted path inside caller-owned data.
 */
public interface ValueResolver {

    /**
     * Resolve a dotted path.
     *
     * @param root Model or state object
     * @param path Dotted path without prefix (e.g., "order.total"); empty for the root itself
     * @return Resolved value (possibly null), or {@link MissingValue#INSTANCE} if any segment
     *         does not resolve
     */
    Object resolve(Object root, String path);

    /**
     * Check whether a path resolves.
     */
    default boolean exists(Object root, String path) {
        return !MissingValue.isMissing(resolve(root, path));
    }
}
