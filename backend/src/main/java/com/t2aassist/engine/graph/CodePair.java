package com.t2aassist.engine.graph;

import com.t2aassist.engine.catalog.CodeCatalog;

/**
 * Unordered pair of code identifiers, stored with {@code first < second}.
 */
public record CodePair(String first, String second) {

    public CodePair {
        if (first.compareTo(second) >= 0) {
            throw new IllegalArgumentException("CodePair must be ordered and distinct: " + first + ", " + second);
        }
    }

    public static CodePair of(String a, String b) {
        String x = CodeCatalog.normalizeId(a);
        String y = CodeCatalog.normalizeId(b);
        if (x.equals(y)) {
            throw new IllegalArgumentException("A code cannot be paired with itself: " + x);
        }
        return x.compareTo(y) < 0 ? new CodePair(x, y) : new CodePair(y, x);
    }

    public boolean contains(String id) {
        return first.equals(id) || second.equals(id);
    }

    public String other(String id) {
        if (first.equals(id)) {
            return second;
        }
        if (second.equals(id)) {
            return first;
        }
        throw new IllegalArgumentException(id + " is not part of " + this);
    }

    @Override
    public String toString() {
        return first + "+" + second;
    }
}
