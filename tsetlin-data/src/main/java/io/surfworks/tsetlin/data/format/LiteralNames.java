package io.surfworks.tsetlin.data.format;

import java.util.ArrayList;
import java.util.List;

/**
 * Default literal names for models that carry none.
 */
public final class LiteralNames {

    private LiteralNames() {} // Utility class

    /**
     * Returns {@code "Literal 0" .. "Literal n-1"}, or an empty list when {@code n} is 0.
     */
    public static List<String> derive(int numLiterals) {
        List<String> names = new ArrayList<>(numLiterals);
        for (int i = 0; i < numLiterals; i++) {
            names.add("Literal " + i);
        }
        return names;
    }
}
