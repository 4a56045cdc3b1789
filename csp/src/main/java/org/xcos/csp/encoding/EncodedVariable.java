package org.xcos.csp.encoding;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.Getter;
import lombok.ToString;

/**
 * Solver-native integer view of a {@link org.xcos.csp.model.Variable}.
 * <p>
 * Integer domains keep their own values ({@code lb = min}, {@code ub = max}); every other
 * domain is encoded as an index {@code 0..n-1} into {@link #getIndexTable()}. Instances are
 * used as identity handles by the IR and the decoder, so equality is reference equality.
 */
@Getter
@ToString(of = {"name", "lowerBound", "upperBound"})
public final class EncodedVariable {

    private final String name;
    private final int lowerBound;
    private final int upperBound;
    // Declared values of an integer domain, null for indexed domains
    private final int[] integerValues;
    // Declared values of a discrete domain in order, null for integer domains
    private final List<Object> indexTable;
    // Domain declared with Long values. JSON and YAML input binds in-range integers to Integer,
    // so only models built in Java set this
    private final boolean longValued;

    private EncodedVariable(String name, int lowerBound, int upperBound, int[] integerValues,
                            List<Object> indexTable, boolean longValued) {
        this.name = name;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        this.integerValues = integerValues;
        this.indexTable = indexTable;
        this.longValued = longValued;
    }

    static EncodedVariable integer(String name, int[] values, boolean longValued) {
        int min = Integer.MAX_VALUE;
        int max = Integer.MIN_VALUE;
        for (int v : values) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        return new EncodedVariable(name, min, max, values.clone(), null, longValued);
    }

    static EncodedVariable indexed(String name, List<Object> indexTable) {
        return new EncodedVariable(name, 0, indexTable.size() - 1, null,
            Collections.unmodifiableList(new ArrayList<>(indexTable)), false);
    }

    public boolean isIndexed() {
        return indexTable != null;
    }

    public int[] getIntegerValues() {
        return integerValues == null ? null : integerValues.clone();
    }
}
