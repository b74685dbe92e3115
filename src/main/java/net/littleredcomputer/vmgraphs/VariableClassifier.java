package net.littleredcomputer.vmgraphs;

import net.littleredcomputer.vmgraphs.sat.Backbone;

import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;

public final class VariableClassifier {
    /** Names of variables introduced by CNF transformations (e.g. Tseitin) start with this. */
    public static final String AUXILIARY_PREFIX = "aux_";

    private VariableClassifier() {}

    /**
     * Labels every variable core, dead or free according to the global backbone. When
     * {@code filterAuxiliary} is set, variables whose name starts with
     * {@link #AUXILIARY_PREFIX} are also marked auxiliary; otherwise none are.
     */
    public static Classification classify(Backbone global, int maxVariable,
                                          Map<Integer, ? extends List<String>> names,
                                          boolean filterAuxiliary) {
        checkArgument(global.maxVariable() == maxVariable,
                "backbone covers %s variables, formula has %s", global.maxVariable(), maxVariable);
        boolean[] auxiliary = new boolean[maxVariable + 1];
        if (filterAuxiliary) {
            for (Map.Entry<Integer, ? extends List<String>> e : names.entrySet()) {
                int v = e.getKey();
                if (v >= 1 && v <= maxVariable && isAuxiliaryName(e.getValue())) auxiliary[v] = true;
            }
        }
        return new Classification(global, auxiliary);
    }

    static boolean isAuxiliaryName(List<String> tokens) {
        return !tokens.isEmpty() && tokens.get(0).startsWith(AUXILIARY_PREFIX);
    }
}
