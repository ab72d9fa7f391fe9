package io.github.eutro.cil2ast.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

final class Nodes {
    private Nodes() {
    }

    static <T> List<T> copy(List<? extends T> list) {
        return list.isEmpty() ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(list));
    }

    /**
     * Element-wise identity comparison, so rebuilding with unchanged children can return {@code this}.
     */
    static boolean sameElements(List<?> a, List<?> b) {
        if (a == b) return true;
        if (a.size() != b.size()) return false;
        for (int i = 0; i < a.size(); i++) {
            if (a.get(i) != b.get(i)) return false;
        }
        return true;
    }
}
