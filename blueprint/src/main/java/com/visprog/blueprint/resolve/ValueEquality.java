package com.visprog.blueprint.resolve;

import java.math.BigDecimal;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Structural equality for JSON-like values: {@code 10}, {@code 10L} and {@code 10.0} are the same value. */
public final class ValueEquality {
    private ValueEquality() {}

    public static boolean sameValue(Object left, Object right) {
        if (left == right) return true;
        if (left == null || right == null) return false;
        if (left instanceof Number l && right instanceof Number r) return sameNumber(l, r);
        if (left instanceof List<?> l && right instanceof List<?> r) return sameList(l, r);
        if (left instanceof Map<?, ?> l && right instanceof Map<?, ?> r) return sameMap(l, r);
        return Objects.equals(left, right);
    }

    private static boolean sameNumber(Number l, Number r) {
        if (!isFinite(l) || !isFinite(r)) return Double.compare(l.doubleValue(), r.doubleValue()) == 0;
        return toBigDecimal(l).compareTo(toBigDecimal(r)) == 0;
    }

    private static boolean isFinite(Number n) {
        if (n instanceof Double || n instanceof Float) return Double.isFinite(n.doubleValue());
        return true;
    }

    private static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal bd) return bd;
        if (n instanceof Double || n instanceof Float) return BigDecimal.valueOf(n.doubleValue());
        return new BigDecimal(n.toString());
    }

    private static boolean sameList(List<?> l, List<?> r) {
        if (l.size() != r.size()) return false;
        Iterator<?> li = l.iterator();
        Iterator<?> ri = r.iterator();
        while (li.hasNext()) {
            if (!sameValue(li.next(), ri.next())) return false;
        }
        return true;
    }

    private static boolean sameMap(Map<?, ?> l, Map<?, ?> r) {
        if (l.size() != r.size()) return false;
        for (Map.Entry<?, ?> e : l.entrySet()) {
            if (!r.containsKey(e.getKey()) || !sameValue(e.getValue(), r.get(e.getKey()))) return false;
        }
        return true;
    }
}
