package com.raditha.astcore.valueflow;

import com.raditha.astcore.config.AnalysisConfig;
import com.raditha.astcore.model.Token;
import com.raditha.astcore.model.TokenKind;
import com.raditha.astcore.symbols.ArgumentValidityOracle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiPredicate;
import java.util.function.Predicate;

/**
 * The facts attached to one token.
 * <p>
 * Insertion keeps the list free of duplicates and of most contradictions.
 * A known integer fact, when present, is always the first entry.
 * Not thread safe; a list belongs to the token sequence of one unit.
 */
public class ValueList {
    private static final Logger logger = LoggerFactory.getLogger(ValueList.class);

    /** Facts beyond this many per token are rejected. */
    public static final int MAX_VALUES = 10;

    /** Rounds of pairwise contradiction removal per insertion. */
    public static final int CONTRADICTION_ROUNDS = 4;

    private static final Comparator<Value> NUMERIC_ORDER = (x, y) -> {
        if (x.compareValue(y)) {
            return -1;
        }
        return y.compareValue(x) ? 1 : 0;
    };

    private final List<Value> values = new ArrayList<>();
    private final List<Value> view = Collections.unmodifiableList(values);

    /**
     * Add a copy of a fact.
     *
     * @param value      the fact to add
     * @param tokenVarId varId of the owning token, used when the fact carries none
     * @return false when the fact was redundant, contradicted a known fact or
     *         the list is full
     */
    public boolean add(Value value, int tokenVarId) {
        if (value.isKnown()) {
            values.removeIf(x -> sameValueType(x, value));
        }

        if (!value.isKnown()) {
            for (Value x : values) {
                if (x.isKnown() && sameValueType(x, value) && !x.equalValue(value)) {
                    return false;
                }
            }
        }

        if (values.size() >= MAX_VALUES) {
            logger.trace("Fact {} rejected, token already holds {} facts", value, MAX_VALUES);
            return false;
        }

        boolean replaced = false;
        for (int i = 0; i < values.size(); i++) {
            Value existing = values.get(i);
            if (existing.getValueType() != value.getValueType()
                    || existing.isImpossible() != value.isImpossible()
                    || !existing.equalValue(value)) {
                continue;
            }
            if ((value.isTokValue() || value.isLifetimeValue())
                    && existing.getTokValue() != value.getTokValue()
                    && !sameText(existing.getTokValue(), value.getTokValue())) {
                continue;
            }
            if (existing.isInconclusive() && !value.isInconclusive() && !value.isImpossible()) {
                values.set(i, withVarId(value, tokenVarId));
                replaced = true;
                break;
            }
            return false;
        }

        if (!replaced) {
            Value copy = withVarId(value, tokenVarId);
            if (copy.isKnown() && copy.isIntValue()) {
                values.add(0, copy);
            } else {
                values.add(copy);
            }
        }

        removeContradictions();
        return true;
    }

    private static Value withVarId(Value value, int tokenVarId) {
        Value copy = new Value(value);
        if (copy.getVarId() == 0) {
            copy.setVarId(tokenVarId);
        }
        return copy;
    }

    private static boolean sameText(Token a, Token b) {
        return a != null && b != null && a.str().equals(b.str());
    }

    private static boolean sameValueType(Value x, Value y) {
        if (x.getValueType() != y.getValueType()) {
            return false;
        }
        if (x.isSymbolicValue()) {
            int exprId = x.getTokValue() == null ? 0 : x.getTokValue().exprId();
            return exprId == 0 || (y.getTokValue() != null && exprId == y.getTokValue().exprId());
        }
        return true;
    }

    /**
     * Overlap removal followed by up to {@value #CONTRADICTION_ROUNDS} rounds
     * of pairwise contradiction removal. Contradictions left after the last
     * round stay in the list.
     */
    public void removeContradictions() {
        removeOverlaps();
        for (int i = 0; i < CONTRADICTION_ROUNDS; i++) {
            if (!removeContradiction()) {
                return;
            }
            removeOverlaps();
        }
    }

    /**
     * One pass over all pairs of facts of the same type and opposite
     * impossibility. Returns true when something changed.
     */
    boolean removeContradiction() {
        boolean result = false;
        for (int ix = 0; ix < values.size(); ix++) {
            Value x = values.get(ix);
            if (x.isNonValue()) {
                continue;
            }
            for (int iy = ix + 1; iy < values.size(); iy++) {
                Value y = values.get(iy);
                if (y.isNonValue()
                        || x.equals(y)
                        || x.getValueType() != y.getValueType()
                        || x.isImpossible() == y.isImpossible()) {
                    continue;
                }
                if (x.isSymbolicValue() && !Value.sameToken(x.getTokValue(), y.getTokValue())) {
                    continue;
                }
                if (!x.equalValue(y)) {
                    Value max = x.compareValue(y) ? y : x;
                    Value min = y.compareValue(x) ? y : x;
                    if (max.isImpossible() && max.getBound() == Bound.UPPER) {
                        removeIdentity(min);
                        return true;
                    }
                    if (min.isImpossible() && min.getBound() == Bound.LOWER) {
                        removeIdentity(max);
                        return true;
                    }
                    continue;
                }
                boolean removex = !x.isImpossible() || y.isKnown();
                boolean removey = !y.isImpossible() || x.isKnown();
                if (x.getBound() == y.getBound()) {
                    if (removex) {
                        removeIdentity(x);
                    }
                    if (removey) {
                        removeIdentity(y);
                    }
                    return true;
                }
                result = removex || removey;
                boolean bail = false;
                if (removex && removePointValue(x)) {
                    bail = true;
                }
                if (removey && removePointValue(y)) {
                    bail = true;
                }
                if (bail) {
                    return true;
                }
            }
        }
        return result;
    }

    /**
     * Narrow a range by one step, or drop a point. Returns true when the fact was dropped.
     */
    private boolean removePointValue(Value x) {
        if (x.getBound() != Bound.POINT) {
            x.decreaseRange();
            return false;
        }
        removeIdentity(x);
        return true;
    }

    /**
     * Collapse facts of the same type, kind, payload and bound, then merge
     * adjacent ranges.
     */
    void removeOverlaps() {
        for (int i = 0; i < values.size(); i++) {
            Value x = values.get(i);
            if (x.isNonValue()) {
                continue;
            }
            values.removeIf(y -> y != x
                    && !y.isNonValue()
                    && x.getValueType() == y.getValueType()
                    && x.getValueKind() == y.getValueKind()
                    && x.equalValue(y)
                    && x.getBound() == y.getBound());
            i = indexOfIdentity(x);
        }
        mergeAdjacent();
    }

    static boolean isAdjacent(Value x, Value y) {
        if (x.getBound() != Bound.POINT && x.getBound() == y.getBound()) {
            return true;
        }
        if (x.getValueType() == ValueType.FLOAT) {
            return false;
        }
        return (y.getIntValue() != Long.MAX_VALUE && x.getIntValue() == y.getIntValue() + 1)
                || (y.getIntValue() != Long.MIN_VALUE && x.getIntValue() == y.getIntValue() - 1);
    }

    /**
     * Fold runs of adjacent facts into the range fact that borders them,
     * for example points 3 and 4 next to {@code >=5} become {@code >=3}.
     */
    void mergeAdjacent() {
        int i = 0;
        while (i < values.size()) {
            Value x = values.get(i);
            if (x.isNonValue() || x.getBound() == Bound.POINT) {
                i++;
                continue;
            }
            List<Value> adjacent = collectAdjacent(x);
            if (adjacent.isEmpty()) {
                i++;
                continue;
            }
            adjacent.sort(NUMERIC_ORDER);
            if (x.getBound() == Bound.LOWER) {
                Collections.reverse(adjacent);
            }
            if (!isAdjacent(x, adjacent.get(0))) {
                i++;
                continue;
            }
            int last = 0;
            while (last + 1 < adjacent.size() && isAdjacent(adjacent.get(last), adjacent.get(last + 1))) {
                last++;
            }
            adjacent.get(last).setBound(x.getBound());

            Map<Value, Boolean> removed = new IdentityHashMap<>();
            for (int k = 0; k < last; k++) {
                removed.put(adjacent.get(k), Boolean.TRUE);
            }
            removed.put(x, Boolean.TRUE);

            Value successor = null;
            for (int k = i + 1; k < values.size(); k++) {
                if (!removed.containsKey(values.get(k))) {
                    successor = values.get(k);
                    break;
                }
            }
            values.removeIf(removed::containsKey);
            i = successor == null ? values.size() : indexOfIdentity(successor);
        }
    }

    private List<Value> collectAdjacent(Value x) {
        List<Value> adjacent = new ArrayList<>();
        for (Value y : values) {
            if (x == y || y.isNonValue()
                    || x.getValueType() != y.getValueType()
                    || x.getValueKind() != y.getValueKind()) {
                continue;
            }
            if (x.isSymbolicValue() && !Value.sameToken(x.getTokValue(), y.getTokValue())) {
                continue;
            }
            if (x.getBound() != y.getBound()) {
                if (y.getBound() != Bound.POINT && isAdjacent(x, y)) {
                    return new ArrayList<>();
                }
                if (x.getValueType() == ValueType.FLOAT || y.getBound() != Bound.POINT) {
                    continue;
                }
            }
            if (x.getBound() == Bound.LOWER && !y.compareValue(x)) {
                continue;
            }
            if (x.getBound() == Bound.UPPER && !x.compareValue(y)) {
                continue;
            }
            adjacent.add(y);
        }
        return adjacent;
    }

    private void removeIdentity(Value v) {
        int index = indexOfIdentity(v);
        if (index >= 0) {
            values.remove(index);
        }
    }

    private int indexOfIdentity(Value v) {
        for (int i = 0; i < values.size(); i++) {
            if (values.get(i) == v) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Read-only live view of the facts. The same instance is returned on every call.
     */
    public List<Value> asList() {
        return view;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    public void clear() {
        values.clear();
    }

    public Value first() {
        return values.isEmpty() ? null : values.get(0);
    }

    // --- queries

    public boolean hasKnownIntValue() {
        Value front = first();
        return front != null && front.isIntValue() && front.isKnown();
    }

    public boolean hasKnownValue() {
        return values.stream().anyMatch(Value::isKnown);
    }

    public boolean hasKnownValue(ValueType type) {
        return values.stream().anyMatch(v -> v.isKnown() && v.getValueType() == type);
    }

    /**
     * Whether a known symbolic fact refers to the expression of {@code tok}.
     */
    public boolean hasKnownSymbolicValue(Token tok) {
        if (tok.exprId() == 0) {
            return false;
        }
        return values.stream().anyMatch(v -> v.isKnown() && v.isSymbolicValue()
                && v.getTokValue() != null && v.getTokValue().exprId() == tok.exprId());
    }

    public Value getKnownValue(ValueType type) {
        if (values.isEmpty()) {
            return null;
        }
        if (type == ValueType.INT) {
            return hasKnownIntValue() ? values.get(0) : null;
        }
        return find(v -> v.isKnown() && v.getValueType() == type);
    }

    public Value getValue(long val) {
        return find(v -> v.isIntValue() && !v.isImpossible() && v.getIntValue() == val);
    }

    public Value getValueNE(long val) {
        return find(v -> v.isIntValue() && !v.isImpossible() && v.getIntValue() != val);
    }

    public Value getValueLE(long val, AnalysisConfig settings) {
        return findValue(settings, v -> !v.isImpossible() && v.isIntValue() && v.getIntValue() <= val);
    }

    public Value getValueGE(long val, AnalysisConfig settings) {
        return findValue(settings, v -> !v.isImpossible() && v.isIntValue() && v.getIntValue() >= val);
    }

    /**
     * The fact that makes argument {@code argnr} of the call at {@code ftok}
     * invalid, preferring certain and unconditional facts.
     */
    public Value getInvalidValue(Token ftok, int argnr, AnalysisConfig settings, ArgumentValidityOracle oracle) {
        return findValue(settings, v -> !v.isImpossible()
                && ((v.isIntValue() && !oracle.isIntArgValid(ftok, argnr, v.getIntValue()))
                || (v.isFloatValue() && !oracle.isFloatArgValid(ftok, argnr, v.getFloatValue()))));
    }

    private Value findValue(AnalysisConfig settings, Predicate<Value> pred) {
        Value ret = null;
        for (Value v : values) {
            if (!pred.test(v)) {
                continue;
            }
            if (ret == null || ret.isInconclusive() || (ret.getCondition() != null && !v.isInconclusive())) {
                ret = v;
            }
            if (!ret.isInconclusive() && ret.getCondition() == null) {
                break;
            }
        }
        if (ret != null) {
            if (ret.isInconclusive() && !settings.inconclusive()) {
                return null;
            }
            if (ret.getCondition() != null && !settings.warnings()) {
                return null;
            }
        }
        return ret;
    }

    public Value getMinValue(boolean condition, long path) {
        return getCompareValue(condition, path, (a, b) -> a < b);
    }

    public Value getMaxValue(boolean condition, long path) {
        return getCompareValue(condition, path, (a, b) -> a > b);
    }

    private Value getCompareValue(boolean condition, long path, BiPredicate<Long, Long> compare) {
        Value ret = null;
        for (Value v : values) {
            if (!v.isIntValue() || v.isImpossible()) {
                continue;
            }
            if (path > 0 && v.getPath() != 0 && v.getPath() != path) {
                continue;
            }
            if ((ret == null || compare.test(v.getIntValue(), ret.getIntValue()))
                    && ((v.getCondition() != null) == condition)) {
                ret = v;
            }
        }
        return ret;
    }

    public Value getMovedValue() {
        return find(v -> v.isMovedValue() && !v.isImpossible() && v.getMoveKind() != MoveKind.NON_MOVED_VARIABLE);
    }

    public Value getContainerSizeValue(long val) {
        return find(v -> v.isContainerSizeValue() && !v.isImpossible() && v.getIntValue() == val);
    }

    /**
     * The string literal fact with the smallest storage size.
     */
    public Value getValueTokenMinStrSize(AnalysisConfig settings) {
        Value ret = null;
        int minSize = Integer.MAX_VALUE;
        for (Value v : values) {
            if (isStringTokValue(v)) {
                int size = Token.getStrSize(v.getTokValue(), settings);
                if (ret == null || size < minSize) {
                    minSize = size;
                    ret = v;
                }
            }
        }
        return ret;
    }

    /**
     * The string literal fact with the longest content.
     */
    public Value getValueTokenMaxStrLength() {
        Value ret = null;
        int maxLength = 0;
        for (Value v : values) {
            if (isStringTokValue(v)) {
                int length = Token.getStrLength(v.getTokValue());
                if (ret == null || length > maxLength) {
                    maxLength = length;
                    ret = v;
                }
            }
        }
        return ret;
    }

    private static boolean isStringTokValue(Value v) {
        return v.isTokValue() && v.getTokValue() != null && v.getTokValue().kind() == TokenKind.STRING;
    }

    private Value find(Predicate<Value> pred) {
        for (Value v : values) {
            if (pred.test(v)) {
                return v;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
