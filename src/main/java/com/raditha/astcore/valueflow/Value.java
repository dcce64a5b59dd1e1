package com.raditha.astcore.valueflow;

import com.raditha.astcore.model.Token;
import com.raditha.astcore.util.Literals;

import java.util.Objects;

/**
 * A dataflow fact: a claim about the value an expression can have at a token.
 * <p>
 * Facts are mutable while they are being built; {@link ValueList} stores its
 * own copy, so a fact can be reused after it has been added to a token.
 * Factories start every fact as {@link ValueKind#POSSIBLE} at a {@link Bound#POINT}.
 */
public class Value {

    private ValueType valueType;
    private ValueKind valueKind = ValueKind.POSSIBLE;
    private Bound bound = Bound.POINT;
    private long intValue;
    private double floatValue;
    private Token tokValue;
    private MoveKind moveKind = MoveKind.NON_MOVED_VARIABLE;
    private LifetimeKind lifetimeKind = LifetimeKind.OBJECT;
    private LifetimeScope lifetimeScope = LifetimeScope.LOCAL;
    private Token condition;
    private long path;
    private int varId;
    private long varValue;
    private int indirect;
    private boolean conditional;
    private boolean defaultArg;

    public Value(ValueType valueType) {
        this.valueType = Objects.requireNonNull(valueType);
    }

    public Value(Value other) {
        this.valueType = other.valueType;
        this.valueKind = other.valueKind;
        this.bound = other.bound;
        this.intValue = other.intValue;
        this.floatValue = other.floatValue;
        this.tokValue = other.tokValue;
        this.moveKind = other.moveKind;
        this.lifetimeKind = other.lifetimeKind;
        this.lifetimeScope = other.lifetimeScope;
        this.condition = other.condition;
        this.path = other.path;
        this.varId = other.varId;
        this.varValue = other.varValue;
        this.indirect = other.indirect;
        this.conditional = other.conditional;
        this.defaultArg = other.defaultArg;
    }

    public static Value intValue(long value) {
        Value v = new Value(ValueType.INT);
        v.intValue = value;
        v.varValue = value;
        return v;
    }

    public static Value floatValue(double value) {
        Value v = new Value(ValueType.FLOAT);
        v.floatValue = value;
        return v;
    }

    public static Value tokValue(Token tok) {
        Value v = new Value(ValueType.TOK);
        v.tokValue = tok;
        return v;
    }

    public static Value moved(MoveKind kind) {
        Value v = new Value(ValueType.MOVED);
        v.moveKind = kind;
        return v;
    }

    public static Value uninit() {
        return new Value(ValueType.UNINIT);
    }

    public static Value containerSize(long size) {
        Value v = new Value(ValueType.CONTAINER_SIZE);
        v.intValue = size;
        return v;
    }

    public static Value bufferSize(long size) {
        Value v = new Value(ValueType.BUFFER_SIZE);
        v.intValue = size;
        return v;
    }

    public static Value iteratorStart(long offset) {
        Value v = new Value(ValueType.ITERATOR_START);
        v.intValue = offset;
        return v;
    }

    public static Value iteratorEnd(long offset) {
        Value v = new Value(ValueType.ITERATOR_END);
        v.intValue = offset;
        return v;
    }

    public static Value lifetime(Token tok, LifetimeKind kind, LifetimeScope scope) {
        Value v = new Value(ValueType.LIFETIME);
        v.tokValue = tok;
        v.lifetimeKind = kind;
        v.lifetimeScope = scope;
        return v;
    }

    /**
     * The value of expression {@code tok} plus {@code delta}.
     */
    public static Value symbolic(Token tok, long delta) {
        Value v = new Value(ValueType.SYMBOLIC);
        v.tokValue = tok;
        v.intValue = delta;
        return v;
    }

    public ValueType getValueType() {
        return valueType;
    }

    public ValueKind getValueKind() {
        return valueKind;
    }

    public Value setValueKind(ValueKind valueKind) {
        this.valueKind = Objects.requireNonNull(valueKind);
        return this;
    }

    public Value setKnown() {
        return setValueKind(ValueKind.KNOWN);
    }

    public Value setPossible() {
        return setValueKind(ValueKind.POSSIBLE);
    }

    public Value setImpossible() {
        return setValueKind(ValueKind.IMPOSSIBLE);
    }

    public Value setInconclusive() {
        return setValueKind(ValueKind.INCONCLUSIVE);
    }

    public boolean isKnown() {
        return valueKind == ValueKind.KNOWN;
    }

    public boolean isPossible() {
        return valueKind == ValueKind.POSSIBLE;
    }

    public boolean isImpossible() {
        return valueKind == ValueKind.IMPOSSIBLE;
    }

    public boolean isInconclusive() {
        return valueKind == ValueKind.INCONCLUSIVE;
    }

    public Bound getBound() {
        return bound;
    }

    public Value setBound(Bound bound) {
        this.bound = Objects.requireNonNull(bound);
        return this;
    }

    public long getIntValue() {
        return intValue;
    }

    public Value setIntValue(long intValue) {
        this.intValue = intValue;
        return this;
    }

    public double getFloatValue() {
        return floatValue;
    }

    public Token getTokValue() {
        return tokValue;
    }

    public MoveKind getMoveKind() {
        return moveKind;
    }

    public LifetimeKind getLifetimeKind() {
        return lifetimeKind;
    }

    public LifetimeScope getLifetimeScope() {
        return lifetimeScope;
    }

    /**
     * Token of the condition this fact depends on, or null when unconditional.
     */
    public Token getCondition() {
        return condition;
    }

    public Value setCondition(Token condition) {
        this.condition = condition;
        return this;
    }

    public long getPath() {
        return path;
    }

    public Value setPath(long path) {
        this.path = path;
        return this;
    }

    public int getVarId() {
        return varId;
    }

    public Value setVarId(int varId) {
        this.varId = varId;
        return this;
    }

    public long getVarValue() {
        return varValue;
    }

    public Value setVarValue(long varValue) {
        this.varValue = varValue;
        return this;
    }

    public int getIndirect() {
        return indirect;
    }

    public Value setIndirect(int indirect) {
        this.indirect = indirect;
        return this;
    }

    public boolean isConditional() {
        return conditional;
    }

    public Value setConditional(boolean conditional) {
        this.conditional = conditional;
        return this;
    }

    public boolean isDefaultArg() {
        return defaultArg;
    }

    public Value setDefaultArg(boolean defaultArg) {
        this.defaultArg = defaultArg;
        return this;
    }

    public boolean isIntValue() {
        return valueType == ValueType.INT;
    }

    public boolean isFloatValue() {
        return valueType == ValueType.FLOAT;
    }

    public boolean isTokValue() {
        return valueType == ValueType.TOK;
    }

    public boolean isMovedValue() {
        return valueType == ValueType.MOVED;
    }

    public boolean isUninitValue() {
        return valueType == ValueType.UNINIT;
    }

    public boolean isContainerSizeValue() {
        return valueType == ValueType.CONTAINER_SIZE;
    }

    public boolean isLifetimeValue() {
        return valueType == ValueType.LIFETIME;
    }

    public boolean isBufferSizeValue() {
        return valueType == ValueType.BUFFER_SIZE;
    }

    public boolean isIteratorValue() {
        return valueType == ValueType.ITERATOR_START || valueType == ValueType.ITERATOR_END;
    }

    public boolean isSymbolicValue() {
        return valueType == ValueType.SYMBOLIC;
    }

    /**
     * Facts that do not describe a value: moved, uninitialized and lifetime states.
     */
    public boolean isNonValue() {
        return isMovedValue() || isUninitValue() || isLifetimeValue();
    }

    /**
     * Same type and same payload. Kind, bound and path are ignored.
     */
    public boolean equalValue(Value rhs) {
        if (valueType != rhs.valueType) {
            return false;
        }
        return switch (valueType) {
            case INT, CONTAINER_SIZE, BUFFER_SIZE, ITERATOR_START, ITERATOR_END -> intValue == rhs.intValue;
            case SYMBOLIC -> sameToken(tokValue, rhs.tokValue) && intValue == rhs.intValue;
            case TOK, LIFETIME -> tokValue == rhs.tokValue;
            case FLOAT -> !(floatValue > rhs.floatValue || floatValue < rhs.floatValue)
                    && (Double.doubleToRawLongBits(floatValue) < 0) == (Double.doubleToRawLongBits(rhs.floatValue) < 0);
            case MOVED -> moveKind == rhs.moveKind;
            case UNINIT -> true;
        };
    }

    /**
     * Numeric less-than between the payloads. Facts without a numeric
     * payload never compare.
     */
    public boolean compareValue(Value rhs) {
        if (valueType == ValueType.FLOAT || rhs.valueType == ValueType.FLOAT) {
            if (!isNumeric() || !rhs.isNumeric()) {
                return false;
            }
            return numeric() < rhs.numeric();
        }
        if (!valueType.isIntegral() || !rhs.valueType.isIntegral()) {
            return false;
        }
        return intValue < rhs.intValue;
    }

    private boolean isNumeric() {
        return valueType == ValueType.FLOAT || valueType.isIntegral();
    }

    private double numeric() {
        return valueType == ValueType.FLOAT ? floatValue : intValue;
    }

    /**
     * Pull the open end of a range in by one step.
     */
    public void decreaseRange() {
        if (bound == Bound.LOWER) {
            if (valueType == ValueType.FLOAT) {
                floatValue++;
            } else {
                intValue++;
            }
        } else if (bound == Bound.UPPER) {
            if (valueType == ValueType.FLOAT) {
                floatValue--;
            } else {
                intValue--;
            }
        }
    }

    /**
     * Whether two tokens denote the same expression: identical, or sharing a
     * non-zero expression id.
     */
    public static boolean sameToken(Token tok1, Token tok2) {
        if (tok1 == tok2) {
            return true;
        }
        if (tok1 == null || tok2 == null) {
            return false;
        }
        return tok1.exprId() != 0 && tok1.exprId() == tok2.exprId();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Value other)) {
            return false;
        }
        return equalValue(other)
                && valueKind == other.valueKind
                && bound == other.bound
                && lifetimeKind == other.lifetimeKind
                && lifetimeScope == other.lifetimeScope
                && condition == other.condition
                && path == other.path
                && varId == other.varId
                && varValue == other.varValue
                && indirect == other.indirect
                && conditional == other.conditional
                && defaultArg == other.defaultArg;
    }

    @Override
    public int hashCode() {
        return Objects.hash(valueType, valueKind, bound, path, varId);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (isImpossible()) {
            sb.append('!');
        }
        if (bound == Bound.LOWER) {
            sb.append(">=");
        } else if (bound == Bound.UPPER) {
            sb.append("<=");
        }
        switch (valueType) {
            case INT -> sb.append(intValue);
            case TOK -> sb.append(tokValue == null ? "" : tokValue.str());
            case FLOAT -> sb.append(Literals.formatFloat(floatValue));
            case MOVED -> sb.append(moveKind.label());
            case UNINIT -> sb.append("Uninit");
            case BUFFER_SIZE, CONTAINER_SIZE -> sb.append("size=").append(intValue);
            case ITERATOR_START -> sb.append("start=").append(intValue);
            case ITERATOR_END -> sb.append("end=").append(intValue);
            case LIFETIME -> sb.append("lifetime[").append(lifetimeKind.label()).append("]=(")
                    .append(expression()).append(')');
            case SYMBOLIC -> {
                sb.append("symbolic=(").append(expression());
                if (intValue > 0) {
                    sb.append('+').append(intValue);
                } else if (intValue < 0) {
                    sb.append('-').append(-intValue);
                }
                sb.append(')');
            }
        }
        sb.append("*".repeat(Math.max(0, indirect)));
        if (path > 0) {
            sb.append('@').append(path);
        }
        return sb.toString();
    }

    private String expression() {
        return tokValue == null ? "" : tokValue.expressionString();
    }
}
