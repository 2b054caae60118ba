package com.regvm.vm;

import com.regvm.vm.host.HostFunction;
import com.regvm.vm.host.HostObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Objects;

/**
 * Runtime value held in a register.
 * Dynamically typed: operations check the kind at the point of use.
 */
public sealed interface Value {

    /** Void/undefined value */
    record Void() implements Value {
        @Override
        public String toString() { return "<Void>"; }
    }

    /** Integer value */
    record Int(int value) implements Value {
        @Override
        public String toString() { return String.valueOf(value); }
    }

    /** Floating point value */
    record Float(double value) implements Value {
        @Override
        public String toString() { return String.valueOf(value); }
    }

    /** String value */
    record Str(String value) implements Value {
        public Str {
            Objects.requireNonNull(value, "value");
        }
        @Override
        public String toString() { return "\"" + value + "\""; }
    }

    /** Ordered sequence of values (call arguments, register snapshots) */
    record Array(java.util.List<Value> items) implements Value {
        public Array {
            items = Collections.unmodifiableList(new ArrayList<>(items));
        }
        public int size() { return items.size(); }
        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("[");
            for (int i = 0; i < items.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(items.get(i));
            }
            return sb.append("]").toString();
        }
    }

    /** Handle to an object owned by the host environment */
    record Host(HostObject object) implements Value {
        public Host {
            Objects.requireNonNull(object, "object");
        }
        @Override
        public String toString() { return "<host " + object + ">"; }
    }

    /** Handle to a host function */
    record Callable(HostFunction function) implements Value {
        public Callable {
            Objects.requireNonNull(function, "function");
        }
        @Override
        public String toString() { return "<callable " + function + ">"; }
    }

    // Singleton instances for common values
    Value VOID = new Void();
    Value ZERO = new Int(0);
    Value ONE = new Int(1);
    Value TRUE = ONE;
    Value FALSE = ZERO;
    Value EMPTY_STRING = new Str("");

    // Factory methods
    static Value of(int value) {
        return switch (value) {
            case 0 -> ZERO;
            case 1 -> ONE;
            default -> new Int(value);
        };
    }

    static Value of(double value) {
        return new Float(value);
    }

    static Value of(String value) {
        if (value == null || value.isEmpty()) return EMPTY_STRING;
        return new Str(value);
    }

    static Value of(boolean value) {
        return value ? TRUE : FALSE;
    }

    static Value array(Value... items) {
        return new Array(java.util.List.of(items));
    }

    static Value array(java.util.List<Value> items) {
        return new Array(items);
    }

    static Value host(HostObject object) {
        return new Host(object);
    }

    static Value callable(HostFunction function) {
        return new Callable(function);
    }

    /**
     * Number with the narrowest representation: integral values inside the int range
     * become {@link Int}, everything else {@link Float}.
     */
    static Value number(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)
                && value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE
                && !(value == 0.0 && 1 / value < 0)) {
            return of((int) value);
        }
        return new Float(value);
    }

    // Type checking
    default boolean isVoid() { return this instanceof Void; }
    default boolean isInt() { return this instanceof Int; }
    default boolean isFloat() { return this instanceof Float; }
    default boolean isNumber() { return isInt() || isFloat(); }
    default boolean isString() { return this instanceof Str; }
    default boolean isArray() { return this instanceof Array; }
    default boolean isHost() { return this instanceof Host; }
    default boolean isCallable() { return this instanceof Callable; }

    default String typeName() {
        if (this instanceof Void) return "void";
        if (this instanceof Int) return "int";
        if (this instanceof Float) return "float";
        if (this instanceof Str) return "string";
        if (this instanceof Array) return "array";
        if (this instanceof Host) return "host";
        if (this instanceof Callable) return "callable";
        return getClass().getSimpleName().toLowerCase();
    }

    default boolean isTruthy() {
        if (this instanceof Void) return false;
        if (this instanceof Int i) return i.value() != 0;
        if (this instanceof Float f) return f.value() != 0.0 && !Double.isNaN(f.value());
        if (this instanceof Str s) return !s.value().isEmpty();
        return true;
    }

    // Type coercion
    default int toInt() {
        if (this instanceof Int i) return i.value();
        if (this instanceof Float f) return (int) f.value();
        if (this instanceof Str s) {
            try {
                return Integer.parseInt(s.value().trim());
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }

    default double toDouble() {
        if (this instanceof Int i) return i.value();
        if (this instanceof Float f) return f.value();
        if (this instanceof Str s) {
            String text = s.value().trim();
            if (text.isEmpty()) return 0.0;
            try {
                return Double.parseDouble(text);
            } catch (NumberFormatException e) {
                return Double.NaN;
            }
        }
        return Double.NaN;
    }

    /**
     * Display form used for string concatenation.
     */
    default String toStr() {
        if (this instanceof Void) return "undefined";
        if (this instanceof Int i) return String.valueOf(i.value());
        if (this instanceof Float f) {
            double d = f.value();
            if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
                return String.valueOf((long) d);
            }
            return String.valueOf(d);
        }
        if (this instanceof Str s) return s.value();
        if (this instanceof Array a) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < a.items().size(); i++) {
                if (i > 0) sb.append(',');
                Value item = a.items().get(i);
                if (!item.isVoid()) sb.append(item.toStr());
            }
            return sb.toString();
        }
        return toString();
    }
}
