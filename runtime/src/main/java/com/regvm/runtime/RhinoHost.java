package com.regvm.runtime;

import com.regvm.vm.Value;
import com.regvm.vm.host.HostBindings;
import com.regvm.vm.host.HostEvaluator;
import com.regvm.vm.host.MapHostObject;

import org.mozilla.javascript.Context;
import org.mozilla.javascript.Function;
import org.mozilla.javascript.Scriptable;
import org.mozilla.javascript.ScriptableObject;
import org.mozilla.javascript.Undefined;
import org.mozilla.javascript.Wrapper;

import java.util.List;
import java.util.Map;

/**
 * JavaScript host environment backed by a Rhino top-level scope.
 * The scope doubles as {@code window}; {@code document} is a plain object with
 * {@code title} and {@code cookie} properties.
 *
 * Every entry point enters a Rhino {@link Context} on the calling thread, so a host
 * can be shared by several VMs as long as they run on one thread at a time.
 */
public class RhinoHost implements HostEvaluator {

    private static final String SOURCE_NAME = "<eval>";

    private final ScriptableObject scope;
    private final Scriptable document;

    public RhinoHost() {
        Context cx = enter();
        try {
            scope = cx.initStandardObjects();
            document = cx.newObject(scope);
            ScriptableObject.putProperty(document, "title", "");
            ScriptableObject.putProperty(document, "cookie", "");
            ScriptableObject.putProperty(scope, "window", scope);
            ScriptableObject.putProperty(scope, "document", document);
        } finally {
            Context.exit();
        }
    }

    /**
     * Bindings for a VM running against this host.
     */
    public HostBindings bindings() {
        return new HostBindings(toValue(scope), toValue(document), this, this::newObject);
    }

    /**
     * A fresh empty JavaScript object, shared by reference with the VM.
     */
    public Value newObject() {
        Context cx = enter();
        try {
            return toValue(cx.newObject(scope));
        } finally {
            Context.exit();
        }
    }

    @Override
    public Value evaluate(String source) {
        Context cx = enter();
        try {
            return toValue(cx.evaluateString(scope, source, SOURCE_NAME, 1, null));
        } finally {
            Context.exit();
        }
    }

    /**
     * Define a global variable visible to evaluated code and property reads on {@code window}.
     */
    public void define(String name, Value value) {
        Context cx = enter();
        try {
            ScriptableObject.putProperty(scope, name, toJs(cx, value));
        } finally {
            Context.exit();
        }
    }

    public Scriptable getScope() {
        return scope;
    }

    static Context enter() {
        Context cx = Context.enter();
        // Interpreted mode: no bytecode generation for one-off snippets
        cx.setOptimizationLevel(-1);
        cx.setLanguageVersion(Context.VERSION_ES6);
        return cx;
    }

    // JavaScript -> VM

    Value toValue(Object js) {
        if (js == null || Undefined.isUndefined(js)) {
            return Value.VOID;
        }
        if (js instanceof Boolean b) {
            return Value.of(b);
        }
        if (js instanceof Number n) {
            return Value.number(n.doubleValue());
        }
        if (js instanceof CharSequence s) {
            return Value.of(s.toString());
        }
        if (js instanceof VmFunction vmFunction) {
            return vmFunction.getCallable();
        }
        if (js instanceof Function function) {
            return Value.callable(new RhinoFunction(this, function));
        }
        if (js instanceof Wrapper wrapper) {
            Object unwrapped = wrapper.unwrap();
            if (unwrapped instanceof Value value) {
                return value;
            }
            if (unwrapped instanceof Boolean || unwrapped instanceof Number || unwrapped instanceof CharSequence) {
                return toValue(unwrapped);
            }
        }
        if (js instanceof Scriptable object) {
            return Value.host(new RhinoObject(this, object));
        }
        return Value.of(js.toString());
    }

    // VM -> JavaScript

    Object toJs(Context cx, Value value) {
        if (value instanceof Value.Void) {
            return Undefined.instance;
        }
        if (value instanceof Value.Int i) {
            return i.value();
        }
        if (value instanceof Value.Float f) {
            return f.value();
        }
        if (value instanceof Value.Str s) {
            return s.value();
        }
        if (value instanceof Value.Array array) {
            return cx.newArray(scope, toJs(cx, array.items()));
        }
        if (value instanceof Value.Host host) {
            if (host.object() instanceof RhinoObject rhinoObject) {
                return rhinoObject.getScriptable();
            }
            if (host.object() instanceof MapHostObject map) {
                Scriptable object = cx.newObject(scope);
                for (Map.Entry<String, Value> entry : map.getProperties().entrySet()) {
                    ScriptableObject.putProperty(object, entry.getKey(), toJs(cx, entry.getValue()));
                }
                return object;
            }
            return Context.javaToJS(host.object(), scope);
        }
        if (value instanceof Value.Callable callable) {
            if (callable.function() instanceof RhinoFunction rhinoFunction) {
                return rhinoFunction.getFunction();
            }
            return new VmFunction(this, callable);
        }
        throw new IllegalArgumentException("Unsupported value: " + value);
    }

    Object[] toJs(Context cx, List<Value> values) {
        Object[] result = new Object[values.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = toJs(cx, values.get(i));
        }
        return result;
    }
}
