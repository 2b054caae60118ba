package com.regvm.runtime;

import com.regvm.vm.Value;
import com.regvm.vm.host.HostFunction;
import com.regvm.vm.host.HostObject;

import org.mozilla.javascript.Context;
import org.mozilla.javascript.Function;
import org.mozilla.javascript.Scriptable;

import java.util.List;

/**
 * VM handle to a JavaScript function.
 * A void receiver calls the function with the global scope as {@code this}.
 * Functions are objects too, so their own properties ({@code String.fromCharCode}) stay readable.
 */
public final class RhinoFunction implements HostFunction, HostObject {

    private final RhinoHost host;
    private final Function function;

    RhinoFunction(RhinoHost host, Function function) {
        this.host = host;
        this.function = function;
    }

    public Function getFunction() {
        return function;
    }

    @Override
    public Value call(Value receiver, List<Value> args) {
        Context cx = RhinoHost.enter();
        try {
            Scriptable scope = host.getScope();
            Scriptable thisObj = receiver.isVoid()
                ? scope
                : Context.toObject(host.toJs(cx, receiver), scope);
            Object result = function.call(cx, scope, thisObj, host.toJs(cx, args));
            return host.toValue(result);
        } finally {
            Context.exit();
        }
    }

    @Override
    public Value getProperty(Value key) {
        return RhinoObject.readProperty(host, function, key);
    }

    @Override
    public String toString() {
        return function.getClassName();
    }
}
