package com.regvm.runtime;

import com.regvm.vm.Value;

import org.mozilla.javascript.BaseFunction;
import org.mozilla.javascript.Context;
import org.mozilla.javascript.ScriptRuntime;
import org.mozilla.javascript.Scriptable;

import java.util.ArrayList;
import java.util.List;

/**
 * JavaScript function that forwards to a VM-side callable.
 */
final class VmFunction extends BaseFunction {

    private static final long serialVersionUID = 1L;

    private final transient RhinoHost host;
    private final transient Value.Callable callable;

    VmFunction(RhinoHost host, Value.Callable callable) {
        this.host = host;
        this.callable = callable;
        ScriptRuntime.setFunctionProtoAndParent(this, host.getScope());
    }

    Value.Callable getCallable() {
        return callable;
    }

    @Override
    public Object call(Context cx, Scriptable scope, Scriptable thisObj, Object[] args) {
        List<Value> values = new ArrayList<>(args.length);
        for (Object arg : args) {
            values.add(host.toValue(arg));
        }
        Value receiver = thisObj == null || thisObj == host.getScope() ? Value.VOID : host.toValue(thisObj);
        Value result = callable.function().call(receiver, values);
        return host.toJs(cx, result == null ? Value.VOID : result);
    }

    @Override
    public String getFunctionName() {
        return "vmCallable";
    }
}
