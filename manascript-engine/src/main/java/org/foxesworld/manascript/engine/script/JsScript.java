package org.foxesworld.manascript.engine.script;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.manascript.core.handle.Handle;
import org.foxesworld.manascript.core.handle.HandleTable;
import org.foxesworld.manascript.core.thing.Thing;
import org.foxesworld.manascript.engine.bridge.CallbackBridge;
import org.foxesworld.manascript.script.Script;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.proxy.ProxyObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * {@link Script} backed by one GraalJS {@link Context}.
 *
 * <p>The file is evaluated once as top-level code when the instance is created; its global
 * functions are the call targets. Simulation objects cross the boundary as {@link Handle} host
 * objects without exported members, so scripts can keep and pass them but never reach the object.</p>
 *
 * <p>A top-level error, an exhausted statement budget or a cancelled context leaves the instance
 * unusable: every later call fails with {@link #FAILED_CALL}.</p>
 */
public final class JsScript extends Script {

    private static final Logger log = LogManager.getLogger(JsScript.class);

    static final String LANGUAGE = "js";

    private final Context ctx;
    private final HandleTable handles;
    private final boolean limited;
    private final BooleanSupplier engineOpen;

    private final List<Object> args = new ArrayList<>();
    private Value function;

    private boolean usable = true;
    private boolean executing;
    private boolean closeAfterCall;
    private boolean contextClosed;

    /**
     * Installs the callback namespace and runs the top-level code of {@code source}.
     * Top-level failures are logged here; they do not fail construction.
     *
     * @param engineOpen false once the loader closed the shared engine, and with it this context
     */
    JsScript(String path, Context ctx, Source source, HandleTable handles, ProxyObject callbacks,
             boolean limited, BooleanSupplier engineOpen) {
        super(path);
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        this.handles = Objects.requireNonNull(handles, "handles");
        this.limited = limited;
        this.engineOpen = Objects.requireNonNull(engineOpen, "engineOpen");

        ctx.getBindings(LANGUAGE).putMember(CallbackBridge.NAMESPACE, callbacks);
        try {
            ctx.eval(source);
        } catch (PolyglotException pe) {
            usable = false;
            log.error("[script] failure while initializing {}: error={}{}, message={}",
                    path, failureKind(pe), JsSyntaxVerifier.location(pe), pe.getMessage());
        } finally {
            resetLimits();
        }
    }

    /** False once the script failed at top level, was cancelled or lost its engine. */
    @Override
    public boolean isUsable() {
        return usable && !contextClosed && !isClosed() && engineOpen.getAsBoolean();
    }

    @Override
    protected void onPrepare(String functionName) {
        args.clear();
        function = null;
        if (!usable) return;
        if (!engineOpen.getAsBoolean()) {
            markContextLost(functionName, "engine is closed");
            return;
        }
        try {
            function = ctx.getBindings(LANGUAGE).getMember(functionName);
        } catch (PolyglotException pe) {
            log.warn("[script] {}: cannot resolve '{}': {}", name(), functionName, pe.getMessage());
        } catch (IllegalStateException e) {
            markContextLost(functionName, e.getMessage());
        }
    }

    @Override
    protected void onPush(int value) {
        args.add(value);
    }

    @Override
    protected void onPush(Thing thing) {
        args.add(handles.mint(thing));
    }

    @Override
    protected int onExecute(String functionName, int argumentCount) {
        executing = true;
        try {
            if (!usable) {
                log.warn("[script] {}: call '{}' skipped, script is unusable", name(), functionName);
                return FAILED_CALL;
            }
            if (function == null || !function.canExecute()) {
                log.warn("[script] Failure while calling '{}' in {}: error=undefined function, type={}",
                        functionName, name(), typeName(function));
                return FAILED_CALL;
            }

            Value result = function.execute(args.toArray());
            if (!result.isNumber()) {
                log.warn("[script] Failure while calling '{}' in {}: error=non-numeric result, type={}, message={}",
                        functionName, name(), typeName(result), result);
                return FAILED_CALL;
            }
            Integer n = toInt(result);
            if (n == null) {
                log.warn("[script] Failure while calling '{}' in {}: error=unrepresentable number, message={}",
                        functionName, name(), result);
                return FAILED_CALL;
            }
            return n;

        } catch (PolyglotException pe) {
            if (pe.isResourceExhausted() || pe.isCancelled() || pe.isExit()) {
                usable = false;
            }
            log.warn("[script] Failure while calling '{}' in {}: error={}{}, argc={}, message={}",
                    functionName, name(), failureKind(pe), JsSyntaxVerifier.location(pe), argumentCount, pe.getMessage());
            return FAILED_CALL;
        } catch (IllegalStateException e) {
            markContextLost(functionName, e.getMessage());
            return FAILED_CALL;
        } finally {
            args.clear();
            function = null;
            executing = false;
            if (closeAfterCall) {
                closeContext();
            } else {
                resetLimits();
            }
        }
    }

    @Override
    protected void onClose() {
        args.clear();
        function = null;
        usable = false;
        if (executing) {
            // closed by native code reached from a callback; finish the call first
            closeAfterCall = true;
            return;
        }
        closeContext();
    }

    // ---------------- internals ----------------

    private void markContextLost(String functionName, String reason) {
        usable = false;
        log.warn("[script] {}: call '{}' failed, context is gone: {}", name(), functionName, reason);
    }

    private void closeContext() {
        if (contextClosed) return;
        contextClosed = true;
        try {
            ctx.close();
            log.debug("[script] closed {}", name());
        } catch (PolyglotException | IllegalStateException e) {
            log.warn("[script] {}: context close failed: {}", name(), e.getMessage());
        }
    }

    private void resetLimits() {
        if (!limited || !usable || contextClosed) return;
        try {
            ctx.resetLimits();
        } catch (PolyglotException | IllegalStateException e) {
            usable = false;
            log.warn("[script] {}: cannot reset execution budget: {}", name(), e.getMessage());
        }
    }

    private static Integer toInt(Value n) {
        if (n.fitsInInt()) return n.asInt();
        if (n.fitsInLong()) {
            long v = n.asLong();
            return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, v));
        }
        if (n.fitsInDouble()) return (int) n.asDouble();
        return null;
    }

    static String failureKind(PolyglotException pe) {
        if (pe.isResourceExhausted()) return "budget exhausted";
        if (pe.isCancelled()) return "cancelled";
        if (pe.isSyntaxError()) return "syntax";
        if (pe.isHostException()) return "host";
        if (pe.isInternalError()) return "internal";
        if (pe.isExit()) return "exit";
        return "runtime";
    }

    static String typeName(Value v) {
        if (v == null) return "undefined";
        try {
            if (v.isNull()) return v.toString();
            if (v.isBoolean()) return "boolean";
            if (v.isString()) return "string";
            if (v.isNumber()) return "number";
            if (v.isHostObject()) return v.asHostObject() instanceof Handle ? "handle" : "host";
            if (v.canExecute()) return "function";
            if (v.hasArrayElements()) return "array";
            Value meta = v.getMetaObject();
            return meta != null ? meta.getMetaSimpleName() : "object";
        } catch (PolyglotException e) {
            return "unknown";
        }
    }
}
