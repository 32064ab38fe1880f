package org.foxesworld.manascript.script;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.manascript.core.thing.Thing;

import java.io.Closeable;
import java.util.Objects;

/**
 * Engine-agnostic script: one interpreter instance with a single calling convention.
 *
 * <pre>
 *   script.prepare("onTalk");
 *   script.push(npc);
 *   script.push(player);
 *   int result = script.execute();
 * </pre>
 *
 * <p>Call sequencing is checked on every call: {@code push}/{@code execute} without a prepared
 * call, {@code prepare} during a call, or any use after {@link #close()} throws
 * {@link ScriptContractException}. Everything that goes wrong inside the interpreter or a backend
 * hook, while preparing or running the call, is reported by {@link #execute()} as a logged failure
 * returning {@link #FAILED_CALL}.</p>
 *
 * <p>A Script is owned by exactly one native component and is not thread-safe.</p>
 */
public abstract class Script implements Closeable {

    private static final Logger log = LogManager.getLogger(Script.class);

    /** Result of every failed call. */
    public static final int FAILED_CALL = 0;

    private final String name;
    private final CallContext call = new CallContext();
    private boolean closed;

    protected Script(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    /** Script file this instance was loaded from. */
    public final String name() {
        return name;
    }

    /**
     * Begins a call to the global function {@code functionName}. An unknown name is not an error here;
     * the following {@link #execute()} fails instead.
     */
    public final void prepare(String functionName) {
        ensureOpen("prepare");
        Objects.requireNonNull(functionName, "functionName");
        if (call.inProgress()) {
            throw new ScriptContractException("prepare('" + functionName + "') while call '"
                    + call.functionName() + "' is in progress in " + name);
        }
        call.begin(functionName);
        try {
            onPrepare(functionName);
        } catch (RuntimeException e) {
            call.fail();
            log.error("[script] {}: prepare('{}') failed in host code", name, functionName, e);
        }
    }

    public final void push(int value) {
        ensureCall("push");
        if (!call.failed()) {
            try {
                onPush(value);
            } catch (RuntimeException e) {
                failPush(e);
            }
        }
        call.argumentPushed();
    }

    /** Pushes a simulation object. The interpreter receives an opaque handle, never the object. */
    public final void push(Thing thing) {
        ensureCall("push");
        Objects.requireNonNull(thing, "thing");
        if (!call.failed()) {
            try {
                onPush(thing);
            } catch (RuntimeException e) {
                failPush(e);
            }
        }
        call.argumentPushed();
    }

    /**
     * Runs the prepared call. The call context is reset whatever happens.
     *
     * @return the function's numeric result, or {@link #FAILED_CALL} on any failure
     */
    public final int execute() {
        ensureCall("execute");
        String fn = call.functionName();
        int argc = call.argumentCount();
        try {
            if (call.failed()) {
                log.warn("[script] {}: call '{}' skipped, preparing it failed", name, fn);
                return FAILED_CALL;
            }
            return onExecute(fn, argc);
        } catch (RuntimeException e) {
            log.error("[script] {}: call '{}' failed in host code", name, fn, e);
            return FAILED_CALL;
        } finally {
            call.reset();
        }
    }

    /** Releases the interpreter. Must be called exactly once. */
    @Override
    public final void close() {
        if (closed) {
            throw new ScriptContractException("Script already closed: " + name);
        }
        closed = true;
        call.reset();
        onClose();
    }

    public final boolean isClosed() {
        return closed;
    }

    /**
     * False once calls can only fail: after {@link #close()}, or when the backend lost its
     * interpreter. Backends narrow this further.
     */
    public boolean isUsable() {
        return !closed;
    }

    public final boolean isCallInProgress() {
        return call.inProgress();
    }

    /** Arguments pushed for the current call, or -1 if none is prepared. */
    public final int pendingArgumentCount() {
        return call.argumentCount();
    }

    // ---------------- backend hooks ----------------

    protected abstract void onPrepare(String functionName);

    protected abstract void onPush(int value);

    protected abstract void onPush(Thing thing);

    /**
     * Invokes the prepared function with the {@code argumentCount} pushed arguments and drops them.
     * Interpreter errors must be handled here and reported as {@link #FAILED_CALL}.
     */
    protected abstract int onExecute(String functionName, int argumentCount);

    /** Tears down the interpreter. Called once; no script code may run afterwards. */
    protected abstract void onClose();

    // ---------------- internals ----------------

    private void failPush(RuntimeException e) {
        call.fail();
        log.error("[script] {}: push for '{}' failed in host code", name, call.functionName(), e);
    }

    private void ensureOpen(String op) {
        if (closed) {
            throw new ScriptContractException(op + "() on closed script " + name);
        }
    }

    private void ensureCall(String op) {
        ensureOpen(op);
        if (!call.inProgress()) {
            throw new ScriptContractException(op + "() without prepare() in " + name);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + name + (closed ? ", closed" : "") + '}';
    }
}
