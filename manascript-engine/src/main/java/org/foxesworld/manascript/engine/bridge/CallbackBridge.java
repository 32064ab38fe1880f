package org.foxesworld.manascript.engine.bridge;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.manascript.core.handle.Handle;
import org.foxesworld.manascript.core.handle.HandleTable;
import org.foxesworld.manascript.core.net.MessageSender;
import org.foxesworld.manascript.core.net.ProtocolMessages;
import org.foxesworld.manascript.core.thing.Thing;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.proxy.ProxyExecutable;
import org.graalvm.polyglot.proxy.ProxyObject;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Exposes native callbacks to scripts under the {@value #NAMESPACE} namespace and validates every
 * call before it reaches native code.
 *
 * <p>Validation, per argument position: the tag must match the callback shape, handles must resolve
 * through the {@link HandleTable} to a live object of the expected kind. Any mismatch logs a warning
 * and aborts the callback with no side effect; the script sees {@code null}. Nothing is thrown into
 * the interpreter.</p>
 */
public final class CallbackBridge {

    private static final Logger log = LogManager.getLogger(CallbackBridge.class);

    public static final String NAMESPACE = "mana";

    private final HandleTable handles;
    private final Map<String, NativeCallback> callbacks;

    public CallbackBridge(HandleTable handles, List<? extends NativeCallback> callbacks) {
        this.handles = Objects.requireNonNull(handles, "handles");
        Map<String, NativeCallback> map = new LinkedHashMap<>();
        for (NativeCallback cb : callbacks) {
            String name = Objects.requireNonNull(cb.name(), "callback.name()");
            if (map.putIfAbsent(name, cb) != null) {
                throw new IllegalArgumentException("Duplicate callback: " + NAMESPACE + "." + name);
            }
        }
        this.callbacks = Collections.unmodifiableMap(map);
    }

    /** Bridge with the standard callback catalog. */
    public static CallbackBridge standard(HandleTable handles, MessageSender messages) {
        return new CallbackBridge(handles, List.of(
                new NpcDialogCallback("msg_npc_message", ProtocolMessages.GPMSG_NPC_MESSAGE, messages),
                new NpcDialogCallback("msg_npc_choice", ProtocolMessages.GPMSG_NPC_CHOICE, messages),
                new ScriptLogCallback("log_info", false),
                new ScriptLogCallback("log_warn", true)));
    }

    public Collection<NativeCallback> callbacks() {
        return callbacks.values();
    }

    /**
     * Builds the namespace object for one interpreter instance.
     *
     * @param scriptName used in log lines of callbacks invoked by that script
     */
    public ProxyObject namespace(String scriptName) {
        Map<String, Object> members = new LinkedHashMap<>();
        for (NativeCallback cb : callbacks.values()) {
            members.put(cb.name(), (ProxyExecutable) args -> dispatch(cb, scriptName, args));
        }
        return ProxyObject.fromMap(members);
    }

    /**
     * Validates {@code args} against the callback shape and runs it. Extra arguments are ignored.
     *
     * @return always {@code null}; callbacks produce no value for the script
     */
    Object dispatch(NativeCallback cb, String scriptName, Value... args) {
        List<ArgSpec> shape = cb.shape();
        Object[] resolved = new Object[shape.size()];

        for (int i = 0; i < shape.size(); i++) {
            ArgSpec spec = shape.get(i);
            CallbackArgument arg = CallbackArgument.of(i < args.length ? args[i] : null);

            if (arg.tag() != spec.tag()) {
                log.warn("[script] {}: {}.{} called with incorrect parameters (arg {} is {}, expected {})",
                        scriptName, NAMESPACE, cb.name(), i + 1, arg.tag(), spec);
                return null;
            }

            if (spec.tag() == ArgTag.HANDLE) {
                Handle h = (Handle) arg.value();
                Thing thing = handles.resolve(h);
                if (thing == null) {
                    log.warn("[script] {}: {}.{} called with stale handle {} (arg {})",
                            scriptName, NAMESPACE, cb.name(), h, i + 1);
                    return null;
                }
                if (spec.thingType() != null && thing.type() != spec.thingType()) {
                    log.warn("[script] {}: {}.{} called with {} where {} expected (arg {})",
                            scriptName, NAMESPACE, cb.name(), thing.type(), spec.thingType(), i + 1);
                    return null;
                }
                resolved[i] = thing;
            } else {
                resolved[i] = arg.value();
            }
        }

        try {
            cb.invoke(new CallbackArgs(scriptName, resolved));
        } catch (RuntimeException e) {
            log.error("[script] {}: {}.{} failed in native code", scriptName, NAMESPACE, cb.name(), e);
        }
        return null;
    }
}
