package org.foxesworld.manascript.engine;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.manascript.core.ManascriptPlatform;
import org.foxesworld.manascript.core.handle.HandleTable;
import org.foxesworld.manascript.core.net.MessageSender;
import org.foxesworld.manascript.core.thing.Thing;
import org.foxesworld.manascript.core.thing.ThingRegistry;
import org.foxesworld.manascript.engine.item.ItemScripts;
import org.foxesworld.manascript.engine.npc.NpcDialogue;
import org.foxesworld.manascript.script.Script;
import org.foxesworld.manascript.script.ScriptEngines;
import org.foxesworld.manascript.script.ScriptHost;
import org.foxesworld.manascript.script.ScriptSourceProvider;
import org.foxesworld.manascript.script.ScriptingConfig;

import java.io.Closeable;
import java.util.Objects;

/**
 * Server-side scripting facade: wires the handle table to the simulation registry, installs the
 * engine backends and hands out scripts.
 *
 * <pre>
 *   try (ScriptingRuntime rt = new ScriptingRuntime(world, sources, sender, ScriptingConfig.fromSystemProperties())) {
 *       rt.installEngines();
 *       NpcDialogue d = rt.dialogue(npc, "scripts/npcs/guard.js");
 *       d.talk(player);
 *   }
 * </pre>
 */
public final class ScriptingRuntime implements ScriptHost, Closeable {

    private static final Logger log = LogManager.getLogger(ScriptingRuntime.class);

    private final ThingRegistry registry;
    private final HandleTable handles;
    private final ScriptSourceProvider sources;
    private final MessageSender messages;
    private final ScriptingConfig config;
    private final ScriptEngines engines;
    private final ItemScripts items;

    private boolean closed;

    public ScriptingRuntime(ThingRegistry registry, ScriptSourceProvider sources,
                            MessageSender messages, ScriptingConfig config) {
        this(registry, sources, messages, config, new ScriptEngines());
    }

    public ScriptingRuntime(ThingRegistry registry, ScriptSourceProvider sources,
                            MessageSender messages, ScriptingConfig config, ScriptEngines engines) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.sources = Objects.requireNonNull(sources, "sources");
        this.messages = Objects.requireNonNull(messages, "messages");
        this.config = Objects.requireNonNull(config, "config");
        this.engines = Objects.requireNonNull(engines, "engines");

        this.handles = new HandleTable(registry::isAlive);
        registry.addLifecycleListener(handles);
        this.items = new ItemScripts(engines, sources, config);

        log.info("[script] {} scripting runtime, {}", ManascriptPlatform.describe(), config);
    }

    /**
     * Registers every engine backend found on the class path.
     *
     * @throws IllegalStateException if two backends claim the same engine name
     */
    public int installEngines() {
        int n = engines.installProviders(this);
        log.info("[script] {} engine(s) installed: {}", n, engines.names());
        return n;
    }

    /** Loads {@code path} with the default engine; {@code null} on failure. */
    public Script load(String path) {
        return load(config.defaultEngine(), path);
    }

    public Script load(String engineName, String path) {
        ensureOpen();
        return engines.load(engineName, path);
    }

    /** Dialogue of {@code npc} driven by {@code scriptPath}; scriptless if the file does not load. */
    public NpcDialogue dialogue(Thing npc, String scriptPath) {
        Script s = scriptPath == null ? null : load(scriptPath);
        return new NpcDialogue(npc, s);
    }

    @Override public HandleTable handles() { return handles; }
    @Override public ScriptSourceProvider sources() { return sources; }
    @Override public MessageSender messages() { return messages; }
    @Override public ScriptingConfig config() { return config; }

    public ScriptEngines engines() { return engines; }
    public ItemScripts items() { return items; }

    /** Closes item scripts and engines, then invalidates every outstanding handle. */
    @Override
    public void close() {
        if (closed) return;
        closed = true;
        items.close();
        engines.clear();
        registry.removeLifecycleListener(handles);
        handles.clear();
        log.info("[script] scripting runtime closed");
    }

    private void ensureOpen() {
        if (closed) throw new IllegalStateException("ScriptingRuntime is closed");
    }
}
