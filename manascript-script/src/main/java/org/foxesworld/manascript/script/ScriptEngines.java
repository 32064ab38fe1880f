package org.foxesworld.manascript.script;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.Set;

/**
 * Registry of script engines: engine name to loader.
 *
 * <p>Backends are registered once at startup, before the first {@link #load(String, String)};
 * entries are never removed in normal operation. {@link #global()} is the process-wide instance,
 * tests may create their own or {@link #clear()} it.</p>
 */
public final class ScriptEngines {

    private static final Logger log = LogManager.getLogger(ScriptEngines.class);

    private static final ScriptEngines GLOBAL = new ScriptEngines();

    private record Registration(ScriptLoader loader, String extension) {}

    private final Map<String, Registration> engines = new LinkedHashMap<>();

    public static ScriptEngines global() {
        return GLOBAL;
    }

    /**
     * @throws IllegalStateException if {@code engineName} is already registered; the first
     *                               registration stays active
     */
    public void register(String engineName, ScriptLoader loader) {
        register(engineName, engineName, loader);
    }

    public synchronized void register(String engineName, String fileExtension, ScriptLoader loader) {
        Objects.requireNonNull(engineName, "engineName");
        Objects.requireNonNull(loader, "loader");
        String key = engineName.trim();
        if (key.isEmpty()) throw new IllegalArgumentException("engineName is blank");

        if (engines.containsKey(key)) {
            throw new IllegalStateException("Duplicate script engine: " + key);
        }
        String ext = (fileExtension == null || fileExtension.isBlank()) ? key : fileExtension.trim();
        engines.put(key, new Registration(loader, ext));
        log.info("[script] engine registered: {} (*.{})", key, ext);
    }

    /**
     * Registers every {@link ScriptEngineProvider} found on the class path.
     *
     * @return number of engines registered
     * @throws IllegalStateException on a duplicate engine name
     */
    public int installProviders(ScriptHost host) {
        return installProviders(host, ServiceLoader.load(ScriptEngineProvider.class));
    }

    public int installProviders(ScriptHost host, Iterable<ScriptEngineProvider> providers) {
        Objects.requireNonNull(host, "host");
        int n = 0;
        for (ScriptEngineProvider p : providers) {
            String name = Objects.requireNonNull(p.engineName(), "provider.engineName()");
            if (isRegistered(name)) {
                throw new IllegalStateException("Duplicate script engine: " + name
                        + " (provider " + p.getClass().getName() + ")");
            }
            register(name, p.fileExtension(), p.createLoader(host));
            n++;
        }
        return n;
    }

    /**
     * Loads {@code path} with the named engine.
     *
     * @return a live script, or {@code null} if the engine is unknown or the file cannot be loaded
     *         (the cause is logged)
     */
    public Script load(String engineName, String path) {
        Registration reg;
        synchronized (this) {
            reg = engineName == null ? null : engines.get(engineName.trim());
        }
        if (reg == null) {
            log.error("[script] unknown engine '{}' for {}", engineName, path);
            return null;
        }

        try {
            Script script = reg.loader().load(path);
            if (script == null) {
                log.error("[script] engine '{}' produced no script for {}", engineName, path);
            }
            return script;
        } catch (ScriptLoadException e) {
            log.error("[script] failed to load {} ({}): {}", path, engineName, e.getMessage());
            return null;
        } catch (RuntimeException e) {
            log.error("[script] engine '{}' crashed while loading {}", engineName, path, e);
            return null;
        }
    }

    public synchronized boolean isRegistered(String engineName) {
        return engineName != null && engines.containsKey(engineName.trim());
    }

    /** File extension used by the engine's scripts, or {@code null} for unknown engines. */
    public synchronized String fileExtension(String engineName) {
        Registration reg = engineName == null ? null : engines.get(engineName.trim());
        return reg == null ? null : reg.extension();
    }

    public synchronized Set<String> names() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(engines.keySet()));
    }

    /**
     * Drops every registration and closes loaders that hold resources. Only for shutdown and tests.
     */
    public synchronized void clear() {
        for (Map.Entry<String, Registration> e : engines.entrySet()) {
            if (e.getValue().loader() instanceof Closeable c) {
                try {
                    c.close();
                } catch (IOException | RuntimeException ex) {
                    log.warn("[script] failed to close engine '{}'", e.getKey(), ex);
                }
            }
        }
        engines.clear();
    }
}
