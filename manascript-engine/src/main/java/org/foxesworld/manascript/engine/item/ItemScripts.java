package org.foxesworld.manascript.engine.item;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.manascript.script.Script;
import org.foxesworld.manascript.script.ScriptEngines;
import org.foxesworld.manascript.script.ScriptSourceProvider;
import org.foxesworld.manascript.script.ScriptingConfig;

import java.io.Closeable;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Scripts attached to item types, one per item id: {@code <itemScriptDir><id>.<ext>}.
 *
 * <p>Items without a script file simply have none. The table owns every script it loaded and
 * closes them in {@link #close()}.</p>
 */
public final class ItemScripts implements Closeable {

    private static final Logger log = LogManager.getLogger(ItemScripts.class);

    private final ScriptEngines engines;
    private final ScriptSourceProvider sources;
    private final ScriptingConfig config;

    private final Map<Integer, Script> scripts = new LinkedHashMap<>();

    public ItemScripts(ScriptEngines engines, ScriptSourceProvider sources, ScriptingConfig config) {
        this.engines = Objects.requireNonNull(engines, "engines");
        this.sources = Objects.requireNonNull(sources, "sources");
        this.config = Objects.requireNonNull(config, "config");
    }

    /** Resource path of the script for {@code itemId}, or {@code null} if the engine is unknown. */
    public String pathOf(int itemId) {
        String ext = engines.fileExtension(config.defaultEngine());
        if (ext == null) return null;
        return config.itemScriptDir() + itemId + "." + ext;
    }

    /**
     * Loads the script of {@code itemId} if its file exists. Calling it again for the same id returns
     * the already loaded script.
     *
     * @return the item's script, or {@code null} when it has none or it failed to load
     */
    public synchronized Script load(int itemId) {
        Script loaded = scripts.get(itemId);
        if (loaded != null) return loaded;

        String path = pathOf(itemId);
        if (path == null) {
            log.warn("[script] item {}: engine '{}' is not registered", itemId, config.defaultEngine());
            return null;
        }
        if (!exists(path)) return null;

        log.info("[script] Loading item script: {}", path);
        Script s = engines.load(config.defaultEngine(), path);
        if (s != null) scripts.put(itemId, s);
        return s;
    }

    /** Script of {@code itemId} if one was loaded. */
    public synchronized Script get(int itemId) {
        return scripts.get(itemId);
    }

    public synchronized int size() {
        return scripts.size();
    }

    /** Closes every owned script. */
    @Override
    public synchronized void close() {
        for (Map.Entry<Integer, Script> e : scripts.entrySet()) {
            Script s = e.getValue();
            if (s.isClosed()) continue;
            try {
                s.close();
            } catch (RuntimeException ex) {
                log.warn("[script] item {}: close failed", e.getKey(), ex);
            }
        }
        scripts.clear();
    }

    private boolean exists(String path) {
        try {
            return sources.exists(path);
        } catch (RuntimeException e) {
            log.warn("[script] cannot probe {}: {}", path, e.getMessage());
            return false;
        }
    }
}
