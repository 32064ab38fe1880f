package org.foxesworld.manascript.script;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Scripting settings. Read from system properties with {@link #fromSystemProperties()}; every key is
 * optional.
 *
 * <ul>
 *   <li>{@code manascript.defaultEngine} engine used for item and NPC scripts (default {@code js})</li>
 *   <li>{@code manascript.statementLimit} statements one {@code execute()} may run, 0 disables (default 1000000)</li>
 *   <li>{@code manascript.itemScriptDir} directory of item scripts (default {@code scripts/items/})</li>
 *   <li>{@code manascript.sourceCacheSize} parsed sources kept in memory (default 512)</li>
 * </ul>
 */
public final class ScriptingConfig {

    private static final Logger log = LogManager.getLogger(ScriptingConfig.class);

    public static final String PREFIX = "manascript.";

    public static final String DEFAULT_ENGINE = "js";
    public static final long DEFAULT_STATEMENT_LIMIT = 1_000_000L;
    public static final String DEFAULT_ITEM_SCRIPT_DIR = "scripts/items/";
    public static final int DEFAULT_SOURCE_CACHE_SIZE = 512;

    private final String defaultEngine;
    private final long statementLimit;
    private final String itemScriptDir;
    private final int sourceCacheSize;

    private ScriptingConfig(String defaultEngine, long statementLimit, String itemScriptDir, int sourceCacheSize) {
        this.defaultEngine = Objects.requireNonNull(defaultEngine, "defaultEngine");
        this.statementLimit = Math.max(0L, statementLimit);
        this.itemScriptDir = normalizeDir(itemScriptDir);
        this.sourceCacheSize = Math.max(0, sourceCacheSize);
    }

    public static ScriptingConfig defaults() {
        return new ScriptingConfig(DEFAULT_ENGINE, DEFAULT_STATEMENT_LIMIT, DEFAULT_ITEM_SCRIPT_DIR, DEFAULT_SOURCE_CACHE_SIZE);
    }

    public static ScriptingConfig fromSystemProperties() {
        String engine = System.getProperty(PREFIX + "defaultEngine", DEFAULT_ENGINE).trim();
        if (engine.isEmpty()) engine = DEFAULT_ENGINE;

        return new ScriptingConfig(
                engine,
                longProperty("statementLimit", DEFAULT_STATEMENT_LIMIT),
                System.getProperty(PREFIX + "itemScriptDir", DEFAULT_ITEM_SCRIPT_DIR),
                (int) longProperty("sourceCacheSize", DEFAULT_SOURCE_CACHE_SIZE));
    }

    public String defaultEngine() { return defaultEngine; }
    public long statementLimit() { return statementLimit; }
    public String itemScriptDir() { return itemScriptDir; }
    public int sourceCacheSize() { return sourceCacheSize; }

    public ScriptingConfig withDefaultEngine(String engine) {
        return new ScriptingConfig(engine, statementLimit, itemScriptDir, sourceCacheSize);
    }

    public ScriptingConfig withStatementLimit(long limit) {
        return new ScriptingConfig(defaultEngine, limit, itemScriptDir, sourceCacheSize);
    }

    public ScriptingConfig withItemScriptDir(String dir) {
        return new ScriptingConfig(defaultEngine, statementLimit, dir, sourceCacheSize);
    }

    public ScriptingConfig withSourceCacheSize(int size) {
        return new ScriptingConfig(defaultEngine, statementLimit, itemScriptDir, size);
    }

    private static long longProperty(String key, long def) {
        String raw = System.getProperty(PREFIX + key);
        if (raw == null || raw.isBlank()) return def;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring malformed {}{}='{}', using {}", PREFIX, key, raw, def);
            return def;
        }
    }

    private static String normalizeDir(String dir) {
        if (dir == null || dir.isBlank()) return DEFAULT_ITEM_SCRIPT_DIR;
        String s = dir.trim().replace('\\', '/');
        while (s.startsWith("./")) s = s.substring(2);
        return s.endsWith("/") ? s : s + "/";
    }

    @Override
    public String toString() {
        return "ScriptingConfig{engine=" + defaultEngine
                + ", statementLimit=" + statementLimit
                + ", itemScriptDir=" + itemScriptDir
                + ", sourceCacheSize=" + sourceCacheSize + '}';
    }
}
