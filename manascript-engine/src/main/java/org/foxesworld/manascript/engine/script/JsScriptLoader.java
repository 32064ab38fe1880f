package org.foxesworld.manascript.engine.script;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.manascript.core.handle.HandleTable;
import org.foxesworld.manascript.engine.bridge.CallbackBridge;
import org.foxesworld.manascript.engine.script.cache.ScriptCaches;
import org.foxesworld.manascript.script.Script;
import org.foxesworld.manascript.script.ScriptHost;
import org.foxesworld.manascript.script.ScriptLoadException;
import org.foxesworld.manascript.script.ScriptLoader;
import org.foxesworld.manascript.script.ScriptSourceProvider;
import org.foxesworld.manascript.script.ScriptingConfig;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.Engine;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.ResourceLimits;
import org.graalvm.polyglot.Source;

import java.io.Closeable;
import java.io.IOException;
import java.util.Objects;

/**
 * Loads JavaScript files into {@link JsScript} instances.
 *
 * <p>All contexts share one polyglot {@link Engine} and a {@link ScriptCaches} source cache.
 * Security: host class lookup is disabled and host access is limited to members annotated with
 * {@link HostAccess.Export}.</p>
 */
public final class JsScriptLoader implements ScriptLoader, Closeable {

    private static final Logger log = LogManager.getLogger(JsScriptLoader.class);

    private static final HostAccess HOST_ACCESS = HostAccess.newBuilder(HostAccess.NONE)
            .allowAccessAnnotatedBy(HostAccess.Export.class)
            .build();

    private final ScriptSourceProvider sources;
    private final HandleTable handles;
    private final CallbackBridge bridge;
    private final ScriptCaches caches;
    private final ResourceLimits limits;
    private final Engine engine;

    private volatile boolean closed;

    public JsScriptLoader(ScriptHost host) {
        this(host.sources(), host.handles(),
                CallbackBridge.standard(host.handles(), host.messages()), host.config());
    }

    public JsScriptLoader(ScriptSourceProvider sources, HandleTable handles, CallbackBridge bridge, ScriptingConfig config) {
        this.sources = Objects.requireNonNull(sources, "sources");
        this.handles = Objects.requireNonNull(handles, "handles");
        this.bridge = Objects.requireNonNull(bridge, "bridge");
        Objects.requireNonNull(config, "config");

        this.caches = ScriptCaches.bounded(config.sourceCacheSize());
        this.limits = config.statementLimit() > 0 ? statementLimit(config.statementLimit()) : null;
        this.engine = Engine.newBuilder()
                .option("engine.WarnInterpreterOnly", "false")
                .build();

        log.debug("[script] js loader ready: statementLimit={}, sourceCache={}",
                config.statementLimit(), config.sourceCacheSize());
    }

    @Override
    public Script load(String path) throws ScriptLoadException {
        if (closed) throw new IllegalStateException("JsScriptLoader is closed");
        if (path == null || path.isBlank()) throw new ScriptLoadException(path, "empty script path");

        String text;
        try {
            text = sources.loadText(path);
        } catch (IOException e) {
            throw new ScriptLoadException(path, "cannot read script: " + e.getMessage(), e);
        }
        if (text == null) {
            throw new ScriptLoadException(path, "script not found");
        }

        Source source = caches.source(path, text,
                key -> Source.newBuilder(JsScript.LANGUAGE, text, path).buildLiteral());

        Context ctx = newContext();
        try {
            JsSyntaxVerifier.verify(ctx, source);
            JsScript script = new JsScript(path, ctx, source, handles, bridge.namespace(path), limits != null,
                    () -> !closed);
            log.info("[script] Successfully loaded script {}", path);
            return script;
        } catch (ScriptLoadException | RuntimeException e) {
            closeQuietly(ctx, path);
            throw e;
        }
    }

    /** Forgets cached sources of {@code path}; the next load re-reads the file. */
    public void invalidate(String path) {
        caches.invalidate(path);
    }

    ScriptCaches caches() {
        return caches;
    }

    /** Closes the shared engine and every context still open on it. */
    @Override
    public void close() {
        if (closed) return;
        closed = true;
        caches.invalidateAll();
        try {
            engine.close();
        } catch (PolyglotException | IllegalStateException e) {
            log.warn("[script] js engine close failed: {}", e.getMessage());
        }
    }

    private Context newContext() {
        Context.Builder b = Context.newBuilder(JsScript.LANGUAGE)
                .engine(engine)
                .allowHostAccess(HOST_ACCESS)
                .allowHostClassLookup(className -> false)
                .allowAllAccess(false);
        if (limits != null) b.resourceLimits(limits);
        return b.build();
    }

    private static ResourceLimits statementLimit(long limit) {
        return ResourceLimits.newBuilder()
                .statementLimit(limit, null)
                .onLimit(event -> log.warn("[script] statement limit of {} reached, cancelling call", limit))
                .build();
    }

    private static void closeQuietly(Context ctx, String path) {
        try {
            ctx.close();
        } catch (PolyglotException | IllegalStateException e) {
            log.warn("[script] {}: context close after failed load: {}", path, e.getMessage());
        }
    }
}
