package org.foxesworld.manascript.engine.script.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.graalvm.polyglot.Source;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;

/**
 * Parsed-source cache shared by every interpreter instance of one engine.
 *
 * <p>Item and NPC types often point many owners at the same file; reusing the {@link Source}
 * lets the shared polyglot engine reuse its parsed code. Keys include a hash of the text, so an
 * edited file is never served stale.</p>
 */
public final class ScriptCaches {

    private static final long FNV_OFFSET = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    private final Cache<SourceKey, Source> sources;

    private ScriptCaches(Cache<SourceKey, Source> sources) {
        this.sources = Objects.requireNonNull(sources, "sources");
    }

    /**
     * @param maximumSize 0 disables caching
     */
    public static ScriptCaches bounded(int maximumSize) {
        return new ScriptCaches(Caffeine.newBuilder()
                .maximumSize(Math.max(0, maximumSize))
                .expireAfterAccess(Duration.ofMinutes(30))
                .build());
    }

    public Source source(String path, String text, Function<SourceKey, Source> builder) {
        return sources.get(SourceKey.of(path, text), builder);
    }

    public long estimatedSize() {
        return sources.estimatedSize();
    }

    /** Drops every cached source of {@code path}. */
    public void invalidate(String path) {
        if (path == null) return;
        sources.asMap().keySet().removeIf(k -> path.equals(k.path()));
    }

    public void invalidateAll() {
        sources.invalidateAll();
    }

    /** Script path plus a 64-bit FNV-1a hash of its text. */
    public record SourceKey(String path, long contentHash) {

        public static SourceKey of(String path, String content) {
            return new SourceKey(Objects.requireNonNull(path, "path"), fnv1a64(content));
        }

        @Override
        public String toString() {
            return path + "@" + Long.toHexString(contentHash);
        }
    }

    private static long fnv1a64(String s) {
        if (s == null) return 0L;
        long h = FNV_OFFSET;
        for (int i = 0, n = s.length(); i < n; i++) {
            h = (h ^ s.charAt(i)) * FNV_PRIME;
        }
        return h;
    }
}
