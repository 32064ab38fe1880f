package org.foxesworld.manascript.engine.asset;

import com.jme3.asset.AssetKey;
import com.jme3.asset.AssetLoadException;
import com.jme3.asset.AssetManager;
import com.jme3.asset.AssetNotFoundException;
import com.jme3.asset.DesktopAssetManager;
import com.jme3.asset.plugins.FileLocator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.manascript.script.ScriptSourceProvider;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Resolves script paths through a jME {@link AssetManager}.
 *
 * <p>Texts are not kept in the asset cache: every load reads the current file, so edited scripts
 * are picked up by the next load.</p>
 */
public final class AssetScriptSourceProvider implements ScriptSourceProvider {

    private static final Logger log = LogManager.getLogger(AssetScriptSourceProvider.class);

    /** Extensions handled by {@link ScriptTextLoader} in managers built here. */
    public static final String[] SCRIPT_EXTENSIONS = {"js"};

    private final AssetManager assets;

    public AssetScriptSourceProvider(AssetManager assets) {
        this.assets = Objects.requireNonNull(assets, "assets");
    }

    /** Asset manager reading scripts below {@code root} on disk. */
    public static AssetScriptSourceProvider directory(Path root) {
        DesktopAssetManager am = new DesktopAssetManager(false);
        am.registerLocator(root.toAbsolutePath().normalize().toString(), FileLocator.class);
        am.registerLoader(ScriptTextLoader.class, SCRIPT_EXTENSIONS);
        return new AssetScriptSourceProvider(am);
    }

    public AssetManager assets() {
        return assets;
    }

    @Override
    public boolean exists(String path) {
        if (path == null || path.isBlank()) return false;
        return assets.locateAsset(new AssetKey<>(path)) != null;
    }

    @Override
    public String loadText(String path) throws IOException {
        AssetKey<Object> key = new AssetKey<>(path);
        if (assets.locateAsset(key) == null) {
            return null;
        }
        try {
            Object text = assets.loadAsset(key);
            if (!(text instanceof String)) {
                throw new IOException("Asset " + path + " is not a script text (got "
                        + (text == null ? "null" : text.getClass().getSimpleName()) + ")");
            }
            return (String) text;
        } catch (AssetNotFoundException e) {
            return null;
        } catch (AssetLoadException e) {
            log.debug("Script asset {} failed to load", path, e);
            throw new IOException("Cannot load " + path + ": " + e.getMessage(), e);
        } finally {
            assets.deleteFromCache(key);
        }
    }
}
