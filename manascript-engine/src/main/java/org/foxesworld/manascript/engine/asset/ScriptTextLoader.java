package org.foxesworld.manascript.engine.asset;

import com.jme3.asset.AssetInfo;
import com.jme3.asset.AssetLoader;
import org.foxesworld.manascript.core.io.ScriptTextParser;

import java.io.IOException;

/**
 * jME asset loader for script files: the whole file, decoded as UTF-8 text.
 */
public final class ScriptTextLoader implements AssetLoader {

    private final ScriptTextParser parser = new ScriptTextParser();

    @Override
    public Object load(AssetInfo assetInfo) throws IOException {
        if (assetInfo == null) throw new IllegalArgumentException("AssetInfo is null");
        return parser.parse(assetInfo.openStream());
    }
}
