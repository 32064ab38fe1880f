package org.foxesworld.manascript.engine.world;

import org.foxesworld.manascript.core.thing.Thing;
import org.foxesworld.manascript.core.thing.ThingType;

/** Simulation object owned by a {@link GameWorld}. Identity-compared. */
public final class Being implements Thing {

    private final ThingType type;
    private final int publicId;
    private final String name;

    Being(ThingType type, int publicId, String name) {
        this.type = type;
        this.publicId = publicId;
        this.name = name;
    }

    @Override public ThingType type() { return type; }
    @Override public int publicId() { return publicId; }

    public String name() { return name; }

    @Override
    public String toString() {
        return type + "#" + publicId + "(" + name + ")";
    }
}
