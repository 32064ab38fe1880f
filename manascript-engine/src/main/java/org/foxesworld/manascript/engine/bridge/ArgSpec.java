package org.foxesworld.manascript.engine.bridge;

import org.foxesworld.manascript.core.thing.ThingType;

import java.util.Locale;

/**
 * Expected argument at one position of a callback's shape.
 *
 * @param tag       required tag
 * @param thingType for {@link ArgTag#HANDLE}, the kind the handle must resolve to ({@code null} = any)
 */
public record ArgSpec(ArgTag tag, ThingType thingType) {

    public static ArgSpec integer() { return new ArgSpec(ArgTag.INTEGER, null); }
    public static ArgSpec string() { return new ArgSpec(ArgTag.STRING, null); }
    public static ArgSpec thing() { return new ArgSpec(ArgTag.HANDLE, null); }
    public static ArgSpec npc() { return new ArgSpec(ArgTag.HANDLE, ThingType.NPC); }
    public static ArgSpec character() { return new ArgSpec(ArgTag.HANDLE, ThingType.CHARACTER); }

    @Override
    public String toString() {
        if (tag != ArgTag.HANDLE) return tag.name().toLowerCase(Locale.ROOT);
        return thingType == null ? "thing" : thingType.name().toLowerCase(Locale.ROOT);
    }
}
