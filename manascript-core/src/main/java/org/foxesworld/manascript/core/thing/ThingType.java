package org.foxesworld.manascript.core.thing;

/**
 * Kind of simulation object. Callbacks use it to reject handles that resolve to the wrong kind
 * (e.g. a character passed where an NPC is expected).
 */
public enum ThingType {
    NPC,
    CHARACTER,
    MONSTER,
    ITEM,
    OTHER
}
