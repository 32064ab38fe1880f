package org.foxesworld.manascript.engine.npc;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.manascript.core.thing.Thing;
import org.foxesworld.manascript.core.thing.ThingType;
import org.foxesworld.manascript.script.Script;

import java.io.Closeable;
import java.util.Objects;

/**
 * Dialogue of one NPC, driven by the NPC's script:
 * {@code onTalk(npc, player)} when a player starts talking and
 * {@code onChoice(npc, player, choice)} when the player picks an answer.
 *
 * <p>An NPC without a usable script answers nothing; both calls return 0.</p>
 */
public final class NpcDialogue implements Closeable {

    private static final Logger log = LogManager.getLogger(NpcDialogue.class);

    public static final String ON_TALK = "onTalk";
    public static final String ON_CHOICE = "onChoice";

    private final Thing npc;
    private Script script;

    /**
     * @param script owned from now on; {@code null} for a scriptless NPC
     */
    public NpcDialogue(Thing npc, Script script) {
        this.npc = Objects.requireNonNull(npc, "npc");
        if (npc.type() != ThingType.NPC) {
            throw new IllegalArgumentException("Not an NPC: " + npc.type() + " #" + npc.publicId());
        }
        this.script = script;
    }

    public Thing npc() {
        return npc;
    }

    /** False for scriptless NPCs and once the script can no longer run (closed, or its engine shut down). */
    public boolean hasScript() {
        return script != null && script.isUsable();
    }

    public int talk(Thing player) {
        Objects.requireNonNull(player, "player");
        if (!hasScript()) return Script.FAILED_CALL;

        script.prepare(ON_TALK);
        script.push(npc);
        script.push(player);
        return script.execute();
    }

    public int choose(Thing player, int choice) {
        Objects.requireNonNull(player, "player");
        if (!hasScript()) return Script.FAILED_CALL;

        script.prepare(ON_CHOICE);
        script.push(npc);
        script.push(player);
        script.push(choice);
        return script.execute();
    }

    /** Destroys the NPC's script. Safe to call more than once. */
    @Override
    public void close() {
        Script s = script;
        script = null;
        if (s == null || s.isClosed()) return;
        s.close();
        log.debug("[script] dialogue of NPC #{} closed", npc.publicId());
    }
}
