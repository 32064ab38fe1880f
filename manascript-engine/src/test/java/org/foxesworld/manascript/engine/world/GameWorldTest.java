package org.foxesworld.manascript.engine.world;

import org.foxesworld.manascript.core.handle.Handle;
import org.foxesworld.manascript.core.handle.HandleTable;
import org.foxesworld.manascript.core.thing.Thing;
import org.foxesworld.manascript.core.thing.ThingLifecycleListener;
import org.foxesworld.manascript.core.thing.ThingType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class GameWorldTest {

    private GameWorld world;

    @BeforeEach
    void setUp() {
        world = new GameWorld();
    }

    @Test
    void spawn_assignsDistinctIds() {
        Being a = world.spawn(ThingType.NPC, "a");
        Being b = world.spawn(ThingType.MONSTER, null);

        assertThat(a.publicId()).isNotEqualTo(b.publicId());
        assertThat(b.name()).isEqualTo("monster");
        assertThat(world.find(a.publicId())).isSameAs(a);
        assertThat(world.size()).isEqualTo(2);
    }

    @Test
    void destroyedId_isReused_butOldObjectStaysDead() {
        Being a = world.spawn(ThingType.NPC, "a");
        world.destroy(a);
        Being b = world.spawn(ThingType.NPC, "b");

        assertThat(b.publicId()).isEqualTo(a.publicId());
        assertThat(world.isAlive(a)).isFalse();
        assertThat(world.isAlive(b)).isTrue();
    }

    @Test
    void listeners_runBeforeIdRelease() {
        Being a = world.spawn(ThingType.CHARACTER, "hero");
        List<Boolean> aliveDuringNotify = new ArrayList<>();
        world.addLifecycleListener(t -> aliveDuringNotify.add(world.find(t.publicId()) == t));

        world.destroy(a);

        assertThat(aliveDuringNotify).containsExactly(true);
        assertThat(world.find(a.publicId())).isNull();
    }

    @Test
    void destroyTwice_notifiesOnce() {
        Being a = world.spawn(ThingType.ITEM, "sword");
        List<Thing> seen = new ArrayList<>();
        world.addLifecycleListener(seen::add);

        world.destroy(a);
        world.destroy(a);

        assertThat(seen).containsExactly(a);
    }

    @Test
    void failingListener_doesNotStopDestruction() {
        Being a = world.spawn(ThingType.NPC, "a");
        List<Thing> seen = new ArrayList<>();
        world.addLifecycleListener(t -> { throw new IllegalStateException("listener bug"); });
        world.addLifecycleListener(seen::add);

        world.destroy(a);

        assertThat(seen).containsExactly(a);
        assertThat(world.isAlive(a)).isFalse();
    }

    @Test
    void handleTable_isInvalidatedSynchronously() {
        HandleTable handles = new HandleTable(world::isAlive);
        world.addLifecycleListener(handles);
        Being a = world.spawn(ThingType.NPC, "a");
        Handle h = handles.mint(a);

        world.destroy(a);

        assertThat(handles.resolve(h)).isNull();
        assertThat(handles.mint(a)).isEqualTo(Handle.INVALID);
    }

    @Test
    void removedListener_isNotNotified() {
        Being a = world.spawn(ThingType.NPC, "a");
        List<Thing> seen = new ArrayList<>();
        ThingLifecycleListener l = seen::add;
        world.addLifecycleListener(l);
        world.removeLifecycleListener(l);

        world.destroy(a);

        assertThat(seen).isEmpty();
    }
}
