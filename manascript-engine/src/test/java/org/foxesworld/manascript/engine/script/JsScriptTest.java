package org.foxesworld.manascript.engine.script;

import org.foxesworld.manascript.core.handle.HandleTable;
import org.foxesworld.manascript.core.net.MessageOut;
import org.foxesworld.manascript.core.net.MessageSender;
import org.foxesworld.manascript.core.net.ProtocolMessages;
import org.foxesworld.manascript.core.thing.ThingType;
import org.foxesworld.manascript.engine.InMemorySources;
import org.foxesworld.manascript.engine.bridge.ArgSpec;
import org.foxesworld.manascript.engine.bridge.CallbackArgs;
import org.foxesworld.manascript.engine.bridge.CallbackBridge;
import org.foxesworld.manascript.engine.bridge.NativeCallback;
import org.foxesworld.manascript.engine.world.Being;
import org.foxesworld.manascript.engine.world.GameWorld;
import org.foxesworld.manascript.script.Script;
import org.foxesworld.manascript.script.ScriptLoadException;
import org.foxesworld.manascript.script.ScriptingConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class JsScriptTest {

    private static final String PATH = "scripts/npcs/guard.js";

    @Mock
    private MessageSender sender;

    private GameWorld world;
    private HandleTable handles;
    private InMemorySources sources;
    private JsScriptLoader loader;

    private Being npc;
    private Being player;

    @BeforeEach
    void setUp() {
        world = new GameWorld();
        handles = new HandleTable(world::isAlive);
        world.addLifecycleListener(handles);
        sources = new InMemorySources();
        loader = new JsScriptLoader(sources, handles, CallbackBridge.standard(handles, sender),
                ScriptingConfig.defaults().withStatementLimit(100_000));

        npc = world.spawn(ThingType.NPC, "guard");
        player = world.spawn(ThingType.CHARACTER, "hero");
    }

    @AfterEach
    void tearDown() {
        loader.close();
    }

    private Script load(String code) throws ScriptLoadException {
        sources.put(PATH, code);
        return loader.load(PATH);
    }

    private int talk(Script s) {
        s.prepare("onTalk");
        s.push(npc);
        s.push(player);
        return s.execute();
    }

    @Test
    void onTalk_returnsScriptResult() throws Exception {
        Script s = load("function onTalk(npc, player) { return 1; }");

        assertThat(talk(s)).isEqualTo(1);
        assertThat(s.isCallInProgress()).isFalse();
        s.close();
    }

    @Test
    void undefinedFunction_failsWithZero() throws Exception {
        Script s = load("function onChoice(npc, player, choice) { return choice; }");

        assertThat(talk(s)).isZero();
        assertThat(s.isCallInProgress()).isFalse();
        s.close();
    }

    @Test
    void destroyedNpc_callbackAborts_callStillReturnsScriptValue() throws Exception {
        Script s = load("""
                function onTalk(npc, player) {
                    mana.msg_npc_message(npc, player, "hello");
                    return 7;
                }
                """);

        world.destroy(npc);

        assertThat(talk(s)).isEqualTo(7);
        verifyNoInteractions(sender);
        s.close();
    }

    @Test
    void npcMessage_isSentToCharacter() throws Exception {
        Script s = load("""
                function onTalk(npc, player) {
                    mana.msg_npc_message(npc, player, "hi");
                    return 1;
                }
                """);

        assertThat(talk(s)).isEqualTo(1);

        ArgumentCaptor<MessageOut> msg = ArgumentCaptor.forClass(MessageOut.class);
        verify(sender).sendTo(same(player), msg.capture());
        MessageOut expected = new MessageOut(ProtocolMessages.GPMSG_NPC_MESSAGE)
                .writeShort(npc.publicId())
                .writeString("hi");
        assertThat(msg.getValue().toByteArray()).isEqualTo(expected.toByteArray());
        s.close();
    }

    @Test
    void storedHandle_goesStaleAfterDestroy() throws Exception {
        Script s = load("""
                var remembered = null;
                function onTalk(npc, player) { remembered = npc; return 1; }
                function later(player) {
                    mana.msg_npc_choice(remembered, player, "again?");
                    return 2;
                }
                """);
        assertThat(talk(s)).isEqualTo(1);

        s.prepare("later");
        s.push(player);
        assertThat(s.execute()).isEqualTo(2);
        verify(sender).sendTo(same(player), any(MessageOut.class));

        world.destroy(npc);
        Being replacement = world.spawn(ThingType.NPC, "replacement");
        handles.mint(replacement);

        s.prepare("later");
        s.push(player);
        assertThat(s.execute()).isEqualTo(2);
        verify(sender).sendTo(same(player), any(MessageOut.class));
        s.close();
    }

    @Test
    void handleIsOpaque() throws Exception {
        Script s = load("""
                function onTalk(npc, player) {
                    return (npc.slot === undefined && npc.publicId === undefined) ? 1 : 2;
                }
                """);

        assertThat(talk(s)).isEqualTo(1);
        s.close();
    }

    @Test
    void nonNumericResult_failsWithZero() throws Exception {
        Script s = load("function onTalk(npc, player) { return 'yes'; }");

        assertThat(talk(s)).isZero();
        s.close();
    }

    @Test
    void fractionalResult_isTruncated() throws Exception {
        Script s = load("function onTalk(npc, player) { return 3.75; }");

        assertThat(talk(s)).isEqualTo(3);
        s.close();
    }

    @Test
    void runtimeError_failsCall_scriptStaysUsable() throws Exception {
        Script s = load("""
                function onTalk(npc, player) { throw new Error('boom'); }
                function onChoice(npc, player, choice) { return choice + 1; }
                """);

        assertThat(talk(s)).isZero();
        assertThat(((JsScript) s).isUsable()).isTrue();

        s.prepare("onChoice");
        s.push(npc);
        s.push(player);
        s.push(4);
        assertThat(s.execute()).isEqualTo(5);
        s.close();
    }

    @Test
    void topLevelError_leavesScriptUnusable() throws Exception {
        Script s = load("""
                function onTalk(npc, player) { return 1; }
                undefinedThing.explode();
                """);

        assertThat(s).isNotNull();
        assertThat(((JsScript) s).isUsable()).isFalse();
        assertThat(talk(s)).isZero();
        s.close();
    }

    @Test
    void endlessLoop_isCutByStatementLimit() throws Exception {
        Script s = load("""
                function onTalk(npc, player) { while (true) {} }
                function onChoice(npc, player, choice) { return 1; }
                """);

        assertThat(talk(s)).isZero();
        assertThat(s.isCallInProgress()).isFalse();
        assertThat(((JsScript) s).isUsable()).isFalse();

        s.prepare("onChoice");
        s.push(npc);
        s.push(player);
        s.push(1);
        assertThat(s.execute()).isZero();
        s.close();
    }

    @Test
    void statementBudget_isPerCall() throws Exception {
        Script s = load("""
                function onChoice(npc, player, n) {
                    var sum = 0;
                    for (var i = 0; i < n; i++) { sum += 1; }
                    return sum > 0 ? 1 : 0;
                }
                """);

        for (int round = 0; round < 5; round++) {
            s.prepare("onChoice");
            s.push(npc);
            s.push(player);
            s.push(10_000);
            assertThat(s.execute()).as("round %d", round).isEqualTo(1);
        }
        s.close();
    }

    @Test
    void scriptLogCallbacks_acceptStringsOnly() throws Exception {
        Script s = load("""
                function onTalk(npc, player) {
                    mana.log_info('talking');
                    mana.log_warn(npc);
                    return 1;
                }
                """);

        assertThat(talk(s)).isEqualTo(1);
        s.close();
    }

    @Test
    void scriptClosedFromCallback_finishesCurrentCall() throws Exception {
        AtomicReference<Script> self = new AtomicReference<>();
        NativeCallback despawn = new NativeCallback() {
            @Override public String name() { return "despawn"; }
            @Override public List<ArgSpec> shape() { return List.of(ArgSpec.npc()); }
            @Override public void invoke(CallbackArgs args) {
                world.destroy(args.thing(0));
                self.get().close();
            }
        };
        sources.put(PATH, """
                function onTalk(npc, player) {
                    mana.despawn(npc);
                    mana.despawn(npc);
                    return 9;
                }
                """);

        try (JsScriptLoader own = new JsScriptLoader(sources, handles,
                new CallbackBridge(handles, List.of(despawn)), ScriptingConfig.defaults())) {
            Script s = own.load(PATH);
            self.set(s);

            assertThat(talk(s)).isEqualTo(9);
            assertThat(s.isClosed()).isTrue();
            assertThat(world.isAlive(npc)).isFalse();
        }
    }
}
