package ai.lspgateway.instance;

import static org.junit.jupiter.api.Assertions.*;

import ai.lspgateway.config.ServerDescriptor;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class ServerInstanceTest {
    private static final ServerDescriptor TYPESCRIPT = new ServerDescriptor(
            "typescript",
            "typescript-language-server",
            "typescript-language-server",
            List.of("--stdio"),
            Set.of("javascript"));

    private static ServerInstance instance() {
        return new ServerInstance(InstanceIds.next("typescript"), TYPESCRIPT, "typescript", Path.of("/work/a"));
    }

    @Test
    void happyPathReachesTerminated() {
        var instance = instance();
        assertEquals(ServerState.STARTING, instance.state());

        assertTrue(instance.transition(ServerState.STARTING, ServerState.INITIALIZING));
        assertTrue(instance.transition(ServerState.INITIALIZING, ServerState.READY));
        assertTrue(instance.transition(ServerState.READY, ServerState.DRAINING));
        assertTrue(instance.transition(ServerState.DRAINING, ServerState.TERMINATED));
        assertTrue(instance.state().isTerminal());
    }

    @Test
    void illegalTransitionsAreRefused() {
        var instance = instance();

        assertFalse(instance.transition(ServerState.STARTING, ServerState.READY));
        assertFalse(instance.transition(ServerState.INITIALIZING, ServerState.READY), "not in INITIALIZING");
        assertEquals(ServerState.STARTING, instance.state());

        assertFalse(ServerState.READY.canTransitionTo(ServerState.STARTING));
        assertFalse(ServerState.TERMINATED.canTransitionTo(ServerState.FAILED));
        assertFalse(ServerState.FAILED.canTransitionTo(ServerState.STARTING));
    }

    @Test
    void anyLiveStateCanFail() {
        for (var state : ServerState.values()) {
            assertEquals(!state.isTerminal(), state.canTransitionTo(ServerState.FAILED), state.name());
        }
    }

    @Test
    void failReportsPreviousStateOnce() {
        var instance = instance();
        instance.transition(ServerState.STARTING, ServerState.INITIALIZING);

        assertEquals(ServerState.INITIALIZING, instance.fail("handshake timed out"));
        assertNull(instance.fail("again"));
        assertEquals(ServerState.FAILED, instance.state());
        assertFalse(instance.transition(ServerState.FAILED, ServerState.TERMINATED));
    }

    @Test
    void racingTransitionsHaveOneWinner() throws Exception {
        var instance = instance();
        instance.transition(ServerState.STARTING, ServerState.INITIALIZING);
        instance.transition(ServerState.INITIALIZING, ServerState.READY);

        var start = new CountDownLatch(1);
        var winners = new AtomicInteger();
        var threads = new ArrayList<Thread>();
        for (int i = 0; i < 8; i++) {
            var t = new Thread(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                if (instance.transition(ServerState.READY, ServerState.DRAINING)) {
                    winners.incrementAndGet();
                }
            });
            t.start();
            threads.add(t);
        }
        start.countDown();
        for (var t : threads) {
            t.join();
        }

        assertEquals(1, winners.get());
        assertEquals(ServerState.DRAINING, instance.state());
    }

    @Test
    void onlyFirstTeardownProceeds() {
        var instance = instance();

        assertTrue(instance.beginTeardown());
        assertFalse(instance.beginTeardown());
        assertFalse(instance.terminated().isDone());
    }

    @Test
    void labelsAreLowerCase() {
        assertEquals("ready", ServerState.READY.label());
        assertEquals("initializing", ServerState.INITIALIZING.label());
    }

    @Test
    void idsAreUniqueAndOrdered() {
        var ids = new ArrayList<String>();
        for (int i = 0; i < 200; i++) {
            ids.add(InstanceIds.next("python"));
        }

        assertEquals(200, new HashSet<>(ids).size());
        for (int i = 1; i < ids.size(); i++) {
            long previous = Long.parseLong(ids.get(i - 1).substring("python-".length()));
            long current = Long.parseLong(ids.get(i).substring("python-".length()));
            assertTrue(current > previous);
        }
        assertTrue(ids.get(0).matches("python-\\d+"));
    }
}
