package info.mouts.orderpipeline.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import info.mouts.orderpipeline.exception.ClientNotificationException;

public class ConnectionRegistryTest {
    private ConnectionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ConnectionRegistry();
    }

    private ClientConnection connection(String id) {
        ClientConnection connection = mock(ClientConnection.class);
        when(connection.getId()).thenReturn(id);
        return connection;
    }

    @Test
    @DisplayName("Should deliver a message to the registered connection")
    void send_registered_shouldDeliver() throws Exception {
        ClientConnection pizza = connection("s1");
        registry.register("pizza", pizza);

        assertTrue(registry.send("pizza", "hello"));

        verify(pizza).send("hello");
        assertEquals(1, registry.size());
    }

    @Test
    @DisplayName("Sending to an unknown client should be a no-op")
    void send_unknownClient_shouldReturnFalse() {
        assertFalse(registry.send("ghost", "hello"));
    }

    @Test
    @DisplayName("Registering again should replace the previous connection")
    void register_twice_shouldReplace() throws Exception {
        ClientConnection first = connection("s1");
        ClientConnection second = connection("s2");

        assertTrue(registry.register("pizza", first).isEmpty());
        assertSame(first, registry.register("pizza", second).orElseThrow());

        registry.send("pizza", "hello");

        verify(second).send("hello");
        verify(first, never()).send(anyString());
    }

    @Test
    @DisplayName("Unregister should only remove the connection it was given")
    void unregister_staleConnection_shouldKeepNewer() {
        ClientConnection first = connection("s1");
        ClientConnection second = connection("s2");
        registry.register("pizza", first);
        registry.register("pizza", second);

        assertFalse(registry.unregister("pizza", first));
        assertSame(second, registry.lookup("pizza").orElseThrow());

        assertTrue(registry.unregister("pizza", second));
        assertTrue(registry.lookup("pizza").isEmpty());
    }

    @Test
    @DisplayName("Write failures should surface as notification failures")
    void send_writeFails_shouldThrow() throws Exception {
        ClientConnection pizza = connection("s1");
        doThrow(new IOException("broken pipe")).when(pizza).send(anyString());
        registry.register("pizza", pizza);

        ClientNotificationException ex = assertThrows(ClientNotificationException.class,
                () -> registry.send("pizza", "hello"));

        assertTrue(ex.getMessage().contains("pizza"));
    }

    @Test
    @DisplayName("Concurrent register, send and unregister should not corrupt the registry")
    void concurrentAccess_shouldBeSafe() throws Exception {
        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        for (int t = 0; t < threads; t++) {
            String clientId = "client-" + t;
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < 200; i++) {
                    ClientConnection connection = connection(clientId + "-" + i);
                    registry.register(clientId, connection);
                    registry.send(clientId, "update " + i);
                    registry.send("client-shared", "noise");
                    registry.unregister(clientId, connection);
                }
                return null;
            }));
        }

        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        executor.shutdown();

        assertEquals(0, registry.size());
    }

    @Test
    @DisplayName("Concurrent register and send on one client id should always reach a registered connection")
    void concurrentAccess_sameClientId_shouldDeliverEverySend() throws Exception {
        int threads = 16;
        int iterations = 200;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<CountingConnection> registered = new CopyOnWriteArrayList<>();
        List<Future<Integer>> futures = new ArrayList<>();

        for (int t = 0; t < threads; t++) {
            int worker = t;
            futures.add(executor.submit(() -> {
                start.await();
                int sent = 0;
                for (int i = 0; i < iterations; i++) {
                    CountingConnection connection = new CountingConnection("w" + worker + "-" + i);
                    registered.add(connection);
                    registry.register("pizza", connection);

                    if (registry.send("pizza", "update " + i)) {
                        sent++;
                    }
                }
                return sent;
            }));
        }

        start.countDown();
        int totalSent = 0;
        for (Future<Integer> future : futures) {
            totalSent += future.get(30, TimeUnit.SECONDS);
        }
        executor.shutdown();

        int totalReceived = registered.stream().mapToInt(c -> c.received.get()).sum();

        assertEquals(threads * iterations, totalSent);
        assertEquals(totalSent, totalReceived);
        assertEquals(1, registry.size());
        assertTrue(registered.contains(registry.lookup("pizza").orElseThrow()));
    }

    private static class CountingConnection implements ClientConnection {
        private final String id;
        private final AtomicInteger received = new AtomicInteger();

        CountingConnection(String id) {
            this.id = id;
        }

        @Override
        public String getId() {
            return id;
        }

        @Override
        public void send(String message) {
            received.incrementAndGet();
        }
    }
}
