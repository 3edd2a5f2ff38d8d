package com.openforge.toolrelay.tool;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ToolRegistryProviderTest {

    @SuppressWarnings("unchecked")
    private static <T> ObjectProvider<T> providerOf(List<T> beans) {
        ObjectProvider<T> provider = mock(ObjectProvider.class);
        when(provider.orderedStream()).thenAnswer(invocation -> beans.stream());
        return provider;
    }

    @Test
    void get_shouldCombineBeansAndSourcesInOrder() {
        ToolSource remote = () -> List.<AgentTool>of(StubTool.returning("remote_search", "r"));
        ToolRegistryProvider provider = new ToolRegistryProvider(
                providerOf(List.<AgentTool>of(StubTool.returning("local", "l"))),
                providerOf(List.of(remote)));

        ToolRegistry registry = provider.get();

        assertEquals(List.of("local", "remote_search"), new ArrayList<>(registry.names()));
    }

    @Test
    void get_shouldInitializeOnceUnderConcurrentFirstUse() throws Exception {
        AtomicInteger loads = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ToolSource slowSource = () -> {
            loads.incrementAndGet();
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return List.<AgentTool>of(StubTool.returning("remote", "r"));
        };
        ToolRegistryProvider provider = new ToolRegistryProvider(
                providerOf(List.<AgentTool>of()), providerOf(List.of(slowSource)));

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<ToolRegistry>> futures = new ArrayList<>();
            Callable<ToolRegistry> task = () -> {
                start.await();
                return provider.get();
            };
            for (int i = 0; i < 8; i++) {
                futures.add(pool.submit(task));
            }
            start.countDown();

            ToolRegistry first = futures.get(0).get();
            for (Future<ToolRegistry> future : futures) {
                assertSame(first, future.get());
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, loads.get());
    }

    @Test
    void get_shouldReturnEmptyRegistryWhenNothingIsConfigured() {
        ToolRegistryProvider provider = new ToolRegistryProvider(
                providerOf(List.<AgentTool>of()), providerOf(List.<ToolSource>of()));

        assertTrue(provider.get().isEmpty());
        assertSame(provider.get(), provider.get());
        assertTrue(provider.get().definitions().isEmpty());
    }
}
