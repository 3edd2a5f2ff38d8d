package com.openforge.toolrelay.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MdcPropagatingExecutorServiceTest {

    private final ExecutorService executor =
            new MdcPropagatingExecutorService(Executors.newSingleThreadExecutor());

    @AfterEach
    void tearDown() {
        MDC.clear();
        executor.shutdownNow();
    }

    @Test
    void submit_shouldCarrySubmitterMdcIntoWorker() throws Exception {
        MDC.put("conversationId", "conv-7");

        Future<String> seen = executor.submit(() -> MDC.get("conversationId"));

        assertEquals("conv-7", seen.get(5, TimeUnit.SECONDS));
    }

    @Test
    void execute_shouldNotLeakMdcIntoLaterTasks() throws Exception {
        MDC.put("conversationId", "conv-1");
        executor.execute(() -> MDC.put("extra", "x"));
        MDC.clear();

        AtomicReference<String> conversation = new AtomicReference<>("unset");
        AtomicReference<String> extra = new AtomicReference<>("unset");
        executor.submit(() -> {
            conversation.set(MDC.get("conversationId"));
            extra.set(MDC.get("extra"));
        }).get(5, TimeUnit.SECONDS);

        assertNull(conversation.get());
        assertNull(extra.get());
    }

    @Test
    void invokeAll_shouldWrapEveryTask() throws Exception {
        MDC.put("conversationId", "conv-9");
        Callable<String> task = () -> MDC.get("conversationId");

        List<Future<String>> results = executor.invokeAll(List.of(task, task));

        for (Future<String> result : results) {
            assertEquals("conv-9", result.get());
        }
    }

    @Test
    void shutdown_shouldReachDelegate() throws Exception {
        executor.shutdown();

        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
        assertTrue(executor.isShutdown());
        assertTrue(executor.isTerminated());
    }
}
