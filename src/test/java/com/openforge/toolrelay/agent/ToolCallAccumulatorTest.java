package com.openforge.toolrelay.agent;

import com.openforge.toolrelay.llm.model.StreamingChunk.FunctionDelta;
import com.openforge.toolrelay.llm.model.StreamingChunk.ToolCallDelta;
import com.openforge.toolrelay.llm.model.ToolCall;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.openforge.toolrelay.llm.Chunks.args;
import static com.openforge.toolrelay.llm.Chunks.open;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolCallAccumulatorTest {

    @Test
    void finish_shouldConcatenateArgumentsInArrivalOrder() {
        ToolCallAccumulator accumulator = new ToolCallAccumulator();

        accumulator.accept(open(0, "c1", "get_weather", null));
        accumulator.accept(args(0, "{\"cit"));
        accumulator.accept(args(0, "y\":\"Kyiv\"}"));

        List<ToolCall> calls = accumulator.finish();
        assertEquals(1, calls.size());
        assertEquals("c1", calls.get(0).id());
        assertEquals("get_weather", calls.get(0).name());
        assertEquals("{\"city\":\"Kyiv\"}", calls.get(0).arguments());
        assertEquals("function", calls.get(0).type());
    }

    @Test
    void finish_shouldKeepFirstSeenOrderWhenFragmentsInterleave() {
        ToolCallAccumulator accumulator = new ToolCallAccumulator();

        accumulator.accept(open(1, "b", "second", "{\"x\":"));
        accumulator.accept(open(0, "a", "first", "{"));
        accumulator.accept(args(1, "1}"));
        accumulator.accept(args(0, "}"));

        List<ToolCall> calls = accumulator.finish();
        assertEquals(List.of("b", "a"), calls.stream().map(ToolCall::id).toList());
        assertEquals("{\"x\":1}", calls.get(0).arguments());
        assertEquals("{}", calls.get(1).arguments());
    }

    @Test
    void accept_shouldAppendArgumentsCarriedByOpeningFragment() {
        ToolCallAccumulator accumulator = new ToolCallAccumulator();

        accumulator.accept(open(0, "c1", "search", "{\"q\":"));
        accumulator.accept(args(0, "\"java\"}"));

        assertEquals("{\"q\":\"java\"}", accumulator.finish().get(0).arguments());
    }

    @Test
    void accept_shouldIgnoreMissingOrEmptyArgumentChunks() {
        ToolCallAccumulator accumulator = new ToolCallAccumulator();

        accumulator.accept(open(0, "c1", "noop", null));
        accumulator.accept(new ToolCallDelta(0, null, null, null));
        accumulator.accept(new ToolCallDelta(0, null, null, new FunctionDelta(null, null)));
        accumulator.accept(args(0, ""));

        assertEquals("", accumulator.finish().get(0).arguments());
    }

    @Test
    void accept_shouldFailOnFragmentForUnopenedIndex() {
        ToolCallAccumulator accumulator = new ToolCallAccumulator();
        accumulator.accept(open(0, "c1", "search", "{}"));

        ToolCallProtocolException error = assertThrows(ToolCallProtocolException.class,
                () -> accumulator.accept(args(3, "{\"q\":1}")));
        assertEquals(3, error.getIndex());
    }

    @Test
    void accept_shouldReplaceCallAtSameIndexButKeepItsPosition() {
        ToolCallAccumulator accumulator = new ToolCallAccumulator();

        accumulator.accept(open(0, "old", "first", "{\"stale\":"));
        accumulator.accept(open(1, "c2", "second", "{}"));
        accumulator.accept(open(0, "new", "replacement", "{\"fresh\":true}"));

        List<ToolCall> calls = accumulator.finish();
        assertEquals(List.of("new", "c2"), calls.stream().map(ToolCall::id).toList());
        assertEquals("replacement", calls.get(0).name());
        assertEquals("{\"fresh\":true}", calls.get(0).arguments());
    }

    @Test
    void accept_shouldTreatMissingIndexAsZero() {
        ToolCallAccumulator accumulator = new ToolCallAccumulator();

        accumulator.accept(new ToolCallDelta(null, "c1", "function", new FunctionDelta("lookup", "{\"a\"")));
        accumulator.accept(new ToolCallDelta(null, null, null, new FunctionDelta(null, ":1}")));

        assertEquals("{\"a\":1}", accumulator.finish().get(0).arguments());
    }

    @Test
    void finish_shouldBeEmptyWhenNoFragmentsArrived() {
        ToolCallAccumulator accumulator = new ToolCallAccumulator();
        accumulator.accept((List<ToolCallDelta>) null);

        assertTrue(accumulator.isEmpty());
        assertTrue(accumulator.finish().isEmpty());
    }
}
