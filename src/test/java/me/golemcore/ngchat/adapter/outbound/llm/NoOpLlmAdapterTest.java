package me.golemcore.ngchat.adapter.outbound.llm;

import me.golemcore.ngchat.domain.model.LlmRequest;
import me.golemcore.ngchat.domain.model.LlmResponse;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NoOpLlmAdapterTest {

    private final NoOpLlmAdapter adapter = new NoOpLlmAdapter();

    @Test
    void shouldAnswerWithPlaceholder() {
        LlmResponse response = adapter.chat(LlmRequest.builder().build()).join();

        assertEquals(NoOpLlmAdapter.PLACEHOLDER, response.getContent());
        assertEquals("stop", response.getFinishReason());
        assertFalse(response.hasToolCalls());
    }

    @Test
    void shouldStreamPlaceholderThenDone() {
        StepVerifier.create(adapter.chatStream(LlmRequest.builder().build()))
                .assertNext(chunk -> assertEquals(NoOpLlmAdapter.PLACEHOLDER, chunk.getText()))
                .assertNext(chunk -> assertTrue(chunk.isDone()))
                .verifyComplete();
    }

    @Test
    void shouldNeverBeAvailable() {
        assertEquals("none", adapter.getProviderId());
        assertFalse(adapter.isAvailable());
    }
}
