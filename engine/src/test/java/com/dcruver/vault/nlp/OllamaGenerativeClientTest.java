package com.dcruver.vault.nlp;

import com.dcruver.vault.config.VaultProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class OllamaGenerativeClientTest {

    private ChatModel chatModel;
    private VaultProperties properties;

    @BeforeEach
    void setUp() {
        chatModel = mock(ChatModel.class);
        properties = new VaultProperties();
    }

    @Test
    void testPromptPrecedesSourceText() {
        when(chatModel.call(any(Prompt.class)))
            .thenReturn(new ChatResponse(List.of(new Generation(new AssistantMessage("---\ntitle: X\n---\nBody")))));

        OllamaGenerativeClient client = new OllamaGenerativeClient(chatModel, properties);
        String output = client.generate("source text", "Summarize:\n");

        assertEquals("---\ntitle: X\n---\nBody", output);

        ArgumentCaptor<Prompt> captor = ArgumentCaptor.forClass(Prompt.class);
        verify(chatModel).call(captor.capture());
        assertEquals("Summarize:\nsource text", captor.getValue().getInstructions().get(0).getText());
    }

    @Test
    void testSourceTextIsTruncated() {
        properties.getGeneration().setMaxInputChars(10);
        when(chatModel.call(any(Prompt.class)))
            .thenReturn(new ChatResponse(List.of(new Generation(new AssistantMessage("ok")))));

        new OllamaGenerativeClient(chatModel, properties).generate("0123456789abcdef", "P:");

        ArgumentCaptor<Prompt> captor = ArgumentCaptor.forClass(Prompt.class);
        verify(chatModel).call(captor.capture());
        assertEquals("P:0123456789", captor.getValue().getInstructions().get(0).getText());
    }

    @Test
    void testEmptyResponseYieldsEmptyText() {
        when(chatModel.call(any(Prompt.class))).thenReturn(new ChatResponse(List.of()));

        assertEquals("", new OllamaGenerativeClient(chatModel, properties).generate("text", "prompt"));
    }

    @Test
    void testModelFailurePropagates() {
        when(chatModel.call(any(Prompt.class))).thenThrow(new IllegalStateException("connection refused"));

        OllamaGenerativeClient client = new OllamaGenerativeClient(chatModel, properties);

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> client.generate("text", "prompt"));
        assertEquals("connection refused", e.getMessage());
    }
}
