package com.dcruver.vault.nlp;

import com.dcruver.vault.config.VaultProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Note generation using Ollama via Spring AI.
 * Model failures are not caught here; the pipeline decides what to do with them.
 */
@Service
@Slf4j
public class OllamaGenerativeClient implements GenerativeClient {

    private final ChatModel chatModel;
    private final int maxInputChars;

    public OllamaGenerativeClient(ChatModel chatModel, VaultProperties properties) {
        this.chatModel = chatModel;
        this.maxInputChars = properties.getGeneration().getMaxInputChars();
        log.info("OllamaGenerativeClient initialized with ChatModel: {}", chatModel.getClass().getSimpleName());
    }

    @Override
    public String generate(String text, String prompt) {
        String request = prompt + truncate(text, maxInputChars);
        log.debug("Sending {} chars to chat model", request.length());

        ChatResponse response = chatModel.call(new Prompt(List.of(new UserMessage(request))));
        if (response == null || response.getResults().isEmpty()) {
            log.warn("No response generated");
            return "";
        }

        String output = response.getResult().getOutput().getText();
        return output != null ? output : "";
    }

    /**
     * Truncate text to max length
     */
    private String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (maxLength <= 0 || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength);
    }
}
