package com.task.ccparser.service;

import com.task.ccparser.config.ModelSettings;
import com.task.ccparser.exception.ModelConfigurationException;
import com.task.ccparser.exception.UpstreamServiceException;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Function;

/**
 * Sends a single user prompt to the chat model and returns the completion text. One attempt per
 * call; failures surface as {@link UpstreamServiceException}.
 */
public class ChatCompletionClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatCompletionClient.class);

    private final ModelSettings settings;
    private final ChatModel chatModel;

    public ChatCompletionClient(ModelSettings settings, Function<ModelSettings, ChatModel> modelFactory) {
        this.settings = settings;
        if (settings.hasApiKey()) {
            this.chatModel = modelFactory.apply(settings);
        } else {
            LOGGER.warn("GROQ_API_KEY not configured; statement parsing will fail until it is set");
            this.chatModel = null;
        }
    }

    public String complete(String prompt) {
        if (chatModel == null) {
            throw new ModelConfigurationException("GROQ_API_KEY not configured. Please set it in the environment.");
        }

        LOGGER.info("Querying Groq AI ({}) with prompt of {} characters", settings.model(), prompt.length());
        ChatResponse response;
        try {
            response = chatModel.chat(List.of(UserMessage.from(prompt)));
        } catch (RuntimeException ex) {
            LOGGER.error("Groq API error: {}", ex.getMessage());
            throw new UpstreamServiceException("Groq API Error: " + ex.getMessage(), ex);
        }

        String text = response.aiMessage() == null ? null : response.aiMessage().text();
        String result = text == null ? "" : text;
        LOGGER.info("AI response received ({} chars)", result.length());
        return result;
    }

    public String modelName() {
        return settings.model();
    }
}
