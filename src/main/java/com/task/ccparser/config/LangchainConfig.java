package com.task.ccparser.config;

import com.task.ccparser.service.ChatCompletionClient;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ModelSettings.class)
public class LangchainConfig {

    @Bean
    public ChatCompletionClient chatCompletionClient(ModelSettings settings) {
        return new ChatCompletionClient(settings, LangchainConfig::groqChatModel);
    }

    static ChatModel groqChatModel(ModelSettings settings) {
        return OpenAiChatModel.builder()
                .baseUrl(settings.baseUrl())
                .apiKey(settings.apiKey())
                .modelName(settings.model())
                .temperature(settings.temperature())
                .maxTokens(settings.maxTokens())
                .timeout(settings.timeout())
                // single attempt per statement
                .maxRetries(0)
                .build();
    }
}
