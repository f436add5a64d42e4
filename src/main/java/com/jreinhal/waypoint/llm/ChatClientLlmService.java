package com.jreinhal.waypoint.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.stereotype.Service;

/**
 * {@link LlmService} backed by the Spring AI chat client of whichever model starter is on the classpath.
 */
@Service
public class ChatClientLlmService implements LlmService {
    private static final Logger log = LoggerFactory.getLogger(ChatClientLlmService.class);
    private static final String SYSTEM_PROMPT = "You are a fast message classifier. Follow the output format exactly. "
            + "Never answer the user's message itself.";

    private final ChatClient chatClient;

    public ChatClientLlmService(ChatClient.Builder builder) {
        this.chatClient = builder.build();
    }

    @Override
    public String generateCompletion(String prompt, CompletionOptions options) {
        ChatOptions chatOptions = ChatOptions.builder()
                .temperature(options.temperature())
                .maxTokens(options.maxTokens())
                .build();
        String content;
        try {
            content = this.chatClient.prompt()
                    .system(SYSTEM_PROMPT)
                    .user(prompt)
                    .options(chatOptions)
                    .call()
                    .content();
        }
        catch (RuntimeException e) {
            throw new LlmServiceException("Chat model call failed: " + e.getMessage(), e);
        }
        if (content == null || content.isBlank()) {
            throw new LlmServiceException("Chat model returned empty content");
        }
        if (log.isDebugEnabled()) {
            log.debug("Chat model returned {} chars (maxTokens={}, temperature={})", content.length(),
                    options.maxTokens(), options.temperature());
        }
        return content;
    }
}
