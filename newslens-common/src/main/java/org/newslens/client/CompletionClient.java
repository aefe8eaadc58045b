package org.newslens.client;

import lombok.extern.slf4j.Slf4j;
import org.newslens.exception.UpstreamMalformedResponseException;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;

import java.time.Duration;
import java.util.List;

/**
 * Completion service used by both query understanding and answer generation.
 *
 * <p>Wraps a Spring AI {@link ChatModel}. When {@code jsonObject} is requested the
 * prompt carries the injected {@link ChatOptions}, which are expected to switch
 * the provider into JSON-object response mode. Without such options the caller's
 * prompt alone asks for JSON.</p>
 */
@Slf4j
public class CompletionClient {

    public static final String BACKEND = "completion";

    private final ChatModel chatModel;
    private final ChatOptions jsonObjectOptions;
    private final UpstreamCallExecutor callExecutor;
    private final Duration timeout;

    /**
     * @param chatModel         Spring AI chat model
     * @param jsonObjectOptions options enabling JSON-object mode, may be {@code null}
     * @param callExecutor      executor enforcing the timeout
     * @param timeout           per-call deadline
     */
    public CompletionClient(ChatModel chatModel, ChatOptions jsonObjectOptions,
                            UpstreamCallExecutor callExecutor, Duration timeout) {
        this.chatModel = chatModel;
        this.jsonObjectOptions = jsonObjectOptions;
        this.callExecutor = callExecutor;
        this.timeout = timeout;

        log.info("CompletionClient initialized: timeout={}ms, jsonObjectMode={}",
                timeout.toMillis(), jsonObjectOptions != null);
    }

    /**
     * Sends one system and one user message and returns the model text.
     *
     * @throws org.newslens.exception.UpstreamException on timeout, failure or empty output
     */
    public String complete(String systemPrompt, String userPrompt, boolean jsonObject) {
        List<Message> messages = List.of(new SystemMessage(systemPrompt), new UserMessage(userPrompt));
        Prompt prompt = jsonObject && jsonObjectOptions != null
                ? new Prompt(messages, jsonObjectOptions)
                : new Prompt(messages);

        long start = System.currentTimeMillis();
        ChatResponse response = callExecutor.call(BACKEND, timeout, () -> chatModel.call(prompt));

        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new UpstreamMalformedResponseException("Completion returned no output");
        }
        String text = response.getResult().getOutput().getText();
        if (text == null || text.isBlank()) {
            throw new UpstreamMalformedResponseException("Completion returned empty text");
        }

        log.debug("Completion answered in {}ms ({} chars)", System.currentTimeMillis() - start, text.length());
        return text;
    }
}
