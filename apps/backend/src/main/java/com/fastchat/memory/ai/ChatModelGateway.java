package com.fastchat.memory.ai;

import com.fastchat.memory.api.dto.Message;
import com.fastchat.memory.api.dto.ModelOptions;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Boundary to whichever LLM provider serves the chat. Callers only see this interface;
 * adding a provider means adding an implementation bean.
 */
public interface ChatModelGateway {

    /**
     * @param messages chronological conversation, a leading system message carries the system prompt
     */
    Mono<ChatCompletion> generateChatCompletion(List<Message> messages, ModelOptions options);
}
