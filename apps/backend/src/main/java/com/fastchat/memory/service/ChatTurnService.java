package com.fastchat.memory.service;

import com.fastchat.memory.ai.ChatCompletion;
import com.fastchat.memory.ai.ChatModelGateway;
import com.fastchat.memory.api.dto.ChatTurnRequest;
import com.fastchat.memory.api.dto.ChatTurnResult;
import com.fastchat.memory.api.dto.ContextOptions;
import com.fastchat.memory.api.dto.MemoryContext;
import com.fastchat.memory.api.dto.Message;
import com.fastchat.memory.api.dto.ModelOptions;
import com.fastchat.memory.api.dto.Role;
import com.fastchat.memory.api.dto.StreamEvent;
import com.fastchat.memory.api.dto.StreamRequest;
import com.fastchat.memory.config.MemoryProperties;
import com.fastchat.memory.exception.StoreUnavailableException;
import com.fastchat.memory.infra.DeliverySink;
import com.fastchat.memory.infra.StreamCallbacks;
import com.fastchat.memory.infra.StreamHandle;
import com.fastchat.memory.infra.StreamingAccumulator;
import com.fastchat.memory.util.TokenEstimator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One chat turn on top of the memory engine: store the user message, assemble the window,
 * call the model, then persist the reply directly or through the streaming accumulator.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChatTurnService {

    private final MemoryManager memory;
    private final StreamingAccumulator accumulator;
    private final ObjectProvider<ChatModelGateway> gateway;
    private final MemoryProperties props;
    private final Clock clock;

    /**
     * Completes once the reply is stored (blocking models) or the stream has started (streaming models);
     * in the latter case {@link ChatTurnResult#requestId()} identifies the stream for cancellation.
     */
    public Mono<ChatTurnResult> run(ChatTurnRequest request, DeliverySink sink) {
        ChatModelGateway model = gateway.getIfAvailable();
        if (model == null) {
            return Mono.error(StoreUnavailableException.notInitialized("Chat model gateway"));
        }
        return resolveBranch(request)
                .flatMap(branchId -> {
                    Message user = Message.builder()
                            .id(UUID.randomUUID().toString())
                            .sessionId(request.sessionId())
                            .role(Role.USER)
                            .content(request.content())
                            .timestamp(clock.millis())
                            .branchId(branchId.isEmpty() ? null : branchId)
                            .metadata(Map.of(Message.META_TOKENS,
                                    TokenEstimator.estimate(request.content(), props.getContext().getCharsPerToken())))
                            .build();
                    ContextOptions base = request.options() == null ? ContextOptions.defaults() : request.options();
                    ContextOptions options = base.toBuilder().branchId(user.getBranchId()).build();
                    return memory.storeMessage(user)
                            .then(memory.getContext(request.sessionId(), options))
                            .flatMap(context -> respond(request, sink, model, user, context));
                });
    }

    private Mono<ChatTurnResult> respond(ChatTurnRequest request, DeliverySink sink, ChatModelGateway model,
                                         Message user, MemoryContext context) {
        ModelOptions modelOptions = request.modelOptions() == null
                ? ModelOptions.streaming(null)
                : request.modelOptions();
        String assistantId = UUID.randomUUID().toString();
        log.debug("[ChatTurn] model call sessionId={} branchId={} contextMessages={} tokens={}",
                request.sessionId(), user.getBranchId(), context.metadata().messageCount(),
                context.metadata().tokenCount());

        return model.generateChatCompletion(toModelInput(context), modelOptions)
                .flatMap(completion -> {
                    if (completion instanceof ChatCompletion.Complete complete) {
                        Message reply = Message.builder()
                                .id(assistantId)
                                .sessionId(request.sessionId())
                                .role(Role.ASSISTANT)
                                .content(complete.text())
                                .timestamp(clock.millis())
                                .branchId(user.getBranchId())
                                .parentMessageId(user.getId())
                                .build();
                        return memory.storeMessage(reply)
                                .then(sink.send(StreamEvent.done(null, request.sessionId(), assistantId, complete.text()))
                                        .onErrorResume(e -> {
                                            log.warn("[ChatTurn] reply not delivered sessionId={} err={}",
                                                    request.sessionId(), e.toString());
                                            return Mono.empty();
                                        }))
                                .thenReturn(new ChatTurnResult(request.sessionId(), user.getId(), assistantId,
                                        null, context));
                    }
                    ChatCompletion.Streaming streaming = (ChatCompletion.Streaming) completion;
                    StreamRequest streamRequest = new StreamRequest(request.connectionId(), request.sessionId(),
                            assistantId, user.getBranchId(), user.getId(), modelOptions.modelId());
                    StreamHandle handle = accumulator.streamResponse(streamRequest, streaming.tokens(), sink,
                            new StreamCallbacks() {
                                @Override
                                public void onComplete(Message persisted) {
                                    memory.mirrorToArchive(persisted);
                                }

                                @Override
                                public void onError(Throwable error) {
                                    log.warn("[ChatTurn] generation failed sessionId={} messageId={} err={}",
                                            request.sessionId(), assistantId, error.toString());
                                }
                            });
                    return Mono.just(new ChatTurnResult(request.sessionId(), user.getId(), assistantId,
                            handle.requestId(), context));
                });
    }

    /** Explicit branch, else the session's active branch, else main (empty string). */
    private Mono<String> resolveBranch(ChatTurnRequest request) {
        if (request.branchId() != null) {
            return Mono.just(request.branchId());
        }
        return memory.getSession(request.sessionId())
                .map(s -> s.activeBranch().orElse(""))
                .defaultIfEmpty("");
    }

    private static List<Message> toModelInput(MemoryContext context) {
        List<Message> input = new ArrayList<>(context.messages().size() + 1);
        if (context.systemPrompt() != null) {
            input.add(Message.builder()
                    .id("system")
                    .sessionId(context.metadata().sessionId())
                    .role(Role.SYSTEM)
                    .content(context.systemPrompt())
                    .build());
        }
        input.addAll(context.messages());
        return input;
    }
}
