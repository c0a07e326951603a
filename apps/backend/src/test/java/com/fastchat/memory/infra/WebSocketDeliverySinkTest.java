package com.fastchat.memory.infra;

import com.fastchat.memory.api.dto.StreamEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WebSocketDeliverySinkTest {

    @Test
    void framesAreSentAsJsonTextMessages() {
        WebSocketSession session = mock(WebSocketSession.class);
        WebSocketMessage text = mock(WebSocketMessage.class);
        when(session.getId()).thenReturn("ws-1");
        when(session.isOpen()).thenReturn(true);
        when(session.textMessage(anyString())).thenReturn(text);
        when(session.send(any())).thenReturn(Mono.empty());
        WebSocketDeliverySink sink = new WebSocketDeliverySink(session, new ObjectMapper());

        StepVerifier.create(sink.send(StreamEvent.token("r1", "S", "m1", "Hi"))).verifyComplete();

        assertThat(sink.connectionId()).isEqualTo("ws-1");
        assertThat(sink.isOpen()).isTrue();
        verify(session).textMessage("{\"type\":\"token\",\"requestId\":\"r1\",\"sessionId\":\"S\","
                + "\"messageId\":\"m1\",\"content\":\"Hi\"}");
    }

    @Test
    void closedSessionReportsNotOpen() {
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.isOpen()).thenReturn(false);

        assertThat(new WebSocketDeliverySink(session, new ObjectMapper()).isOpen()).isFalse();
    }
}
