package com.fastchat.memory.infra;

import com.fastchat.memory.api.dto.StreamEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class SseDeliverySinkTest {

    private final SseDeliverySink sink = new SseDeliverySink(new ObjectMapper());

    @Test
    void framesAreNamedByTypeAndTheStreamEndsAfterDone() {
        sink.send(StreamEvent.start("r1", "S", "m1")).block();
        sink.send(StreamEvent.token("r1", "S", "m1", "Hi")).block();
        sink.send(StreamEvent.done("r1", "S", "m1", "Hi")).block();

        assertThat(sink.isOpen()).isFalse();
        StepVerifier.create(sink.flux())
                .assertNext(e -> {
                    assertThat(e.event()).isEqualTo("start");
                    assertThat(e.id()).isEqualTo("r1");
                })
                .assertNext(e -> {
                    assertThat(e.event()).isEqualTo("token");
                    assertThat(e.data()).contains("\"type\":\"token\"").contains("\"content\":\"Hi\"");
                })
                .assertNext(e -> assertThat(e.event()).isEqualTo("done"))
                .expectComplete()
                .verify(Duration.ofSeconds(2));
    }

    @Test
    void errorFrameClosesTheSinkAndOmitsNullFields() {
        sink.send(StreamEvent.error("r1", "S", "m1", "boom")).block();

        assertThat(sink.isOpen()).isFalse();
        StepVerifier.create(sink.flux())
                .assertNext(e -> assertThat(e.data()).contains("\"error\":\"boom\"").doesNotContain("content"))
                .verifyComplete();
    }
}
