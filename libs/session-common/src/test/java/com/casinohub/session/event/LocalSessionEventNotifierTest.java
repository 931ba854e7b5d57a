package com.casinohub.session.event;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(OutputCaptureExtension.class)
class LocalSessionEventNotifierTest {

    @Test
    void failingListenerDoesNotBlockOthers() {
        List<String> seen = new ArrayList<>();
        SessionEventListener broken = e -> {
            throw new IllegalStateException("boom");
        };
        SessionEventListener ok = e -> seen.add(e.getToken());
        LocalSessionEventNotifier notifier = new LocalSessionEventNotifier(List.of(broken, ok));

        boolean allSuccess = notifier.dispatch(SessionInvalidatedEvent.of("t1", "alice", "room-1",
                SessionInvalidatedEvent.EventType.EXPIRED, 0L, null));

        assertThat(allSuccess).isFalse();
        assertThat(seen).containsExactly("t1");
    }

    @Test
    void listenerFailureIsLoggedWithoutToken(CapturedOutput output) {
        SessionEventListener broken = e -> {
            throw new IllegalStateException("boom");
        };
        LocalSessionEventNotifier notifier = new LocalSessionEventNotifier(List.of(broken));

        notifier.dispatch(SessionInvalidatedEvent.of("secret-token-42", "bob", "room-2",
                SessionInvalidatedEvent.EventType.CLOSED, 0L, "left"));

        assertThat(output).contains("playerId=bob", "roomId=room-2");
        assertThat(output).doesNotContain("secret-token-42");
    }
}
