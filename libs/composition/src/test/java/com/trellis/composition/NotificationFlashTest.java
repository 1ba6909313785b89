package com.trellis.composition;

import com.trellis.composition.testing.InMemorySessionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("NotificationFlash")
class NotificationFlashTest {

    private InMemorySessionStore sessions;
    private NotificationFlash flash;

    @BeforeEach
    void setUp() {
        sessions = new InMemorySessionStore();
        flash = new NotificationFlash(sessions);
    }

    @Test
    @DisplayName("carries undelivered notifications to the next request once")
    void carriesAcrossRedirect() {
        var redirecting = new NotificationQueue();
        redirecting.info("Let's set up your team first.");
        flash.park("s-1", redirecting);

        var next = new NotificationQueue();
        flash.restore("s-1", next);
        var afterThat = new NotificationQueue();
        flash.restore("s-1", afterThat);

        assertThat(redirecting.isEmpty()).isTrue();
        assertThat(next.peekAll()).containsExactly(
                new Notification(NotificationLevel.INFO, "Let's set up your team first."));
        assertThat(afterThat.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("does not touch the session for an empty queue")
    void noWriteForEmptyQueue() {
        flash.park("s-1", new NotificationQueue());

        assertThat(sessions.writeCount()).isZero();
    }

    @Test
    @DisplayName("ignores requests without a session")
    void ignoresMissingSession() {
        var queue = new NotificationQueue();
        queue.success("kept");

        flash.park(null, queue);
        flash.restore(null, queue);

        assertThat(queue.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("keeps only notifications from a parked value and clears it")
    void restoresOnlyNotifications() {
        sessions.set("s-1", SessionKeys.FLASH_NOTIFICATIONS,
                List.of("stale", new Notification(NotificationLevel.WARNING, "Check your settings")));
        sessions.set("s-2", SessionKeys.FLASH_NOTIFICATIONS, "not a list");
        var first = new NotificationQueue();
        var second = new NotificationQueue();

        flash.restore("s-1", first);
        flash.restore("s-2", second);

        assertThat(first.peekAll()).containsExactly(
                new Notification(NotificationLevel.WARNING, "Check your settings"));
        assertThat(second.isEmpty()).isTrue();
        assertThat(sessions.attributes("s-1")).doesNotContainKey(SessionKeys.FLASH_NOTIFICATIONS);
        assertThat(sessions.attributes("s-2")).doesNotContainKey(SessionKeys.FLASH_NOTIFICATIONS);
    }
}
