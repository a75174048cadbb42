package com.deliverydispatch.dispatch.connection;

import com.deliverydispatch.dispatch.model.OutboundEvent;
import com.deliverydispatch.dispatch.support.RecordingChannel;
import com.deliverydispatch.shared.enums.UserRole;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConnectionTest {

    @Test
    @DisplayName("Live traffic held during authentication goes out after the replies")
    void heldTrafficFollowsReplies() {
        RecordingChannel channel = new RecordingChannel();
        Connection connection = new Connection("c1", channel, Instant.EPOCH);

        connection.holdLiveTraffic();
        connection.send(event("presence_update"));
        connection.reply(event("authenticated"));
        connection.reply(event("queued_message_flush"));
        assertThat(channel.sentTypes()).containsExactly("authenticated", "queued_message_flush");

        connection.releaseLiveTraffic();
        assertThat(channel.sentTypes()).containsExactly("authenticated", "queued_message_flush", "presence_update");

        connection.send(event("assignment_result"));
        assertThat(channel.sentTypes()).endsWith("assignment_result");
    }

    @Test
    @DisplayName("Writes to a closed or failing socket report failure instead of throwing")
    void failedWrites() {
        RecordingChannel closed = new RecordingChannel();
        closed.close("bye");
        assertThat(new Connection("c1", closed, Instant.EPOCH).send(event("ping"))).isFalse();

        RecordingChannel broken = new RecordingChannel();
        broken.failWrites();
        assertThat(new Connection("c2", broken, Instant.EPOCH).reply(event("ping"))).isFalse();
    }

    @Test
    @DisplayName("Binding is fixed once set, but rebinding the same user is allowed")
    void bindOnce() {
        Connection connection = new Connection("c1", new RecordingChannel(), Instant.EPOCH);

        connection.bindUser(7L, UserRole.CONSUMER);
        connection.bindUser(7L, UserRole.CONSUMER);

        assertThat(connection.isAuthenticated()).isTrue();
        assertThatThrownBy(() -> connection.bindUser(8L, UserRole.CONSUMER)).isInstanceOf(IllegalStateException.class);
    }

    private static OutboundEvent event(String type) {
        return OutboundEvent.builder(type).build();
    }
}
