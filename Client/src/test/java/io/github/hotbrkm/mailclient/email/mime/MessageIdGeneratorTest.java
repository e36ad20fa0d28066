package io.github.hotbrkm.mailclient.email.mime;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MessageIdGenerator Test")
class MessageIdGeneratorTest {

    @Test
    @DisplayName("Message-ID has the pid.random.random@host form")
    void testFormat() {
        // When
        String messageId = MessageIdGenerator.next();

        // Then
        assertThat(messageId).matches("<" + ProcessHandle.current().pid() + "\\.\\d+\\.[A-Za-z0-9]{17}@.+>");
    }

    @Test
    @DisplayName("50000 generated IDs are unique")
    void testUnique() {
        // Given
        Set<String> ids = new HashSet<>();

        // When
        for (int i = 0; i < 50_000; i++) {
            ids.add(MessageIdGenerator.next());
        }

        // Then
        assertThat(ids).hasSize(50_000);
    }

    @Test
    @DisplayName("Boundaries are random 60 character hex strings")
    void testBoundary() {
        // When
        String first = BoundaryGenerator.next();
        String second = BoundaryGenerator.next();

        // Then
        assertThat(first).matches("[0-9a-f]{60}");
        assertThat(first).isNotEqualTo(second);
    }
}
