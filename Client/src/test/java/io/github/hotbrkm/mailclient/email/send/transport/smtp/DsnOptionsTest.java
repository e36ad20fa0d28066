package io.github.hotbrkm.mailclient.email.send.transport.smtp;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DsnOptions Test")
class DsnOptionsTest {

    @Test
    @DisplayName("RET and NOTIFY parameters are formatted")
    void testParameters() {
        // Given
        DsnOptions options = DsnOptions.of(DsnReturn.HDRS, DsnNotify.FAILURE, DsnNotify.SUCCESS);

        // When // Then
        assertThat(options.mailParameter()).isEqualTo("RET=HDRS");
        assertThat(options.rcptParameter()).isEqualTo("NOTIFY=SUCCESS,FAILURE");
    }

    @Test
    @DisplayName("Unset values produce no parameters")
    void testEmpty() {
        // Given
        DsnOptions options = DsnOptions.of((DsnReturn) null);

        // When // Then
        assertThat(options.mailParameter()).isEmpty();
        assertThat(options.rcptParameter()).isEmpty();
    }

    @Test
    @DisplayName("NEVER cannot be combined with other notify values")
    void testNeverExclusive() {
        // When // Then
        assertThat(DsnOptions.of(DsnReturn.FULL, DsnNotify.NEVER).rcptParameter()).isEqualTo("NOTIFY=NEVER");
        assertThatThrownBy(() -> DsnOptions.of(DsnReturn.FULL, DsnNotify.NEVER, DsnNotify.DELAY))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Notify values are kept as an unmodifiable copy")
    void testNotifyTypesCopied() {
        // Given
        var requested = new HashSet<>(Set.of(DsnNotify.DELAY));

        // When
        DsnOptions options = new DsnOptions(null, requested);
        requested.add(DsnNotify.SUCCESS);

        // Then
        assertThat(options.notifyTypes()).containsExactly(DsnNotify.DELAY);
        assertThatThrownBy(() -> options.notifyTypes().add(DsnNotify.FAILURE))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
