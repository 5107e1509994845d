package tw.gc.strategy.optimizer.services.storage;

import java.time.Instant;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import tw.gc.strategy.optimizer.enums.SearchKind;

import static org.assertj.core.api.Assertions.*;

class RunIdGeneratorTest {

    private static final Instant CREATED = Instant.parse("2024-05-06T07:08:09.123Z");

    @Test
    @DisplayName("should combine strategy, kind and UTC timestamp")
    void shouldFormatId() {
        assertThat(RunIdGenerator.generate("rsi", SearchKind.WALK_FORWARD, CREATED, 0))
            .isEqualTo("rsi_walk_forward_20240506T070809Z");
    }

    @Test
    @DisplayName("should append the disambiguator after a collision")
    void shouldAppendDisambiguator() {
        assertThat(RunIdGenerator.generate("rsi", SearchKind.GRID, CREATED, 2))
            .isEqualTo("rsi_grid_20240506T070809Z_2");
    }

    @Test
    @DisplayName("should keep ids safe as file names")
    void shouldSanitizeStrategy() {
        assertThat(RunIdGenerator.generate("ma/cross over", SearchKind.ADAPTIVE, CREATED, 0))
            .isEqualTo("ma-cross-over_adaptive_20240506T070809Z");
    }

    @Test
    @DisplayName("should reject a blank strategy")
    void shouldRejectBlankStrategy() {
        assertThatThrownBy(() -> RunIdGenerator.generate(" ", SearchKind.GRID, CREATED, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
