package ch.fleetclash.sessionserver.application.service;

import ch.fleetclash.sessionserver.domain.Coordinate;
import ch.fleetclash.sessionserver.exception.ValidationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Coordinate}: board notation parsing and neighbourhood checks.
 */
class CoordinateTest {

    @Test
    void parse_shouldMapLetterToRow_andNumberToColumn() {
        // Act
        Coordinate c = Coordinate.parse("C7");

        // Assert
        assertThat(c.getRow()).isEqualTo(2);
        assertThat(c.getColumn()).isEqualTo(6);
        assertThat(c).hasToString("C7");
    }

    @Test
    void parse_shouldIgnoreCaseAndSurroundingWhitespace() {
        assertThat(Coordinate.parse(" j10 ")).isEqualTo(new Coordinate(9, 9));
    }

    @Test
    void parse_shouldRejectMalformedInput() {
        assertThatThrownBy(() -> Coordinate.parse("A0")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> Coordinate.parse("AA1")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> Coordinate.parse("A100")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> Coordinate.parse(null)).isInstanceOf(ValidationException.class);
    }

    @Test
    void isWithin_shouldRespectBoardSize() {
        assertThat(Coordinate.parse("J10").isWithin(10)).isTrue();
        assertThat(Coordinate.parse("K1").isWithin(10)).isFalse();
        assertThat(Coordinate.parse("A11").isWithin(10)).isFalse();
    }

    @Test
    void isAdjacentTo_shouldIncludeDiagonals_butNotSameCell() {
        Coordinate b2 = Coordinate.parse("B2");

        assertThat(b2.isAdjacentTo(Coordinate.parse("A1"))).isTrue();
        assertThat(b2.isAdjacentTo(Coordinate.parse("B3"))).isTrue();
        assertThat(b2.isAdjacentTo(Coordinate.parse("B2"))).isFalse();
        assertThat(b2.isAdjacentTo(Coordinate.parse("D2"))).isFalse();
    }
}
