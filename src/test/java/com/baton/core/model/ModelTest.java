package com.baton.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    @Nested
    @DisplayName("Wave")
    class WaveTests {

        @Test
        @DisplayName("numbered waves come first, then eval, then fix")
        void ordering() {
            var waves = new TreeSet<>(List.of(Wave.FIX, Wave.numbered(10), Wave.EVAL, Wave.numbered(2)));
            assertEquals(List.of(Wave.numbered(2), Wave.numbered(10), Wave.EVAL, Wave.FIX), List.copyOf(waves));
        }

        @Test
        @DisplayName("parses bare values and labels")
        void parse() {
            assertEquals(Optional.of(Wave.numbered(3)), Wave.parse("3"));
            assertEquals(Optional.of(Wave.EVAL), Wave.parse("wave:eval"));
            assertEquals(Optional.of(Wave.FIX), Wave.fromLabel("wave:FIX"));
            assertTrue(Wave.parse("0").isEmpty());
            assertTrue(Wave.parse("later").isEmpty());
            assertTrue(Wave.fromLabel("3").isEmpty());
        }

        @Test
        @DisplayName("parsing ignores the default locale")
        void parseUnderTurkishLocale() {
            Locale previous = Locale.getDefault();
            Locale.setDefault(Locale.forLanguageTag("tr-TR"));
            try {
                assertEquals(Optional.of(Wave.FIX), Wave.parse("WAVE:FIX"));
                assertEquals(Optional.of(Wave.EVAL), Wave.parse("EVAL"));
            } finally {
                Locale.setDefault(previous);
            }
        }

        @Test
        @DisplayName("label round-trips through fromLabel")
        void label() {
            assertEquals("wave:4", Wave.numbered(4).label());
            assertEquals(Optional.of(Wave.numbered(4)), Wave.fromLabel(Wave.numbered(4).label()));
        }

        @Test
        @DisplayName("wave numbers start at 1")
        void rejectsZero() {
            assertThrows(IllegalArgumentException.class, () -> Wave.numbered(0));
        }
    }

    @Nested
    @DisplayName("Phase")
    class PhaseTests {

        @Test
        @DisplayName("maps each phase to its status label and open thread")
        void labels() {
            assertEquals(StatusLabel.READY, Phase.READY.statusLabel());
            assertEquals(StatusLabel.IN_PROGRESS, Phase.TEST_CLOSED.statusLabel());
            assertEquals(StatusLabel.REVIEW_NEEDED, Phase.REVIEW_OPEN.statusLabel());
            assertEquals(StatusLabel.NEEDS_INPUT, Phase.REVIEW_FAILED.statusLabel());
            assertEquals(Optional.of(ThreadType.TEST), Phase.TEST_OPEN.openThread());
            assertTrue(Phase.DEV_CLOSED.openThread().isEmpty());
        }

        @Test
        @DisplayName("accepts tags with dashes or underscores in any case")
        void fromTag() {
            assertEquals(Optional.of(Phase.DEV_OPEN), Phase.fromTag("dev-open"));
            assertEquals(Optional.of(Phase.REVIEW_FAILED), Phase.fromTag(" REVIEW_FAILED "));
            assertTrue(Phase.fromTag("shipped").isEmpty());
        }

        @Test
        @DisplayName("state labels carry the exact phase")
        void stateLabel() {
            assertEquals("state:test_open", Phase.TEST_OPEN.stateLabel());
            assertEquals(Optional.of(Phase.TEST_OPEN), Phase.fromStateLabel("state:test_open"));
            assertTrue(Phase.fromStateLabel("phase:test").isEmpty());
        }

        @Test
        @DisplayName("only claimed-through-review phases are in progress")
        void inProgress() {
            assertFalse(Phase.READY.isInProgress());
            assertTrue(Phase.CLAIMED.isInProgress());
            assertTrue(Phase.REVIEW_FAILED.isInProgress());
            assertFalse(Phase.COMPLETED.isInProgress());
        }
    }

    @Nested
    @DisplayName("EnforcementLevel")
    class EnforcementLevelTests {

        @Test
        @DisplayName("reminder, warning, then block from the third occurrence")
        void ladder() {
            assertEquals(EnforcementLevel.NONE, EnforcementLevel.forOccurrences(0));
            assertEquals(EnforcementLevel.REMINDER, EnforcementLevel.forOccurrences(1));
            assertEquals(EnforcementLevel.WARNING, EnforcementLevel.forOccurrences(2));
            assertEquals(EnforcementLevel.BLOCK, EnforcementLevel.forOccurrences(3));
            assertEquals(EnforcementLevel.BLOCK, EnforcementLevel.forOccurrences(7));
            assertTrue(EnforcementLevel.BLOCK.atLeast(EnforcementLevel.WARNING));
            assertFalse(EnforcementLevel.REMINDER.atLeast(EnforcementLevel.WARNING));
        }
    }
}
