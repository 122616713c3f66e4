package com.baton.core.wave;

import com.baton.core.CoordinationFixture;
import com.baton.core.error.CoordinationException;
import com.baton.core.error.RuleViolation;
import com.baton.core.model.Wave;
import com.baton.core.model.WaveStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class WaveSequencerTest {

    private CoordinationFixture fixture;
    private WaveSequencer sequencer;
    private String epic;

    @BeforeEach
    void setUp() {
        fixture = new CoordinationFixture();
        sequencer = fixture.waveSequencer;
        epic = fixture.epic("Release");
    }

    @Test
    @DisplayName("wave 1 is always enterable")
    void firstWaveOpen() {
        fixture.item(epic, Wave.numbered(1), "A");
        assertTrue(sequencer.canEnterWave(epic, Wave.numbered(1)));
    }

    @Test
    @DisplayName("wave 2 waits until every wave 1 item is completed")
    void secondWaveWaits() {
        String a = fixture.item(epic, Wave.numbered(1), "A");
        String b = fixture.item(epic, Wave.numbered(1), "B");
        fixture.item(epic, Wave.numbered(2), "C");

        assertFalse(sequencer.canEnterWave(epic, Wave.numbered(2)));
        fixture.complete(a);
        assertFalse(sequencer.canEnterWave(epic, Wave.numbered(2)));
        fixture.complete(b);
        assertTrue(sequencer.canEnterWave(epic, Wave.numbered(2)));
    }

    @Test
    @DisplayName("eval follows the highest numbered wave and fix follows eval")
    void evalAndFixOrdering() {
        String one = fixture.item(epic, Wave.numbered(1), "A");
        String three = fixture.item(epic, Wave.numbered(3), "B");
        String eval = fixture.item(epic, Wave.EVAL, "Eval");
        fixture.item(epic, Wave.FIX, "Fix");

        var loaded = fixture.repository.epic(epic);
        assertEquals(Optional.of(Wave.numbered(1)), sequencer.predecessor(loaded, Wave.numbered(3)));
        assertEquals(Optional.of(Wave.numbered(3)), sequencer.predecessor(loaded, Wave.EVAL));
        assertEquals(Optional.of(Wave.EVAL), sequencer.predecessor(loaded, Wave.FIX));
        assertEquals(Optional.empty(), sequencer.predecessor(loaded, Wave.numbered(1)));

        fixture.complete(one);
        assertTrue(sequencer.canEnterWave(epic, Wave.numbered(3)));
        assertFalse(sequencer.canEnterWave(epic, Wave.EVAL));
        fixture.complete(three);
        assertTrue(sequencer.canEnterWave(epic, Wave.EVAL));
        assertFalse(sequencer.canEnterWave(epic, Wave.FIX));
        fixture.complete(eval);
        assertTrue(sequencer.canEnterWave(epic, Wave.FIX));
    }

    @Test
    @DisplayName("requireEnterable names the wave that is still open")
    void requireEnterable() {
        String a = fixture.item(epic, Wave.numbered(1), "A");
        String c = fixture.item(epic, Wave.numbered(2), "C");

        var e = assertThrows(CoordinationException.class, () -> sequencer.requireEnterable(fixture.get(c)));

        assertEquals(RuleViolation.WAVE_NOT_ELIGIBLE, e.getRule());
        assertTrue(e.getMessage().contains("#" + a));
    }

    @Test
    @DisplayName("items without an epic or a wave tag are never gated")
    void untaggedItems() {
        String loose = fixture.item(null, null, "Loose");
        String untagged = fixture.item(epic, null, "Untagged");
        fixture.item(epic, Wave.numbered(1), "A");

        assertDoesNotThrow(() -> sequencer.requireEnterable(fixture.get(loose)));
        assertDoesNotThrow(() -> sequencer.requireEnterable(fixture.get(untagged)));
    }

    @Test
    @DisplayName("report shows per-wave progress and the active wave")
    void report() {
        String a = fixture.item(epic, Wave.numbered(1), "A");
        fixture.item(epic, Wave.numbered(2), "B");
        fixture.complete(a);

        List<WaveStatus> report = sequencer.report(epic);

        assertEquals(2, report.size());
        assertEquals(new WaveStatus(Wave.numbered(1), 1, 1, true, false), report.get(0));
        assertEquals(new WaveStatus(Wave.numbered(2), 1, 0, true, true), report.get(1));
        assertTrue(report.get(0).isComplete());
        assertEquals(Optional.of(Wave.numbered(2)), sequencer.activeWave(fixture.repository.epic(epic)));
    }
}
