package com.baton.dispatch.api;

import com.baton.core.model.Epic;
import com.baton.core.model.Wave;
import com.baton.core.wave.WaveSequencer;
import com.baton.core.workitem.WorkItemRepository;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST controller for epic wave ordering.
 */
@RestController
@RequestMapping("/api/v1/epics")
public class EpicController {

    private final WorkItemRepository repository;
    private final WaveSequencer waveSequencer;

    public EpicController(WorkItemRepository repository, WaveSequencer waveSequencer) {
        this.repository = repository;
        this.waveSequencer = waveSequencer;
    }

    /**
     * GET /api/v1/epics/{id}/waves: Per-wave progress and the active wave.
     */
    @GetMapping("/{id}/waves")
    public ResponseEntity<Map<String, Object>> waves(@PathVariable String id) {
        Epic epic = repository.epic(id);
        List<WaveStatusResponse> waves = waveSequencer.report(epic).stream().map(WaveStatusResponse::from).toList();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("epic_id", epic.id());
        result.put("title", epic.title());
        result.put("active_wave", waveSequencer.activeWave(epic).map(Wave::toString).orElse(null));
        result.put("waves", waves);
        return ResponseEntity.ok(result);
    }

    /**
     * GET /api/v1/epics/{id}/waves/{wave}/eligibility: Whether work in the wave may start.
     */
    @GetMapping("/{id}/waves/{wave}/eligibility")
    public ResponseEntity<Map<String, Object>> eligibility(@PathVariable String id, @PathVariable String wave) {
        Optional<Wave> parsed = Wave.parse(wave);
        if (parsed.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid wave: " + wave));
        }
        Epic epic = repository.epic(id);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("epic_id", epic.id());
        result.put("wave", parsed.get().toString());
        result.put("enterable", waveSequencer.canEnterWave(epic, parsed.get()));
        result.put("predecessor", waveSequencer.predecessor(epic, parsed.get()).map(Wave::toString).orElse(null));
        return ResponseEntity.ok(result);
    }
}
