package com.baton.core.wave;

import com.baton.core.error.CoordinationException;
import com.baton.core.error.RuleViolation;
import com.baton.core.logging.MdcContext;
import com.baton.core.model.Epic;
import com.baton.core.model.Phase;
import com.baton.core.model.Wave;
import com.baton.core.model.WaveStatus;
import com.baton.core.model.WorkItem;
import com.baton.core.workitem.WorkItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Epic-level wave ordering: numbered waves {@code 1..N}, then {@code eval}, then {@code fix}.
 * <p>
 * A wave may be entered only once every work item in the waves before it is completed.
 * There is no partial override.
 */
@Service
public class WaveSequencer {

    private static final Logger log = LoggerFactory.getLogger(WaveSequencer.class);

    private final WorkItemRepository repository;

    public WaveSequencer(WorkItemRepository repository) {
        this.repository = repository;
    }

    public boolean canEnterWave(String epicId, Wave wave) {
        return canEnterWave(repository.epic(epicId), wave);
    }

    public boolean canEnterWave(Epic epic, Wave wave) {
        List<WorkItem> open = blockingItems(epic, wave);
        if (!open.isEmpty()) {
            log.debug("Wave {} of epic {} not enterable: {} earlier item(s) open {}", wave, epic.id(), open.size(),
                    open.stream().map(WorkItem::id).toList());
        }
        return open.isEmpty();
    }

    /**
     * Throws {@link RuleViolation#WAVE_NOT_ELIGIBLE} when the item's wave may not be entered yet.
     * Items outside an epic or without a wave tag are always eligible.
     */
    public void requireEnterable(WorkItem item) {
        if (item.epicId() == null || item.wave() == null) return;
        Epic epic = repository.epic(item.epicId());
        List<WorkItem> open = blockingItems(epic, item.wave());
        if (!open.isEmpty()) {
            MdcContext.setWave(epic.id(), item.wave().toString());
            Wave waiting = open.get(0).wave();
            throw new CoordinationException(RuleViolation.WAVE_NOT_ELIGIBLE, item.id(),
                    "Wave " + item.wave() + " of epic #" + epic.id() + " cannot start: wave " + waiting
                            + " still has open work " + open.stream().map(w -> "#" + w.id()).toList());
        }
    }

    /** The wave that must be complete before {@code wave}, if any. */
    public Optional<Wave> predecessor(Epic epic, Wave wave) {
        List<Wave> earlier = epic.waves().stream().filter(w -> w.compareTo(wave) < 0).toList();
        return earlier.isEmpty() ? Optional.empty() : Optional.of(earlier.get(earlier.size() - 1));
    }

    public Optional<Wave> activeWave(Epic epic) {
        return epic.activeWave();
    }

    public List<WaveStatus> report(String epicId) {
        return report(repository.epic(epicId));
    }

    public List<WaveStatus> report(Epic epic) {
        Optional<Wave> active = epic.activeWave();
        var statuses = new ArrayList<WaveStatus>();
        for (Wave wave : epic.waves()) {
            List<WorkItem> items = epic.itemsIn(wave);
            int completed = (int) items.stream().filter(i -> i.phase() == Phase.COMPLETED).count();
            statuses.add(new WaveStatus(wave, items.size(), completed, canEnterWave(epic, wave),
                    active.map(wave::equals).orElse(false)));
        }
        return statuses;
    }

    /** Non-completed items in every wave ordered before {@code wave}. */
    private static List<WorkItem> blockingItems(Epic epic, Wave wave) {
        return epic.children().stream()
                .filter(c -> c.wave() != null && c.wave().compareTo(wave) < 0)
                .filter(c -> c.phase() != Phase.COMPLETED)
                .sorted((a, b) -> a.wave().compareTo(b.wave()))
                .toList();
    }
}
