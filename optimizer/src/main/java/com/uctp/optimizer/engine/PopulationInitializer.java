package com.uctp.optimizer.engine;

import com.uctp.optimizer.model.Batch;
import com.uctp.optimizer.model.ClassAssignment;
import com.uctp.optimizer.model.Subject;
import com.uctp.optimizer.model.TimetableGrid;
import com.uctp.optimizer.snapshot.ProblemSnapshot;
import com.uctp.optimizer.snapshot.SessionKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.random.RandomGenerator;

/**
 * Seeds the first generation. Pinned sessions are committed verbatim, the rest
 * are dropped into random free cells.
 */
@Component
public class PopulationInitializer {
    private static final Logger logger = LoggerFactory.getLogger(PopulationInitializer.class);

    private final SessionPlacer sessionPlacer;

    public PopulationInitializer(SessionPlacer sessionPlacer) {
        this.sessionPlacer = sessionPlacer;
    }

    /**
     * Builds {@code size} individuals. When the snapshot carries a baseline
     * timetable, individual 0 is a copy of it.
     */
    public List<TimetableGrid> initialize(ProblemSnapshot snapshot, int size, RandomGenerator rng) {
        List<TimetableGrid> population = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            if (i == 0 && snapshot.getBaseline().isPresent()) {
                TimetableGrid seeded = snapshot.getBaseline().get().copy();
                snapshot.batchIds().forEach(seeded::addBatch);
                snapshot.getPinnedPlacements().forEach(seeded::place);
                population.add(seeded);
                continue;
            }
            population.add(createIndividual(snapshot, rng));
        }
        return population;
    }

    public TimetableGrid createIndividual(ProblemSnapshot snapshot, RandomGenerator rng) {
        TimetableGrid grid = TimetableGrid.empty(snapshot.getGeometry(), snapshot.batchIds());

        Map<SessionKey, Integer> tally = new LinkedHashMap<>(snapshot.getRequiredSessions());
        for (ClassAssignment pinned : snapshot.getPinnedPlacements()) {
            grid.place(pinned);
            tally.computeIfPresent(SessionKey.of(pinned.getBatchId(), pinned.getSubjectId()),
                    (key, count) -> count > 0 ? count - 1 : 0);
        }

        List<SessionKey> queued = new ArrayList<>();
        tally.forEach((key, count) -> {
            for (int i = 0; i < count; i++) {
                queued.add(key);
            }
        });
        shuffle(queued, rng);

        int numDays = snapshot.getGeometry().numWorkingDays();
        int slotsPerDay = snapshot.getGeometry().getSlotsPerDay();
        long maxAttempts = (long) queued.size() * slotsPerDay * numDays;
        Deque<SessionKey> pending = new ArrayDeque<>(queued);
        long attempts = 0;
        while (!pending.isEmpty() && attempts < maxAttempts) {
            attempts++;
            SessionKey session = pending.pollFirst();
            Batch batch = snapshot.batch(session.getBatchId());
            Subject subject = snapshot.subject(session.getSubjectId());
            int day = snapshot.getGeometry().randomDay(rng);
            int slot = snapshot.getGeometry().randomSlot(rng);
            Optional<ClassAssignment> placed = sessionPlacer.tryCell(snapshot, grid, batch, subject,
                    AssignmentIds.next(rng), day, slot, rng);
            if (placed.isPresent()) {
                grid.place(placed.get());
            } else {
                pending.addLast(session);
            }
        }
        if (!pending.isEmpty()) {
            logger.debug("Initial placement gave up on {} of {} sessions after {} attempts",
                    pending.size(), queued.size(), attempts);
        }
        return grid;
    }

    private static <T> void shuffle(List<T> items, RandomGenerator rng) {
        for (int i = items.size() - 1; i > 0; i--) {
            Collections.swap(items, i, rng.nextInt(i + 1));
        }
    }
}
