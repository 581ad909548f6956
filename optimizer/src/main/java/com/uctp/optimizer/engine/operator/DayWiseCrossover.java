package com.uctp.optimizer.engine.operator;

import com.uctp.optimizer.model.TimetableGrid;
import com.uctp.optimizer.snapshot.ProblemSnapshot;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.random.RandomGenerator;

/**
 * Cuts the week at a random working day: every batch takes the days before the
 * cut from the first parent and the rest from the second. The child is not
 * checked for clashes; repair runs afterwards.
 */
@Component
public class DayWiseCrossover {

    public TimetableGrid cross(ProblemSnapshot snapshot, TimetableGrid first, TimetableGrid second,
                               RandomGenerator rng) {
        List<Integer> workingDays = snapshot.getGeometry().getWorkingDays();
        int cutDay = workingDays.get(rng.nextInt(workingDays.size()));
        return cross(first, second, cutDay);
    }

    TimetableGrid cross(TimetableGrid first, TimetableGrid second, int cutDay) {
        TimetableGrid child = new TimetableGrid(first.getDayCount(), first.getSlotsPerDay());
        Set<String> batchIds = new LinkedHashSet<>(first.batchIds());
        batchIds.addAll(second.batchIds());
        for (String batchId : batchIds) {
            child.addBatch(batchId);
            for (int day = 0; day < child.getDayCount(); day++) {
                child.copyDayFrom(day < cutDay ? first : second, batchId, day);
            }
        }
        return child;
    }
}
