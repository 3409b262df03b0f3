package com.rfqlog.domain.model;

import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * History of one entity grouped for review: date (newest first), then actor, then change
 */
@Value
public class RevisionTree {
    List<DateGroup> dates;

    public static RevisionTree empty() {
        return new RevisionTree(List.of());
    }

    public boolean isEmpty() {
        return dates.isEmpty();
    }

    public int totalChanges() {
        return dates.stream().mapToInt(DateGroup::totalChanges).sum();
    }

    /**
     * Changes made on one calendar day
     */
    @Value
    public static class DateGroup {
        LocalDate date;
        List<ActorGroup> actors;

        public int totalChanges() {
            return actors.stream().mapToInt(actor -> actor.getChanges().size()).sum();
        }
    }

    /**
     * Changes made by one actor on one day, oldest first
     */
    @Value
    public static class ActorGroup {
        String actor;
        List<ChangeRecord> changes;
    }
}
