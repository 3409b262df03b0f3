package com.rfqlog.application.service;

import com.rfqlog.domain.exception.ValidationException;
import com.rfqlog.domain.model.ChangeRecord;
import com.rfqlog.domain.model.RevisionTree;
import com.rfqlog.domain.model.RevisionTree.ActorGroup;
import com.rfqlog.domain.model.RevisionTree.DateGroup;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Groups a chronological change list into date → actor → change.
 *
 * <p>Dates come newest first and are taken in one reference zone. Within a date, actors keep the
 * order in which they first appear and their changes stay oldest first.
 */
public class RevisionTreeBuilder {

    private final ZoneId referenceZone;

    public RevisionTreeBuilder(ZoneId referenceZone) {
        this.referenceZone = Objects.requireNonNull(referenceZone, "referenceZone");
    }

    /**
     * Build the tree
     * @param records Changes as returned by the revision store, oldest first
     */
    public RevisionTree build(List<ChangeRecord> records) {
        if (records == null || records.isEmpty()) {
            return RevisionTree.empty();
        }

        Map<LocalDate, Map<String, List<ChangeRecord>>> byDate = new LinkedHashMap<>();
        for (ChangeRecord record : records) {
            if (record.getChangedAt() == null) {
                throw new ValidationException("change " + record.getId() + " has no timestamp");
            }
            if (record.getChangedBy() == null || record.getChangedBy().isBlank()) {
                throw new ValidationException("change " + record.getId() + " has no actor");
            }
            LocalDate date = record.getChangedAt().atZone(referenceZone).toLocalDate();
            byDate.computeIfAbsent(date, d -> new LinkedHashMap<>())
                    .computeIfAbsent(record.getChangedBy(), a -> new ArrayList<>())
                    .add(record);
        }

        List<DateGroup> dates = new ArrayList<>();
        byDate.entrySet().stream()
                .sorted(Map.Entry.<LocalDate, Map<String, List<ChangeRecord>>>comparingByKey(Comparator.reverseOrder()))
                .forEach(entry -> dates.add(new DateGroup(entry.getKey(), actorGroups(entry.getValue()))));

        return new RevisionTree(List.copyOf(dates));
    }

    private List<ActorGroup> actorGroups(Map<String, List<ChangeRecord>> byActor) {
        List<ActorGroup> actors = new ArrayList<>();
        byActor.forEach((actor, changes) -> actors.add(new ActorGroup(actor, List.copyOf(changes))));
        return List.copyOf(actors);
    }
}
