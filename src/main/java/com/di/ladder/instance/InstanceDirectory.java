package com.di.ladder.instance;

import com.di.ladder.kind.EntityKind;
import com.di.ladder.model.InstanceOccupancy;
import com.di.ladder.model.Tier;
import com.di.ladder.store.LadderStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of a tier's instances and their occupancy. Placeholders are not counted.
 */
public class InstanceDirectory<E> {

    private final EntityKind<E> kind;
    private final LadderStore<E> store;

    public InstanceDirectory(EntityKind<E> kind, LadderStore<E> store) {
        this.kind = kind;
        this.store = store;
    }

    /**
     * Instances of {@code tier} that currently have members, ascending by instance number.
     * Empty when the tier has no members.
     */
    public List<InstanceOccupancy> listInstances(Tier tier) {
        Map<Integer, Integer> counts = store.countMembersByInstance(tier);
        List<InstanceOccupancy> instances = new ArrayList<>(counts.size());
        counts.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> instances.add(new InstanceOccupancy(tier, e.getKey(), e.getValue(), kind.capacity())));
        return instances;
    }
}
