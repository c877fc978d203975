package edu.harvard.hms.dbmi.avillach.synth.data.reference;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Optional;

public record RepairReport(List<RepairAction> actions) {

    public static final RepairReport EMPTY = new RepairReport(List.of());

    public RepairReport {
        actions = ImmutableList.copyOf(actions);
    }

    public boolean isEmpty() {
        return actions.isEmpty();
    }

    public int totalFixes() {
        return actions.stream().mapToInt(RepairAction::count).sum();
    }

    public Optional<RepairAction> find(RepairType type) {
        return actions.stream().filter(action -> action.type() == type).findFirst();
    }
}
