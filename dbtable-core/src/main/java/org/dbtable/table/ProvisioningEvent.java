package org.dbtable.table;

import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * Passed to a table after ensureSchema changed it: either the table was
 * created, or the listed columns were added to it.
 */
@Getter
public final class ProvisioningEvent {

    public enum Action {
        CREATED,
        ALTERED
    }

    private final Action action;
    private final List<String> columns;

    private ProvisioningEvent(Action action, List<String> columns) {
        this.action = action;
        this.columns = Collections.unmodifiableList(columns);
    }

    static ProvisioningEvent created(List<String> columns) {
        return new ProvisioningEvent(Action.CREATED, columns);
    }

    static ProvisioningEvent altered(List<String> addedColumns) {
        return new ProvisioningEvent(Action.ALTERED, addedColumns);
    }

    public boolean isCreated() {
        return action == Action.CREATED;
    }

    @Override
    public String toString() {
        return action + " " + columns;
    }
}
