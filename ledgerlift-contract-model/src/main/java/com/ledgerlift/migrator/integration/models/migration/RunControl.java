package com.ledgerlift.migrator.integration.models.migration;

import com.ledgerlift.migrator.integration.contract.migration.IRunControl;

import java.util.concurrent.atomic.AtomicBoolean;

public class RunControl implements IRunControl {

    private final AtomicBoolean aborted = new AtomicBoolean(false);

    @Override
    public void abort() {
        aborted.set(true);
    }

    @Override
    public boolean isAborted() {
        return aborted.get();
    }
}
