package com.ledgerlift.migrator.core.engine.planning;

import com.ledgerlift.migrator.core.exception.InvalidConfigurationException;
import com.ledgerlift.migrator.integration.contract.migration.IBatch;
import com.ledgerlift.migrator.integration.contract.migration.IBatchPlanner;
import com.ledgerlift.migrator.integration.contract.participant.IParticipantAddress;
import com.ledgerlift.migrator.integration.models.migration.Batch;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

@Slf4j
public class BatchPlannerImpl implements IBatchPlanner {

    private BatchPlannerImpl() {}

    private static final class SingletonHelper {
        private static final BatchPlannerImpl INSTANCE = new BatchPlannerImpl();
    }

    public static IBatchPlanner getInstance() {
        return SingletonHelper.INSTANCE;
    }

    @Override
    public List<IBatch> plan(List<IParticipantAddress> participants, int batchSize) {
        if (batchSize <= 0) {
            throw new InvalidConfigurationException("batchSize must be positive, got [" + batchSize + "]");
        }
        int total = participants.size();
        List<IBatch> batches = new ArrayList<>();
        int index = 0;
        for (long start = 0; start < total; start += batchSize, index++) {
            int end = (int) Math.min(start + batchSize, total);
            batches.add(new Batch(index, participants.subList((int) start, end)));
        }
        log.info("Planned [{}] batches of up to [{}] for [{}] participants", batches.size(), batchSize, total);
        return List.copyOf(batches);
    }
}
