package com.ledgerlift.migrator.integration.contract.migration;

import com.ledgerlift.migrator.integration.contract.participant.IParticipantAddress;

import java.util.List;

/**
 * Partitions participants into fixed-size batches in stable order.
 */
public interface IBatchPlanner {

    /**
     * Batch {@code i} holds elements {@code [i*batchSize, min((i+1)*batchSize, n))}.
     *
     * @param participants participants in discovery order
     * @param batchSize positive batch size
     * @return batches in index order; empty for empty input
     */
    List<IBatch> plan(List<IParticipantAddress> participants, int batchSize);
}
