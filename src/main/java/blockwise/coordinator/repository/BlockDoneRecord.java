package blockwise.coordinator.repository;

import blockwise.coordinator.model.BlockKey;
import blockwise.coordinator.model.Roi;

import java.time.Instant;

/**
 * A stored completion marker.
 */
public record BlockDoneRecord(BlockKey block, Roi writeRoi, Instant finishedAt) {
}
