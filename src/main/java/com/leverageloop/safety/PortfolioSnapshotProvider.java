package com.leverageloop.safety;

import com.leverageloop.domain.model.PortfolioSnapshot;
import java.util.Optional;

/**
 * Source of the current wallet snapshot. Empty when no snapshot has been taken yet.
 */
public interface PortfolioSnapshotProvider {

    Optional<PortfolioSnapshot> currentSnapshot();
}
