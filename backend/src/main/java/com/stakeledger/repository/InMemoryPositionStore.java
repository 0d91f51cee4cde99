package com.stakeledger.repository;

import com.stakeledger.model.PositionKey;
import com.stakeledger.model.StakePosition;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryPositionStore implements PositionStore {

    private final Map<PositionKey, StakePosition> positions = new ConcurrentHashMap<>();

    @Override
    public Optional<StakePosition> findByKey(PositionKey key) {
        return Optional.ofNullable(positions.get(key)).map(StakePosition::copy);
    }

    @Override
    public List<StakePosition> findByPoolId(long poolId) {
        return positions.values().stream()
                .filter(position -> position.getPoolId() == poolId)
                .sorted(Comparator.comparing(StakePosition::getAccount))
                .map(StakePosition::copy)
                .toList();
    }

    @Override
    public StakePosition save(StakePosition position) {
        Objects.requireNonNull(position, "position is required");
        positions.put(position.key(), position.copy());
        return position;
    }
}
