package com.bank.payout.repository.memory;

import com.bank.payout.model.EmergencyHaltState;
import com.bank.payout.repository.SystemControlRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.concurrent.atomic.AtomicReference;

@Repository
@ConditionalOnProperty(name = "payout.storage", havingValue = "memory")
public class InMemorySystemControlRepository implements SystemControlRepository {

    private final AtomicReference<EmergencyHaltState> haltState =
            new AtomicReference<>(EmergencyHaltState.running());

    @Override
    public EmergencyHaltState getHaltState() {
        return haltState.get();
    }

    @Override
    public void saveHaltState(EmergencyHaltState state) {
        haltState.set(state);
    }
}
