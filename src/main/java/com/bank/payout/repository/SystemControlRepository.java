package com.bank.payout.repository;

import com.bank.payout.model.EmergencyHaltState;

public interface SystemControlRepository {

    EmergencyHaltState getHaltState();

    void saveHaltState(EmergencyHaltState state);
}
