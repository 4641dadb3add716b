package com.kyb.engine.persistence;

import com.kyb.core.repository.SessionPreferencesRepository;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

public class InMemorySessionPreferencesRepository implements SessionPreferencesRepository {

    private final AtomicReference<String> selectedCustomerId = new AtomicReference<>();

    @Override
    public void saveSelectedCustomerId(String customerId) {
        selectedCustomerId.set(customerId);
    }

    @Override
    public Optional<String> findSelectedCustomerId() {
        return Optional.ofNullable(selectedCustomerId.get());
    }

    @Override
    public void clearSelectedCustomerId() {
        selectedCustomerId.set(null);
    }
}
