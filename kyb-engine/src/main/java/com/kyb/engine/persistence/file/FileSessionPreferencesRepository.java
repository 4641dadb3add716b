package com.kyb.engine.persistence.file;

import com.fasterxml.jackson.core.type.TypeReference;
import com.kyb.core.repository.SessionPreferencesRepository;

import java.util.Optional;

public class FileSessionPreferencesRepository implements SessionPreferencesRepository {

    static final String KEY = "selected_customer_id";

    private final JsonFileStore store;

    public FileSessionPreferencesRepository(JsonFileStore store) {
        this.store = store;
    }

    @Override
    public void saveSelectedCustomerId(String customerId) {
        store.write(KEY, customerId);
    }

    @Override
    public Optional<String> findSelectedCustomerId() {
        return store.read(KEY, new TypeReference<String>() {});
    }

    @Override
    public void clearSelectedCustomerId() {
        store.delete(KEY);
    }
}
