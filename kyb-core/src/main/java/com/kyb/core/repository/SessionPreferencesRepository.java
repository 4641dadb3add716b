package com.kyb.core.repository;

import java.util.Optional;

/**
 * Durable key-value preferences for the dashboard session.
 */
public interface SessionPreferencesRepository {

    /**
     * Remember the customer the last run was started for.
     */
    void saveSelectedCustomerId(String customerId);

    /**
     * The customer the last run was started for, surviving restarts.
     */
    Optional<String> findSelectedCustomerId();

    void clearSelectedCustomerId();
}
