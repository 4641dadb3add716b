package com.kyb.core.repository;

import com.kyb.core.model.Customer;

import java.util.List;
import java.util.Optional;

/**
 * Directory of customers the dashboard can run checks for.
 */
public interface CustomerRepository {

    /**
     * All available customers, in display order. Never null.
     */
    List<Customer> findAll();

    /**
     * Find a customer by id.
     *
     * @param customerId The customer ID
     * @return The customer if it is available
     */
    Optional<Customer> findById(String customerId);
}
