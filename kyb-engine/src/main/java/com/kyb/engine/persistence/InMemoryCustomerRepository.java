package com.kyb.engine.persistence;

import com.kyb.core.model.Customer;
import com.kyb.core.repository.CustomerRepository;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed customer directory, in the order it was configured.
 */
public class InMemoryCustomerRepository implements CustomerRepository {

    private final Map<String, Customer> customers = new LinkedHashMap<>();

    public InMemoryCustomerRepository(Collection<Customer> customers) {
        for (Customer customer : customers) {
            if (this.customers.putIfAbsent(customer.customerId(), customer) != null) {
                throw new IllegalArgumentException("Duplicate customer id: " + customer.customerId());
            }
        }
    }

    @Override
    public List<Customer> findAll() {
        return List.copyOf(customers.values());
    }

    @Override
    public Optional<Customer> findById(String customerId) {
        if (customerId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(customers.get(customerId));
    }
}
