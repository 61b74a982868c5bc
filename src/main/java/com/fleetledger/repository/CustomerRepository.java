package com.fleetledger.repository;

import com.fleetledger.model.Customer;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface CustomerRepository extends JpaRepository<Customer, Long> {

    // Lowest id first, so the first element is the canonical owner of a shared plate
    @Query("select c from Customer c where :plate member of c.assignedLicensePlates order by c.id asc")
    List<Customer> findByAssignedLicensePlate(@Param("plate") String licensePlate);
}
