package com.licenseguard.api.subscription.entities;

import com.licenseguard.api.subscription.models.PlanTier;
import lombok.NonNull;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * A JPA {@link Repository} declaration for database interactions of {@link Plan} entity.
 */
@Repository
public interface PlanRepository extends CrudRepository<Plan, Short> {

    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from Plan e where e.name = ?1")
    Optional<Plan> findByName(@NonNull PlanTier name);
}
