package com.logistics.reconciliation.repository;

import com.logistics.reconciliation.entity.PayloadResult;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Stored payloads in {@code order_clean_payload}.
 */
@Repository
public interface PayloadResultRepository extends JpaRepository<PayloadResult, Long> {

    Optional<PayloadResult> findByDoNumber(String doNumber);

    /**
     * Offset/limit window ordered by id, for the payload listing.
     */
    @Query(value = "SELECT * FROM order_clean_payload ORDER BY id LIMIT :limit OFFSET :offset", nativeQuery = true)
    List<PayloadResult> findSlice(@Param("limit") int limit, @Param("offset") int offset);
}
