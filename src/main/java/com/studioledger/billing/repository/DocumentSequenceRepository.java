package com.studioledger.billing.repository;

import com.studioledger.billing.model.DocumentSequence;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface DocumentSequenceRepository extends JpaRepository<DocumentSequence, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints({ @QueryHint(name = "jakarta.persistence.lock.timeout", value = "10000") })
    @Query("SELECT s FROM DocumentSequence s WHERE s.documentType = :documentType")
    Optional<DocumentSequence> findForUpdate(@Param("documentType") String documentType);
}
