package com.studioledger.billing.repository;

import com.studioledger.billing.model.Account;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface AccountRepository extends JpaRepository<Account, Long> {
    Optional<Account> findByCode(String code);

    Optional<Account> findByCodeAndActiveTrue(String code);
}
