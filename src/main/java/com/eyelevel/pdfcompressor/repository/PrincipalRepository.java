package com.eyelevel.pdfcompressor.repository;

import com.eyelevel.pdfcompressor.model.Principal;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

/**
 * Spring Data JPA repository for the {@link Principal} entity.
 */
@Repository
public interface PrincipalRepository extends JpaRepository<Principal, UUID> {

    Optional<Principal> findByEmail(String email);
}
