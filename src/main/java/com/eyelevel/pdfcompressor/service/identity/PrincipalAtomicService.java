package com.eyelevel.pdfcompressor.service.identity;

import com.eyelevel.pdfcompressor.model.Principal;
import com.eyelevel.pdfcompressor.repository.PrincipalRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Service
@Slf4j
@RequiredArgsConstructor
public class PrincipalAtomicService {

    private final PrincipalRepository principalRepository;

    /**
     * Reads the principal in a fresh transaction so that a row committed by a concurrent creator is visible.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW, readOnly = true)
    public Optional<Principal> findByEmail(final String email) {
        return principalRepository.findByEmail(email);
    }

    /**
     * Attempts to insert a new principal in its own transaction.
     *
     * @throws DataIntegrityViolationException if a principal with the same email was created concurrently.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Principal attemptToCreate(final String email, final String fullName) throws DataIntegrityViolationException {
        final Principal principal = new Principal();
        principal.setEmail(email);
        principal.setFullName(fullName);
        principal.setActive(true);
        final Principal saved = principalRepository.saveAndFlush(principal);
        log.info("Created principal {} for '{}'.", saved.getId(), email);
        return saved;
    }
}
