package com.example.planner.service;

import com.example.planner.domain.entity.Principal;
import com.example.planner.domain.entity.PrincipalRole;
import com.example.planner.exception.InvalidCredentialsException;
import com.example.planner.repository.PrincipalRepository;
import java.util.Locale;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Checks username/PIN (children) and email/password (adults) against the stored BCrypt hash.
 * Stateless; an unknown login name costs the same hash comparison as a wrong secret.
 */
@Slf4j
@Service
public class CredentialVerifier {

  private final PrincipalRepository principalRepository;
  private final PasswordEncoder passwordEncoder;
  private final String unknownPrincipalHash;

  public CredentialVerifier(PrincipalRepository principalRepository, PasswordEncoder passwordEncoder) {
    this.principalRepository = principalRepository;
    this.passwordEncoder = passwordEncoder;
    this.unknownPrincipalHash = passwordEncoder.encode("unknown-principal-placeholder");
  }

  @Transactional(readOnly = true)
  public Principal verifyChild(String username, String pin) {
    return verify(normalize(username), pin, PrincipalRole.CHILD);
  }

  @Transactional(readOnly = true)
  public Principal verifyAdult(String email, String password) {
    return verify(normalize(email), password, PrincipalRole.ADULT);
  }

  private Principal verify(String loginName, String secret, PrincipalRole role) {
    if (loginName == null || secret == null || secret.isEmpty()) {
      throw new InvalidCredentialsException("Missing credentials");
    }

    Optional<Principal> principal = principalRepository.findByLoginNameAndRole(loginName, role);
    String storedHash = principal.map(Principal::getCredentialHash).orElse(unknownPrincipalHash);
    boolean matches = passwordEncoder.matches(secret, storedHash);

    if (principal.isEmpty() || !matches) {
      log.info("Credential check failed for {} login", role);
      throw new InvalidCredentialsException("Invalid credentials", principal.map(Principal::getId).orElse(null));
    }
    if (!principal.get().isActive()) {
      log.info("Credential check rejected inactive {} principal {}", role, principal.get().getId());
      throw new InvalidCredentialsException("Principal is inactive");
    }
    return principal.get();
  }

  private String normalize(String loginName) {
    return loginName == null ? null : loginName.trim().toLowerCase(Locale.ROOT);
  }
}
