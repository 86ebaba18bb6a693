package com.example.planner.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import com.example.planner.domain.entity.Principal;
import com.example.planner.domain.entity.PrincipalRole;
import com.example.planner.exception.InvalidCredentialsException;
import com.example.planner.repository.PrincipalRepository;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

@ExtendWith(MockitoExtension.class)
@DisplayName("CredentialVerifier")
class CredentialVerifierTest {

  private final PasswordEncoder passwordEncoder = new BCryptPasswordEncoder(4);

  @Mock
  private PrincipalRepository principalRepository;

  private CredentialVerifier credentialVerifier;

  @BeforeEach
  void setUp() {
    credentialVerifier = new CredentialVerifier(principalRepository, passwordEncoder);
  }

  private Principal child(boolean active) {
    return Principal.builder()
        .id("child-1")
        .role(PrincipalRole.CHILD)
        .loginName("tim")
        .credentialHash(passwordEncoder.encode("1234"))
        .active(active)
        .build();
  }

  @Test
  @DisplayName("accepts the right PIN and normalizes the username")
  void validPin() {
    // given
    when(principalRepository.findByLoginNameAndRole("tim", PrincipalRole.CHILD)).thenReturn(Optional.of(child(true)));

    // when
    Principal principal = credentialVerifier.verifyChild("  Tim ", "1234");

    // then
    assertThat(principal.getId()).isEqualTo("child-1");
  }

  @Test
  @DisplayName("a wrong PIN carries the principal id for anomaly scoring")
  void wrongPin() {
    // given
    when(principalRepository.findByLoginNameAndRole("tim", PrincipalRole.CHILD)).thenReturn(Optional.of(child(true)));

    // when / then
    assertThatThrownBy(() -> credentialVerifier.verifyChild("tim", "4321"))
        .isInstanceOfSatisfying(InvalidCredentialsException.class,
            e -> assertThat(e.getPrincipalId()).isEqualTo("child-1"));
  }

  @Test
  @DisplayName("an unknown username fails without a principal id")
  void unknownUser() {
    // given
    when(principalRepository.findByLoginNameAndRole("nobody", PrincipalRole.CHILD)).thenReturn(Optional.empty());

    // when / then
    assertThatThrownBy(() -> credentialVerifier.verifyChild("nobody", "1234"))
        .isInstanceOfSatisfying(InvalidCredentialsException.class,
            e -> assertThat(e.getPrincipalId()).isNull());
  }

  @Test
  @DisplayName("an inactive principal is rejected even with the right PIN")
  void inactivePrincipal() {
    // given
    when(principalRepository.findByLoginNameAndRole("tim", PrincipalRole.CHILD)).thenReturn(Optional.of(child(false)));

    // when / then
    assertThatThrownBy(() -> credentialVerifier.verifyChild("tim", "1234"))
        .isInstanceOf(InvalidCredentialsException.class);
  }

  @Test
  @DisplayName("an empty secret is rejected before any lookup")
  void emptySecret() {
    assertThatThrownBy(() -> credentialVerifier.verifyAdult("pat@example.com", ""))
        .isInstanceOf(InvalidCredentialsException.class);
  }
}
