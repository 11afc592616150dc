package com.flock.server.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flock.server.model.Principal;
import com.flock.server.repository.PrincipalRepository;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

@ExtendWith(MockitoExtension.class)
class CredentialGateTest {

  @Mock private PrincipalRepository principalRepository;

  @InjectMocks private CredentialGate credentialGate;

  @Test
  void acceptsMatchingToken() {
    when(principalRepository.findByUsername("alice"))
        .thenReturn(Optional.of(new Principal("alice", "Alice", "abc123", Instant.EPOCH)));

    assertThat(credentialGate.authenticate("alice", "abc123")).isTrue();
  }

  @Test
  void rejectsWrongTokenAndUnknownUser() {
    when(principalRepository.findByUsername("alice"))
        .thenReturn(Optional.of(new Principal("alice", "Alice", "abc123", Instant.EPOCH)));
    when(principalRepository.findByUsername("bob")).thenReturn(Optional.empty());

    assertThat(credentialGate.authenticate("alice", "abc124")).isFalse();
    assertThat(credentialGate.authenticate("bob", "abc123")).isFalse();
  }

  @Test
  void rejectsBlankInputWithoutLookup() {
    assertThat(credentialGate.authenticate(null, "x")).isFalse();
    assertThat(credentialGate.authenticate(" ", "x")).isFalse();
    assertThat(credentialGate.authenticate("alice", null)).isFalse();
    verifyNoInteractions(principalRepository);
  }

  @Test
  void failsClosedWhenTheStoreTimesOut() {
    when(principalRepository.findByUsername("alice"))
        .thenThrow(new QueryTimeoutException("timeout"));

    assertThat(credentialGate.authenticate("alice", "abc123")).isFalse();
  }
}
