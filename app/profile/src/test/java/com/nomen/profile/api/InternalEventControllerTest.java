package com.nomen.profile.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.nomen.profile.api.request.IdentitySyncRequest;
import com.nomen.profile.api.response.IdentitySyncResponse;
import com.nomen.profile.model.AccountRecord;
import com.nomen.profile.service.AccountBindingService;
import com.nomen.profile.service.ProfileConsolidationService;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(InternalEventController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ProfileApiExceptionHandler.class)
class InternalEventControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private AccountBindingService accountBindingService;
  @MockitoBean private ProfileConsolidationService profileConsolidationService;

  @Test
  void principalCreatedReturns201WhenAccountIsNew() throws Exception {
    when(accountBindingService.bindPrincipal("account-1"))
        .thenReturn(
            new AccountBindingService.Binding(
                new AccountRecord("account-1", null, Instant.EPOCH, Instant.EPOCH), true));

    mockMvc
        .perform(
            post("/internal/principals")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"principalId\":\"account-1\"}"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.accountId").value("account-1"))
        .andExpect(jsonPath("$.profileId").doesNotExist());
  }

  @Test
  void principalCreatedReturns200WhenAccountAlreadyExists() throws Exception {
    when(accountBindingService.bindPrincipal("account-1"))
        .thenReturn(
            new AccountBindingService.Binding(
                new AccountRecord("account-1", "profile-1", Instant.EPOCH, Instant.EPOCH),
                false));

    mockMvc
        .perform(
            post("/internal/principals")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"principalId\":\"account-1\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.profileId").value("profile-1"));
  }

  @Test
  void syncIdentityMapsLockConflictTo409() throws Exception {
    when(profileConsolidationService.syncIdentity(any(IdentitySyncRequest.class)))
        .thenThrow(new ConcurrencyFailureException("identity owner kept changing while locking"));

    mockMvc
        .perform(
            post("/internal/identities:sync")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"accountId":"account-1","provider":"google","providerUserId":"sub-1"}
                    """))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("CONFLICT"));
  }

  @Test
  void syncIdentityReturnsBoundAccountAndProfile() throws Exception {
    when(profileConsolidationService.syncIdentity(any(IdentitySyncRequest.class)))
        .thenReturn(new IdentitySyncResponse("account-1", "profile-1", "identity-1"));

    mockMvc
        .perform(
            post("/internal/identities:sync")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"identityId":"identity-1","accountId":"account-1","provider":"google",
                     "providerUserId":"sub-1","claims":{"name":"Alice","email":"a@example.com"}}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.accountId").value("account-1"))
        .andExpect(jsonPath("$.profileId").value("profile-1"))
        .andExpect(jsonPath("$.identityId").value("identity-1"));
  }

  @Test
  void syncIdentityMapsValidationFailureTo400() throws Exception {
    when(profileConsolidationService.syncIdentity(any(IdentitySyncRequest.class)))
        .thenThrow(new IllegalArgumentException("provider is required"));

    mockMvc
        .perform(
            post("/internal/identities:sync")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"accountId\":\"account-1\",\"providerUserId\":\"sub-1\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"))
        .andExpect(jsonPath("$.message").value("provider is required"));
  }
}
