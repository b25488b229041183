package com.nomen.profile.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.nomen.profile.api.response.MergeCandidateResponse;
import com.nomen.profile.api.response.MergeExecutionResponse;
import com.nomen.profile.api.response.MergeRequestCreatedResponse;
import com.nomen.profile.api.response.MergeRequesterInfoResponse;
import com.nomen.profile.service.AuthDirectoryIntegrationException;
import com.nomen.profile.service.MergeCandidateService;
import com.nomen.profile.service.MergeRequestService;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

@WebMvcTest(MergeController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ProfileApiExceptionHandler.class)
class MergeControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private MergeRequestService mergeRequestService;
  @MockitoBean private MergeCandidateService mergeCandidateService;

  @Test
  void createMergeRequestReturnsTokenAndExpiry() throws Exception {
    when(mergeRequestService.createMergeRequest("account-a"))
        .thenReturn(
            new MergeRequestCreatedResponse("token-1", Instant.parse("2026-03-01T00:10:00Z")));

    mockMvc
        .perform(post("/me/merge-requests").header("X-Account-Id", "account-a"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.token").value("token-1"))
        .andExpect(jsonPath("$.expiresAt").value("2026-03-01T00:10:00Z"));
  }

  @Test
  void lookupReturnsRequesterInfo() throws Exception {
    when(mergeRequestService.getRequesterInfo("token-1", "account-b"))
        .thenReturn(new MergeRequesterInfoResponse("Alice", "a@example.com"));

    mockMvc
        .perform(tokenRequest("/merge-requests:lookup", "account-b", "token-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.requesterDisplayName").value("Alice"))
        .andExpect(jsonPath("$.requesterEmail").value("a@example.com"));
  }

  @Test
  void lookupMapsExpiredTokenTo410() throws Exception {
    when(mergeRequestService.getRequesterInfo("token-1", "account-b"))
        .thenThrow(new MergeTokenExpiredException("merge token expired"));

    mockMvc
        .perform(tokenRequest("/merge-requests:lookup", "account-b", "token-1"))
        .andExpect(status().isGone())
        .andExpect(jsonPath("$.code").value("EXPIRED"));
  }

  @Test
  void lookupMapsOwnTokenToSameAccount() throws Exception {
    when(mergeRequestService.getRequesterInfo("token-1", "account-a"))
        .thenThrow(new SameAccountException("merge token was issued by the caller"));

    mockMvc
        .perform(tokenRequest("/merge-requests:lookup", "account-a", "token-1"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("SAME_ACCOUNT"));
  }

  @Test
  void lookupRejectsMissingToken() throws Exception {
    mockMvc
        .perform(
            post("/merge-requests:lookup")
                .header("X-Account-Id", "account-b")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
    verifyNoInteractions(mergeRequestService);
  }

  @Test
  void cancelReturns204() throws Exception {
    mockMvc
        .perform(tokenRequest("/merge-requests:cancel", "account-a", "token-1"))
        .andExpect(status().isNoContent());

    verify(mergeRequestService).cancelMergeRequest("token-1");
  }

  @Test
  void executeReturnsMergeOutcome() throws Exception {
    when(mergeRequestService.executeMerge("token-1", "account-b"))
        .thenReturn(
            new MergeExecutionResponse(
                true, "profile-a", "profile-b", 3, 1, true, "account-b", true));

    mockMvc
        .perform(tokenRequest("/merge-requests:execute", "account-b", "token-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true))
        .andExpect(jsonPath("$.targetProfileId").value("profile-a"))
        .andExpect(jsonPath("$.sourceAccountDeleted").value(true))
        .andExpect(jsonPath("$.sourceAccountId").value("account-b"))
        .andExpect(jsonPath("$.reauthenticationRequired").value(true));
  }

  @Test
  void executeMapsMergeRejectionReasons() throws Exception {
    when(mergeRequestService.executeMerge("token-1", "account-b"))
        .thenThrow(
            new MergeRejectedException(
                MergeRejectedException.Reason.ALREADY_MERGED, "accounts already share a profile"));

    mockMvc
        .perform(tokenRequest("/merge-requests:execute", "account-b", "token-1"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("ALREADY_MERGED"));
  }

  @Test
  void executeMapsDirectoryTimeoutTo504() throws Exception {
    when(mergeRequestService.executeMerge("token-1", "account-b"))
        .thenThrow(
            new AuthDirectoryIntegrationException(
                AuthDirectoryIntegrationException.Reason.TIMEOUT, "auth directory request timeout"));

    mockMvc
        .perform(tokenRequest("/merge-requests:execute", "account-b", "token-1"))
        .andExpect(status().isGatewayTimeout())
        .andExpect(jsonPath("$.code").value("TIMEOUT"));
  }

  @Test
  void executeMapsDirectoryFailureTo502() throws Exception {
    when(mergeRequestService.executeMerge("token-1", "account-b"))
        .thenThrow(
            new AuthDirectoryIntegrationException(
                AuthDirectoryIntegrationException.Reason.BAD_GATEWAY, "auth directory failed"));

    mockMvc
        .perform(tokenRequest("/merge-requests:execute", "account-b", "token-1"))
        .andExpect(status().isBadGateway())
        .andExpect(jsonPath("$.code").value("BAD_GATEWAY"));
  }

  @Test
  void executeMapsIntegrityViolationToConflict() throws Exception {
    when(mergeRequestService.executeMerge(any(), any()))
        .thenThrow(new DataIntegrityViolationException("duplicate key"));

    mockMvc
        .perform(tokenRequest("/merge-requests:execute", "account-b", "token-1"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("CONFLICT"));
  }

  @Test
  void mergeCandidateReturnsOtherAccount() throws Exception {
    when(mergeCandidateService.checkMergeCandidate("github", "gh-1", "account-a"))
        .thenReturn(
            new MergeCandidateResponse(true, "account-b", "profile-b", "Bob", "b@example.com"));

    mockMvc
        .perform(
            get("/me/merge-candidates")
                .header("X-Account-Id", "account-a")
                .param("provider", "github")
                .param("providerUserId", "gh-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.canMerge").value(true))
        .andExpect(jsonPath("$.otherAccountId").value("account-b"));
  }

  @Test
  void mergeCandidateOwnedByCallerIsAlreadyOwned() throws Exception {
    when(mergeCandidateService.checkMergeCandidate("github", "gh-1", "account-a"))
        .thenThrow(new IdentityAlreadyOwnedException("identity already belongs to the caller"));

    mockMvc
        .perform(
            get("/me/merge-candidates")
                .header("X-Account-Id", "account-a")
                .param("provider", "github")
                .param("providerUserId", "gh-1"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("ALREADY_OWNED"));
  }

  private MockHttpServletRequestBuilder tokenRequest(String path, String accountId, String token) {
    return post(path)
        .header("X-Account-Id", accountId)
        .contentType(MediaType.APPLICATION_JSON)
        .content("{\"token\":\"" + token + "\"}");
  }
}
