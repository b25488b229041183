package com.nomen.profile.api.response;

public record MergeRequesterInfoResponse(String requesterDisplayName, String requesterEmail) {
}
