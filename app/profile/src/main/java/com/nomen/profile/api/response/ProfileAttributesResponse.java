package com.nomen.profile.api.response;

import java.util.List;

public record ProfileAttributesResponse(String profileId, List<ProfileAttributeResponse> attributes) {

  public ProfileAttributesResponse {
    attributes = attributes == null ? List.of() : List.copyOf(attributes);
  }
}
