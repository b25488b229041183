/*
 * どこで: app/profile/src/main/java/com/nomen/profile/api/response/ProviderLinksResponse.java
 * 何を: GET /me/providers の出力 DTO
 * なぜ: 「N 件のアカウントを連携中」の表示に必要な provider 別件数だけを返すため
 */
package com.nomen.profile.api.response;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ProviderLinksResponse(String accountId, Map<String, Long> providers, long total) {

    public ProviderLinksResponse {
        // provider 名の順序を保ったまま不変にする。
        providers = providers == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(providers));
    }
}
