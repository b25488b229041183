package com.nomen.profile.service;

import com.nomen.profile.model.AttributeKey;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * identity の claims から profile 属性の候補値を取り出す。
 *
 * <p>キーごとに {@link AttributeKey#claimNames()} の順で評価し、trim 後に空でない最初の値を採用する。
 * 採用値は trim 済みで返す。どの claim にも値がないキーは結果に含めない。
 */
@Component
public class ClaimsAttributeExtractor {

  public Map<AttributeKey, String> extract(Map<String, String> claims) {
    if (claims == null || claims.isEmpty()) {
      return Map.of();
    }
    final Map<AttributeKey, String> candidates = new EnumMap<>(AttributeKey.class);
    for (AttributeKey key : AttributeKey.values()) {
      for (String claimName : key.claimNames()) {
        final String value = claims.get(claimName);
        if (value != null && !value.trim().isEmpty()) {
          candidates.put(key, value.trim());
          break;
        }
      }
    }
    return Collections.unmodifiableMap(candidates);
  }
}
