/*
 * どこで: app/profile/src/main/java/com/nomen/profile/model/AttributeKey.java
 * 何を: profile_attributes.attribute_key の固定集合と claims からの抽出優先順位
 * なぜ: provider ごとに異なる claim 名を 1 か所で吸収し、抽出ルールを型で固定するため
 */
package com.nomen.profile.model;

import java.util.Arrays;
import java.util.List;

public enum AttributeKey {
    DISPLAY_NAME("display_name", true, List.of("full_name", "name", "display_name")),
    PRIMARY_EMAIL("primary_email", true, List.of("email")),
    USERNAME("username", false, List.of("preferred_username", "user_name", "login")),
    AVATAR_URL("avatar_url", false, List.of("avatar_url", "picture"));

    private final String columnValue;
    private final boolean aggregated;
    private final List<String> claimNames;

    AttributeKey(String columnValue, boolean aggregated, List<String> claimNames) {
        this.columnValue = columnValue;
        this.aggregated = aggregated;
        this.claimNames = claimNames;
    }

    public String columnValue() {
        return columnValue;
    }

    /** profiles テーブルへ書き戻す対象 (display_name / primary_email) かどうか。 */
    public boolean aggregated() {
        return aggregated;
    }

    /** 先頭から順に評価し、最初に値を持つ claim を採用する。 */
    public List<String> claimNames() {
        return claimNames;
    }

    public static AttributeKey fromColumnValue(String value) {
        return Arrays.stream(values())
                .filter(key -> key.columnValue.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("unknown attribute_key: " + value));
    }

    public static List<String> columnValues() {
        return Arrays.stream(values()).map(AttributeKey::columnValue).toList();
    }
}
