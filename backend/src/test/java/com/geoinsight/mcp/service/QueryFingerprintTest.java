package com.geoinsight.mcp.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("QueryFingerprint")
class QueryFingerprintTest {

    @Test
    @DisplayName("Whitespace and full-width forms normalize to the same text")
    void normalizesWhitespaceAndCompatibilityForms() {
        assertThat(QueryFingerprint.normalize("  강남구   매출\t추이 ")).isEqualTo("강남구 매출 추이");
        assertThat(QueryFingerprint.normalize("ＴＯＰ５ 유동인구")).isEqualTo("TOP5 유동인구");
    }

    @Test
    @DisplayName("Same text under the same parser and schema gives the same fingerprint")
    void stableForEquivalentText() {
        String a = QueryFingerprint.fingerprint("강남구 매출 추이", "model", "tpl", "2");
        String b = QueryFingerprint.fingerprint(" 강남구  매출 추이", "model", "tpl", "2");

        assertThat(a).isEqualTo(b).hasSize(64);
    }

    @Test
    @DisplayName("Parser identity and schema version are part of the fingerprint")
    void parserAndSchemaChangeFingerprint() {
        String base = QueryFingerprint.fingerprint("강남구 매출 추이", "model", "tpl", "2");

        assertThat(QueryFingerprint.fingerprint("강남구 매출 추이", "other", "tpl", "2")).isNotEqualTo(base);
        assertThat(QueryFingerprint.fingerprint("강남구 매출 추이", "model", "tpl2", "2")).isNotEqualTo(base);
        assertThat(QueryFingerprint.fingerprint("강남구 매출 추이", "model", "tpl", "3")).isNotEqualTo(base);
    }
}
