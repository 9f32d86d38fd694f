package com.flexboard.agent.connector.http;

import com.flexboard.agent.error.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("UrlTemplate Tests")
class UrlTemplateTest {

    @Test
    @DisplayName("Should encode path placeholders and append unused parameters")
    void expandsTemplate() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("tenant", "vpi co/ltd");
        params.put("status", List.of("open", "late"));
        params.put("skip", null);
        params.put("limit", 10);

        String uri = UrlTemplate.expand("https://erp.internal/api/", "/tenants/{tenant}/orders?sort=date", params).toString();

        assertThat(uri).isEqualTo("https://erp.internal/api/tenants/vpi%20co%2Fltd/orders?sort=date&status=open&status=late&limit=10");
    }

    @Test
    @DisplayName("Should keep absolute templates on the base host and join relative paths without a slash")
    void resolvesBase() {
        assertThat(UrlTemplate.expand("https://a/api", "https://A:443/x", Map.of()).toString()).isEqualTo("https://A:443/x");
        assertThat(UrlTemplate.expand(null, "https://b/x", Map.of()).toString()).isEqualTo("https://b/x");
        assertThat(UrlTemplate.expand("https://a/api", "reports", Map.of()).toString()).isEqualTo("https://a/api/reports");
    }

    @Test
    @DisplayName("Should reject absolute templates that leave the configured host")
    void rejectsForeignHosts() {
        assertThatThrownBy(() -> UrlTemplate.expand("https://a/api", "https://b/x", Map.of()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("https://a:443");
        assertThatThrownBy(() -> UrlTemplate.expand("https://a/api", "http://a/x", Map.of()))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> UrlTemplate.expand("https://a/api", "https://a:8443/x", Map.of()))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Should reject missing placeholder values and relative paths without a base")
    void rejectsInvalid() {
        Map<String, Object> nullId = new LinkedHashMap<>();
        nullId.put("id", null);

        assertThatThrownBy(() -> UrlTemplate.expand("https://a", "/x/{id}", Map.of()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("{id}");
        assertThatThrownBy(() -> UrlTemplate.expand("https://a", "/x/{id}", nullId))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> UrlTemplate.expand(null, "/x", Map.of()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("baseUrl");
        assertThatThrownBy(() -> UrlTemplate.expand("https://a", "/x", Map.of("ids", Arrays.asList(Map.of()))))
                .isInstanceOf(ValidationException.class);
    }
}
