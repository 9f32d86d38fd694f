package com.flexboard.agent.config;

import com.flexboard.agent.model.DataSourceKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("EngineProperties Tests")
class EnginePropertiesTest {

    @Test
    @DisplayName("Should accept the defaults")
    void defaultsAreValid() {
        EngineProperties properties = new EngineProperties();

        assertThatCode(properties::validate).doesNotThrowAnyException();
        assertThat(properties.getMaxPoolSizePerKey()).isEqualTo(5);
        assertThat(properties.getRequestTimeout()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    @DisplayName("Should find backends configured under an alias")
    void findsBackendByAlias() {
        EngineProperties properties = new EngineProperties();
        BackendProperties pg = new BackendProperties();
        properties.getBackends().put("postgres", pg);

        assertThat(properties.backendFor(DataSourceKind.POSTGRESQL)).containsSame(pg);
        assertThat(properties.backendFor(DataSourceKind.MYSQL)).isEmpty();
    }

    @Test
    @DisplayName("Should reject unusable settings")
    void rejectsInvalidSettings() {
        EngineProperties zeroPool = new EngineProperties();
        zeroPool.setMaxPoolSizePerKey(0);
        EngineProperties tooManyIdle = new EngineProperties();
        tooManyIdle.setMinIdlePerKey(6);
        EngineProperties noTimeout = new EngineProperties();
        noTimeout.setRequestTimeout(Duration.ZERO);
        EngineProperties unknownBackend = new EngineProperties();
        unknownBackend.getBackends().put("oracle", new BackendProperties());

        assertThatThrownBy(zeroPool::validate).hasMessageContaining("maxPoolSizePerKey");
        assertThatThrownBy(tooManyIdle::validate).hasMessageContaining("minIdlePerKey");
        assertThatThrownBy(noTimeout::validate).hasMessageContaining("requestTimeout");
        assertThatThrownBy(unknownBackend::validate).hasMessageContaining("oracle");
    }
}
