package com.flexboard.agent.connector.sql;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DsnParser Tests")
class DsnParserTest {

    @Test
    @DisplayName("Should split a full DSN")
    void parsesFullDsn() {
        DsnParser.ParsedDsn dsn = DsnParser.parse("postgresql://user:p@ss@host.local:5433/db?sslmode=disable");

        assertThat(dsn.getScheme()).isEqualTo("postgresql");
        assertThat(dsn.getUsername()).isEqualTo("user");
        assertThat(dsn.getPassword()).isEqualTo("p@ss");
        assertThat(dsn.getHost()).isEqualTo("host.local");
        assertThat(dsn.getPort()).isEqualTo(5433);
        assertThat(dsn.getDatabase()).isEqualTo("db");
        assertThat(dsn.getQueryParams()).containsEntry("sslmode", "disable");
    }

    @Test
    @DisplayName("Should leave port unset when absent")
    void parsesWithoutPort() {
        DsnParser.ParsedDsn dsn = DsnParser.parse("mysql://host.local/db");

        assertThat(dsn.getPort()).isEqualTo(-1);
        assertThat(dsn.getUsername()).isNull();
    }

    @Test
    @DisplayName("Should reject jdbc URLs and malformed ports")
    void rejectsInvalid() {
        assertThatThrownBy(() -> DsnParser.parse("jdbc:postgresql://h/db")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DsnParser.parse("postgres://h:abc/db")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should mask passwords for logging")
    void masksPasswords() {
        assertThat(DsnParser.mask("postgres://agent:secret@db/x")).isEqualTo("postgres://agent:****@db/x");
        assertThat(DsnParser.mask("jdbc:sqlserver://h;password=secret;x=1")).isEqualTo("jdbc:sqlserver://h;password=****;x=1");
    }
}
