package com.eventmirror.proxy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MirrorTargetTest {

    @Test
    @DisplayName("Host should match case-insensitively and ignore the port")
    void hostMatching() {
        MirrorTarget target = MirrorTarget.of("API.Example.com", "/batch");

        assertThat(target.getHost()).isEqualTo("api.example.com");
        assertThat(target.matches("api.example.com", "/batch")).isTrue();
        assertThat(target.matches("Api.Example.COM:8443", "/batch")).isTrue();
        assertThat(target.matches("other.example.com", "/batch")).isFalse();
        assertThat(target.matches(null, "/batch")).isFalse();
    }

    @Test
    @DisplayName("Exact path should not match longer paths but should ignore the query")
    void exactPath() {
        MirrorTarget target = MirrorTarget.of("a.example.com", "/batch");

        assertThat(target.matches(URI.create("http://a.example.com/batch?x=1"))).isTrue();
        assertThat(target.matches(URI.create("http://a.example.com/batch/extra"))).isFalse();
        assertThat(target.matches(URI.create("http://a.example.com/"))).isFalse();
        assertThat(target.isPrefix()).isFalse();
    }

    @Test
    @DisplayName("Trailing wildcard should turn the path into a prefix")
    void prefixPath() {
        MirrorTarget target = MirrorTarget.of("a.example.com", "/v1/*");

        assertThat(target.isPrefix()).isTrue();
        assertThat(target.matches("a.example.com", "/v1/batch")).isTrue();
        assertThat(target.matches("a.example.com", "/v1/")).isTrue();
        assertThat(target.matches("a.example.com", "/v2/batch")).isFalse();
    }

    @Test
    @DisplayName("Empty request path should be treated as root")
    void emptyPath() {
        MirrorTarget target = MirrorTarget.of("a.example.com", "/");

        assertThat(target.matches(URI.create("http://a.example.com"))).isTrue();
    }

    @Test
    @DisplayName("Bracketed IPv6 host should have its port stripped")
    void ipv6Host() {
        MirrorTarget target = MirrorTarget.of("[::1]", "/batch");

        assertThat(target.matches("[::1]:9000", "/batch")).isTrue();
    }

    @Test
    @DisplayName("Invalid host or path should be rejected")
    void validation() {
        assertThatThrownBy(() -> MirrorTarget.of(" ", "/batch"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("host");
        assertThatThrownBy(() -> MirrorTarget.of("a.example.com", "batch"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must start with '/'");
        assertThatThrownBy(() -> MirrorTarget.of("a.example.com", "/v1/*/x"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Wildcard");
    }

    @Test
    @DisplayName("Targets with the same host and path should be equal")
    void equality() {
        assertThat(MirrorTarget.of("A.example.com", "/b"))
                .isEqualTo(MirrorTarget.of("a.example.com", "/b"))
                .hasSameHashCodeAs(MirrorTarget.of("a.example.com", "/b"))
                .hasToString("a.example.com/b");
    }
}
