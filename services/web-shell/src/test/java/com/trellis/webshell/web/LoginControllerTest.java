package com.trellis.webshell.web;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("LoginController")
class LoginControllerTest {

    @ParameterizedTest
    @CsvSource({"/, /", "/teams/, /teams/", "/teams/a/?tab=stats, /teams/a/?tab=stats"})
    @DisplayName("follows same-site paths after sign-in")
    void keepsLocalPaths(String next, String expected) {
        assertThat(LoginController.safeNext(next)).isEqualTo(expected);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"https://evil.example", "//evil.example", "/\\evil.example", "teams/"})
    @DisplayName("falls back to the home page for anything else")
    void rejectsOffSiteTargets(String next) {
        assertThat(LoginController.safeNext(next)).isEqualTo("/");
    }
}
