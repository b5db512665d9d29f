package io.mnemo.core.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class SanitizerTest {

    @Test
    void shouldStripControlCharactersAndTrimIdentities() {
        assertThat(Sanitizer.identity("  alice\u0000\n ")).isEqualTo("alice");
        assertThat(Sanitizer.identity(null)).isEmpty();
    }

    @Test
    void shouldKeepQuotesInIdentities() {
        assertThat(Sanitizer.identity("O'Brien")).isEqualTo("O'Brien");
    }

    @Test
    void shouldEscapeLikeWildcards() {
        assertThat(Sanitizer.likeContains("100%_done\\")).isEqualTo("%100\\%\\_done\\\\%");
        assertThat(Sanitizer.likeContains("tea")).isEqualTo("%tea%");
    }

    @Test
    void shouldAcceptOnlyBareKeywords() {
        assertThat(Sanitizer.keyword("wal")).isEqualTo("WAL");
        assertThatThrownBy(() -> Sanitizer.keyword("WAL; DROP TABLE relations"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
