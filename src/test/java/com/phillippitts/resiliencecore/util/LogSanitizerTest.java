package com.phillippitts.resiliencecore.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void truncateHandlesNullAndShortStrings() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.truncate("abc", 10)).isEqualTo("abc");
        assertThat(LogSanitizer.truncate("abcdef", 3)).isEqualTo("abc");
        assertThat(LogSanitizer.truncate("abc", 0)).isEmpty();
    }

    @Test
    void previewFlattensControlCharactersAndMarksTruncation() {
        assertThat(LogSanitizer.preview("line one\nline two", 100)).isEqualTo("line one line two");
        assertThat(LogSanitizer.preview("abcdefgh", 4)).isEqualTo("abcd...");
    }
}
