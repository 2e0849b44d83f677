package com.phillippitts.peercall.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void shouldReturnEmptyStringForNullOrNonPositiveMax() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.truncate("hello world", 0)).isEmpty();
        assertThat(LogSanitizer.truncate("hello world", -1)).isEmpty();
    }

    @Test
    void shouldTruncateWhenLongerThanMax() {
        assertThat(LogSanitizer.truncate("hello", 5)).isEqualTo("hello");
        assertThat(LogSanitizer.truncate("hello world", 5)).isEqualTo("hello...");
    }

    @Test
    void sdpIsDescribedBySizeOnly() {
        String sdp = "v=0\r\no=- 4611731400430051336 2 IN IP4 127.0.0.1\r\n";

        assertThat(LogSanitizer.describeSdp(sdp)).isEqualTo("sdp[" + sdp.length() + " chars]").doesNotContain("127.0.0.1");
        assertThat(LogSanitizer.describeSdp(null)).isEqualTo("sdp[none]");
    }
}
