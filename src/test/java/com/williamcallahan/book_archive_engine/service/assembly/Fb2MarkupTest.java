package com.williamcallahan.book_archive_engine.service.assembly;

import com.williamcallahan.book_archive_engine.exception.LibraryArchiveException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class Fb2MarkupTest {

    @Test
    void malformedPayloadFailsWithoutWritingToStderr() {
        byte[] broken = "<FictionBook><description>".getBytes(StandardCharsets.UTF_8);
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        PrintStream originalErr = System.err;
        System.setErr(new PrintStream(captured, true, StandardCharsets.UTF_8));
        try {
            assertThatThrownBy(() -> Fb2Markup.parse(new ByteArrayInputStream(broken), "12.fb2"))
                .isInstanceOf(LibraryArchiveException.class)
                .hasMessageContaining("12.fb2");
        } finally {
            System.setErr(originalErr);
        }

        assertThat(captured.toString(StandardCharsets.UTF_8)).isEmpty();
    }
}
