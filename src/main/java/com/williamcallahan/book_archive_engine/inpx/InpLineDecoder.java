package com.williamcallahan.book_archive_engine.inpx;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;

/**
 * Decodes one raw line strictly in the primary charset, falling back to a legacy
 * single-byte charset with replacement. Not thread-safe; use one per parse.
 */
final class InpLineDecoder {

    record DecodedLine(String text, boolean fallback) {
    }

    private final CharsetDecoder primary;
    private final Charset fallback;

    InpLineDecoder(Charset primary, Charset fallback) {
        this.primary = primary.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        this.fallback = fallback;
    }

    DecodedLine decode(byte[] data, int offset, int length) {
        try {
            primary.reset();
            String text = primary.decode(ByteBuffer.wrap(data, offset, length)).toString();
            return new DecodedLine(text, false);
        } catch (CharacterCodingException e) {
            return new DecodedLine(new String(data, offset, length, fallback), true);
        }
    }
}
