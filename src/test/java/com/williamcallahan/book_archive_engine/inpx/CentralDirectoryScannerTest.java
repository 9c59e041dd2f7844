package com.williamcallahan.book_archive_engine.inpx;

import com.williamcallahan.book_archive_engine.exception.MalformedContainerException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.zip.ZipEntry;

import static com.williamcallahan.book_archive_engine.testutil.ArchiveFixtures.members;
import static com.williamcallahan.book_archive_engine.testutil.ArchiveFixtures.patchMethod;
import static com.williamcallahan.book_archive_engine.testutil.ArchiveFixtures.stripEndOfCentralDirectory;
import static com.williamcallahan.book_archive_engine.testutil.ArchiveFixtures.zipBytes;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CentralDirectoryScannerTest {

    @Test
    void recoversStoredAndDeflatedEntriesWithoutEndRecord() throws IOException {
        String text = "line one\nline two\n".repeat(50);
        byte[] deflated = stripEndOfCentralDirectory(zipBytes(members("a.inp", text, "b.inp", "short"), ZipEntry.DEFLATED));
        byte[] stored = stripEndOfCentralDirectory(zipBytes(members("c.inp", text), ZipEntry.STORED));

        CentralDirectoryScanner.RecoveryResult fromDeflated = CentralDirectoryScanner.scan(deflated);
        CentralDirectoryScanner.RecoveryResult fromStored = CentralDirectoryScanner.scan(stored);

        assertThat(fromDeflated.members()).containsOnlyKeys("a.inp", "b.inp");
        assertThat(new String(fromDeflated.members().get("a.inp"), StandardCharsets.UTF_8)).isEqualTo(text);
        assertThat(fromDeflated.droppedEntries()).isEmpty();
        assertThat(new String(fromStored.members().get("c.inp"), StandardCharsets.UTF_8)).isEqualTo(text);
    }

    @Test
    void dropsEntriesWithUnsupportedMethod() throws IOException {
        byte[] zip = zipBytes(members("good.inp", "kept", "bad.inp", "dropped"), ZipEntry.DEFLATED);
        byte[] damaged = stripEndOfCentralDirectory(patchMethod(zip, "bad.inp", 12));

        CentralDirectoryScanner.RecoveryResult result = CentralDirectoryScanner.scan(damaged);

        assertThat(result.members()).containsOnlyKeys("good.inp");
        assertThat(result.droppedEntries()).containsExactly("bad.inp");
    }

    @Test
    void ignoresCentralHeaderSignatureInsideMemberData() throws IOException {
        byte[] fake = new byte[64];
        fake[0] = 'P';
        fake[1] = 'K';
        fake[2] = 1;
        fake[3] = 2;
        fake[28] = 1;                       // name length
        fake[30] = (byte) 0xFF;             // extra length 0xFFFF
        fake[31] = (byte) 0xFF;
        fake[32] = (byte) 0xFF;             // comment length 0xFFFF
        fake[33] = (byte) 0xFF;
        String text = "Doe,John,\u0004Sample Book\n";
        byte[] zip = stripEndOfCentralDirectory(zipBytes(members("junk.bin", fake, "a.inp", text), ZipEntry.STORED));

        CentralDirectoryScanner.RecoveryResult result = CentralDirectoryScanner.scan(zip);

        assertThat(result.members()).containsOnlyKeys("junk.bin", "a.inp");
        assertThat(result.members().get("junk.bin")).isEqualTo(fake);
        assertThat(new String(result.members().get("a.inp"), StandardCharsets.UTF_8)).isEqualTo(text);
        assertThat(result.droppedEntries()).isEmpty();
    }

    @Test
    void skipsDirectoryEntries() throws IOException {
        byte[] zip = stripEndOfCentralDirectory(zipBytes(members("dir/", new byte[0], "dir/x.inp", "x"), ZipEntry.DEFLATED));

        assertThat(CentralDirectoryScanner.scan(zip).members()).containsOnlyKeys("dir/x.inp");
    }

    @Test
    void rejectsBufferWithoutCentralDirectory() {
        byte[] garbage = "not a zip at all".getBytes(StandardCharsets.US_ASCII);

        assertThatThrownBy(() -> CentralDirectoryScanner.scan(garbage))
            .isInstanceOf(MalformedContainerException.class);
    }
}
