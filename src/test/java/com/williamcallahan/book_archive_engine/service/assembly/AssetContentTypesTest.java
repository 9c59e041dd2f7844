package com.williamcallahan.book_archive_engine.service.assembly;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class AssetContentTypesTest {

    @ParameterizedTest
    @CsvSource({
        "cover.jpg,image/jpeg",
        "5/pics/photo.JPEG,image/jpeg",
        "5/a.png,image/png",
        "anim.gif,image/gif",
        "scan.tiff,application/octet-stream",
        "12345,image/jpeg",
        "5/.hidden,image/jpeg"
    })
    void infersTypeFromMemberName(String name, String expected) {
        assertThat(AssetContentTypes.fromFileName(name)).isEqualTo(expected);
    }
}
