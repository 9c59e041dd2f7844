package com.williamcallahan.book_archive_engine.repository;

import com.williamcallahan.book_archive_engine.model.CatalogRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryCatalogStoreTest {

    private final InMemoryCatalogStore store = new InMemoryCatalogStore();

    @Test
    void keepsFirstRecordPerLibraryId() {
        CatalogRecord first = record(1, "First", "2001-01-01", "Doe,John,");
        CatalogRecord duplicate = record(1, "Duplicate", "2002-01-01", "Doe,John,");

        assertThat(store.saveAllIfAbsent(List.of(first, duplicate, record(2, "Second", null, "Roe,Jane,")))).isEqualTo(2);
        assertThat(store.count()).isEqualTo(2);
        assertThat(store.findById(1)).get().extracting(CatalogRecord::getTitle).isEqualTo("First");
        assertThat(store.findAll()).extracting(CatalogRecord::getLibId).containsExactly(1L, 2L);
    }

    @Test
    void searchRequiresEveryTokenAndSortsNewestFirst() {
        store.saveIfAbsent(record(1, "Night Watch", "2001-05-01", "Lukyanenko,Sergei,"));
        store.saveIfAbsent(record(2, "Day Watch", "2003-05-01", "Lukyanenko,Sergei,"));
        store.saveIfAbsent(record(3, "Night Shift", "2010-05-01", "King,Stephen,"));

        assertThat(store.search("watch sergei")).extracting(CatalogRecord::getLibId).containsExactly(2L, 1L);
        assertThat(store.search("NIGHT")).extracting(CatalogRecord::getLibId).containsExactly(3L, 1L);
        assertThat(store.search("  ")).isEmpty();
    }

    @Test
    void rejectsRecordWithoutId() {
        assertThatThrownBy(() -> store.saveIfAbsent(new CatalogRecord()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static CatalogRecord record(long id, String title, String date, String author) {
        CatalogRecord record = new CatalogRecord();
        record.setLibId(id);
        record.setTitle(title);
        record.setDate(date);
        record.setAuthors(List.of(author));
        return record;
    }
}
