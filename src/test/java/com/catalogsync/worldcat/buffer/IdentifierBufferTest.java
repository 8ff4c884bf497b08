package com.catalogsync.worldcat.buffer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IdentifierBufferTest {

    @Test
    @DisplayName("dict buffer keeps insertion order and looks up MMS IDs by OCLC number")
    void dictBuffer_add_keepsOrder() {
        DictBuffer buffer = new DictBuffer();
        buffer.add("30", "mms-a");
        buffer.add("10", "mms-b");
        buffer.add("20", "mms-c");

        assertThat(buffer.size()).isEqualTo(3);
        assertThat(buffer.identifiers()).containsExactly("30", "10", "20");
        assertThat(buffer.mmsIdFor("10")).contains("mms-b");
        assertThat(buffer.mmsIdFor("99")).isEmpty();
    }

    @Test
    void dictBuffer_duplicateKey_rejectedAndSizeUnchanged() {
        DictBuffer buffer = new DictBuffer();
        buffer.add("123", "mms-a");

        assertThatThrownBy(() -> buffer.add("123", "mms-b"))
                .isInstanceOf(DuplicateIdentifierException.class)
                .hasMessage("OCLC number 123 already exists in records buffer with MMS ID mms-a");
        assertThat(buffer.size()).isEqualTo(1);
        assertThat(buffer.mmsIdFor("123")).contains("mms-a");
    }

    @Test
    void setBuffer_duplicate_rejected() {
        SetBuffer buffer = new SetBuffer();
        buffer.add("123");

        assertThatThrownBy(() -> buffer.add("123")).isInstanceOf(DuplicateIdentifierException.class);
        assertThat(buffer.size()).isEqualTo(1);
        assertThat(buffer.contains("123")).isTrue();
    }

    @Test
    @DisplayName("capacity is the driver's concern: buffers accept adds beyond any batch size")
    void setBuffer_manyAdds_noCapacityLimit() {
        SetBuffer buffer = new SetBuffer();
        for (int i = 0; i < 60; i++) {
            buffer.add(String.valueOf(i));
        }
        assertThat(buffer.size()).isEqualTo(60);
    }

    @Test
    void singleRecordBuffer_secondAdd_rejected() {
        SingleRecordBuffer buffer = new SingleRecordBuffer();
        buffer.add(new SearchRecord(2, "991", Map.of("lccn", "n123")));

        assertThatThrownBy(() -> buffer.add(new SearchRecord(3, "992", Map.of())))
                .isInstanceOf(DuplicateIdentifierException.class);
        assertThat(buffer.size()).isEqualTo(1);
        assertThat(buffer.identifiers()).containsExactly("991");
    }

    @Test
    @DisplayName("clear empties the buffer but keeps the lifetime request count")
    void clear_resetsContentsNotRequestCount() {
        DictBuffer buffer = new DictBuffer();
        buffer.add("1", "a");
        buffer.recordApiRequest();
        buffer.recordApiRequest();

        buffer.clear();

        assertThat(buffer.isEmpty()).isTrue();
        assertThat(buffer.identifiers()).isEmpty();
        assertThat(buffer.getNumApiRequestsMade()).isEqualTo(2);
    }

    @Test
    void searchRecord_identifier_trimmedOrEmpty() {
        SearchRecord record = new SearchRecord(2, "991", Map.of("isbn", "  978-1 "));

        assertThat(record.identifier("isbn")).isEqualTo("978-1");
        assertThat(record.identifier("issn")).isEmpty();
    }
}
