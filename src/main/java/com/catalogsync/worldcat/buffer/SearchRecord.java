package com.catalogsync.worldcat.buffer;

import java.util.Map;

/**
 * One input row to look up in WorldCat: its MMS ID plus every alternate identifier column
 * (lccn_fixed, lccn, isbn, issn, gov_doc_class_num_086, gpo_item_num_074) present in the row.
 */
public record SearchRecord(int rowNumber, String mmsId, Map<String, String> identifiers) {

    public SearchRecord {
        identifiers = Map.copyOf(identifiers);
    }

    /** Trimmed value of an identifier column; empty when the column is absent. */
    public String identifier(String column) {
        String value = identifiers.get(column);
        return value == null ? "" : value.strip();
    }
}
