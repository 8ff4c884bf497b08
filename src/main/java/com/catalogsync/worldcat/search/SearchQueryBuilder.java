package com.catalogsync.worldcat.search;

import com.catalogsync.common.ValidationException;
import com.catalogsync.worldcat.buffer.SearchRecord;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds a brief-bibs query from the first usable alternate identifier of a record.
 * Order: lccn_fixed, lccn, isbn, issn, gov_doc_class_num_086 (optionally ANDed with gpo_item_num_074).
 */
public final class SearchQueryBuilder {

    public static final String LCCN_FIXED = "lccn_fixed";
    public static final String LCCN = "lccn";
    public static final String ISBN = "isbn";
    public static final String ISSN = "issn";
    public static final String GOV_DOC_CLASS_NUM_086 = "gov_doc_class_num_086";
    public static final String GPO_ITEM_NUM_074 = "gpo_item_num_074";

    public static final List<String> IDENTIFIER_COLUMNS =
            List.of(LCCN_FIXED, LCCN, ISBN, ISSN, GOV_DOC_CLASS_NUM_086, GPO_ITEM_NUM_074);

    private static final String MULTI_VALUE_SEPARATOR = ";";

    private SearchQueryBuilder() {
    }

    /**
     * @throws ValidationException when none of the identifiers is usable
     */
    public static String build(SearchRecord record) {
        String lccnFixed = record.identifier(LCCN_FIXED);
        if (!lccnFixed.isEmpty()) {
            return "nl:" + lccnFixed;
        }
        String lccn = record.identifier(LCCN);
        if (!lccn.isEmpty()) {
            return "nl:" + lccn;
        }
        String isbn = joinValues(record.identifier(ISBN), "bn:");
        if (!isbn.isEmpty()) {
            return isbn;
        }
        String issn = joinValues(record.identifier(ISSN), "in:");
        if (!issn.isEmpty()) {
            return issn;
        }
        String govDoc = joinValues(record.identifier(GOV_DOC_CLASS_NUM_086), "");
        if (!govDoc.isEmpty()) {
            String gpoItem = joinValues(record.identifier(GPO_ITEM_NUM_074), "");
            return gpoItem.isEmpty() ? govDoc : govDoc + " AND " + gpoItem;
        }
        throw new ValidationException("Cannot build a valid search query. Record from input file must include at least "
                + "one of the following record identifiers: lccn_fixed (i.e. a corrected version of the lccn value), "
                + "lccn, isbn, issn, gov_doc_class_num_086. These record identifiers are either empty or invalid.");
    }

    /** Splits a semicolon-separated cell, prefixes each non-empty value and joins them with OR. */
    static String joinValues(String cell, String prefix) {
        return Arrays.stream(cell.split(MULTI_VALUE_SEPARATOR))
                .map(String::strip)
                .filter(v -> !v.isEmpty())
                .map(v -> prefix + v)
                .collect(Collectors.joining(" OR "));
    }
}
