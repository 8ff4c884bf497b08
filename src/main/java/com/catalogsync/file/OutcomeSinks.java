package com.catalogsync.file;

import com.catalogsync.domain.OutcomeCategory;
import com.catalogsync.domain.RecordOperation;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * One output sink per outcome category of an operation. Closing closes every sink that is
 * {@link Closeable}.
 */
public class OutcomeSinks implements Closeable {

    private final Map<OutcomeCategory, OutputSink> sinks;

    public OutcomeSinks(Map<OutcomeCategory, ? extends OutputSink> sinks) {
        this.sinks = new EnumMap<>(OutcomeCategory.class);
        this.sinks.putAll(sinks);
    }

    public OutputSink get(OutcomeCategory category) {
        OutputSink sink = sinks.get(category);
        if (sink == null) {
            throw new IllegalStateException("No output sink configured for " + category);
        }
        return sink;
    }

    /**
     * Opens (appending to) the CSV files for an operation under the given directory.
     */
    public static OutcomeSinks csv(Path directory, RecordOperation operation) throws IOException {
        Map<OutcomeCategory, CsvFileSink> opened = new EnumMap<>(OutcomeCategory.class);
        try {
            for (Map.Entry<OutcomeCategory, String> e : fileNames(operation).entrySet()) {
                opened.put(e.getKey(), new CsvFileSink(directory.resolve(e.getValue())));
            }
        } catch (IOException e) {
            for (CsvFileSink sink : opened.values()) {
                try {
                    sink.close();
                } catch (IOException closeFailure) {
                    e.addSuppressed(closeFailure);
                }
            }
            throw e;
        }
        return new OutcomeSinks(opened);
    }

    static Map<OutcomeCategory, String> fileNames(RecordOperation operation) {
        Map<OutcomeCategory, String> names = new EnumMap<>(OutcomeCategory.class);
        switch (operation) {
            case GET_CURRENT_NUMBER -> {
                names.put(OutcomeCategory.CURRENT, "already_has_current_oclc_number.csv");
                names.put(OutcomeCategory.OLD, "needs_current_oclc_number.csv");
                names.put(OutcomeCategory.ERROR, "records_with_errors_when_getting_current_oclc_number.csv");
            }
            case SET_HOLDING -> {
                names.put(OutcomeCategory.UPDATED, "records_with_holding_successfully_set.csv");
                names.put(OutcomeCategory.NO_UPDATE_NEEDED, "records_with_holding_already_set.csv");
                names.put(OutcomeCategory.ERROR, "records_with_errors_when_setting_holding.csv");
            }
            case UNSET_HOLDING -> {
                names.put(OutcomeCategory.UPDATED, "records_with_holding_successfully_unset.csv");
                names.put(OutcomeCategory.NO_UPDATE_NEEDED, "records_with_holding_already_unset.csv");
                names.put(OutcomeCategory.ERROR, "records_with_errors_when_unsetting_holding.csv");
            }
            case SEARCH -> {
                names.put(OutcomeCategory.OCLC_NUMBER_FOUND, "records_with_oclc_num.csv");
                names.put(OutcomeCategory.ZERO_OR_MULTIPLE_MATCHES, "records_with_zero_or_multiple_worldcat_matches.csv");
                names.put(OutcomeCategory.ERROR, "records_with_errors_when_searching_worldcat.csv");
            }
        }
        return names;
    }

    @Override
    public void close() throws IOException {
        List<IOException> failures = new ArrayList<>();
        for (OutputSink sink : sinks.values()) {
            if (sink instanceof Closeable closeable) {
                try {
                    closeable.close();
                } catch (IOException e) {
                    failures.add(e);
                }
            }
        }
        if (!failures.isEmpty()) {
            IOException first = failures.get(0);
            failures.stream().skip(1).forEach(first::addSuppressed);
            throw first;
        }
    }
}
