package com.catalogsync.cli;

import com.catalogsync.compare.ComparisonResult;
import com.catalogsync.compare.HoldingsComparison;
import com.catalogsync.config.OutputProperties;
import com.catalogsync.domain.Cascade;
import com.catalogsync.domain.RecordOperation;
import com.catalogsync.domain.RunSummary;
import com.catalogsync.file.CsvRowSource;
import com.catalogsync.file.OutcomeSinks;
import com.catalogsync.worldcat.config.WorldCatProperties;
import com.catalogsync.worldcat.job.CatalogOperations;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Command-line entry: {@code --operation=get-current-oclc-number|set-holding|unset-holding|search --input=file.csv}
 * with optional {@code --batch-size=N}, {@code --cascade=0|1} and {@code --search-held-by-first}, or
 * {@code --operation=compare --alma-records=alma.csv --worldcat-records=worldcat.csv}.
 * Does nothing when no operation is given.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CatalogSyncRunner implements ApplicationRunner {

    static final String OPT_OPERATION = "operation";
    static final String OPT_INPUT = "input";
    static final String OPT_BATCH_SIZE = "batch-size";
    static final String OPT_CASCADE = "cascade";
    static final String OPT_SEARCH_HELD_BY_FIRST = "search-held-by-first";
    static final String OPT_ALMA_RECORDS = "alma-records";
    static final String OPT_WORLDCAT_RECORDS = "worldcat-records";
    static final String OPERATION_COMPARE = "compare";

    private final CatalogOperations operations;
    private final HoldingsComparison holdingsComparison;
    private final WorldCatProperties worldCatProperties;
    private final OutputProperties outputProperties;

    @Override
    public void run(ApplicationArguments args) throws Exception {
        String operationName = single(args, OPT_OPERATION);
        if (operationName == null) {
            log.debug("No --{} given; nothing to run", OPT_OPERATION);
            return;
        }
        Path outputDirectory = Path.of(outputProperties.getDirectory());
        if (OPERATION_COMPARE.equals(operationName.strip().toLowerCase(Locale.ROOT))) {
            ComparisonResult result = holdingsComparison.compareFiles(Path.of(required(args, OPT_ALMA_RECORDS)),
                    Path.of(required(args, OPT_WORLDCAT_RECORDS)), outputDirectory);
            System.out.println(result.describe());
            return;
        }
        RecordOperation operation = parseOperation(operationName);
        String input = required(args, OPT_INPUT);
        log.info("Running {} on {} (outputs in {})", operation.getApiName(), input, outputDirectory);

        RunSummary summary;
        try (CsvRowSource rows = CsvRowSource.open(Path.of(input));
             OutcomeSinks sinks = OutcomeSinks.csv(outputDirectory, operation)) {
            summary = switch (operation) {
                case GET_CURRENT_NUMBER -> operations.getCurrentNumber(rows, batchSize(args), sinks);
                case SET_HOLDING -> operations.setHolding(rows, batchSize(args), sinks);
                case UNSET_HOLDING -> operations.unsetHolding(rows, batchSize(args), cascade(args), sinks);
                case SEARCH -> operations.search(rows, args.containsOption(OPT_SEARCH_HELD_BY_FIRST), sinks);
            };
        }
        System.out.println(summary.describe());
    }

    static RecordOperation parseOperation(String name) {
        return switch (name.strip().toLowerCase(Locale.ROOT)) {
            case "get-current-oclc-number" -> RecordOperation.GET_CURRENT_NUMBER;
            case "set-holding" -> RecordOperation.SET_HOLDING;
            case "unset-holding" -> RecordOperation.UNSET_HOLDING;
            case "search" -> RecordOperation.SEARCH;
            default -> throw new IllegalArgumentException("Unknown operation '" + name
                    + "'; expected get-current-oclc-number, set-holding, unset-holding, search or compare");
        };
    }

    private int batchSize(ApplicationArguments args) {
        String value = single(args, OPT_BATCH_SIZE);
        return value == null ? worldCatProperties.getMaxRecordsPerRequest() : Integer.parseInt(value.strip());
    }

    private static Cascade cascade(ApplicationArguments args) {
        String value = single(args, OPT_CASCADE);
        return value == null ? Cascade.ABORT_IF_LOCAL_RECORDS : Cascade.fromValue(Integer.parseInt(value.strip()));
    }

    private static String required(ApplicationArguments args, String name) {
        String value = single(args, name);
        if (value == null) {
            throw new IllegalArgumentException("--" + name + " is required");
        }
        return value;
    }

    private static String single(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(values.size() - 1);
    }
}
