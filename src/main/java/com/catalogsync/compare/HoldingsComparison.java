package com.catalogsync.compare;

import com.catalogsync.file.CsvFileSink;
import com.catalogsync.file.IdentifierListReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Works out which WorldCat holdings to set and which to unset so that WorldCat matches the Alma
 * record list. The three output files use an "OCLC Number" header, so the set and unset files
 * can be fed straight into the holding operations.
 */
@Component
@Slf4j
public class HoldingsComparison {

    static final String TO_SET_FILE = "records_to_set_in_worldcat.csv";
    static final String TO_UNSET_FILE = "records_to_unset_in_worldcat.csv";
    static final String NO_ACTION_FILE = "records_with_no_action_needed.csv";
    static final List<String> HEADER = List.of("OCLC Number");

    /** Set differences and intersection, each in the iteration order of the set it is taken from. */
    public ComparisonResult compare(Set<String> almaRecords, Set<String> worldcatRecords) {
        List<String> toSet = almaRecords.stream()
                .filter(n -> !worldcatRecords.contains(n))
                .collect(Collectors.toList());
        List<String> toUnset = worldcatRecords.stream()
                .filter(n -> !almaRecords.contains(n))
                .collect(Collectors.toList());
        List<String> inBoth = almaRecords.stream()
                .filter(worldcatRecords::contains)
                .collect(Collectors.toList());
        log.debug("To set: {}; to unset: {}; no action needed: {}", toSet, toUnset, inBoth);
        return new ComparisonResult(toSet, toUnset, inBoth);
    }

    /**
     * Reads both lists, compares them and appends the results to the three files under the output
     * directory.
     */
    public ComparisonResult compareFiles(Path almaFile, Path worldcatFile, Path outputDirectory) throws IOException {
        log.info("Comparing Alma records in {} with WorldCat holdings in {}", almaFile, worldcatFile);
        ComparisonResult result = compare(IdentifierListReader.read(almaFile), IdentifierListReader.read(worldcatFile));
        write(outputDirectory.resolve(TO_SET_FILE), result.toSet());
        write(outputDirectory.resolve(TO_UNSET_FILE), result.toUnset());
        write(outputDirectory.resolve(NO_ACTION_FILE), result.noActionNeeded());
        log.info(result.describe());
        return result;
    }

    private static void write(Path file, List<String> oclcNumbers) throws IOException {
        try (CsvFileSink sink = new CsvFileSink(file)) {
            if (sink.isEmpty()) {
                sink.append(HEADER);
            }
            for (String oclcNumber : oclcNumbers) {
                sink.append(List.of(oclcNumber));
            }
        }
    }
}
