package com.identity.dedup.bulk;

import com.identity.dedup.core.model.RawIdentity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GroundTruthImporterTest {

    private final GroundTruthImporter importer = new GroundTruthImporter();

    @Test
    @DisplayName("Should read labelled identities")
    void testImport() {
        String csv = """
                name,email,label
                Jane Doe,jane@example.com,jane
                "Doe, J.",jdoe@example.com, jane
                Bob Smith,bob@example.com,bob
                """;

        ImportResult<LabelledIdentity> result = importer.importLabels(new StringReader(csv));

        assertEquals(3, result.successCount());
        Map<RawIdentity, String> labels = GroundTruthImporter.toLabels(result);
        assertEquals("jane", labels.get(RawIdentity.of("Doe, J.", "jdoe@example.com")));
        assertEquals("bob", labels.get(RawIdentity.of("Bob Smith", "bob@example.com")));
    }

    @Test
    @DisplayName("Rows without a label are errors")
    void testMissingLabel() {
        String csv = "name,email,label\nJane Doe,jane@example.com\nBob,bob@example.com,  \n";

        ImportResult<LabelledIdentity> result = importer.importLabels(new StringReader(csv));

        assertEquals(2, result.totalRecords());
        assertEquals(2, result.errorCount());
        assertEquals(3, result.errors().get(1).lineNumber());
    }

    @Test
    @DisplayName("The first label of a twice-labelled identity wins")
    void testConflict() {
        String csv = "name,email,label\nJane,jane@example.com,a\nJane,jane@example.com,b\n";

        Map<RawIdentity, String> labels = GroundTruthImporter.toLabels(importer.importLabels(new StringReader(csv)));

        assertEquals(Map.of(RawIdentity.of("Jane", "jane@example.com"), "a"), labels);
    }
}
