package com.identity.dedup.bulk;

import com.identity.dedup.api.AnalysisContext;
import com.identity.dedup.api.HeuristicResult;
import com.identity.dedup.core.model.CandidatePair;
import com.identity.dedup.core.model.RawIdentity;
import com.identity.dedup.evaluation.DuplicatePairValidator;
import com.identity.dedup.evaluation.PairValidation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.util.Locale;

/**
 * Writes one CSV row per duplicate pair of a heuristic run, with the
 * review confidence and evidence of {@link DuplicatePairValidator} alongside the score.
 *
 * <pre>
 * id1,name1,email1,id2,name2,email2,score,evidence,review_confidence,likely_duplicate,review_evidence
 * </pre>
 */
public class DuplicatePairCsvExporter {
    private static final Logger log = LoggerFactory.getLogger(DuplicatePairCsvExporter.class);

    static final String HEADER =
            "id1,name1,email1,id2,name2,email2,score,evidence,review_confidence,likely_duplicate,review_evidence";

    private final DuplicatePairValidator validator = new DuplicatePairValidator();

    /**
     * @return number of pairs written
     */
    public long export(AnalysisContext context, HeuristicResult result, Writer writer) throws IOException {
        BufferedWriter out = new BufferedWriter(writer);
        out.write(HEADER);
        out.newLine();
        long rows = 0;
        for (CandidatePair pair : result.duplicatePairs()) {
            RawIdentity first = context.index().identity(pair.first());
            RawIdentity second = context.index().identity(pair.second());
            PairValidation validation = validator.validate(
                    context.normalized().get(pair.first()), context.normalized().get(pair.second()));
            out.write(String.join(",",
                    Integer.toString(pair.first()),
                    CsvReader.escape(first.rawName()),
                    CsvReader.escape(first.rawEmail()),
                    Integer.toString(pair.second()),
                    CsvReader.escape(second.rawName()),
                    CsvReader.escape(second.rawEmail()),
                    String.format(Locale.ROOT, "%.4f", pair.score()),
                    CsvReader.escape(pair.evidence()),
                    String.format(Locale.ROOT, "%.2f", validation.confidence()),
                    Boolean.toString(validation.likelyDuplicate()),
                    CsvReader.escape(String.join("; ", validation.evidence()))));
            out.newLine();
            rows++;
        }
        out.flush();
        log.debug("export.completed format=duplicate-pairs heuristic={} rows={}", result.heuristic(), rows);
        return rows;
    }
}
