package com.identity.dedup.bulk;

import com.identity.dedup.api.ClusterRow;
import com.identity.dedup.core.model.RawIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Writes one CSV row per final cluster. Member names and emails are joined with {@code "; "}.
 *
 * <pre>
 * cluster_id,size,commits,names,emails
 * 0,2,57,J. Doe; Jane Doe,jdoe@co.com; jane.doe@co.com
 * </pre>
 */
public class ClusterCsvExporter {
    private static final Logger log = LoggerFactory.getLogger(ClusterCsvExporter.class);

    static final String HEADER = "cluster_id,size,commits,names,emails";
    static final String MEMBER_SEPARATOR = "; ";

    private final boolean mergedOnly;

    public ClusterCsvExporter() {
        this(false);
    }

    /**
     * @param mergedOnly write only clusters with more than one member
     */
    public ClusterCsvExporter(boolean mergedOnly) {
        this.mergedOnly = mergedOnly;
    }

    public long export(List<ClusterRow> clusters, Writer writer) throws IOException {
        BufferedWriter out = new BufferedWriter(writer);
        out.write(HEADER);
        out.newLine();
        long rows = 0;
        for (ClusterRow cluster : clusters) {
            if (mergedOnly && cluster.size() < 2) {
                continue;
            }
            out.write(String.join(",",
                    Integer.toString(cluster.clusterId()),
                    Integer.toString(cluster.size()),
                    Long.toString(cluster.commitCount()),
                    CsvReader.escape(join(cluster.members(), true)),
                    CsvReader.escape(join(cluster.members(), false))));
            out.newLine();
            rows++;
        }
        out.flush();
        log.debug("export.completed format=clusters rows={}", rows);
        return rows;
    }

    private static String join(List<RawIdentity> members, boolean names) {
        return members.stream()
                .map(names ? RawIdentity::rawName : RawIdentity::rawEmail)
                .collect(Collectors.joining(MEMBER_SEPARATOR));
    }
}
