package com.identity.dedup.api;

import com.identity.dedup.core.model.RawIdentity;

import java.util.List;

/**
 * One final cluster as reported to output writers.
 *
 * @param clusterId   smallest identity id in the cluster
 * @param members     member identities in id order
 * @param commitCount commits authored by all members together
 */
public record ClusterRow(int clusterId, List<RawIdentity> members, long commitCount) {

    public ClusterRow {
        members = List.copyOf(members);
    }

    public int size() {
        return members.size();
    }
}
