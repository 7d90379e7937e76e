package com.identity.dedup.bulk;

import com.identity.dedup.core.model.RawIdentity;

/**
 * A raw identity with its ground-truth person label.
 */
public record LabelledIdentity(RawIdentity identity, String label) {
}
