package com.example.JobCopilot.repository;

import com.example.JobCopilot.model.VectorMatch;
import com.example.JobCopilot.model.VectorQuery;
import com.example.JobCopilot.model.VectorRecord;

import java.util.List;

/**
 * Nearest-neighbour store for evidence embeddings. Metadata carries {@code tenant_id} and
 * {@code job_id}; callers must still check them on every match since a backend may ignore filters.
 */
public interface VectorIndex {

    /** Matches ordered by descending score, at most {@code query.topK()}. */
    List<VectorMatch> query(float[] embedding, VectorQuery query);

    /** Stored metadata for the given ids; unknown ids are skipped. */
    List<VectorRecord> get(List<String> ids);

    void upsert(List<VectorRecord> records);
}
