package com.example.repoassist;

/**
 * Optional similarity scorer blended into lexical ranking. No implementation ships with the
 * service; when a bean is present its score is added as {@code retriever.semantic.weight * score}.
 */
public interface SemanticScorer {

    /** Similarity of the query to the chunk in [0, 1]. */
    double score(String query, Chunk chunk);
}
