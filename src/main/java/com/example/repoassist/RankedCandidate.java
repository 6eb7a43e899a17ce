package com.example.repoassist;

import lombok.Builder;
import lombok.Value;

/** A scored chunk with the parts its score was assembled from. */
@Value
@Builder
public class RankedCandidate {
    Chunk chunk;
    SourceFile file;
    double score;
    double lexicalScore;
    double pathBoost;
    double orientationBoost;
    double tagBoost;
    double semanticScore;

    public int depth() {
        return file.depth();
    }
}
