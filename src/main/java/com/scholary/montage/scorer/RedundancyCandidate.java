package com.scholary.montage.scorer;

/** A clip as seen by redundancy ranking: its pool index and description. */
public record RedundancyCandidate(int index, String description) {}
