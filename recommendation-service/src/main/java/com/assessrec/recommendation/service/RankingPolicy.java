package com.assessrec.recommendation.service;

/**
 * Tunables of the ranking pipeline.
 *
 * @param minResults        strict duration filtering that keeps fewer items than this triggers one relaxation
 * @param maxResults        upper bound on the result size
 * @param relaxationMinutes minutes added to the duration cap on relaxation
 * @param entryLevelBoost   additive score boost for entry-level named items on entry-level queries
 * @param knowledgeQuota    K items kept when balancing
 * @param personalityQuota  P items kept when balancing
 * @param abilityQuota      A items kept when balancing a cognitive query
 */
public record RankingPolicy(
        int minResults,
        int maxResults,
        int relaxationMinutes,
        double entryLevelBoost,
        int knowledgeQuota,
        int personalityQuota,
        int abilityQuota
) {

    public static final RankingPolicy DEFAULT = new RankingPolicy(5, 10, 10, 0.1, 5, 5, 3);

    public RankingPolicy {
        if (minResults < 0 || maxResults <= 0 || minResults > maxResults) {
            throw new IllegalArgumentException("invalid result bounds min=" + minResults + " max=" + maxResults);
        }
        if (relaxationMinutes < 0 || knowledgeQuota < 0 || personalityQuota < 0 || abilityQuota < 0) {
            throw new IllegalArgumentException("ranking quotas and relaxation must be >= 0");
        }
    }
}
