package io.creditx.core.record;

/// In-force policy considered for renewal prioritisation.
///
/// @param policyId unique policy identifier
/// @param broker servicing broker
/// @param sector industry sector
/// @param currentPremium current annual premium, `>= 0`
/// @param limit policy limit, `>= 0`
/// @param utilizationPct share of the limit in use, `[0, 1]`
/// @param claimsLast24mCnt number of claims in the last 24 months, `>= 0`
/// @param claimsRatio24m claims-to-premium ratio over 24 months, `>= 0`
/// @param daysToExpiry days until the policy expires, `>= 0`
/// @param requestedChangePct requested premium change, signed (`-0.1` is a 10% reduction)
public record PolicyRecord(
        String policyId,
        String broker,
        Sector sector,
        double currentPremium,
        double limit,
        double utilizationPct,
        int claimsLast24mCnt,
        double claimsRatio24m,
        double daysToExpiry,
        double requestedChangePct)
        implements UnderwritingRecord {

    @Override
    public String id() {
        return policyId;
    }

    @Override
    public RecordKind kind() {
        return RecordKind.POLICY;
    }
}
