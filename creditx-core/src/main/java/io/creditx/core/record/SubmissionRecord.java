package io.creditx.core.record;

/// New-business submission awaiting triage and pricing.
///
/// @param submissionId unique submission identifier
/// @param broker introducing broker
/// @param sector industry sector
/// @param exposureLimit requested exposure limit in currency units, `>= 0`
/// @param debtorDays average debtor days, `>= 0`
/// @param financialsAttached whether financial statements were supplied
/// @param yearsTrading years the applicant has traded, `>= 0`
/// @param brokerHitRate historical broker conversion rate in `[0, 1]`
/// @param requestedCovPct requested coverage share in `[0, 1]`
/// @param hasJudgements whether the applicant has outstanding judgements
public record SubmissionRecord(
        String submissionId,
        String broker,
        Sector sector,
        double exposureLimit,
        double debtorDays,
        boolean financialsAttached,
        double yearsTrading,
        double brokerHitRate,
        double requestedCovPct,
        boolean hasJudgements)
        implements UnderwritingRecord {

    @Override
    public String id() {
        return submissionId;
    }

    @Override
    public RecordKind kind() {
        return RecordKind.SUBMISSION;
    }
}
