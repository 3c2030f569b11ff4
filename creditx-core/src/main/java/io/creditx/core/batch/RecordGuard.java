package io.creditx.core.batch;

import io.creditx.core.engine.Operation;
import io.creditx.core.record.PolicyRecord;
import io.creditx.core.record.SubmissionRecord;
import io.creditx.core.record.UnderwritingRecord;

/// Rejects records the extractors cannot score.
///
/// Ingestion validates field ranges upstream; this only catches what would otherwise surface
/// as a runtime error or a meaningless score inside the engine.
final class RecordGuard {

    private RecordGuard() {}

    static void check(UnderwritingRecord record, Operation operation) throws RecordException {
        if (record == null) {
            throw new RecordException(null, "Record is null");
        }
        String id = record.id();
        if (id == null || id.isBlank()) {
            throw new RecordException(id, "Record has no id");
        }
        if (record.kind() != operation.recordKind()) {
            throw new RecordException(
                    id,
                    operation
                            + " expects "
                            + operation.recordKind()
                            + " records but got "
                            + record.kind());
        }
        if (record.sector() == null) {
            throw new RecordException(id, "Record has no sector");
        }

        if (record instanceof SubmissionRecord s) {
            requireFinite(id, "exposure_limit", s.exposureLimit());
            requireFinite(id, "debtor_days", s.debtorDays());
            requireFinite(id, "years_trading", s.yearsTrading());
            requireFinite(id, "broker_hit_rate", s.brokerHitRate());
            requireFinite(id, "requested_cov_pct", s.requestedCovPct());
        } else if (record instanceof PolicyRecord p) {
            requireFinite(id, "current_premium", p.currentPremium());
            requireFinite(id, "limit", p.limit());
            requireFinite(id, "utilization_pct", p.utilizationPct());
            requireFinite(id, "claims_ratio_24m", p.claimsRatio24m());
            requireFinite(id, "days_to_expiry", p.daysToExpiry());
            requireFinite(id, "requested_change_pct", p.requestedChangePct());
        }
    }

    private static void requireFinite(String id, String field, double value)
            throws RecordException {
        if (!Double.isFinite(value)) {
            throw new RecordException(id, field + " must be a finite number but was " + value);
        }
    }
}
