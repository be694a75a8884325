package com.solis.report;

import com.solis.model.ReportAnomaly;
import com.solis.model.SignalFamily;
import com.solis.model.SignalReport;
import com.solis.model.SignalSet;
import org.json.JSONArray;
import org.json.JSONObject;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * On-disk layout of a daily report:
 * <pre>
 * { "version", "date", "generatedAt",
 *   "signals": { "repos": [], "onchain": [], "dex": [], "tokens": [] },
 *   "anomalies": [] }
 * </pre>
 */
public final class SignalReportJson {

    private SignalReportJson() {
    }

    public static JSONObject toJson(SignalReport report) {
        JSONObject root = new JSONObject();
        root.put("version", SignalReport.VERSION);
        root.put("date", report.date().toString());
        root.put("generatedAt", report.generatedAt() == null ? "" : report.generatedAt().toString());
        root.put("signals", signalsToJson(report.signals()));

        JSONArray anomalies = new JSONArray();
        for (ReportAnomaly a : report.anomalies()) {
            JSONObject item = new JSONObject();
            item.put("family", a.family().id());
            item.put("key", a.key());
            item.put("metric", a.metric());
            item.put("value", a.value());
            item.put("mean", a.mean());
            item.put("stdDev", a.stdDev());
            item.put("zScore", a.zScore());
            anomalies.put(item);
        }
        root.put("anomalies", anomalies);
        return root;
    }

    public static SignalReport fromJson(JSONObject root) {
        LocalDate date = LocalDate.parse(root.getString("date"));
        String generated = root.optString("generatedAt", "");
        Instant generatedAt = generated.isEmpty() ? null : Instant.parse(generated);
        SignalSet signals = signalsFromJson(root.optJSONObject("signals"));

        List<ReportAnomaly> anomalies = new ArrayList<>();
        JSONArray rawAnomalies = root.optJSONArray("anomalies");
        if (rawAnomalies != null) {
            for (int i = 0; i < rawAnomalies.length(); i++) {
                JSONObject a = rawAnomalies.optJSONObject(i);
                if (a == null) {
                    continue;
                }
                anomalies.add(new ReportAnomaly(
                        SignalFamily.fromId(a.optString("family")),
                        a.optString("key", ""),
                        a.optString("metric", ""),
                        a.optDouble("value", 0.0),
                        a.optDouble("mean", 0.0),
                        a.optDouble("stdDev", 0.0),
                        a.optDouble("zScore", 0.0)
                ));
            }
        }
        return new SignalReport(date, generatedAt, signals, anomalies);
    }

    static JSONObject signalsToJson(SignalSet signals) {
        JSONObject out = new JSONObject();
        out.put(SignalFamily.REPOS.id(), SignalCodec.REPOS.toJsonArray(signals.repos()));
        out.put(SignalFamily.ONCHAIN.id(), SignalCodec.ONCHAIN.toJsonArray(signals.onchain()));
        out.put(SignalFamily.DEX.id(), SignalCodec.DEX.toJsonArray(signals.dexVolumes()));
        out.put(SignalFamily.TOKENS.id(), SignalCodec.TOKENS.toJsonArray(signals.tokens()));
        return out;
    }

    static SignalSet signalsFromJson(JSONObject json) {
        if (json == null) {
            return SignalSet.empty();
        }
        return new SignalSet(
                SignalCodec.REPOS.fromJsonArray(json.optJSONArray(SignalFamily.REPOS.id())),
                SignalCodec.ONCHAIN.fromJsonArray(json.optJSONArray(SignalFamily.ONCHAIN.id())),
                SignalCodec.DEX.fromJsonArray(json.optJSONArray(SignalFamily.DEX.id())),
                SignalCodec.TOKENS.fromJsonArray(json.optJSONArray(SignalFamily.TOKENS.id()))
        );
    }
}
