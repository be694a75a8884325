package com.solis.report;

import com.solis.model.DexVolumeSignal;
import com.solis.model.OnchainSignal;
import com.solis.model.RepoSignal;
import com.solis.model.TokenSignal;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON mapping of one signal family. Unset deltas are omitted rather than written as 0.
 */
public interface SignalCodec<T> {

    JSONObject toJson(T record);

    T fromJson(JSONObject json);

    default JSONArray toJsonArray(List<T> records) {
        JSONArray out = new JSONArray();
        for (T record : records) {
            out.put(toJson(record));
        }
        return out;
    }

    default List<T> fromJsonArray(JSONArray array) {
        List<T> out = new ArrayList<>();
        if (array == null) {
            return out;
        }
        for (int i = 0; i < array.length(); i++) {
            JSONObject item = array.optJSONObject(i);
            if (item != null) {
                out.add(fromJson(item));
            }
        }
        return out;
    }

    SignalCodec<RepoSignal> REPOS = new SignalCodec<>() {
        @Override
        public JSONObject toJson(RepoSignal r) {
            JSONObject o = new JSONObject();
            o.put("repo", r.getRepo());
            o.put("stars", r.getStars());
            o.put("forks", r.getForks());
            o.put("contributors", r.getContributors());
            o.put("commits", r.getCommits());
            o.put("language", r.getLanguage() == null ? "" : r.getLanguage());
            o.put("commitsDelta", r.getCommitsDelta());
            putIfSet(o, "starsDelta", r.getStarsDelta());
            putIfSet(o, "forksDelta", r.getForksDelta());
            putIfSet(o, "contributorsDelta", r.getContributorsDelta());
            o.put("commitsZScore", r.getCommitsZScore());
            o.put("starsZScore", r.getStarsZScore());
            o.put("forksZScore", r.getForksZScore());
            return o;
        }

        @Override
        public RepoSignal fromJson(JSONObject o) {
            return RepoSignal.builder()
                    .repo(o.getString("repo"))
                    .stars(o.optLong("stars", 0L))
                    .forks(o.optLong("forks", 0L))
                    .contributors(o.optLong("contributors", 0L))
                    .commits(o.optLong("commits", 0L))
                    .language(o.optString("language", ""))
                    .commitsDelta(o.optLong("commitsDelta", 0L))
                    .starsDelta(optLongOrNull(o, "starsDelta"))
                    .forksDelta(optLongOrNull(o, "forksDelta"))
                    .contributorsDelta(optLongOrNull(o, "contributorsDelta"))
                    .commitsZScore(o.optDouble("commitsZScore", 0.0))
                    .starsZScore(o.optDouble("starsZScore", 0.0))
                    .forksZScore(o.optDouble("forksZScore", 0.0))
                    .build();
        }
    };

    SignalCodec<OnchainSignal> ONCHAIN = new SignalCodec<>() {
        @Override
        public JSONObject toJson(OnchainSignal s) {
            JSONObject o = new JSONObject();
            o.put("programId", s.getProgramId());
            o.put("programName", s.getProgramName() == null ? "" : s.getProgramName());
            o.put("txCount", s.getTxCount());
            o.put("uniqueSigners", s.getUniqueSigners());
            putIfSet(o, "txDelta", s.getTxDelta());
            o.put("txZScore", s.getTxZScore());
            return o;
        }

        @Override
        public OnchainSignal fromJson(JSONObject o) {
            return OnchainSignal.builder()
                    .programId(o.getString("programId"))
                    .programName(o.optString("programName", ""))
                    .txCount(o.optLong("txCount", 0L))
                    .uniqueSigners(o.optLong("uniqueSigners", 0L))
                    .txDelta(optLongOrNull(o, "txDelta"))
                    .txZScore(o.optDouble("txZScore", 0.0))
                    .build();
        }
    };

    SignalCodec<DexVolumeSignal> DEX = new SignalCodec<>() {
        @Override
        public JSONObject toJson(DexVolumeSignal d) {
            JSONObject o = new JSONObject();
            o.put("protocol", d.getProtocol());
            o.put("volume24h", d.getVolume24h());
            putIfSet(o, "volumeDelta", d.getVolumeDelta());
            o.put("volumeZScore", d.getVolumeZScore());
            return o;
        }

        @Override
        public DexVolumeSignal fromJson(JSONObject o) {
            return DexVolumeSignal.builder()
                    .protocol(o.getString("protocol"))
                    .volume24h(o.optDouble("volume24h", 0.0))
                    .volumeDelta(optDoubleOrNull(o, "volumeDelta"))
                    .volumeZScore(o.optDouble("volumeZScore", 0.0))
                    .build();
        }
    };

    SignalCodec<TokenSignal> TOKENS = new SignalCodec<>() {
        @Override
        public JSONObject toJson(TokenSignal t) {
            JSONObject o = new JSONObject();
            o.put("id", t.getId());
            o.put("symbol", t.getSymbol() == null ? "" : t.getSymbol());
            o.put("name", t.getName() == null ? "" : t.getName());
            o.put("price", t.getPrice());
            o.put("volume24h", t.getVolume24h());
            o.put("marketCap", t.getMarketCap());
            o.put("category", t.getCategory() == null ? "" : t.getCategory());
            putIfSet(o, "volumeDelta", t.getVolumeDelta());
            o.put("volumeZScore", t.getVolumeZScore());
            return o;
        }

        @Override
        public TokenSignal fromJson(JSONObject o) {
            return TokenSignal.builder()
                    .id(o.getString("id"))
                    .symbol(o.optString("symbol", ""))
                    .name(o.optString("name", ""))
                    .price(o.optDouble("price", 0.0))
                    .volume24h(o.optDouble("volume24h", 0.0))
                    .marketCap(o.optDouble("marketCap", 0.0))
                    .category(o.optString("category", ""))
                    .volumeDelta(optDoubleOrNull(o, "volumeDelta"))
                    .volumeZScore(o.optDouble("volumeZScore", 0.0))
                    .build();
        }
    };

    private static void putIfSet(JSONObject o, String key, Number value) {
        if (value != null) {
            o.put(key, value);
        }
    }

    private static Long optLongOrNull(JSONObject o, String key) {
        return o.has(key) && !o.isNull(key) ? o.getLong(key) : null;
    }

    private static Double optDoubleOrNull(JSONObject o, String key) {
        return o.has(key) && !o.isNull(key) ? o.getDouble(key) : null;
    }
}
