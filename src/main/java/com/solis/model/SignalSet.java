package com.solis.model;

import java.util.List;

/**
 * All signal families collected in one cycle. Lists keep collection order.
 */
public record SignalSet(
        List<RepoSignal> repos,
        List<OnchainSignal> onchain,
        List<DexVolumeSignal> dexVolumes,
        List<TokenSignal> tokens
) {
    public SignalSet {
        repos = repos == null ? List.of() : List.copyOf(repos);
        onchain = onchain == null ? List.of() : List.copyOf(onchain);
        dexVolumes = dexVolumes == null ? List.of() : List.copyOf(dexVolumes);
        tokens = tokens == null ? List.of() : List.copyOf(tokens);
    }

    public static SignalSet empty() {
        return new SignalSet(List.of(), List.of(), List.of(), List.of());
    }

    public int size() {
        return repos.size() + onchain.size() + dexVolumes.size() + tokens.size();
    }
}
