package com.solis.data;

import com.solis.model.DexVolumeSignal;
import com.solis.model.OnchainSignal;
import com.solis.model.RepoSignal;
import com.solis.model.SignalSet;
import com.solis.model.TokenSignal;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects every family in sequence. A failing family contributes no records; the cycle
 * only fails when every family failed.
 */
public final class SourceSignalCollector implements SignalCollector {
    private static final Logger LOG = LogManager.getLogger(SourceSignalCollector.class);

    private final SignalSource<RepoSignal> repos;
    private final SignalSource<OnchainSignal> onchain;
    private final SignalSource<DexVolumeSignal> dex;
    private final SignalSource<TokenSignal> tokens;

    public SourceSignalCollector(
            SignalSource<RepoSignal> repos,
            SignalSource<OnchainSignal> onchain,
            SignalSource<DexVolumeSignal> dex,
            SignalSource<TokenSignal> tokens
    ) {
        if (repos == null || onchain == null || dex == null || tokens == null) {
            throw new IllegalArgumentException("all four signal sources are required");
        }
        this.repos = repos;
        this.onchain = onchain;
        this.dex = dex;
        this.tokens = tokens;
    }

    @Override
    public SignalSet collect(LocalDate date) throws Exception {
        List<String> failed = new ArrayList<>();
        Exception last = null;

        List<RepoSignal> repoList = List.of();
        List<OnchainSignal> onchainList = List.of();
        List<DexVolumeSignal> dexList = List.of();
        List<TokenSignal> tokenList = List.of();
        try {
            repoList = repos.fetch(date);
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            last = recordFailure(failed, repos, e);
        }
        try {
            onchainList = onchain.fetch(date);
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            last = recordFailure(failed, onchain, e);
        }
        try {
            dexList = dex.fetch(date);
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            last = recordFailure(failed, dex, e);
        }
        try {
            tokenList = tokens.fetch(date);
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            last = recordFailure(failed, tokens, e);
        }

        if (failed.size() == 4) {
            throw new IOException("all signal sources failed: " + String.join(",", failed), last);
        }
        SignalSet set = new SignalSet(repoList, onchainList, dexList, tokenList);
        LOG.info("[COLLECT] date={} repos={} onchain={} dex={} tokens={} failed={}",
                date, repoList.size(), onchainList.size(), dexList.size(), tokenList.size(),
                failed.isEmpty() ? "none" : String.join(",", failed));
        return set;
    }

    private static Exception recordFailure(List<String> failed, SignalSource<?> source, Exception e) {
        failed.add(source.name());
        LOG.warn("[COLLECT] source failed family={} error={}", source.name(), e.getMessage());
        return e;
    }
}
