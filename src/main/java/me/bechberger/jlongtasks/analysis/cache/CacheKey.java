package me.bechberger.jlongtasks.analysis.cache;

import java.util.Objects;

/**
 * Key of a computed artifact: which computation, applied to which input
 *
 * @param computation name of the computation, e.g. "JavaScriptUrls"
 * @param inputIdentity stable identity of the input, see {@link me.bechberger.jlongtasks.model.TraceInput#identity()}
 */
public record CacheKey(String computation, String inputIdentity) {
    public CacheKey {
        Objects.requireNonNull(computation, "computation");
        Objects.requireNonNull(inputIdentity, "inputIdentity");
    }

    @Override
    public String toString() {
        return computation + "/" + inputIdentity;
    }
}
