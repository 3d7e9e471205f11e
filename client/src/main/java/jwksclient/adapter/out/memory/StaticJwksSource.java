package jwksclient.adapter.out.memory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import io.smallrye.mutiny.Uni;

import jwksclient.core.model.JsonWebKeySet;
import jwksclient.core.port.out.JwksSource;

/**
 * In-memory key source.
 *
 * <p>Serves a fixed key set, or fails every fetch once {@link #failWith(Throwable)} was called. Both
 * can be changed at runtime, which makes this source useful for key sets shipped with an
 * application as well as for exercising refresh behaviour.
 */
public class StaticJwksSource implements JwksSource {

    private final AtomicReference<JsonWebKeySet> keySet;
    private final AtomicReference<Throwable> failure = new AtomicReference<>();
    private final AtomicInteger fetchCount = new AtomicInteger();

    public StaticJwksSource(JsonWebKeySet keySet) {
        this.keySet = new AtomicReference<>(Objects.requireNonNull(keySet, "keySet is required"));
    }

    public static StaticJwksSource empty() {
        return new StaticJwksSource(JsonWebKeySet.empty());
    }

    @Override
    public Uni<JsonWebKeySet> fetchKeys() {
        return Uni.createFrom().deferred(() -> {
            fetchCount.incrementAndGet();
            final var error = failure.get();
            if (error != null) {
                return Uni.createFrom().failure(error);
            }
            return Uni.createFrom().item(keySet.get());
        });
    }

    /**
     * Serve {@code keySet} from now on, clearing any configured failure.
     */
    public void setKeySet(JsonWebKeySet keySet) {
        this.keySet.set(Objects.requireNonNull(keySet, "keySet is required"));
        this.failure.set(null);
    }

    /**
     * Fail every fetch with {@code error} until {@link #setKeySet(JsonWebKeySet)} is called.
     */
    public void failWith(Throwable error) {
        this.failure.set(Objects.requireNonNull(error, "error is required"));
    }

    /**
     * Number of times {@link #fetchKeys()} has been subscribed to.
     */
    public int fetchCount() {
        return fetchCount.get();
    }
}
