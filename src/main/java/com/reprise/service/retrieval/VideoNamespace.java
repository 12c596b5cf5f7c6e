package com.reprise.service.retrieval;

import com.reprise.model.Passage;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Retrieval state of one video: its passages and, once built, their lexical index.
 *
 * State is a single immutable {@link Snapshot} behind an atomic reference. Writers build a
 * complete new snapshot and publish it in one step, so readers see either the old or the new
 * state, never a mix.
 */
public class VideoNamespace {

    private final String videoId;
    private final AtomicReference<Snapshot> state = new AtomicReference<>(new Snapshot(List.of(), null));

    public VideoNamespace(String videoId) {
        this.videoId = videoId;
    }

    public String getVideoId() {
        return videoId;
    }

    public Snapshot snapshot() {
        return state.get();
    }

    /**
     * Replace passages and index wholesale.
     */
    public void publish(List<Passage> passages, Bm25Index index) {
        state.set(new Snapshot(List.copyOf(passages), index));
    }

    /**
     * Append passages and drop the index; the next search rebuilds it.
     */
    public void append(List<Passage> added) {
        state.updateAndGet(current -> {
            List<Passage> merged = new ArrayList<>(current.passages());
            merged.addAll(added);
            return new Snapshot(List.copyOf(merged), null);
        });
    }

    /**
     * Index for the current passages, building and publishing it if missing.
     * If a writer publishes first, the writer's snapshot wins and is returned.
     */
    public Bm25Index indexOrBuild(Function<List<Passage>, Bm25Index> builder) {
        while (true) {
            Snapshot current = state.get();
            if (current.index() != null) {
                return current.index();
            }
            Bm25Index built = builder.apply(current.passages());
            if (state.compareAndSet(current, new Snapshot(current.passages(), built))) {
                return built;
            }
        }
    }

    /**
     * Passages plus the index built over exactly those passages (null until built).
     */
    public record Snapshot(List<Passage> passages, Bm25Index index) {
    }
}
