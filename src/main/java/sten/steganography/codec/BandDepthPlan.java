package sten.steganography.codec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Which channels carry payload bits and how many low-order bits of each. Channels are visited in
 * insertion order for every pixel; channels with depth 0 are left out.
 */
public final class BandDepthPlan implements Iterable<BandDepthPlan.Entry> {

    public static final int MAX_DEPTH = 8;

    public record Entry(int channel, int depth) {
    }

    private final List<Entry> entries;

    private BandDepthPlan(List<Entry> entries) {
        this.entries = Collections.unmodifiableList(entries);
    }

    /**
     * @param depths Depth per channel, indexed by channel. Zero excludes the channel.
     */
    public static BandDepthPlan of(int... depths) {
        Builder builder = builder();
        for (int channel = 0; channel < depths.length; channel++) {
            builder.put(channel, depths[channel]);
        }
        return builder.build();
    }

    /**
     * Parses comma separated per-channel depths such as {@code "1,0,2"}.
     * @throws IllegalArgumentException on a malformed list or a depth outside 0..8.
     */
    public static BandDepthPlan parse(String text) {
        String[] parts = text.split(",", -1);
        int[] depths = new int[parts.length];
        for (int i = 0; i < parts.length; i++) {
            try {
                depths[i] = Integer.parseInt(parts[i].trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid depth '" + parts[i] + "' in '" + text + "'", e);
            }
        }
        return of(depths);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Enumerates every plan over {@code channels} channels with at least one non-zero depth. Depth tuples
     * are produced in lexicographic order, last channel varying fastest, from (0,..,0,1) up to (8,..,8).
     * For three channels that is 728 plans.
     */
    public static List<BandDepthPlan> bruteForceCandidates(int channels) {
        List<BandDepthPlan> result = new ArrayList<>();
        int[] depths = new int[channels];
        while (increment(depths)) {
            result.add(of(depths));
        }
        return result;
    }

    private static boolean increment(int[] depths) {
        for (int i = depths.length - 1; i >= 0; i--) {
            if (depths[i] < MAX_DEPTH) {
                depths[i]++;
                return true;
            }
            depths[i] = 0;
        }
        return false;
    }

    public List<Entry> entries() {
        return entries;
    }

    @Override
    public Iterator<Entry> iterator() {
        return entries.iterator();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * @return payload bits carried by one pixel.
     */
    public int totalDepth() {
        int total = 0;
        for (Entry entry : entries) {
            total += entry.depth();
        }
        return total;
    }

    public int highestChannel() {
        int highest = -1;
        for (Entry entry : entries) {
            highest = Math.max(highest, entry.channel());
        }
        return highest;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BandDepthPlan)) return false;
        return entries.equals(((BandDepthPlan) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return entries.stream()
                .map(e -> e.channel() + ":" + e.depth())
                .collect(Collectors.joining(", ", "{", "}"));
    }

    public static final class Builder {

        private final Map<Integer, Integer> depths = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Sets the depth of a channel. A channel set again keeps its original position; depth 0 removes it.
         */
        public Builder put(int channel, int depth) {
            if (channel < 0) {
                throw new IllegalArgumentException("Channel index must not be negative: " + channel);
            }
            if (depth < 0 || depth > MAX_DEPTH) {
                throw new IllegalArgumentException("Depth must be between 0 and " + MAX_DEPTH + ", got " + depth);
            }
            if (depth == 0) {
                depths.remove(channel);
            } else {
                depths.put(channel, depth);
            }
            return this;
        }

        public BandDepthPlan build() {
            List<Entry> entries = new ArrayList<>(depths.size());
            depths.forEach((channel, depth) -> entries.add(new Entry(channel, depth)));
            return new BandDepthPlan(entries);
        }
    }
}
