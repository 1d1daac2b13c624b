package com.stargazer.tracker.crawl.query;

import java.util.ArrayList;
import java.util.List;

public enum StarRangeStrategy {
    /**
     * Eight wide ranges; cheap on quota, dense low-star ranges overflow the result cap.
     */
    COARSE {
        @Override
        public List<String> ranges() {
            return List.of(
                "stars:>10000",
                "stars:1000..9999",
                "stars:500..999",
                "stars:100..499",
                "stars:50..99",
                "stars:20..49",
                "stars:10..19",
                "stars:1..9"
            );
        }
    },
    /**
     * Bands narrow as star counts drop, down to one bucket per count below 100.
     */
    BANDED {
        @Override
        public List<String> ranges() {
            List<String> buckets = new ArrayList<>();
            buckets.add("stars:>100000");
            buckets.add("stars:50001..100000");
            addBands(buckets, 10_000, 50_000, 5000);
            addBands(buckets, 5000, 9999, 1000);
            addBands(buckets, 1000, 4999, 500);
            addBands(buckets, 500, 999, 100);
            addBands(buckets, 100, 499, 50);
            for (int stars = 99; stars >= 0; stars--) {
                buckets.add("stars:" + stars);
            }
            return List.copyOf(buckets);
        }
    };

    public abstract List<String> ranges();

    private static void addBands(List<String> buckets, int low, int high, int width) {
        for (int lo = low; lo <= high; lo += width) {
            int hi = Math.min(high, lo + width - 1);
            buckets.add("stars:" + lo + ".." + hi);
        }
    }
}
