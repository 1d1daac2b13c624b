package com.stargazer.tracker.crawl.query;

import com.stargazer.tracker.config.CrawlerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Splits the repository search space along language, star range and creation year so that
 * each combination stays under the search API's per-query result cap.
 *
 * <p>Primary queries combine all three facets. Fallback queries drop the creation year,
 * which is the least reliable facet, to catch repositories that match no year bucket.
 * Partitioning is static: actual result counts are never fed back.
 */
public class FacetQueryPartitioner implements QueryPartitioner {
    private static final Logger log = LoggerFactory.getLogger(FacetQueryPartitioner.class);

    private final List<String> languageTerms;
    private final List<String> starRanges;
    private final List<String> yearRanges;

    public FacetQueryPartitioner(List<String> languages, List<String> starRanges, List<String> yearRanges) {
        this.languageTerms = languages == null ? List.of() : languages.stream()
            .filter(value -> value != null && !value.isBlank())
            .map(FacetQueryPartitioner::languageTerm)
            .distinct()
            .toList();
        this.starRanges = clean(starRanges);
        this.yearRanges = clean(yearRanges);
    }

    public static FacetQueryPartitioner fromProperties(CrawlerProperties.Query query) {
        List<String> stars = query.getStarRanges().isEmpty()
            ? query.getStarStrategy().ranges()
            : query.getStarRanges();
        List<String> years = query.isIncludeYears()
            ? yearRanges(query.getFirstYear(), query.getLastYear())
            : List.of();
        return new FacetQueryPartitioner(query.getLanguages(), stars, years);
    }

    /**
     * Newest year first, then one open-ended bucket for everything created before
     * {@code firstYear}.
     */
    public static List<String> yearRanges(int firstYear, int lastYear) {
        List<String> ranges = new ArrayList<>();
        for (int year = lastYear; year >= firstYear; year--) {
            ranges.add("created:" + year + "-01-01.." + year + "-12-31");
        }
        ranges.add("created:<" + firstYear + "-01-01");
        return List.copyOf(ranges);
    }

    @Override
    public List<String> generate() {
        Set<String> queries = new LinkedHashSet<>();
        List<List<String>> primary = nonEmpty(List.of(languageTerms, starRanges, yearRanges));
        addCombinations(queries, primary);
        int primaryCount = queries.size();

        if (!yearRanges.isEmpty()) {
            addCombinations(queries, nonEmpty(List.of(languageTerms, starRanges)));
        }

        log.info(
            "Query partitioner produced {} queries ({} languages x {} star ranges x {} year ranges + {} fallbacks)",
            queries.size(),
            languageTerms.size(),
            starRanges.size(),
            yearRanges.size(),
            queries.size() - primaryCount
        );
        return List.copyOf(queries);
    }

    private void addCombinations(Set<String> out, List<List<String>> dimensions) {
        if (dimensions.isEmpty()) {
            return;
        }
        combine(out, dimensions, 0, "");
    }

    private void combine(Set<String> out, List<List<String>> dimensions, int index, String prefix) {
        if (index == dimensions.size()) {
            out.add(prefix);
            return;
        }
        for (String term : dimensions.get(index)) {
            combine(out, dimensions, index + 1, prefix.isEmpty() ? term : prefix + " " + term);
        }
    }

    private static List<List<String>> nonEmpty(List<List<String>> dimensions) {
        return dimensions.stream().filter(values -> !values.isEmpty()).toList();
    }

    private static List<String> clean(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
            .filter(value -> value != null && !value.isBlank())
            .map(String::trim)
            .distinct()
            .toList();
    }

    static String languageTerm(String language) {
        String trimmed = language.trim();
        if (trimmed.chars().anyMatch(Character::isWhitespace)) {
            return "language:\"" + trimmed + "\"";
        }
        return "language:" + trimmed;
    }
}
