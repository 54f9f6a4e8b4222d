package de.mirkosertic.mcp.memoryindex.search;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Generates wildcard variants of a keyword for typo tolerant retrieval from the exact backend.
 *
 * <p>For an alphabetic keyword within the configured length bounds the variants are, in priority order:</p>
 * <ol>
 *   <li>the keyword with a trailing wildcard</li>
 *   <li>a wildcard inserted at each internal position, longest literal prefix first</li>
 *   <li>each single-character deletion with a trailing wildcard, dropping residues shorter than two characters</li>
 *   <li>configured category patterns for four-letter codes</li>
 * </ol>
 * Any other keyword yields a single {@link VariantKind#EXACT} variant.
 */
public class FuzzyVariantGenerator {

    private static final int MIN_RESIDUE_LENGTH = 2;
    private static final int CATEGORY_CODE_LENGTH = 4;

    private final int minLength;
    private final int maxLength;
    private final Map<String, List<String>> categoryExpansions;

    public FuzzyVariantGenerator(final int minLength, final int maxLength,
                                 final Map<String, List<String>> categoryExpansions) {
        this.minLength = minLength;
        this.maxLength = maxLength;
        this.categoryExpansions = Map.copyOf(categoryExpansions);
    }

    /**
     * Whether the keyword qualifies for wildcard variants at all.
     */
    public boolean isEligible(final String keyword) {
        final int length = keyword.codePointCount(0, keyword.length());
        return length >= minLength
                && length <= maxLength
                && keyword.codePoints().allMatch(Character::isLetter)
                && !ScriptClassifier.containsHan(keyword);
    }

    /**
     * Variants in the order they should be queried. Never empty.
     */
    public List<QueryVariant> variants(final String keyword, final boolean fuzzy) {
        if (!fuzzy || !isEligible(keyword)) {
            return List.of(QueryVariant.of(keyword, VariantKind.EXACT));
        }

        final String lower = keyword.toLowerCase(Locale.ROOT);
        final int[] codePoints = lower.codePoints().toArray();
        final Map<String, QueryVariant> ordered = new LinkedHashMap<>();

        add(ordered, QueryVariant.of(lower + "*", VariantKind.PREFIX));

        final List<QueryVariant> insertions = new ArrayList<>();
        for (int i = 1; i < codePoints.length; i++) {
            insertions.add(QueryVariant.of(
                    substring(codePoints, 0, i) + "*" + substring(codePoints, i, codePoints.length),
                    VariantKind.INSERTION));
        }
        insertions.sort(Comparator.comparingInt(QueryVariant::literalPrefixLength).reversed());
        insertions.forEach(variant -> add(ordered, variant));

        for (int i = 0; i < codePoints.length; i++) {
            final String residue = substring(codePoints, 0, i) + substring(codePoints, i + 1, codePoints.length);
            if (residue.codePointCount(0, residue.length()) >= MIN_RESIDUE_LENGTH) {
                add(ordered, QueryVariant.of(residue + "*", VariantKind.DELETION));
            }
        }

        if (codePoints.length == CATEGORY_CODE_LENGTH) {
            for (final String pattern : categoryExpansions.getOrDefault(lower, List.of())) {
                add(ordered, QueryVariant.of(pattern.toLowerCase(Locale.ROOT), VariantKind.CATEGORY));
            }
        }

        return new ArrayList<>(ordered.values());
    }

    private static void add(final Map<String, QueryVariant> ordered, final QueryVariant variant) {
        ordered.putIfAbsent(variant.pattern(), variant);
    }

    private static String substring(final int[] codePoints, final int from, final int to) {
        return new String(codePoints, from, to - from);
    }
}
