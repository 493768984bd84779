package com.sitebuild.groupby.key;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * ASCII slugs: accents are folded, letters lower-cased, and every run of
 * characters other than letters, digits, dot and underscore becomes a single
 * dash. Leading and trailing dashes are dropped.
 */
public class DefaultSlugifier implements Slugifier {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern SEPARATORS = Pattern.compile("[^a-z0-9._]+");
    private static final Pattern EDGE_DASHES = Pattern.compile("^-+|-+$");

    @Override
    public String slugify(String text) {
        if (text == null) {
            return "";
        }
        String folded = Normalizer.normalize(text.trim(), Normalizer.Form.NFKD);
        folded = COMBINING_MARKS.matcher(folded).replaceAll("");
        String lower = folded.toLowerCase(Locale.ROOT);
        String dashed = SEPARATORS.matcher(lower).replaceAll("-");
        return EDGE_DASHES.matcher(dashed).replaceAll("");
    }
}
