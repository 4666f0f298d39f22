package io.github.yok.sentilink.nlp;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizes raw text before it is scored.
 *
 * <ol>
 * <li>Lowercase</li>
 * <li>Remove URL-like tokens ({@code http…}, {@code https…}, {@code www…})</li>
 * <li>Remove characters other than word characters, whitespace and {@code . , ! ?}</li>
 * <li>Collapse whitespace runs and trim</li>
 * </ol>
 *
 * <p>
 * Stateless and thread-safe. {@code null}, empty and whitespace-only input all normalize to the
 * empty string.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class TextPreprocessor {

    private static final Pattern URL = Pattern.compile("http\\S+|www\\S+|https\\S+");

    private static final Pattern NON_TEXT =
            Pattern.compile("[^\\w\\s.,!?]", Pattern.UNICODE_CHARACTER_CLASS);

    private static final Pattern WHITESPACE =
            Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    /**
     * Normalizes one text.
     *
     * @param text raw text, may be {@code null}
     * @return normalized text, never {@code null}
     */
    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String result = text.toLowerCase(Locale.ROOT);
        result = URL.matcher(result).replaceAll("");
        result = NON_TEXT.matcher(result).replaceAll("");
        result = WHITESPACE.matcher(result).replaceAll(" ");
        return result.trim();
    }
}
