package io.github.yok.sentilink.nlp;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import io.github.yok.sentilink.exception.ConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.StringUtils;

/**
 * Word list used by {@link SentimentScorer}.
 *
 * <p>
 * Holds three kinds of entries, all keyed by lower-case word:
 * </p>
 * <ul>
 * <li>sentiment words with a polarity in {@code [-1, 1]} and a subjectivity in {@code [0, 1]}</li>
 * <li>intensifiers with a multiplier applied to the following sentiment word</li>
 * <li>negations that flip a sentiment word appearing shortly after them</li>
 * </ul>
 *
 * <p>
 * The bundled lexicon is a CSV resource with the header
 * {@code word,type,polarity,subjectivity,multiplier}, where {@code type} is {@code word},
 * {@code intensifier} or {@code negation}. Instances are immutable.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class SentimentLexicon {

    private final ImmutableMap<String, WordEntry> words;
    private final ImmutableMap<String, Double> intensifiers;
    private final ImmutableSet<String> negations;

    private SentimentLexicon(Builder builder) {
        this.words = ImmutableMap.copyOf(builder.words);
        this.intensifiers = ImmutableMap.copyOf(builder.intensifiers);
        this.negations = ImmutableSet.copyOf(builder.negations);
    }

    /**
     * Loads a lexicon from a classpath CSV resource.
     *
     * @param resource classpath location, e.g. {@code lexicon/en-sentiment.csv}
     * @return loaded lexicon
     * @throws ConfigurationException if the resource is missing or malformed
     */
    public static SentimentLexicon fromClasspath(String resource) {
        ClassLoader loader = SentimentLexicon.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new ConfigurationException("Lexicon resource not found: " + resource);
            }
            SentimentLexicon lexicon =
                    read(new InputStreamReader(in, StandardCharsets.UTF_8), resource);
            log.info("Lexicon loaded: resource={}, words={}, intensifiers={}, negations={}",
                    resource, lexicon.words.size(), lexicon.intensifiers.size(),
                    lexicon.negations.size());
            return lexicon;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read lexicon resource: " + resource, e);
        }
    }

    /**
     * Parses lexicon CSV content.
     *
     * @param reader CSV content with header
     * @param name name used in error messages
     * @return parsed lexicon
     * @throws IOException if reading fails
     * @throws ConfigurationException if a record is malformed
     */
    static SentimentLexicon read(Reader reader, String name) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true)
                .setTrim(true).setIgnoreEmptyLines(true).get();
        Builder builder = builder();
        try (CSVParser parser = CSVParser.parse(reader, format)) {
            for (CSVRecord rec : parser) {
                String word = rec.get("word");
                String type = rec.get("type").toLowerCase(Locale.ROOT);
                try {
                    switch (type) {
                        case "word":
                            builder.word(word, Double.parseDouble(rec.get("polarity")),
                                    Double.parseDouble(rec.get("subjectivity")));
                            break;
                        case "intensifier":
                            builder.intensifier(word, Double.parseDouble(rec.get("multiplier")));
                            break;
                        case "negation":
                            builder.negation(word);
                            break;
                        default:
                            throw new IllegalArgumentException("unknown type '" + type + "'");
                    }
                } catch (IllegalArgumentException e) {
                    throw new ConfigurationException("Invalid lexicon entry in " + name
                            + " at line " + rec.getRecordNumber() + ": " + e.getMessage(), e);
                }
            }
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param token normalized token
     * @return sentiment entry for the token, if any
     */
    public Optional<WordEntry> lookup(String token) {
        return Optional.ofNullable(words.get(token));
    }

    /**
     * @param token normalized token
     * @return multiplier if the token is an intensifier
     */
    public Optional<Double> intensifier(String token) {
        return Optional.ofNullable(intensifiers.get(token));
    }

    public boolean isNegation(String token) {
        return negations.contains(token);
    }

    /**
     * @return number of sentiment words
     */
    public int size() {
        return words.size();
    }

    /**
     * Polarity and subjectivity of one sentiment word.
     */
    @Getter
    public static final class WordEntry {
        private final double polarity;
        private final double subjectivity;

        WordEntry(double polarity, double subjectivity) {
            this.polarity = polarity;
            this.subjectivity = subjectivity;
        }
    }

    /**
     * Collects entries; later entries for the same word replace earlier ones.
     */
    public static final class Builder {

        private final Map<String, WordEntry> words = new HashMap<>();
        private final Map<String, Double> intensifiers = new HashMap<>();
        private final Set<String> negations = new HashSet<>();

        private Builder() {}

        public Builder word(String word, double polarity, double subjectivity) {
            Preconditions.checkArgument(polarity >= -1.0 && polarity <= 1.0,
                    "polarity of '%s' out of range: %s", word, polarity);
            Preconditions.checkArgument(subjectivity >= 0.0 && subjectivity <= 1.0,
                    "subjectivity of '%s' out of range: %s", word, subjectivity);
            words.put(key(word), new WordEntry(polarity, subjectivity));
            return this;
        }

        public Builder intensifier(String word, double multiplier) {
            Preconditions.checkArgument(multiplier > 0, "multiplier of '%s' must be positive: %s",
                    word, multiplier);
            intensifiers.put(key(word), multiplier);
            return this;
        }

        public Builder negation(String word) {
            negations.add(key(word));
            return this;
        }

        public SentimentLexicon build() {
            return new SentimentLexicon(this);
        }

        private static String key(String word) {
            Preconditions.checkArgument(StringUtils.isNotBlank(word), "word must not be blank");
            return word.trim().toLowerCase(Locale.ROOT);
        }
    }
}
