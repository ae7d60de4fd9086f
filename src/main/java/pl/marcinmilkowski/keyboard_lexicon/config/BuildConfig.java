package pl.marcinmilkowski.keyboard_lexicon.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Immutable settings for one index build.
 *
 * Input paths, the output location and the tunables that used to be literals
 * (visible cap per prefix, deletion budget) all live here.
 */
public final class BuildConfig {

    public static final int DEFAULT_PREFIX_CAP = 20;
    public static final int DEFAULT_DELETE_BUDGET = 2;
    public static final int MAX_DELETE_BUDGET = 3;

    private final Path legitimateWordsPath;
    private final Path hiddenWordsPath;
    private final Path frequencySourcePath;
    private final SourceFormat sourceFormat;
    private final Path auxiliaryCorpusPath;
    private final Path outputPath;
    private final Path filteredWordListPath;
    private final int prefixCap;
    private final int deleteBudget;
    private final FuzzyStrategy fuzzyStrategy;
    private final int threads;

    private BuildConfig(Builder builder) {
        this.legitimateWordsPath = builder.legitimateWordsPath;
        this.hiddenWordsPath = builder.hiddenWordsPath;
        this.frequencySourcePath = builder.frequencySourcePath;
        this.sourceFormat = builder.sourceFormat;
        this.auxiliaryCorpusPath = builder.auxiliaryCorpusPath;
        this.outputPath = builder.outputPath;
        this.filteredWordListPath = builder.filteredWordListPath;
        this.prefixCap = builder.prefixCap;
        this.deleteBudget = builder.deleteBudget;
        this.fuzzyStrategy = builder.fuzzyStrategy;
        this.threads = builder.threads;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .legitimateWordsPath(legitimateWordsPath)
            .hiddenWordsPath(hiddenWordsPath)
            .frequencySourcePath(frequencySourcePath)
            .sourceFormat(sourceFormat)
            .auxiliaryCorpusPath(auxiliaryCorpusPath)
            .outputPath(outputPath)
            .filteredWordListPath(filteredWordListPath)
            .prefixCap(prefixCap)
            .deleteBudget(deleteBudget)
            .fuzzyStrategy(fuzzyStrategy)
            .threads(threads);
    }

    public Path getLegitimateWordsPath() {
        return legitimateWordsPath;
    }

    /** May be null: no words are hidden. */
    public Path getHiddenWordsPath() {
        return hiddenWordsPath;
    }

    public Path getFrequencySourcePath() {
        return frequencySourcePath;
    }

    public SourceFormat getSourceFormat() {
        return sourceFormat;
    }

    /** May be null: distributions are written as zeros. */
    public Path getAuxiliaryCorpusPath() {
        return auxiliaryCorpusPath;
    }

    public Path getOutputPath() {
        return outputPath;
    }

    /** May be null. */
    public Path getFilteredWordListPath() {
        return filteredWordListPath;
    }

    public int getPrefixCap() {
        return prefixCap;
    }

    public int getDeleteBudget() {
        return deleteBudget;
    }

    public FuzzyStrategy getFuzzyStrategy() {
        return fuzzyStrategy;
    }

    public int getThreads() {
        return threads;
    }

    @Override
    public String toString() {
        return String.format("BuildConfig[legitimate=%s, hidden=%s, source=%s (%s), corpus=%s, output=%s, "
                + "prefixCap=%d, deleteBudget=%d, fuzzy=%s, threads=%d]",
            legitimateWordsPath, hiddenWordsPath, frequencySourcePath, sourceFormat,
            auxiliaryCorpusPath, outputPath, prefixCap, deleteBudget, fuzzyStrategy, threads);
    }

    public static final class Builder {
        private Path legitimateWordsPath;
        private Path hiddenWordsPath;
        private Path frequencySourcePath;
        private SourceFormat sourceFormat = SourceFormat.AUTO;
        private Path auxiliaryCorpusPath;
        private Path outputPath;
        private Path filteredWordListPath;
        private int prefixCap = DEFAULT_PREFIX_CAP;
        private int deleteBudget = DEFAULT_DELETE_BUDGET;
        private FuzzyStrategy fuzzyStrategy = FuzzyStrategy.DELETE_DICTIONARY;
        private int threads = Math.min(4, Runtime.getRuntime().availableProcessors());

        private Builder() {
        }

        public Builder legitimateWordsPath(Path path) {
            this.legitimateWordsPath = path;
            return this;
        }

        public Builder hiddenWordsPath(Path path) {
            this.hiddenWordsPath = path;
            return this;
        }

        public Builder frequencySourcePath(Path path) {
            this.frequencySourcePath = path;
            return this;
        }

        public Builder sourceFormat(SourceFormat format) {
            this.sourceFormat = format;
            return this;
        }

        public Builder auxiliaryCorpusPath(Path path) {
            this.auxiliaryCorpusPath = path;
            return this;
        }

        public Builder outputPath(Path path) {
            this.outputPath = path;
            return this;
        }

        public Builder filteredWordListPath(Path path) {
            this.filteredWordListPath = path;
            return this;
        }

        public Builder prefixCap(int prefixCap) {
            this.prefixCap = prefixCap;
            return this;
        }

        public Builder deleteBudget(int deleteBudget) {
            this.deleteBudget = deleteBudget;
            return this;
        }

        public Builder fuzzyStrategy(FuzzyStrategy strategy) {
            this.fuzzyStrategy = strategy;
            return this;
        }

        public Builder threads(int threads) {
            this.threads = threads;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a required path is missing or a tunable is out of range
         */
        public BuildConfig build() {
            if (legitimateWordsPath == null) {
                throw new IllegalArgumentException("Missing legitimate words path");
            }
            if (frequencySourcePath == null) {
                throw new IllegalArgumentException("Missing frequency source path");
            }
            if (outputPath == null) {
                throw new IllegalArgumentException("Missing output path");
            }
            if (prefixCap < 1) {
                throw new IllegalArgumentException("prefix_cap must be >= 1, got " + prefixCap);
            }
            if (deleteBudget < 0 || deleteBudget > MAX_DELETE_BUDGET) {
                throw new IllegalArgumentException("delete_budget must be within 0.." + MAX_DELETE_BUDGET
                    + ", got " + deleteBudget);
            }
            if (threads < 1) {
                throw new IllegalArgumentException("threads must be >= 1, got " + threads);
            }
            Objects.requireNonNull(sourceFormat, "sourceFormat");
            Objects.requireNonNull(fuzzyStrategy, "fuzzyStrategy");
            return new BuildConfig(this);
        }
    }
}
