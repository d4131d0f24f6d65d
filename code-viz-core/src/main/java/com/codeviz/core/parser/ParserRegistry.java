package com.codeviz.core.parser;

import com.codeviz.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.TreeSet;

/**
 * Maps languages, aliases and file extensions to {@link LanguageParser} instances.
 *
 * <p>Parsers are created once and reused for every file of every run; the registry
 * itself is immutable after construction and safe to share between threads.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * ParserRegistry registry = ParserRegistry.discover();
 * LanguageParser parser = registry.getParserForFile(Path.of("src/app.ts"));
 * }</pre>
 *
 * @see LanguageParser
 * @since 1.0.0
 */
public final class ParserRegistry {

    private static final Logger log = LoggerFactory.getLogger(ParserRegistry.class);

    private final Map<String, LanguageParser> parsersByLanguage;
    private final Map<String, String> languageByAlias;
    private final Map<String, String> languageByExtension;

    /**
     * Builds a registry from an explicit parser list. When two parsers claim the
     * same language, extension or alias, the first one wins.
     *
     * @param parsers parsers to register
     */
    public ParserRegistry(List<? extends LanguageParser> parsers) {
        Map<String, LanguageParser> byLanguage = new LinkedHashMap<>();
        Map<String, String> byAlias = new LinkedHashMap<>();
        Map<String, String> byExtension = new LinkedHashMap<>();

        for (LanguageParser parser : parsers) {
            String language = normalize(parser.getLanguage());
            if (byLanguage.putIfAbsent(language, parser) != null) {
                log.warn("Duplicate parser for language '{}' ignored: {}", language, parser.getClass().getName());
                continue;
            }
            for (String extension : parser.getExtensions()) {
                String previous = byExtension.putIfAbsent(normalize(extension), language);
                if (previous != null) {
                    log.warn("Extension '{}' already mapped to '{}', not to '{}'", extension, previous, language);
                }
            }
            for (String alias : parser.getAliases()) {
                byAlias.putIfAbsent(normalize(alias), language);
            }
        }

        this.parsersByLanguage = Collections.unmodifiableMap(byLanguage);
        this.languageByAlias = Collections.unmodifiableMap(byAlias);
        this.languageByExtension = Collections.unmodifiableMap(byExtension);
        log.debug("Parser registry initialized with languages {}", byLanguage.keySet());
    }

    /**
     * Discovers parsers via {@link ServiceLoader}. Parsers whose engine cannot be
     * loaded on this platform are left out.
     *
     * @return registry of the available parsers
     */
    public static ParserRegistry discover() {
        log.debug("Discovering language parsers via ServiceLoader");
        ServiceLoader<LanguageParser> loader = ServiceLoader.load(LanguageParser.class);
        List<LanguageParser> parsers = new ArrayList<>();
        for (LanguageParser parser : loader) {
            if (parser.isAvailable()) {
                parsers.add(parser);
            } else {
                log.warn("Language parser for '{}' is not available on this platform", parser.getLanguage());
            }
        }
        log.info("Discovered {} language parsers", parsers.size());
        return new ParserRegistry(parsers);
    }

    /**
     * Gets the parser for a language tag or alias.
     *
     * @param language language tag or alias, case-insensitive
     * @return parser instance
     * @throws UnsupportedLanguageException if no parser handles the language
     */
    public LanguageParser getParser(String language) {
        return findParser(language).orElseThrow(() -> new UnsupportedLanguageException(language));
    }

    /**
     * Looks up a parser without throwing.
     *
     * @param language language tag or alias, case-insensitive
     * @return parser, or empty if unsupported
     */
    public Optional<LanguageParser> findParser(String language) {
        if (language == null) {
            return Optional.empty();
        }
        String key = normalize(language);
        LanguageParser parser = parsersByLanguage.get(key);
        if (parser == null) {
            String resolved = languageByAlias.get(key);
            parser = resolved != null ? parsersByLanguage.get(resolved) : null;
        }
        return Optional.ofNullable(parser);
    }

    /**
     * Gets the parser for a file, chosen by extension.
     *
     * @param file file path
     * @return parser instance
     * @throws UnsupportedLanguageException if the extension is not registered
     */
    public LanguageParser getParserForFile(Path file) {
        String language = detectLanguage(file)
            .orElseThrow(() -> new UnsupportedLanguageException("." + FileUtils.getNormalizedExtension(file)));
        return getParser(language);
    }

    /**
     * Detects the language of a file from its extension.
     *
     * @param file file path
     * @return language tag, or empty if no parser handles the extension
     */
    public Optional<String> detectLanguage(Path file) {
        return Optional.ofNullable(languageByExtension.get(FileUtils.getNormalizedExtension(file)));
    }

    /**
     * @return every extension handled by a registered parser
     */
    public Set<String> getSupportedExtensions() {
        return Collections.unmodifiableSet(new TreeSet<>(languageByExtension.keySet()));
    }

    /**
     * @return registered language tags, in registration order
     */
    public Set<String> getLanguages() {
        return parsersByLanguage.keySet();
    }

    public boolean supports(String language) {
        return findParser(language).isPresent();
    }

    private static String normalize(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
