package com.architecture.memory.riskscope.service.signal.profile;

import com.architecture.memory.riskscope.config.RiskScopeProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Picks the threshold profile for a changed file.
 *
 * <p>Order: a fixed profile if configured, then {@code language_domain}, then the language's
 * usual profiles, then the domain's usual profile, then {@code default}. Language comes from
 * the configured repository language or the file extension; domain from configuration or
 * the directories in the path.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RiskProfileSelector {

    static final Map<String, String> LANGUAGE_BY_EXTENSION = Map.ofEntries(
            Map.entry("py", "python"),
            Map.entry("go", "go"),
            Map.entry("ts", "typescript"),
            Map.entry("tsx", "typescript"),
            Map.entry("js", "typescript"),
            Map.entry("jsx", "typescript"),
            Map.entry("mjs", "typescript"),
            Map.entry("java", "java"),
            Map.entry("kt", "kotlin"),
            Map.entry("scala", "scala"),
            Map.entry("rs", "rust"),
            Map.entry("rb", "ruby"),
            Map.entry("php", "php"),
            Map.entry("cs", "csharp"),
            Map.entry("ex", "elixir"),
            Map.entry("exs", "elixir"));

    static final Map<String, String> LANGUAGE_ALIASES = Map.of(
            "golang", "go",
            "javascript", "typescript",
            "c#", "csharp");

    static final Map<String, List<String>> LANGUAGE_FALLBACKS = Map.of(
            "python", List.of(RiskProfileCatalog.PYTHON_WEB, RiskProfileCatalog.PYTHON_BACKEND),
            "go", List.of(RiskProfileCatalog.GO_BACKEND, RiskProfileCatalog.GO_WEB),
            "typescript", List.of(RiskProfileCatalog.TYPESCRIPT_FRONTEND, RiskProfileCatalog.TYPESCRIPT_WEB),
            "java", List.of(RiskProfileCatalog.JAVA_BACKEND),
            "rust", List.of(RiskProfileCatalog.RUST_BACKEND));

    static final Map<ProjectDomain, String> DOMAIN_FALLBACKS = Map.of(
            ProjectDomain.WEB, RiskProfileCatalog.PYTHON_WEB,
            ProjectDomain.BACKEND, RiskProfileCatalog.GO_BACKEND,
            ProjectDomain.FRONTEND, RiskProfileCatalog.TYPESCRIPT_FRONTEND,
            ProjectDomain.ML, RiskProfileCatalog.ML_PROJECT,
            ProjectDomain.CLI, RiskProfileCatalog.CLI_TOOL);

    static final Set<String> CLI_DIRS = Set.of("cmd", "cli", "commands");
    static final Set<String> ML_DIRS = Set.of("ml", "notebooks", "training", "pipelines");
    static final Set<String> FRONTEND_DIRS = Set.of("components", "pages", "public", "static", "assets");
    static final Set<String> BACKEND_DIRS = Set.of("api", "server", "services", "handlers", "controllers");
    static final Set<String> WEB_DIRS = Set.of("templates", "views", "routes");
    static final Set<String> BACKEND_LANGUAGES = Set.of("go", "java", "rust", "csharp", "kotlin", "scala", "elixir");

    private final RiskProfileCatalog catalog;
    private final RiskScopeProperties properties;

    public ProfileSelection select(String filePath) {
        RiskScopeProperties.Profiles config = properties.getProfiles();
        String fixed = config.getFixed();
        if (fixed != null && !fixed.isBlank()) {
            Optional<RiskProfile> pinned = catalog.find(fixed.trim());
            if (pinned.isPresent()) {
                return ProfileSelection.builder()
                        .profile(pinned.get())
                        .domain(ProjectDomain.UNKNOWN)
                        .reason("Fixed profile: config=" + pinned.get().getKey())
                        .build();
            }
            log.warn("[Profiles] Unknown fixed profile '{}', selecting per file", fixed);
        }
        if (!config.isAdaptive()) {
            return ProfileSelection.builder()
                    .profile(catalog.defaultProfile())
                    .domain(ProjectDomain.UNKNOWN)
                    .reason("Adaptive profiles disabled: config=" + RiskProfileCatalog.DEFAULT)
                    .build();
        }

        String language = languageOf(filePath, config.getLanguage());
        ProjectDomain configured = ProjectDomain.fromWireName(config.getDomain());
        ProjectDomain domain = configured != ProjectDomain.UNKNOWN ? configured : inferDomain(filePath, language);
        return select(language, domain);
    }

    ProfileSelection select(String language, ProjectDomain domain) {
        Optional<RiskProfile> exact = exactKey(language, domain).flatMap(catalog::find);
        if (exact.isPresent()) {
            return selection(exact.get(), language, domain, "Exact match", false);
        }
        for (String key : LANGUAGE_FALLBACKS.getOrDefault(language, List.of())) {
            Optional<RiskProfile> byLanguage = catalog.find(key);
            if (byLanguage.isPresent()) {
                return selection(byLanguage.get(), language, domain, "Language fallback", true);
            }
        }
        Optional<RiskProfile> byDomain = Optional.ofNullable(DOMAIN_FALLBACKS.get(domain)).flatMap(catalog::find);
        if (byDomain.isPresent()) {
            return selection(byDomain.get(), language, domain, "Domain fallback", true);
        }
        return selection(catalog.defaultProfile(), language, domain, "Default fallback", true);
    }

    static Optional<String> exactKey(String language, ProjectDomain domain) {
        if (domain == ProjectDomain.ML) {
            return Optional.of(RiskProfileCatalog.ML_PROJECT);
        }
        if (domain == ProjectDomain.CLI) {
            return Optional.of(RiskProfileCatalog.CLI_TOOL);
        }
        if (language == null || language.isEmpty() || domain == ProjectDomain.UNKNOWN) {
            return Optional.empty();
        }
        return Optional.of(language + "_" + domain.getWireName());
    }

    static String languageOf(String filePath, String configuredLanguage) {
        if (configuredLanguage != null && !configuredLanguage.isBlank()) {
            return normalizeLanguage(configuredLanguage);
        }
        String name = filePath.substring(filePath.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return "";
        }
        return LANGUAGE_BY_EXTENSION.getOrDefault(name.substring(dot + 1).toLowerCase(Locale.ROOT), "");
    }

    static String normalizeLanguage(String language) {
        String lower = language.trim().toLowerCase(Locale.ROOT);
        return LANGUAGE_ALIASES.getOrDefault(lower, lower);
    }

    /**
     * Directory-name heuristics over the path's segments, then backend for service languages.
     */
    static ProjectDomain inferDomain(String filePath, String language) {
        String[] segments = filePath.toLowerCase(Locale.ROOT).split("/");
        Set<String> dirs = new HashSet<>(Arrays.asList(segments).subList(0, Math.max(0, segments.length - 1)));
        if (dirs.stream().anyMatch(CLI_DIRS::contains)) {
            return ProjectDomain.CLI;
        }
        if (dirs.stream().anyMatch(ML_DIRS::contains)) {
            return ProjectDomain.ML;
        }
        if (dirs.stream().anyMatch(FRONTEND_DIRS::contains)) {
            return ProjectDomain.FRONTEND;
        }
        if (dirs.stream().anyMatch(BACKEND_DIRS::contains)) {
            return ProjectDomain.BACKEND;
        }
        if (dirs.stream().anyMatch(WEB_DIRS::contains)) {
            return ProjectDomain.WEB;
        }
        return BACKEND_LANGUAGES.contains(language) ? ProjectDomain.BACKEND : ProjectDomain.UNKNOWN;
    }

    private static ProfileSelection selection(RiskProfile profile, String language, ProjectDomain domain,
                                              String strategy, boolean fallbackUsed) {
        String shownLanguage = language == null || language.isEmpty() ? "unknown" : language;
        return ProfileSelection.builder()
                .profile(profile)
                .language(language)
                .domain(domain)
                .reason(String.format("%s: language=%s, domain=%s, config=%s",
                        strategy, shownLanguage, domain.getWireName(), profile.getKey()))
                .fallbackUsed(fallbackUsed)
                .build();
    }
}
