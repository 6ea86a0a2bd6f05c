package com.architecture.memory.riskscope.service.signal.profile;

import com.architecture.memory.riskscope.config.RiskScopeProperties;
import com.architecture.memory.riskscope.dto.risk.RiskLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RiskProfileSelectorTest {

    private RiskScopeProperties properties;
    private RiskProfileCatalog catalog;
    private RiskProfileSelector selector;

    @BeforeEach
    void setUp() {
        properties = new RiskScopeProperties();
        properties.getProfiles().setAdaptive(true);
        catalog = new RiskProfileCatalog(properties);
        selector = new RiskProfileSelector(catalog, properties);
    }

    @Test
    void picksExactLanguageAndDomainMatch() {
        ProfileSelection selection = selector.select("api/handlers/orders.py");

        assertThat(selection.getProfile().getKey()).isEqualTo(RiskProfileCatalog.PYTHON_BACKEND);
        assertThat(selection.isFallbackUsed()).isFalse();
        assertThat(selection.getReason())
                .isEqualTo("Exact match: language=python, domain=backend, config=python_backend");
    }

    @Test
    void mlAndCliDirectories_overrideLanguage() {
        assertThat(selector.select("training/loaders/dataset.py").getProfile().getKey())
                .isEqualTo(RiskProfileCatalog.ML_PROJECT);
        assertThat(selector.select("cmd/riskctl/main.go").getProfile().getKey())
                .isEqualTo(RiskProfileCatalog.CLI_TOOL);
    }

    @Test
    void fallsBackToLanguage_whenNoProfileForDomain() {
        ProfileSelection selection = selector.select("components/button/index.java");

        assertThat(selection.getDomain()).isEqualTo(ProjectDomain.FRONTEND);
        assertThat(selection.getProfile().getKey()).isEqualTo(RiskProfileCatalog.JAVA_BACKEND);
        assertThat(selection.isFallbackUsed()).isTrue();
        assertThat(selection.getReason()).startsWith("Language fallback: language=java, domain=frontend");
    }

    @Test
    void fallsBackToDomain_forLanguageWithoutProfiles() {
        ProfileSelection selection = selector.select("app/views/orders.rb");

        assertThat(selection.getProfile().getKey()).isEqualTo(RiskProfileCatalog.PYTHON_WEB);
        assertThat(selection.getReason()).startsWith("Domain fallback: language=ruby, domain=web");
    }

    @Test
    void fallsBackToDefault_whenNothingIsKnown() {
        ProfileSelection selection = selector.select("README");

        assertThat(selection.getProfile()).isSameAs(catalog.defaultProfile());
        assertThat(selection.getReason()).isEqualTo("Default fallback: language=unknown, domain=unknown, config=default");
    }

    @Test
    void configuredLanguageAndDomain_winOverThePath() {
        properties.getProfiles().setLanguage("TypeScript");
        properties.getProfiles().setDomain("web");

        assertThat(selector.select("src/server/main.go").getProfile().getKey())
                .isEqualTo(RiskProfileCatalog.TYPESCRIPT_WEB);
    }

    @Test
    void fixedProfile_winsOverAdaptiveSelection() {
        properties.getProfiles().setFixed("rust_backend");

        ProfileSelection selection = selector.select("api/handlers/orders.py");

        assertThat(selection.getProfile().getKey()).isEqualTo(RiskProfileCatalog.RUST_BACKEND);
        assertThat(selection.getReason()).isEqualTo("Fixed profile: config=rust_backend");
    }

    @Test
    void unknownFixedProfile_isIgnored() {
        properties.getProfiles().setFixed("cobol_mainframe");

        assertThat(selector.select("api/handlers/orders.py").getProfile().getKey())
                .isEqualTo(RiskProfileCatalog.PYTHON_BACKEND);
    }

    @Test
    void adaptiveOff_alwaysUsesDefault() {
        properties.getProfiles().setAdaptive(false);

        ProfileSelection selection = selector.select("api/handlers/orders.py");

        assertThat(selection.getProfile().getKey()).isEqualTo(RiskProfileCatalog.DEFAULT);
        assertThat(selection.getReason()).isEqualTo("Adaptive profiles disabled: config=default");
    }

    @Test
    void repeatedDirectoryNames_areTolerated() {
        assertThat(RiskProfileSelector.inferDomain("services/api/api/handler.go", "go"))
                .isEqualTo(ProjectDomain.BACKEND);
    }

    @Test
    void defaultProfile_mirrorsTierOneThresholds() {
        RiskProfile profile = catalog.defaultProfile();

        assertThat(profile.getCouplingThreshold()).isEqualTo(10);
        assertThat(profile.getCoChangeThreshold()).isEqualTo(0.7);
        assertThat(profile.getTestRatioThreshold()).isEqualTo(0.3);
        assertThat(profile.couplingLevel(11)).isEqualTo(RiskLevel.HIGH);
        assertThat(profile.couplingLevel(10)).isEqualTo(RiskLevel.MEDIUM);
        assertThat(profile.couplingLevel(5)).isEqualTo(RiskLevel.LOW);
        assertThat(profile.coChangeLevel(0.3)).isEqualTo(RiskLevel.LOW);
        assertThat(profile.coChangeLevel(0.31)).isEqualTo(RiskLevel.MEDIUM);
        assertThat(profile.testRatioLevel(0.29)).isEqualTo(RiskLevel.HIGH);
        assertThat(profile.testRatioLevel(0.79)).isEqualTo(RiskLevel.MEDIUM);
        assertThat(profile.testRatioLevel(0.8)).isEqualTo(RiskLevel.LOW);
    }

    @Test
    void catalogHoldsEveryBuiltInProfile() {
        assertThat(catalog.all()).extracting(RiskProfile::getKey).contains(
                RiskProfileCatalog.DEFAULT, RiskProfileCatalog.GO_BACKEND, RiskProfileCatalog.ML_PROJECT,
                RiskProfileCatalog.CLI_TOOL, RiskProfileCatalog.TYPESCRIPT_FRONTEND);
        assertThat(catalog.find("nope")).isEmpty();
        assertThat(catalog.find(null)).isEmpty();
    }
}
