package com.kmg.repost.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.kmg.repost.config.RepostProperties;
import com.kmg.repost.model.ActionOutcome;
import java.util.List;
import org.junit.jupiter.api.Test;

class PlaywrightRepostExecutorTest {

    @Test
    void shouldFailWithoutLaunchingBrowserWhenCredentialsMissing() {
        RepostProperties properties = new RepostProperties();
        properties.getAction().setEmail("seller@example.com");
        properties.getAction().setPassword(" ");

        ActionOutcome outcome = new PlaywrightRepostExecutor(properties).execute("https://www.leboncoin.fr/ad/1");

        assertThat(outcome.ok()).isFalse();
        assertThat(outcome.toResultText()).isEqualTo("ERR: Missing LBC_EMAIL or LBC_PASSWORD in environment");
    }

    @Test
    void shouldBuildCaseFoldedAlternationFromLabels() {
        String pattern = PlaywrightRepostExecutor.labelAlternation(List.of("Renouveler", "Remonter l'annonce", "a.b"));

        assertThat(pattern).isEqualTo("(renouveler|remonter l'annonce|a\\.b)");
        assertThat("Remonter l'annonce maintenant".toLowerCase()).containsPattern(pattern);
    }
}
