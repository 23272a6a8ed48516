package org.smileyface.riskcrawler.crawler;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.smileyface.riskcrawler.model.TargetKind;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TargetCanonicalizerTest {

    @ParameterizedTest
    @ValueSource(strings = {
            "@Crypto_Signals",
            "crypto_signals",
            "t.me/crypto_signals",
            "https://t.me/Crypto_Signals",
            "https://t.me/s/crypto_signals",
            "http://telegram.me/crypto_signals",
            "https://t.me/crypto_signals/1234",
            "  @crypto_signals  "
    })
    void channelSpellingsCollapseToOneHandle(String raw) {
        assertThat(TargetCanonicalizer.inferKind(raw)).isEqualTo(TargetKind.CHANNEL);
        assertThat(TargetCanonicalizer.canonicalize(raw, null)).isEqualTo("@crypto_signals");
    }

    @Test
    void pageUrlsAreNormalized() {
        assertThat(TargetCanonicalizer.canonicalUrl("HTTPS://Example.COM:443/Offers/?utm_source=x&id=7&ref=abc"))
                .isEqualTo("https://example.com/Offers?id=7");
        assertThat(TargetCanonicalizer.canonicalUrl("http://example.com")).isEqualTo("http://example.com/");
        assertThat(TargetCanonicalizer.canonicalUrl("http://example.com:8080/a//")).isEqualTo("http://example.com:8080/a");
        assertThat(TargetCanonicalizer.canonicalUrl("https://example.com/page#section")).isEqualTo("https://example.com/page");
    }

    @Test
    void equivalentUrlsShareTheSameIdentifier() {
        String a = TargetCanonicalizer.canonicalize("https://shop.example/deal?utm_campaign=spring", TargetKind.PAGE);
        String b = TargetCanonicalizer.canonicalize("https://SHOP.example/deal/", TargetKind.PAGE);
        assertThat(a).isEqualTo(b);
    }

    @Test
    void invalidIdentifiersAreRejected() {
        assertThatThrownBy(() -> TargetCanonicalizer.canonicalUrl("ftp://example.com/file"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TargetCanonicalizer.canonicalUrl("/relative/path"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TargetCanonicalizer.canonicalHandle("@abc"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TargetCanonicalizer.canonicalHandle("https://t.me/"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(TargetCanonicalizer.tryCanonicalize("mailto:someone@example.com", TargetKind.PAGE)).isEmpty();
    }

    @Test
    void domainAndKindOfCanonicalIdentifiers() {
        assertThat(TargetCanonicalizer.domainOf("@crypto_signals")).isEqualTo("crypto_signals");
        assertThat(TargetCanonicalizer.domainOf("https://example.com/a")).isEqualTo("example.com");
        assertThat(TargetCanonicalizer.kindOf("@crypto_signals")).isEqualTo(TargetKind.CHANNEL);
        assertThat(TargetCanonicalizer.kindOf("https://example.com/")).isEqualTo(TargetKind.PAGE);
        assertThat(TargetCanonicalizer.inferKind("https://example.com/t.me")).isEqualTo(TargetKind.PAGE);
    }
}
