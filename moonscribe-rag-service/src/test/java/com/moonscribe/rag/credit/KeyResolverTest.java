package com.moonscribe.rag.credit;

import com.moonscribe.rag.config.ProviderProperties;
import com.moonscribe.rag.exception.InsufficientCreditsException;
import com.moonscribe.rag.exception.MissingCredentialException;
import com.moonscribe.rag.llm.ProviderCredential;
import com.moonscribe.rag.llm.ProviderKind;
import com.moonscribe.rag.team.TeamKey;
import com.moonscribe.rag.team.TeamKeyStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class KeyResolverTest {

    @Mock
    private CreditLedger ledger;

    @Mock
    private TeamKeyStore teamKeys;

    private ProviderProperties providers;
    private KeyResolver resolver;

    @BeforeEach
    void setUp() {
        providers = new ProviderProperties();
        providers.getOpenai().setApiKey("sk-server-openai");
        resolver = new KeyResolver(ledger, teamKeys, providers);
    }

    @Nested
    @DisplayName("Own key")
    class Byok {

        @Test
        @DisplayName("Should use the caller's key without touching teams or credits")
        void shouldUseCallerKey() {
            KeyResolution resolution = resolver.resolve("user-1", "  sk-mine ", ProviderKind.ANTHROPIC, CreditAction.ASK_CLAUDE);

            assertThat(resolution.keySource()).isEqualTo(KeySource.BYOK);
            assertThat(resolution.credential()).isEqualTo(new ProviderCredential(ProviderKind.ANTHROPIC, "sk-mine"));
            assertThat(resolution.requiresDeduction()).isFalse();
            verifyNoInteractions(ledger, teamKeys);
        }

        @Test
        @DisplayName("Anonymous callers may use their own key")
        void shouldAllowAnonymousByok() {
            KeyResolution resolution = resolver.resolve(null, "sk-mine", null, CreditAction.ASK_GPT35);

            assertThat(resolution.userId()).isNull();
            assertThat(resolution.credential().provider()).isEqualTo(ProviderKind.OPENAI);
            verifyNoInteractions(ledger, teamKeys);
        }
    }

    @Nested
    @DisplayName("Team key")
    class Team {

        @Test
        @DisplayName("Should use the team key and never consult credits")
        void shouldUseTeamKey() {
            // given
            when(teamKeys.getTeamKey("user-1"))
                    .thenReturn(Optional.of(new TeamKey("sk-team", "Biology Lab", ProviderKind.ANTHROPIC)));

            // when
            KeyResolution resolution = resolver.resolve("user-1", null, ProviderKind.OPENAI, CreditAction.ASK_GPT4O);

            // then
            assertThat(resolution.keySource()).isEqualTo(KeySource.TEAM);
            assertThat(resolution.teamName()).isEqualTo("Biology Lab");
            assertThat(resolution.credential().provider()).isEqualTo(ProviderKind.ANTHROPIC);
            assertThat(resolution.cost()).isZero();
            verifyNoInteractions(ledger);
        }
    }

    @Nested
    @DisplayName("Credits")
    class Credits {

        @Test
        @DisplayName("Should use the server key when the balance covers the cost")
        void shouldUseServerKey() {
            when(teamKeys.getTeamKey("user-1")).thenReturn(Optional.empty());
            when(ledger.getCost(CreditAction.ASK_GPT4O)).thenReturn(5);
            when(ledger.getBalance("user-1")).thenReturn(5);

            KeyResolution resolution = resolver.resolve("user-1", "", ProviderKind.OPENAI, CreditAction.ASK_GPT4O);

            assertThat(resolution.keySource()).isEqualTo(KeySource.CREDITS);
            assertThat(resolution.credential().apiKey()).isEqualTo("sk-server-openai");
            assertThat(resolution.cost()).isEqualTo(5);
            assertThat(resolution.balanceBefore()).isEqualTo(5);
            assertThat(resolution.requiresDeduction()).isTrue();
        }

        @Test
        @DisplayName("Should multiply the cost by the quantity")
        void shouldMultiplyCost() {
            when(teamKeys.getTeamKey("user-1")).thenReturn(Optional.empty());
            when(ledger.getCost(CreditAction.UPLOAD_DOCUMENT_PAGE)).thenReturn(1);
            when(ledger.getBalance("user-1")).thenReturn(3);

            assertThatThrownBy(() -> resolver.resolve("user-1", null, ProviderKind.OPENAI, CreditAction.UPLOAD_DOCUMENT_PAGE, 4))
                    .isInstanceOf(InsufficientCreditsException.class)
                    .satisfies(e -> {
                        InsufficientCreditsException ex = (InsufficientCreditsException) e;
                        assertThat(ex.getRequired()).isEqualTo(4);
                        assertThat(ex.getBalance()).isEqualTo(3);
                    });
        }

        @Test
        @DisplayName("Should fall back to the default provider's server key")
        void shouldFallBackToDefaultProvider() {
            when(teamKeys.getTeamKey("user-1")).thenReturn(Optional.empty());
            when(ledger.getCost(CreditAction.ASK_CLAUDE)).thenReturn(5);
            when(ledger.getBalance("user-1")).thenReturn(100);

            KeyResolution resolution = resolver.resolve("user-1", null, ProviderKind.ANTHROPIC, CreditAction.ASK_CLAUDE);

            assertThat(resolution.credential().provider()).isEqualTo(ProviderKind.OPENAI);
        }

        @Test
        @DisplayName("Zero-cost actions pass with an empty balance")
        void shouldAllowFreeAction() {
            when(teamKeys.getTeamKey("user-1")).thenReturn(Optional.empty());
            when(ledger.getCost(CreditAction.EXPORT_INSIGHT)).thenReturn(0);
            when(ledger.getBalance("user-1")).thenReturn(0);

            KeyResolution resolution = resolver.resolve("user-1", null, null, CreditAction.EXPORT_INSIGHT);

            assertThat(resolution.requiresDeduction()).isFalse();
        }
    }

    @Nested
    @DisplayName("Missing credentials")
    class Missing {

        @Test
        @DisplayName("Anonymous callers without a key cannot use credits")
        void shouldRejectAnonymousCaller() {
            assertThatThrownBy(() -> resolver.resolve(" ", null, ProviderKind.OPENAI, CreditAction.ASK_GPT35))
                    .isInstanceOf(MissingCredentialException.class)
                    .satisfies(e -> assertThat(((MissingCredentialException) e).isServerMisconfigured()).isFalse());
            verifyNoInteractions(ledger, teamKeys);
        }

        @Test
        @DisplayName("No server key at all is a server misconfiguration")
        void shouldReportMisconfiguredServer() {
            providers.getOpenai().setApiKey("");
            when(teamKeys.getTeamKey("user-1")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> resolver.resolve("user-1", null, ProviderKind.OPENAI, CreditAction.ASK_GPT35))
                    .isInstanceOf(MissingCredentialException.class)
                    .satisfies(e -> assertThat(((MissingCredentialException) e).isServerMisconfigured()).isTrue());
            verifyNoInteractions(ledger);
        }
    }

    @Nested
    @DisplayName("Embedding key")
    class EmbeddingKey {

        @Test
        @DisplayName("Should reuse an OpenAI credential")
        void shouldReuseOpenAiKey() {
            KeyResolution resolution = KeyResolution.byok(new ProviderCredential(ProviderKind.OPENAI, "sk-mine"), null);

            assertThat(resolver.embeddingKey(resolution)).isEqualTo("sk-mine");
        }

        @Test
        @DisplayName("Should use the server OpenAI key for an Anthropic credential billed to credits")
        void shouldUseServerKeyInCreditsMode() {
            KeyResolution resolution = KeyResolution.credits(
                    new ProviderCredential(ProviderKind.ANTHROPIC, "sk-server-ant"), "u", CreditAction.ASK_CLAUDE, 2, 10);

            assertThat(resolver.embeddingKey(resolution)).isEqualTo("sk-server-openai");
        }

        @Test
        @DisplayName("Should not fund embeddings for an anonymous Anthropic key")
        void shouldRejectAnthropicByokWithoutTouchingServerKey() {
            // given
            KeyResolution resolution = resolver.resolve(null, "sk-ant-mine", ProviderKind.ANTHROPIC,
                    CreditAction.UPLOAD_DOCUMENT_PAGE, 500);

            // when / then
            assertThatThrownBy(() -> resolver.embeddingKey(resolution))
                    .isInstanceOf(MissingCredentialException.class)
                    .satisfies(e -> {
                        MissingCredentialException mce = (MissingCredentialException) e;
                        assertThat(mce.getStage()).isEqualTo("embedding");
                        assertThat(mce.isServerMisconfigured()).isFalse();
                        assertThat(mce.getMessage()).doesNotContain("sk-server-openai");
                    });
            verifyNoInteractions(ledger, teamKeys);
        }

        @Test
        @DisplayName("Should not fund embeddings for an Anthropic team key")
        void shouldRejectAnthropicTeamKey() {
            KeyResolution resolution = KeyResolution.team(new ProviderCredential(ProviderKind.ANTHROPIC, "sk-ant"), "u", "T");

            assertThatThrownBy(() -> resolver.embeddingKey(resolution))
                    .isInstanceOf(MissingCredentialException.class);
        }

        @Test
        @DisplayName("Should fail when the server has no OpenAI key in credits mode")
        void shouldFailWithoutOpenAiKey() {
            providers.getOpenai().setApiKey(null);
            KeyResolution resolution = KeyResolution.credits(
                    new ProviderCredential(ProviderKind.ANTHROPIC, "sk-server-ant"), "u", CreditAction.ASK_CLAUDE, 2, 10);

            assertThatThrownBy(() -> resolver.embeddingKey(resolution))
                    .isInstanceOf(MissingCredentialException.class)
                    .satisfies(e -> {
                        assertThat(((MissingCredentialException) e).getStage()).isEqualTo("embedding");
                        assertThat(((MissingCredentialException) e).isServerMisconfigured()).isTrue();
                    });
        }
    }
}
