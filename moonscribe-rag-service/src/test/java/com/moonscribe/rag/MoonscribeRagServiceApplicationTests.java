package com.moonscribe.rag;

import com.moonscribe.rag.credit.KeyResolver;
import com.moonscribe.rag.llm.CompletionOrchestrator;
import com.moonscribe.rag.llm.ProviderKind;
import com.moonscribe.rag.vector.VectorIndexClient;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class MoonscribeRagServiceApplicationTests {

    @Autowired
    private VectorIndexClient vectorIndex;

    @Autowired
    private CompletionOrchestrator orchestrator;

    @Autowired
    private KeyResolver keyResolver;

    @Test
    void contextLoads() {
        assertThat(vectorIndex).isNotNull();
        assertThat(keyResolver).isNotNull();
        assertThat(orchestrator.defaultModel(ProviderKind.ANTHROPIC)).isNotBlank();
    }
}
