package fr.lapetina.codex.linker.domain.provider;

import java.util.List;
import java.util.Map;

/**
 * Default base URLs of well-known OpenAI-compatible servers and hosted APIs.
 */
public final class KnownEndpoints {

    public static final String LMSTUDIO = "http://localhost:1234/v1";
    public static final String OLLAMA = "http://localhost:11434/v1";
    public static final String VLLM = "http://localhost:8000/v1";
    public static final String TGWUI = "http://localhost:5000/v1";
    public static final String TGI_8080 = "http://localhost:8080/v1";
    public static final String TGI_3000 = "http://localhost:3000/v1";
    public static final String OPENROUTER_LOCAL = "http://localhost:7000/v1";
    public static final String OPENROUTER = "https://openrouter.ai/api/v1";
    public static final String ANTHROPIC = "https://api.anthropic.com/v1";
    public static final String GROQ = "https://api.groq.com/openai/v1";
    public static final String MISTRAL = "https://api.mistral.ai/v1";
    public static final String DEEPSEEK = "https://api.deepseek.com/v1";
    public static final String COHERE = "https://api.cohere.com/v2";
    public static final String BASETEN = "https://inference.baseten.co/v1";
    public static final String ANYTHINGLLM = "http://localhost:3001/v1";
    public static final String JAN = "http://localhost:1337/v1";
    public static final String OPENAI = "https://api.openai.com/v1";

    /**
     * Candidates probed by auto-detection when no list is configured.
     */
    public static final List<String> COMMON_BASE_URLS = List.of(
            LMSTUDIO, OLLAMA, VLLM, TGWUI, TGI_8080, TGI_3000, OPENROUTER_LOCAL,
            OPENROUTER, ANTHROPIC, GROQ, MISTRAL, DEEPSEEK, COHERE, BASETEN, ANYTHINGLLM
    );

    /**
     * Provider id for each known base URL.
     */
    static final Map<String, String> PROVIDER_IDS = Map.ofEntries(
            Map.entry(LMSTUDIO, "lmstudio"),
            Map.entry(OLLAMA, "ollama"),
            Map.entry(VLLM, "vllm"),
            Map.entry(TGWUI, "tgwui"),
            Map.entry(TGI_8080, "tgi"),
            Map.entry(TGI_3000, "tgi"),
            Map.entry(OPENROUTER_LOCAL, "openrouter"),
            Map.entry(OPENROUTER, "openrouter-remote"),
            Map.entry(ANTHROPIC, "anthropic"),
            Map.entry(GROQ, "groq"),
            Map.entry(MISTRAL, "mistral"),
            Map.entry(DEEPSEEK, "deepseek"),
            Map.entry(COHERE, "cohere"),
            Map.entry(BASETEN, "baseten"),
            Map.entry(OPENAI, "openai"),
            Map.entry(ANYTHINGLLM, "anythingllm"),
            Map.entry(JAN, "jan")
    );

    private KnownEndpoints() {
        // Constants holder
    }
}
