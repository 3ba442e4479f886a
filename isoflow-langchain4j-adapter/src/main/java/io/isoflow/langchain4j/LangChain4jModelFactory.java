package io.isoflow.langchain4j;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Creates LangChain4j {@link ChatModel}s for step extraction.
///
/// The provider is picked from the model name prefix: Anthropic for {@code claude*}, OpenAI
/// for {@code gpt*} and {@code o1*}, Google for {@code gemini*} and {@code gemma*}, and
/// DeepSeek for {@code deepseek*} through the OpenAI-compatible API. Names written as
/// {@code ollama:<model>} run on a local Ollama server and need no key.
///
/// API keys and the Ollama base URL are looked up in the credentials map first
/// (lower-case key, then the environment-variable name), then in the process environment.
/// The Ollama base URL defaults to {@value #DEFAULT_OLLAMA_BASE_URL}.
///
/// @implNote Stateless and thread-safe. Every call builds a new model.
public class LangChain4jModelFactory {

    private static final Logger logger = Logger.getLogger(LangChain4jModelFactory.class.getName());

    static final String DEEPSEEK_BASE_URL = "https://api.deepseek.com";
    static final String OLLAMA_PREFIX = "ollama:";
    static final String DEFAULT_OLLAMA_BASE_URL = "http://localhost:11434";

    private final Map<String, String> credentials;
    private final Map<String, String> environment;

    /// Creates a factory that falls back to {@link System#getenv()} for missing keys.
    ///
    /// @param credentials explicit API keys, not null
    public LangChain4jModelFactory(Map<String, String> credentials) {
        this(credentials, System.getenv());
    }

    LangChain4jModelFactory(Map<String, String> credentials, Map<String, String> environment) {
        this.credentials = Map.copyOf(Objects.requireNonNull(credentials, "credentials required"));
        this.environment = Objects.requireNonNull(environment, "environment required");
    }

    public static boolean supportsModel(String modelName) {
        if (modelName == null) return false;
        return modelName.startsWith("claude")
                || modelName.startsWith("gpt")
                || modelName.startsWith("o1")
                || modelName.startsWith("gemini")
                || modelName.startsWith("gemma")
                || modelName.startsWith("deepseek")
                || (modelName.startsWith(OLLAMA_PREFIX)
                        && modelName.length() > OLLAMA_PREFIX.length());
    }

    /// Builds a chat model for the given settings.
    ///
    /// @param settings model name and parameters, not null
    /// @return configured model, never null
    /// @throws IllegalArgumentException if the model name has no known provider
    /// @throws IllegalStateException if the provider's API key is missing
    public ChatModel create(ModelSettings settings) {
        Objects.requireNonNull(settings, "settings required");
        String modelName = settings.modelName();
        logger.info("Creating extraction model: " + modelName);

        if (modelName.startsWith("claude")) {
            return createAnthropicModel(settings);
        } else if (modelName.startsWith("gpt") || modelName.startsWith("o1")) {
            return createOpenAiModel(settings, null);
        } else if (modelName.startsWith("gemini") || modelName.startsWith("gemma")) {
            return createGoogleAiModel(settings);
        } else if (modelName.startsWith("deepseek")) {
            return createOpenAiModel(settings, DEEPSEEK_BASE_URL);
        } else if (modelName.startsWith(OLLAMA_PREFIX)
                && modelName.length() > OLLAMA_PREFIX.length()) {
            return createOllamaModel(settings);
        }

        throw new IllegalArgumentException("Unsupported model: " + modelName);
    }

    private ChatModel createAnthropicModel(ModelSettings settings) {
        return AnthropicChatModel.builder()
                .apiKey(requireApiKey("anthropic_api_key", "ANTHROPIC_API_KEY"))
                .modelName(settings.modelName())
                .temperature(settings.temperature())
                .maxTokens(settings.maxTokens())
                .timeout(settings.timeout())
                .build();
    }

    private ChatModel createOpenAiModel(ModelSettings settings, String baseUrl) {
        String apiKey =
                baseUrl != null
                        ? requireApiKey("deepseek_api_key", "DEEPSEEK_API_KEY")
                        : requireApiKey("openai_api_key", "OPENAI_API_KEY");

        var builder =
                OpenAiChatModel.builder()
                        .apiKey(apiKey)
                        .modelName(settings.modelName())
                        .temperature(settings.temperature())
                        .maxTokens(settings.maxTokens())
                        .timeout(settings.timeout());

        if (baseUrl != null) builder.baseUrl(baseUrl);

        return builder.build();
    }

    private ChatModel createGoogleAiModel(ModelSettings settings) {
        return GoogleAiGeminiChatModel.builder()
                .apiKey(requireApiKey("google_api_key", "GOOGLE_API_KEY"))
                .modelName(settings.modelName())
                .temperature(settings.temperature())
                .maxOutputTokens(settings.maxTokens())
                .timeout(settings.timeout())
                .build();
    }

    private ChatModel createOllamaModel(ModelSettings settings) {
        String baseUrl = ollamaBaseUrl();
        logger.info("Using local Ollama server at " + baseUrl);
        return OllamaChatModel.builder()
                .baseUrl(baseUrl)
                .modelName(settings.modelName().substring(OLLAMA_PREFIX.length()))
                .temperature(settings.temperature())
                .numPredict(settings.maxTokens())
                .timeout(settings.timeout())
                .build();
    }

    /// Resolves the Ollama base URL from credentials, then the environment, then the default.
    String ollamaBaseUrl() {
        String value = credentials.get("ollama_base_url");
        if (value == null) value = credentials.get("OLLAMA_BASE_URL");
        if (value == null) value = environment.get("OLLAMA_BASE_URL");
        if (value == null || value.isBlank()) {
            return DEFAULT_OLLAMA_BASE_URL;
        }
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }

    /// Resolves an API key from credentials, then from the environment.
    ///
    /// @throws IllegalStateException if neither source has the key
    String requireApiKey(String credentialKey, String envKey) {
        String value = credentials.get(credentialKey);
        if (value == null) value = credentials.get(envKey);
        if (value == null) value = environment.get(envKey);
        if (value == null || value.isBlank()) {
            throw new IllegalStateException(
                    "API key not found. Provide " + credentialKey + " or set " + envKey);
        }
        return value;
    }
}
