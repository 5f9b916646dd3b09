package com.purchasingpower.codegraph.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.codegraph.configuration.CodeGraphProperties;
import com.purchasingpower.codegraph.configuration.OllamaProperties;
import com.purchasingpower.codegraph.exception.EmbeddingException;
import com.purchasingpower.codegraph.exception.SummaryException;
import com.purchasingpower.codegraph.model.CallContext;
import com.purchasingpower.codegraph.model.ServiceType;
import com.purchasingpower.codegraph.model.graph.NodeKind;
import com.purchasingpower.codegraph.util.ExternalCallLogger;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Ollama-backed summaries ({@code /api/chat}) and embeddings ({@code /api/embeddings}).
 * Runs against a local model server, so there is no API key.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OllamaClient implements EmbeddingProvider, SummaryProvider {

    private static final String SYSTEM_PROMPT = """
            You are an expert software engineer and technical writer. \
            Write a descriptive, clear and non-redundant summary of the code you are given. \
            Focus on its main purpose, its functionality and any detail that helps someone \
            understand it without reading it. Reply with the summary only.""";

    private final ObjectMapper objectMapper;
    private final CodeGraphProperties properties;
    private WebClient ollamaWebClient;

    @PostConstruct
    public void init() {
        OllamaProperties ollama = properties.getOllama();

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, ollama.getConnectTimeoutMs())
                .responseTimeout(Duration.ofMinutes(ollama.getReadTimeoutMinutes()))
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(ollama.getReadTimeoutMinutes(), TimeUnit.MINUTES))
                        .addHandlerLast(new WriteTimeoutHandler(ollama.getReadTimeoutMinutes(), TimeUnit.MINUTES)));

        this.ollamaWebClient = WebClient.builder()
                .baseUrl(ollama.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }

    @Override
    public String getProviderName() {
        return "Ollama (" + properties.getOllama().getEmbeddingModel() + ")";
    }

    @Override
    public List<Double> embed(String text) {
        if (text == null || text.isBlank()) {
            throw new EmbeddingException("Cannot embed empty text");
        }

        String model = properties.getOllama().getEmbeddingModel();
        CallContext call = ExternalCallLogger.startCall(ServiceType.OLLAMA, "Embed", log);
        call.logRequest("Embedding text", "Model", model, "TextLength", text.length());

        try {
            JsonNode response = ollamaWebClient.post()
                    .uri("/api/embeddings")
                    .bodyValue(Map.of("model", model, "prompt", text))
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block();

            if (response == null || !response.path("embedding").isArray() || response.path("embedding").isEmpty()) {
                throw new EmbeddingException("Ollama returned no embedding for model " + model);
            }

            List<Double> embedding = objectMapper.convertValue(
                    response.path("embedding"),
                    objectMapper.getTypeFactory().constructCollectionType(List.class, Double.class));

            call.logResponse("Embedding received", "Dimensions", embedding.size());
            return embedding;

        } catch (EmbeddingException e) {
            call.logError("Empty embedding", e);
            throw e;
        } catch (Exception e) {
            call.logError("Embedding failed", e);
            throw new EmbeddingException("Embedding generation failed. Ensure " + model + " is pulled and Ollama is running.", e);
        }
    }

    @Override
    public String summarize(NodeKind kind, String name, String code) {
        OllamaProperties ollama = properties.getOllama();
        String source = code == null ? "" : code;
        if (source.length() > ollama.getMaxCodeChars()) {
            source = source.substring(0, ollama.getMaxCodeChars());
        }

        CallContext call = ExternalCallLogger.startCall(ServiceType.OLLAMA, "Summarize", log);
        call.logRequest("Summarizing " + kind.getTypeName() + " " + name,
                "Model", ollama.getChatModel(), "CodeLength", source.length());

        Map<String, Object> body = Map.of(
                "model", ollama.getChatModel(),
                "messages", List.of(
                        Map.of("role", "system", "content", SYSTEM_PROMPT),
                        Map.of("role", "user", "content",
                                "Summarize this " + kind.getTypeName() + " named `" + name + "`:\n```\n" + source + "\n```")
                ),
                "stream", false,
                "options", Map.of(
                        "num_ctx", ollama.getNumCtx(),
                        "temperature", 0.3
                )
        );

        try {
            JsonNode response = ollamaWebClient.post()
                    .uri("/api/chat")
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block();

            String content = response == null ? "" : response.path("message").path("content").asText("").trim();
            if (content.isEmpty()) {
                throw new IllegalStateException("empty summary returned");
            }

            call.logResponse("Summary received", "Preview", ExternalCallLogger.truncate(content, 120));
            return content;

        } catch (Exception e) {
            call.logError("Summary failed", e);
            throw new SummaryException("Summary generation failed for " + name + " with " + ollama.getChatModel(), e);
        }
    }
}
