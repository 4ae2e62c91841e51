package io.relay.core.provider;

import io.relay.core.error.ErrorKind;
import io.relay.core.error.ProviderError;
import io.relay.core.error.RelayException;
import io.relay.core.event.CanonicalEvent;
import io.relay.core.event.EventStream;
import io.relay.core.model.ChatMessage;
import io.relay.core.model.MessageRole;
import io.relay.core.model.ToolCall;
import io.relay.core.model.ToolDeclaration;
import io.relay.core.policy.ErrorClassifier;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.document.Document;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeAsyncClient;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeAsyncClientBuilder;
import software.amazon.awssdk.services.bedrockruntime.model.ContentBlock;
import software.amazon.awssdk.services.bedrockruntime.model.ConversationRole;
import software.amazon.awssdk.services.bedrockruntime.model.ConverseStreamRequest;
import software.amazon.awssdk.services.bedrockruntime.model.ConverseStreamResponseHandler;
import software.amazon.awssdk.services.bedrockruntime.model.InferenceConfiguration;
import software.amazon.awssdk.services.bedrockruntime.model.Message;
import software.amazon.awssdk.services.bedrockruntime.model.ModelStreamErrorException;
import software.amazon.awssdk.services.bedrockruntime.model.SystemContentBlock;
import software.amazon.awssdk.services.bedrockruntime.model.ThrottlingException;
import software.amazon.awssdk.services.bedrockruntime.model.Tool;
import software.amazon.awssdk.services.bedrockruntime.model.ToolConfiguration;
import software.amazon.awssdk.services.bedrockruntime.model.ToolInputSchema;
import software.amazon.awssdk.services.bedrockruntime.model.ToolResultBlock;
import software.amazon.awssdk.services.bedrockruntime.model.ToolResultContentBlock;
import software.amazon.awssdk.services.bedrockruntime.model.ToolResultStatus;
import software.amazon.awssdk.services.bedrockruntime.model.ToolSpecification;
import software.amazon.awssdk.services.bedrockruntime.model.ToolUseBlock;

/**
 * Converse-stream family over the AWS SDK async client. The resolved credential, when present, is
 * {@code ACCESS_KEY_ID:SECRET_ACCESS_KEY[:SESSION_TOKEN]}; otherwise the profile's AWS profile or the default
 * provider chain is used.
 */
public final class BedrockConverseStreamAdapter implements StreamAdapter, AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(BedrockConverseStreamAdapter.class);

    private final Function<RoutingDecision, BedrockRuntimeAsyncClient> clientFactory;
    private final Map<String, CachedClient> clients = new ConcurrentHashMap<>();
    private final ErrorClassifier classifier;
    private final Duration readTimeout;

    public BedrockConverseStreamAdapter(Duration readTimeout) {
        this(BedrockConverseStreamAdapter::buildClient, new ErrorClassifier(), readTimeout);
    }

    BedrockConverseStreamAdapter(
        Function<RoutingDecision, BedrockRuntimeAsyncClient> clientFactory,
        ErrorClassifier classifier,
        Duration readTimeout
    ) {
        this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.readTimeout = Objects.requireNonNull(readTimeout, "readTimeout must not be null");
    }

    @Override
    public ApiShape api() {
        return ApiShape.BEDROCK_CONVERSE_STREAM;
    }

    @Override
    public EventStream send(LlmRequest request, RoutingDecision route) {
        BedrockRuntimeAsyncClient client;
        try {
            client = clientFor(route);
        } catch (IllegalArgumentException | SdkClientException e) {
            return EventStream.failed(ProviderError.of(ErrorKind.CONFIG_ERROR, e.getMessage()));
        }

        QueuedEventStream stream = new QueuedEventStream(readTimeout);
        ConverseStreamTranslator translator = new ConverseStreamTranslator();
        ConverseStreamResponseHandler handler = ConverseStreamResponseHandler.builder()
            .subscriber(output -> {
                try {
                    translator.accept(output, stream::offer);
                } catch (RelayException e) {
                    stream.offer(new CanonicalEvent.StreamError(e.error()));
                }
            })
            .onError(error -> stream.offer(new CanonicalEvent.StreamError(classify(error))))
            .onComplete(() -> translator.complete(stream::offer))
            .build();

        CompletableFuture<Void> future = client.converseStream(buildRequest(request), handler);
        future.whenComplete((ignored, error) -> {
            if (error != null) {
                stream.offer(new CanonicalEvent.StreamError(classify(error)));
            }
        });
        stream.onCancel(() -> future.cancel(true));
        return stream;
    }

    @Override
    public void close() {
        clients.values().forEach(cached -> cached.client().close());
        clients.clear();
    }

    BedrockRuntimeAsyncClient clientFor(RoutingDecision route) {
        String credential = route.credential();
        String region = route.profile().region();
        CachedClient cached = clients.compute(route.profile().name(), (name, existing) -> {
            if (existing != null && existing.matches(credential, region)) {
                return existing;
            }
            CachedClient created = new CachedClient(credential, region, clientFactory.apply(route));
            if (existing != null) {
                LOG.debug("Replacing Bedrock client for provider {}", name);
                existing.client().close();
            }
            return created;
        });
        return cached.client();
    }

    ProviderError classify(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof ThrottlingException) {
            return ProviderError.of(ErrorKind.RATE_LIMITED, cause.getMessage());
        }
        if (cause instanceof ModelStreamErrorException) {
            return ProviderError.of(ErrorKind.NETWORK_ERROR, cause.getMessage());
        }
        if (cause instanceof AwsServiceException service) {
            int status = service.statusCode();
            return ProviderError.http(classifier.kindForStatus(status), status, service.getMessage(), null);
        }
        return classifier.fromException(cause);
    }

    ConverseStreamRequest buildRequest(LlmRequest request) {
        ConverseStreamRequest.Builder builder = ConverseStreamRequest.builder()
            .modelId(normalizeModelId(request.model()))
            .messages(toBedrockMessages(request.messages()));

        List<SystemContentBlock> systemBlocks = toSystemBlocks(request.messages());
        if (!systemBlocks.isEmpty()) {
            builder.system(systemBlocks);
        }
        if (!request.tools().isEmpty()) {
            builder.toolConfig(toToolConfiguration(request.tools()));
        }
        if (request.maxTokens() != null) {
            builder.inferenceConfig(InferenceConfiguration.builder().maxTokens(request.maxTokens()).build());
        }
        return builder.build();
    }

    private static BedrockRuntimeAsyncClient buildClient(RoutingDecision route) {
        ProviderProfile profile = route.profile();
        String region = firstNonBlank(profile.region(), System.getenv("AWS_REGION"), System.getenv("AWS_DEFAULT_REGION"));
        if (region == null) {
            throw new IllegalArgumentException("missing AWS region for Bedrock provider " + profile.name());
        }
        BedrockRuntimeAsyncClientBuilder builder = BedrockRuntimeAsyncClient.builder()
            .region(Region.of(region))
            .credentialsProvider(resolveCredentialsProvider(route.credential(), profile.awsProfile()));
        if (!profile.baseUrl().isBlank()) {
            builder.endpointOverride(URI.create(profile.baseUrl()));
        }
        LOG.debug("Created Bedrock client for provider {} in {}", profile.name(), region);
        return builder.build();
    }

    private static AwsCredentialsProvider resolveCredentialsProvider(String credential, String awsProfile) {
        if (credential != null && !credential.isBlank()) {
            String[] parts = credential.split(":", 3);
            if (parts.length < 2 || parts[0].isBlank() || parts[1].isBlank()) {
                throw new IllegalArgumentException("Bedrock credential must be ACCESS_KEY_ID:SECRET_ACCESS_KEY[:SESSION_TOKEN]");
            }
            if (parts.length == 3 && !parts[2].isBlank()) {
                return StaticCredentialsProvider.create(AwsSessionCredentials.create(parts[0], parts[1], parts[2]));
            }
            return StaticCredentialsProvider.create(AwsBasicCredentials.create(parts[0], parts[1]));
        }
        if (awsProfile != null && !awsProfile.isBlank()) {
            return ProfileCredentialsProvider.create(awsProfile);
        }
        return DefaultCredentialsProvider.create();
    }

    private record CachedClient(String credential, String region, BedrockRuntimeAsyncClient client) {
        boolean matches(String otherCredential, String otherRegion) {
            return Objects.equals(credential, otherCredential) && Objects.equals(region, otherRegion);
        }
    }

    private String normalizeModelId(String model) {
        String normalized = model.trim();
        if (normalized.toLowerCase(Locale.ROOT).startsWith("bedrock/")) {
            return normalized.substring("bedrock/".length());
        }
        return normalized;
    }

    private List<SystemContentBlock> toSystemBlocks(List<ChatMessage> messages) {
        List<SystemContentBlock> blocks = new ArrayList<>();
        for (ChatMessage message : messages) {
            if (message.role() == MessageRole.SYSTEM && !message.content().isBlank()) {
                blocks.add(SystemContentBlock.builder().text(message.content()).build());
            }
        }
        return blocks;
    }

    private List<Message> toBedrockMessages(List<ChatMessage> messages) {
        List<Message> wire = new ArrayList<>();
        List<ContentBlock> pendingResults = null;
        for (ChatMessage message : messages) {
            if (message.role() == MessageRole.SYSTEM) {
                continue;
            }
            if (message.role() == MessageRole.TOOL) {
                ContentBlock result = ContentBlock.builder().toolResult(
                    ToolResultBlock.builder()
                        .toolUseId(message.toolCallId() == null ? "" : message.toolCallId())
                        .status(message.toolError() ? ToolResultStatus.ERROR : ToolResultStatus.SUCCESS)
                        .content(List.of(ToolResultContentBlock.builder().text(message.content()).build()))
                        .build()
                ).build();
                if (pendingResults == null) {
                    pendingResults = new ArrayList<>();
                }
                pendingResults.add(result);
                continue;
            }
            if (pendingResults != null) {
                wire.add(Message.builder().role(ConversationRole.USER).content(pendingResults).build());
                pendingResults = null;
            }

            List<ContentBlock> content = new ArrayList<>();
            if (!message.content().isBlank()) {
                content.add(ContentBlock.builder().text(message.content()).build());
            }
            if (message.role() == MessageRole.ASSISTANT) {
                for (ToolCall toolCall : message.toolCalls()) {
                    content.add(ContentBlock.builder().toolUse(
                        ToolUseBlock.builder()
                            .toolUseId(toolCall.id())
                            .name(toolCall.name())
                            .input(toDocument(toolCall.arguments()))
                            .build()
                    ).build());
                }
            }
            if (content.isEmpty()) {
                continue;
            }
            wire.add(Message.builder()
                .role(message.role() == MessageRole.ASSISTANT ? ConversationRole.ASSISTANT : ConversationRole.USER)
                .content(content)
                .build());
        }
        if (pendingResults != null) {
            wire.add(Message.builder().role(ConversationRole.USER).content(pendingResults).build());
        }
        return wire;
    }

    private ToolConfiguration toToolConfiguration(List<ToolDeclaration> tools) {
        List<Tool> mapped = new ArrayList<>();
        for (ToolDeclaration tool : tools) {
            ToolSpecification specification = ToolSpecification.builder()
                .name(tool.name())
                .description(tool.description())
                .inputSchema(ToolInputSchema.builder().json(toDocument(tool.parameters())).build())
                .build();
            mapped.add(Tool.builder().toolSpec(specification).build());
        }
        return ToolConfiguration.builder().tools(mapped).build();
    }

    private Document toDocument(Object value) {
        if (value == null) {
            return Document.fromNull();
        }
        if (value instanceof String s) {
            return Document.fromString(s);
        }
        if (value instanceof Boolean b) {
            return Document.fromBoolean(b);
        }
        if (value instanceof Number n) {
            return Document.fromNumber(n.toString());
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Document> converted = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                converted.put(String.valueOf(entry.getKey()), toDocument(entry.getValue()));
            }
            return Document.fromMap(converted);
        }
        if (value instanceof List<?> list) {
            List<Document> converted = new ArrayList<>();
            for (Object item : list) {
                converted.add(toDocument(item));
            }
            return Document.fromList(converted);
        }
        return Document.fromString(String.valueOf(value));
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
