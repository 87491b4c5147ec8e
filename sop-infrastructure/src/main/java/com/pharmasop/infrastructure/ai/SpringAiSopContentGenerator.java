package com.pharmasop.infrastructure.ai;

import com.pharmasop.domain.sop.adapter.gateway.ContentGenerationException;
import com.pharmasop.domain.sop.adapter.gateway.ISopContentGenerator;
import com.pharmasop.domain.sop.model.valobj.ContentSnapshot;
import com.pharmasop.domain.sop.model.valobj.GenerationRequest;
import com.pharmasop.domain.sop.service.SopContentAssemblyDomainService;
import com.pharmasop.types.enums.SopJobErrorKindEnum;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;

import java.net.SocketTimeoutException;
import java.util.Map;

/**
 * 基于 Spring AI ChatClient 的内容生成适配器。
 * <p>
 * 每次调用无状态；不写作业存储和审计。重试由编排器负责，
 * 这里只把底层异常翻译为 {@link ContentGenerationException} 的三种类型。
 * </p>
 *
 * @author pharmasop
 * @since 2026-10-01
 */
@Slf4j
@Component
public class SpringAiSopContentGenerator implements ISopContentGenerator {

    private final ObjectProvider<ChatModel> chatModelProvider;
    private final SopPromptBuilder promptBuilder;
    private final SopContentParser contentParser;
    private final SopContentAssemblyDomainService contentAssemblyDomainService;
    private final String engineId;
    private final String modelName;
    private final double temperature;

    public SpringAiSopContentGenerator(ObjectProvider<ChatModel> chatModelProvider,
                                       SopPromptBuilder promptBuilder,
                                       SopContentParser contentParser,
                                       SopContentAssemblyDomainService contentAssemblyDomainService,
                                       @Value("${sop.generation.engine-id:openai-compatible}") String engineId,
                                       @Value("${sop.generation.model:}") String modelName,
                                       @Value("${sop.generation.temperature:0.1}") double temperature) {
        this.chatModelProvider = chatModelProvider;
        this.promptBuilder = promptBuilder;
        this.contentParser = contentParser;
        this.contentAssemblyDomainService = contentAssemblyDomainService;
        this.engineId = StringUtils.defaultIfBlank(engineId, "openai-compatible");
        this.modelName = modelName;
        this.temperature = temperature;
    }

    @Override
    public ContentSnapshot generate(GenerationRequest request) throws ContentGenerationException {
        if (request == null || request.getSections() == null || request.getSections().isEmpty()) {
            throw ContentGenerationException.rejected("Generation request has no sections", null);
        }
        if (request.remainingMillis() <= 0) {
            throw ContentGenerationException.timeout("Deadline elapsed before the engine was called");
        }
        ChatModel chatModel = chatModelProvider.getIfAvailable();
        if (chatModel == null) {
            throw ContentGenerationException.unavailable("No chat model is configured", null);
        }

        String content;
        long startedAt = System.currentTimeMillis();
        try {
            content = ChatClient.builder(chatModel)
                    .build()
                    .prompt()
                    .system(promptBuilder.systemPrompt())
                    .user(promptBuilder.buildUserPrompt(request))
                    .options(buildOptions())
                    .call()
                    .content();
        } catch (NonTransientAiException ex) {
            throw ContentGenerationException.rejected("Engine rejected the request: " + ex.getMessage(), ex);
        } catch (TransientAiException ex) {
            throw ContentGenerationException.unavailable("Engine temporarily unavailable: " + ex.getMessage(), ex);
        } catch (ResourceAccessException ex) {
            if (ex.getCause() instanceof SocketTimeoutException) {
                throw new ContentGenerationException(SopJobErrorKindEnum.ENGINE_TIMEOUT,
                        "Engine call timed out: " + ex.getMessage(), ex);
            }
            throw ContentGenerationException.unavailable("Engine unreachable: " + ex.getMessage(), ex);
        } catch (RuntimeException ex) {
            throw ContentGenerationException.unavailable("Engine call failed: " + ex.getMessage(), ex);
        }

        if (StringUtils.isBlank(content)) {
            throw ContentGenerationException.unavailable("Engine returned empty content", null);
        }
        Map<String, String> bodies = contentParser.parse(content, request.getSections());
        ContentSnapshot snapshot = contentAssemblyDomainService.assemble(request.getSections(), bodies, engineId);
        log.info("SOP content generated. jobId={}, attempt={}, requestedSections={}, parsedSections={}, costMs={}",
                request.getJobId(), request.getAttempt(), request.getSections().size(), bodies.size(),
                System.currentTimeMillis() - startedAt);
        return snapshot;
    }

    @Override
    public String engineId() {
        return engineId;
    }

    private OpenAiChatOptions buildOptions() {
        OpenAiChatOptions options = new OpenAiChatOptions();
        options.setTemperature(temperature);
        if (StringUtils.isNotBlank(modelName)) {
            options.setModel(modelName);
        }
        return options;
    }
}
