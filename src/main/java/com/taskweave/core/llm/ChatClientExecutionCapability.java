package com.taskweave.core.llm;

import com.taskweave.core.model.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.stereotype.Service;

/**
 * {@link ExecutionCapability} backed by Spring AI's {@link ChatClient}.
 * <p>
 * The execution profile picks the model and temperature from
 * {@link ExecutionProperties}. Each call sends one user message and returns the
 * model's text content.
 */
@Service
public class ChatClientExecutionCapability implements ExecutionCapability {

    private static final Logger log = LoggerFactory.getLogger(ChatClientExecutionCapability.class);

    private final ChatClient chatClient;
    private final ExecutionProperties properties;

    public ChatClientExecutionCapability(ChatClient.Builder builder, ExecutionProperties properties) {
        this.chatClient = builder.build();
        this.properties = properties;
        log.info("Chat execution capability initialized with profiles {}", properties.getProfiles().keySet());
    }

    @Override
    public String execute(String instruction, String profile, CancellationToken token) {
        if (token != null && token.isCancellationRequested()) {
            throw new ExecutionFailedException("Cancelled before the call was sent");
        }
        var selected = properties.profile(profile)
                .orElseThrow(() -> new ExecutionFailedException("Unknown execution profile: " + profile));

        log.debug("Model call started [profile={}, model={}]", profile, selected.getModel());
        long start = System.currentTimeMillis();
        String response;
        try {
            var request = chatClient.prompt().user(instruction);
            if (selected.hasModel() || selected.getTemperature() != null) {
                var options = ChatOptions.builder();
                if (selected.hasModel()) {
                    options.model(selected.getModel());
                }
                if (selected.getTemperature() != null) {
                    options.temperature(selected.getTemperature());
                }
                request = request.options(options.build());
            }
            response = request.call().content();
        } catch (RuntimeException e) {
            throw new ExecutionFailedException("Model call failed for profile " + profile + ": " + e.getMessage(), e);
        }
        long elapsed = System.currentTimeMillis() - start;
        log.debug("Model call complete [profile={}] ({}s)", profile, String.format("%.1f", elapsed / 1000.0));

        if (response == null || response.isBlank()) {
            throw new ExecutionFailedException("Model returned empty content for profile " + profile);
        }
        return response;
    }
}
