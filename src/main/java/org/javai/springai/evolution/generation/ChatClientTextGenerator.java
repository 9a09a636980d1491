package org.javai.springai.evolution.generation;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;

/**
 * {@link TextGenerator} backed by a Spring AI {@link ChatClient}.
 *
 * <p>Each call sends the optional system message followed by the prompt as a user message
 * and returns the response content.</p>
 */
public class ChatClientTextGenerator implements TextGenerator {

	private static final Logger logger = LoggerFactory.getLogger(ChatClientTextGenerator.class);

	private final ChatClient chatClient;
	private final String systemMessage;

	public ChatClientTextGenerator(ChatClient chatClient) {
		this(chatClient, null);
	}

	/**
	 * @param chatClient the client to call
	 * @param systemMessage system message sent with every prompt; null or blank for none
	 */
	public ChatClientTextGenerator(ChatClient chatClient, String systemMessage) {
		this.chatClient = Objects.requireNonNull(chatClient, "chatClient must not be null");
		this.systemMessage = systemMessage;
	}

	@Override
	public String generate(String prompt) {
		Objects.requireNonNull(prompt, "prompt must not be null");
		String content;
		try {
			ChatClient.ChatClientRequestSpec request = chatClient.prompt();
			if (systemMessage != null && !systemMessage.isBlank()) {
				request.system(systemMessage);
			}
			request.user(prompt);
			content = request.call().content();
		}
		catch (RuntimeException e) {
			throw new GenerationException("Chat client call failed: " + e.getMessage(), e);
		}
		if (content == null) {
			throw new GenerationException("Chat client returned no content");
		}
		logger.debug("Prompt:\n{}", prompt);
		logger.debug("LLM response:\n{}", content);
		return content;
	}
}
